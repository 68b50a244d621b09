package com.tenantoptions.core;

/** Options type without any tenant mutator. */
public class LoggingOptions {

    private String level = "INFO";
    private boolean json;

    public String getLevel() {
        return level;
    }

    public void setLevel(String level) {
        this.level = level;
    }

    public boolean isJson() {
        return json;
    }

    public void setJson(boolean json) {
        this.json = json;
    }
}
