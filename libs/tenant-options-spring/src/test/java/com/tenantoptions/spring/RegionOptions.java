package com.tenantoptions.spring;

import java.util.ArrayList;
import java.util.List;

/** Options type resolved in the auto-configuration tests. */
public class RegionOptions {

    private final List<String> trail = new ArrayList<>();
    private String region = "global";

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    /** Names of the mutators that ran, in order. */
    public List<String> getTrail() {
        return trail;
    }
}
