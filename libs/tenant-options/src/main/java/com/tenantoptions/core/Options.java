package com.tenantoptions.core;

/**
 * Naming conventions shared by every part of the options subsystem.
 */
public final class Options {

    /** Name of the unnamed (default) instance of an options type. */
    public static final String DEFAULT_NAME = "";

    private Options() {
        // utility class
    }

    /**
     * Maps a missing name to {@link #DEFAULT_NAME}.
     */
    public static String nameOrDefault(String name) {
        return name == null ? DEFAULT_NAME : name;
    }
}
