package com.chemked.data;

public final class Version {
    static final int MAJOR = 0;
    static final int MINOR = 4;
    static final int PATCH = 1;

    public static final String FULL = MAJOR + "." + MINOR + "." + PATCH;
    /** Schema version written to {@code chemked-version} by converters. */
    public static final String CHEMKED_SCHEMA = FULL;
    public static final String USER_AGENT = "chemked-java/" + FULL;

    private Version() {}
}
