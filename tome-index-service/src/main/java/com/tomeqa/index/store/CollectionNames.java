package com.tomeqa.index.store;

/**
 * Naming of live aliases and staged collections.
 */
public final class CollectionNames {

    private CollectionNames() {}

    public static String liveAlias(String base) {
        return base + "_live";
    }

    public static String stagedCollection(String base, String runId) {
        return base + "_temp_" + runId;
    }
}
