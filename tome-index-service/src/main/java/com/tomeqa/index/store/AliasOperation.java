package com.tomeqa.index.store;

/**
 * One step of an alias batch.
 */
public record AliasOperation(Type type, String alias, String collection) {

    public enum Type { CREATE, DELETE }

    public static AliasOperation create(String alias, String collection) {
        return new AliasOperation(Type.CREATE, alias, collection);
    }

    public static AliasOperation delete(String alias) {
        return new AliasOperation(Type.DELETE, alias, null);
    }
}
