package com.sporty.qcache.core;

import java.util.regex.Pattern;

/**
 * Builds the keys entries are stored under.
 * <pre>
 * collection: {namespace} or {namespace}_{suffix}
 * detail:     {namespace}_{identifier}
 * </pre>
 * Namespaces must be unique across the managers sharing one store, and suffixes must not collide with identifiers.
 */
public final class CacheKeys {
    private static final String SEPARATOR = "_";
    private static final Pattern GLOB_SPECIAL = Pattern.compile("[*?\\[\\]\\\\]");

    private CacheKeys() {
    }

    public static String collectionKey(final String namespace, final String suffix) {
        if (suffix == null) {
            return namespace;
        }
        return namespace + SEPARATOR + suffix;
    }

    public static String detailKey(final String namespace, final Object identifier) {
        return namespace + SEPARATOR + identifier;
    }

    /**
     * Glob matching every {@code {namespace}_} key. Glob characters in the namespace are escaped so they match literally.
     */
    static String detailKeyPattern(final String namespace) {
        return GLOB_SPECIAL.matcher(namespace + SEPARATOR).replaceAll("\\\\$0") + "*";
    }
}
