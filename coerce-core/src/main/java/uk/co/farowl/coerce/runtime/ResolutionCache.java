// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * A mapping from the pair (type of a value, name of a target type) to
 * the {@link Directive} that converts such values to the target. It
 * includes the pairs for which there is no conversion, mapped to
 * {@link Directive#NONE}.
 * <p>
 * Entries are never replaced or removed. The methods a type exposes,
 * and therefore the conversions between types, are assumed not to
 * change once the types are loaded. Threads that race to resolve the
 * same pair all go on to use the directive stored first.
 */
final class ResolutionCache {

    /**
     * Key to the cache. The source is the exact type of the value, not
     * one of its bases.
     */
    private static record Key(NamedType source, String target) {}

    private final Map<Key, Directive> map = new ConcurrentHashMap<>();

    /** Calls to {@link #lookup(NamedType, String)}. */
    private final LongAdder lookups = new LongAdder();

    /** Calls to {@link #lookup(NamedType, String)} that found an entry. */
    private final LongAdder hits = new LongAdder();

    /**
     * Find the directive for converting values of the given type to the
     * named type, if it has been stored.
     *
     * @param source exact type of the value
     * @param target canonical name of the target type
     * @return the directive or {@code null} if not resolved yet
     */
    Directive lookup(NamedType source, String target) {
        lookups.increment();
        Directive d = map.get(new Key(source, target));
        if (d != null) { hits.increment(); }
        return d;
    }

    /**
     * Store the directive for converting values of the given type to the
     * named type, unless one is already stored. A thread that loses a
     * race to store receives the directive of the winner, which may
     * differ from its own if a conversion was declared meanwhile.
     *
     * @param source exact type of the value
     * @param target canonical name of the target type
     * @param directive to store
     * @return the directive now stored for the pair
     */
    Directive store(NamedType source, String target, Directive directive) {
        Directive previous =
                map.putIfAbsent(new Key(source, target), directive);
        return previous != null ? previous : directive;
    }

    /**
     * Test whether any entry has been stored for the pair of type
     * names. (The source type need not be loaded.)
     *
     * @param source canonical name of the source type
     * @param target canonical name of the target type
     * @return {@code true} iff an entry exists
     */
    boolean contains(String source, String target) {
        NamedType s = TypeSystem.registry.find(source);
        return s != null && map.containsKey(new Key(s, target));
    }

    /** @return the number of entries. */
    int size() { return map.size(); }

    /** @return the number of lookups. */
    long lookups() { return lookups.sum(); }

    /** @return the number of lookups that found an entry. */
    long hits() { return hits.sum(); }

    @Override
    public String toString() {
        return String.format("ResolutionCache(entries=%d, lookups=%d, hits=%d)",
                size(), lookups(), hits());
    }
}
