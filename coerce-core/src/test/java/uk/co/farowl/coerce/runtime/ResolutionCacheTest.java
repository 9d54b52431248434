// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.invoke.MethodHandles;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Test a {@link ResolutionCache} separate from the one the engine uses.
 */
@DisplayName("A resolution cache")
class ResolutionCacheTest extends UnitTestSupport {

    static NamedType source;
    static NamedType subSource;

    ResolutionCache cache;

    @BeforeAll
    static void defineTypes() {
        source = simpleType("Cache::Source");
        subSource = NamedType.fromSpec(new TypeSpec("Cache::SubSource",
                MethodHandles.lookup(), false)
                        .primary(Instance.class).base(source));
    }

    @BeforeEach
    void newCache() { cache = new ResolutionCache(); }

    @Test
    @DisplayName("is empty when new")
    void empty() {
        assertEquals(0, cache.size());
        assertNull(cache.lookup(source, "Cache::Target"));
        assertEquals(1, cache.lookups());
        assertEquals(0, cache.hits());
    }

    @Test
    @DisplayName("returns what was stored")
    void storeAndLookup() {
        Directive d = new Directive.Push("__as_Cache_Target");
        cache.store(source, "Cache::Target", d);
        assertSame(d, cache.lookup(source, "Cache::Target"));
        assertEquals(1, cache.hits());
        assertTrue(cache.contains("Cache::Source", "Cache::Target"));
        assertFalse(cache.contains("Cache::Source", "Cache::Other"));
        assertFalse(cache.contains("Cache::Nowhere", "Cache::Target"));
    }

    @Test
    @DisplayName("keys on the exact source type")
    void exactType() {
        cache.store(source, "Cache::Target", Directive.NONE);
        assertNull(cache.lookup(subSource, "Cache::Target"));
        cache.store(subSource, "Cache::Target",
                new Directive.Pull("__from_Cache_SubSource"));
        assertSame(Directive.NONE, cache.lookup(source, "Cache::Target"));
        assertEquals(2, cache.size());
    }

    @Test
    @DisplayName("accepts an equal directive again")
    void idempotent() {
        cache.store(source, "Cache::Target", new Directive.Push("__as_X"));
        cache.store(source, "Cache::Target", new Directive.Push("__as_X"));
        cache.store(source, "Cache::None", Directive.NONE);
        cache.store(source, "Cache::None", Directive.NONE);
        assertEquals(2, cache.size());
    }

    @Test
    @DisplayName("keeps the first directive stored")
    void firstWins() {
        Directive push = new Directive.Push("__as_X");
        assertSame(push, cache.store(source, "Cache::Target", push));
        assertSame(push, cache.store(source, "Cache::Target", Directive.NONE));
        assertSame(push, cache.lookup(source, "Cache::Target"));
        assertEquals(1, cache.size());
    }
}
