// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

/**
 * A source of type definitions, consulted when a type is needed that is
 * not yet loaded. The type system consults its loaders in the order they
 * were registered, the built-in loader (if enabled) first, until the
 * type has been defined.
 * <p>
 * A loader is expected to define the type by the normal means, that is,
 * directly or indirectly through {@link NamedType#fromSpec(TypeSpec)}.
 */
@FunctionalInterface
public interface TypeLoader {

    /**
     * Attempt to define the named type. Return {@code false} if this
     * loader has nothing to offer for the name. A loader that finds
     * something to load, but fails in the attempt, should throw.
     *
     * @param name canonical name of the type
     * @return {@code true} if this loader attempted to define the type
     * @throws RuntimeException if the attempt failed
     */
    boolean load(String name) throws RuntimeException;

    /**
     * Add a loader to those the type system consults.
     *
     * @param loader to add
     */
    static void register(TypeLoader loader) { TypeSystem.addLoader(loader); }
}
