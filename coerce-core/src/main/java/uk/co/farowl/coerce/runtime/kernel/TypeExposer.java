// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime.kernel;

import java.lang.invoke.MethodHandles.Lookup;

import uk.co.farowl.coerce.runtime.ExposedMethod;

/**
 * Interface expected of the type exposer, and used by the
 * {@link TypeFactory}.
 */
/*
 * We define this (in the kernel) to make it possible for the runtime
 * package to contain the implementation of the type exposer, while the
 * TypeFactory can request and use instances. When we create a type
 * factory, we provide it with a factory object for TypeExposer
 * instances.
 */
public interface TypeExposer {

    /**
     * Gather method definitions from the specified class. Definitions
     * accumulate in the exposer.
     *
     * @param methodClass to scan for definitions
     */
    void exposeMethods(Class<?> methodClass);

    /**
     * Get the methods gathered in this {@code TypeExposer}. The client
     * for this action is the type factory, and the values are entered in
     * the method table of the type. They are constructed as the iterator
     * runs.
     *
     * @param lookup authorisation to access the implementations
     * @return sequence of methods found for the type
     */
    Iterable<ExposedMethod> methods(Lookup lookup);
}
