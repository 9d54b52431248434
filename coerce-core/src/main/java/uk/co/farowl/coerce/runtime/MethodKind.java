// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

/** Enum describing whether a method is an instance or type method. */
public enum MethodKind {
    /**
     * The method is invoked on an instance, which it receives as
     * {@code self} ahead of the arguments.
     */
    INSTANCE,
    /**
     * The method is invoked on the type. If called through an instance,
     * the instance is not passed.
     */
    TYPE
}
