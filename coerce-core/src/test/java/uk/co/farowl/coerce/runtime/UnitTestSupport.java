// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.lang.invoke.MethodHandles;

import org.junit.jupiter.api.function.Executable;

/**
 * A base class for unit tests that defines some common convenience
 * functions for which the need recurs. A unit test that extends this
 * base will initialise the type system before running.
 */
public class UnitTestSupport {

    /** Ensure the type system is ready before tests run. */
    static final long BOOT = TypeSystem.bootstrapNanoTime;

    /**
     * The Java representation of instances of types made by
     * {@link #simpleType(String, Class...)}. Since it implements
     * {@link TypedObject}, any number of types may share it.
     */
    public static class Instance implements TypedObject {
        private final NamedType type;

        public Instance(NamedType type) { this.type = type; }

        @Override
        public NamedType getType() { return type; }

        @Override
        public String toString() { return "<" + type.getName() + " object>"; }
    }

    /**
     * Define a type with {@link Instance} as its primary class, and
     * methods from the given classes (if any).
     *
     * @param name of the new type
     * @param methodImpls classes defining the methods
     * @return the new type
     */
    public static NamedType simpleType(String name, Class<?>... methodImpls) {
        return NamedType.fromSpec(
                new TypeSpec(name, MethodHandles.lookup(), false)
                        .primary(Instance.class).methodImpls(methodImpls));
    }

    /**
     * Assert that the action throws a {@link CoercionError} of the
     * expected kind, and return it for further examination.
     *
     * @param kind expected
     * @param action to perform
     * @return the exception
     */
    public static CoercionError assertCoercionError(CoercionError.Kind kind,
            Executable action) {
        CoercionError e = assertThrows(CoercionError.class, action);
        assertEquals(kind, e.getKind(), () -> e.getMessage());
        return e;
    }
}
