// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

/**
 * How to convert an instance of one type to another, once this has been
 * worked out by {@link Coercion}. A directive names the method to call,
 * and where to find it, but holds no reference to the method itself:
 * it is looked up again on each application.
 */
public sealed interface Directive {

    /** The directive that there is no conversion. */
    static final Directive NONE = new None();

    /**
     * Apply the conversion to a value.
     *
     * @param value to convert (a typed instance of the source type)
     * @param target type of the conversion
     * @return the result of the conversion method (unchecked)
     * @throws Throwable from the conversion method
     */
    Object apply(Object value, NamedType target) throws Throwable;

    /**
     * Convert by calling an instance method of the source value without
     * arguments.
     *
     * @param method name of the instance method
     */
    static record Push(String method) implements Directive {
        @Override
        public Object apply(Object value, NamedType target) throws Throwable {
            return NamedType.of(value).lookup(method).call(value);
        }
    }

    /**
     * Convert by calling a type method of the target type with the
     * source value as the only argument.
     *
     * @param method name of the type method
     */
    static record Pull(String method) implements Directive {
        @Override
        public Object apply(Object value, NamedType target) throws Throwable {
            return target.lookup(method).call(target, value);
        }
    }

    /**
     * Convert by calling a type method of a third type (acting as a
     * module of functions) with the source value as the only argument.
     * See {@link Coercion#declareExternal(String, String, String, String)}.
     *
     * @param module type defining the method
     * @param function name of the type method
     */
    static record External(NamedType module, String function)
            implements Directive {
        @Override
        public Object apply(Object value, NamedType target) throws Throwable {
            return module.lookup(function).call(module, value);
        }

        @Override
        public String toString() {
            return "External[" + module.getName() + "::" + function + "]";
        }
    }

    /** There is no conversion. */
    static final class None implements Directive {
        private None() {}

        @Override
        public Object apply(Object value, NamedType target) { return null; }

        @Override
        public String toString() { return "None"; }
    }
}
