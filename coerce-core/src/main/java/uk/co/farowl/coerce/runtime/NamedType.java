// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import java.util.List;

/**
 * Each nominal type in the type system is implemented by an
 * <i>instance</i> in Java of {@code NamedType}. Only the interface is
 * public API: the type objects themselves are created by the type
 * factory in response to {@link NamedType#fromSpec(TypeSpec)}.
 * <p>
 * {@code NamedType} also offers the static type object lookup and
 * creation methods, which go through the single instance of the type
 * system that comes into being on first use.
 */
public interface NamedType {

    /**
     * Return the (canonical) name of the type.
     *
     * @return the name of the type
     */
    String getName();

    /**
     * The bases specified for the type, in order.
     *
     * @return the sequence of bases
     */
    List<NamedType> getBases();

    /**
     * The method resolution order of this type: this type, then its
     * ancestors, in the order they are searched by
     * {@link #lookup(String)}.
     *
     * @return the MRO of this type
     */
    List<NamedType> getMRO();

    /**
     * Determine if this type is a sub-type of {@code b} (if {@code b} is
     * on the MRO of this type). A type is a sub-type of itself.
     *
     * @param b to test
     * @return {@code true} if {@code this} is a sub-type of {@code b}
     */
    boolean isSubTypeOf(NamedType b);

    /**
     * {@code true} iff {@code o} is a typed instance and its type is a
     * sub-type of {@code this} (including exactly {@code this} type).
     *
     * @param o object to test
     * @return {@code true} iff {@code o} is of a sub-type of this type
     */
    boolean check(Object o);

    /**
     * Look for a method by name along the MRO, returning the first
     * definition found. This method does not throw an exception if the
     * name is not found, but returns {@code null} like a
     * {@code Map.get}.
     *
     * @param name to look up
     * @return the method or {@code null} if not found
     */
    ExposedMethod lookup(String name);

    /**
     * Test whether the type defines a method of the given name itself,
     * without regard to its bases.
     *
     * @param name to look up
     * @return {@code true} iff defined in this type
     */
    boolean definesOwn(String name);

    /**
     * The primary Java representation class of the type.
     *
     * @return primary class of the type
     */
    Class<?> javaClass();

    // static methods -----------------------------------------------

    /**
     * Create a type according to the specification. This is the normal
     * way to create a type that is defined in Java. The minimal idiom
     * is:<pre>
     * class MyType {
     *     static final NamedType TYPE = NamedType.fromSpec(
     *         new TypeSpec("My::Type", MethodHandles.lookup()));
     * }
     * </pre>
     *
     * @param spec specifying the new type
     * @return the new type
     */
    static NamedType fromSpec(TypeSpec spec) {
        return TypeSystem.typeFromSpec(spec);
    }

    /**
     * Determine the type of the given object, or {@code null} if it is
     * not a typed instance.
     *
     * @param o for which a type is required
     * @return the type or {@code null}
     */
    static NamedType of(Object o) { return TypeSystem.typeOf(o); }

    /**
     * Find the loaded type with the given name, or {@code null} if there
     * is none. No attempt is made to load the type.
     *
     * @param name of the type (need not be canonical)
     * @return the type or {@code null}
     */
    static NamedType forName(String name) {
        String n = Names.typeName(name);
        return n == null ? null : TypeSystem.registry.find(n);
    }

    /**
     * Test whether a type of the given name is loaded.
     *
     * @param name of the type (need not be canonical)
     * @return {@code true} iff the type is loaded
     */
    static boolean isLoaded(String name) { return forName(name) != null; }

    /**
     * Test whether a loaded type of the given name exposes a method of
     * the given name (itself or by inheritance).
     *
     * @param typeName of the type (need not be canonical)
     * @param member name of the method
     * @return {@code true} iff the type is loaded and has the method
     */
    static boolean exposes(String typeName, String member) {
        String n = Names.typeName(typeName);
        return n != null && TypeSystem.registry.typeExposes(n, member);
    }
}
