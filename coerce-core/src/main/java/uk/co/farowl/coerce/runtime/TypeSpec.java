// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import java.lang.invoke.MethodHandles.Lookup;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

import uk.co.farowl.coerce.support.TypeSystemError;

/**
 * A specification for a type that acts as a complex argument to
 * {@link NamedType#fromSpec(TypeSpec)}. A Java class intended as the
 * definition of a type creates one of these data structures during
 * static initialisation, configuring it using the mutators. A fluent
 * interface makes this configuration readable as a single long
 * statement. The normal idiom is:<pre>
 * public static final NamedType TYPE = NamedType.fromSpec(
 *    new TypeSpec("Example::Thing", MethodHandles.lookup()));
 * </pre>
 * <p>
 * Recall that {@code MethodHandles.lookup} is context sensitive: it
 * captures the identity of the class from which it was called, in the
 * {@code Lookup} it returns. In the example, this class becomes the
 * (primary) Java representation class for instances of the type, and
 * the source of method definitions. It is possible to adjust this
 * behaviour though choice of constructor and mutators on the
 * specification before {@code NamedType.fromSpec} reads it.
 */
public class TypeSpec {

    /** Unmodifiable empty list. */
    private static final List<Class<?>> EMPTY = List.of();

    /** Canonical name of the type. */
    private final String name;

    /** Delegated authorisation to resolve names. */
    private final Lookup lookup;

    /**
     * If {@code true} the class creating the {@code Lookup} object will
     * be treated as the primary representation and examined as a method
     * implementation class.
     */
    private final boolean defaultToLookup;

    /** Whether further change is allowed. */
    private boolean frozen;

    /** Documentation string for the type. */
    private String doc;

    /**
     * The primary class that will represent the instances of the type
     * being defined. See {@link #primary(Class)}.
     */
    private Class<?> primary;

    /**
     * Classes in which to look up implementations of methods composing
     * the type. See {@link #methodImpls(Class...)}.
     */
    private List<Class<?>> methodImpls = new LinkedList<>();

    /** Types that are bases of the type being specified. */
    private final List<NamedType> bases = new LinkedList<>();

    /**
     * Argument lists to {@link CoercionImport#use(NamedType, Object...)}
     * to be applied to the type once it exists.
     */
    private final List<Object[]> imports = new LinkedList<>();

    /**
     * Create (begin) a specification for a type. This is the beginning
     * normally made by types defined in Java, during the static
     * initialisation of their defining class.
     * <p>
     * The caller supplies a {@code Lookup} object which must grant
     * sufficient access to implementing class(es) for method definitions
     * to be exposed reflectively. By default, the lookup class becomes
     * the (primary) Java representation class for instances of the
     * type, and the source of method definitions.
     *
     * @param name of the type being specified
     * @param lookup authorisation to access the implementation
     * @throws TypeSystemError if the name is not valid
     */
    public TypeSpec(String name, Lookup lookup) throws TypeSystemError {
        this(name, lookup, true);
    }

    /**
     * Create (begin) a specification for a type. This is identical to
     * {@link #TypeSpec(String, Lookup)}, except that the class creating
     * the {@code Lookup} object will not be treated as the primary
     * representation or examined as a method implementation class. The
     * mutators {@link #primary} and optionally
     * {@link #methodImpls(Class...)} must be used to specify those
     * explicitly.
     *
     * @param name of the type being specified
     * @param lookup authorisation to access the implementation
     * @param defaultToLookup if false, do not look for methods in the
     *     lookup class itself
     * @throws TypeSystemError if the name is not valid
     */
    public TypeSpec(String name, Lookup lookup, boolean defaultToLookup)
            throws TypeSystemError {
        String n = Names.typeName(name);
        if (n == null) {
            throw new TypeSystemError("illegal type name '%s'", name);
        }
        this.name = n;
        this.lookup = lookup;
        this.defaultToLookup = defaultToLookup;
        if (defaultToLookup) { methodImpls.add(lookup.lookupClass()); }
    }

    /**
     * Mark the specification as complete. (No further mutations are
     * possible.) The primary class is defaulted if necessary.
     *
     * @return {@code this}
     * @throws TypeSystemError if inconsistent in some way
     */
    public TypeSpec freeze() throws TypeSystemError {
        if (frozen == false) {
            frozen = true;
            if (primary == null) {
                if (defaultToLookup) {
                    primary = lookup.lookupClass();
                } else {
                    throw specError("no primary representation was specified");
                }
            }
            methodImpls = Collections.unmodifiableList(methodImpls);
        }
        return this;
    }

    /**
     * Name of the type being specified, in canonical form.
     *
     * @return name specified for the type.
     */
    public String getName() { return name; }

    /**
     * The {@code Lookup} object provided in the constructor, which
     * represents a delegated authority to access methods of the defining
     * classes.
     *
     * @return lookup specified in construction.
     */
    public Lookup getLookup() { return lookup; }

    /**
     * Specify the primary class that will represent instances of the
     * type. The default value is the defining class (obtained from the
     * lookup object), so this method need not be called in simple cases.
     * <p>
     * If the class implements {@link TypedObject}, its instances report
     * their own type and the class is not bound to this type in the
     * registry.
     *
     * @param klass is the primary representation class of instances
     * @return {@code this}
     */
    public TypeSpec primary(Class<?> klass) {
        checkNotFrozen();
        if (primary != null) { throw repeatError("primary class"); }
        this.primary = klass;
        return this;
    }

    /**
     * Get the primary representation class. This may be {@code null}
     * before {@link #freeze()} is called.
     *
     * @return primary representation class for instances
     */
    public Class<?> getPrimary() { return primary; }

    /**
     * Add classes to those in which methods will be looked up. The
     * {@code Lookup} given to the constructor must grant access to
     * them. Successive calls are cumulative.
     *
     * @param classes to add to the list
     * @return {@code this}
     */
    public TypeSpec methodImpls(Class<?>... classes) {
        checkNotFrozen();
        for (Class<?> c : classes) {
            if (methodImpls.contains(c)) {
                throw repeatError("methodImpls", c.getTypeName());
            }
            methodImpls.add(c);
        }
        return this;
    }

    /**
     * The classes in which methods of the type will be looked up.
     *
     * @return the method implementation classes
     */
    public List<Class<?>> getMethodImpls() {
        return methodImpls.isEmpty() ? EMPTY : methodImpls;
    }

    /**
     * Add bases of the type being specified. Successive calls are
     * cumulative.
     *
     * @param newBases to append to the bases
     * @return {@code this}
     */
    public TypeSpec base(NamedType... newBases) {
        checkNotFrozen();
        for (NamedType b : newBases) {
            if (b == null) {
                throw specError("null base (base type not ready?)");
            } else if (bases.contains(b)) {
                throw repeatError("base", b.getName());
            }
            bases.add(b);
        }
        return this;
    }

    /**
     * Return the bases of the type being specified, in the order given.
     *
     * @return the bases
     */
    public List<NamedType> getBases() {
        return Collections.unmodifiableList(bases);
    }

    /**
     * Request that the type, once defined, be given a coercion method,
     * in the way {@link CoercionImport#use(NamedType, Object...)} would
     * do. The arguments are not checked until then. Successive calls
     * are cumulative.
     *
     * @param args arguments to the import
     * @return {@code this}
     */
    public TypeSpec use(Object... args) {
        checkNotFrozen();
        imports.add(args.clone());
        return this;
    }

    /**
     * Return the argument lists given to {@link #use(Object...)}.
     *
     * @return the import arguments
     */
    public List<Object[]> getImports() {
        return Collections.unmodifiableList(imports);
    }

    /**
     * Set the documentation string for the type.
     *
     * @param doc the documentation string
     * @return {@code this}
     */
    public TypeSpec doc(String doc) {
        checkNotFrozen();
        this.doc = doc;
        return this;
    }

    /**
     * Return the documentation string for the type.
     *
     * @return documentation string (or {@code null})
     */
    public String getDoc() { return doc; }

    @Override
    public String toString() {
        return String.format("TypeSpec(%s, bases=%s, primary=%s)", name,
                bases.stream().map(NamedType::getName).toList(),
                primary == null ? null : primary.getSimpleName());
    }

    /** Check that {@link #freeze()} has not yet been called. */
    private void checkNotFrozen() {
        if (frozen) { throw specError("specification changed after frozen"); }
    }

    /**
     * Construct a {@link TypeSystemError} along the lines "[err] while
     * defining '[name]'."
     *
     * @param err qualifying the error (a format string)
     * @param args to formatted message
     * @return to throw
     */
    private TypeSystemError specError(String err, Object... args) {
        StringBuilder sb = new StringBuilder(100);
        sb.append(String.format(err, args)).append(" while defining '")
                .append(name).append("'.");
        return new TypeSystemError("%s", sb.toString());
    }

    /**
     * Construct a {@link TypeSystemError} along the lines "repeat
     * [thing] specified while defining '[name]'."
     *
     * @param thing qualifying the error
     * @return to throw
     */
    private TypeSystemError repeatError(String thing) {
        return specError("repeat %s specified", thing);
    }

    /**
     * Construct a {@link TypeSystemError} along the lines "repeat
     * [method]([n]) specified while defining '[name]'."
     *
     * @param method naming the method called
     * @param n the item being added
     * @return to throw
     */
    private TypeSystemError repeatError(String method, String n) {
        return specError("repeat %s(%s) specified", method, n);
    }
}
