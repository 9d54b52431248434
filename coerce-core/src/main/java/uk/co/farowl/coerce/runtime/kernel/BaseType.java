// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime.kernel;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import uk.co.farowl.coerce.runtime.ExposedMethod;
import uk.co.farowl.coerce.runtime.NamedType;

/**
 * The implementation of every {@link NamedType}. Instances are created
 * only by the {@link TypeFactory}, which completes their method table
 * before publishing them.
 * <p>
 * The name, bases and MRO of a type never change. The method table may
 * grow after publication (a coercion helper may be installed), but an
 * entry once present is never replaced or removed.
 */
public final class BaseType implements NamedType {

    /** Name of the type. */
    private final String name;

    /** The bases as specified. */
    private final List<NamedType> bases;

    /** The MRO, beginning with this type. Set by the factory. */
    private List<NamedType> mro;

    /** Primary Java representation class. */
    private final Class<?> javaClass;

    /** Documentation string or {@code null}. */
    private final String doc;

    /** The methods defined by this type (not its bases). */
    private final Map<String, ExposedMethod> dict =
            new ConcurrentHashMap<>();

    /**
     * Create a type that is partially complete. The factory must set the
     * MRO and fill the method table before the type is published.
     *
     * @param name of the type
     * @param bases of the type
     * @param javaClass primary representation
     * @param doc documentation string or {@code null}
     */
    BaseType(String name, List<NamedType> bases, Class<?> javaClass,
            String doc) {
        this.name = name;
        this.bases = List.copyOf(bases);
        this.javaClass = javaClass;
        this.doc = doc;
    }

    @Override
    public String getName() { return name; }

    @Override
    public List<NamedType> getBases() { return bases; }

    @Override
    public List<NamedType> getMRO() { return mro; }

    /**
     * Set the MRO (exactly once).
     *
     * @param mro beginning with this type
     */
    void setMRO(List<NamedType> mro) {
        assert this.mro == null && mro.get(0) == this;
        this.mro = List.copyOf(mro);
    }

    @Override
    public boolean isSubTypeOf(NamedType b) {
        // Deal with multiple inheritance by walking the MRO
        for (NamedType t : mro) {
            if (t == b) { return true; }
        }
        return false;
    }

    @Override
    public boolean check(Object o) {
        NamedType t = NamedType.of(o);
        return t != null && t.isSubTypeOf(this);
    }

    @Override
    public ExposedMethod lookup(String name) {
        for (NamedType t : mro) {
            ExposedMethod m = ((BaseType)t).dict.get(name);
            if (m != null) { return m; }
        }
        return null;
    }

    @Override
    public boolean definesOwn(String name) {
        return dict.containsKey(name);
    }

    @Override
    public Class<?> javaClass() { return javaClass; }

    /**
     * Return the documentation string for the type.
     *
     * @return documentation string (or {@code null})
     */
    public String getDoc() { return doc; }

    /**
     * Add a method to the table of this type, if no method of that name
     * is defined by this type already. An existing method is never
     * replaced.
     *
     * @param method to add
     * @return {@code true} if added, {@code false} if the name exists
     */
    public boolean addMethod(ExposedMethod method) {
        assert method.getOwner() == this;
        return dict.putIfAbsent(method.getName(), method) == null;
    }

    @Override
    public String toString() { return "<type '" + name + "'>"; }
}
