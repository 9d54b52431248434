// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime.kernel;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import uk.co.farowl.coerce.runtime.ExposedMethod;
import uk.co.farowl.coerce.runtime.NamedType;
import uk.co.farowl.coerce.runtime.TypedObject;
import uk.co.farowl.coerce.runtime.kernel.TypeFactory.Clash;

/**
 * The published types, indexed by name and by their primary Java class.
 * A type is "loaded" exactly when it is present in this registry.
 * <p>
 * In normal operation (outside test cases) there is only one instance
 * of this class, owned by a {@link TypeFactory}. Note that only the
 * owning factory has a write interface to the registry. Entries are
 * never removed: a type, once loaded, stays loaded for the lifetime of
 * the registry.
 */
public class TypeRegistry {

    /** Published types by canonical name. */
    private final Map<String, BaseType> byName = new ConcurrentHashMap<>();

    /**
     * Published types by primary Java class. Classes implementing
     * {@link TypedObject} are not entered, since their instances report
     * their own type.
     */
    private final Map<Class<?>, BaseType> byClass =
            new ConcurrentHashMap<>();

    /** Only a {@link TypeFactory} creates a registry. */
    TypeRegistry() {}

    /**
     * Find the type published under the given name.
     *
     * @param name canonical type name
     * @return the type or {@code null} if not loaded
     */
    public NamedType find(String name) { return byName.get(name); }

    /**
     * Find the type of which instances of the given Java class are
     * typed instances, by looking for the class or its nearest
     * superclass that is the primary class of a type.
     *
     * @param c class of an instance
     * @return the type or {@code null} if there is none
     */
    public NamedType find(Class<?> c) {
        for (Class<?> k = c; k != null; k = k.getSuperclass()) {
            BaseType t = byClass.get(k);
            if (t != null) { return t; }
        }
        return null;
    }

    /**
     * Test whether the named type is loaded.
     *
     * @param name canonical type name
     * @return {@code true} iff a type of that name is published
     */
    public boolean isLoaded(String name) { return byName.containsKey(name); }

    /**
     * Test whether the named type exposes a method of the given name,
     * either itself or by inheritance.
     *
     * @param typeName canonical type name
     * @param member name of the method
     * @return {@code true} iff the type is loaded and has the method
     */
    public boolean typeExposes(String typeName, String member) {
        BaseType t = byName.get(typeName);
        if (t != null) {
            ExposedMethod m = t.lookup(member);
            return m != null;
        }
        return false;
    }

    /** @return the number of types published. */
    public int size() { return byName.size(); }

    /**
     * Publish a completed type under its name and (unless it is a
     * {@code TypedObject}) under its primary class.
     *
     * @param type to publish
     * @throws Clash if the name or class is already bound
     */
    synchronized void publish(BaseType type) throws Clash {
        String name = type.getName();
        Class<?> c = type.javaClass();
        boolean bindClass = !TypedObject.class.isAssignableFrom(c);

        BaseType existing = byName.get(name);
        if (existing != null) {
            throw new Clash(Clash.Mode.NAME, name, existing);
        }
        if (bindClass && (existing = byClass.get(c)) != null) {
            throw new Clash(Clash.Mode.CLASS, c.getTypeName(), existing);
        }

        if (bindClass) { byClass.put(c, type); }
        byName.put(name, type);
    }
}
