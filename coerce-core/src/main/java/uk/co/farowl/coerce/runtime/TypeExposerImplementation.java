// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import uk.co.farowl.coerce.runtime.Exposed.InstanceMethod;
import uk.co.farowl.coerce.runtime.Exposed.TypeMethod;
import uk.co.farowl.coerce.runtime.kernel.BaseType;
import uk.co.farowl.coerce.runtime.kernel.TypeExposer;
import uk.co.farowl.coerce.support.TypeSystemError;

/**
 * An object for tabulating the methods of classes that define types.
 * Methods are identified by the annotations in {@link Exposed}, or by
 * having the reserved name of a conversion method:
 * <ul>
 * <li>a method named {@code __as_*} is an instance method. If declared
 * {@code static}, its first parameter receives the instance.</li>
 * <li>a method named {@code __from_*} is a type method, and must be
 * declared {@code static}.</li>
 * </ul>
 * The type factory obtains one of these for each type it creates (see
 * {@link TypeSystem}).
 */
class TypeExposerImplementation implements TypeExposer {

    /** The type being defined. */
    private final BaseType type;

    /** Definitions found so far, in order, by exposed name. */
    private final Map<String, Definition> definitions =
            new LinkedHashMap<>();

    /** A method found by the exposer and what it will become. */
    private static record Definition(String name, MethodKind kind,
            Method method) {}

    /**
     * Create an exposer for the given type.
     *
     * @param type being defined
     */
    TypeExposerImplementation(BaseType type) { this.type = type; }

    @Override
    public void exposeMethods(Class<?> methodClass) {
        // Iterate over methods looking for the relevant annotations
        for (Method m : methodClass.getDeclaredMethods()) {
            if (m.isSynthetic() || m.isBridge()) { continue; }

            InstanceMethod im = m.getDeclaredAnnotation(InstanceMethod.class);
            TypeMethod tm = m.getDeclaredAnnotation(TypeMethod.class);
            boolean isStatic = Modifier.isStatic(m.getModifiers());
            String javaName = m.getName();

            if (im != null && tm != null) {
                throw definitionError(m, "is annotated as instance and type method");
            } else if (im != null) {
                add(exposedName(im.value(), m), MethodKind.INSTANCE, m);
            } else if (tm != null) {
                if (!isStatic) {
                    throw definitionError(m, "is a type method but not static");
                }
                add(exposedName(tm.value(), m), MethodKind.TYPE, m);
            } else if (javaName.startsWith(Names.PUSH_PREFIX)) {
                add(javaName, MethodKind.INSTANCE, m);
            } else if (javaName.startsWith(Names.PULL_PREFIX)) {
                if (!isStatic) {
                    throw definitionError(m, "is a conversion from another type but not static");
                }
                add(javaName, MethodKind.TYPE, m);
            }
        }
    }

    @Override
    public Iterable<ExposedMethod> methods(Lookup lookup) {
        List<ExposedMethod> methods = new ArrayList<>(definitions.size());
        for (Definition d : definitions.values()) {
            MethodHandle mh;
            try {
                mh = lookup.unreflect(d.method);
            } catch (IllegalAccessException e) {
                throw new TypeSystemError(e,
                        "cannot access %s while defining '%s'", d.method,
                        type.getName());
            }
            methods.add(new ExposedMethod(type, d.name, d.kind, mh));
        }
        return methods;
    }

    /**
     * Add a definition, checking the name is valid and not already used
     * and that an instance method has somewhere to receive {@code self}.
     *
     * @param name exposed name
     * @param kind of method
     * @param m the Java method
     */
    private void add(String name, MethodKind kind, Method m) {
        if (Names.methodName(name) == null) {
            throw definitionError(m, "has illegal exposed name '" + name + "'");
        } else if (definitions.containsKey(name)) {
            throw definitionError(m, "repeats the name '" + name + "'");
        } else if (kind == MethodKind.INSTANCE
                && Modifier.isStatic(m.getModifiers())
                && m.getParameterCount() == 0) {
            throw definitionError(m, "is a static instance method without self");
        }
        definitions.put(name, new Definition(name, kind, m));
    }

    /**
     * The name specified in an annotation or, if that is blank, the Java
     * name of the method.
     *
     * @param annotated name from an annotation
     * @param m the Java method
     * @return exposed name
     */
    private static String exposedName(String annotated, Method m) {
        return annotated.isEmpty() ? m.getName() : annotated;
    }

    /**
     * Construct a {@link TypeSystemError} along the lines "[method]
     * [err] while defining '[name]'."
     *
     * @param m the Java method
     * @param err qualifying the error
     * @return to throw
     */
    private TypeSystemError definitionError(Method m, String err) {
        return new TypeSystemError("%s.%s %s while defining '%s'",
                m.getDeclaringClass().getSimpleName(), m.getName(), err,
                type.getName());
    }
}
