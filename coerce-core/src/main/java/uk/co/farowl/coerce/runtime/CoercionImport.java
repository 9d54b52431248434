// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import static java.lang.invoke.MethodHandles.insertArguments;
import static java.lang.invoke.MethodType.methodType;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.coerce.runtime.CoercionError.Kind;
import uk.co.farowl.coerce.runtime.kernel.BaseType;
import uk.co.farowl.coerce.support.TypeSystemError;

/**
 * Installation of coercion helpers into a consuming type. A type that
 * accepts arguments "coercible to" some other type may ask, when it is
 * defined, for a type method that performs the coercion, so that it
 * need not repeat the target type name at every call. For example:<pre>
 * static final NamedType TYPE = NamedType.fromSpec(
 *         new TypeSpec("Foo", MethodHandles.lookup())
 *                 .use("_Bar", "Foo::Bar"));
 * ...
 * Object bar = TYPE.lookup("_Bar").call(TYPE, arg);
 * </pre> The forms of import are:
 * <dl>
 * <dt>{@code use(type)}</dt>
 * <dd>Does nothing.</dd>
 * <dt>{@code use(type, "coerce")}</dt>
 * <dd>Installs a type method {@code coerce(target, value)} equivalent
 * to {@link Coercion#coerce(String, Object)}.</dd>
 * <dt>{@code use(type, method, target)}</dt>
 * <dd>Installs a type method {@code method(value)} equivalent to
 * {@code Coercion.coerce(target, value)}, loading the target type if
 * necessary.</dd>
 * </dl>
 * No form replaces a method the consuming type already defines.
 */
public final class CoercionImport {

    private CoercionImport() {} // only static methods here

    /** Logger for imports. */
    static final Logger logger = LoggerFactory.getLogger(CoercionImport.class);

    /** The only function that may be imported by name. */
    static final String COERCE = "coerce";

    /** Handle on {@link Coercion#coerce(String, Object)}. */
    private static final MethodHandle COERCE_HANDLE;

    static {
        try {
            COERCE_HANDLE = MethodHandles.lookup().findStatic(
                    Coercion.class, COERCE,
                    methodType(Object.class, String.class, Object.class));
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new TypeSystemError(e, "cannot find %s.%s",
                    Coercion.class.getSimpleName(), COERCE);
        }
    }

    /**
     * Install a coercion helper in the consuming type, according to the
     * form of the arguments (see the class documentation).
     *
     * @param consumer type to receive the helper
     * @param args arguments to the import
     * @throws CoercionError if the arguments are not a recognised form,
     *     are not valid names, name a method the consumer already
     *     defines, or name a target type that cannot be loaded
     */
    public static void use(NamedType consumer, Object... args)
            throws CoercionError {
        switch (args.length) {
            case 0:
                break;
            case 1:
                if (!COERCE.equals(args[0])) {
                    throw new CoercionError(Kind.UNSUPPORTED_IMPORT,
                            String.format("%s does not export '%s'",
                                    Coercion.class.getSimpleName(),
                                    args[0]));
                }
                install(consumer, COERCE, COERCE_HANDLE, null);
                break;
            case 2:
                useBound(consumer, args[0], args[1]);
                break;
            default:
                throw new CoercionError(Kind.UNSUPPORTED_IMPORT,
                        "Too many parameters");
        }
    }

    /**
     * Install a one-argument helper coercing to a fixed target type.
     *
     * @param consumer type to receive the helper
     * @param method name of the helper
     * @param target name of the target type
     * @throws CoercionError on any failure
     */
    private static void useBound(NamedType consumer, Object method,
            Object target) throws CoercionError {
        String name = Names.methodName(method);
        if (name == null) {
            throw new CoercionError(Kind.INVALID_METHOD_NAME, method);
        }
        String targetName = Names.typeName(target);
        if (targetName == null) {
            throw new CoercionError(Kind.INVALID_TYPE_NAME, target);
        }
        // Check before loading, since loading may be expensive
        if (consumer.definesOwn(name)) {
            throw new CoercionError(Kind.METHOD_COLLISION,
                    consumer.getName(), name);
        }
        ensureLoaded(targetName);
        MethodHandle mh = insertArguments(COERCE_HANDLE, 0, targetName);
        install(consumer, name, mh, targetName);
    }

    /**
     * Add a type method to the consuming type, unless it already
     * defines a method of that name.
     *
     * @param consumer type to receive the method
     * @param name of the method
     * @param mh implementation
     * @param targetName for the log (or {@code null})
     * @throws CoercionError on a collision
     */
    private static void install(NamedType consumer, String name,
            MethodHandle mh, String targetName) throws CoercionError {
        if (!(consumer instanceof BaseType type)) {
            throw new TypeSystemError("cannot install '%s' in %s", name,
                    consumer);
        }
        ExposedMethod m = new ExposedMethod(type, name, MethodKind.TYPE, mh);
        if (!type.addMethod(m)) {
            throw new CoercionError(Kind.METHOD_COLLISION, type.getName(),
                    name);
        }
        logger.atDebug().setMessage("Installed {} coercing to {}")
                .addArgument(m)
                .addArgument(targetName == null ? "any type" : targetName)
                .log();
    }

    /**
     * Return the named type, loading it if necessary.
     *
     * @param name canonical type name
     * @return the type
     * @throws CoercionError if it could not be loaded
     */
    static NamedType ensureLoaded(String name) throws CoercionError {
        NamedType type;
        try {
            type = TypeSystem.load(name);
        } catch (RuntimeException e) {
            throw new CoercionError(e, Kind.TARGET_NOT_LOADED, name);
        }
        if (type == null) {
            throw new CoercionError(Kind.TARGET_NOT_LOADED, name);
        }
        return type;
    }
}
