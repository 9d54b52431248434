// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.coerce.runtime.CoercionError.Kind;

/**
 * Coercion of a value to a given type. A value may be coerced to a type
 * if it is already an instance of that type (or a sub-type), or if one
 * of the two types declares a conversion by exposing a method with a
 * conventional name:
 * <ol>
 * <li>an instance method {@code __as_T} (without arguments) of the
 * value's type, where {@code T} is the target type name with its
 * separators flattened to {@code _};</li>
 * <li>a type method {@code __from_S} (of one argument) of the target
 * type, where {@code S} is the value's type name, flattened
 * similarly.</li>
 * </ol>
 * The first of these takes precedence where both exist. Finally, a
 * conversion may be declared by a third party (see
 * {@link #declareExternal(String, String, String, String)}).
 * <p>
 * The conversion found for each pair of types is remembered, so that
 * the search happens once only for each pair, whether or not a
 * conversion is found. A conversion is not chained through
 * intermediate types.
 * <p>
 * A consumer that accepts "anything that may be coerced to a
 * {@code Foo::Bar}" may write:<pre>
 * Object bar = Coercion.coerce("Foo::Bar", arg);
 * if (bar == null) throw new IllegalArgumentException("Not passed a Foo::Bar");
 * </pre>
 */
public final class Coercion {

    private Coercion() {} // only static methods here

    /** Logger for the coercion engine. */
    static final Logger logger = LoggerFactory.getLogger(Coercion.class);

    /** The directives found for each pair of types. */
    static final ResolutionCache cache = new ResolutionCache();

    /**
     * Number of times conversion methods have been sought, that is, the
     * number of times the cache could not provide the answer.
     */
    static final LongAdder resolutions = new LongAdder();

    /** Key to a declaration of an external conversion. */
    private static record Declared(String source, String target) {}

    /** External conversions declared by third parties. */
    private static final Map<Declared, Directive.External> externals =
            new ConcurrentHashMap<>();

    /**
     * Coerce a value to the named type, or one of its sub-types. The
     * target type must be loaded already: it is the responsibility of
     * the caller to ensure this.
     * <p>
     * Only a typed instance may be coerced. A plain value (a
     * {@code String} or {@code Integer}, say) or {@code null} results in
     * {@code null}. A value that is already an instance of the target
     * type is returned unchanged. Otherwise, the result is that of the
     * conversion method, if there is one and it returns an instance of
     * the target type, and in all other cases {@code null}. A conversion
     * method that raises an exception is treated as returning
     * {@code null}.
     *
     * @param targetName name of the target type
     * @param value to coerce
     * @return an instance of the target type or {@code null}
     * @throws CoercionError if the name is not valid or the type is not
     *     loaded
     */
    public static Object coerce(String targetName, Object value)
            throws CoercionError {
        // Check what they want properly first
        String name = Names.typeName(targetName);
        if (name == null) {
            throw new CoercionError(Kind.INVALID_TYPE_NAME, targetName);
        }
        NamedType target = TypeSystem.registry.find(name);
        if (target == null) {
            throw new CoercionError(Kind.TARGET_NOT_LOADED, name);
        }
        return coerce(target, value);
    }

    /**
     * Coerce a value to the given type, or one of its sub-types. This
     * is {@link #coerce(String, Object)} for a caller that already holds
     * the type object.
     *
     * @param target type
     * @param value to coerce
     * @return an instance of the target type or {@code null}
     */
    public static Object coerce(NamedType target, Object value) {

        NamedType source = TypeSystem.typeOf(value);
        if (source == null) {
            // Only typed instances can be coerced
            return null;
        } else if (source.isSubTypeOf(target)) {
            // In the simplest case it is already what we need
            return value;
        }

        String targetName = target.getName();
        Directive directive = cache.lookup(source, targetName);
        if (directive == null) {
            // A racing thread may have stored first: use its answer
            directive = cache.store(source, targetName,
                    resolve(source, target));
        }

        if (directive == Directive.NONE) { return null; }

        Object result;
        try {
            result = directive.apply(value, target);
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            // A conversion that fails is no conversion
            logger.atDebug()
                    .setMessage("Conversion of '{}' to '{}' by {} raised {}")
                    .addArgument(source::getName).addArgument(targetName)
                    .addArgument(directive).addArgument(t).setCause(t).log();
            return null;
        }

        // The conversion might not have produced what we asked for
        return target.check(result) ? result : null;
    }

    /**
     * Work out how to convert an instance of the source type to the
     * target type. Conversion methods are sought along the MRO of the
     * type that would define them.
     *
     * @param source type of the value
     * @param target type to convert to
     * @return the directive (possibly {@link Directive#NONE})
     */
    static Directive resolve(NamedType source, NamedType target) {
        resolutions.increment();
        Directive directive;

        // Does what we have support casting to what we want?
        String push = Names.pushMethodName(target.getName());
        String pull = Names.pullMethodName(source.getName());
        if (hasShape(source.lookup(push), MethodKind.INSTANCE, 0)) {
            directive = new Directive.Push(push);
        } else if (hasShape(target.lookup(pull), MethodKind.TYPE, 1)) {
            // What we want can be made from what we have
            directive = new Directive.Pull(pull);
        } else {
            // Has a third party declared a conversion?
            Directive.External e = externals
                    .get(new Declared(source.getName(), target.getName()));
            directive = e != null ? e : Directive.NONE;
        }

        logger.atDebug().setMessage("Resolved '{}' to '{}' as {}")
                .addArgument(source::getName).addArgument(target::getName)
                .addArgument(directive).log();
        return directive;
    }

    /**
     * Test that a method found by name is of the kind and arity a
     * conversion needs. A method of the right name but the wrong shape
     * is not a conversion.
     *
     * @param m method found or {@code null}
     * @param kind required
     * @param arity required (not counting {@code self})
     * @return {@code true} iff {@code m} may be called as a conversion
     */
    private static boolean hasShape(ExposedMethod m, MethodKind kind,
            int arity) {
        return m != null && m.getKind() == kind && m.getArity() == arity;
    }

    /**
     * Declare that an instance of the source type may be converted to
     * the target type by a type method of a third type, acting as a
     * module of conversion functions. This is consulted only if neither
     * the source nor the target type declares a conversion.
     * <p>
     * The module type must be loaded, or loadable. The source and target
     * types need not be loaded. A declaration is effective only if made
     * before the first attempt to coerce between the two types.
     *
     * @param source name of the source type
     * @param target name of the target type
     * @param module name of the type defining the function
     * @param function name of a one-argument type method of the module
     * @throws CoercionError if a name is invalid, the module cannot be
     *     loaded or lacks a suitable function, or a conversion has already been
     *     declared for the pair
     */
    public static void declareExternal(String source, String target,
            String module, String function) throws CoercionError {
        String s = checkedTypeName(source);
        String t = checkedTypeName(target);
        String m = checkedTypeName(module);
        String f = Names.methodName(function);
        if (f == null) {
            throw new CoercionError(Kind.INVALID_METHOD_NAME, function);
        }

        NamedType moduleType = CoercionImport.ensureLoaded(m);
        ExposedMethod fn = moduleType.lookup(f);
        if (fn == null) {
            throw new CoercionError(Kind.UNSUPPORTED_IMPORT, String.format(
                    "'%s' does not define '%s'", m, f));
        } else if (!hasShape(fn, MethodKind.TYPE, 1)) {
            throw new CoercionError(Kind.UNSUPPORTED_IMPORT, String.format(
                    "'%s::%s' is not a type method of one argument", m, f));
        }

        Directive.External directive =
                new Directive.External(moduleType, f);
        if (externals.putIfAbsent(new Declared(s, t), directive) != null) {
            throw new CoercionError(Kind.UNSUPPORTED_IMPORT, String.format(
                    "conversion of '%s' to '%s' is already declared", s, t));
        }

        if (cache.contains(s, t)) {
            logger.atWarn().setMessage(
                    "Conversion of '{}' to '{}' declared after first use: ignored")
                    .addArgument(s).addArgument(t).log();
        } else {
            logger.atDebug().setMessage("Declared '{}' to '{}' as {}")
                    .addArgument(s).addArgument(t).addArgument(directive)
                    .log();
        }
    }

    /**
     * Validate a type name.
     *
     * @param name to validate
     * @return canonical name
     * @throws CoercionError if invalid
     */
    private static String checkedTypeName(String name) throws CoercionError {
        String n = Names.typeName(name);
        if (n == null) {
            throw new CoercionError(Kind.INVALID_TYPE_NAME, name);
        }
        return n;
    }
}
