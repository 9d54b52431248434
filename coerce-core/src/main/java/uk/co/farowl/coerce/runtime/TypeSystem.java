// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.coerce.runtime.kernel.TypeFactory;
import uk.co.farowl.coerce.runtime.kernel.TypeFactory.Clash;
import uk.co.farowl.coerce.runtime.kernel.TypeRegistry;
import uk.co.farowl.coerce.support.TypeSystemError;

/**
 * {@code TypeSystem} is the nexus of type object lookup, creation and
 * loading methods in the run-time system, and holds the single instance
 * of the type factory and its registry. These come into being with the
 * static initialisation of this class.
 * <p>
 * All use of the type system is funnelled through this class in order
 * to ensure this initialisation is complete before types are used. The
 * JVM guarantees that competing threads are made to wait while the
 * first thread to use the type system completes the initialisation.
 * <p>
 * The configuration of the type system is read from system properties
 * during that initialisation:
 * <dl>
 * <dt>{@value #LOADER_PACKAGES}</dt>
 * <dd>comma-separated Java packages in which the built-in loader looks
 * for classes that define types (default: none).</dd>
 * <dt>{@value #LOADER_ENABLED}</dt>
 * <dd>{@code false} to disable the built-in loader (default
 * {@code true}).</dd>
 * </dl>
 */
final class TypeSystem {

    private TypeSystem() {} // no instances and static members only

    /** Logger for (the public face of) the type system. */
    static final Logger logger = LoggerFactory.getLogger(TypeSystem.class);

    /** Property naming packages the built-in loader searches. */
    static final String LOADER_PACKAGES = "uk.co.farowl.coerce.loader.packages";

    /** Property enabling (or disabling) the built-in loader. */
    static final String LOADER_ENABLED = "uk.co.farowl.coerce.loader.enabled";

    /** The type factory to which the run-time system goes for types. */
    static final TypeFactory factory;

    /** The registry in which the factory publishes types. */
    static final TypeRegistry registry;

    /** Sources of types not yet loaded, in the order consulted. */
    private static final List<TypeLoader> loaders =
            new CopyOnWriteArrayList<>();

    /**
     * High-resolution time (the result of {@link System#nanoTime()}) at
     * which the type system began static initialisation.
     */
    static final long bootstrapNanoTime;

    /**
     * High-resolution time at which the type system completed static
     * initialisation.
     */
    static final long readyNanoTime;

    static {
        // This should be the first thing the run-time system does.
        logger.info("Type system is waking up.");
        bootstrapNanoTime = System.nanoTime();

        factory = new TypeFactory(TypeExposerImplementation::new);
        registry = factory.getRegistry();

        String enabled = System.getProperty(LOADER_ENABLED, "true");
        if (Boolean.parseBoolean(enabled.trim())) {
            List<String> packages =
                    packages(System.getProperty(LOADER_PACKAGES, ""));
            ClassInitLoader builtin = new ClassInitLoader(packages);
            loaders.add(builtin);
            logger.atDebug().setMessage("Built-in loader is {}")
                    .addArgument(builtin).log();
        } else {
            logger.info("Built-in type loader disabled.");
        }

        readyNanoTime = System.nanoTime();

        logger.atInfo()
                .setMessage("Type system is ready after {} seconds")
                .addArgument(() -> String.format("%.3f",
                        1e-9 * (readyNanoTime - bootstrapNanoTime)))
                .log();
    }

    /**
     * Parse the value of {@link #LOADER_PACKAGES} to a list.
     *
     * @param value of the property
     * @return package names (without blanks)
     */
    static List<String> packages(String value) {
        List<String> list = new ArrayList<>();
        for (String p : value.split(",")) {
            p = p.trim();
            if (!p.isEmpty()) { list.add(p); }
        }
        return list;
    }

    /**
     * Determine the type of the given object. The type is found from
     * the object itself if it is a {@link TypedObject}, and otherwise
     * (in the registry) from its Java class.
     *
     * @param o for which a type is required
     * @return the type or {@code null} if not a typed instance
     */
    static NamedType typeOf(Object o) {
        if (o instanceof TypedObject t) {
            return t.getType();
        } else if (o == null) {
            return null;
        } else {
            return registry.find(o.getClass());
        }
    }

    /**
     * Create a type according to the specification. This exists to back
     * {@link NamedType#fromSpec(TypeSpec)}. When the type has been
     * published, any imports requested with {@link TypeSpec#use} are
     * applied to it.
     *
     * @param spec specifying the new type
     * @return the new type
     * @throws TypeSystemError if the type cannot be defined
     */
    static NamedType typeFromSpec(TypeSpec spec) throws TypeSystemError {
        NamedType type;
        try {
            type = factory.fromSpec(spec);
        } catch (Clash clash) {
            logger.atError().log(clash.toString());
            throw new TypeSystemError(clash);
        }
        for (Object[] args : spec.getImports()) {
            CoercionImport.use(type, args);
        }
        return type;
    }

    /**
     * Return the named type, attempting to load it if necessary by
     * consulting the loaders in turn.
     *
     * @param name canonical type name
     * @return the type or {@code null} if no loader could define it
     * @throws RuntimeException from a loader that failed
     */
    static NamedType load(String name) throws RuntimeException {
        NamedType type = registry.find(name);
        if (type == null) {
            for (TypeLoader loader : loaders) {
                if (loader.load(name)
                        && (type = registry.find(name)) != null) {
                    logger.atDebug().setMessage("Loaded '{}' using {}")
                            .addArgument(name).addArgument(loader).log();
                    break;
                }
            }
        }
        return type;
    }

    /**
     * Add a loader to those consulted by {@link #load(String)}.
     *
     * @param loader to add
     */
    static void addLoader(TypeLoader loader) {
        loaders.add(loader);
        logger.atDebug().setMessage("Added type loader {}")
                .addArgument(loader).log();
    }
}
