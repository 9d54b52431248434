// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime.kernel;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.coerce.runtime.ExposedMethod;
import uk.co.farowl.coerce.runtime.NamedType;
import uk.co.farowl.coerce.runtime.TypeSpec;
import uk.co.farowl.coerce.support.TypeSystemError;

/**
 * The {@code TypeFactory} is the home of type creation. In normal
 * operation, only one instance of {@code TypeFactory} will be created,
 * held statically by the run-time system. Exceptionally, we create
 * instances for limited test purposes.
 * <p>
 * The factory is the only writer to its {@link TypeRegistry}. A type is
 * completed (its MRO calculated and its methods exposed) before it is
 * published, so that no other thread can see a type without its
 * methods. Creation is serialised by the lock on the factory. The lock
 * is not held while a type is being used, only while it is made.
 */
public class TypeFactory {

    /** Logger for the type factory. */
    final Logger logger = LoggerFactory.getLogger(TypeFactory.class);

    /** The registry in which types are published. */
    private final TypeRegistry registry;

    /** Factory method to make type exposers. */
    private final Function<BaseType, TypeExposer> exposerFactory;

    /**
     * Construct a {@code TypeFactory}. Normally this constructor is used
     * exactly once, by the run-time system. Exceptionally, we create
     * instances for test purposes.
     *
     * @param exposerFactory makes an exposer for a type under
     *     construction
     */
    public TypeFactory(Function<BaseType, TypeExposer> exposerFactory) {
        logger.info("Type factory being created.");
        this.registry = new TypeRegistry();
        this.exposerFactory = exposerFactory;
    }

    /**
     * Return the registry in which this factory publishes types.
     *
     * @return the registry
     */
    public TypeRegistry getRegistry() { return registry; }

    /**
     * Create a type according to the specification, and publish it in
     * the registry.
     *
     * @param spec specifying the new type
     * @return the new type
     * @throws Clash if the name or the primary class is already bound
     * @throws TypeSystemError if the specification is inconsistent
     */
    public synchronized BaseType fromSpec(TypeSpec spec)
            throws Clash, TypeSystemError {

        // No further change once we start
        String name = spec.freeze().getName();

        logger.atDebug().setMessage(CREATING_TYPE).addArgument(name)
                .log();

        NamedType existing = registry.find(name);
        if (existing != null) {
            throw new Clash(Clash.Mode.NAME, name, existing);
        }

        // Every base must have been made by a factory like this one.
        List<NamedType> bases = new ArrayList<>(spec.getBases());
        for (NamedType b : bases) {
            if (!(b instanceof BaseType)) {
                throw new TypeSystemError(
                        "base '%s' of '%s' was not created by the runtime",
                        b.getName(), name);
            }
        }

        BaseType type = new BaseType(name, bases, spec.getPrimary(),
                spec.getDoc());
        type.setMRO(MROCalculator.getMRO(type, bases));

        // Gather the methods from the implementation classes
        TypeExposer exposer = exposerFactory.apply(type);
        for (Class<?> c : spec.getMethodImpls()) {
            exposer.exposeMethods(c);
        }
        for (ExposedMethod m : exposer.methods(spec.getLookup())) {
            if (!type.addMethod(m)) {
                throw new TypeSystemError(
                        "method '%s' defined twice in type '%s'",
                        m.getName(), name);
            }
            logger.atTrace().setMessage("  {}").addArgument(m).log();
        }

        registry.publish(type);
        logger.atDebug().setMessage(PUBLISHED_TYPE).addArgument(name)
                .addArgument(type::getMRO).log();
        return type;
    }

    private static final String CREATING_TYPE = "Creating type '{}'";
    private static final String PUBLISHED_TYPE =
            "Published type '{}' with MRO {}";

    /**
     * A name or Java class has already been bound to a type, so a new
     * type cannot be published. This is a checked exception so that the
     * run-time system is obliged to decide how to report it.
     */
    public static class Clash extends Exception {
        private static final long serialVersionUID = 1L;

        /** Type of clash. */
        final Mode mode;
        /** Name of the thing being bound. */
        final String key;
        /** Type already registered for {@link #key} */
        final NamedType existing;

        /** Types of clash. */
        public enum Mode {
            /** New type requested but name exists already. */
            NAME("type name '%s' was already bound to %s"),
            /** Primary class of new type is bound to another type. */
            CLASS("class %s was already bound to %s");

            final String fmt;

            Mode(String fmt) { this.fmt = fmt; }
        }

        /**
         * Create an exception reporting a specified type of problem in
         * the registry.
         *
         * @param mode of the clash
         * @param key name or class name being bound
         * @param existing type bound to that key
         */
        Clash(Mode mode, String key, NamedType existing) {
            this.mode = mode;
            this.key = key;
            this.existing = existing;
        }

        /** @return the type of clash. */
        public Mode getMode() { return mode; }

        @Override
        public String getMessage() {
            return String.format(mode.fmt, key, existing);
        }

        @Override
        public String toString() { return "Clash: " + getMessage(); }
    }
}
