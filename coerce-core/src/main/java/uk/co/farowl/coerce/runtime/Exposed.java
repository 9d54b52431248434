// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/**
 * Annotations that may be placed on elements of a Java class intended
 * as the implementation of a type, and that the type exposer will look
 * for during the definition of a {@link NamedType}.
 * <p>
 * Conversion methods (those named with {@link Names#PUSH_PREFIX} or
 * {@link Names#PULL_PREFIX}) are identified by their reserved name and
 * need not be annotated.
 */
public interface Exposed {

    /**
     * Identify a (non-static) method of a Java class as an exposed
     * instance method of the type. The Java object on which it is called
     * is the instance.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(METHOD)
    @interface InstanceMethod {

        /**
         * Exposed name of the method if different from the declaration.
         *
         * @return name of the method
         */
        String value() default "";
    }

    /**
     * Identify a static method of a Java class as an exposed type method
     * of the type. It is called without an instance.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(METHOD)
    @interface TypeMethod {

        /**
         * Exposed name of the method if different from the declaration.
         *
         * @return name of the method
         */
        String value() default "";
    }
}
