// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The exception thrown when a coercion, or the installation of a
 * coercion helper, is requested in a way that cannot be honoured: a
 * malformed name, a target type that is not loaded, a method that would
 * replace an existing one, or an unrecognised import. These are errors
 * in the calling code or its configuration, and are not retried.
 * <p>
 * Note that the failure to find a conversion is not an error, nor is
 * the failure of a conversion method:
 * {@link Coercion#coerce(String, Object)} simply returns {@code null}.
 */
public class CoercionError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /** Logger for coercion errors. */
    static final Logger logger = LoggerFactory.getLogger(CoercionError.class);

    /**
     * The types of problem a {@code CoercionError} reports. Each
     * carries the format of its message.
     */
    public enum Kind {
        /** A string offered as a type name is not one. */
        INVALID_TYPE_NAME("Illegal type name '%s'"),
        /** A string offered as a method name is not one. */
        INVALID_METHOD_NAME("Illegal method name '%s'"),
        /** The target type of a coercion is not loaded. */
        TARGET_NOT_LOADED("Tried to coerce to unloaded type '%s'"),
        /** An installed method would replace an existing one. */
        METHOD_COLLISION("Cannot create '%s::%s'. It already exists"),
        /** The arguments to an import are not a recognised form. */
        UNSUPPORTED_IMPORT("%s");

        private final String fmt;

        Kind(String fmt) { this.fmt = fmt; }
    }

    /** The type of problem. */
    private final Kind kind;

    /**
     * Create an exception of the given kind, formatting the message
     * from the arguments according to the kind.
     *
     * @param kind of problem
     * @param args to insert in the message
     */
    public CoercionError(Kind kind, Object... args) {
        super(String.format(kind.fmt, args));
        this.kind = kind;
        logger.atDebug().log(getMessage());
    }

    /**
     * Create an exception of the given kind with a cause, formatting
     * the message from the arguments according to the kind.
     *
     * @param cause of this exception
     * @param kind of problem
     * @param args to insert in the message
     */
    public CoercionError(Throwable cause, Kind kind, Object... args) {
        super(String.format(kind.fmt, args), cause);
        this.kind = kind;
        logger.atDebug().setCause(cause).log(getMessage());
    }

    /**
     * The type of problem reported.
     *
     * @return the kind of problem
     */
    public Kind getKind() { return kind; }
}
