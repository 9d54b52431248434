// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal error thrown when the type system cannot be relied on to
 * work. A {@code CoercionError} (that a consumer might reasonably catch)
 * is not then appropriate. A {@code TypeSystemError} is typically
 * thrown during the definition of a type or for irrecoverable internal
 * errors.
 */
public class TypeSystemError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Logger for type system errors. A proportion of these are thrown
     * during the static initialisation of classes that define types,
     * where they surface only as an {@code ExceptionInInitializerError}
     * (or not at all): this gives us a second chance to notice.
     */
    static final Logger logger =
            LoggerFactory.getLogger(TypeSystemError.class);

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public TypeSystemError(String msg, Object... args) {
        super(String.format(msg, args));
        logger.atInfo().log(getMessage());
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public TypeSystemError(Throwable cause, String msg, Object... args) {
        super(String.format(msg, args), cause);
        logger.atInfo().log(getMessage());
        logger.atInfo().log(cause.toString());
    }

    /**
     * Constructor specifying a cause.
     *
     * @param cause a Java exception behind the error
     */
    public TypeSystemError(Throwable cause) {
        this(cause, "%s", notNull(cause.getMessage(), "(no message)"));
    }

    /**
     * @param msg a string or {@code null}
     * @param defaultMsg a string or {@code null}
     * @return non-{@code null} {@code msg} or {@code defaultMsg}
     */
    private static String notNull(String msg, String defaultMsg) {
        return msg != null ? msg : defaultMsg;
    }
}
