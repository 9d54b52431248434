// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

/**
 * An object that reports its own type. A Java class may represent
 * instances of several types (for example, a generic record of
 * attributes), in which case it is not possible to determine the type
 * from the Java class. Such classes implement this interface.
 */
public interface TypedObject {

    /**
     * The type of this object.
     *
     * @return the type of this object
     */
    NamedType getType();
}
