// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime.loadable;

import java.lang.invoke.MethodHandles;

import uk.co.farowl.coerce.runtime.NamedType;
import uk.co.farowl.coerce.runtime.TypeSpec;

/**
 * A type named after its Java class, which the built-in loader finds
 * without a package prefix. Tests must not touch it before they try to
 * load it.
 */
public class Widget {
    public static final NamedType TYPE = NamedType.fromSpec(new TypeSpec(
            "uk.co.farowl.coerce.runtime.loadable.Widget",
            MethodHandles.lookup()));
}
