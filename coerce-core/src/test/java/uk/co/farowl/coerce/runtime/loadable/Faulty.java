// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime.loadable;

import uk.co.farowl.coerce.runtime.NamedType;

/** A class whose static initialisation fails. */
public class Faulty {
    public static final NamedType TYPE = define();

    private static NamedType define() {
        throw new IllegalStateException("Faulty cannot be defined");
    }
}
