// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * Coercion of typed values. The public API consists of
 * {@link uk.co.farowl.coerce.runtime.Coercion} (the coercion of a value
 * to a named type), {@link uk.co.farowl.coerce.runtime.CoercionImport}
 * (installation of coercion helpers in a consuming type), and the
 * nominal type system on which these operate:
 * {@link uk.co.farowl.coerce.runtime.NamedType},
 * {@link uk.co.farowl.coerce.runtime.TypeSpec} and the annotations in
 * {@link uk.co.farowl.coerce.runtime.Exposed}.
 * <p>
 * A type declares that its instances may be converted to another type
 * by defining a method {@code __as_T()}, or that it may be made from
 * instances of another type by defining a static method
 * {@code __from_S(Object)}, where {@code T} and {@code S} are the other
 * type names flattened by {@link uk.co.farowl.coerce.runtime.Names}.
 */
package uk.co.farowl.coerce.runtime;
