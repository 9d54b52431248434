// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * Classes supporting the implementation of the type system and the
 * coercion engine, but not specific to either.
 */
package uk.co.farowl.coerce.support;
