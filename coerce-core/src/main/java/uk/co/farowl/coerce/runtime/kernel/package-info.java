// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/**
 * The kernel of the type system: type objects, the factory that makes
 * them and the registry in which they are published. Although some
 * classes here are public (because the run-time package must use
 * them), this package is not API.
 */
package uk.co.farowl.coerce.runtime.kernel;
