// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import java.util.regex.Pattern;

/**
 * Validation of the names of types and methods, and the derivation from
 * type names of the names of the conversion methods through which types
 * declare that they may be coerced.
 * <p>
 * A type name is a sequence of identifiers separated by {@code ::} (or
 * {@code .}, which is accepted and converted to {@code ::}). A name that
 * begins with the separator is rooted explicitly in the root namespace,
 * called {@value #ROOT}. A method name is a single identifier. An
 * identifier is a letter or underscore followed by letters, digits and
 * underscores.
 * <p>
 * The validating methods return {@code null} in place of any invalid
 * name, and never throw.
 */
public final class Names {

    private Names() {} // only static methods here

    /** Name of the root namespace. */
    public static final String ROOT = "main";

    /** The canonical namespace separator. */
    public static final String SEPARATOR = "::";

    /**
     * Prefix of the name of the instance method by which a type declares
     * it may be converted <i>to</i> another type.
     */
    public static final String PUSH_PREFIX = "__as_";

    /**
     * Prefix of the name of the type method by which a type declares it
     * may be made <i>from</i> another type.
     */
    public static final String PULL_PREFIX = "__from_";

    private static final String IDENTIFIER = "[A-Za-z_]\\w*";

    private static final Pattern METHOD_NAME =
            Pattern.compile("\\A" + IDENTIFIER + "\\z");

    private static final Pattern TYPE_NAME = Pattern.compile(
            "\\A" + IDENTIFIER + "(?:(?:::|\\.)" + IDENTIFIER + ")*\\z");

    /** Any separator, for flattening a type name. */
    private static final Pattern ANY_SEPARATOR = Pattern.compile("::|\\.");

    /**
     * Validate a method name. The name must be a single identifier.
     *
     * @param name candidate (any object)
     * @return {@code name} if valid, otherwise {@code null}
     */
    public static String methodName(Object name) {
        if (name instanceof String s && METHOD_NAME.matcher(s).matches()) {
            return s;
        }
        return null;
    }

    /**
     * Validate a type name and return it in canonical form. The special
     * name {@code "::"} is the root namespace itself, and a name
     * beginning {@code "::"} is made to begin with the root namespace.
     * The separator {@code "."} is replaced with {@code "::"}.
     *
     * @param name candidate (any object)
     * @return canonical {@code name} if valid, otherwise {@code null}
     */
    public static String typeName(Object name) {
        if (!(name instanceof String)) { return null; }
        String s = (String)name;
        if (s.equals(SEPARATOR)) {
            return ROOT;
        } else if (s.startsWith(SEPARATOR)) {
            s = ROOT + s;
        }
        if (TYPE_NAME.matcher(s).matches()) {
            return s.indexOf('.') < 0 ? s : s.replace(".", SEPARATOR);
        }
        return null;
    }

    /**
     * Replace every namespace separator in a type name by an underscore,
     * so that it may be part of a method name.
     *
     * @param typeName a valid type name
     * @return the flattened name
     */
    public static String flatten(String typeName) {
        return ANY_SEPARATOR.matcher(typeName).replaceAll("_");
    }

    /**
     * The name of the instance method a type must expose to declare that
     * its instances may be converted to the named type. For the type
     * {@code Foo::Bar} this is {@code __as_Foo_Bar}.
     *
     * @param targetName valid name of the type converted to
     * @return name of the conversion method
     */
    public static String pushMethodName(String targetName) {
        return PUSH_PREFIX + flatten(targetName);
    }

    /**
     * The name of the type method a type must expose to declare that it
     * may make an instance of itself from an instance of the named type.
     * For the type {@code Foo::Bar} this is {@code __from_Foo_Bar}.
     *
     * @param sourceName valid name of the type converted from
     * @return name of the conversion method
     */
    public static String pullMethodName(String sourceName) {
        return PULL_PREFIX + flatten(sourceName);
    }
}
