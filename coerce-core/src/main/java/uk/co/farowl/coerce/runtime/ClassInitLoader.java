// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.coerce.support.TypeSystemError;

/**
 * The built-in {@link TypeLoader}. It maps the name of a type to the
 * name of a Java class, and statically initialises that class, on the
 * assumption that the class defines the type in the usual idiom:<pre>
 * static final NamedType TYPE = NamedType.fromSpec(...);
 * </pre> The namespace separators in the type name become {@code "."},
 * and a leading root namespace is dropped, so that {@code Foo::Bar}
 * names the class {@code Foo.Bar}. The class is sought first under each
 * configured package prefix in turn, and then without a prefix.
 */
class ClassInitLoader implements TypeLoader {

    /** Logger for the loader. */
    static final Logger logger = LoggerFactory.getLogger(ClassInitLoader.class);

    /** Package prefixes to try, the last being empty. */
    private final List<String> prefixes;

    /**
     * Create a loader that will search the given packages.
     *
     * @param packages Java package names to search (may be empty)
     */
    ClassInitLoader(List<String> packages) {
        String[] p = new String[packages.size() + 1];
        int i = 0;
        for (String pkg : packages) { p[i++] = pkg + "."; }
        p[i] = "";
        this.prefixes = List.of(p);
    }

    /**
     * The name of a Java class corresponding to a type name.
     *
     * @param typeName canonical type name
     * @return Java binary name (without package prefix)
     */
    static String javaName(String typeName) {
        String root = Names.ROOT + Names.SEPARATOR;
        if (typeName.startsWith(root)) {
            typeName = typeName.substring(root.length());
        }
        return typeName.replace(Names.SEPARATOR, ".");
    }

    @Override
    public boolean load(String name) throws TypeSystemError {
        String javaName = javaName(name);
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) { cl = ClassInitLoader.class.getClassLoader(); }

        for (String prefix : prefixes) {
            String className = prefix + javaName;
            try {
                Class.forName(className, true, cl);
                logger.atDebug().setMessage("Initialised {} for type '{}'")
                        .addArgument(className).addArgument(name).log();
                return true;
            } catch (ClassNotFoundException e) {
                // Not under this prefix: try the next.
                logger.atTrace().setMessage("No class {}")
                        .addArgument(className).log();
            } catch (ExceptionInInitializerError e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new TypeSystemError(cause,
                        "failed to initialise class %s", className);
            } catch (LinkageError e) {
                throw new TypeSystemError(e, "failed to load class %s",
                        className);
            }
        }
        return false;
    }

    @Override
    public String toString() { return "ClassInitLoader" + prefixes; }
}
