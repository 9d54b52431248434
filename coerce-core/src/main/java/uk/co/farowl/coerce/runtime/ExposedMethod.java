// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodType;

/**
 * A method in the table of a {@link NamedType}, as found by
 * {@link NamedType#lookup(String)}. It wraps a {@link MethodHandle} on
 * the Java implementation, adapted so that every argument and the
 * return are {@code Object}.
 * <p>
 * An {@link MethodKind#INSTANCE INSTANCE} method receives the object on
 * which it is called as its first argument ({@code self}). A
 * {@link MethodKind#TYPE TYPE} method does not, and may be called with
 * the type or any instance as the receiver.
 */
public final class ExposedMethod {

    /** The type in which this method is defined. */
    private final NamedType owner;

    /** Name of the method as exposed. */
    private final String name;

    /** Whether the method expects a {@code self} argument. */
    private final MethodKind kind;

    /** Number of arguments, not counting {@code self}. */
    private final int arity;

    /**
     * Handle on the implementation, of type {@code (O,O,...)O} with
     * {@code arity} arguments, or {@code arity+1} if an instance method.
     */
    private final MethodHandle handle;

    /**
     * Create a method from a handle on its implementation. The handle
     * must accept {@code arity} arguments, preceded by {@code self} if
     * it is an instance method. It will be adapted to a generic type.
     *
     * @param owner type in which defined
     * @param name of the method as exposed
     * @param kind of method
     * @param mh handle on the implementation
     */
    ExposedMethod(NamedType owner, String name, MethodKind kind,
            MethodHandle mh) {
        this.owner = owner;
        this.name = name;
        this.kind = kind;
        int n = mh.type().parameterCount();
        this.arity = kind == MethodKind.INSTANCE ? n - 1 : n;
        this.handle = mh.asType(MethodType.genericMethodType(n));
    }

    /** @return the type in which this method is defined. */
    public NamedType getOwner() { return owner; }

    /** @return name of the method as exposed. */
    public String getName() { return name; }

    /** @return whether the method expects a {@code self} argument. */
    public MethodKind getKind() { return kind; }

    /** @return number of arguments, not counting {@code self}. */
    public int getArity() { return arity; }

    /**
     * Call the method with the given receiver and arguments. The
     * receiver is passed to an instance method as {@code self} and
     * ignored by a type method.
     *
     * @param self the receiver (an instance or the type)
     * @param args arguments to the method
     * @return the return from the method
     * @throws IllegalArgumentException if the number of arguments is
     *     wrong
     * @throws Throwable from the implementation
     */
    public Object call(Object self, Object... args)
            throws IllegalArgumentException, Throwable {
        if (args.length != arity) {
            throw new IllegalArgumentException(String.format(
                    "%s() takes %d arguments (%d given)", name, arity,
                    args.length));
        }
        if (kind == MethodKind.INSTANCE) {
            switch (arity) {
                case 0:
                    return handle.invokeExact(self);
                case 1:
                    return handle.invokeExact(self, args[0]);
                default:
                    Object[] all = new Object[arity + 1];
                    all[0] = self;
                    System.arraycopy(args, 0, all, 1, arity);
                    return handle.invokeWithArguments(all);
            }
        } else {
            switch (arity) {
                case 0:
                    return handle.invokeExact();
                case 1:
                    return handle.invokeExact(args[0]);
                case 2:
                    return handle.invokeExact(args[0], args[1]);
                default:
                    return handle.invokeWithArguments(args);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("<%s method '%s' of '%s' objects>",
                kind == MethodKind.INSTANCE ? "instance" : "type", name,
                owner.getName());
    }
}
