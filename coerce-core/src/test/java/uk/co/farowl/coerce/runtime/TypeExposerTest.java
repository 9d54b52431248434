// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.invoke.MethodHandles;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import uk.co.farowl.coerce.runtime.Exposed.InstanceMethod;
import uk.co.farowl.coerce.runtime.Exposed.TypeMethod;
import uk.co.farowl.coerce.support.TypeSystemError;

/**
 * Test that the methods of a type defined in Java, identified by the
 * annotations in {@link Exposed} or by their reserved names, are
 * entered in the type with the expected characteristics, and that
 * definitions we cannot support are rejected.
 */
@DisplayName("A type defined in Java")
class TypeExposerTest extends UnitTestSupport {

    /** A class with one of each kind of method. */
    static class Exhibit {
        static final NamedType TYPE = NamedType.fromSpec(
                new TypeSpec("Exposer::Exhibit", MethodHandles.lookup())
                        .doc("A type with one of everything."));

        final int value;

        Exhibit(int value) { this.value = value; }

        @InstanceMethod
        Object value() { return value; }

        @InstanceMethod("plus")
        Object add(Object other) { return value + (Integer)other; }

        @TypeMethod
        static Object make(Object v) { return new Exhibit((Integer)v); }

        @TypeMethod("sum3")
        static Object sum(Object a, Object b, Object c) {
            return (Integer)a + (Integer)b + (Integer)c;
        }

        // Reserved name: an instance method without annotation
        Object __as_Exposer_Other() { return "other"; }

        // Reserved name, static: the first parameter is self
        static Object __as_Exposer_Third(Exhibit self) {
            return "third " + self.value;
        }

        // Reserved name: a type method without annotation
        static Object __from_Exposer_Other(Object o) {
            return new Exhibit(-1);
        }

        // Not exposed
        Object hidden() { return "hidden"; }
    }

    /** A sub-type adding a method and overriding another. */
    static class Extended extends Exhibit {
        static final NamedType TYPE = NamedType.fromSpec(
                new TypeSpec("Exposer::Extended", MethodHandles.lookup())
                        .base(Exhibit.TYPE));

        Extended(int value) { super(value); }

        @Override
        @InstanceMethod
        Object value() { return 100 + value; }

        @InstanceMethod
        Object extra() { return "extra"; }
    }

    @Nested
    @DisplayName("exposes")
    class Exposes {

        @Test
        @DisplayName("an annotated instance method")
        void instanceMethod() throws Throwable {
            ExposedMethod m = Exhibit.TYPE.lookup("value");
            assertNotNull(m);
            assertEquals(MethodKind.INSTANCE, m.getKind());
            assertEquals(0, m.getArity());
            assertSame(Exhibit.TYPE, m.getOwner());
            assertEquals(42, m.call(new Exhibit(42)));
        }

        @Test
        @DisplayName("an annotated instance method under another name")
        void renamedInstanceMethod() throws Throwable {
            assertNull(Exhibit.TYPE.lookup("add"));
            ExposedMethod m = Exhibit.TYPE.lookup("plus");
            assertEquals(1, m.getArity());
            assertEquals(5, m.call(new Exhibit(2), 3));
        }

        @Test
        @DisplayName("annotated type methods")
        void typeMethods() throws Throwable {
            ExposedMethod m = Exhibit.TYPE.lookup("make");
            assertEquals(MethodKind.TYPE, m.getKind());
            assertEquals(1, m.getArity());
            Object r = m.call(Exhibit.TYPE, 7);
            assertEquals(7, ((Exhibit)r).value);

            ExposedMethod s = Exhibit.TYPE.lookup("sum3");
            assertEquals(3, s.getArity());
            assertEquals(6, s.call(null, 1, 2, 3));
        }

        @Test
        @DisplayName("conversion methods by their names")
        void conversionMethods() throws Throwable {
            ExposedMethod push = Exhibit.TYPE.lookup("__as_Exposer_Other");
            assertEquals(MethodKind.INSTANCE, push.getKind());
            assertEquals(0, push.getArity());
            assertEquals("other", push.call(new Exhibit(1)));

            ExposedMethod third = Exhibit.TYPE.lookup("__as_Exposer_Third");
            assertEquals(MethodKind.INSTANCE, third.getKind());
            assertEquals(0, third.getArity());
            assertEquals("third 3", third.call(new Exhibit(3)));

            ExposedMethod pull = Exhibit.TYPE.lookup("__from_Exposer_Other");
            assertEquals(MethodKind.TYPE, pull.getKind());
            assertEquals(1, pull.getArity());
        }

        @Test
        @DisplayName("nothing else")
        void hidden() {
            assertNull(Exhibit.TYPE.lookup("hidden"));
            assertFalse(NamedType.exposes("Exposer::Exhibit", "hidden"));
            assertTrue(NamedType.exposes("Exposer::Exhibit", "value"));
            assertFalse(NamedType.exposes("Exposer::Nowhere", "value"));
        }

        @Test
        @DisplayName("methods inherited along the MRO")
        void inherited() throws Throwable {
            NamedType t = Extended.TYPE;
            assertSame(Exhibit.TYPE, t.lookup("plus").getOwner());
            assertSame(t, t.lookup("value").getOwner());
            assertFalse(t.definesOwn("plus"));
            assertTrue(t.definesOwn("extra"));
            assertEquals(101, t.lookup("value").call(new Extended(1)));
            assertEquals(3, t.lookup("plus").call(new Extended(1), 2));
        }
    }

    @Nested
    @DisplayName("has")
    class Attributes {

        @Test
        void name() { assertEquals("Exposer::Exhibit", Exhibit.TYPE.getName()); }

        @Test
        void mro() {
            assertEquals(List.of(Extended.TYPE, Exhibit.TYPE),
                    Extended.TYPE.getMRO());
            assertEquals(List.of(Exhibit.TYPE),
                    Extended.TYPE.getBases());
        }

        @Test
        @DisplayName("instances recognised by their Java class")
        void typeOf() {
            assertSame(Exhibit.TYPE, NamedType.of(new Exhibit(1)));
            assertSame(Extended.TYPE, NamedType.of(new Extended(1)));
            assertSame(Exhibit.class, Exhibit.TYPE.javaClass());
            assertTrue(Exhibit.TYPE.check(new Extended(1)));
            assertFalse(Extended.TYPE.check(new Exhibit(1)));
            assertNull(NamedType.of("a String"));
        }

        @Test
        @DisplayName("a string representation")
        void string() {
            assertEquals("<type 'Exposer::Exhibit'>", Exhibit.TYPE.toString());
        }
    }

    @Test
    @DisplayName("checks the number of arguments in a call")
    void wrongArity() {
        ExposedMethod m = Exhibit.TYPE.lookup("plus");
        assertThrows(IllegalArgumentException.class,
                () -> m.call(new Exhibit(1)));
        assertThrows(IllegalArgumentException.class,
                () -> m.call(new Exhibit(1), 1, 2));
    }

    // Definitions that must be rejected -------------------------------

    static class BothAnnotations {
        @InstanceMethod
        @TypeMethod
        static Object f(Object x) { return x; }
    }

    static class TypeMethodNotStatic {
        @TypeMethod
        Object f(Object x) { return x; }
    }

    static class PullNotStatic {
        Object __from_Exposer_Other(Object x) { return x; }
    }

    static class StaticPushWithoutSelf {
        static Object __as_Exposer_Other() { return null; }
    }

    static class Repeated {
        @InstanceMethod("f")
        Object f1() { return 1; }

        @InstanceMethod("f")
        Object f2() { return 2; }
    }

    static class IllegalName {
        @InstanceMethod("not a name")
        Object f() { return 1; }
    }

    @DisplayName("rejects a definition that")
    @ParameterizedTest(name = "{0}")
    @ValueSource(classes = {BothAnnotations.class, TypeMethodNotStatic.class,
            PullNotStatic.class, StaticPushWithoutSelf.class, Repeated.class,
            IllegalName.class})
    void rejects(Class<?> impl) {
        String name = "Exposer::Bad" + impl.getSimpleName();
        TypeSpec spec = new TypeSpec(name, MethodHandles.lookup(), false)
                .primary(Instance.class).methodImpls(impl);
        assertThrows(TypeSystemError.class, () -> NamedType.fromSpec(spec));
        assertFalse(NamedType.isLoaded(name));
    }

    @Test
    @DisplayName("must have a valid name")
    void invalidName() {
        assertThrows(TypeSystemError.class,
                () -> new TypeSpec("1abc", MethodHandles.lookup()));
    }

    @Test
    @DisplayName("may not be defined twice")
    void defineTwice() {
        assertNotNull(Exhibit.TYPE);
        TypeSpec spec = new TypeSpec("Exposer::Exhibit",
                MethodHandles.lookup(), false).primary(Instance.class);
        assertThrows(TypeSystemError.class, () -> NamedType.fromSpec(spec));
    }

    @Test
    @DisplayName("may not be changed once defined")
    void frozen() {
        TypeSpec spec = new TypeSpec("Exposer::Frozen",
                MethodHandles.lookup(), false).primary(Instance.class);
        NamedType t = NamedType.fromSpec(spec);
        assertNotNull(t);
        assertThrows(TypeSystemError.class, () -> spec.doc("too late"));
    }
}
