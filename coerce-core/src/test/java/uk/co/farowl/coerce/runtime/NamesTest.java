// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coerce.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.params.provider.Arguments.arguments;

import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Test the validation of names and the derivation of the names of
 * conversion methods.
 */
@DisplayName("Names")
class NamesTest {

    @Nested
    @DisplayName("of methods")
    class MethodNames {

        @DisplayName("are accepted when a single identifier")
        @ParameterizedTest(name = "\"{0}\"")
        @ValueSource(strings = {"foo", "_Bar", "__as_Foo_Bar", "x1", "_"})
        void accepted(String name) {
            assertEquals(name, Names.methodName(name));
        }

        @DisplayName("are rejected otherwise")
        @ParameterizedTest(name = "\"{0}\"")
        @ValueSource(strings = {"", "foo::bar", "1abc", "foo.bar", "a b",
                "foo-bar", "::", "foo\n"})
        void rejected(String name) {
            assertNull(Names.methodName(name));
        }

        @Test
        @DisplayName("are rejected if not a String")
        void rejectedNotString() {
            assertNull(Names.methodName(null));
            assertNull(Names.methodName(42));
            assertNull(Names.methodName(new StringBuilder("foo")));
        }
    }

    @Nested
    @DisplayName("of types")
    class TypeNames {

        static Stream<Arguments> accepted() {
            return Stream.of( //
                    arguments("foo", "foo"), //
                    arguments("foo::bar", "foo::bar"), //
                    arguments("::", Names.ROOT), //
                    arguments("::bar", Names.ROOT + "::bar"), //
                    arguments("Foo::Bar::Baz", "Foo::Bar::Baz"), //
                    arguments("Foo.Bar", "Foo::Bar"), //
                    arguments("a.b::c", "a::b::c"), //
                    arguments("_x::_y1", "_x::_y1"));
        }

        @DisplayName("are accepted in canonical form")
        @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
        @MethodSource
        void accepted(String name, String expected) {
            assertEquals(expected, Names.typeName(name));
        }

        @DisplayName("are rejected when malformed")
        @ParameterizedTest(name = "\"{0}\"")
        @ValueSource(strings = {"", "1abc", "foo::", "foo::::bar", "foo:bar",
                "foo::1", "::::", ".", "foo..bar", "foo bar", ":::foo"})
        void rejected(String name) {
            assertNull(Names.typeName(name));
        }

        @Test
        @DisplayName("are rejected if not a String")
        void rejectedNotString() {
            assertNull(Names.typeName(null));
            assertNull(Names.typeName(Integer.valueOf(1)));
        }
    }

    @Nested
    @DisplayName("of conversion methods")
    class ConversionNames {

        @Test
        void push() {
            assertEquals("__as_Bar", Names.pushMethodName("Bar"));
            assertEquals("__as_Foo_Bar", Names.pushMethodName("Foo::Bar"));
            assertEquals("__as_main_x", Names.pushMethodName("main::x"));
        }

        @Test
        void pull() {
            assertEquals("__from_Foo", Names.pullMethodName("Foo"));
            assertEquals("__from_a_b_c", Names.pullMethodName("a::b::c"));
        }

        @Test
        @DisplayName("flatten either separator")
        void flatten() {
            assertEquals("a_b_c", Names.flatten("a::b.c"));
            assertEquals("abc", Names.flatten("abc"));
        }
    }
}
