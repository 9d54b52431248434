package uk.co.farowl.coercebm;

import java.lang.invoke.MethodHandles;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import uk.co.farowl.coerce.runtime.Coercion;
import uk.co.farowl.coerce.runtime.CoercionImport;
import uk.co.farowl.coerce.runtime.ExposedMethod;
import uk.co.farowl.coerce.runtime.NamedType;
import uk.co.farowl.coerce.runtime.TypeSpec;

/**
 * This is a JMH benchmark for coercion once the directive for each pair
 * of types is in the cache.
 *
 * The target is {@link Coercion#coerce(String, Object)}, and the helper
 * a type may install with {@link CoercionImport}. Comparison is with
 * the time for the equivalent in-line Java: a type test, or a direct
 * call of the conversion method.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)

@Fork(2)
@Warmup(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)

@State(Scope.Thread)
public class CoerceBenchmark {

    /** The target type. */
    public static class Bar {
        static final NamedType TYPE = NamedType.fromSpec(
                new TypeSpec("Bench::Bar", MethodHandles.lookup()));
    }

    /** Converts to {@code Bar} by a push method. */
    public static class Foo {
        static final NamedType TYPE = NamedType.fromSpec(
                new TypeSpec("Bench::Foo", MethodHandles.lookup()));

        Bar __as_Bench_Bar() { return new Bar(); }
    }

    /** Does not convert to {@code Bar}. */
    public static class Baz {
        static final NamedType TYPE = NamedType.fromSpec(
                new TypeSpec("Bench::Baz", MethodHandles.lookup()));
    }

    /** A consumer with an installed helper. */
    public static class Consumer {
        static final NamedType TYPE = NamedType.fromSpec(
                new TypeSpec("Bench::Consumer", MethodHandles.lookup())
                        .use("_Bar", "Bench::Bar"));
    }

    // Bar must be defined before Consumer can install its helper
    static final NamedType BAR = Bar.TYPE;
    static final ExposedMethod HELPER = Consumer.TYPE.lookup("_Bar");

    // Copies of type Object to avoid any static specialisation
    Object bar = new Bar(), foo = new Foo(), baz = new Baz();
    Foo javaFoo = new Foo();

    public CoerceBenchmark() {
        // Put each pair in the cache before measurement
        Coercion.coerce("Bench::Bar", foo);
        Coercion.coerce("Bench::Bar", baz);
    }

    @Benchmark
    @Fork(4)  // Needs a lot of iterations to resolve short times
    @Measurement(iterations = 50)
    public Object identity_java() {
        return bar instanceof Bar ? bar : null;
    }

    @Benchmark
    public Object identity() { return Coercion.coerce("Bench::Bar", bar); }

    @Benchmark
    public Object identity_type() { return Coercion.coerce(BAR, bar); }

    @Benchmark
    @Fork(4)  // Needs a lot of iterations to resolve short times
    @Measurement(iterations = 50)
    public Object push_java() { return javaFoo.__as_Bench_Bar(); }

    @Benchmark
    public Object push() { return Coercion.coerce("Bench::Bar", foo); }

    @Benchmark
    public Object push_helper() throws Throwable {
        return HELPER.call(Consumer.TYPE, foo);
    }

    @Benchmark
    public Object none() { return Coercion.coerce("Bench::Bar", baz); }
}
