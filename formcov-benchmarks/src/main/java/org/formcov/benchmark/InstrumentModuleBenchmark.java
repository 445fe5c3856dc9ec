package org.formcov.benchmark;

import java.util.concurrent.TimeUnit;

import org.formcov.InstrumentedModule;
import org.formcov.Instrumenter;
import org.formcov.eval.Interpreter;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Measures instrumenting a whole module end to end: reading, wrapping and evaluating every top-level form.
 * The baseline evaluates the same module without probes.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dformcov.instrument.strict=false"
})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class InstrumentModuleBenchmark {

    static final String MODULE = "bench.sample";

    @State(Scope.Thread)
    public static class InstrumenterState {

        Instrumenter instrumenter;

        // Definitions accumulate in the interpreter, so every invocation starts from a fresh one.
        @Setup(Level.Invocation)
        public void create() {
            instrumenter = Instrumenter.builder().build();
        }
    }

    @State(Scope.Thread)
    public static class InterpreterState {

        Interpreter interpreter;
        String source;

        @Setup(Level.Trial)
        public void load() {
            source = BenchmarkSources.load(Instrumenter.resourcePath(MODULE));
        }

        @Setup(Level.Invocation)
        public void create() {
            interpreter = new Interpreter();
        }
    }

    @Benchmark
    public void instrumentModule(InstrumenterState state, Blackhole blackhole) {
        InstrumentedModule module = state.instrumenter.instrument(MODULE);
        blackhole.consume(module);
        blackhole.consume(state.instrumenter.getCoverage().hits());
    }

    @Benchmark
    public Object evaluateUninstrumented(InterpreterState state) {
        return state.interpreter.evalString(state.source);
    }
}
