package org.formcov.benchmark;

import java.util.concurrent.TimeUnit;

import org.formcov.ast.Form;
import org.formcov.ast.meta.MetadataTable;
import org.formcov.coverage.CoverageStore;
import org.formcov.instrument.FormWrapper;
import org.formcov.normalize.Normalizer;
import org.formcov.reader.FormReader;
import org.openjdk.jmh.annotations.*;

/**
 * Measures the purely structural rewrite: classification, desugaring and probe insertion, with nothing
 * evaluated.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
public class WrapBenchmark {

    static final String SMALL = "(def total (+ 1 2 3))";

    static final String LARGE = "(defn classify [n]\n"
                                + "  (let [small (< n 10)\n"
                                + "        parity (if (even? n) :even :odd)]\n"
                                + "    (cond\n"
                                + "      (zero? n) {:kind :zero}\n"
                                + "      small {:kind :small, :parity parity, :digits [n]}\n"
                                + "      :else (-> {:kind :large, :parity parity}\n"
                                + "                (assoc :text (.toString (StringBuilder. (str n))))\n"
                                + "                (assoc :twice (loop [i 0 acc 0] (if (< i 2) (recur (inc i) (+ acc n)) acc)))))))";

    @State(Scope.Thread)
    public static class SmallFormState {

        MetadataTable metadata;
        Form form;
        FormWrapper wrapper;

        @Setup(Level.Invocation)
        public void read() {
            metadata = new MetadataTable();
            form = FormReader.readOne(SMALL, metadata);
            wrapper = new FormWrapper(new CoverageStore().forModule("bench.small"), metadata, new Normalizer(), false);
        }
    }

    @State(Scope.Thread)
    public static class LargeFormState {

        MetadataTable metadata;
        Form form;
        FormWrapper wrapper;

        @Setup(Level.Invocation)
        public void read() {
            metadata = new MetadataTable();
            form = FormReader.readOne(LARGE, metadata);
            wrapper = new FormWrapper(new CoverageStore().forModule("bench.large"), metadata, new Normalizer(), false);
        }
    }

    @Benchmark
    public Form wrapSmallForm(SmallFormState state) {
        return state.wrapper.wrap(null, state.form);
    }

    @Benchmark
    public Form wrapLargeForm(LargeFormState state) {
        return state.wrapper.wrap(null, state.form);
    }
}
