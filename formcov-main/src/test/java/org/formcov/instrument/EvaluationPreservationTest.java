package org.formcov.instrument;

import org.formcov.ast.Form;
import org.formcov.ast.meta.MetadataTable;
import org.formcov.eval.Interpreter;
import org.formcov.reader.FormReader;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wrapping every form in {@code (do form)} must not change what it evaluates to.
 */
class EvaluationPreservationTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "(+ 1 2)",
            "[1 (inc 1) {:k (str \"v\")}]",
            "(let [a 2 b 3] (* a b))",
            "(loop [i 0 acc 0] (if (< i 5) (recur (inc i) (+ acc i)) acc))",
            "((fn [x] (* x x)) 7)",
            "((fn f ([] (f 1)) ([x] (+ x 10))))",
            "(do (defn fact [n] (if (zero? n) 1 (* n (fact (dec n))))) (fact 6))",
            "(do (def v 3) (* v v))",
            "(str \"a\" :b 1)",
            "(.toUpperCase \"abc\")",
            "(. \"abcdef\" (substring 1 (+ 1 2)))",
            "(Math/max 1 2)",
            "(.size (new java.util.ArrayList [1 2 3]))",
            "(:a {:a 1})",
            "(cond false 1 :else 2)",
            "(and 1 nil)",
            "(-> 5 inc (* 2))",
            "(when (pos? 1) :yes)",
            "(try (/ 1 0) (catch ArithmeticException e :caught))",
            "(quote (a b c))",
            "(if-let [x (get {:k 4} :k)] (* x x) 0)",
            "(dotimes [i 3] i)",
            "(let [and (fn [a b] :called)] (and false 1))",
            "((fn [when] (when 1 2)) (fn [a b] (+ a b)))",
            "((fn and [x] (if (= x 0) :done (and (dec x)))) 2)",
            "(loop [or (fn [x] (* x 2)) n 0] (if (< n 2) (recur or (inc n)) (or n)))",
            "(do (let [and (fn [a b] :called)] (and 1 2)) (and false 1))"
    })
    void testWrappingPreservesValue(String source) {
        Probe probe = (line, form) -> Form.list(Form.symbol("do"), form);
        MetadataTable metadata = new MetadataTable();
        Form form = FormReader.readOne(source, metadata);

        Object expected = new Interpreter().eval(form);
        Object actual = new Interpreter().eval(new FormWrapper(probe, metadata).wrap(null, form));

        assertThat(actual).isEqualTo(expected);
    }
}
