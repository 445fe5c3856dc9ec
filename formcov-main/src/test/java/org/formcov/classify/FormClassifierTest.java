package org.formcov.classify;

import org.formcov.ast.Form;
import org.formcov.ast.meta.MetadataTable;
import org.formcov.reader.FormReader;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FormClassifierTest {

    private static FormType classify(String source) {
        return FormClassifier.classify(FormReader.readOne(source, new MetadataTable()));
    }

    @Test
    void testStopForms() {
        assertThat(classify("(quote (a b))")).isEqualTo(FormType.STOP);
        assertThat(classify("(var x)")).isEqualTo(FormType.STOP);
        assertThat(classify("(catch Exception e e)")).isEqualTo(FormType.STOP);
        assertThat(classify("(finally (f))")).isEqualTo(FormType.STOP);
        assertThat(classify("(set! x 1)")).isEqualTo(FormType.STOP);
        assertThat(classify("(import* \"java.util.List\")")).isEqualTo(FormType.STOP);
        assertThat(classify("(clojure.core/import* \"java.util.List\")")).isEqualTo(FormType.STOP);
        assertThat(classify("(deftest t (f))")).isEqualTo(FormType.STOP);
    }

    @Test
    void testStopSymbolsOnlyStopWhenBare() {
        assertThat(classify("if")).isEqualTo(FormType.STOP);
        assertThat(classify("recur")).isEqualTo(FormType.STOP);
        assertThat(classify("monitor-enter")).isEqualTo(FormType.STOP);
        // a list headed by a special form is still descended into
        assertThat(classify("(if a b c)")).isEqualTo(FormType.COMPOUND);
        assertThat(classify("(do a b)")).isEqualTo(FormType.COMPOUND);
        assertThat(classify("(try a)")).isEqualTo(FormType.COMPOUND);
    }

    @Test
    void testAtoms() {
        assertThat(classify("x")).isEqualTo(FormType.ATOMIC);
        assertThat(classify("clojure.core/inc")).isEqualTo(FormType.ATOMIC);
        assertThat(classify("42")).isEqualTo(FormType.ATOMIC);
        assertThat(classify("\"text\"")).isEqualTo(FormType.ATOMIC);
        assertThat(classify(":kw")).isEqualTo(FormType.ATOMIC);
        assertThat(classify("\\c")).isEqualTo(FormType.ATOMIC);
        assertThat(classify("true")).isEqualTo(FormType.ATOMIC);
        assertThat(classify("nil")).isEqualTo(FormType.ATOMIC);
    }

    @Test
    void testContainers() {
        assertThat(classify("[1 2]")).isEqualTo(FormType.STRUCTURAL);
        assertThat(classify("{:a 1}")).isEqualTo(FormType.STRUCTURAL);
        assertThat(classify("#{1}")).isEqualTo(FormType.DEFAULT);
    }

    @Test
    void testHeadedLists() {
        assertThat(classify("(let* [a 1] a)")).isEqualTo(FormType.BINDING);
        assertThat(classify("(loop* [a 1] a)")).isEqualTo(FormType.BINDING);
        assertThat(classify("(def x 1)")).isEqualTo(FormType.DEFINITION);
        assertThat(classify("(new StringBuilder)")).isEqualTo(FormType.CONSTRUCTOR_CALL);
        assertThat(classify("(. s length)")).isEqualTo(FormType.MEMBER_ACCESS);
        assertThat(classify("(fn [x] x)")).isEqualTo(FormType.FUNCTION);
        assertThat(classify("(fn* f [x] x)")).isEqualTo(FormType.FUNCTION);
    }

    @Test
    void testCompound() {
        assertThat(classify("(f 1 2)")).isEqualTo(FormType.COMPOUND);
        assertThat(classify("(let [a 1] a)")).isEqualTo(FormType.COMPOUND);
        assertThat(classify("((f) 1)")).isEqualTo(FormType.COMPOUND);
        assertThat(classify("(1 2)")).isEqualTo(FormType.COMPOUND);
        assertThat(classify("()")).isEqualTo(FormType.COMPOUND);
    }

    @Test
    void testClassificationIsStable() {
        Form form = FormReader.readOne("(let* [a (f)] a)", new MetadataTable());

        assertThat(FormClassifier.classify(form)).isEqualTo(FormClassifier.classify(form));
    }

    @Test
    void testIsHeadedBy() {
        Form form = FormReader.readOne("(catch Exception e)", new MetadataTable());

        assertThat(FormClassifier.isHeadedBy(form, "catch")).isTrue();
        assertThat(FormClassifier.isHeadedBy(form, "finally")).isFalse();
        assertThat(FormClassifier.isHeadedBy(Form.symbol("catch"), "catch")).isFalse();
        assertThat(FormClassifier.isHeadedBy(Form.list(), "catch")).isFalse();
    }
}
