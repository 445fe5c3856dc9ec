package org.formcov.coverage;

import org.formcov.ast.Form;
import org.formcov.ast.meta.MetadataTable;
import org.formcov.eval.EvaluatorException;
import org.formcov.eval.Interpreter;
import org.formcov.instrument.FormWrapper;
import org.formcov.instrument.Probe;
import org.formcov.printer.FormPrinter;
import org.formcov.reader.FormReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoverageStoreTest {

    private CoverageStore store;
    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        store = new CoverageStore();
        interpreter = new Interpreter();
        store.install(interpreter);
    }

    @Test
    void testProbeEmitsCaptureCall() {
        Probe probe = store.forModule("my.mod");

        Form call = probe.wrap(4, Form.symbol("x"));

        assertThat(FormPrinter.print(call)).isEqualTo("(formcov.coverage/capture 0 x)");
        assertThat(store.records()).containsExactly(new CoverageRecord(0, "my.mod", 4, Form.symbol("x")));
        assertThat(store.isHit(0)).isFalse();
    }

    @Test
    void testCaptureReturnsValueAndCountsHits() {
        MetadataTable metadata = new MetadataTable();
        FormWrapper wrapper = new FormWrapper(store.forModule("m"), metadata);
        Form wrapped = wrapper.wrap(null, FormReader.readOne("(defn twice [x] (* 2 x))", metadata));

        interpreter.eval(wrapped);
        Object result = interpreter.eval(wrapper.wrap(null, FormReader.readOne("(+ (twice 1) (twice 2))", metadata)));

        assertThat(result).isEqualTo(6L);
        CoverageRecord body = store.records().stream()
                .filter(r -> FormPrinter.print(r.form()).matches("\\(\\(formcov\\.coverage/capture \\d+ \\*\\).*"))
                .findFirst()
                .orElseThrow();
        assertThat(store.hitCount(body.id())).isEqualTo(2);
        assertThat(store.hits()).hasSameSizeAs(store.records());
    }

    @Test
    void testUnevaluatedBranchIsNotHit() {
        MetadataTable metadata = new MetadataTable();
        FormWrapper wrapper = new FormWrapper(store.forModule("m"), metadata);

        interpreter.eval(wrapper.wrap(null, FormReader.readOne("(if true :then :else)", metadata)));

        assertThat(store.records())
                .filteredOn(r -> r.form().equals(Form.keyword("else")))
                .singleElement()
                .satisfies(r -> assertThat(store.isHit(r.id())).isFalse());
        assertThat(store.records())
                .filteredOn(r -> r.form().equals(Form.keyword("then")))
                .singleElement()
                .satisfies(r -> assertThat(store.isHit(r.id())).isTrue());
    }

    @Test
    void testThrowingFormIsNotHit() {
        MetadataTable metadata = new MetadataTable();
        FormWrapper wrapper = new FormWrapper(store.forModule("m"), metadata);
        Form wrapped = wrapper.wrap(null, FormReader.readOne("(/ 1 0)", metadata));

        assertThatThrownBy(() -> interpreter.eval(wrapped)).isInstanceOf(ArithmeticException.class);

        // the operator and both operands were hit, the call itself was not
        assertThat(store.hits()).hasSize(3);
        assertThat(store.isHit(store.records().size() - 1)).isFalse();
    }

    @Test
    void testRecordsPerModule() {
        store.forModule("a").wrap(1, Form.symbol("x"));
        store.forModule("b").wrap(2, Form.symbol("y"));
        store.forModule("a").wrap(3, Form.symbol("z"));

        assertThat(store.recordsFor("a")).extracting(CoverageRecord::line).containsExactly(1, 3);
        assertThat(store.record(1).module()).isEqualTo("b");
    }

    @Test
    void testUnknownProbe() {
        assertThatThrownBy(() -> store.hit(5))
                .isInstanceOf(EvaluatorException.class)
                .hasMessageContaining("Unknown probe id 5");
        assertThatThrownBy(() -> interpreter.evalString("(formcov.coverage/capture :x 1)"))
                .isInstanceOf(EvaluatorException.class)
                .hasMessageContaining("capture expects");
    }
}
