package org.formcov.instrument;

import org.formcov.ast.Form;
import org.formcov.ast.meta.Metadata;
import org.formcov.ast.meta.MetadataTable;
import org.formcov.reader.FormReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataPropagatorTest {

    private MetadataTable metadata;
    private MetadataPropagator propagator;

    @BeforeEach
    void setUp() {
        metadata = new MetadataTable();
        propagator = new MetadataPropagator(metadata);
    }

    @Test
    void testPropagatesHintToFormsWithoutLine() {
        Form.Symbol f = Form.symbol("f");
        Form.Num one = Form.number(1);
        Form.VectorForm vector = Form.vector(Form.symbol("x"));
        Form.ListForm form = Form.list(f, one, vector);

        propagator.propagateLine(5, form);

        assertThat(metadata.line(form)).isEqualTo(5);
        assertThat(metadata.line(f)).isEqualTo(5);
        assertThat(metadata.line(vector)).isEqualTo(5);
        assertThat(metadata.line(vector.get(0))).isEqualTo(5);
        assertThat(metadata.contains(one)).isFalse();
    }

    @Test
    void testOwnLineWinsAndIsInherited() {
        Form.Symbol inner = Form.symbol("y");
        Form.ListForm nested = metadata.put(Form.list(Form.symbol("g"), inner), Metadata.ofLine(7));
        Form.ListForm form = Form.list(Form.symbol("f"), nested);

        propagator.propagateLine(5, form);

        assertThat(metadata.line(form)).isEqualTo(5);
        assertThat(metadata.line(nested)).isEqualTo(7);
        assertThat(metadata.line(inner)).isEqualTo(7);
    }

    @Test
    void testUnknownLineIsNotRecorded() {
        Form.ListForm form = Form.list(Form.symbol("f"));

        propagator.propagateLine(null, form);

        assertThat(metadata.contains(form)).isFalse();
        assertThat(metadata.contains(form.get(0))).isFalse();
    }

    @Test
    void testMergeProvenance() {
        Form original = FormReader.readOne("\n(when a b)", metadata);
        Form.ListForm rewritten = Form.list(Form.symbol("if"), Form.symbol("a"), Form.symbol("b"));

        propagator.mergeProvenance(original, rewritten);

        Metadata meta = metadata.get(rewritten);
        assertThat(meta.line()).isEqualTo(2);
        assertThat(meta.get(Metadata.COLUMN)).isEqualTo(1);
        assertThat(meta.get(Metadata.SOURCE)).isEqualTo("<string>");
        assertThat(meta.original()).containsSame(original);
        assertThat(metadata.line(rewritten.get(1))).isEqualTo(2);
    }

    @Test
    void testMergeProvenanceWithoutLine() {
        Form.ListForm original = Form.list(Form.symbol("when"), Form.symbol("a"));
        Form.ListForm rewritten = Form.list(Form.symbol("if"), Form.symbol("a"), Form.nil());

        propagator.mergeProvenance(original, rewritten);

        Metadata meta = metadata.get(rewritten);
        assertThat(meta.containsKey(Metadata.LINE)).isFalse();
        assertThat(meta.original()).containsSame(original);
    }

    @Test
    void testMergeProvenanceKeepsRewrittenLine() {
        Form original = FormReader.readOne("(when a b)", metadata);
        Form.ListForm rewritten = metadata.put(Form.list(Form.symbol("if")), Metadata.ofLine(9));

        propagator.mergeProvenance(original, rewritten);

        assertThat(metadata.line(rewritten)).isEqualTo(9);
    }

    @Test
    void testLiteralsPassThrough() {
        Form.Num number = Form.number(3);

        assertThat(propagator.mergeProvenance(Form.symbol("x"), number)).isSameAs(number);
        assertThat(metadata.size()).isZero();
    }
}
