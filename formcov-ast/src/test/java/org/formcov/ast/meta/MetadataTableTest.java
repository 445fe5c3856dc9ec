package org.formcov.ast.meta;

import org.formcov.ast.Form;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataTableTest {

    @Test
    void equalFormsKeepSeparateMetadata() {
        MetadataTable table = new MetadataTable();
        Form.Symbol first = Form.symbol("x");
        Form.Symbol second = Form.symbol("x");

        table.put(first, Metadata.ofLine(3));
        table.put(second, Metadata.ofLine(7));

        assertThat(first).isEqualTo(second);
        assertThat(table.line(first)).isEqualTo(3);
        assertThat(table.line(second)).isEqualTo(7);
    }

    @Test
    void literalsNeverCarryMetadata() {
        MetadataTable table = new MetadataTable();
        Form.Num one = Form.number(1);

        Form.Num returned = table.put(one, Metadata.ofLine(1));

        assertThat(returned).isSameAs(one);
        assertThat(table.contains(one)).isFalse();
        assertThat(table.get(one)).isSameAs(Metadata.EMPTY);
    }

    @Test
    void emptyMetadataRemovesEntry() {
        MetadataTable table = new MetadataTable();
        Form.ListForm list = Form.list(Form.symbol("f"));
        table.put(list, Metadata.ofLine(2));

        table.vary(list, m -> m.without(Metadata.LINE));

        assertThat(table.contains(list)).isFalse();
        assertThat(table.size()).isZero();
    }

    @Test
    void mergeLayersOtherOnTop() {
        Metadata base = Metadata.ofLine(1).with(Metadata.COLUMN, 4);
        Metadata top = Metadata.of(Metadata.COLUMN, 9).with(Metadata.SOURCE, "a.clj");

        Metadata merged = base.merge(top);

        assertThat(merged.line()).isEqualTo(1);
        assertThat(merged.get(Metadata.COLUMN)).isEqualTo(9);
        assertThat(merged.get(Metadata.SOURCE)).isEqualTo("a.clj");
        assertThat(base.get(Metadata.COLUMN)).isEqualTo(4);
    }

    @Test
    void nullLineIsPresentButUnknown() {
        Metadata metadata = Metadata.of(Metadata.LINE, null);

        assertThat(metadata.containsKey(Metadata.LINE)).isTrue();
        assertThat(metadata.line()).isNull();
        assertThat(metadata.without(Metadata.LINE).isEmpty()).isTrue();
    }
}
