package org.formcov.ast;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormTest {

    @Test
    void symbolSplitsNamespace() {
        Form.Symbol qualified = Form.symbol("formcov.coverage/capture");
        assertThat(qualified.namespace()).isEqualTo("formcov.coverage");
        assertThat(qualified.name()).isEqualTo("capture");
        assertThat(qualified.fullName()).isEqualTo("formcov.coverage/capture");

        Form.Symbol division = Form.symbol("/");
        assertThat(division.isQualified()).isFalse();
        assertThat(division.name()).isEqualTo("/");
    }

    @Test
    void listsCompareStructurally() {
        Form first = Form.list(Form.symbol("+"), Form.number(1), Form.number(2));
        Form second = Form.list(Form.symbol("+"), Form.number(1), Form.number(2));

        assertThat(first).isEqualTo(second).isNotSameAs(second);
        assertThat(first).isNotEqualTo(Form.vector(Form.symbol("+"), Form.number(1), Form.number(2)));
    }

    @Test
    void listHelpers() {
        Form.ListForm list = Form.list(Form.symbol("def"), Form.symbol("x"), Form.number(1));

        assertThat(list.headSymbol()).contains(Form.symbol("def"));
        assertThat(list.drop(1)).containsExactly(Form.symbol("x"), Form.number(1));
        assertThat(list.drop(5)).isEmpty();
        assertThat(Form.list().headSymbol()).isEmpty();
    }

    @Test
    void mapNeedsPairs() {
        assertThatThrownBy(() -> Form.map(Form.keyword("a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("even number");
    }

    @Test
    void onlyContainersAndSymbolsCarryMetadata() {
        assertThat(Form.symbol("x").isMetadataCapable()).isTrue();
        assertThat(Form.list().isMetadataCapable()).isTrue();
        assertThat(Form.vector().isMetadataCapable()).isTrue();
        assertThat(Form.keyword("k").isMetadataCapable()).isFalse();
        assertThat(Form.number(1).isMetadataCapable()).isFalse();
        assertThat(Form.nil().isMetadataCapable()).isFalse();
    }
}
