package org.formcov.reader;

import org.formcov.FormReadException;
import org.formcov.ast.Form;
import org.formcov.ast.meta.Metadata;
import org.formcov.ast.meta.MetadataTable;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormReaderTest {

    @Test
    void testAtoms() {
        List<Form> forms = FormReader.readAll("foo ns/bar :kw \"s\\\"q\\n\" \\a \\newline 42 -7 1.5 2e3 12N 1.25M true false nil",
                                              new MetadataTable());

        assertThat(forms).containsExactly(
                Form.symbol("foo"),
                new Form.Symbol("ns", "bar"),
                Form.keyword("kw"),
                Form.string("s\"q\n"),
                new Form.Char('a'),
                new Form.Char('\n'),
                Form.number(42),
                Form.number(-7),
                Form.number(1.5),
                Form.number(2000.0),
                new Form.Num(BigInteger.valueOf(12)),
                new Form.Num(new BigDecimal("1.25")),
                Form.bool(true),
                Form.bool(false),
                Form.nil());
    }

    @Test
    void testOverflowingIntegerBecomesBig() {
        Form form = FormReader.readOne("9223372036854775808", new MetadataTable());

        assertThat(form).isEqualTo(new Form.Num(new BigInteger("9223372036854775808")));
    }

    @Test
    void testCollections() {
        Form form = FormReader.readOne("(f [1 2] {:a 1, :b 2} #{3})", new MetadataTable());

        assertThat(form).isEqualTo(Form.list(
                Form.symbol("f"),
                Form.vector(Form.number(1), Form.number(2)),
                Form.map(Form.keyword("a"), Form.number(1), Form.keyword("b"), Form.number(2)),
                new Form.SetForm(List.of(Form.number(3)))));
    }

    @Test
    void testReaderSugar() {
        List<Form> forms = FormReader.readAll("'x #'y (a #_ ignored b) ; comment\n", new MetadataTable());

        assertThat(forms).containsExactly(
                Form.list(Form.symbol("quote"), Form.symbol("x")),
                Form.list(Form.symbol("var"), Form.symbol("y")),
                Form.list(Form.symbol("a"), Form.symbol("b")));
    }

    @Test
    void testLineAndColumnMetadata() {
        MetadataTable metadata = new MetadataTable();
        Form form = FormReader.readOne("\n  (def x\n    (+ 1 2))", metadata);

        Form.ListForm def = (Form.ListForm) form;
        Form.ListForm add = (Form.ListForm) def.get(2);
        assertThat(metadata.line(def)).isEqualTo(2);
        assertThat(metadata.get(def).get(Metadata.COLUMN)).isEqualTo(3);
        assertThat(metadata.get(def).get(Metadata.SOURCE)).isEqualTo("<string>");
        assertThat(metadata.line(def.get(1))).isEqualTo(2);
        assertThat(metadata.line(add)).isEqualTo(3);
        assertThat(metadata.get(add).get(Metadata.COLUMN)).isEqualTo(5);
        assertThat(metadata.contains(add.get(1))).isFalse();
    }

    @Test
    void testReadsOneFormAtATime() {
        MetadataTable metadata = new MetadataTable();
        byte[] source = "(a) (b)\n(c)".getBytes(StandardCharsets.UTF_8);
        try (FormReader reader = new FormReader(
                new StreamSourceProvider(new ByteArrayInputStream(source), StandardCharsets.UTF_8, "abc.clj"), metadata)) {
            assertThat(reader.read()).contains(Form.list(Form.symbol("a")));
            assertThat(reader.read()).contains(Form.list(Form.symbol("b")));
            assertThat(reader.getLine()).isEqualTo(1);
            Optional<Form> third = reader.read();
            assertThat(third).contains(Form.list(Form.symbol("c")));
            assertThat(metadata.get(third.get()).get(Metadata.SOURCE)).isEqualTo("abc.clj");
            assertThat(reader.read()).isEmpty();
        }
    }

    @Test
    void testExplicitMetadata() {
        MetadataTable metadata = new MetadataTable();
        Form form = FormReader.readOne("^{:line 7, :doc \"d\"} (f ^:private x ^String y)", metadata);

        assertThat(form).isEqualTo(Form.list(Form.symbol("f"), Form.symbol("x"), Form.symbol("y")));
        Metadata meta = metadata.get(form);
        assertThat(meta.line()).isEqualTo(7);
        assertThat(meta.get(Metadata.COLUMN)).isEqualTo(22);
        assertThat(meta.get("doc")).isEqualTo("d");
        assertThat(meta.get(Metadata.SOURCE)).isEqualTo("<string>");

        Form.ListForm list = (Form.ListForm) form;
        assertThat(metadata.get(list.get(1)).get("private")).isEqualTo(true);
        assertThat(metadata.get(list.get(2)).get("tag")).isEqualTo("String");
    }

    @Test
    void testMetadataErrors() {
        MetadataTable metadata = new MetadataTable();

        assertThatThrownBy(() -> FormReader.readAll("^1 x", metadata))
                .isInstanceOf(FormReadException.class)
                .hasMessageContaining("Metadata must be");
        assertThatThrownBy(() -> FormReader.readAll("^:k 1", metadata))
                .isInstanceOf(FormReadException.class)
                .hasMessageContaining("can only be applied");
        assertThatThrownBy(() -> FormReader.readAll("^{1 2} x", metadata))
                .isInstanceOf(FormReadException.class)
                .hasMessageContaining("keys must be keywords");
        assertThatThrownBy(() -> FormReader.readAll("^:k", metadata))
                .isInstanceOf(FormReadException.class)
                .hasMessageContaining("Unexpected end of input");
    }

    @Test
    void testErrors() {
        MetadataTable metadata = new MetadataTable();

        assertThatThrownBy(() -> FormReader.readAll("(a b", metadata))
                .isInstanceOf(FormReadException.class)
                .hasMessageContaining("Unexpected end of input");
        assertThatThrownBy(() -> FormReader.readAll("a)", metadata))
                .isInstanceOf(FormReadException.class)
                .hasMessageContaining("Unmatched delimiter");
        assertThatThrownBy(() -> FormReader.readAll("{:a}", metadata))
                .isInstanceOf(FormReadException.class)
                .hasMessageContaining("even number");
        assertThatThrownBy(() -> FormReader.readAll("\"bad \\q\"", metadata))
                .isInstanceOf(FormReadException.class)
                .hasMessageContaining("Invalid escape");
        assertThatThrownBy(() -> FormReader.readAll("#(inc %)", metadata))
                .isInstanceOf(FormReadException.class)
                .hasMessageContaining("Unsupported dispatch");
        assertThatThrownBy(() -> FormReader.readOne("  ", metadata))
                .isInstanceOf(FormReadException.class);
    }
}
