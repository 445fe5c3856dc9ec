package org.formcov.printer;

import org.formcov.ast.Form;
import org.formcov.ast.meta.MetadataTable;
import org.formcov.reader.FormReader;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FormPrinterTest {

    @Test
    void testPrintsReadableSource() {
        Form form = Form.list(
                Form.symbol("f"),
                Form.string("a \"b\"\n"),
                new Form.Char(' '),
                Form.keyword("k"),
                new Form.Num(BigInteger.TEN),
                Form.nil(),
                Form.vector(Form.number(1), Form.number(2.5)),
                Form.map(Form.keyword("a"), Form.bool(true), Form.keyword("b"), Form.bool(false)),
                new Form.SetForm(List.of(Form.symbol("s"))));

        assertThat(FormPrinter.print(form))
                .isEqualTo("(f \"a \\\"b\\\"\\n\" \\space :k 10N nil [1 2.5] {:a true, :b false} #{s})");
    }

    @Test
    void testPrintedFormReadsBack() {
        String source = "(defn f [x] (if (nil? x) {:empty true} [x \"x\" \\x]))";
        Form form = FormReader.readOne(source, new MetadataTable());

        assertThat(FormReader.readOne(FormPrinter.print(form), new MetadataTable())).isEqualTo(form);
    }

    @Test
    void testPrintsLineMetadata() {
        MetadataTable metadata = new MetadataTable();
        Form form = FormReader.readOne("(a\n b)", metadata);

        assertThat(FormPrinter.printWithMetadata(form, metadata))
                .isEqualTo("^{:line 1, :column 1} (^{:line 1, :column 2} a ^{:line 2, :column 2} b)");
    }

    @Test
    void testMetadataReadsBack() {
        MetadataTable metadata = new MetadataTable();
        Form form = FormReader.readOne("(f\n  [x]\n  x)", metadata);
        String printed = FormPrinter.printWithMetadata(form, metadata);

        MetadataTable reread = new MetadataTable();
        Form copy = FormReader.readOne(printed, reread);

        assertThat(copy).isEqualTo(form);
        assertThat(FormPrinter.printWithMetadata(copy, reread)).isEqualTo(printed);
        assertThat(reread.line(((Form.ListForm) copy).get(2))).isEqualTo(3);
    }
}
