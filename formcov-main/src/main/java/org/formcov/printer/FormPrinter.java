/*
 * Copyright 2019 Red Hat, Inc. and/or its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 *
 */

package org.formcov.printer;

import org.formcov.ast.Form;
import org.formcov.ast.meta.Metadata;
import org.formcov.ast.meta.MetadataTable;
import org.formcov.ast.visitor.FormVisitor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;

/**
 * Renders forms back to source text that the reader accepts.
 * <p>
 * When built with a {@link MetadataTable}, line and column attributes are printed as a {@code ^{...}} prefix,
 * which the reader attaches back to the form that follows it.
 */
public class FormPrinter implements FormVisitor<Void, StringBuilder> {

    private static final FormPrinter PLAIN = new FormPrinter(null);

    private final MetadataTable metadata;

    public FormPrinter(MetadataTable metadata) {
        this.metadata = metadata;
    }

    public static String print(Form form) {
        return PLAIN.render(form);
    }

    public static String printWithMetadata(Form form, MetadataTable metadata) {
        return new FormPrinter(metadata).render(form);
    }

    public String render(Form form) {
        StringBuilder sb = new StringBuilder();
        form.accept(this, sb);
        return sb.toString();
    }

    @Override
    public Void visit(Form.Symbol n, StringBuilder sb) {
        printMetadata(n, sb);
        sb.append(n.fullName());
        return null;
    }

    @Override
    public Void visit(Form.Keyword n, StringBuilder sb) {
        sb.append(':').append(n.name());
        return null;
    }

    @Override
    public Void visit(Form.Str n, StringBuilder sb) {
        sb.append('"');
        for (char c : n.value().toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return null;
    }

    @Override
    public Void visit(Form.Char n, StringBuilder sb) {
        switch (n.value()) {
            case '\n' -> sb.append("\\newline");
            case ' ' -> sb.append("\\space");
            case '\t' -> sb.append("\\tab");
            case '\r' -> sb.append("\\return");
            default -> sb.append('\\').append(n.value());
        }
        return null;
    }

    @Override
    public Void visit(Form.Num n, StringBuilder sb) {
        Number value = n.value();
        sb.append(value);
        if (value instanceof BigInteger) {
            sb.append('N');
        } else if (value instanceof BigDecimal) {
            sb.append('M');
        }
        return null;
    }

    @Override
    public Void visit(Form.Bool n, StringBuilder sb) {
        sb.append(n.value());
        return null;
    }

    @Override
    public Void visit(Form.Nil n, StringBuilder sb) {
        sb.append("nil");
        return null;
    }

    @Override
    public Void visit(Form.ListForm n, StringBuilder sb) {
        printMetadata(n, sb);
        printSequence("(", n.elements(), ")", sb);
        return null;
    }

    @Override
    public Void visit(Form.VectorForm n, StringBuilder sb) {
        printMetadata(n, sb);
        printSequence("[", n.elements(), "]", sb);
        return null;
    }

    @Override
    public Void visit(Form.MapForm n, StringBuilder sb) {
        printMetadata(n, sb);
        sb.append('{');
        Iterator<Form.MapForm.Entry> it = n.entries().iterator();
        while (it.hasNext()) {
            Form.MapForm.Entry entry = it.next();
            entry.key().accept(this, sb);
            sb.append(' ');
            entry.value().accept(this, sb);
            if (it.hasNext()) {
                sb.append(", ");
            }
        }
        sb.append('}');
        return null;
    }

    @Override
    public Void visit(Form.SetForm n, StringBuilder sb) {
        printMetadata(n, sb);
        printSequence("#{", n.elements(), "}", sb);
        return null;
    }

    private void printSequence(String open, List<Form> elements, String close, StringBuilder sb) {
        sb.append(open);
        Iterator<Form> it = elements.iterator();
        while (it.hasNext()) {
            it.next().accept(this, sb);
            if (it.hasNext()) {
                sb.append(' ');
            }
        }
        sb.append(close);
    }

    private void printMetadata(Form n, StringBuilder sb) {
        if (metadata == null) {
            return;
        }
        Metadata meta = metadata.get(n);
        Integer line = meta.line();
        Object column = meta.get(Metadata.COLUMN);
        if (line == null && column == null) {
            return;
        }
        sb.append("^{");
        if (line != null) {
            sb.append(":line ").append(line);
        }
        if (column != null) {
            if (line != null) {
                sb.append(", ");
            }
            sb.append(":column ").append(column);
        }
        sb.append("} ");
    }
}
