package org.formcov.ast;

import org.formcov.ast.visitor.FormVisitor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * One syntactic unit of program structure, as produced by the reader.
 * <p>
 * Forms are immutable and compare structurally. Metadata such as source lines is not part of a form;
 * it lives in a {@link org.formcov.ast.meta.MetadataTable} keyed by node identity.
 */
public sealed interface Form permits Form.Symbol, Form.Keyword, Form.Str, Form.Char, Form.Num, Form.Bool,
        Form.Nil, Form.ListForm, Form.VectorForm, Form.MapForm, Form.SetForm {

    <R, A> R accept(FormVisitor<R, A> visitor, A arg);

    /**
     * Whether metadata can be attached to this kind of form. Literals cannot carry metadata.
     */
    default boolean isMetadataCapable() {
        return false;
    }

    /**
     * Direct sub-forms in source order. Map entries contribute key then value.
     */
    default List<Form> children() {
        return List.of();
    }

    static Symbol symbol(String text) {
        return Symbol.of(text);
    }

    static Keyword keyword(String name) {
        return new Keyword(name);
    }

    static Str string(String value) {
        return new Str(value);
    }

    static Num number(long value) {
        return new Num(value);
    }

    static Num number(double value) {
        return new Num(value);
    }

    static Bool bool(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static Nil nil() {
        return Nil.INSTANCE;
    }

    static ListForm list(Form... elements) {
        return new ListForm(Arrays.asList(elements));
    }

    static ListForm list(List<? extends Form> elements) {
        return new ListForm(new ArrayList<>(elements));
    }

    static VectorForm vector(Form... elements) {
        return new VectorForm(Arrays.asList(elements));
    }

    static VectorForm vector(List<? extends Form> elements) {
        return new VectorForm(new ArrayList<>(elements));
    }

    /**
     * Builds a map form from alternating keys and values.
     */
    static MapForm map(Form... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Map literal needs an even number of forms, got " + keysAndValues.length);
        }
        List<MapForm.Entry> entries = new ArrayList<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            entries.add(new MapForm.Entry(keysAndValues[i], keysAndValues[i + 1]));
        }
        return new MapForm(entries);
    }

    /**
     * A symbol, optionally qualified as {@code namespace/name}.
     */
    record Symbol(String namespace, String name) implements Form {

        public Symbol {
            requireNonNull(name);
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Symbol name must not be empty");
            }
        }

        public static Symbol of(String text) {
            int slash = text.indexOf('/');
            if (slash <= 0 || slash == text.length() - 1) {
                return new Symbol(null, text);
            }
            return new Symbol(text.substring(0, slash), text.substring(slash + 1));
        }

        public boolean isQualified() {
            return namespace != null;
        }

        public String fullName() {
            return namespace == null ? name : namespace + "/" + name;
        }

        @Override
        public boolean isMetadataCapable() {
            return true;
        }

        @Override
        public <R, A> R accept(FormVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }

        @Override
        public String toString() {
            return fullName();
        }
    }

    /**
     * A keyword; the name excludes the leading colon.
     */
    record Keyword(String name) implements Form {

        public Keyword {
            requireNonNull(name);
        }

        @Override
        public <R, A> R accept(FormVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }

        @Override
        public String toString() {
            return ":" + name;
        }
    }

    record Str(String value) implements Form {

        public Str {
            requireNonNull(value);
        }

        @Override
        public <R, A> R accept(FormVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Char(char value) implements Form {

        @Override
        public <R, A> R accept(FormVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /**
     * A numeric literal holding a {@link Long}, {@link Double}, {@link BigInteger} or {@link BigDecimal}.
     */
    record Num(Number value) implements Form {

        public Num {
            requireNonNull(value);
            if (!(value instanceof Long || value instanceof Double
                  || value instanceof BigInteger || value instanceof BigDecimal)) {
                throw new IllegalArgumentException("Unsupported numeric literal type: " + value.getClass().getName());
            }
        }

        @Override
        public <R, A> R accept(FormVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Bool(boolean value) implements Form {
        public static final Bool TRUE = new Bool(true);
        public static final Bool FALSE = new Bool(false);

        @Override
        public <R, A> R accept(FormVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record Nil() implements Form {
        public static final Nil INSTANCE = new Nil();

        @Override
        public <R, A> R accept(FormVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /**
     * A parenthesized sequence. Every call, special form and macro use is a list.
     */
    record ListForm(List<Form> elements) implements Form {

        public ListForm {
            elements = Collections.unmodifiableList(new ArrayList<>(requireNonNull(elements)));
        }

        public int size() {
            return elements.size();
        }

        public boolean isEmpty() {
            return elements.isEmpty();
        }

        public Form get(int index) {
            return elements.get(index);
        }

        public Optional<Form> head() {
            return elements.isEmpty() ? Optional.empty() : Optional.of(elements.get(0));
        }

        /**
         * The leading symbol, if the list starts with one.
         */
        public Optional<Symbol> headSymbol() {
            return head().filter(Symbol.class::isInstance).map(Symbol.class::cast);
        }

        /**
         * Elements after the first {@code n}.
         */
        public List<Form> drop(int n) {
            return n >= elements.size() ? List.of() : elements.subList(n, elements.size());
        }

        @Override
        public List<Form> children() {
            return elements;
        }

        @Override
        public boolean isMetadataCapable() {
            return true;
        }

        @Override
        public <R, A> R accept(FormVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record VectorForm(List<Form> elements) implements Form {

        public VectorForm {
            elements = Collections.unmodifiableList(new ArrayList<>(requireNonNull(elements)));
        }

        public int size() {
            return elements.size();
        }

        public Form get(int index) {
            return elements.get(index);
        }

        @Override
        public List<Form> children() {
            return elements;
        }

        @Override
        public boolean isMetadataCapable() {
            return true;
        }

        @Override
        public <R, A> R accept(FormVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /**
     * A map literal. Entries keep their source order.
     */
    record MapForm(List<Entry> entries) implements Form {

        public MapForm {
            entries = Collections.unmodifiableList(new ArrayList<>(requireNonNull(entries)));
        }

        public record Entry(Form key, Form value) {
            public Entry {
                requireNonNull(key);
                requireNonNull(value);
            }
        }

        public int size() {
            return entries.size();
        }

        @Override
        public List<Form> children() {
            List<Form> children = new ArrayList<>(entries.size() * 2);
            for (Entry entry : entries) {
                children.add(entry.key());
                children.add(entry.value());
            }
            return children;
        }

        @Override
        public boolean isMetadataCapable() {
            return true;
        }

        @Override
        public <R, A> R accept(FormVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    record SetForm(List<Form> elements) implements Form {

        public SetForm {
            elements = Collections.unmodifiableList(new ArrayList<>(requireNonNull(elements)));
        }

        @Override
        public List<Form> children() {
            return elements;
        }

        @Override
        public boolean isMetadataCapable() {
            return true;
        }

        @Override
        public <R, A> R accept(FormVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }
}
