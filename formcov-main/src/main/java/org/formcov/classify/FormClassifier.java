package org.formcov.classify;

import org.formcov.ast.Form;
import org.formcov.ast.visitor.FormVisitorWithDefaults;
import org.formcov.printer.FormPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Assigns a {@link FormType} to a form by looking at its shape and, for lists, its leading symbol.
 * <p>
 * Classification is pure: the same form always yields the same label.
 */
public final class FormClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(FormClassifier.class);

    /**
     * Special-form symbols that cannot be evaluated as values, so a bare occurrence is left alone.
     */
    public static final Set<String> STOP_SYMBOLS = Set.of(
            ".", "do", "if", "var", "quote", "try", "finally", "throw", "recur", "monitor-enter", "monitor-exit");

    /**
     * Leading symbols of lists that are never descended into.
     */
    public static final Set<String> STOP_HEADS = Set.of(
            "var", "import*", "clojure.core/import*", "catch", "set!", "finally", "quote", "deftest");

    private static final Map<String, FormType> HEAD_TYPES = Map.ofEntries(
            Map.entry("let*", FormType.BINDING),
            Map.entry("loop*", FormType.BINDING),
            Map.entry("def", FormType.DEFINITION),
            Map.entry("new", FormType.CONSTRUCTOR_CALL),
            Map.entry(".", FormType.MEMBER_ACCESS),
            Map.entry("fn", FormType.FUNCTION),
            Map.entry("fn*", FormType.FUNCTION)
    );

    private static final FormVisitorWithDefaults<FormType, Void> SHAPE = new FormVisitorWithDefaults<>() {

        @Override
        public FormType defaultAction(Form n, Void arg) {
            return FormType.ATOMIC;
        }

        @Override
        public FormType visit(Form.Symbol n, Void arg) {
            return STOP_SYMBOLS.contains(n.fullName()) ? FormType.STOP : FormType.ATOMIC;
        }

        @Override
        public FormType visit(Form.VectorForm n, Void arg) {
            return FormType.STRUCTURAL;
        }

        @Override
        public FormType visit(Form.MapForm n, Void arg) {
            return FormType.STRUCTURAL;
        }

        @Override
        public FormType visit(Form.SetForm n, Void arg) {
            return FormType.DEFAULT;
        }

        @Override
        public FormType visit(Form.ListForm n, Void arg) {
            return n.headSymbol()
                    .map(Form.Symbol::fullName)
                    .map(head -> STOP_HEADS.contains(head) ? FormType.STOP : HEAD_TYPES.getOrDefault(head, FormType.COMPOUND))
                    .orElse(FormType.COMPOUND);
        }
    };

    private FormClassifier() {}

    public static FormType classify(Form form) {
        FormType type = form.accept(SHAPE, null);
        if (LOG.isTraceEnabled()) {
            LOG.trace("Type of {} is {}", FormPrinter.print(form), type);
        }
        return type;
    }

    /**
     * Whether the list is headed by the given symbol name.
     */
    public static boolean isHeadedBy(Form form, String symbolName) {
        return form instanceof Form.ListForm list
               && list.headSymbol().map(s -> s.fullName().equals(symbolName)).orElse(false);
    }
}
