package org.formcov.normalize;

import org.formcov.FormWrapException;
import org.formcov.ast.Form;
import org.formcov.printer.FormPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Expands syntactic sugar into core forms using an explicit table of {@link Expansion}s.
 * <p>
 * Only the head of the given form is expanded, repeatedly, until no entry applies. Sub-forms are left for the
 * caller to expand when it descends into them.
 */
public class Normalizer {

    private static final Logger LOG = LoggerFactory.getLogger(Normalizer.class);

    /**
     * Upper bound on head expansions of a single form; exceeding it means the table loops.
     */
    public static final int MAX_EXPANSIONS = 256;

    private final Map<String, Expansion> expansions;
    private final List<CoreExpansions.SymbolPattern> patterns;
    private long gensymCounter;

    public Normalizer() {
        this(CoreExpansions.table(), CoreExpansions.patterns());
    }

    public Normalizer(Map<String, Expansion> expansions, List<CoreExpansions.SymbolPattern> patterns) {
        this.expansions = expansions;
        this.patterns = patterns;
    }

    /**
     * Whether the head of this form has an entry in the table.
     */
    public boolean isExpandable(Form form) {
        return lookup(form).isPresent();
    }

    /**
     * Applies a single table entry, or returns the form itself when none applies.
     */
    public Form expandOnce(Form form) {
        Optional<Expansion> expansion = lookup(form);
        if (expansion.isEmpty()) {
            return form;
        }
        Form expanded = expansion.get().expand((Form.ListForm) form, this);
        if (LOG.isTraceEnabled()) {
            LOG.trace("Expanded {} to {}", FormPrinter.print(form), FormPrinter.print(expanded));
        }
        return expanded;
    }

    /**
     * Expands the head of the form until no table entry applies.
     *
     * @throws FormWrapException if the sugar is malformed or expansion does not settle
     */
    public Form expand(Form form) {
        Form current = form;
        for (int i = 0; i < MAX_EXPANSIONS; i++) {
            Form next = expandOnce(current);
            if (next == current) {
                return current;
            }
            current = next;
        }
        throw new FormWrapException("Expansion did not settle after " + MAX_EXPANSIONS + " steps",
                                    FormPrinter.print(form), null);
    }

    /**
     * A fresh symbol, unique within this normalizer.
     */
    public Form.Symbol gensym(String prefix) {
        return Form.symbol(prefix + "__" + (++gensymCounter));
    }

    private Optional<Expansion> lookup(Form form) {
        if (!(form instanceof Form.ListForm list)) {
            return Optional.empty();
        }
        Optional<Form.Symbol> head = list.headSymbol();
        if (head.isEmpty()) {
            return Optional.empty();
        }
        Expansion byName = expansions.get(head.get().fullName());
        if (byName != null) {
            return Optional.of(byName);
        }
        for (CoreExpansions.SymbolPattern pattern : patterns) {
            if (pattern.matches().test(head.get())) {
                return Optional.of(pattern.expansion());
            }
        }
        return Optional.empty();
    }
}
