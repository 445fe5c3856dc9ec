package org.formcov.normalize;

import org.formcov.ast.Form;

/**
 * One entry of the desugaring table: rewrites a list headed by sugar into core forms.
 */
@FunctionalInterface
public interface Expansion {

    /**
     * @param form       the list to expand; its head selected this expansion
     * @param normalizer the calling normalizer, for fresh symbols
     * @return the expansion, which may itself need further expansion
     */
    Form expand(Form.ListForm form, Normalizer normalizer);
}
