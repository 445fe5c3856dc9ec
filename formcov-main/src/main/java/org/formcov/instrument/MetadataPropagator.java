package org.formcov.instrument;

import org.formcov.ast.Form;
import org.formcov.ast.meta.Metadata;
import org.formcov.ast.meta.MetadataTable;

/**
 * Keeps line and provenance metadata attached to rewritten forms, so a probe call can always report the line
 * its form came from.
 */
public class MetadataPropagator {

    private final MetadataTable metadata;

    public MetadataPropagator(MetadataTable metadata) {
        this.metadata = metadata;
    }

    /**
     * Attach the most specific known line to {@code form} and, recursively, to every metadata-capable sub-form
     * that has no line of its own. A form's own line wins over {@code hint} and is inherited by its sub-forms.
     *
     * @return {@code form}
     */
    public <F extends Form> F propagateLine(Integer hint, F form) {
        if (!form.isMetadataCapable()) {
            return form;
        }
        Integer own = metadata.line(form);
        Integer line = own != null ? own : hint;
        for (Form child : form.children()) {
            propagateLine(line, child);
        }
        if (own == null && line != null) {
            metadata.vary(form, m -> m.with(Metadata.LINE, line));
        }
        return form;
    }

    /**
     * Record {@code original} as the provenance of {@code rewritten}. The rewritten tree gets line metadata
     * recomputed from the original, then every other attribute of the original layered over its own. A line that
     * stays unknown is dropped rather than stored as {@code null}.
     *
     * @return {@code rewritten}
     */
    public <F extends Form> F mergeProvenance(Form original, F rewritten) {
        if (!rewritten.isMetadataCapable()) {
            return rewritten;
        }
        Metadata originalMeta = metadata.get(original);
        propagateLine(originalMeta.line(), rewritten);
        Integer line = metadata.line(rewritten);

        Metadata merged = metadata.get(rewritten)
                .merge(originalMeta.without(Metadata.LINE))
                .with(Metadata.LINE, line);
        if (merged.line() == null) {
            merged = merged.without(Metadata.LINE);
        }
        if (original != rewritten) {
            merged = merged.with(Metadata.ORIGINAL, original);
        }
        metadata.put(rewritten, merged);
        return rewritten;
    }
}
