package org.formcov.ast.meta;

import org.formcov.ast.Form;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Side table mapping form instances to their {@link Metadata}.
 * <p>
 * Keys are compared by identity, so two structurally equal forms read from different source lines keep
 * separate metadata. Forms that are not {@linkplain Form#isMetadataCapable() metadata capable} are never stored.
 */
public class MetadataTable {

    private final Map<Form, Metadata> entries = new IdentityHashMap<>();

    /**
     * Look up the metadata of a form.
     *
     * @return the recorded metadata, or {@link Metadata#EMPTY} if nothing was recorded
     */
    public Metadata get(Form form) {
        Metadata metadata = entries.get(form);
        return metadata == null ? Metadata.EMPTY : metadata;
    }

    /**
     * The recorded line of a form, or {@code null}.
     */
    public Integer line(Form form) {
        return get(form).line();
    }

    /**
     * Replace the metadata of a form. Non-capable forms pass through untouched.
     *
     * @return the same form, for chaining
     */
    public <F extends Form> F put(F form, Metadata metadata) {
        if (!form.isMetadataCapable()) {
            return form;
        }
        if (metadata.isEmpty()) {
            entries.remove(form);
        } else {
            entries.put(form, metadata);
        }
        return form;
    }

    /**
     * Apply {@code fn} to the current metadata of a form and store the result.
     */
    public <F extends Form> F vary(F form, UnaryOperator<Metadata> fn) {
        return put(form, fn.apply(get(form)));
    }

    public boolean contains(Form form) {
        return entries.containsKey(form);
    }

    public int size() {
        return entries.size();
    }
}
