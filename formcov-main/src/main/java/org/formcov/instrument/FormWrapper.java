package org.formcov.instrument;

import org.formcov.FormWrapException;
import org.formcov.MalformedOverloadException;
import org.formcov.ast.Form;
import org.formcov.ast.meta.MetadataTable;
import org.formcov.classify.FormClassifier;
import org.formcov.classify.FormType;
import org.formcov.normalize.Normalizer;
import org.formcov.printer.FormPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rewrites a form so that evaluating it records every instrumentable sub-form through a {@link Probe}.
 * <p>
 * The rewrite is purely structural: nothing is evaluated. Every atomic leaf and every rebuilt compound form on a
 * path that does not cross a {@link FormType#STOP} form ends up wrapped by exactly one probe call. Vectors and
 * maps are rebuilt with wrapped elements but are not wrapped themselves.
 * <p>
 * Names bound by {@code let*}, {@code loop*} and {@code fn*} are tracked while their scope is wrapped, and a list
 * headed by such a local is treated as a plain call rather than expanded as sugar. A wrapper keeps this scope as
 * state, so an instance must not be shared between threads.
 */
public class FormWrapper {

    private static final Logger LOG = LoggerFactory.getLogger(FormWrapper.class);

    private final Probe probe;
    private final MetadataTable metadata;
    private final MetadataPropagator propagator;
    private final Normalizer normalizer;
    private final boolean strict;
    private Set<String> locals = Set.of();

    public FormWrapper(Probe probe, MetadataTable metadata) {
        this(probe, metadata, new Normalizer(), false);
    }

    /**
     * @param strict reject forms the classifier does not recognize instead of passing them through
     */
    public FormWrapper(Probe probe, MetadataTable metadata, Normalizer normalizer, boolean strict) {
        this.probe = probe;
        this.metadata = metadata;
        this.propagator = new MetadataPropagator(metadata);
        this.normalizer = normalizer;
        this.strict = strict;
    }

    /**
     * Wrap a form. The form's own recorded line takes precedence over {@code lineHint}.
     *
     * @throws FormWrapException if a sub-form is too malformed to restructure
     */
    public Form wrap(Integer lineHint, Form form) {
        Integer formLine = metadata.line(form);
        Integer line = formLine != null ? formLine : lineHint;
        FormType type = FormClassifier.classify(form);
        return switch (type) {
            case STOP -> form;
            case ATOMIC -> emit(line, form, form);
            case STRUCTURAL -> wrapStructural(line, form);
            case BINDING -> wrapBinding(line, (Form.ListForm) form);
            case DEFINITION -> wrapDefinition(line, (Form.ListForm) form);
            case CONSTRUCTOR_CALL -> wrapConstructorCall(line, (Form.ListForm) form);
            case MEMBER_ACCESS -> wrapMemberAccess(line, (Form.ListForm) form);
            case FUNCTION -> wrapFunction(line, (Form.ListForm) form);
            case COMPOUND -> wrapCompound(line, (Form.ListForm) form);
            case DEFAULT -> wrapUnclassified(line, form);
        };
    }

    private Form emit(Integer line, Form original, Form rebuilt) {
        propagator.mergeProvenance(original, rebuilt);
        Form call = probe.wrap(line, rebuilt);
        propagator.propagateLine(line, call);
        return propagator.mergeProvenance(original, call);
    }

    private List<Form> wrapAll(Integer line, List<Form> forms) {
        List<Form> wrapped = new ArrayList<>(forms.size());
        for (Form form : forms) {
            wrapped.add(wrap(line, form));
        }
        return wrapped;
    }

    private Form wrapStructural(Integer line, Form form) {
        Form rebuilt;
        if (form instanceof Form.VectorForm vector) {
            rebuilt = Form.vector(wrapAll(line, vector.elements()));
        } else {
            List<Form.MapForm.Entry> entries = new ArrayList<>();
            for (Form.MapForm.Entry entry : ((Form.MapForm) form).entries()) {
                entries.add(new Form.MapForm.Entry(wrap(line, entry.key()), wrap(line, entry.value())));
            }
            rebuilt = new Form.MapForm(entries);
        }
        return propagator.mergeProvenance(form, rebuilt);
    }

    // (let* [name value ...] body*) and (loop* [name value ...] body*)
    private Form wrapBinding(Integer line, Form.ListForm form) {
        if (form.size() < 2 || !(form.get(1) instanceof Form.VectorForm bindings)) {
            throw wrapError(form.get(0) + " requires a binding vector", form, line);
        }
        if (bindings.size() % 2 != 0) {
            throw wrapError(form.get(0) + " requires an even number of forms in the binding vector", form, line);
        }
        Set<String> enclosing = locals;
        try {
            List<Form> rebuiltBindings = new ArrayList<>(bindings.size());
            for (int i = 0; i < bindings.size(); i += 2) {
                rebuiltBindings.add(bindings.get(i));
                rebuiltBindings.add(wrap(line, bindings.get(i + 1)));
                bindLocals(List.of(bindings.get(i)));
            }
            List<Form> rebuilt = new ArrayList<>();
            rebuilt.add(form.get(0));
            rebuilt.add(propagator.mergeProvenance(bindings, Form.vector(rebuiltBindings)));
            rebuilt.addAll(wrapAll(line, form.drop(2)));
            return emit(line, form, Form.list(rebuilt));
        } finally {
            locals = enclosing;
        }
    }

    // (def name), (def name init) or (def name "doc" init)
    private Form wrapDefinition(Integer line, Form.ListForm form) {
        if (form.size() < 2 || form.size() > 4 || !(form.get(1) instanceof Form.Symbol)
            || (form.size() == 4 && !(form.get(2) instanceof Form.Str))) {
            throw wrapError("def requires a name, an optional docstring and an optional initializer", form, line);
        }
        List<Form> rebuilt = new ArrayList<>(form.elements());
        if (form.size() > 2) {
            int last = form.size() - 1;
            rebuilt.set(last, wrap(line, form.get(last)));
        }
        return emit(line, form, Form.list(rebuilt));
    }

    // (new Class args*)
    private Form wrapConstructorCall(Integer line, Form.ListForm form) {
        if (form.size() < 2) {
            throw wrapError("new requires a class name", form, line);
        }
        List<Form> rebuilt = new ArrayList<>();
        rebuilt.add(form.get(0));
        rebuilt.add(form.get(1));
        rebuilt.addAll(wrapAll(line, form.drop(2)));
        return emit(line, form, Form.list(rebuilt));
    }

    // (. target member args*) or (. target (member args*))
    private Form wrapMemberAccess(Integer line, Form.ListForm form) {
        if (form.size() < 3) {
            throw wrapError("Member access requires a target and a member", form, line);
        }
        List<Form> rebuilt = new ArrayList<>();
        rebuilt.add(form.get(0));
        rebuilt.add(form.get(1));
        Form selector = form.get(2);
        if (selector instanceof Form.ListForm call) {
            if (call.isEmpty()) {
                throw wrapError("Member access has an empty selector", form, line);
            }
            if (LOG.isTraceEnabled()) {
                LOG.trace("List member form, wrapping arguments of {}", FormPrinter.print(call));
            }
            List<Form> rebuiltCall = new ArrayList<>();
            rebuiltCall.add(call.get(0));
            rebuiltCall.addAll(wrapAll(line, call.drop(1)));
            rebuilt.add(propagator.mergeProvenance(call, Form.list(rebuiltCall)));
            rebuilt.addAll(form.drop(3));
        } else {
            rebuilt.add(selector);
            rebuilt.addAll(wrapAll(line, form.drop(3)));
        }
        return emit(line, form, Form.list(rebuilt));
    }

    // (fn* name? [params] body*) or (fn* name? ([params] body*)+)
    private Form wrapFunction(Integer line, Form.ListForm form) {
        List<Form> rebuilt = new ArrayList<>();
        rebuilt.add(form.get(0));
        int index = 1;
        Set<String> enclosing = locals;
        try {
            if (form.size() > 1 && form.get(1) instanceof Form.Symbol name) {
                rebuilt.add(name);
                bindLocals(List.of(name));
                index++;
            }
            List<Form> overloads = form.drop(index);
            if (overloads.isEmpty()) {
                throw new MalformedOverloadException("()", FormPrinter.print(form), line);
            }
            if (overloads.get(0) instanceof Form.VectorForm) {
                rebuilt.addAll(wrapOverload(line, overloads, form, Form.list(overloads)));
            } else {
                for (Form group : overloads) {
                    if (!(group instanceof Form.ListForm overload)) {
                        throw new MalformedOverloadException(FormPrinter.print(group), FormPrinter.print(form), line);
                    }
                    Form.ListForm wrapped = Form.list(wrapOverload(line, overload.elements(), form, overload));
                    rebuilt.add(propagator.mergeProvenance(overload, wrapped));
                }
            }
            return emit(line, form, Form.list(rebuilt));
        } finally {
            locals = enclosing;
        }
    }

    private List<Form> wrapOverload(Integer line, List<Form> overload, Form.ListForm enclosing, Form group) {
        if (LOG.isTraceEnabled()) {
            LOG.trace("Wrapping overload {}", FormPrinter.print(group));
        }
        if (overload.isEmpty() || !isParameterVector(overload.get(0))) {
            throw new MalformedOverloadException(FormPrinter.print(group), FormPrinter.print(enclosing), line);
        }
        Form.VectorForm parameters = (Form.VectorForm) overload.get(0);
        Set<String> outer = locals;
        try {
            bindLocals(parameters.elements());
            List<Form> rebuilt = new ArrayList<>();
            rebuilt.add(parameters);
            rebuilt.addAll(wrapAll(line, overload.subList(1, overload.size())));
            return rebuilt;
        } finally {
            locals = outer;
        }
    }

    private static boolean isParameterVector(Form form) {
        if (!(form instanceof Form.VectorForm vector)) {
            return false;
        }
        for (Form parameter : vector.elements()) {
            if (!(parameter instanceof Form.Symbol symbol) || symbol.isQualified()) {
                return false;
            }
        }
        return true;
    }

    private void bindLocals(List<Form> names) {
        Set<String> extended = new HashSet<>(locals);
        for (Form name : names) {
            if (name instanceof Form.Symbol symbol && !symbol.fullName().equals("&")) {
                extended.add(symbol.fullName());
            }
        }
        locals = extended;
    }

    private boolean isLocalCall(Form.ListForm form) {
        return !form.isEmpty() && form.get(0) instanceof Form.Symbol head && locals.contains(head.fullName());
    }

    private Form wrapCompound(Integer line, Form.ListForm form) {
        if (isLocalCall(form)) {
            return emit(line, form, Form.list(wrapAll(line, form.elements())));
        }
        Form expanded;
        try {
            expanded = normalizer.expand(form);
        } catch (FormWrapException e) {
            if (e.getLine() != null) {
                throw e;
            }
            throw new FormWrapException(e.getMessage(), e.getFormText(), line, e);
        }
        if (expanded != form && FormClassifier.classify(expanded) != FormType.COMPOUND) {
            return wrap(line, propagator.mergeProvenance(form, expanded));
        }
        Form.ListForm list = (Form.ListForm) expanded;
        return emit(line, form, Form.list(wrapAll(line, list.elements())));
    }

    private Form wrapUnclassified(Integer line, Form form) {
        if (strict) {
            throw wrapError("Don't know how to wrap form", form, line);
        }
        LOG.warn("Don't know how to wrap {}, leaving it uninstrumented", FormPrinter.print(form));
        return form;
    }

    private static FormWrapException wrapError(String message, Form form, Integer line) {
        return new FormWrapException(message + ": " + FormPrinter.print(form), FormPrinter.print(form), line);
    }
}
