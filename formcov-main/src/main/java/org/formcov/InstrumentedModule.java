package org.formcov;

import org.formcov.ast.Form;

import java.util.List;

/**
 * The result of instrumenting one module: its rewritten top-level forms in source order.
 *
 * @param resourcePath the classpath resource the module was read from
 */
public record InstrumentedModule(String moduleName, String resourcePath, List<Form> forms) {

    public InstrumentedModule {
        forms = List.copyOf(forms);
    }
}
