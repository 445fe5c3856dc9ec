package org.formcov;

import org.formcov.ast.Form;
import org.formcov.ast.meta.MetadataTable;
import org.formcov.coverage.CoverageStore;
import org.formcov.eval.FormEvaluator;
import org.formcov.eval.Interpreter;
import org.formcov.instrument.FormWrapper;
import org.formcov.instrument.ProbeFactory;
import org.formcov.normalize.Normalizer;
import org.formcov.printer.FormPrinter;
import org.formcov.reader.FormReader;
import org.formcov.reader.StreamSourceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Instruments a module: every top-level form of its source is read, wrapped with the module's probe and
 * evaluated immediately, in source order.
 * <p>
 * Instances are built with {@link #builder()}. Unless configured otherwise, an {@link Interpreter} evaluates the
 * forms and a fresh {@link CoverageStore} supplies the probes.
 */
public class Instrumenter {

    private static final Logger LOG = LoggerFactory.getLogger(Instrumenter.class);

    public static final String MDC_MODULE = "formcov.module";
    public static final String STRICT_PROPERTY = "formcov.instrument.strict";
    public static final String DUMP_DIR_PROPERTY = "formcov.instrument.dumpDir";
    public static final String SOURCE_EXTENSION = ".clj";
    public static final String DUMP_EXTENSION = ".instrumented.clj";

    private static final String SEGMENT = "[A-Za-z_*+!?<>=-][A-Za-z0-9_*+!?<>='-]*";
    private static final Pattern MODULE_NAME = Pattern.compile(SEGMENT + "(\\." + SEGMENT + ")*");

    private final ProbeFactory probeFactory;
    private final FormEvaluator evaluator;
    private final Normalizer normalizer;
    private final ClassLoader classLoader;
    private final Path dumpDirectory;
    private final boolean strict;
    private final CoverageStore coverage;

    private Instrumenter(Builder builder) {
        this.classLoader = builder.classLoader != null ? builder.classLoader : Instrumenter.class.getClassLoader();
        this.normalizer = builder.normalizer != null ? builder.normalizer : new Normalizer();
        this.evaluator = builder.evaluator != null ? builder.evaluator : new Interpreter(normalizer, classLoader);
        if (builder.probeFactory != null) {
            this.probeFactory = builder.probeFactory;
            this.coverage = builder.probeFactory instanceof CoverageStore store ? store : null;
        } else {
            this.coverage = new CoverageStore();
            this.probeFactory = coverage;
        }
        if (coverage != null && evaluator instanceof Interpreter interpreter) {
            coverage.install(interpreter);
        }
        this.dumpDirectory = builder.dumpDirectory;
        this.strict = builder.strict;
    }

    public static Builder builder() {
        return new Builder();
    }

    public InstrumentedModule instrument(String moduleName) {
        return instrument((Object) moduleName);
    }

    public InstrumentedModule instrument(Form.Symbol moduleName) {
        return instrument((Object) moduleName);
    }

    /**
     * Instrument the module of that name.
     *
     * @param moduleName a {@link String} or an unqualified {@link Form.Symbol}
     * @throws ModuleNameException if the name is invalid or no such module is on the class path
     * @throws FormReadException if the module source is malformed
     * @throws FormWrapException if a form cannot be instrumented; later forms are not processed
     * @throws FormEvaluationException if evaluating an instrumented form fails; later forms are not processed
     */
    public InstrumentedModule instrument(Object moduleName) {
        String module = validateModuleName(moduleName);
        String path = resourcePath(module);

        String previousModule = MDC.get(MDC_MODULE);
        MDC.put(MDC_MODULE, module);
        try {
            MetadataTable metadata = new MetadataTable();
            FormWrapper wrapper = new FormWrapper(probeFactory.forModule(module), metadata, normalizer, strict);
            InputStream stream = classLoader.getResourceAsStream(path);
            if (stream == null) {
                throw new ModuleNameException("Unable to find module " + module + " on the class path (" + path + ")", module);
            }
            LOG.debug("Instrumenting module {} from {}", module, path);
            List<Form> forms = instrumentForms(module, path, stream, wrapper, metadata);
            InstrumentedModule result = new InstrumentedModule(module, path, forms);
            if (dumpDirectory != null) {
                dump(result);
            }
            LOG.debug("Instrumented {} forms of module {}", forms.size(), module);
            return result;
        } finally {
            if (previousModule == null) {
                MDC.remove(MDC_MODULE);
            } else {
                MDC.put(MDC_MODULE, previousModule);
            }
        }
    }

    private List<Form> instrumentForms(String module, String path, InputStream stream, FormWrapper wrapper,
                                       MetadataTable metadata) {
        List<Form> forms = new ArrayList<>();
        try (FormReader reader = new FormReader(new StreamSourceProvider(stream, StandardCharsets.UTF_8, path), metadata)) {
            Optional<Form> next;
            while ((next = reader.read()).isPresent()) {
                Form form = next.get();
                Integer line = metadata.line(form);
                Form wrapped = wrap(wrapper, module, line, form);
                if (LOG.isTraceEnabled()) {
                    LOG.trace("Wrapped form{}: {}", describeLine(line), FormPrinter.printWithMetadata(wrapped, metadata));
                }
                evaluate(module, line, form, wrapped);
                forms.add(wrapped);
            }
        }
        return forms;
    }

    private Form wrap(FormWrapper wrapper, String module, Integer line, Form form) {
        try {
            return wrapper.wrap(line, form);
        } catch (FormWrapException e) {
            Integer errorLine = e.getLine() != null ? e.getLine() : line;
            throw new FormWrapException("Unable to instrument form in " + module + describeLine(errorLine) + ": "
                                        + e.getMessage(), FormPrinter.print(form), errorLine, e);
        }
    }

    private void evaluate(String module, Integer line, Form original, Form wrapped) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("Evaluating form{}: {}", describeLine(line), FormPrinter.print(original));
        }
        try {
            evaluator.eval(wrapped);
        } catch (RuntimeException e) {
            throw new FormEvaluationException("Unable to evaluate form in " + module + describeLine(line) + ": "
                                              + e.getMessage(), FormPrinter.print(wrapped), FormPrinter.print(original), e);
        }
    }

    private void dump(InstrumentedModule module) {
        Path file = dumpDirectory.resolve(module.moduleName() + DUMP_EXTENSION);
        try {
            Files.createDirectories(dumpDirectory);
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                for (Form form : module.forms()) {
                    writer.write(FormPrinter.print(form));
                    writer.write(System.lineSeparator());
                }
            }
            LOG.debug("Wrote instrumented forms of {} to {}", module.moduleName(), file);
        } catch (IOException e) {
            throw new FormCoverageException("Unable to write instrumented forms to " + file, e);
        }
    }

    private static String describeLine(Integer line) {
        return line != null ? " at line " + line : "";
    }

    /**
     * The module name as text.
     *
     * @throws ModuleNameException if the value is not a valid module name
     */
    public static String validateModuleName(Object moduleName) {
        String name;
        if (moduleName instanceof String string) {
            name = string;
        } else if (moduleName instanceof Form.Symbol symbol && !symbol.isQualified()) {
            name = symbol.name();
        } else {
            throw new ModuleNameException("Module name must be a string or an unqualified symbol, got "
                                          + (moduleName == null ? "nil" : moduleName.getClass().getName()),
                                          String.valueOf(moduleName));
        }
        if (!MODULE_NAME.matcher(name).matches()) {
            throw new ModuleNameException("Invalid module name '" + name + "'", name);
        }
        return name;
    }

    /**
     * Class path resource of a module: {@code my-app.core} is {@code my_app/core.clj}.
     */
    public static String resourcePath(String moduleName) {
        return moduleName.replace('-', '_').replace('.', '/') + SOURCE_EXTENSION;
    }

    public FormEvaluator getEvaluator() {
        return evaluator;
    }

    /**
     * The store collecting probe hits, or {@code null} when a custom {@link ProbeFactory} was configured.
     */
    public CoverageStore getCoverage() {
        return coverage;
    }

    public Path getDumpDirectory() {
        return dumpDirectory;
    }

    public boolean isStrict() {
        return strict;
    }

    public static class Builder {

        private ProbeFactory probeFactory;
        private FormEvaluator evaluator;
        private Normalizer normalizer;
        private ClassLoader classLoader;
        private Path dumpDirectory;
        private boolean strict;

        private Builder() {
            this.strict = Boolean.getBoolean(STRICT_PROPERTY);
            String dumpDir = System.getProperty(DUMP_DIR_PROPERTY);
            this.dumpDirectory = dumpDir == null || dumpDir.isBlank() ? null : Paths.get(dumpDir);
        }

        public Builder probeFactory(ProbeFactory probeFactory) {
            this.probeFactory = probeFactory;
            return this;
        }

        public Builder evaluator(FormEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        /**
         * The normalizer shared by the wrapper and the default interpreter.
         */
        public Builder normalizer(Normalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder classLoader(ClassLoader classLoader) {
            this.classLoader = classLoader;
            return this;
        }

        /**
         * Write the rewritten forms of every module to {@code <directory>/<module>.instrumented.clj}.
         */
        public Builder dumpDirectory(Path dumpDirectory) {
            this.dumpDirectory = dumpDirectory;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Instrumenter build() {
            return new Instrumenter(this);
        }
    }
}
