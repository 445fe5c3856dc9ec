package org.formcov;

import org.formcov.ast.Form;
import org.formcov.classify.FormClassifier;
import org.formcov.coverage.CoverageRecord;
import org.formcov.coverage.CoverageStore;
import org.formcov.eval.Interpreter;
import org.formcov.printer.FormPrinter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstrumenterTest {

    @Test
    void testDefinitionScenario() {
        Instrumenter instrumenter = Instrumenter.builder().build();

        InstrumentedModule module = instrumenter.instrument("sample.scenario");

        Interpreter interpreter = (Interpreter) instrumenter.getEvaluator();
        assertThat(interpreter.resolve("x")).isEqualTo(3L);
        assertThat(module.resourcePath()).isEqualTo("sample/scenario.clj");
        assertThat(module.forms()).hasSize(1);

        CoverageStore coverage = instrumenter.getCoverage();
        assertThat(coverage.records()).hasSize(5).allSatisfy(r -> {
            assertThat(r.module()).isEqualTo("sample.scenario");
            assertThat(r.line()).isEqualTo(1);
            assertThat(coverage.hitCount(r.id())).isEqualTo(1);
        });
        List<CoverageRecord> definitions = coverage.records().stream()
                .filter(r -> FormClassifier.isHeadedBy(r.form(), "def"))
                .collect(Collectors.toList());
        List<CoverageRecord> additions = coverage.records().stream()
                .filter(r -> r.form() instanceof Form.ListForm && !FormClassifier.isHeadedBy(r.form(), "def"))
                .collect(Collectors.toList());
        assertThat(definitions).hasSize(1);
        assertThat(additions).hasSize(1);
        assertThat(FormPrinter.print(additions.get(0).form())).isEqualTo(
                "((formcov.coverage/capture 0 +) (formcov.coverage/capture 1 1) (formcov.coverage/capture 2 2))");
    }

    @Test
    void testModuleWithSugarAndInterop() {
        Instrumenter instrumenter = Instrumenter.builder().build();

        InstrumentedModule module = instrumenter.instrument("sample.my-app");

        assertThat(module.moduleName()).isEqualTo("sample.my-app");
        assertThat(module.resourcePath()).isEqualTo("sample/my_app.clj");
        assertThat(module.forms()).hasSize(11);

        Interpreter interpreter = (Interpreter) instrumenter.getEvaluator();
        assertThat(interpreter.getCurrentNamespace().getName()).isEqualTo("sample.my-app");
        assertThat(interpreter.resolve("greeting")).isEqualTo("Hello, formcov!");
        assertThat(interpreter.resolve("total")).isEqualTo(10L);
        assertThat(interpreter.resolve("upper")).isEqualTo("ABC");
        assertThat(interpreter.resolve("items")).isEqualTo(1L);
        assertThat(interpreter.resolve("evens")).isEqualTo(List.of(0L, 2L, 4L, 6L, 8L));
        assertThat(interpreter.resolve("answer")).isEqualTo(Form.keyword("medium"));
        assertThat(interpreter.resolve("sample.my-app/config"))
                .isEqualTo(Map.of(Form.keyword("name"), "formcov", Form.keyword("depth"), 120L));
        assertThat(interpreter.getCurrentNamespace().find("never-defined")).isEmpty();

        CoverageStore coverage = instrumenter.getCoverage();
        assertThat(coverage.recordsFor("sample.my-app")).isNotEmpty();
        assertThat(coverage.hits()).hasSizeLessThan(coverage.records().size());
        assertThat(coverage.records())
                .filteredOn(r -> FormClassifier.isHeadedBy(r.form(), "def") && r.line() != null && r.line() == 38)
                .hasSize(1)
                .allSatisfy(r -> assertThat(coverage.isHit(r.id())).isFalse());
    }

    @Test
    void testSymbolModuleName() {
        Instrumenter instrumenter = Instrumenter.builder().build();

        InstrumentedModule module = instrumenter.instrument(Form.symbol("sample.scenario"));

        assertThat(module.moduleName()).isEqualTo("sample.scenario");
        assertThat(((Interpreter) instrumenter.getEvaluator()).resolve("x")).isEqualTo(3L);
    }

    @Test
    void testResourcePath() {
        assertThat(Instrumenter.resourcePath("my-app.core")).isEqualTo("my_app/core.clj");
        assertThat(Instrumenter.resourcePath("single")).isEqualTo("single.clj");
    }

    @Test
    void testInvalidModuleNames() {
        Instrumenter instrumenter = Instrumenter.builder().build();

        assertThatThrownBy(() -> instrumenter.instrument(42))
                .isInstanceOf(ModuleNameException.class)
                .hasMessageContaining("java.lang.Integer");
        assertThatThrownBy(() -> instrumenter.instrument("not a module"))
                .isInstanceOf(ModuleNameException.class)
                .satisfies(e -> assertThat(((ModuleNameException) e).getModuleName()).isEqualTo("not a module"));
        assertThatThrownBy(() -> instrumenter.instrument("trailing."))
                .isInstanceOf(ModuleNameException.class);
        assertThatThrownBy(() -> instrumenter.instrument(Form.symbol("sample/scenario")))
                .isInstanceOf(ModuleNameException.class);
        assertThatThrownBy(() -> instrumenter.instrument("sample.missing"))
                .isInstanceOf(ModuleNameException.class)
                .hasMessageContaining("sample/missing.clj");
        assertThat(instrumenter.getCoverage().records()).isEmpty();
    }

    @Test
    void testWrapFailureStopsTheModule() {
        Instrumenter instrumenter = Instrumenter.builder().build();

        assertThatThrownBy(() -> instrumenter.instrument("sample.bad-wrap"))
                .isInstanceOf(FormWrapException.class)
                .hasCauseInstanceOf(MalformedOverloadException.class)
                .satisfies(e -> {
                    FormWrapException wrapException = (FormWrapException) e;
                    assertThat(wrapException.getFormText()).isEqualTo("(fn ([x] x) oops)");
                    assertThat(wrapException.getLine()).isEqualTo(3);
                    assertThat(((MalformedOverloadException) e.getCause()).getOverloadText()).isEqualTo("oops");
                });

        Interpreter interpreter = (Interpreter) instrumenter.getEvaluator();
        assertThat(interpreter.resolve("ok")).isEqualTo(1L);
        assertThat(interpreter.getCurrentNamespace().find("after")).isEmpty();
    }

    @Test
    void testEvaluationFailure() {
        Instrumenter instrumenter = Instrumenter.builder().build();

        assertThatThrownBy(() -> instrumenter.instrument("sample.bad-eval"))
                .isInstanceOf(FormEvaluationException.class)
                .hasRootCauseInstanceOf(ArithmeticException.class)
                .satisfies(e -> {
                    FormEvaluationException evalException = (FormEvaluationException) e;
                    assertThat(evalException.getOriginalText()).isEqualTo("(def y (/ 1 0))");
                    assertThat(evalException.getRewrittenText()).startsWith("(formcov.coverage/capture");
                    assertThat(evalException.getMessage()).contains("line 1");
                });
    }

    @Test
    void testReadFailure() {
        Instrumenter instrumenter = Instrumenter.builder().build();

        assertThatThrownBy(() -> instrumenter.instrument("sample.bad-read"))
                .isInstanceOf(FormReadException.class)
                .satisfies(e -> assertThat(((FormReadException) e).getSource()).isEqualTo("sample/bad_read.clj"));
    }

    @Test
    void testUnclassifiedFormsPassThroughUnlessStrict() {
        Instrumenter lenient = Instrumenter.builder().strict(false).build();

        lenient.instrument("sample.tags");

        assertThat(((Interpreter) lenient.getEvaluator()).resolve("tags"))
                .isEqualTo(Set.of(Form.keyword("a"), Form.keyword("b")));

        Instrumenter strict = Instrumenter.builder().strict(true).build();
        assertThatThrownBy(() -> strict.instrument("sample.tags"))
                .isInstanceOf(FormWrapException.class)
                .hasMessageContaining("#{:a :b}");
    }

    @Test
    void testDumpDirectory(@TempDir Path dir) throws Exception {
        Instrumenter instrumenter = Instrumenter.builder().dumpDirectory(dir.resolve("dump")).build();

        InstrumentedModule module = instrumenter.instrument("sample.scenario");

        Path dump = dir.resolve("dump").resolve("sample.scenario.instrumented.clj");
        assertThat(dump).exists();
        List<String> lines = Files.readAllLines(dump, StandardCharsets.UTF_8);
        assertThat(lines).containsExactly(FormPrinter.print(module.forms().get(0)));
        assertThat(lines.get(0)).startsWith("(formcov.coverage/capture 4 (def x (formcov.coverage/capture 3 (");
    }

    @Test
    void testModuleMarkerIsClearedAfterwards() {
        Instrumenter instrumenter = Instrumenter.builder().build();

        instrumenter.instrument("sample.scenario");
        assertThat(MDC.get(Instrumenter.MDC_MODULE)).isNull();

        assertThatThrownBy(() -> instrumenter.instrument("sample.bad-eval"))
                .isInstanceOf(FormEvaluationException.class);
        assertThat(MDC.get(Instrumenter.MDC_MODULE)).isNull();
    }

    @Test
    void testCustomProbeFactory() {
        Instrumenter instrumenter = Instrumenter.builder()
                .probeFactory(module -> (line, form) -> Form.list(Form.symbol("do"), form))
                .build();

        InstrumentedModule module = instrumenter.instrument("sample.scenario");

        assertThat(instrumenter.getCoverage()).isNull();
        assertThat(FormPrinter.print(module.forms().get(0)))
                .isEqualTo("(do (def x (do ((do +) (do 1) (do 2)))))");
        assertThat(((Interpreter) instrumenter.getEvaluator()).resolve("x")).isEqualTo(3L);
    }

    @Test
    void testFailingProbeFactoryOpensNoSource() {
        List<String> opened = new ArrayList<>();
        ClassLoader loader = new ClassLoader(InstrumenterTest.class.getClassLoader()) {
            @Override
            public InputStream getResourceAsStream(String name) {
                opened.add(name);
                return super.getResourceAsStream(name);
            }
        };
        Instrumenter instrumenter = Instrumenter.builder()
                .classLoader(loader)
                .probeFactory(module -> {
                    throw new IllegalStateException("no probes for " + module);
                })
                .build();

        assertThatThrownBy(() -> instrumenter.instrument("sample.scenario"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("no probes for sample.scenario");
        assertThat(opened).isEmpty();
        assertThat(MDC.get(Instrumenter.MDC_MODULE)).isNull();
    }
}
