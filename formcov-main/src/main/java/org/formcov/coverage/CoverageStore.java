package org.formcov.coverage;

import org.formcov.ast.Form;
import org.formcov.eval.Builtins;
import org.formcov.eval.EvaluatorException;
import org.formcov.eval.Interpreter;
import org.formcov.instrument.Probe;
import org.formcov.instrument.ProbeFactory;
import org.formcov.printer.FormPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Registers every probe emitted while instrumenting and counts the hits reported back by evaluated code.
 * <p>
 * Probes emit {@code (formcov.coverage/capture <id> <form>)}. Once {@link #install(Interpreter)} has defined
 * {@code capture} in an interpreter, evaluating that call returns the value of {@code <form>} and counts a hit
 * for record {@code <id>}. A form whose evaluation throws is not counted.
 * <p>
 * Not thread-safe.
 */
public class CoverageStore implements ProbeFactory {

    private static final Logger LOG = LoggerFactory.getLogger(CoverageStore.class);

    public static final String CAPTURE_NAMESPACE = "formcov.coverage";
    public static final String CAPTURE_NAME = "capture";

    private final List<CoverageRecord> records = new ArrayList<>();
    private final List<Long> hitCounts = new ArrayList<>();

    @Override
    public Probe forModule(String module) {
        return (line, form) -> {
            CoverageRecord record = register(module, line, form);
            return Form.list(Form.symbol(CAPTURE_NAMESPACE + "/" + CAPTURE_NAME), Form.number(record.id()), form);
        };
    }

    /**
     * Define the {@code capture} function the emitted probe calls rely on.
     */
    public void install(Interpreter interpreter) {
        interpreter.define(CAPTURE_NAMESPACE, CAPTURE_NAME, new Builtins.Builtin(CAPTURE_NAME, args -> {
            if (args.size() != 2 || !(args.get(0) instanceof Number id)) {
                throw new EvaluatorException("capture expects a probe id and a value");
            }
            hit(id.intValue());
            return args.get(1);
        }));
    }

    public CoverageRecord register(String module, Integer line, Form form) {
        CoverageRecord record = new CoverageRecord(records.size(), module, line, form);
        records.add(record);
        hitCounts.add(0L);
        if (LOG.isTraceEnabled()) {
            LOG.trace("Registered probe {} for {} line {}: {}", record.id(), module, line, FormPrinter.print(form));
        }
        return record;
    }

    /**
     * @throws EvaluatorException if no probe has that id
     */
    public void hit(int id) {
        if (id < 0 || id >= records.size()) {
            throw new EvaluatorException("Unknown probe id " + id);
        }
        hitCounts.set(id, hitCounts.get(id) + 1);
    }

    public long hitCount(int id) {
        return hitCounts.get(id);
    }

    public boolean isHit(int id) {
        return hitCounts.get(id) > 0;
    }

    public CoverageRecord record(int id) {
        return records.get(id);
    }

    public List<CoverageRecord> records() {
        return Collections.unmodifiableList(records);
    }

    /**
     * Records hit at least once, in registration order.
     */
    public List<CoverageRecord> hits() {
        return records.stream().filter(r -> isHit(r.id())).collect(Collectors.toList());
    }

    public List<CoverageRecord> recordsFor(String module) {
        return records.stream().filter(r -> r.module().equals(module)).collect(Collectors.toList());
    }
}
