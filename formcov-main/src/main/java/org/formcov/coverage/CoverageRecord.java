package org.formcov.coverage;

import org.formcov.ast.Form;

/**
 * One instrumented form: the probe id that reports it, where it came from, and the form itself.
 *
 * @param line the source line, or {@code null} when unknown
 */
public record CoverageRecord(int id, String module, Integer line, Form form) {
}
