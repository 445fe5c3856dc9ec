package org.formcov.instrument;

/**
 * Supplies the {@link Probe} used while instrumenting one module.
 */
@FunctionalInterface
public interface ProbeFactory {

    Probe forModule(String module);
}
