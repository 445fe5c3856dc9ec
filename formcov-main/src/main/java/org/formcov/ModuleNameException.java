package org.formcov;

public class ModuleNameException extends FormCoverageException {

    private final String moduleName;

    public ModuleNameException(String message, String moduleName) {
        super(message);
        this.moduleName = moduleName;
    }

    public String getModuleName() {
        return moduleName;
    }
}
