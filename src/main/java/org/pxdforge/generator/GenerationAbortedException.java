package org.pxdforge.generator;

import java.util.List;

import org.pxdforge.generator.frontend.ast.UpstreamDiagnostic;

/**
 * Thrown in strict mode when the front end reported an error for a translation unit.
 * No scope of the run has been aggregated at that point.
 */
public class GenerationAbortedException extends RuntimeException {

    private final transient List<UpstreamDiagnostic> errors;

    public GenerationAbortedException(String mainFile, List<UpstreamDiagnostic> errors) {
        super("Aborting: " + errors.size() + " upstream error(s) in " + mainFile
                + (errors.isEmpty() ? "" : ", first: " + errors.get(0).message()));
        this.errors = List.copyOf(errors);
    }

    public List<UpstreamDiagnostic> getErrors() {
        return errors;
    }
}
