package org.pxdforge.generator.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics for one generator run and forwards them to the log.
 *
 * <p>Every diagnostic is recorded. Only those at or above the configured warning level
 * are logged; severities {@link Severity#ERROR} and {@link Severity#FATAL} are always
 * logged. Recording never throws: aborting on upstream errors is the pipeline's
 * decision, not the sink's.</p>
 */
public class DiagnosticsEngine {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final int warningLevel;

    /**
     * Creates an engine that logs warnings and above.
     */
    public DiagnosticsEngine() {
        this(Severity.WARNING.level());
    }

    /**
     * @param warningLevel The lowest severity level (1..4) that is logged.
     */
    public DiagnosticsEngine(int warningLevel) {
        this.warningLevel = warningLevel;
    }

    public void report(Severity severity, String message, String file, int line) {
        Diagnostic diagnostic = new Diagnostic(severity, message, file, line);
        diagnostics.add(diagnostic);
        if (severity.level() < warningLevel && severity.level() < Severity.ERROR.level()) {
            return;
        }
        switch (severity) {
            case REMARK -> log.info("{}", diagnostic);
            case WARNING -> log.warn("{}", diagnostic);
            case ERROR, FATAL -> log.error("{}", diagnostic);
        }
    }

    public void reportRemark(String message) {
        report(Severity.REMARK, message, null, 0);
    }

    public void reportWarning(String message, String file, int line) {
        report(Severity.WARNING, message, file, line);
    }

    public void reportError(String message, String file, int line) {
        report(Severity.ERROR, message, file, line);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity().level() >= Severity.ERROR.level());
    }

    public long count(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * One line per diagnostic, in reporting order.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
