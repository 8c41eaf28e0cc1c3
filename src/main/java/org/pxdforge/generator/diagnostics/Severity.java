package org.pxdforge.generator.diagnostics;

/**
 * Severity scale shared by generator diagnostics and upstream parser diagnostics.
 */
public enum Severity {
    /** Informational, never affects output. */
    REMARK(1),
    /** Unsupported construct, unresolved type or best-effort reference. Output continues. */
    WARNING(2),
    /** Upstream parse error. Aborts the run in strict mode. */
    ERROR(3),
    /** Upstream fatal error. Aborts the run in strict mode. */
    FATAL(4);

    private final int level;

    Severity(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    /**
     * Maps a numeric level to a severity, clamping out-of-range values.
     *
     * @param level 1..4
     * @return The matching severity.
     */
    public static Severity fromLevel(int level) {
        if (level <= 1) {
            return REMARK;
        }
        return switch (level) {
            case 2 -> WARNING;
            case 3 -> ERROR;
            default -> FATAL;
        };
    }
}
