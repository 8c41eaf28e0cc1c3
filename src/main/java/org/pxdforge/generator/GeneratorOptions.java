package org.pxdforge.generator;

import java.nio.file.Path;

import org.pxdforge.generator.frontend.semantics.ModuleLayout;

import com.typesafe.config.Config;

/**
 * Settings of one generator run.
 *
 * @param recursive    Keep declarations from included headers.
 * @param strict       Abort on upstream errors instead of logging them.
 * @param importAll    Import types of sibling headers instead of assuming them in scope.
 * @param systemHeader Spell the extern header as {@code <path>}.
 * @param warningLevel Lowest severity that is logged.
 * @param layout       Module assignment; {@code null} picks {@link ModuleLayout#NAMESPACE}
 *                     for single dumps and {@link ModuleLayout#HEADER} for directories.
 * @param headersGlob  Glob of further headers to treat as origin files, or {@code null}.
 * @param includeBase  Directory the extern header is spelled relative to, or {@code null}.
 * @param defines      Declare object-like and function-like macros as constants.
 * @param autodefine   Declare unresolved types as opaque structs.
 * @param noimport     Suppress the import list.
 */
public record GeneratorOptions(boolean recursive,
                               boolean strict,
                               boolean importAll,
                               boolean systemHeader,
                               int warningLevel,
                               ModuleLayout layout,
                               String headersGlob,
                               Path includeBase,
                               boolean defines,
                               boolean autodefine,
                               boolean noimport) {

    private static final String AUTO = "auto";

    public static GeneratorOptions defaults() {
        return builder().build();
    }

    /**
     * Reads options from the {@code pxdforge.generator} section.
     *
     * @param config The section itself, not the application root.
     * @return The options; unset optional paths stay {@code null}.
     */
    public static GeneratorOptions fromConfig(Config config) {
        Builder builder = builder()
                .recursive(config.getBoolean("recursive"))
                .strict(config.getBoolean("strict"))
                .importAll(config.getBoolean("import-all"))
                .systemHeader(config.getBoolean("system-header"))
                .warningLevel(config.getInt("warning-level"))
                .defines(config.getBoolean("flags.defines"))
                .autodefine(config.getBoolean("flags.autodefine"))
                .noimport(config.getBoolean("flags.noimport"));
        String layout = config.getString("module-layout");
        if (!AUTO.equalsIgnoreCase(layout)) {
            builder.layout(ModuleLayout.parse(layout));
        }
        if (config.hasPath("headers") && !config.getString("headers").isBlank()) {
            builder.headersGlob(config.getString("headers"));
        }
        if (config.hasPath("include-base") && !config.getString("include-base").isBlank()) {
            builder.includeBase(Path.of(config.getString("include-base")));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .recursive(recursive).strict(strict).importAll(importAll).systemHeader(systemHeader)
                .warningLevel(warningLevel).layout(layout).headersGlob(headersGlob).includeBase(includeBase)
                .defines(defines).autodefine(autodefine).noimport(noimport);
    }

    /**
     * Recursive mode with a headers glob keeps only the matching headers.
     */
    public boolean keepsAllIncludes() {
        return recursive && headersGlob == null;
    }

    public static final class Builder {
        private boolean recursive;
        private boolean strict;
        private boolean importAll;
        private boolean systemHeader;
        private int warningLevel = 1;
        private ModuleLayout layout;
        private String headersGlob;
        private Path includeBase;
        private boolean defines;
        private boolean autodefine;
        private boolean noimport;

        private Builder() {
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder importAll(boolean importAll) {
            this.importAll = importAll;
            return this;
        }

        public Builder systemHeader(boolean systemHeader) {
            this.systemHeader = systemHeader;
            return this;
        }

        public Builder warningLevel(int warningLevel) {
            this.warningLevel = warningLevel;
            return this;
        }

        public Builder layout(ModuleLayout layout) {
            this.layout = layout;
            return this;
        }

        public Builder headersGlob(String headersGlob) {
            this.headersGlob = headersGlob;
            return this;
        }

        public Builder includeBase(Path includeBase) {
            this.includeBase = includeBase;
            return this;
        }

        public Builder defines(boolean defines) {
            this.defines = defines;
            return this;
        }

        public Builder autodefine(boolean autodefine) {
            this.autodefine = autodefine;
            return this;
        }

        public Builder noimport(boolean noimport) {
            this.noimport = noimport;
            return this;
        }

        /**
         * Sets a named output flag ({@code defines}, {@code autodefine}, {@code noimport}).
         *
         * @throws IllegalArgumentException for an unknown flag.
         */
        public Builder flag(String name) {
            switch (name.trim().toLowerCase()) {
                case "defines" -> defines = true;
                case "autodefine" -> autodefine = true;
                case "noimport" -> noimport = true;
                default -> throw new IllegalArgumentException("Unknown flag '" + name + "'");
            }
            return this;
        }

        public GeneratorOptions build() {
            return new GeneratorOptions(recursive, strict, importAll, systemHeader, warningLevel, layout,
                    headersGlob, includeBase, defines, autodefine, noimport);
        }
    }
}
