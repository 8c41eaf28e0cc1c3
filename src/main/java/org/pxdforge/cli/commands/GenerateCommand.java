package org.pxdforge.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.pxdforge.cli.CommandLineInterface;
import org.pxdforge.generator.GenerationAbortedException;
import org.pxdforge.generator.GeneratorOptions;
import org.pxdforge.generator.PxdGenerator;
import org.pxdforge.generator.api.FileOutputSink;
import org.pxdforge.generator.api.IOutputSink;
import org.pxdforge.generator.api.OutputUnit;
import org.pxdforge.generator.api.PackageLayout;
import org.pxdforge.generator.diagnostics.DiagnosticsEngine;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.io.AstDumpFinder;
import org.pxdforge.generator.frontend.io.IAstProvider;
import org.pxdforge.generator.frontend.io.JsonAstProvider;
import org.pxdforge.generator.frontend.semantics.TypeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command generating Cython declarations from AST dumps.
 * <p>
 * A single dump yields one module per namespace. With {@code -D} the input is a directory
 * of dumps; all of them are registered first and each header becomes one module.
 * Without {@code -o} modules are printed to standard output.
 */
@Command(
    name = "generate",
    mixinStandardHelpOptions = true,
    description = "Generate .pxd declarations from a JSON AST dump or a directory of dumps"
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Parameters(
        index = "0",
        paramLabel = "<dump|directory>",
        description = "AST dump (*" + AstDumpFinder.DUMP_SUFFIX + ") or, with -D, a directory of dumps"
    )
    private Path input;

    @Option(
        names = {"-o", "--output"},
        description = "Output .pxd file or directory (default: standard output)"
    )
    private Path output;

    @Option(
        names = {"-r", "--recursive-includes"},
        description = "Include declarations from other included headers"
    )
    private boolean recursive;

    @Option(
        names = {"-H", "--headers"},
        description = "Glob of included headers whose declarations are kept as well"
    )
    private String headers;

    @Option(
        names = {"-W", "--warning-level"},
        description = "Lowest diagnostic severity that is logged (1-4)"
    )
    private Integer warningLevel;

    @Option(
        names = {"-D", "--directory"},
        description = "Treat the input as a directory of dumps"
    )
    private boolean directory;

    @Option(
        names = {"--strict"},
        description = "Abort on upstream parse errors"
    )
    private boolean strict;

    @Option(
        names = {"--import-all"},
        description = "Import types of sibling headers instead of assuming them in scope"
    )
    private boolean importAll;

    @Option(
        names = {"--system-header"},
        description = "Spell extern headers as <path>"
    )
    private boolean systemHeader;

    @Option(
        names = {"--relpath"},
        description = "Directory extern headers and module paths are relative to"
    )
    private Path relpath;

    @Option(
        names = {"-f", "--flag"},
        description = "Output flag: defines, autodefine or noimport (repeatable)"
    )
    private List<String> flags = new ArrayList<>();

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    private final IAstProvider provider;

    public GenerateCommand() {
        this(new JsonAstProvider());
    }

    GenerateCommand(IAstProvider provider) {
        this.provider = provider;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        GeneratorOptions options;
        try {
            options = options(parent.getConfig());
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        if (directory && output == null) {
            err.println("Error: directory mode needs an output directory (-o)");
            return 1;
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine(options.warningLevel());
        PxdGenerator generator = new PxdGenerator(options, diagnostics, new TypeResolver(diagnostics));
        try {
            List<OutputUnit> units;
            if (directory) {
                List<TranslationUnit> parsed = new ArrayList<>();
                for (Path dump : AstDumpFinder.find(input)) {
                    parsed.add(provider.load(dump));
                }
                log.info("Loaded {} AST dump(s) from {}", parsed.size(), input);
                units = generator.generateAll(parsed, relpath);
            } else {
                units = generator.generate(provider.load(input));
            }
            write(units, out);
            generator.finish();
            return 0;
        } catch (IOException e) {
            log.error("Generation failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (GenerationAbortedException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private GeneratorOptions options(Config config) {
        GeneratorOptions.Builder builder = GeneratorOptions.fromConfig(config.getConfig("pxdforge.generator")).toBuilder();
        if (recursive) {
            builder.recursive(true);
        }
        if (headers != null) {
            builder.headersGlob(headers);
        }
        if (warningLevel != null) {
            builder.warningLevel(warningLevel);
        }
        if (strict) {
            builder.strict(true);
        }
        if (importAll) {
            builder.importAll(true);
        }
        if (systemHeader) {
            builder.systemHeader(true);
        }
        if (relpath != null) {
            builder.includeBase(relpath);
        }
        for (String flag : flags) {
            builder.flag(flag);
        }
        return builder.build();
    }

    private void write(List<OutputUnit> units, PrintWriter out) throws IOException {
        Map<String, String> files = PackageLayout.filesOf(units.stream().map(OutputUnit::modulePath).toList());
        if (output == null) {
            for (OutputUnit unit : units) {
                if (units.size() > 1) {
                    out.println("# " + files.get(unit.modulePath()));
                }
                out.print(unit.text());
            }
            out.flush();
            return;
        }
        if (!directory && isModuleFile(output)) {
            if (units.size() > 1) {
                throw new IOException(units.size() + " modules generated; pass a directory to -o instead of " + output);
            }
            Path parentDir = output.toAbsolutePath().getParent();
            IOutputSink sink = new FileOutputSink(parentDir);
            for (OutputUnit unit : units) {
                sink.write(output.getFileName().toString(), unit.text());
            }
            return;
        }
        Files.createDirectories(output);
        IOutputSink sink = new FileOutputSink(output);
        for (OutputUnit unit : units) {
            sink.write(files.get(unit.modulePath()), unit.text());
        }
    }

    private static boolean isModuleFile(Path path) {
        return !Files.isDirectory(path) && path.getFileName().toString().endsWith(PackageLayout.EXTENSION);
    }
}
