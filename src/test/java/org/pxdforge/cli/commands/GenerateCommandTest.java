package org.pxdforge.cli.commands;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pxdforge.cli.CommandLineInterface;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.UpstreamDiagnostic;
import org.pxdforge.generator.frontend.io.IAstProvider;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.pxdforge.test.utils.AstFixtures.*;

/**
 * Smoke tests for the generate command.
 */
@Tag("unit")
public class GenerateCommandTest {

    private static final String SINGLE_FUNCTION = """
            { "file": "/work/include/test.h",
              "cursors": [
                { "kind": "FUNCTION_DECL", "spelling": "f", "file": "/work/include/test.h",
                  "resultType": { "kind": "BUILTIN", "spelling": "void" },
                  "children": [ { "kind": "PARM_DECL", "spelling": "a", "type": { "kind": "BUILTIN", "spelling": "int" } } ] }
              ] }
            """;

    private static final String TWO_NAMESPACES = """
            { "file": "/work/include/test.h",
              "cursors": [
                { "kind": "FUNCTION_DECL", "spelling": "f", "file": "/work/include/test.h",
                  "resultType": { "kind": "BUILTIN", "spelling": "void" } },
                { "kind": "NAMESPACE", "spelling": "A", "file": "/work/include/test.h",
                  "children": [ { "kind": "VAR_DECL", "spelling": "counter", "type": { "kind": "BUILTIN", "spelling": "int" } } ] }
              ] }
            """;

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private CommandLine commandLine() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine;
    }

    private CommandLine commandLine(IAstProvider provider) {
        CommandLine.IFactory factory = new CommandLine.IFactory() {
            @Override
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == GenerateCommand.class) {
                    return cls.cast(new GenerateCommand(provider));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
        CommandLine cmdLine = new CommandLine(new CommandLineInterface(), factory);
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine;
    }

    private Path dump(String name, String json) throws Exception {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, json);
    }

    @Test
    void testCommandParses() {
        assertThat(CommandLineInterface.createCommandLine().getSubcommands()).containsKey("generate");
    }

    @Test
    void testHelpOutput() {
        commandLine().execute("generate", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("generate", "--recursive-includes", "--flag", "--headers");
    }

    @Test
    void testGenerateToStandardOutput() throws Exception {
        Path dump = dump("test.ast.json", SINGLE_FUNCTION);

        int exitCode = commandLine().execute("generate", dump.toString());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(0);
        assertThat(out.toString()).isEqualTo("""
                cdef extern from "test.h":
                    void f(int a)
                """);
    }

    @Test
    void testSeveralModulesAreSeparatedOnStandardOutput() throws Exception {
        Path dump = dump("test.ast.json", TWO_NAMESPACES);

        int exitCode = commandLine().execute("generate", dump.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("# test.pxd", "# A.pxd", "cdef extern from \"test.h\" namespace \"A\":");
    }

    @Test
    void testGenerateIntoDirectory() throws Exception {
        Path dump = dump("test.ast.json", TWO_NAMESPACES);
        Path target = tempDir.resolve("out");

        int exitCode = commandLine().execute("generate", dump.toString(), "-o", target.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(Files.readString(target.resolve("test.pxd"))).contains("void f()");
        assertThat(Files.readString(target.resolve("A.pxd"))).contains("int counter");
    }

    @Test
    void testGenerateIntoSingleFile() throws Exception {
        Path dump = dump("test.ast.json", SINGLE_FUNCTION);
        Path target = tempDir.resolve("bindings.pxd");

        int exitCode = commandLine().execute("generate", dump.toString(), "-o", target.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(Files.readString(target)).contains("void f(int a)");
    }

    @Test
    void testSingleFileRejectsSeveralModules() throws Exception {
        Path dump = dump("test.ast.json", TWO_NAMESPACES);

        int exitCode = commandLine().execute("generate", dump.toString(), "-o", tempDir.resolve("all.pxd").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("2 modules generated");
    }

    @Test
    void testDirectoryMode() throws Exception {
        dump("ast/a.ast.json", SINGLE_FUNCTION.replace("/work/include/test.h", "/work/include/lib/a.h"));
        dump("ast/b.ast.json", SINGLE_FUNCTION.replace("/work/include/test.h", "/work/include/lib/b.h")
                .replace("\"f\"", "\"g\""));
        Path target = tempDir.resolve("bindings");

        int exitCode = commandLine().execute("generate", "-D", tempDir.resolve("ast").toString(), "-o", target.toString());

        assertThat(exitCode)
            .describedAs("stderr: %s", err.toString())
            .isEqualTo(0);
        assertThat(Files.readString(target.resolve("lib/a.pxd"))).startsWith("cdef extern from \"lib/a.h\":");
        assertThat(Files.readString(target.resolve("lib/b.pxd"))).contains("void g(int a)");
    }

    @Test
    void testDirectoryModeNeedsOutput() throws Exception {
        int exitCode = commandLine().execute("generate", "-D", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("needs an output directory");
    }

    @Test
    void testUnknownFlagIsRejected() throws Exception {
        Path dump = dump("test.ast.json", SINGLE_FUNCTION);

        int exitCode = commandLine().execute("generate", dump.toString(), "-f", "everything");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown flag 'everything'");
    }

    @Test
    void testNonexistentDumpReturnsError() {
        int exitCode = commandLine().execute("generate", "/nonexistent/test.ast.json");

        assertThat(exitCode).isNotEqualTo(0);
    }

    @Test
    void testStrictModeAbortsOnUpstreamErrors() throws Exception {
        IAstProvider provider = mock(IAstProvider.class);
        TranslationUnit broken = TranslationUnit.of(HEADER, List.of(function("f", VOID)),
                List.of(new UpstreamDiagnostic(4, "too many errors", HEADER, 1)));
        when(provider.load(any())).thenReturn(broken);

        int strict = commandLine(provider).execute("generate", "in.ast.json", "--strict");

        assertThat(strict).isEqualTo(1);
        assertThat(err.toString()).contains("Aborting", "too many errors");
        verify(provider).load(Path.of("in.ast.json"));
    }

    @Test
    void testFlagsReachTheGenerator() throws Exception {
        IAstProvider provider = mock(IAstProvider.class);
        when(provider.load(any())).thenReturn(unit(macro("SIZE", "SIZE", "16"),
                function("load", VOID, param("m", pointer(record("Missing", null))))));

        int exitCode = commandLine(provider).execute("generate", "in.ast.json", "-f", "defines", "--flag", "autodefine");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("const long SIZE", "ctypedef struct Missing:");
    }
}
