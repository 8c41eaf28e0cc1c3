package org.pxdforge.generator;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.pxdforge.generator.api.OutputUnit;
import org.pxdforge.generator.backend.render.DeclarationRenderer;
import org.pxdforge.generator.backend.render.OutputAssembler;
import org.pxdforge.generator.diagnostics.DiagnosticsEngine;
import org.pxdforge.generator.diagnostics.Severity;
import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.UpstreamDiagnostic;
import org.pxdforge.generator.frontend.scope.Scope;
import org.pxdforge.generator.frontend.scope.ScopeAggregator;
import org.pxdforge.generator.frontend.semantics.ModuleLayout;
import org.pxdforge.generator.frontend.semantics.ReferenceSite;
import org.pxdforge.generator.frontend.semantics.TypeRegistrar;
import org.pxdforge.generator.frontend.semantics.TypeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the generator over translation units.
 *
 * <p>Each unit goes through four phases:</p>
 * <ol>
 *   <li><b>Check:</b> upstream diagnostics are reported; in strict mode an error aborts
 *       the run before anything is aggregated.</li>
 *   <li><b>Aggregate:</b> scopes are found and filtered.</li>
 *   <li><b>Register:</b> every declared type enters the {@link TypeResolver}, every
 *       referenced type is looked up.</li>
 *   <li><b>Render:</b> scopes are rendered and grouped into one {@link OutputUnit} per
 *       module, imports drained per module.</li>
 * </ol>
 * <p>In directory mode all units are registered before the first one is rendered, so
 * types declared in any header resolve everywhere. {@link #finish()} reports the types
 * that never resolved.</p>
 */
public class PxdGenerator {

    private static final Logger log = LoggerFactory.getLogger(PxdGenerator.class);

    private final GeneratorOptions options;
    private final DiagnosticsEngine diagnostics;
    private final TypeResolver resolver;
    private final DeclarationRenderer renderer;
    private final OutputAssembler assembler;

    /**
     * @param options     Run settings.
     * @param diagnostics Sink for every diagnostic of the run.
     * @param resolver    Symbol table shared by all units of the run.
     */
    public PxdGenerator(GeneratorOptions options, DiagnosticsEngine diagnostics, TypeResolver resolver) {
        this.options = options;
        this.diagnostics = diagnostics;
        this.resolver = resolver;
        this.renderer = new DeclarationRenderer(resolver, diagnostics);
        this.assembler = new OutputAssembler(!options.noimport(), options.autodefine());
    }

    /**
     * Generates a single header: one output unit per module of its namespaces.
     *
     * @param unit The parsed header.
     * @return The output units in scope order.
     * @throws GenerationAbortedException in strict mode if the unit has upstream errors.
     */
    public List<OutputUnit> generate(TranslationUnit unit) {
        check(unit);
        ModuleLayout layout = options.layout() != null ? options.layout() : ModuleLayout.NAMESPACE;
        String relativeHeader = relativeHeader(unit.mainFile(), options.includeBase());
        Prepared prepared = prepare(unit, options.keepsAllIncludes(), originFiles(unit), layout, relativeHeader);
        register(prepared);
        return render(prepared);
    }

    /**
     * Generates a directory of headers: one output unit per header.
     *
     * @param units       The parsed headers.
     * @param includeBase Directory module paths and extern headers are relative to, or
     *                    {@code null} to use the configured base or the parent of the
     *                    headers' common directory.
     * @return The output units in unit order.
     * @throws GenerationAbortedException in strict mode if any unit has upstream errors.
     */
    public List<OutputUnit> generateAll(List<TranslationUnit> units, Path includeBase) {
        for (TranslationUnit unit : units) {
            check(unit);
        }
        ModuleLayout layout = options.layout() != null ? options.layout() : ModuleLayout.HEADER;
        Path base = includeBase != null ? includeBase
                : options.includeBase() != null ? options.includeBase() : defaultIncludeBase(units);
        List<Prepared> prepared = new ArrayList<>();
        for (TranslationUnit unit : units) {
            Prepared next = prepare(unit, false, Set.of(unit.mainFile()), layout, relativeHeader(unit.mainFile(), base));
            register(next);
            prepared.add(next);
        }
        List<OutputUnit> outputs = new ArrayList<>();
        for (Prepared next : prepared) {
            outputs.addAll(render(next));
        }
        return outputs;
    }

    /**
     * Reports the types that never resolved. Call once after the last unit.
     *
     * @return The number of unresolved types.
     */
    public int finish() {
        int unresolved = resolver.warnUnresolved();
        log.info("Generation finished: {} known type(s), {} unresolved, {} diagnostic(s)",
                resolver.knownTypes().size(), unresolved, diagnostics.getDiagnostics().size());
        return unresolved;
    }

    public TypeResolver getResolver() {
        return resolver;
    }

    private void check(TranslationUnit unit) {
        List<UpstreamDiagnostic> errors = new ArrayList<>();
        for (UpstreamDiagnostic upstream : unit.diagnostics()) {
            Severity severity = Severity.fromLevel(upstream.severity());
            diagnostics.report(severity, upstream.message(), upstream.file(), upstream.line());
            if (severity.level() >= Severity.ERROR.level()) {
                errors.add(upstream);
            }
        }
        if (options.strict() && !errors.isEmpty()) {
            throw new GenerationAbortedException(unit.mainFile(), errors);
        }
    }

    private Prepared prepare(TranslationUnit unit, boolean recursive, Set<String> originFiles,
                             ModuleLayout layout, String relativeHeader) {
        ScopeAggregator aggregator = new ScopeAggregator(unit, recursive, originFiles, options.defines());
        List<Scope> scopes = aggregator.aggregateAll();
        log.debug("Aggregated {} scope(s) from {}", scopes.size(), unit.mainFile());
        return new Prepared(unit, scopes, layout, relativeHeader);
    }

    private void register(Prepared prepared) {
        TypeRegistrar registrar = new TypeRegistrar(resolver);
        for (Scope scope : prepared.scopes()) {
            registrar.register(scope, prepared.modulePath(scope));
        }
    }

    private List<OutputUnit> render(Prepared prepared) {
        Map<String, List<Scope>> byModule = new LinkedHashMap<>();
        for (Scope scope : prepared.scopes()) {
            if (scope.hasDeclarations()) {
                byModule.computeIfAbsent(prepared.modulePath(scope), m -> new ArrayList<>()).add(scope);
            }
        }
        String header = options.systemHeader() ? "<" + prepared.relativeHeader() + ">" : prepared.relativeHeader();
        List<OutputUnit> outputs = new ArrayList<>();
        for (Map.Entry<String, List<Scope>> module : byModule.entrySet()) {
            List<List<String>> blocks = new ArrayList<>();
            for (Scope scope : module.getValue()) {
                ReferenceSite site = new ReferenceSite(scope.namespace(), module.getKey(), scope.originFiles(),
                        scope.restricted(), options.importAll(), prepared.layout());
                blocks.add(renderer.render(scope, site, header));
            }
            String text = assembler.assemble(resolver.drainImports(), resolver.drainUnresolved(), blocks);
            outputs.add(new OutputUnit(module.getKey(), text));
        }
        if (outputs.isEmpty()) {
            log.info("No declarations to write for {}", prepared.unit().mainFile());
        }
        return outputs;
    }

    /**
     * The main file plus, with a headers glob, every file of the unit matching it.
     */
    private Set<String> originFiles(TranslationUnit unit) {
        Set<String> files = new LinkedHashSet<>();
        files.add(unit.mainFile());
        if (options.headersGlob() == null) {
            return files;
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + options.headersGlob());
        Deque<Cursor> stack = new ArrayDeque<>(unit.root().children());
        while (!stack.isEmpty()) {
            Cursor cursor = stack.pop();
            if (cursor.file() != null && !files.contains(cursor.file())) {
                Path path = Path.of(cursor.file());
                Path name = path.getFileName();
                if (matcher.matches(path) || (name != null && matcher.matches(name))) {
                    files.add(cursor.file());
                }
            }
            stack.addAll(cursor.children());
        }
        log.debug("Origin files of {}: {}", unit.mainFile(), files);
        return files;
    }

    static String relativeHeader(String mainFile, Path includeBase) {
        Path header = Path.of(mainFile);
        Path relative;
        if (includeBase == null) {
            relative = header.getFileName();
        } else {
            relative = includeBase.toAbsolutePath().normalize().relativize(header.toAbsolutePath().normalize());
        }
        return relative.toString().replace('\\', '/');
    }

    /**
     * The parent of the deepest directory containing every header, so module paths keep
     * that directory's name.
     */
    static Path defaultIncludeBase(List<TranslationUnit> units) {
        Path common = null;
        for (TranslationUnit unit : units) {
            Path dir = Path.of(unit.mainFile()).toAbsolutePath().normalize().getParent();
            if (common == null) {
                common = dir;
            }
            while (common != null && dir != null && !dir.startsWith(common)) {
                common = common.getParent();
            }
        }
        if (common == null) {
            return Path.of("").toAbsolutePath();
        }
        return common.getParent() != null ? common.getParent() : common;
    }

    private record Prepared(TranslationUnit unit, List<Scope> scopes, ModuleLayout layout, String relativeHeader) {

        String modulePath(Scope scope) {
            return layout.modulePath(scope.namespace(), relativeHeader);
        }
    }
}
