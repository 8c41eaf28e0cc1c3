package org.pxdforge.generator.frontend.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.pxdforge.generator.frontend.ast.AccessSpecifier;
import org.pxdforge.generator.frontend.ast.Cursor;
import org.pxdforge.generator.frontend.ast.CursorKind;
import org.pxdforge.generator.frontend.ast.TranslationUnit;
import org.pxdforge.generator.frontend.ast.TypeDescriptor;
import org.pxdforge.generator.frontend.ast.TypeKind;
import org.pxdforge.generator.frontend.ast.UpstreamDiagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Reads translation units from JSON AST dumps.
 *
 * <p>A dump holds the main header path, the front end's diagnostics and the top-level
 * cursors:</p>
 * <pre>
 * { "file": "/abs/include/foo.h",
 *   "diagnostics": [ { "severity": 3, "message": "...", "file": "...", "line": 7 } ],
 *   "cursors": [ { "id": "c:@S@Foo", "kind": "STRUCT_DECL", "spelling": "Foo", ... } ] }
 * </pre>
 * <p>Unknown cursor and type kinds are tolerated and mapped to
 * {@link CursorKind#OTHER} and {@link TypeKind#UNEXPOSED}.</p>
 */
public class JsonAstProvider implements IAstProvider {

    private static final Logger log = LoggerFactory.getLogger(JsonAstProvider.class);

    @Override
    public TranslationUnit load(Path source) throws IOException {
        try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            JsonElement element = JsonParser.parseReader(reader);
            if (!element.isJsonObject()) {
                throw new IOException("AST dump " + source + " is not a JSON object");
            }
            TranslationUnit unit = read(element.getAsJsonObject(), source);
            log.debug("Loaded AST dump {} for {}", source, unit.mainFile());
            return unit;
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
            throw new IOException("Malformed AST dump " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Converts an already parsed dump.
     *
     * @param json   The dump's root object.
     * @param source The dump's location, used when it names no main file.
     * @return The linked unit.
     */
    public TranslationUnit read(JsonObject json, Path source) {
        String mainFile = string(json, "file", source.toString());
        List<UpstreamDiagnostic> diagnostics = new ArrayList<>();
        for (JsonElement element : array(json, "diagnostics")) {
            JsonObject diagnostic = element.getAsJsonObject();
            diagnostics.add(new UpstreamDiagnostic(
                    integer(diagnostic, "severity", 1),
                    string(diagnostic, "message", ""),
                    string(diagnostic, "file", null),
                    integer(diagnostic, "line", 0)));
        }
        List<Cursor> cursors = new ArrayList<>();
        for (JsonElement element : array(json, "cursors")) {
            cursors.add(cursor(element.getAsJsonObject()));
        }
        return TranslationUnit.of(mainFile, cursors, diagnostics);
    }

    private Cursor cursor(JsonObject json) {
        Cursor.Builder builder = Cursor.builder(CursorKind.parse(string(json, "kind", null)), string(json, "spelling", ""))
                .id(string(json, "id", null))
                .file(string(json, "file", null))
                .line(integer(json, "line", 0))
                .access(AccessSpecifier.parse(string(json, "access", null)))
                .anonymous(bool(json, "anonymous", false))
                .definition(bool(json, "definition", true))
                .staticStorage(bool(json, "static", false))
                .variadic(bool(json, "variadic", false))
                .hasDefaultValue(bool(json, "hasDefault", false))
                .exceptionSpecification(string(json, "exceptionSpec", null))
                .macroFunction(bool(json, "macroFunction", false))
                .inlineNamespace(bool(json, "inlineNamespace", false))
                .type(type(json, "type"))
                .resultType(type(json, "resultType"))
                .underlyingType(type(json, "underlyingType"));
        if (json.has("enumValue") && !json.get("enumValue").isJsonNull()) {
            builder.enumValue(json.get("enumValue").getAsLong());
        }
        List<String> tokens = new ArrayList<>();
        for (JsonElement token : array(json, "tokens")) {
            tokens.add(token.getAsString());
        }
        builder.tokens(tokens);
        for (JsonElement child : array(json, "children")) {
            builder.child(cursor(child.getAsJsonObject()));
        }
        return builder.build();
    }

    private TypeDescriptor type(JsonObject owner, String member) {
        if (!owner.has(member) || !owner.get(member).isJsonObject()) {
            return null;
        }
        JsonObject json = owner.getAsJsonObject(member);
        TypeDescriptor.Builder builder = TypeDescriptor.builder(TypeKind.parse(string(json, "kind", null)))
                .spelling(string(json, "spelling", ""))
                .constQualified(bool(json, "const", false))
                .pointee(type(json, "pointee"))
                .element(type(json, "element"))
                .declarationId(string(json, "declaration", null))
                .result(type(json, "result"))
                .variadic(bool(json, "variadic", false));
        if (json.has("arraySize")) {
            builder.arraySize(json.get("arraySize").getAsLong());
        }
        if (json.has("size")) {
            builder.sizeBytes(json.get("size").getAsLong());
        }
        builder.templateArguments(types(json, "templateArguments"));
        builder.arguments(types(json, "arguments"));
        return builder.build();
    }

    private List<TypeDescriptor> types(JsonObject json, String member) {
        List<TypeDescriptor> types = new ArrayList<>();
        for (JsonElement element : array(json, member)) {
            JsonObject wrapper = new JsonObject();
            wrapper.add("t", element);
            TypeDescriptor type = type(wrapper, "t");
            if (type != null) {
                types.add(type);
            }
        }
        return types;
    }

    private static JsonArray array(JsonObject json, String member) {
        JsonElement element = json.get(member);
        return element != null && element.isJsonArray() ? element.getAsJsonArray() : new JsonArray();
    }

    private static String string(JsonObject json, String member, String fallback) {
        JsonElement element = json.get(member);
        return element == null || element.isJsonNull() ? fallback : element.getAsString();
    }

    private static int integer(JsonObject json, String member, int fallback) {
        JsonElement element = json.get(member);
        return element == null || element.isJsonNull() ? fallback : element.getAsInt();
    }

    private static boolean bool(JsonObject json, String member, boolean fallback) {
        JsonElement element = json.get(member);
        return element == null || element.isJsonNull() ? fallback : element.getAsBoolean();
    }
}
