package org.pxdforge.generator.frontend.dialect;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token-level rewriting of C/C++ type spellings into Cython spellings.
 *
 * <p>All methods are pure and idempotent: converting an already converted spelling
 * returns it unchanged. Names that need namespace resolution are never passed through
 * here; that is the job of the type resolver.</p>
 */
public final class DialectConverter {

    private static final Pattern THROW_SPEC = Pattern.compile("\\bthrow\\s*\\([^)]*\\)");
    private static final Pattern NOEXCEPT = Pattern.compile("\\bnoexcept(\\s*\\([^)]*\\))?");
    private static final Pattern BOOL = Pattern.compile("\\b(_Bool|bool)\\b");
    private static final Pattern DROPPED_QUALIFIERS = Pattern.compile("\\b(__restrict__|__restrict|restrict|volatile|typename)\\b\\s*");
    private static final Pattern ELABORATION = Pattern.compile("^(const\\s+)?(struct|enum|union|class)\\s+");
    private static final Pattern SPACES = Pattern.compile("\\s{2,}");
    private static final Pattern SPACE_BEFORE_DECORATION = Pattern.compile("\\s+([*&\\]])");
    private static final Pattern SPACE_AFTER_OPEN = Pattern.compile("\\[\\s+");

    private DialectConverter() {
    }

    /**
     * Converts a type spelling to the Cython dialect.
     *
     * @param spelling The C/C++ spelling, e.g. {@code const std::vector<bool> &}.
     * @return The Cython spelling, e.g. {@code const std::vector[bint]&}.
     */
    public static String convert(String spelling) {
        if (spelling == null || spelling.isEmpty()) {
            return "";
        }
        String result = spelling.replace('<', '[').replace('>', ']');
        result = convertExceptionSpecification(result);
        result = BOOL.matcher(result).replaceAll("bint");
        result = DROPPED_QUALIFIERS.matcher(result).replaceAll("");
        return normalizeSpaces(result);
    }

    /**
     * Rewrites a dynamic exception specification into Cython's {@code except +} and drops
     * {@code noexcept}.
     *
     * @param text A function suffix or full declaration.
     * @return The rewritten text.
     */
    public static String convertExceptionSpecification(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        Matcher matcher = THROW_SPEC.matcher(text);
        String result = matcher.find() ? matcher.replaceFirst("except +") : text;
        return NOEXCEPT.matcher(result).replaceAll("").trim();
    }

    /**
     * Removes a leading {@code struct}, {@code enum}, {@code union} or {@code class}
     * keyword, keeping a leading {@code const}.
     */
    public static String stripElaboration(String spelling) {
        if (spelling == null) {
            return "";
        }
        Matcher matcher = ELABORATION.matcher(spelling.trim());
        if (matcher.find()) {
            String constPrefix = matcher.group(1) == null ? "" : "const ";
            return constPrefix + spelling.trim().substring(matcher.end());
        }
        return spelling.trim();
    }

    /**
     * Removes template arguments: {@code Foo<int>} becomes {@code Foo}.
     */
    public static String stripTemplateArguments(String spelling) {
        int open = spelling.indexOf('<');
        return open < 0 ? spelling : spelling.substring(0, open).trim();
    }

    private static String normalizeSpaces(String text) {
        String result = SPACES.matcher(text).replaceAll(" ");
        result = SPACE_BEFORE_DECORATION.matcher(result).replaceAll("$1");
        result = SPACE_AFTER_OPEN.matcher(result).replaceAll("[");
        return result.trim();
    }
}
