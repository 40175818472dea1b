package com.qualitygate.core.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts module specifiers from JavaScript and TypeScript source text.
 *
 * <p>Recognized forms:
 * <ul>
 *   <li>{@code import x from 'module'} and {@code import type {X} from 'module'}</li>
 *   <li>side-effect imports: {@code import 'module'}</li>
 *   <li>re-exports: {@code export * from 'module'}, {@code export {x} from 'module'}</li>
 *   <li>{@code require('module')} and dynamic {@code import('module')}</li>
 * </ul>
 *
 * <p>A specifier is <em>external</em> (a package) unless it starts with {@code .}, {@code /}
 * or the {@code @/} source alias.
 */
public final class ImportExtractor {

    private static final Pattern IMPORT_FROM = Pattern.compile(
        "\\b(?:import|export)\\s+(?:type\\s+)?[^'\";]*?\\bfrom\\s+['\"]([^'\"]+)['\"]", Pattern.DOTALL);
    private static final Pattern SIDE_EFFECT_IMPORT = Pattern.compile(
        "^\\s*import\\s+['\"]([^'\"]+)['\"]", Pattern.MULTILINE);
    private static final Pattern CALL_IMPORT = Pattern.compile(
        "\\b(?:require|import)\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    /** Alias for the project source root, as configured by most bundlers. */
    public static final String SOURCE_ALIAS = "@/";

    private ImportExtractor() {
        // Utility class
    }

    /**
     * Extracts all module specifiers in order of appearance.
     *
     * @param content source text
     * @return specifiers, possibly with duplicates
     */
    public static List<String> extract(String content) {
        List<Match> matches = new ArrayList<>();
        for (Pattern pattern : List.of(IMPORT_FROM, SIDE_EFFECT_IMPORT, CALL_IMPORT)) {
            Matcher matcher = pattern.matcher(content);
            while (matcher.find()) {
                matches.add(new Match(matcher.start(1), matcher.group(1).trim()));
            }
        }
        matches.sort((a, b) -> Integer.compare(a.offset(), b.offset()));

        List<String> specifiers = new ArrayList<>();
        int lastOffset = -1;
        for (Match match : matches) {
            // The same specifier can be matched by two patterns
            if (match.offset() != lastOffset && !match.specifier().isEmpty()) {
                specifiers.add(match.specifier());
            }
            lastOffset = match.offset();
        }
        return specifiers;
    }

    /**
     * Checks whether a specifier refers to an external package.
     *
     * @param specifier module specifier
     * @return true for package imports
     */
    public static boolean isExternal(String specifier) {
        if (specifier.startsWith(SOURCE_ALIAS)) {
            return false;
        }
        return !specifier.startsWith(".") && !specifier.startsWith("/");
    }

    /**
     * Returns the package a specifier belongs to: the first segment, or the first two for
     * scoped packages ({@code @scope/name}).
     *
     * @param specifier external module specifier
     * @return package name
     */
    public static String packageName(String specifier) {
        String[] segments = specifier.split("/");
        if (specifier.startsWith("@") && segments.length > 1) {
            return segments[0] + "/" + segments[1];
        }
        return segments[0];
    }

    private record Match(int offset, String specifier) {}
}
