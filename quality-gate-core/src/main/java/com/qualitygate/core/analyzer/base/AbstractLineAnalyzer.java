package com.qualitygate.core.analyzer.base;

import com.qualitygate.core.analyzer.AnalyzerSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for analyzers that work from line-oriented pattern heuristics.
 *
 * <p>The built-in analyzers intentionally do not parse source into a syntax tree; they match
 * precompiled regular expressions against lines or whole files. This base class provides the
 * matching primitives they share.
 *
 * @see AbstractAnalyzer
 */
public abstract class AbstractLineAnalyzer extends AbstractAnalyzer {

    protected AbstractLineAnalyzer(AnalyzerSettings settings) {
        super(settings);
    }

    /**
     * A match on a single line.
     *
     * @param line 1-based line number
     * @param column 1-based column of the match start
     * @param text matched text
     */
    public record LineMatch(int line, int column, String text) {}

    // ==================== Pattern Matching Utilities ====================

    /**
     * Splits content into lines, keeping empty trailing lines out.
     *
     * @param content file content
     * @return lines without terminators
     */
    protected List<String> splitLines(String content) {
        return content.lines().toList();
    }

    /**
     * Finds every match of a pattern, line by line, skipping comment lines.
     *
     * @param pattern compiled pattern
     * @param lines file lines
     * @return matches in line order
     */
    protected List<LineMatch> findLineMatches(Pattern pattern, List<String> lines) {
        List<LineMatch> matches = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (isComment(line)) {
                continue;
            }
            Matcher matcher = pattern.matcher(line);
            while (matcher.find()) {
                matches.add(new LineMatch(i + 1, matcher.start() + 1, matcher.group()));
            }
        }
        return matches;
    }

    /**
     * Counts non-overlapping matches of a pattern in a text.
     *
     * @param pattern compiled pattern
     * @param text text to search
     * @return match count
     */
    protected int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * Computes the 1-based line number of a character offset.
     *
     * @param content file content
     * @param offset character offset
     * @return line number
     */
    protected int lineNumberAt(String content, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * Checks whether a line is a single-line or block comment line.
     *
     * @param line line to check
     * @return true if the trimmed line starts a comment
     */
    protected boolean isComment(String line) {
        String trimmed = line.trim();
        return trimmed.startsWith("//") || trimmed.startsWith("/*") || trimmed.startsWith("*");
    }
}
