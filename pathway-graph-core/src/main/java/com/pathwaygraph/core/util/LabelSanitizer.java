package com.pathwaygraph.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Escapes free text for embedding in a diagram language's quoted labels.
 *
 * <p>Both dialects replace double quotes with apostrophes, turn real newlines and literal
 * {@code \n} sequences into spaces and collapse whitespace. The output never contains a
 * double quote, which would terminate the label and break the diagram.
 *
 * <ul>
 *   <li><b>FLOWCHART:</b> {@code &} and {@code #} become the HTML entities {@code &#38;} and
 *       {@code &#35;}; text longer than {@code maxLength} is cut to fit and ends in
 *       {@code "..."}. Cuts never split an entity.</li>
 *   <li><b>DIGRAPH:</b> backslashes are doubled; text is word-wrapped into lines of at most
 *       {@code maxLength} characters joined with the DOT line break escape {@code \n}.</li>
 * </ul>
 */
public final class LabelSanitizer {

    /** Returned for null or blank input. */
    public static final String EMPTY_LABEL = "Step";

    /** Marker appended to truncated flowchart labels. */
    public static final String ELLIPSIS = "...";

    /** Line break escape inside DOT labels. */
    public static final String DOT_LINE_BREAK = "\\n";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private LabelSanitizer() {
        // Utility class
    }

    /**
     * Sanitizes text for the given dialect.
     *
     * @param text raw text (may be null)
     * @param maxLength maximum label length (flowchart) or line width (digraph); must be at least 4
     * @param dialect target dialect
     * @return sanitized label, or {@value #EMPTY_LABEL} for blank input
     */
    public static String sanitize(String text, int maxLength, LabelDialect dialect) {
        Objects.requireNonNull(dialect, "dialect must not be null");
        if (maxLength <= ELLIPSIS.length()) {
            throw new IllegalArgumentException("maxLength must be greater than " + ELLIPSIS.length());
        }
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return EMPTY_LABEL;
        }
        return switch (dialect) {
            case FLOWCHART -> truncate(escapeFlowchart(normalized), maxLength);
            case DIGRAPH -> wrapDigraph(normalized, maxLength);
        };
    }

    /**
     * Replaces quotes and line breaks and collapses whitespace.
     */
    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String replaced = text
            .replace("\"", "'")
            .replace("\\n", " ")
            .replace('\n', ' ')
            .replace('\r', ' ');
        return WHITESPACE.matcher(replaced).replaceAll(" ").strip();
    }

    private static String escapeFlowchart(String text) {
        return text.replace("&", "&#38;").replace("#", "&#35;");
    }

    /**
     * Truncates to {@code maxLength}, backing off so that no {@code &#NN;} entity is cut.
     */
    private static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        int cut = maxLength - ELLIPSIS.length();
        int entityStart = text.lastIndexOf('&', cut - 1);
        if (entityStart >= 0) {
            int entityEnd = text.indexOf(';', entityStart);
            if (entityEnd >= cut) {
                cut = entityStart;
            }
        }
        return text.substring(0, cut).stripTrailing() + ELLIPSIS;
    }

    /**
     * Greedy word wrap; words longer than the width are broken. Each line is escaped
     * separately so a line break never lands inside a backslash escape.
     */
    private static String wrapDigraph(String text, int width) {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (String word : text.split(" ")) {
            String remaining = word;
            while (remaining.length() > width) {
                if (!line.isEmpty()) {
                    lines.add(line.toString());
                    line.setLength(0);
                }
                lines.add(remaining.substring(0, width));
                remaining = remaining.substring(width);
            }
            if (line.isEmpty()) {
                line.append(remaining);
            } else if (line.length() + 1 + remaining.length() <= width) {
                line.append(' ').append(remaining);
            } else {
                lines.add(line.toString());
                line.setLength(0);
                line.append(remaining);
            }
        }
        if (!line.isEmpty()) {
            lines.add(line.toString());
        }
        return String.join(DOT_LINE_BREAK, lines.stream().map(LabelSanitizer::escapeDigraph).toList());
    }

    private static String escapeDigraph(String line) {
        return line.replace("\\", "\\\\");
    }
}
