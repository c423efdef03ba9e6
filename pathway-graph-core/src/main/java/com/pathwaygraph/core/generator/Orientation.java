package com.pathwaygraph.core.generator;

import java.util.Locale;

/**
 * Layout direction of a rendered pathway.
 */
public enum Orientation {
    /** Top to bottom */
    VERTICAL("TD", "TB"),

    /** Left to right */
    HORIZONTAL("LR", "LR");

    private final String mermaidDirection;
    private final String dotRankdir;

    Orientation(String mermaidDirection, String dotRankdir) {
        this.mermaidDirection = mermaidDirection;
        this.dotRankdir = dotRankdir;
    }

    /**
     * Returns the Mermaid {@code graph} direction keyword.
     *
     * @return "TD" or "LR"
     */
    public String mermaidDirection() {
        return mermaidDirection;
    }

    /**
     * Returns the Graphviz {@code rankdir} value.
     *
     * @return "TB" or "LR"
     */
    public String dotRankdir() {
        return dotRankdir;
    }

    /**
     * Parses an orientation from configuration or command-line text.
     *
     * <p>Accepts {@code vertical}, {@code TD} and {@code TB} for {@link #VERTICAL}, and
     * {@code horizontal} and {@code LR} for {@link #HORIZONTAL}, case-insensitively.
     *
     * @param value orientation text (null means vertical)
     * @return orientation
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static Orientation fromValue(String value) {
        if (value == null) {
            return VERTICAL;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "VERTICAL", "TD", "TB" -> VERTICAL;
            case "HORIZONTAL", "LR" -> HORIZONTAL;
            default -> throw new IllegalArgumentException("Unknown orientation: " + value);
        };
    }
}
