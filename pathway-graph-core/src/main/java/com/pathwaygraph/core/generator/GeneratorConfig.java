package com.pathwaygraph.core.generator;

import java.util.Map;

/**
 * Configuration for diagram generation.
 *
 * <p>Recognized custom settings:
 * <ul>
 *   <li>{@code labelLength} ({@link Integer}) - overrides the generator's node label length</li>
 *   <li>{@code name} ({@link String}) - base file name of the generated diagram</li>
 * </ul>
 *
 * @param includeStyling whether the flowchart emits style classes
 * @param orientation layout direction
 * @param customSettings generator-specific custom settings
 */
public record GeneratorConfig(
    boolean includeStyling,
    Orientation orientation,
    Map<String, Object> customSettings
) {
    /** Diagram base name used when none is configured. */
    public static final String DEFAULT_NAME = "pathway";

    public GeneratorConfig {
        if (orientation == null) {
            orientation = Orientation.VERTICAL;
        }
        customSettings = customSettings == null ? Map.of() : Map.copyOf(customSettings);
    }

    /**
     * Creates the default configuration: styled, vertical.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(true, Orientation.VERTICAL, Map.of());
    }

    /**
     * Gets a custom setting value.
     *
     * @param key setting key
     * @param <T> expected type
     * @return setting value or null
     */
    @SuppressWarnings("unchecked")
    public <T> T getSetting(String key) {
        return (T) customSettings.get(key);
    }

    /**
     * Gets a custom setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @param <T> expected type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Returns the configured diagram base name.
     *
     * @return name setting or {@value #DEFAULT_NAME}
     */
    public String diagramName() {
        return getSettingOrDefault("name", DEFAULT_NAME);
    }
}
