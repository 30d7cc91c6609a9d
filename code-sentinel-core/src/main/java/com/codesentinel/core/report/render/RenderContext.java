package com.codesentinel.core.report.render;

import java.util.Map;

/**
 * Settings passed to renderers.
 *
 * <p>Known keys: {@code console.colors} ("true"/"false") for the text renderer.
 *
 * @param settings renderer-specific settings
 */
public record RenderContext(Map<String, String> settings) {

    public RenderContext {
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public static RenderContext defaults() {
        return new RenderContext(Map.of());
    }

    /**
     * Gets a setting value.
     *
     * @param key setting key
     * @return setting value or null
     */
    public String getSetting(String key) {
        return settings.get(key);
    }

    /**
     * Gets a setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
