package com.codesentinel.core.report.render;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Lookup of the {@link ReportRenderer} implementations on the class path.
 *
 * @since 1.0.0
 */
public final class ReportRenderers {

    private ReportRenderers() {
        // Utility class - prevent instantiation
    }

    /**
     * Discovers every renderer, sorted by id.
     *
     * @return renderers
     */
    public static List<ReportRenderer> discover() {
        List<ReportRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(ReportRenderer.class).forEach(renderers::add);
        renderers.sort(Comparator.comparing(ReportRenderer::getId));
        return renderers;
    }

    /**
     * Finds a renderer by id, case-insensitively.
     *
     * @param id renderer id
     * @return renderer if one is registered under the id
     */
    public static Optional<ReportRenderer> byId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String wanted = id.trim().toLowerCase(Locale.ROOT);
        return discover().stream().filter(renderer -> renderer.getId().equals(wanted)).findFirst();
    }
}
