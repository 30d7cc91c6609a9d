package com.codesentinel.cli;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.report.render.ReportRenderer;
import com.codesentinel.core.report.render.ReportRenderers;
import com.codesentinel.core.rule.Rule;
import com.codesentinel.core.rule.RuleProvider;
import com.codesentinel.core.rule.RuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list available rules, categories, or report renderers.
 *
 * <p>Rule providers and renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codesentinel list rules
 * codesentinel list categories
 * codesentinel list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available rules, categories, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: rules, categories, or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "rules", "rule" -> listRules();
            case "categories", "category" -> listCategories();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: rules, categories, or renderers", type);
                yield 1;
            }
        };
    }

    private int listRules() {
        System.out.println("Available Rules:");
        System.out.println();

        List<RuleProvider> providers = RuleRegistry.discoverProviders().stream()
            .sorted(Comparator.comparingInt(RuleProvider::getPriority))
            .toList();
        for (RuleProvider provider : providers) {
            System.out.printf("  %s (ID: %s, priority %d)%n",
                provider.getDisplayName(), provider.getId(), provider.getPriority());
            for (Rule rule : provider.rules()) {
                System.out.printf("    • %-28s %-8s %s%n",
                    rule.id(), rule.severity().wireName(), rule.cweId() == null ? "" : rule.cweId());
            }
            System.out.println();
        }

        if (providers.isEmpty()) {
            System.out.println("  No rule providers found.");
        }
        return 0;
    }

    private int listCategories() {
        System.out.println("Available Categories:");
        System.out.println();

        RuleRegistry registry = RuleRegistry.defaultRegistry();
        for (Category category : Category.values()) {
            System.out.printf("  • %-12s %s (%d rules)%n",
                category.wireName(), category.displayName(), registry.rulesFor(category).size());
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        List<ReportRenderer> renderers = ReportRenderers.discover();
        for (ReportRenderer renderer : renderers) {
            System.out.printf("  • %s (.%s)%n", renderer.getId(), renderer.getFileExtension());
        }

        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
