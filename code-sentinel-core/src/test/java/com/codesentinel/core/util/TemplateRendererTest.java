package com.codesentinel.core.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TemplateRenderer}.
 */
class TemplateRendererTest {

    @Test
    void render_substitutesGroupsAndCaseModifiers() {
        String result = TemplateRenderer.render(
            "{1} = os.getenv(\"{1:upper}\")", List.of("api_key = 'x'", "api_key"), "api_key = 'x'");

        assertThat(result).isEqualTo("api_key = os.getenv(\"API_KEY\")");
    }

    @Test
    void render_substitutesSnippet() {
        assertThat(TemplateRenderer.render("{snippet}:", List.of(), "if x > 1")).isEqualTo("if x > 1:");
    }

    @Test
    void render_missingGroup_isEmpty() {
        assertThat(TemplateRenderer.render("[{3}]", List.of("a"), "")).isEqualTo("[]");
    }

    @Test
    void render_otherBraces_areLeftUntouched() {
        assertThat(TemplateRenderer.render("f\"{var1}{var2}\"", List.of(), ""))
            .isEqualTo("f\"{var1}{var2}\"");
    }

    @Test
    void render_replacementContainingDollar_isLiteral() {
        assertThat(TemplateRenderer.render("{1}", List.of("", "$price"), "")).isEqualTo("$price");
    }

    @Test
    void render_indexBeyondIntRange_isEmpty() {
        assertThat(TemplateRenderer.render("value: {99999999999}", List.of("a", "b"), ""))
            .isEqualTo("value: ");
    }

    @Test
    void render_nullTemplate_returnsNull() {
        assertThat(TemplateRenderer.render(null, List.of(), "x")).isNull();
    }
}
