package com.codesentinel.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CompareCommand}.
 */
class CompareCommandTest extends CommandTestBase {

    @Test
    void compare_fixedCredential_reportsImprovement() throws Exception {
        Path before = createFile("before.py", "password = \"admin123\"\nconnect(password)\n");
        Path after = createFile("after.py", "password = os.getenv(\"PASSWORD\")\nconnect(password)\n");

        int exitCode = execute(new CompareCommand(),
            before.toString(), after.toString(), "--only", "security", "-c", configFile.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("Security:     75 -> 100 (+25)")
            .contains("Fixed 1 issues. Security improved by 25.0%");
    }

    @Test
    void compare_jsonFormat_hasWireNames() throws Exception {
        Path before = createFile("before.py", "x = eval(data)\nuse(x)\n");
        Path after = createFile("after.py", "x = parse(data)\nuse(x)\n");

        int exitCode = execute(new CompareCommand(),
            before.toString(), after.toString(), "-f", "json", "-c", configFile.toString());

        assertThat(exitCode).isZero();
        JsonNode root = new ObjectMapper().readTree(stdout());
        assertThat(root.get("issues_fixed").asInt()).isEqualTo(1);
        assertThat(root.get("before").get("file_name").asText()).isEqualTo("before.py");
    }
}
