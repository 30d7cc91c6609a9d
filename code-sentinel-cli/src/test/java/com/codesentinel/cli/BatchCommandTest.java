package com.codesentinel.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link BatchCommand}.
 */
class BatchCommandTest extends CommandTestBase {

    @Test
    void batch_allFilesValid_listsEachInOrder() throws Exception {
        Path first = createFile("a.py", "password = \"admin123\"\n");
        Path second = createFile("b.py", "x = 1\nuse(x)\n");

        int exitCode = execute(new BatchCommand(), first.toString(), second.toString(), "-c", configFile.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("[OK] a.py: Found")
            .contains("[OK] b.py: Found")
            .contains("Processed: 2, successful: 2, failed: 0");
        assertThat(stdout().indexOf("a.py")).isLessThan(stdout().indexOf("b.py"));
    }

    @Test
    void batch_emptyFile_isReportedAsFailed() throws Exception {
        Path good = createFile("a.py", "x = 1\nuse(x)\n");
        Path empty = createFile("empty.py", "");

        int exitCode = execute(new BatchCommand(), good.toString(), empty.toString(), "-c", configFile.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout()).contains("[FAILED] empty.py: Analysis failed:");
    }

    @Test
    void batch_jsonFormat_containsCounters() throws Exception {
        Path file = createFile("a.py", "x = 1\nuse(x)\n");

        int exitCode = execute(new BatchCommand(), file.toString(), "-f", "json", "-c", configFile.toString());

        assertThat(exitCode).isZero();
        JsonNode root = new ObjectMapper().readTree(stdout());
        assertThat(root.get("total_processed").asInt()).isEqualTo(1);
        assertThat(root.get("results").get(0).get("file_name").asText()).isEqualTo("a.py");
        assertThat(root.get("results").get(0).get("success").asBoolean()).isTrue();
    }

    @Test
    void batch_missingFile_exitsOne() {
        int exitCode = execute(new BatchCommand(), tempDir.resolve("missing.py").toString(), "-c", configFile.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Batch analysis failed");
    }
}
