package work.snakeunit.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigFileLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void readsYaml() throws IOException {
        Path file = Files.writeString(
            tempDir.resolve("snakeunit.yaml"),
            String.join(
                "\n",
                "snakefile: workflow/Snakefile",
                "snakemake-log: logs/run.log",
                "exclude-rules:",
                "  - all",
                "  - report",
                "comparison-exclusions: .pdf",
                "include-entire-dag: true",
                ""
            )
        );

        ConfigFile config = ConfigFileLoader.load(file);

        assertEquals("workflow/Snakefile", config.snakefile());
        assertEquals("logs/run.log", config.snakemakeLog());
        assertEquals(List.of("all", "report"), config.excludeRules());
        assertEquals(List.of(".pdf"), config.comparisonExclusions());
        assertEquals(Boolean.TRUE, config.includeEntireDag());
        assertNull(config.instDir());
        assertTrue(config.addedFiles().isEmpty());
    }

    @Test
    void readsToml() throws IOException {
        Path file = Files.writeString(
            tempDir.resolve("snakeunit.toml"),
            String.join(
                "\n",
                "inst-dir = \"inst\"",
                "added-directories = [\"config\", \"resources\"]",
                "update = [\"snakefiles\", \"pytest\"]",
                ""
            )
        );

        ConfigFile config = ConfigFileLoader.load(file);

        assertEquals("inst", config.instDir());
        assertEquals(List.of("config", "resources"), config.addedDirectories());
        assertEquals(List.of("snakefiles", "pytest"), config.update());
        assertNull(config.includeEntireDag());
    }

    @Test
    void rejectsUnknownKeys() throws IOException {
        Path file = Files.writeString(tempDir.resolve("bad.yaml"), "snakefiles: oops\n");

        var ex = assertThrows(IllegalArgumentException.class, () -> ConfigFileLoader.load(file));
        assertTrue(ex.getMessage().contains("snakefiles"));
    }

    @Test
    void rejectsNestedValues() throws IOException {
        Path file = Files.writeString(tempDir.resolve("bad.yaml"), "snakefile:\n  path: x\n");

        assertThrows(IllegalArgumentException.class, () -> ConfigFileLoader.load(file));
    }

    @Test
    void rejectsUnsupportedExtensions() throws IOException {
        Path file = Files.writeString(tempDir.resolve("config.json"), "{}");

        assertThrows(IllegalArgumentException.class, () -> ConfigFileLoader.load(file));
    }
}
