package work.snakeunit.synth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TemplateRendererTest {
    @TempDir
    Path tempDir;

    @Test
    void testScriptStartsWithBindings() throws IOException {
        Path template = tempDir.resolve("test.py");
        Files.write(template, List.of("import common", "", "def test_rule():", "    pass"));
        Path unitDir = Files.createDirectories(tempDir.resolve("out/unit"));

        Path script = TemplateRenderer.writeTestScript(
            unitDir,
            tempDir.resolve("out"),
            "combine",
            Path.of("workflow/Snakefile"),
            Path.of("."),
            List.of(".docx", ".eps"),
            template
        );

        assertEquals(unitDir.resolve("test_combine.py"), script);
        assertEquals(
            List.of(
                "#!/usr/bin/env python3",
                "unit_test_dir='" + unitDir + "'",
                "testdir='" + tempDir.resolve("out") + "'",
                "rulename='combine'",
                "snakefile_relative_path='workflow/Snakefile'",
                "snakemake_exec_path='.'",
                "extra_comparison_exclusions=['.docx', '.eps', ]",
                "import common",
                "",
                "def test_rule():",
                "    pass"
            ),
            Files.readAllLines(script)
        );
    }

    @Test
    void rendersEmptyExclusionList() {
        assertEquals("[]", TemplateRenderer.pythonList(List.of()));
        assertEquals("['.pdf', ]", TemplateRenderer.pythonList(List.of(".pdf")));
    }

    @Test
    void launcherBindsTestDirectoryAfterShebang() throws IOException {
        Path template = tempDir.resolve("pytest_runner.bash");
        Files.write(template, List.of("#!/usr/bin/env bash", "pytest \"${SNAKEMAKE_UNIT_TESTS_DIR}/unit\""));
        Path target = Files.createDirectories(tempDir.resolve("out"));

        Path launcher = TemplateRenderer.writeLauncher(target, Path.of("/abs/tests"), template);

        assertEquals(
            List.of(
                "#!/usr/bin/env bash",
                "SNAKEMAKE_UNIT_TESTS_DIR=" + Path.of("/abs/tests"),
                "pytest \"${SNAKEMAKE_UNIT_TESTS_DIR}/unit\""
            ),
            Files.readAllLines(launcher)
        );
        assertTrue(Files.isExecutable(launcher));
    }

    @Test
    void launcherNeedsTargetDirectoryAndTemplate() throws IOException {
        Path template = Files.writeString(tempDir.resolve("pytest_runner.bash"), "#!/usr/bin/env bash\n");

        assertThrows(
            IllegalStateException.class,
            () -> TemplateRenderer.writeLauncher(tempDir.resolve("missing"), tempDir, template)
        );
        var ex = assertThrows(
            IllegalStateException.class,
            () -> TemplateRenderer.writeLauncher(tempDir, tempDir, tempDir.resolve("absent.bash"))
        );
        assertTrue(ex.getMessage().contains("cannot find template file"));
    }
}
