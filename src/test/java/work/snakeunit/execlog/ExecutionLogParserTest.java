package work.snakeunit.execlog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.snakeunit.shared.Diagnostics;

class ExecutionLogParserTest {
    private final Diagnostics diagnostics = new Diagnostics();
    private final ExecutionLogParser parser = new ExecutionLogParser(diagnostics);

    private SolvedWorkflow parse(String log) throws IOException {
        return parser.parse(new StringReader(log));
    }

    @Test
    void readsRuleAndCheckpointSections() throws IOException {
        var solved = parse(
            "[Mon Jun 13 14:05:00 2022]\n"
                + "rule rulename1:\n"
                + "    input: input1, input2\n"
                + "    output: output.tsv\n"
                + "    log: logfile\n"
                + "[Mon Jun 13 14:05:01 2022]\n"
                + "checkpoint checkpointname:\n"
                + "    input: input3\n"
                + "    output: output2.tsv\n"
                + "    jobid: 2\n"
                + "    wildcards: sample=a\n"
                + "    benchmark: bench.txt\n"
                + "    resources: tmpdir=/tmp\n"
                + "    threads: 4\n"
                + "    priority: 1\n"
                + "    reason: Missing output files: output2.tsv\n"
                + "This was a dry-run (flag -n)\n"
        );

        assertEquals(2, solved.size());
        var first = solved.recipe(0);
        assertEquals("rulename1", first.ruleName());
        assertFalse(first.checkpoint());
        assertEquals(List.of(Path.of("input1"), Path.of("input2")), first.inputs());
        assertEquals(List.of(Path.of("output.tsv")), first.outputs());
        assertEquals(Optional.of(Path.of("logfile")), first.log());

        var second = solved.recipe(1);
        assertEquals("checkpointname", second.ruleName());
        assertTrue(second.checkpoint());
        assertTrue(second.log().isEmpty());

        assertEquals(2, solved.outputLookup().size());
        assertEquals(first, solved.producerOf(Path.of("output.tsv")).orElseThrow());
        assertEquals(second, solved.producerOf(Path.of("./output2.tsv")).orElseThrow());
        assertTrue(diagnostics.warnings().isEmpty());
    }

    @Test
    void acceptsUnresolvedCheckpointInputs() throws IOException {
        var solved = parse("checkpoint chk:\n    input: <TBD>\n    output: out.tsv\n");
        assertEquals(1, solved.size());
        assertTrue(solved.recipe(0).inputs().isEmpty());
    }

    @Test
    void laterRecipeWinsDuplicateOutput() throws IOException {
        var solved = parse(
            "rule rulename1:\n"
                + "    input: input1\n"
                + "    output: output.tsv\n"
                + "\n"
                + "rule rulename2:\n"
                + "    input: input3\n"
                + "    output: output.tsv\n"
        );

        assertEquals(1, solved.outputLookup().size());
        assertEquals("rulename2", solved.producerOf(Path.of("output.tsv")).orElseThrow().ruleName());
        assertTrue(diagnostics.hasWarningContaining("at least one output file appears multiple times"));
    }

    @Test
    void warnsAboutUnknownKeys() throws IOException {
        var solved = parse("rule a:\n    output: a.txt\n    frobnicate: yes\n    log: a.log\n");
        assertEquals(Optional.of(Path.of("a.log")), solved.recipe(0).log());
        assertTrue(diagnostics.hasWarningContaining("unrecognized log block \"frobnicate\""));
    }

    @Test
    void readsLocalRulesAndStopsAtUnrelatedLines() throws IOException {
        var solved = parse(
            "localrule all:\n"
                + "    input: results/output.tsv\n"
                + "Finished job 0.\n"
                + "    output: stray.txt\n"
        );
        assertEquals(1, solved.size());
        assertEquals("all", solved.recipe(0).ruleName());
        assertTrue(solved.recipe(0).outputs().isEmpty());
        assertTrue(solved.producerOf(Path.of("stray.txt")).isEmpty());
    }

    @Test
    void loadsLogFile() {
        var solved = parser.load(Path.of("src", "test", "resources", "pipelines", "simple", "snakemake.log"));
        assertEquals(2, solved.size());
        assertEquals("combine", solved.recipe(0).ruleName());
        assertEquals("all", solved.recipe(1).ruleName());
        assertEquals(List.of(Path.of("results/output.tsv")), solved.recipe(0).outputs());
    }

    @Test
    void missingLogFileIsFatal() {
        var ex = assertThrows(IllegalStateException.class, () -> parser.load(Path.of("does", "not", "exist.log")));
        assertTrue(ex.getMessage().contains("exist.log"));
    }
}
