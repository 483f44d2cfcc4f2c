package work.snakeunit.workflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.snakeunit.shared.LexicalNormalizer;

class BlockTest {
    private static Block single(int globalIndentation, String... lines) {
        var blocks = BlockParser.parseAll(LexicalNormalizer.normalize(List.of(lines)), Path.of("test.smk"), globalIndentation);
        return blocks.get(blocks.size() - 1);
    }

    @Test
    void rendersSubBlocksInCanonicalOrder() {
        Block rule = single(0,
            "rule r:",
            "    shell: 's'",
            "    params: p=1",
            "    output: 'o'",
            "    log: 'l'",
            "    input: 'i'"
        );
        assertEquals(
            "rule r:\n    input: 'i'\n    output: 'o'\n    params: p=1\n    log: 'l'\n    shell: 's'\n\n\n",
            rule.render()
        );
    }

    @Test
    void appliesGlobalIndentationToEveryLine() {
        Block rule = single(4, "rule a:", "    input:", "        'x',", "    shell: 'touch {output}'");
        assertEquals(
            "    rule a:\n        input:\n            'x',\n        shell: 'touch {output}'\n\n\n",
            rule.render()
        );
        assertEquals("    x = 1\n", single(4, "x = 1").render());
    }

    @Test
    void rendersDerivedRuleHeaders() {
        assertEquals("use rule a as b with:\n    output: 'x'\n\n\n", single(0, "use rule a as b with:", "    output: 'x'").render());
        assertEquals("use rule a as b\n\n\n", single(0, "use rule a as b").render());

        Block merged = single(0, "use rule a as b with:", "    output: 'x'");
        merged.offerBaseRuleContents("a", "shell", " 'cp'");
        merged.markBaseMerged();
        assertEquals("rule b:\n    output: 'x'\n    shell: 'cp'\n\n\n", merged.render());
    }

    @Test
    void placeholderKeepsRuleIndentation() {
        Block rule = single(0, "if x:", "    rule a:", "        output: 'a'");
        assertEquals("    pass\n", rule.renderPlaceholder());
        Block nested = single(4, "rule a:", "    output: 'a'");
        assertEquals("    pass\n", nested.renderPlaceholder());
    }

    @Test
    void reparsingRenderedRuleYieldsEqualBlock() {
        Block original = single(0,
            "rule combine:",
            "    \"\"\"",
            "    Combine tables.",
            "    \"\"\"",
            "    input:",
            "        a=\"a.tsv\",",
            "        b=\"b.tsv\",",
            "    output: \"out.tsv\"",
            "    threads: 2",
            "    shell:",
            "        \"cat {input} > {output}\""
        );
        List<String> rendered = Arrays.asList(original.render().split("\n", -1));
        Block reparsed = single(0, rendered.toArray(new String[0]));
        assertEquals(original, reparsed);
        assertEquals(original.hashCode(), reparsed.hashCode());
    }

    @Test
    void equalityIgnoresBookkeeping() {
        Block first = single(0, "rule a:", "    output: 'a'");
        Block second = single(0, "", "", "rule a:", "    output: 'a'");
        second.setResolution(ResolutionStatus.RESOLVED_INCLUDED);
        second.setInterpreterTag(7);
        assertEquals(first, second);
        assertNotEquals(first, single(0, "rule a:", "    output: 'b'"));
        assertNotEquals(first, single(4, "rule a:", "    output: 'a'"));
    }

    @Test
    void rejectsMixingCodeAndSubBlocks() {
        Block rule = single(0, "rule a:", "    output: 'a'");
        assertThrows(IllegalStateException.class, () -> rule.addCodeLine("x = 1"));
        Block code = single(0, "x = 1");
        assertThrows(IllegalStateException.class, () -> code.putNamedBlock("output", " 'a'"));
    }

    @Test
    void mergeRequiresMatchingBaseName() {
        Block derived = single(0, "use rule a as b with:", "    output: 'x'");
        assertThrows(IllegalArgumentException.class, () -> derived.offerBaseRuleContents("c", "shell", " 'x'"));
    }

    @Test
    void shiftsContinuationLinesWithoutTouchingTheFirst() {
        assertEquals(" 'x'", Block.shiftContinuationLines(" 'x'", 4));
        assertEquals("\n        'a'\n\n        'b'", Block.shiftContinuationLines("\n    'a'\n\n    'b'", 4));
        assertEquals("\n'a'\n  'b'", Block.shiftContinuationLines("\n  'a'\n    'b'", -2));
        assertEquals("\n'a'", Block.shiftContinuationLines("\n  'a'", -8));
    }
}
