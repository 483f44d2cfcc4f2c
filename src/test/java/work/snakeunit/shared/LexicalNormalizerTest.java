package work.snakeunit.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class LexicalNormalizerTest {
    @Test
    void stripsCommentsAndTrailingWhitespace() {
        var normalized = LexicalNormalizer.normalize(List.of("rule a:  # the first rule", "    input: 'x#y'  ", "# only a comment"));
        assertEquals(List.of("rule a:", "    input: 'x#y'", ""), normalized);
    }

    @Test
    void keepsLineCountWhenJoiningMultiLineStrings() {
        var lines = List.of(
            "    shell:",
            "        \"\"\"",
            "        echo hi",
            "        \"\"\"",
            "x = 1"
        );
        var normalized = LexicalNormalizer.normalize(lines);
        assertEquals(5, normalized.size());
        assertEquals("    shell:", normalized.get(0));
        assertEquals("        \"\"\"\n        echo hi\n        \"\"\"", normalized.get(1));
        assertEquals("", normalized.get(2));
        assertEquals("", normalized.get(3));
        assertEquals("x = 1", normalized.get(4));
    }

    @Test
    void dropsStandaloneDocstrings() {
        var normalized = LexicalNormalizer.normalize(List.of("\"\"\"module", "docs\"\"\"", "x = 1"));
        assertEquals(List.of("", "", "x = 1"), normalized);
    }

    @Test
    void keepsTripleQuotedPieceOfConcatenatedShellCommand() {
        var normalized = LexicalNormalizer.normalize(List.of(
            "rule a:",
            "    output: 'x'",
            "    shell:",
            "        'echo start '",
            "        '''--flag'''"
        ));
        assertEquals("        '''--flag'''", normalized.get(4));
    }

    @Test
    void keepsTripleQuotedLiteralNestedUnderSubBlockHeader() {
        var normalized = LexicalNormalizer.normalize(List.of(
            "rule a:",
            "    output: 'x'",
            "    params:",
            "        extra=1,",
            "        \"\"\"tail\"\"\"",
            "    shell: 'true'"
        ));
        assertEquals("        \"\"\"tail\"\"\"", normalized.get(4));
    }

    @Test
    void dropsStrayDocstringAtRuleBodyLevel() {
        var normalized = LexicalNormalizer.normalize(List.of(
            "rule a:",
            "    output: 'x'",
            "    '''stray'''",
            "    shell: 'true'"
        ));
        assertEquals(List.of("rule a:", "    output: 'x'", "", "    shell: 'true'"), normalized);
    }

    @Test
    void keepsDocstringDirectlyAfterRuleHeader() {
        var normalized = LexicalNormalizer.normalize(List.of("rule a:", "    '''Makes a.'''", "    output: 'a'"));
        assertEquals("    '''Makes a.'''", normalized.get(1));
    }

    @Test
    void joinsOpenBracketsAndExplicitContinuations() {
        var normalized = LexicalNormalizer.normalize(List.of("x = [", "  1,", "  2]", "y = 1 + \\", "  2"));
        assertEquals(List.of("x = [\n  1,\n  2]", "", "", "y = 1 + \\\n  2", ""), normalized);
    }

    @Test
    void treatsOtherQuoteKindAsLiteral() {
        var normalized = LexicalNormalizer.normalize(List.of("x = \"it's\" # note", "y = 'say \"hi\"'"));
        assertEquals(List.of("x = \"it's\"", "y = 'say \"hi\"'"), normalized);
    }

    @Test
    void keepsUnterminatedLiteralAtEndOfFile() {
        var normalized = LexicalNormalizer.normalize(List.of("x = '''open", "still open"));
        assertEquals(List.of("x = '''open\nstill open", ""), normalized);
    }

    @Test
    void recognizesLeadingStringLiterals() {
        assertTrue(LexicalNormalizer.startsWithStringLiteral("\"\"\"doc\"\"\""));
        assertTrue(LexicalNormalizer.startsWithStringLiteral("r'raw'"));
        assertFalse(LexicalNormalizer.startsWithStringLiteral("input: 'a'"));
        assertEquals(4, LexicalNormalizer.indentation("    rule a:"));
    }
}
