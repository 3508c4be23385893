package org.pragmatica.txt2tex.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.txt2tex.parser.Parser;
import org.pragmatica.txt2tex.tree.SourceLocation;
import org.pragmatica.txt2tex.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DiagnosticTest {

    private static ConversionException failure(String source) {
        return catchThrowableOfType(() -> Parser.parse(source), ConversionException.class);
    }

    @Test
    void lexError_pointsAtTheCharacter() {
        var source = "x = $y";

        assertThat(Diagnostic.of(failure(source)).format(source, "input")).isEqualTo("""
            error: Unexpected character '$'
              --> input:1:5
              |
            1 | x = $y
              |     ^
              |
              = help: this character is not valid in whiteboard notation
            """);
    }

    @Test
    void parseError_showsThePrecedingLine() {
        var source = "p\nx + )";

        var formatted = Diagnostic.of(failure(source)).format(source, "exercise.txt");

        assertThat(formatted).startsWith("error: Unexpected ')', expected expression\n")
                             .contains("  --> exercise.txt:2:5\n")
                             .contains("1 | p\n")
                             .contains("2 | x + )\n");
    }

    @Test
    void missingEnd_getsAHelpNote() {
        var diagnostic = Diagnostic.of(failure("schema S\n  x : N\nwhere\n  x > 0\n"));

        assertThat(diagnostic.severity()).isEqualTo(Diagnostic.Severity.ERROR);
        assertThat(diagnostic.notes()).containsExactly("help: did you forget 'end' before starting a new block?");
    }

    @Test
    void chainedComparison_getsAHelpNote() {
        var diagnostic = Diagnostic.of(failure("x < y < z"));

        assertThat(diagnostic.notes()).singleElement()
                                      .asString()
                                      .contains("add parentheses");
    }

    @Test
    void errorWithoutKnownHint_hasNoNotes() {
        assertThat(Diagnostic.of(failure("PROOF:\n  p\nq\n")).notes()).isEmpty();
    }

    @Test
    void formatSimple_isOneLine() {
        assertThat(Diagnostic.of(failure("x = $y")).formatSimple(null))
            .isEqualTo("input:1:5: error: Unexpected character '$'");
    }

    @Test
    void warning_withNotes() {
        var span = SourceSpan.of(SourceLocation.at(1, 1, 0), SourceLocation.at(1, 3, 2));

        var formatted = Diagnostic.warning("Suspicious formula", span)
                                  .withNote("note: first")
                                  .withHelp("second")
                                  .format("abc", null);

        assertThat(formatted).startsWith("warning: Suspicious formula\n  --> 1:1\n")
                             .contains("  | ^^\n")
                             .endsWith("  = note: first\n  = help: second\n");
    }
}
