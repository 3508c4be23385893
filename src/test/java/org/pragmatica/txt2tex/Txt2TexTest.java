package org.pragmatica.txt2tex;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pragmatica.txt2tex.error.ConversionException;
import org.pragmatica.txt2tex.error.LexError;
import org.pragmatica.txt2tex.error.ParseError;
import org.pragmatica.txt2tex.generator.GenerationWarning;
import org.pragmatica.txt2tex.generator.NotationMode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class Txt2TexTest {

    @Nested
    class Convert {

        @Test
        void defaults_produceAStandaloneStandardDocument() {
            var result = Txt2Tex.convert("""
                === Exercise 1 ===
                forall x : N | x >= 0
                """);

            assertThat(result.output()).startsWith("\\documentclass")
                                       .contains("\\section*{Exercise 1}")
                                       .contains("\\forall x \\colon \\mathbb{N} \\bullet x \\geq 0");
            assertThat(result.hasWarnings()).isFalse();
        }

        @Test
        void lexError_isThrown() {
            assertThatThrownBy(() -> Txt2Tex.convert("x = $y")).isInstanceOf(LexError.class);
        }

        @Test
        void parseError_isThrown() {
            assertThatThrownBy(() -> Txt2Tex.convert("schema S\n  x : N\n")).isInstanceOf(ParseError.class);
        }

        @Test
        void parseThenGenerate_matchesConvert() {
            var source = "p and q => r";
            var document = Txt2Tex.parse(source);

            assertThat(Txt2Tex.generate(document, NotationMode.STANDARD, 100))
                .isEqualTo(Txt2Tex.convert(source));
        }

        @Test
        void generate_appliesTheThreshold() {
            var result = Txt2Tex.generate(Txt2Tex.parse("p and q => r"), NotationMode.FUZZ, 20);

            assertThat(result.warnings()).isNotEmpty()
                                         .allMatch(warning -> warning instanceof GenerationWarning.LineOverflow);
        }
    }

    @Nested
    class Builder {

        @Test
        void fuzzBodyOnly() {
            var converter = Txt2Tex.builder()
                                   .notationMode(NotationMode.FUZZ)
                                   .standalone(false)
                                   .build();

            assertThat(converter.convert("p => q").output()).isEqualTo("\\[\np \\implies q\n\\]\n\n");
        }

        @Test
        void strictIndentation_reachesTheParser() {
            var converter = Txt2Tex.builder()
                                   .strictIndentation(true)
                                   .indentUnit(4)
                                   .build();

            assertThat(converter.parserConfig().indentUnit()).isEqualTo(4);
            assertThat(converter.convert("PROOF:\np\n    q\n").hasWarnings()).isFalse();
            assertThatThrownBy(() -> converter.convert("PROOF:\np\n  q\n"))
                .isInstanceOf(ParseError.class)
                .hasMessageContaining("Expected proof step at column 5 but found column 3");
        }

        @Test
        void converter_isReusable() {
            var converter = Txt2Tex.builder()
                                   .overflowThreshold(80)
                                   .build();

            assertThat(converter.generatorConfig().overflowThreshold()).isEqualTo(80);
            assertThat(converter.convert("p")).isEqualTo(converter.convert("p"));
        }

        @Test
        void thresholdBelowOne_turnsOverflowWarningsOff() {
            var converter = Txt2Tex.builder()
                                   .overflowThreshold(0)
                                   .build();

            assertThat(converter.convert("p and q => r").hasWarnings()).isFalse();
            assertThat(Txt2Tex.generate(Txt2Tex.parse("p and q => r"), NotationMode.FUZZ, -5).warnings()).isEmpty();
        }
    }

    @Test
    void diagnose_namesTheFile() {
        var source = "x = $y";
        var error = catchThrowableOfType(() -> Txt2Tex.convert(source), ConversionException.class);

        assertThat(Txt2Tex.diagnose(error, source)).contains("--> input:1:5");
        assertThat(Txt2Tex.diagnose(error, source, "hw1.txt")).startsWith("error: Unexpected character '$'")
                                                            .contains("--> hw1.txt:1:5");
    }
}
