package org.pragmatica.txt2tex.generator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OverflowScannerTest {

    @Test
    void linesWithinTheThreshold_produceNothing() {
        assertThat(OverflowScanner.scan("short\nlines\n", 10)).isEmpty();
    }

    @Test
    void longLine_isReportedWithItsNumberAndLength() {
        assertThat(OverflowScanner.scan("ok\n0123456789AB\nok", 10))
            .containsExactly(new GenerationWarning.LineOverflow(2, 12, 10));
    }

    @Test
    void lengthCountsCodePoints() {
        assertThat(OverflowScanner.scan("𝑥𝑥𝑥", 3)).isEmpty();
        assertThat(OverflowScanner.scan("𝑥𝑥𝑥𝑥", 3)).hasSize(1);
    }

    @Test
    void lineExactlyAtTheThreshold_isAllowed() {
        assertThat(OverflowScanner.scan("0123456789", 10)).isEmpty();
    }
}
