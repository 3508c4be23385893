package org.pragmatica.txt2tex.generator;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports output lines longer than a threshold. Lengths count Unicode code points. A threshold
 * below 1 reports nothing.
 */
final class OverflowScanner {
    private OverflowScanner() {}

    static List<GenerationWarning> scan(String output, int threshold) {
        var warnings = new ArrayList<GenerationWarning>();
        if (threshold < 1) {
            return warnings;
        }
        var lines = output.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            var line = lines[i];
            int length = line.codePointCount(0, line.length());
            if (length > threshold) {
                warnings.add(new GenerationWarning.LineOverflow(i + 1, length, threshold));
            }
        }
        return warnings;
    }
}
