package org.pragmatica.txt2tex.ast;

/**
 * How deep a {@code CONTENTS:} table reaches.
 */
public enum ContentsDepth {
    SECTIONS(1),
    SUBSECTIONS(2);

    private final int tocDepth;

    ContentsDepth(int tocDepth) {
        this.tocDepth = tocDepth;
    }

    public int tocDepth() {
        return tocDepth;
    }
}
