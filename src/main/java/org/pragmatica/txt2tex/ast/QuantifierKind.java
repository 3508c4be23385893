package org.pragmatica.txt2tex.ast;

public enum QuantifierKind {
    FORALL,
    EXISTS,
    EXISTS_UNIQUE
}
