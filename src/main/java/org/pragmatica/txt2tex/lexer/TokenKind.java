package org.pragmatica.txt2tex.lexer;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of token kinds. ASCII and Unicode spellings of one operator share a kind.
 */
public enum TokenKind {
    IDENTIFIER,
    NUMBER,

    // Propositional logic
    AND,
    OR,
    NOT,
    IMPLIES,
    IFF,

    // Binders
    FORALL,
    EXISTS,
    EXISTS1,
    MU,
    LAMBDA,
    IF,
    THEN,
    ELSE,

    // Relational tier
    EQUALS,
    NOT_EQUAL,
    LESS,
    GREATER,
    LESS_EQUAL,
    GREATER_EQUAL,
    IN,
    NOT_IN,
    SUBSET,
    PROPER_SUBSET,

    // Sets and relations
    UNION,
    INTERSECT,
    SET_MINUS,
    CROSS,
    RELATION,
    MAPLET,
    DOM_RESTRICT,
    RAN_RESTRICT,
    DOM_SUBTRACT,
    RAN_SUBTRACT,
    COMPOSE,
    CIRCLE,
    OVERRIDE,

    // Function arrows
    TOTAL_FUN,
    PARTIAL_FUN,
    TOTAL_INJ,
    PARTIAL_INJ,
    TOTAL_SURJ,
    PARTIAL_SURJ,
    BIJECTION,
    FINITE_FUN,

    // Arithmetic
    PLUS,
    MINUS,
    TIMES,
    DIV,
    MOD,
    HASH,

    // Sequences and bags
    CONCAT,
    FILTER,
    BAG_UNION,
    RANGE,
    SUPERSCRIPT,
    SUBSCRIPT,

    // Postfix closures
    INVERSE,
    PLUS_CLOSURE,
    STAR_CLOSURE,

    // Brackets
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    SEQ_OPEN,
    SEQ_CLOSE,
    BAG_OPEN,
    BAG_CLOSE,
    IMAGE_OPEN,
    IMAGE_CLOSE,

    // Punctuation
    COMMA,
    COLON,
    DOUBLE_COLON,
    SEMICOLON,
    PIPE,
    BULLET,
    DOT,
    DEFINES,
    FREE_TYPE,

    // Paragraph keywords
    GIVEN,
    AXDEF,
    GENDEF,
    SCHEMA,
    WHERE,
    END,
    ZED,
    SYNTAX,

    // Line-start structure
    SECTION,
    SOLUTION,
    PART_LABEL,
    TEXT,
    PURETEXT,
    LATEX,
    TITLE,
    SUBTITLE,
    AUTHOR,
    DATE,
    INSTITUTION,
    TEXT_BODY,
    PROOF,
    EQUIV,
    TRUTH_TABLE,
    INFRULE,
    PAGEBREAK,
    CONTENTS,
    PARTS,
    BIBLIOGRAPHY,
    BIBLIOGRAPHY_STYLE,
    RULE_LINE,
    JUSTIFICATION,

    NEWLINE,
    EOF;

    private static final Set<TokenKind> OPERAND_END = EnumSet.of(
        IDENTIFIER, NUMBER, RPAREN, RBRACKET, RBRACE, SEQ_CLOSE, BAG_CLOSE, IMAGE_CLOSE,
        INVERSE, PLUS_CLOSURE, STAR_CLOSURE);

    private static final Set<TokenKind> DIRECTIVES = EnumSet.of(
        TEXT, PURETEXT, LATEX, TITLE, SUBTITLE, AUTHOR, DATE, INSTITUTION,
        PROOF, EQUIV, TRUTH_TABLE, INFRULE, PAGEBREAK, CONTENTS, PARTS, BIBLIOGRAPHY, BIBLIOGRAPHY_STYLE);

    private static final Set<TokenKind> STRUCTURE = EnumSet.of(SECTION, SOLUTION, PART_LABEL);

    /**
     * True when a token of this kind can be the last token of an operand.
     */
    public boolean endsOperand() {
        return OPERAND_END.contains(this);
    }

    public boolean isDirective() {
        return DIRECTIVES.contains(this);
    }

    public boolean isStructural() {
        return STRUCTURE.contains(this);
    }
}
