package org.pragmatica.txt2tex.generator;

import org.pragmatica.txt2tex.ast.BinaryOperator;
import org.pragmatica.txt2tex.ast.ClosureKind;
import org.pragmatica.txt2tex.ast.QuantifierKind;
import org.pragmatica.txt2tex.ast.UnaryOperator;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Every LaTeX symbol the generator emits, with its spelling in both notation dialects.
 *
 * <p>Dialect-specific symbols are declared with two spellings, shared ones with one. Operator
 * lookups are switch expressions over the operator enums, so a new operator without a symbol does
 * not compile. Spellings containing {@code %s} are templates taking the operand.
 */
public enum Symbol {
    // === Dialect-specific ===
    NATURALS("\\nat", "\\mathbb{N}"),
    INTEGERS("\\num", "\\mathbb{Z}"),
    NATURALS_1("\\nat_1", "\\mathbb{N}_1"),
    BULLET("\\spot", "\\bullet"),
    DECLARATION_COLON(":", "\\colon"),
    SUCH_THAT("|", "\\mid"),
    IMPLIES("\\implies", "\\Rightarrow"),
    IFF("\\iff", "\\Leftrightarrow"),
    FORWARD_COMPOSE("\\comp", "\\semi"),
    TRANSITIVE_CLOSURE("\\plus", "^{+}"),
    REFLEXIVE_CLOSURE("\\star", "^{*}"),
    SUPERSCRIPT_OPEN("\\bsup ", "^{"),
    SUPERSCRIPT_CLOSE("\\esup", "}"),
    IF("\\IF", "\\mbox{if}"),
    THEN("\\THEN", "\\mbox{then}"),
    ELSE("\\ELSE", "\\mbox{else}"),
    COMPREHENSION_OPEN("\\{", "\\{~"),
    COMPREHENSION_CLOSE("\\}", "~\\}"),
    FIRST("first~%s", "%s.1"),
    SECOND("second~%s", "%s.2"),

    // === Logic ===
    AND("\\land"),
    OR("\\lor"),
    NOT("\\lnot"),
    FORALL("\\forall"),
    EXISTS("\\exists"),
    EXISTS_UNIQUE("\\exists_1"),
    MU("\\mu"),
    LAMBDA("\\lambda"),
    TRUE("\\true"),
    FALSE("\\false"),

    // === Relations and comparison ===
    EQUALS("="),
    NOT_EQUAL("\\neq"),
    LESS("<"),
    GREATER(">"),
    LESS_EQUAL("\\leq"),
    GREATER_EQUAL("\\geq"),
    MEMBER("\\in"),
    NOT_MEMBER("\\notin"),
    SUBSET("\\subseteq"),
    PROPER_SUBSET("\\subset"),

    // === Types and arrows ===
    RELATION("\\rel"),
    TOTAL_FUN("\\fun"),
    PARTIAL_FUN("\\pfun"),
    TOTAL_INJ("\\inj"),
    PARTIAL_INJ("\\pinj"),
    TOTAL_SURJ("\\surj"),
    PARTIAL_SURJ("\\psurj"),
    BIJECTION("\\bij"),
    FINITE_FUN("\\ffun"),
    MAPLET("\\mapsto"),
    CROSS("\\cross"),
    POWER("\\power"),
    POWER_1("\\power_1"),
    FINSET("\\finset"),
    FINSET_1("\\finset_1"),
    SEQ("\\seq"),
    SEQ_1("\\seq_1"),
    ISEQ("\\iseq"),
    BAG("\\bag"),

    // === Operators ===
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    DIV("\\div"),
    MOD("\\mod"),
    UNION("\\cup"),
    INTERSECT("\\cap"),
    SET_MINUS("\\setminus"),
    OVERRIDE("\\oplus"),
    CONCAT("\\cat"),
    BAG_UNION("\\uplus"),
    CIRCLE("\\circ"),
    FILTER("\\filter"),
    DOM_RESTRICT("\\dres"),
    RAN_RESTRICT("\\rres"),
    DOM_SUBTRACT("\\ndres"),
    RAN_SUBTRACT("\\nrres"),
    NEGATE("-"),
    CARDINALITY("\\#"),
    INVERSE("\\inv"),
    UPTO("\\upto"),

    // === Toolkit functions ===
    DOM("\\dom"),
    RAN("\\ran"),
    ID("\\id"),
    HEAD("\\head"),
    TAIL("\\tail"),
    FRONT("\\front"),
    LAST("\\last"),
    REV("\\rev"),
    BIGCUP("\\bigcup"),
    BIGCAP("\\bigcap"),
    EMPTY_SET("\\emptyset"),

    // === Brackets ===
    SET_OPEN("\\{"),
    SET_CLOSE("\\}"),
    SEQ_OPEN("\\langle"),
    SEQ_CLOSE("\\rangle"),
    BAG_OPEN("\\lbag"),
    BAG_CLOSE("\\rbag"),
    IMAGE_OPEN("\\limg"),
    IMAGE_CLOSE("\\rimg"),
    DATA_OPEN("\\ldata"),
    DATA_CLOSE("\\rdata"),
    ELLIPSIS("\\ldots");

    private static final Map<String, Symbol> TOOLKIT = new HashMap<>();

    static {
        TOOLKIT.put("N", NATURALS);
        TOOLKIT.put("ℕ", NATURALS);
        TOOLKIT.put("Z", INTEGERS);
        TOOLKIT.put("ℤ", INTEGERS);
        TOOLKIT.put("N1", NATURALS_1);
        TOOLKIT.put("ℕ₁", NATURALS_1);
        TOOLKIT.put("P", POWER);
        TOOLKIT.put("ℙ", POWER);
        TOOLKIT.put("P1", POWER_1);
        TOOLKIT.put("F", FINSET);
        TOOLKIT.put("F1", FINSET_1);
        TOOLKIT.put("seq", SEQ);
        TOOLKIT.put("seq1", SEQ_1);
        TOOLKIT.put("iseq", ISEQ);
        TOOLKIT.put("bag", BAG);
        TOOLKIT.put("dom", DOM);
        TOOLKIT.put("ran", RAN);
        TOOLKIT.put("id", ID);
        TOOLKIT.put("head", HEAD);
        TOOLKIT.put("tail", TAIL);
        TOOLKIT.put("front", FRONT);
        TOOLKIT.put("last", LAST);
        TOOLKIT.put("rev", REV);
        TOOLKIT.put("bigcup", BIGCUP);
        TOOLKIT.put("bigcap", BIGCAP);
        TOOLKIT.put("emptyset", EMPTY_SET);
        TOOLKIT.put("∅", EMPTY_SET);
        TOOLKIT.put("true", TRUE);
        TOOLKIT.put("false", FALSE);
    }

    private final String fuzz;
    private final String standard;

    Symbol(String shared) {
        this(shared, shared);
    }

    Symbol(String fuzz, String standard) {
        this.fuzz = fuzz;
        this.standard = standard;
    }

    public String latex(NotationMode mode) {
        return switch (mode) {
            case FUZZ -> fuzz;
            case STANDARD -> standard;
        };
    }

    /**
     * Fill the operand into a template spelling.
     */
    public String apply(NotationMode mode, String operand) {
        return latex(mode).replace("%s", operand);
    }

    public boolean isDialectSpecific() {
        return !fuzz.equals(standard);
    }

    /**
     * Toolkit symbol for a reserved identifier such as {@code N}, {@code dom} or {@code seq1}.
     */
    public static Optional<Symbol> forName(String name) {
        return Optional.ofNullable(TOOLKIT.get(name));
    }

    public static Symbol forOperator(BinaryOperator operator) {
        return switch (operator) {
            case IFF -> IFF;
            case IMPLIES -> IMPLIES;
            case OR -> OR;
            case AND -> AND;
            case EQUALS -> EQUALS;
            case NOT_EQUAL -> NOT_EQUAL;
            case LESS -> LESS;
            case GREATER -> GREATER;
            case LESS_EQUAL -> LESS_EQUAL;
            case GREATER_EQUAL -> GREATER_EQUAL;
            case IN -> MEMBER;
            case NOT_IN -> NOT_MEMBER;
            case SUBSET -> SUBSET;
            case PROPER_SUBSET -> PROPER_SUBSET;
            case RELATION -> RELATION;
            case TOTAL_FUN -> TOTAL_FUN;
            case PARTIAL_FUN -> PARTIAL_FUN;
            case TOTAL_INJ -> TOTAL_INJ;
            case PARTIAL_INJ -> PARTIAL_INJ;
            case TOTAL_SURJ -> TOTAL_SURJ;
            case PARTIAL_SURJ -> PARTIAL_SURJ;
            case BIJECTION -> BIJECTION;
            case FINITE_FUN -> FINITE_FUN;
            case MAPLET -> MAPLET;
            case PLUS -> PLUS;
            case MINUS -> MINUS;
            case UNION -> UNION;
            case SET_MINUS -> SET_MINUS;
            case OVERRIDE -> OVERRIDE;
            case CONCAT -> CONCAT;
            case BAG_UNION -> BAG_UNION;
            case TIMES -> TIMES;
            case DIV -> DIV;
            case MOD -> MOD;
            case INTERSECT -> INTERSECT;
            case CROSS -> CROSS;
            case COMPOSE -> FORWARD_COMPOSE;
            case CIRCLE -> CIRCLE;
            case FILTER -> FILTER;
            case DOM_RESTRICT -> DOM_RESTRICT;
            case RAN_RESTRICT -> RAN_RESTRICT;
            case DOM_SUBTRACT -> DOM_SUBTRACT;
            case RAN_SUBTRACT -> RAN_SUBTRACT;
        };
    }

    public static Symbol forOperator(UnaryOperator operator) {
        return switch (operator) {
            case NOT -> NOT;
            case NEGATE -> NEGATE;
            case CARDINALITY -> CARDINALITY;
        };
    }

    public static Symbol forQuantifier(QuantifierKind kind) {
        return switch (kind) {
            case FORALL -> FORALL;
            case EXISTS -> EXISTS;
            case EXISTS_UNIQUE -> EXISTS_UNIQUE;
        };
    }

    public static Symbol forClosure(ClosureKind kind) {
        return switch (kind) {
            case INVERSE -> INVERSE;
            case TRANSITIVE -> TRANSITIVE_CLOSURE;
            case REFLEXIVE_TRANSITIVE -> REFLEXIVE_CLOSURE;
        };
    }
}
