package org.pragmatica.txt2tex.lexer;

import org.pragmatica.txt2tex.error.LexError;
import org.pragmatica.txt2tex.tree.SourceLocation;
import org.pragmatica.txt2tex.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Tokenizer for whiteboard notation.
 *
 * <p>Scans with maximal munch. Line-start structures (section and solution markers, part labels,
 * directives, dash rules) are captured whole. Inside proof, equivalence and inference-rule blocks a
 * trailing bracketed justification is captured as a single token. Everything else is grammar-free.
 */
public final class Lexer {
    private static final int MAX_INPUT_SIZE = 4_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 16;
    private static final Pattern PART_LABEL = Pattern.compile("\\(([a-j])\\)(?=[ \\t\\r\\n]|$)");
    private static final String CLOSURE_FOLLOWERS = ")]},;|>\n\r \t";

    private static final Map<String, TokenKind> KEYWORDS = Map.ofEntries(
        Map.entry("and", TokenKind.AND),
        Map.entry("land", TokenKind.AND),
        Map.entry("or", TokenKind.OR),
        Map.entry("lor", TokenKind.OR),
        Map.entry("not", TokenKind.NOT),
        Map.entry("lnot", TokenKind.NOT),
        Map.entry("forall", TokenKind.FORALL),
        Map.entry("exists", TokenKind.EXISTS),
        Map.entry("exists1", TokenKind.EXISTS1),
        Map.entry("mu", TokenKind.MU),
        Map.entry("lambda", TokenKind.LAMBDA),
        Map.entry("if", TokenKind.IF),
        Map.entry("then", TokenKind.THEN),
        Map.entry("else", TokenKind.ELSE),
        Map.entry("in", TokenKind.IN),
        Map.entry("elem", TokenKind.IN),
        Map.entry("notin", TokenKind.NOT_IN),
        Map.entry("subset", TokenKind.SUBSET),
        Map.entry("psubset", TokenKind.PROPER_SUBSET),
        Map.entry("union", TokenKind.UNION),
        Map.entry("intersect", TokenKind.INTERSECT),
        Map.entry("cross", TokenKind.CROSS),
        Map.entry("o9", TokenKind.COMPOSE),
        Map.entry("comp", TokenKind.CIRCLE),
        Map.entry("div", TokenKind.DIV),
        Map.entry("mod", TokenKind.MOD),
        Map.entry("filter", TokenKind.FILTER),
        Map.entry("uplus", TokenKind.BAG_UNION),
        Map.entry("given", TokenKind.GIVEN),
        Map.entry("axdef", TokenKind.AXDEF),
        Map.entry("gendef", TokenKind.GENDEF),
        Map.entry("schema", TokenKind.SCHEMA),
        Map.entry("where", TokenKind.WHERE),
        Map.entry("end", TokenKind.END),
        Map.entry("zed", TokenKind.ZED),
        Map.entry("syntax", TokenKind.SYNTAX));

    private static final Map<Character, TokenKind> UNICODE = Map.ofEntries(
        Map.entry('∧', TokenKind.AND),
        Map.entry('∨', TokenKind.OR),
        Map.entry('¬', TokenKind.NOT),
        Map.entry('⇒', TokenKind.IMPLIES),
        Map.entry('⇔', TokenKind.IFF),
        Map.entry('∀', TokenKind.FORALL),
        Map.entry('∃', TokenKind.EXISTS),
        Map.entry('μ', TokenKind.MU),
        Map.entry('λ', TokenKind.LAMBDA),
        Map.entry('≠', TokenKind.NOT_EQUAL),
        Map.entry('≤', TokenKind.LESS_EQUAL),
        Map.entry('≥', TokenKind.GREATER_EQUAL),
        Map.entry('∈', TokenKind.IN),
        Map.entry('∉', TokenKind.NOT_IN),
        Map.entry('⊆', TokenKind.SUBSET),
        Map.entry('⊂', TokenKind.PROPER_SUBSET),
        Map.entry('∪', TokenKind.UNION),
        Map.entry('∩', TokenKind.INTERSECT),
        Map.entry('∖', TokenKind.SET_MINUS),
        Map.entry('×', TokenKind.CROSS),
        Map.entry('↔', TokenKind.RELATION),
        Map.entry('↦', TokenKind.MAPLET),
        Map.entry('◁', TokenKind.DOM_RESTRICT),
        Map.entry('▷', TokenKind.RAN_RESTRICT),
        Map.entry('⩤', TokenKind.DOM_SUBTRACT),
        Map.entry('⩥', TokenKind.RAN_SUBTRACT),
        Map.entry('⨾', TokenKind.COMPOSE),
        Map.entry('∘', TokenKind.CIRCLE),
        Map.entry('⊕', TokenKind.OVERRIDE),
        Map.entry('→', TokenKind.TOTAL_FUN),
        Map.entry('⇸', TokenKind.PARTIAL_FUN),
        Map.entry('↣', TokenKind.TOTAL_INJ),
        Map.entry('⤔', TokenKind.PARTIAL_INJ),
        Map.entry('↠', TokenKind.TOTAL_SURJ),
        Map.entry('⤀', TokenKind.PARTIAL_SURJ),
        Map.entry('⤖', TokenKind.BIJECTION),
        Map.entry('⇻', TokenKind.FINITE_FUN),
        Map.entry('⌢', TokenKind.CONCAT),
        Map.entry('↾', TokenKind.FILTER),
        Map.entry('⊎', TokenKind.BAG_UNION),
        Map.entry('‥', TokenKind.RANGE),
        Map.entry('⟨', TokenKind.SEQ_OPEN),
        Map.entry('⟩', TokenKind.SEQ_CLOSE),
        Map.entry('⟦', TokenKind.BAG_OPEN),
        Map.entry('⟧', TokenKind.BAG_CLOSE),
        Map.entry('⦇', TokenKind.IMAGE_OPEN),
        Map.entry('⦈', TokenKind.IMAGE_CLOSE),
        Map.entry('∼', TokenKind.INVERSE),
        Map.entry('⁺', TokenKind.PLUS_CLOSURE),
        Map.entry('⋆', TokenKind.STAR_CLOSURE),
        Map.entry('≙', TokenKind.DEFINES),
        Map.entry('⩴', TokenKind.FREE_TYPE),
        Map.entry('•', TokenKind.BULLET),
        Map.entry('∅', TokenKind.IDENTIFIER));

    private static final Map<String, TokenKind> DIRECTIVES = new LinkedHashMap<>();

    static {
        DIRECTIVES.put("TRUTH TABLE:", TokenKind.TRUTH_TABLE);
        DIRECTIVES.put("PURETEXT:", TokenKind.PURETEXT);
        DIRECTIVES.put("TEXT:", TokenKind.TEXT);
        DIRECTIVES.put("LATEX:", TokenKind.LATEX);
        DIRECTIVES.put("TITLE:", TokenKind.TITLE);
        DIRECTIVES.put("SUBTITLE:", TokenKind.SUBTITLE);
        DIRECTIVES.put("AUTHOR:", TokenKind.AUTHOR);
        DIRECTIVES.put("DATE:", TokenKind.DATE);
        DIRECTIVES.put("INSTITUTION:", TokenKind.INSTITUTION);
        DIRECTIVES.put("PROOF:", TokenKind.PROOF);
        DIRECTIVES.put("EQUIV:", TokenKind.EQUIV);
        DIRECTIVES.put("ARGUE:", TokenKind.EQUIV);
        DIRECTIVES.put("INFRULE:", TokenKind.INFRULE);
        DIRECTIVES.put("PAGEBREAK:", TokenKind.PAGEBREAK);
        DIRECTIVES.put("CONTENTS:", TokenKind.CONTENTS);
        DIRECTIVES.put("PARTS:", TokenKind.PARTS);
        DIRECTIVES.put("BIBLIOGRAPHY:", TokenKind.BIBLIOGRAPHY);
        DIRECTIVES.put("BIBLIOGRAPHY_STYLE:", TokenKind.BIBLIOGRAPHY_STYLE);
    }

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<TokenKind> brackets = new ArrayDeque<>();
    private int pos;
    private int line;
    private int column;
    private boolean spaceBefore;
    private boolean lineHasTokens;
    private boolean derivationMode;
    private boolean proofMode;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    /**
     * Tokenize a whole document. The result always ends with an {@link TokenKind#EOF} token.
     *
     * @throws LexError on the first character no token can start with, or when the input is too large
     */
    public static List<Token> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw inputTooLarge(input);
        }
        return new Lexer(input).tokenizeAll();
    }

    private static LexError inputTooLarge(String input) {
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < MAX_INPUT_SIZE; i++) {
            if (input.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        var location = SourceLocation.at(line, input.codePointCount(lineStart, MAX_INPUT_SIZE) + 1, MAX_INPUT_SIZE);
        return LexError.inputTooLarge(location, String.valueOf(input.charAt(MAX_INPUT_SIZE)), MAX_INPUT_SIZE);
    }

    private List<Token> tokenizeAll() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                scanNewline();
            }else if (c == ' ' || c == '\t' || c == '\r') {
                advance();
                spaceBefore = true;
            }else if (!lineHasTokens && input.startsWith("%%", pos)) {
                skipCommentLine();
            }else if (lineHasTokens || !scanLineStart()) {
                add(nextToken());
            }
        }
        var end = currentLocation();
        tokens.add(new Token(TokenKind.EOF, "", SourceSpan.at(end), spaceBefore));
        return tokens;
    }

    private void scanNewline() {
        var start = currentLocation();
        // a proof continues across blank lines while its steps stay indented
        if (!lineHasTokens && !(proofMode && indentedLineFollows())) {
            endDerivation();
        }
        advance();
        tokens.add(new Token(TokenKind.NEWLINE, "\n", span(start), spaceBefore));
        lineHasTokens = false;
        spaceBefore = false;
    }

    private boolean indentedLineFollows() {
        int next = pos + 1;
        while (next < input.length()) {
            int lineEnd = input.indexOf('\n', next);
            var text = input.substring(next, lineEnd < 0 ? input.length() : lineEnd);
            if (!text.isBlank()) {
                return text.charAt(0) == ' ' || text.charAt(0) == '\t';
            }
            if (lineEnd < 0) {
                return false;
            }
            next = lineEnd + 1;
        }
        return false;
    }

    private void endDerivation() {
        derivationMode = false;
        proofMode = false;
    }

    private void skipCommentLine() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
        if (!isAtEnd()) {
            advance();
        }
        spaceBefore = false;
    }

    private void add(Token token) {
        tokens.add(token);
        lineHasTokens = true;
        spaceBefore = false;
    }

    private TokenKind previousKind() {
        return tokens.isEmpty() ? TokenKind.NEWLINE : tokens.get(tokens.size() - 1).kind();
    }

    // === Line-start structures ===

    private boolean scanLineStart() {
        var start = currentLocation();
        if (input.startsWith("===", pos)) {
            return scanDelimitedMarker(start, "===", TokenKind.SECTION);
        }
        if (input.startsWith("**", pos)) {
            return scanDelimitedMarker(start, "**", TokenKind.SOLUTION);
        }
        if (input.startsWith("---", pos) && restOfLine().strip().matches("-{3,}")) {
            var rule = restOfLine().strip();
            skipToEndOfLine();
            add(new Token(TokenKind.RULE_LINE, rule, span(start), spaceBefore));
            return true;
        }
        var matcher = PART_LABEL.matcher(input).region(pos, input.length());
        if (matcher.lookingAt()) {
            var label = matcher.group(1);
            advanceBy(3);
            endDerivation();
            add(new Token(TokenKind.PART_LABEL, label, span(start), spaceBefore));
            // the rest of the line may open with a directive
            lineHasTokens = false;
            return true;
        }
        for (var entry : DIRECTIVES.entrySet()) {
            if (input.startsWith(entry.getKey(), pos)) {
                advanceBy(entry.getKey().length());
                scanDirective(start, entry.getKey(), entry.getValue());
                return true;
            }
        }
        return false;
    }

    private boolean scanDelimitedMarker(SourceLocation start, String marker, TokenKind kind) {
        var rest = restOfLine();
        int closing = rest.indexOf(marker, marker.length());
        if (closing < 0) {
            return false;
        }
        var body = rest.substring(marker.length(), closing).strip();
        advanceBy(closing + marker.length());
        endDerivation();
        add(new Token(kind, body, span(start), spaceBefore));
        return true;
    }

    private void scanDirective(SourceLocation start, String spelling, TokenKind kind) {
        add(new Token(kind, spelling, span(start), spaceBefore));
        derivationMode = kind == TokenKind.PROOF || kind == TokenKind.EQUIV || kind == TokenKind.INFRULE;
        proofMode = kind == TokenKind.PROOF;
        if (carriesBody(kind)) {
            var bodyStart = currentLocation();
            var body = restOfLine().strip();
            skipToEndOfLine();
            add(new Token(TokenKind.TEXT_BODY, body, span(bodyStart), true));
        }
    }

    private static boolean carriesBody(TokenKind kind) {
        return switch (kind) {
            case TEXT, PURETEXT, LATEX, TITLE, SUBTITLE, AUTHOR, DATE, INSTITUTION,
                 CONTENTS, PARTS, BIBLIOGRAPHY, BIBLIOGRAPHY_STYLE -> true;
            default -> false;
        };
    }

    // === Ordinary tokens ===

    private Token nextToken() {
        var start = currentLocation();
        char c = peek();
        if (derivationMode && c == '[') {
            var justification = scanJustification(start);
            if (justification != null) {
                return justification;
            }
        }
        if (input.startsWith("77->", pos)) {
            return fixed(start, 4, TokenKind.FINITE_FUN);
        }
        if (input.startsWith("∃₁", pos)) {
            return fixed(start, 2, TokenKind.EXISTS1);
        }
        var unicode = UNICODE.get(c);
        if (unicode != null) {
            return scanUnicode(start, unicode);
        }
        if (Character.isLetter(c) || Character.isDigit(c) || startsSupplementaryLetter(c)) {
            return scanWord(start);
        }
        return scanOperator(start);
    }

    private boolean startsSupplementaryLetter(char c) {
        return Character.isHighSurrogate(c) && Character.isLetter(input.codePointAt(pos));
    }

    private Token scanUnicode(SourceLocation start, TokenKind kind) {
        switch (kind) {
            case SEQ_OPEN, BAG_OPEN, IMAGE_OPEN -> brackets.push(kind);
            case SEQ_CLOSE -> popIf(TokenKind.SEQ_OPEN);
            case BAG_CLOSE -> popIf(TokenKind.BAG_OPEN);
            case IMAGE_CLOSE -> popIf(TokenKind.IMAGE_OPEN);
            default -> {
            }
        }
        return fixed(start, 1, kind);
    }

    private Token scanWord(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        boolean numeral = true;
        while (!isAtEnd() && Character.isDigit(peek())) {
            sb.append(advance());
        }
        while (!isAtEnd() && isWordPart()) {
            numeral = false;
            sb.append(advance());
        }
        if (numeral) {
            return new Token(TokenKind.NUMBER, sb.toString(), span(start), spaceBefore);
        }
        while (!isAtEnd() && isDecoration()) {
            sb.append(advance());
        }
        var text = sb.toString();
        var kind = KEYWORDS.getOrDefault(text, TokenKind.IDENTIFIER);
        return new Token(kind, text, span(start), spaceBefore);
    }

    private boolean isWordPart() {
        char c = peek();
        if (Character.isLetterOrDigit(c)) {
            return !UNICODE.containsKey(c);
        }
        if (Character.isHighSurrogate(c)) {
            return Character.isLetter(input.codePointAt(pos));
        }
        if (c >= '₀' && c <= '₉') {
            return true;
        }
        return c == '_' && pos + 1 < input.length() && Character.isLetterOrDigit(input.charAt(pos + 1));
    }

    private boolean isDecoration() {
        char c = peek();
        if (c == '\'' || c == '?') {
            return true;
        }
        return c == '!' && peekAt(1) != '=';
    }

    private Token scanOperator(SourceLocation start) {
        char c = peek();
        return switch (c) {
            case '<' -> scanLess(start);
            case '>' -> scanGreater(start);
            case '|' -> scanPipe(start);
            case '-' -> longest(start, TokenKind.MINUS, "-->>", TokenKind.TOTAL_SURJ, "->", TokenKind.TOTAL_FUN);
            case '+' -> scanPlus(start);
            case '*' -> closureFollows() ? fixed(start, 1, TokenKind.STAR_CLOSURE) : fixed(start, 1, TokenKind.TIMES);
            case '=' -> longest(start, TokenKind.EQUALS, "==", TokenKind.DEFINES, "=>", TokenKind.IMPLIES);
            case '!' -> required(start, "!=", TokenKind.NOT_EQUAL);
            case '/' -> required(start, "/=", TokenKind.NOT_EQUAL);
            case ':' -> longest(start, TokenKind.COLON, "::=", TokenKind.FREE_TYPE, "::", TokenKind.DOUBLE_COLON);
            case '.' -> scanDot(start);
            case '(' -> scanOpenParen(start);
            case ')' -> {
                popIf(TokenKind.LPAREN);
                yield fixed(start, 1, TokenKind.RPAREN);
            }
            case '[' -> scanOpenBracket(start);
            case ']' -> scanCloseBracket(start);
            case '{' -> {
                brackets.push(TokenKind.LBRACE);
                yield fixed(start, 1, TokenKind.LBRACE);
            }
            case '}' -> {
                popIf(TokenKind.LBRACE);
                yield fixed(start, 1, TokenKind.RBRACE);
            }
            case ',' -> fixed(start, 1, TokenKind.COMMA);
            case ';' -> fixed(start, 1, TokenKind.SEMICOLON);
            case '#' -> fixed(start, 1, TokenKind.HASH);
            case '\\' -> fixed(start, 1, TokenKind.SET_MINUS);
            case '~' -> fixed(start, 1, TokenKind.INVERSE);
            case '@' -> fixed(start, 1, TokenKind.BULLET);
            case '_' -> fixed(start, 1, TokenKind.SUBSCRIPT);
            case '^' -> spaceBefore || isWhitespace(peekAt(1))
                        ? fixed(start, 1, TokenKind.CONCAT)
                        : fixed(start, 1, TokenKind.SUPERSCRIPT);
            default -> throw new LexError(start, new String(Character.toChars(input.codePointAt(pos))));
        };
    }

    private Token scanLess(SourceLocation start) {
        for (var candidate : List.of("<=>", "<->", "<<|", "<=", "<|")) {
            if (input.startsWith(candidate, pos)) {
                return fixed(start, candidate.length(), lessKind(candidate));
            }
        }
        var decision = AngleBrackets.classifyOpen(input, pos, previousKind(), spaceBefore);
        if (decision == TokenKind.SEQ_OPEN) {
            brackets.push(TokenKind.SEQ_OPEN);
        }
        return fixed(start, 1, decision);
    }

    private static TokenKind lessKind(String spelling) {
        return switch (spelling) {
            case "<=>" -> TokenKind.IFF;
            case "<->" -> TokenKind.RELATION;
            case "<<|" -> TokenKind.DOM_SUBTRACT;
            case "<=" -> TokenKind.LESS_EQUAL;
            default -> TokenKind.DOM_RESTRICT;
        };
    }

    private Token scanGreater(SourceLocation start) {
        if (AngleBrackets.closesSequence(brackets.peek(), input, pos)) {
            brackets.pop();
            return fixed(start, 1, TokenKind.SEQ_CLOSE);
        }
        for (var candidate : List.of(">->>", ">->", ">+>", ">=")) {
            if (input.startsWith(candidate, pos)) {
                var kind = switch (candidate) {
                    case ">->>" -> TokenKind.BIJECTION;
                    case ">->" -> TokenKind.TOTAL_INJ;
                    case ">+>" -> TokenKind.PARTIAL_INJ;
                    default -> TokenKind.GREATER_EQUAL;
                };
                return fixed(start, candidate.length(), kind);
            }
        }
        return fixed(start, 1, TokenKind.GREATER);
    }

    private Token scanPipe(SourceLocation start) {
        if (input.startsWith("|->", pos)) {
            return fixed(start, 3, TokenKind.MAPLET);
        }
        if (input.startsWith("|>>", pos)) {
            return fixed(start, 3, TokenKind.RAN_SUBTRACT);
        }
        if (input.startsWith("|)", pos) && brackets.peek() == TokenKind.IMAGE_OPEN) {
            brackets.pop();
            return fixed(start, 2, TokenKind.IMAGE_CLOSE);
        }
        if (input.startsWith("|>", pos)) {
            return fixed(start, 2, TokenKind.RAN_RESTRICT);
        }
        return fixed(start, 1, TokenKind.PIPE);
    }

    private Token scanPlus(SourceLocation start) {
        if (input.startsWith("+->>", pos)) {
            return fixed(start, 4, TokenKind.PARTIAL_SURJ);
        }
        if (input.startsWith("+->", pos)) {
            return fixed(start, 3, TokenKind.PARTIAL_FUN);
        }
        if (input.startsWith("++", pos)) {
            return fixed(start, 2, TokenKind.OVERRIDE);
        }
        return closureFollows() ? fixed(start, 1, TokenKind.PLUS_CLOSURE) : fixed(start, 1, TokenKind.PLUS);
    }

    /**
     * An unspaced {@code +} or {@code *} directly after an operand and followed by whitespace, a
     * closer or a separator is a postfix closure.
     */
    private boolean closureFollows() {
        if (spaceBefore || !previousKind().endsOperand()) {
            return false;
        }
        return pos + 1 >= input.length() || CLOSURE_FOLLOWERS.indexOf(input.charAt(pos + 1)) >= 0;
    }

    private Token scanDot(SourceLocation start) {
        if (input.startsWith("..", pos)) {
            return fixed(start, 2, TokenKind.RANGE);
        }
        char next = peekAt(1);
        if (!spaceBefore && previousKind().endsOperand() && Character.isLetterOrDigit(next)) {
            return fixed(start, 1, TokenKind.DOT);
        }
        return fixed(start, 1, TokenKind.BULLET);
    }

    private Token scanOpenParen(SourceLocation start) {
        if (input.startsWith("(|", pos)) {
            brackets.push(TokenKind.IMAGE_OPEN);
            return fixed(start, 2, TokenKind.IMAGE_OPEN);
        }
        brackets.push(TokenKind.LPAREN);
        return fixed(start, 1, TokenKind.LPAREN);
    }

    private Token scanOpenBracket(SourceLocation start) {
        if (input.startsWith("[[", pos)) {
            brackets.push(TokenKind.BAG_OPEN);
            return fixed(start, 2, TokenKind.BAG_OPEN);
        }
        brackets.push(TokenKind.LBRACKET);
        return fixed(start, 1, TokenKind.LBRACKET);
    }

    private Token scanCloseBracket(SourceLocation start) {
        if (brackets.peek() == TokenKind.BAG_OPEN && input.startsWith("]]", pos)) {
            brackets.pop();
            return fixed(start, 2, TokenKind.BAG_CLOSE);
        }
        popIf(TokenKind.LBRACKET);
        return fixed(start, 1, TokenKind.RBRACKET);
    }

    /**
     * A bracket that starts a line or follows whitespace, holds something other than a bare label
     * number and closes the line is a justification.
     */
    private Token scanJustification(SourceLocation start) {
        if ((lineHasTokens && !spaceBefore) || input.startsWith("[[", pos)) {
            return null;
        }
        var rest = restOfLine();
        int depth = 0;
        int closing = -1;
        for (int i = 0; i < rest.length(); i++) {
            char c = rest.charAt(i);
            if (c == '[') {
                depth++;
            }else if (c == ']' && --depth == 0) {
                closing = i;
                break;
            }
        }
        if (closing < 0 || !rest.substring(closing + 1).isBlank()) {
            return null;
        }
        var content = rest.substring(1, closing).strip();
        if (content.isEmpty() || content.chars().allMatch(Character::isDigit)) {
            return null;
        }
        advanceBy(closing + 1);
        return new Token(TokenKind.JUSTIFICATION, content, span(start), spaceBefore);
    }

    private Token longest(SourceLocation start, TokenKind fallback, String first, TokenKind firstKind,
                          String second, TokenKind secondKind) {
        if (input.startsWith(first, pos)) {
            return fixed(start, first.length(), firstKind);
        }
        if (input.startsWith(second, pos)) {
            return fixed(start, second.length(), secondKind);
        }
        return fixed(start, 1, fallback);
    }

    private Token required(SourceLocation start, String spelling, TokenKind kind) {
        if (input.startsWith(spelling, pos)) {
            return fixed(start, spelling.length(), kind);
        }
        throw new LexError(start, String.valueOf(peek()));
    }

    private Token fixed(SourceLocation start, int length, TokenKind kind) {
        var text = input.substring(pos, pos + length);
        advanceBy(length);
        return new Token(kind, text, span(start), spaceBefore);
    }

    private void popIf(TokenKind opener) {
        if (brackets.peek() == opener) {
            brackets.pop();
        }
    }

    // === Helper methods ===

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\0';
    }

    private String restOfLine() {
        int end = input.indexOf('\n', pos);
        return input.substring(pos, end < 0 ? input.length() : end);
    }

    private void skipToEndOfLine() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
    }

    private String advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
            return "\n";
        }
        column++;
        if (Character.isHighSurrogate(c) && pos < input.length() && Character.isLowSurrogate(input.charAt(pos))) {
            return new String(new char[]{c, input.charAt(pos++)});
        }
        return String.valueOf(c);
    }

    private void advanceBy(int chars) {
        int target = pos + chars;
        while (pos < target && !isAtEnd()) {
            advance();
        }
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }
}
