package org.pragmatica.txt2tex.parser;

import org.pragmatica.txt2tex.ast.BibliographyMetadata;
import org.pragmatica.txt2tex.ast.BinaryOperator;
import org.pragmatica.txt2tex.ast.ContentsDepth;
import org.pragmatica.txt2tex.ast.Declaration;
import org.pragmatica.txt2tex.ast.Document;
import org.pragmatica.txt2tex.ast.DocumentItem;
import org.pragmatica.txt2tex.ast.DocumentMetadata;
import org.pragmatica.txt2tex.ast.Expr;
import org.pragmatica.txt2tex.ast.PartsFormat;
import org.pragmatica.txt2tex.ast.TextKind;
import org.pragmatica.txt2tex.error.ParseError;
import org.pragmatica.txt2tex.lexer.TokenKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Line-oriented parser for the document layer: structure markers, directives and Z paragraphs.
 * Expressions are delegated to {@link ExpressionParser} and proofs to {@link ProofParser}.
 */
final class DocumentParser {
    private static final Set<TokenKind> SECTION_END = EnumSet.of(TokenKind.SECTION);
    private static final Set<TokenKind> SOLUTION_END = EnumSet.of(TokenKind.SECTION, TokenKind.SOLUTION);
    private static final Set<TokenKind> PART_END = EnumSet.of(TokenKind.SECTION, TokenKind.SOLUTION,
                                                              TokenKind.PART_LABEL);
    private static final Set<TokenKind> PARAGRAPHS = EnumSet.of(TokenKind.GIVEN, TokenKind.AXDEF, TokenKind.GENDEF,
                                                                TokenKind.SCHEMA, TokenKind.ZED,
                                                                TokenKind.SYNTAX);

    private final TokenCursor cursor;
    private final ExpressionParser expressions;
    private final ProofParser proofs;
    private DocumentMetadata metadata = DocumentMetadata.EMPTY;
    private BibliographyMetadata bibliography = BibliographyMetadata.EMPTY;
    private PartsFormat partsFormat = PartsFormat.INLINE;

    DocumentParser(TokenCursor cursor, ParserConfig config) {
        this.cursor = cursor;
        this.expressions = new ExpressionParser(cursor);
        this.proofs = new ProofParser(cursor, expressions, config);
    }

    /**
     * True for the keywords that open a Z paragraph.
     */
    static boolean startsParagraph(TokenKind kind) {
        return PARAGRAPHS.contains(kind);
    }

    Document parseDocument() {
        cursor.skipNewlines();
        var start = cursor.peek();
        var items = parseItems(EnumSet.noneOf(TokenKind.class));
        var span = items.isEmpty()
                   ? start.span()
                   : start.span().to(items.get(items.size() - 1).span());
        return new Document(span, metadata, bibliography, items);
    }

    private List<DocumentItem> parseItems(Set<TokenKind> stops) {
        var items = new ArrayList<DocumentItem>();
        while (true) {
            cursor.skipNewlines();
            if (cursor.isAtEnd() || stops.contains(cursor.peek().kind())) {
                return items;
            }
            parseItem().ifPresent(items::add);
        }
    }

    private Optional<DocumentItem> parseItem() {
        var start = cursor.peek();
        switch (start.kind()) {
            case SECTION:
                cursor.advance();
                return Optional.of(new DocumentItem.Section(start.span(), start.text(), nested(SECTION_END)));
            case SOLUTION:
                cursor.advance();
                return Optional.of(new DocumentItem.Solution(start.span(), start.text(), nested(SOLUTION_END)));
            case PART_LABEL:
                cursor.advance();
                return Optional.of(new DocumentItem.Part(start.span(), start.text(), partsFormat,
                                                         parseItems(PART_END)));
            case TITLE:
            case SUBTITLE:
            case AUTHOR:
            case DATE:
            case INSTITUTION:
                parseMetadata();
                return Optional.empty();
            case BIBLIOGRAPHY:
            case BIBLIOGRAPHY_STYLE:
                parseBibliography();
                return Optional.empty();
            case PARTS:
                parsePartsFormat();
                return Optional.empty();
            case TEXT:
                return Optional.of(parseText(TextKind.SMART));
            case PURETEXT:
                return Optional.of(parseText(TextKind.ESCAPED));
            case LATEX:
                return Optional.of(parseText(TextKind.RAW));
            case PAGEBREAK:
                cursor.advance();
                cursor.expectLineEnd();
                return Optional.of(new DocumentItem.PageBreak(start.span()));
            case CONTENTS:
                return Optional.of(parseContents());
            case TRUTH_TABLE:
                return Optional.of(parseTruthTable());
            case EQUIV:
                return Optional.of(parseEquivalence());
            case INFRULE:
                return Optional.of(parseInferenceRule());
            case PROOF:
                return Optional.of(proofs.parse(cursor.advance()));
            default:
                var item = parseParagraph();
                cursor.expectLineEnd();
                return Optional.of(item);
        }
    }

    private List<DocumentItem> nested(Set<TokenKind> stops) {
        cursor.expectLineEnd();
        return parseItems(stops);
    }

    // === Directives ===

    private void parseMetadata() {
        var directive = cursor.advance();
        var value = cursor.expect(TokenKind.TEXT_BODY, "text").text();
        cursor.expectLineEnd();
        metadata = switch (directive.kind()) {
            case TITLE -> metadata.withTitle(value);
            case SUBTITLE -> metadata.withSubtitle(value);
            case AUTHOR -> metadata.withAuthor(value);
            case DATE -> metadata.withDate(value);
            default -> metadata.withInstitution(value);
        };
    }

    private void parseBibliography() {
        var directive = cursor.advance();
        var value = cursor.expect(TokenKind.TEXT_BODY, "text");
        cursor.expectLineEnd();
        if (value.text().isEmpty()) {
            throw ParseError.semantic(value, "Missing value after " + directive.text());
        }
        bibliography = directive.is(TokenKind.BIBLIOGRAPHY)
                       ? bibliography.withFile(value.text())
                       : bibliography.withStyle(value.text());
    }

    /**
     * {@code PARTS: inline} or {@code PARTS: subsection}, in force for the parts that follow.
     */
    private void parsePartsFormat() {
        cursor.advance();
        var value = cursor.expect(TokenKind.TEXT_BODY, "parts format");
        cursor.expectLineEnd();
        partsFormat = switch (value.text().toLowerCase(Locale.ROOT)) {
            case "inline" -> PartsFormat.INLINE;
            case "subsection" -> PartsFormat.SUBSECTION;
            default -> throw ParseError.semantic(value, "Unknown parts format '" + value.text()
                                                        + "', expected inline or subsection");
        };
    }

    private DocumentItem parseContents() {
        var start = cursor.advance();
        var value = cursor.expect(TokenKind.TEXT_BODY, "contents depth");
        cursor.expectLineEnd();
        var depth = switch (value.text().toLowerCase(Locale.ROOT)) {
            case "", "1" -> ContentsDepth.SECTIONS;
            case "full", "2" -> ContentsDepth.SUBSECTIONS;
            default -> throw ParseError.semantic(value, "Unknown contents depth '" + value.text()
                                                        + "', expected 1, 2 or full");
        };
        return new DocumentItem.Contents(start.span(), depth);
    }

    private DocumentItem parseText(TextKind kind) {
        var start = cursor.advance();
        var body = cursor.expect(TokenKind.TEXT_BODY, "text");
        var span = start.span().to(body.span());
        cursor.expectLineEnd();
        return new DocumentItem.TextBlock(span, kind, body.text());
    }

    private DocumentItem parseTruthTable() {
        var start = cursor.advance();
        cursor.expectLineEnd();
        var headers = new ArrayList<Expr>();
        headers.add(expressions.parseExpression());
        while (cursor.match(TokenKind.PIPE)) {
            headers.add(expressions.parseExpression());
        }
        cursor.expectLineEnd();

        var rows = new ArrayList<List<Boolean>>();
        while (continuesBlock()) {
            if (cursor.match(TokenKind.RULE_LINE)) {
                cursor.expectLineEnd();
                continue;
            }
            var rowStart = cursor.peek();
            var row = parseTruthRow();
            if (row.size() != headers.size()) {
                throw ParseError.semantic(rowStart, "Truth table row has " + row.size()
                                                    + " values but the header has " + headers.size() + " columns");
            }
            rows.add(row);
        }
        return new DocumentItem.TruthTable(cursor.spanFrom(start), headers, rows);
    }

    private List<Boolean> parseTruthRow() {
        var row = new ArrayList<Boolean>();
        while (!cursor.atLineEnd()) {
            if (cursor.match(TokenKind.PIPE)) {
                continue;
            }
            var value = cursor.expect(TokenKind.IDENTIFIER, "truth value T or F");
            switch (value.text()) {
                case "T", "true" -> row.add(Boolean.TRUE);
                case "F", "false" -> row.add(Boolean.FALSE);
                default -> throw ParseError.unexpected(value, "truth value T or F");
            }
        }
        cursor.expectLineEnd();
        return row;
    }

    private DocumentItem parseEquivalence() {
        var start = cursor.advance();
        cursor.expectLineEnd();
        var first = expressions.parseExpression();
        cursor.expectLineEnd();
        var steps = new ArrayList<DocumentItem.EquivalenceStep>();
        while (continuesBlock()) {
            var stepStart = cursor.peek();
            cursor.match(TokenKind.IFF);
            var expression = expressions.parseExpression();
            var justification = justification();
            steps.add(new DocumentItem.EquivalenceStep(cursor.spanFrom(stepStart), expression, justification));
            cursor.expectLineEnd();
        }
        if (steps.isEmpty()) {
            throw ParseError.semantic(start, "An equivalence chain needs at least two expressions");
        }
        return new DocumentItem.EquivalenceChain(cursor.spanFrom(start), first, steps);
    }

    private DocumentItem parseInferenceRule() {
        var start = cursor.advance();
        cursor.expectLineEnd();
        var premises = new ArrayList<Expr>();
        while (!cursor.check(TokenKind.RULE_LINE)) {
            if (!continuesBlock()) {
                throw ParseError.unexpected(cursor.peek(), "rule line '---'");
            }
            premises.addAll(expressions.parseExpressionList());
            cursor.expectLineEnd();
        }
        cursor.advance();
        cursor.expectLineEnd();
        var conclusion = expressions.parseExpression();
        var name = justification();
        var span = cursor.spanFrom(start);
        cursor.expectLineEnd();
        return new DocumentItem.InferenceRule(span, premises, conclusion, name);
    }

    private Optional<String> justification() {
        return cursor.check(TokenKind.JUSTIFICATION)
               ? Optional.of(cursor.advance().text())
               : Optional.empty();
    }

    /**
     * A derivation block runs until a blank line, the end of input or the next structure line.
     */
    private boolean continuesBlock() {
        if (cursor.isAtEnd() || cursor.check(TokenKind.NEWLINE)) {
            return false;
        }
        var kind = cursor.peek().kind();
        return !kind.isDirective() && !kind.isStructural() && !startsParagraph(kind);
    }

    // === Z paragraphs ===

    /**
     * Paragraph or expression line, leaving the line end unconsumed.
     */
    private DocumentItem parseParagraph() {
        var start = cursor.peek();
        switch (start.kind()) {
            case GIVEN:
                return parseGiven();
            case AXDEF:
                return parseAxiomatic();
            case GENDEF:
                return parseGeneric();
            case SCHEMA:
                return parseSchema();
            case ZED:
                return parseZed();
            case SYNTAX:
                return parseSyntax();
            default:
                break;
        }
        return parseZedLine();
    }

    private DocumentItem.GivenType parseGiven() {
        var start = cursor.peek();
        cursor.match(TokenKind.GIVEN);
        boolean bracketed = cursor.match(TokenKind.LBRACKET);
        var names = identifierList();
        if (bracketed) {
            cursor.expect(TokenKind.RBRACKET, "']'");
        }
        return new DocumentItem.GivenType(cursor.spanFrom(start), names);
    }

    /**
     * A bare {@code [A, B]} on its own line declares given types.
     */
    private boolean startsBracketedGiven() {
        if (!cursor.check(TokenKind.LBRACKET)) {
            return false;
        }
        int offset = parametersEnd(0);
        if (offset == 0) {
            return false;
        }
        var next = cursor.peekAt(offset).kind();
        return next == TokenKind.NEWLINE || next == TokenKind.EOF || next == TokenKind.SEMICOLON
               || next == TokenKind.END;
    }

    private boolean startsFreeType() {
        if (!cursor.check(TokenKind.IDENTIFIER)) {
            return false;
        }
        int offset = parametersEnd(1);
        return cursor.peekAt(offset).is(TokenKind.FREE_TYPE);
    }

    private boolean startsAbbreviation() {
        if (cursor.check(TokenKind.IDENTIFIER)) {
            return cursor.peekAt(parametersEnd(1)).is(TokenKind.DEFINES);
        }
        if (cursor.check(TokenKind.LBRACKET)) {
            int offset = parametersEnd(0);
            return offset > 0
                   && cursor.peekAt(offset).is(TokenKind.IDENTIFIER)
                   && cursor.peekAt(offset + 1).is(TokenKind.DEFINES);
        }
        return false;
    }

    /**
     * Offset just past a {@code [X, Y]} parameter list starting at {@code offset}, or {@code offset}
     * itself when there is none.
     */
    private int parametersEnd(int offset) {
        if (!cursor.peekAt(offset).is(TokenKind.LBRACKET)) {
            return offset;
        }
        int index = offset + 1;
        while (cursor.peekAt(index).is(TokenKind.IDENTIFIER)) {
            if (cursor.peekAt(index + 1).is(TokenKind.RBRACKET)) {
                return index + 2;
            }
            if (!cursor.peekAt(index + 1).is(TokenKind.COMMA)) {
                break;
            }
            index += 2;
        }
        return offset;
    }

    private List<String> optionalParameters() {
        if (!cursor.match(TokenKind.LBRACKET)) {
            return List.of();
        }
        var names = identifierList();
        cursor.expect(TokenKind.RBRACKET, "']'");
        return names;
    }

    private List<String> identifierList() {
        var names = new ArrayList<String>();
        names.add(cursor.expect(TokenKind.IDENTIFIER, "identifier").text());
        while (cursor.match(TokenKind.COMMA)) {
            names.add(cursor.expect(TokenKind.IDENTIFIER, "identifier").text());
        }
        return names;
    }

    private DocumentItem.Abbreviation parseAbbreviation() {
        var start = cursor.peek();
        var parameters = new ArrayList<>(optionalParameters());
        var name = cursor.expect(TokenKind.IDENTIFIER, "identifier").text();
        if (parameters.isEmpty()) {
            parameters.addAll(optionalParameters());
        }
        cursor.expect(TokenKind.DEFINES, "'=='");
        cursor.skipNewlines();
        var definition = expressions.parseExpression();
        return new DocumentItem.Abbreviation(cursor.spanFrom(start), name, parameters, definition);
    }

    private DocumentItem.FreeType parseFreeType() {
        var start = cursor.advance();
        var parameters = optionalParameters();
        cursor.expect(TokenKind.FREE_TYPE, "'::='");
        cursor.skipNewlines();
        cursor.match(TokenKind.PIPE);
        var branches = new ArrayList<DocumentItem.FreeBranch>();
        branches.add(parseBranch());
        while (true) {
            if (cursor.match(TokenKind.PIPE)) {
                cursor.skipNewlines();
            }else if (cursor.check(TokenKind.NEWLINE) && cursor.peekAt(1).is(TokenKind.PIPE)) {
                cursor.advance();
                cursor.advance();
                cursor.skipNewlines();
            }else {
                break;
            }
            branches.add(parseBranch());
        }
        return new DocumentItem.FreeType(cursor.spanFrom(start), start.text(), parameters, branches);
    }

    private DocumentItem.FreeBranch parseBranch() {
        var constructor = cursor.expect(TokenKind.IDENTIFIER, "constructor name");
        TokenKind closer;
        if (cursor.check(TokenKind.LESS)) {
            closer = TokenKind.GREATER;
        }else if (cursor.check(TokenKind.SEQ_OPEN)) {
            closer = TokenKind.SEQ_CLOSE;
        }else {
            return new DocumentItem.FreeBranch(constructor.span(), constructor.text(), Optional.empty());
        }
        cursor.advance();
        Expr payload = expressions.parseType();
        while (cursor.match(TokenKind.COMMA)) {
            var next = expressions.parseType();
            payload = new Expr.BinaryOp(payload.span().to(next.span()), BinaryOperator.CROSS, payload, next);
        }
        if (!cursor.match(TokenKind.GREATER) && !cursor.match(TokenKind.SEQ_CLOSE)) {
            throw ParseError.unexpected(cursor.peek(), closer == TokenKind.GREATER ? "'>'" : "'>' or '⟩'");
        }
        return new DocumentItem.FreeBranch(cursor.spanFrom(constructor), constructor.text(), Optional.of(payload));
    }

    private DocumentItem parseAxiomatic() {
        var start = cursor.advance();
        var parameters = optionalParameters();
        var body = parseBoxBody();
        var span = cursor.spanFrom(start);
        if (!parameters.isEmpty()) {
            return new DocumentItem.GenericDefinition(span, parameters, body.declarations(), body.predicates());
        }
        return new DocumentItem.AxiomaticDefinition(span, body.declarations(), body.predicates());
    }

    private DocumentItem parseGeneric() {
        var start = cursor.advance();
        if (!cursor.check(TokenKind.LBRACKET)) {
            throw ParseError.unexpected(cursor.peek(), "'[' with generic parameters");
        }
        var parameters = optionalParameters();
        var body = parseBoxBody();
        return new DocumentItem.GenericDefinition(cursor.spanFrom(start), parameters, body.declarations(),
                                                  body.predicates());
    }

    private DocumentItem parseSchema() {
        var start = cursor.advance();
        Optional<String> name = Optional.empty();
        if (cursor.check(TokenKind.IDENTIFIER)) {
            name = Optional.of(cursor.advance().text());
        }
        var parameters = optionalParameters();
        var body = parseBoxBody();
        return new DocumentItem.Schema(cursor.spanFrom(start), name, parameters, body.declarations(),
                                       body.predicates());
    }

    private record BoxBody(List<Declaration> declarations, List<List<Expr>> predicates) {}

    /**
     * Declarations, then optionally {@code where} and predicate groups, then {@code end}.
     */
    private BoxBody parseBoxBody() {
        var declarations = new ArrayList<Declaration>();
        cursor.skipNewlines();
        while (!cursor.check(TokenKind.WHERE) && !cursor.check(TokenKind.END)) {
            if (cursor.isAtEnd()) {
                throw ParseError.unexpected(cursor.peek(), "'where' or 'end'");
            }
            declarations.add(parseDeclaration());
            if (!cursor.match(TokenKind.SEMICOLON) && !cursor.check(TokenKind.WHERE) && !cursor.check(TokenKind.END)) {
                cursor.expectLineEnd();
            }
            cursor.skipNewlines();
        }
        var predicates = new ArrayList<List<Expr>>();
        if (cursor.match(TokenKind.WHERE)) {
            var group = new ArrayList<Expr>();
            cursor.skipNewlines();
            while (!cursor.check(TokenKind.END)) {
                if (cursor.isAtEnd()) {
                    throw ParseError.unexpected(cursor.peek(), "'end'");
                }
                group.add(expressions.parseExpression());
                if (cursor.check(TokenKind.END)) {
                    break;
                }
                if (!cursor.atLineEnd()) {
                    throw ParseError.unexpected(cursor.peek(), "'end'");
                }
                if (cursor.skipNewlines() > 1 && !cursor.check(TokenKind.END)) {
                    predicates.add(group);
                    group = new ArrayList<>();
                }
            }
            if (!group.isEmpty()) {
                predicates.add(group);
            }
        }
        cursor.expect(TokenKind.END, "'end'");
        return new BoxBody(declarations, predicates);
    }

    private Declaration parseDeclaration() {
        var start = cursor.peek();
        var names = identifierList();
        cursor.expect(TokenKind.COLON, "':'");
        var type = expressions.parseType();
        return new Declaration(start.span().to(type.span()), names, type);
    }

    /**
     * Given types, free types, abbreviations and predicates; boxed paragraphs do not nest.
     */
    private DocumentItem.ZedContent parseZedLine() {
        if (cursor.check(TokenKind.GIVEN) || startsBracketedGiven()) {
            return parseGiven();
        }
        if (startsFreeType()) {
            return parseFreeType();
        }
        if (startsAbbreviation()) {
            return parseAbbreviation();
        }
        var expression = expressions.parseExpression();
        return new DocumentItem.ExpressionItem(expression.span(), expression);
    }

    private DocumentItem parseZed() {
        var start = cursor.advance();
        var contents = new ArrayList<DocumentItem.ZedContent>();
        cursor.skipNewlines();
        while (!cursor.check(TokenKind.END)) {
            if (cursor.isAtEnd()) {
                throw ParseError.unexpected(cursor.peek(), "'end'");
            }
            contents.add(parseZedLine());
            if (!cursor.match(TokenKind.SEMICOLON) && !cursor.check(TokenKind.END)) {
                if (!cursor.atLineEnd()) {
                    throw ParseError.unexpected(cursor.peek(), "'end'");
                }
            }
            cursor.skipNewlines();
        }
        cursor.expect(TokenKind.END, "'end'");
        return new DocumentItem.ZedBlock(cursor.spanFrom(start), contents);
    }

    /**
     * {@code syntax}, then definitions with one row per source line, then {@code end}. A blank line
     * starts a new group.
     */
    private DocumentItem parseSyntax() {
        var start = cursor.advance();
        var groups = new ArrayList<List<DocumentItem.SyntaxDefinition>>();
        var group = new ArrayList<DocumentItem.SyntaxDefinition>();
        cursor.skipNewlines();
        while (!cursor.check(TokenKind.END)) {
            if (cursor.isAtEnd()) {
                throw ParseError.unexpected(cursor.peek(), "'end'");
            }
            group.add(parseSyntaxDefinition());
            if (cursor.check(TokenKind.END)) {
                break;
            }
            if (!cursor.atLineEnd()) {
                throw ParseError.unexpected(cursor.peek(), "'end'");
            }
            if (cursor.skipNewlines() > 1 && !cursor.check(TokenKind.END)) {
                groups.add(group);
                group = new ArrayList<>();
            }
        }
        if (!group.isEmpty()) {
            groups.add(group);
        }
        if (groups.isEmpty()) {
            throw ParseError.semantic(start, "A syntax block needs at least one definition");
        }
        cursor.expect(TokenKind.END, "'end'");
        return new DocumentItem.SyntaxBlock(cursor.spanFrom(start), groups);
    }

    private DocumentItem.SyntaxDefinition parseSyntaxDefinition() {
        var name = cursor.expect(TokenKind.IDENTIFIER, "type name");
        cursor.expect(TokenKind.FREE_TYPE, "'::='");
        cursor.match(TokenKind.PIPE);
        var rows = new ArrayList<List<DocumentItem.FreeBranch>>();
        var row = new ArrayList<DocumentItem.FreeBranch>();
        row.add(parseBranch());
        while (true) {
            if (cursor.match(TokenKind.PIPE)) {
                row.add(parseBranch());
            }else if (cursor.check(TokenKind.NEWLINE) && cursor.peekAt(1).is(TokenKind.PIPE)) {
                cursor.advance();
                cursor.advance();
                rows.add(row);
                row = new ArrayList<>();
                row.add(parseBranch());
            }else {
                break;
            }
        }
        rows.add(row);
        return new DocumentItem.SyntaxDefinition(cursor.spanFrom(name), name.text(), rows);
    }
}
