package org.pragmatica.txt2tex.generator;

import org.pragmatica.txt2tex.error.ConversionException;
import org.pragmatica.txt2tex.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Finds formulas in {@code TEXT:} prose and typesets them as inline math.
 *
 * <p>The text is held as a list of segments. Each stage rewrites only {@link Prose} segments, so
 * whatever an earlier stage turned into {@link Formula} or {@link Raw} is never looked at again. A
 * candidate the expression parser rejects stays prose. Stages run in the order of {@link #stages()}.
 */
final class TextPipeline {
    private static final Logger log = LoggerFactory.getLogger(TextPipeline.class);

    private static final Pattern CITATION = Pattern.compile("\\[cite\\s+([^\\s\\]]+)(?:\\s+([^\\]]+))?\\]");
    private static final Pattern MANUAL_MATH = Pattern.compile("\\$[^$]+\\$");
    private static final Pattern SET_BUILDER = Pattern.compile("\\{[^{}]*\\|[^{}]*\\}");
    private static final Pattern QUANTIFIER = Pattern.compile("(?<![\\w$])(?:forall|exists1|exists|∀|∃)\\s");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.,;](?=\\s|$)");
    private static final Pattern LOGIC_GROUP = Pattern.compile(
        "\\((?:[^()]*\\b(?:and|or|not|implies)\\b[^()]*|[^()]*(?:<=>|=>|∧|∨|¬|⇒|⇔)[^()]*)\\)");
    private static final Pattern DECLARATION = Pattern.compile(
        "(?<![\\w$])([A-Za-z][\\w']*(?:\\s*,\\s*[A-Za-z][\\w']*)*)\\s*:\\s*((?:seq|P|F)\\s+[A-Za-z]\\w*|N1|ℕ₁|N|Z|ℕ|ℤ)(?![\\w])");
    private static final String TERM = "[A-Za-z0-9][\\w']*(?:\\s*[+*-]\\s*[A-Za-z0-9][\\w']*)*";
    private static final Pattern RELATION = Pattern.compile(
        "(?<![\\w$])" + TERM + "\\s*(?:<=|>=|!=|≤|≥|≠|=|<|>|∈|∉|⊆)\\s*" + TERM);
    private static final Pattern APPLICATION = Pattern.compile("(?<![\\w$])[A-Za-z][\\w']*\\([^()]*\\)");
    private static final Pattern SCRIPT = Pattern.compile("(?<![\\w$])[A-Za-z][A-Za-z0-9]*(?:\\^[A-Za-z0-9]+|_(?:[0-9]+|[A-Za-z]))(?![\\w])");
    private static final Pattern CONNECTIVE = Pattern.compile("<=>|=>|⇔|⇒|∧|∨|¬|\\bland\\b|\\blor\\b|\\blnot\\b");
    private static final Pattern KEYWORD = Pattern.compile("(?<![\\w\\\\$])(?:exists1|exists|forall|emptyset|elem)(?!\\w)");
    private static final Map<String, Symbol> KEYWORDS = Map.of(
        "forall", Symbol.FORALL,
        "exists", Symbol.EXISTS,
        "exists1", Symbol.EXISTS_UNIQUE,
        "emptyset", Symbol.EMPTY_SET,
        "elem", Symbol.MEMBER);
    private static final Map<String, Symbol> CONNECTIVES = Map.of(
        "<=>", Symbol.IFF,
        "⇔", Symbol.IFF,
        "=>", Symbol.IMPLIES,
        "⇒", Symbol.IMPLIES,
        "∧", Symbol.AND,
        "land", Symbol.AND,
        "∨", Symbol.OR,
        "lor", Symbol.OR,
        "¬", Symbol.NOT,
        "lnot", Symbol.NOT);

    /**
     * A run of text with its typesetting status.
     */
    sealed interface Segment {}

    /**
     * Plain text still open to rewriting; escaped on output.
     */
    record Prose(String text) implements Segment {}

    /**
     * LaTeX math, wrapped in {@code $...$} on output.
     */
    record Formula(String latex) implements Segment {}

    /**
     * LaTeX passed through verbatim.
     */
    record Raw(String latex) implements Segment {}

    /**
     * One rewrite stage: a pure function over the segment list.
     */
    record Stage(String name, Function<List<Segment>, List<Segment>> rewrite) {
        List<Segment> apply(List<Segment> segments) {
            return rewrite.apply(segments);
        }
    }

    private final ExpressionRenderer renderer;
    private final NotationMode mode;
    private final List<Stage> stages;

    TextPipeline(NotationMode mode) {
        this.renderer = new ExpressionRenderer(mode);
        this.mode = mode;
        this.stages = List.of(
            new Stage("citation", segments -> replace(segments, CITATION, this::citation)),
            new Stage("manual math", segments -> replace(segments, MANUAL_MATH,
                                                          match -> Optional.of(new Raw(match.group())))),
            new Stage("set builder", segments -> replace(segments, SET_BUILDER, this::formula)),
            new Stage("quantifier", segments -> rewriteProse(segments, this::quantifiers)),
            new Stage("logic group", segments -> replace(segments, LOGIC_GROUP, this::formula)),
            new Stage("declaration", segments -> replace(segments, DECLARATION, this::declaration)),
            new Stage("relation", segments -> replace(segments, RELATION, this::formula)),
            new Stage("application", segments -> replace(segments, APPLICATION, this::formula)),
            new Stage("script", segments -> replace(segments, SCRIPT, this::formula)),
            new Stage("connective", segments -> replace(segments, CONNECTIVE, this::connective)),
            new Stage("keyword", segments -> replace(segments, KEYWORD, this::keyword)));
    }

    /**
     * Stages in application order. Each expects that the stages before it have already claimed their
     * matches, e.g. relations inside a set builder are never seen by the relation stage.
     */
    List<Stage> stages() {
        return stages;
    }

    String render(String text) {
        List<Segment> segments = List.of(new Prose(text));
        for (var stage : stages) {
            segments = stage.apply(segments);
        }
        return assemble(segments);
    }

    static String assemble(List<Segment> segments) {
        var sb = new StringBuilder();
        for (var segment : segments) {
            if (segment instanceof Prose prose) {
                sb.append(escape(prose.text()));
            }else if (segment instanceof Formula formula) {
                sb.append('$').append(formula.latex()).append('$');
            }else if (segment instanceof Raw raw) {
                sb.append(raw.latex());
            }
        }
        return sb.toString();
    }

    /**
     * Escape LaTeX special characters in plain text.
     */
    static String escape(String text) {
        var sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\textbackslash{}");
                case '{', '}', '$', '&', '#', '%', '_' -> sb.append('\\').append(c);
                case '^' -> sb.append("\\^{}");
                case '~' -> sb.append("\\textasciitilde{}");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    // === Stage bodies ===

    private Optional<Segment> citation(MatchResult match) {
        var key = match.group(1);
        var locator = match.group(2);
        if (locator == null) {
            return Optional.of(new Raw("\\citep{" + key + "}"));
        }
        return Optional.of(new Raw("\\citep[" + escape(locator.strip()) + "]{" + key + "}"));
    }

    private Optional<Segment> formula(MatchResult match) {
        return math(match.group()).<Segment>map(Formula::new);
    }

    private Optional<Segment> declaration(MatchResult match) {
        var names = new ArrayList<String>();
        for (var name : match.group(1).split(",")) {
            var rendered = math(name.strip());
            if (rendered.isEmpty()) {
                return Optional.empty();
            }
            names.add(rendered.get());
        }
        return math(match.group(2))
            .<Segment>map(type -> new Formula(String.join(", ", names) + " " + Symbol.DECLARATION_COLON.latex(mode) + " " + type));
    }

    private Optional<Segment> connective(MatchResult match) {
        return Optional.ofNullable(CONNECTIVES.get(match.group()))
                       .<Segment>map(symbol -> new Formula(symbol.latex(mode)));
    }

    /**
     * A bare quantifier, membership or empty-set keyword left over once no formula around it parsed.
     */
    private Optional<Segment> keyword(MatchResult match) {
        return Optional.of(new Formula(KEYWORDS.get(match.group()).latex(mode)));
    }

    /**
     * A quantifier runs to the longest sentence prefix that parses: the candidates end at each
     * {@code . , ;} followed by whitespace, and at the end of the prose run.
     */
    private List<Segment> quantifiers(String text) {
        var result = new ArrayList<Segment>();
        int done = 0;
        var start = QUANTIFIER.matcher(text);
        int searchFrom = 0;
        while (searchFrom < text.length() && start.find(searchFrom)) {
            var ends = new ArrayList<Integer>();
            var breaks = SENTENCE_BREAK.matcher(text).region(start.end(), text.length());
            while (breaks.find()) {
                ends.add(breaks.start());
            }
            ends.add(text.length());
            Optional<String> rendered = Optional.empty();
            int end = -1;
            for (int i = ends.size() - 1; i >= 0 && rendered.isEmpty(); i--) {
                end = ends.get(i);
                rendered = math(text.substring(start.start(), end).strip());
            }
            if (rendered.isEmpty()) {
                searchFrom = start.end();
                continue;
            }
            int trimmedEnd = start.start() + text.substring(start.start(), end).stripTrailing().length();
            if (start.start() > done) {
                result.add(new Prose(text.substring(done, start.start())));
            }
            result.add(new Formula(rendered.get()));
            done = trimmedEnd;
            searchFrom = trimmedEnd;
        }
        if (done < text.length()) {
            result.add(new Prose(text.substring(done)));
        }
        return result;
    }

    // === Helper methods ===

    private Optional<String> math(String source) {
        try {
            return Optional.of(renderer.render(Parser.parseExpression(source)));
        } catch (ConversionException e) {
            log.debug("Not a formula: '{}' ({})", source, e.getMessage());
            return Optional.empty();
        }
    }

    private static List<Segment> replace(List<Segment> segments, Pattern pattern,
                                         Function<MatchResult, Optional<Segment>> rewrite) {
        return rewriteProse(segments, text -> {
            var result = new ArrayList<Segment>();
            var matcher = pattern.matcher(text);
            int done = 0;
            while (matcher.find()) {
                var replacement = rewrite.apply(matcher.toMatchResult());
                if (replacement.isEmpty()) {
                    continue;
                }
                if (matcher.start() > done) {
                    result.add(new Prose(text.substring(done, matcher.start())));
                }
                result.add(replacement.get());
                done = matcher.end();
            }
            if (done < text.length()) {
                result.add(new Prose(text.substring(done)));
            }
            return result;
        });
    }

    private static List<Segment> rewriteProse(List<Segment> segments, Function<String, List<Segment>> rewrite) {
        var result = new ArrayList<Segment>();
        for (var segment : segments) {
            if (segment instanceof Prose prose) {
                result.addAll(rewrite.apply(prose.text()));
            }else {
                result.add(segment);
            }
        }
        return result;
    }
}
