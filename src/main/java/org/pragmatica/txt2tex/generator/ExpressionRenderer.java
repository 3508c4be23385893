package org.pragmatica.txt2tex.generator;

import org.pragmatica.txt2tex.ast.ApplicationStyle;
import org.pragmatica.txt2tex.ast.BinderGroup;
import org.pragmatica.txt2tex.ast.Expr;
import org.pragmatica.txt2tex.ast.ExprVisitor;
import org.pragmatica.txt2tex.ast.Precedence;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders expressions as LaTeX math in one notation dialect.
 *
 * <p>A child is parenthesized when its precedence is looser than its position requires. Binder
 * forms extend as far right as possible, so they are also parenthesized when anything follows
 * them.
 */
public final class ExpressionRenderer implements ExprVisitor<String> {
    private static final Pattern SIMPLE_SUBSCRIPT = Pattern.compile("([A-Za-z][A-Za-z0-9]*)_([0-9]+|[A-Za-z])");
    private static final Pattern DECORATION = Pattern.compile("['?!]+$");

    private final NotationMode mode;

    public ExpressionRenderer(NotationMode mode) {
        this.mode = mode;
    }

    public String render(Expr expr) {
        return expr.accept(this);
    }

    // === Atoms ===

    @Override
    public String visitIdentifier(Expr.Identifier identifier) {
        return identifier(identifier.name());
    }

    /**
     * Identifier spelling: toolkit names become macros, {@code a_1} a subscript, other names with
     * underscores or several letters {@code \mathit}. Decorations stay outside the italic group.
     */
    String identifier(String name) {
        var toolkit = Symbol.forName(name);
        if (toolkit.isPresent()) {
            return symbol(toolkit.get());
        }
        var matcher = DECORATION.matcher(name);
        var decoration = matcher.find() ? matcher.group() : "";
        var base = toSubscriptForm(name.substring(0, name.length() - decoration.length()));
        if (base.isEmpty()) {
            return name;
        }
        var script = SIMPLE_SUBSCRIPT.matcher(base);
        if (script.matches()) {
            return plain(script.group(1)) + "_{" + script.group(2) + "}" + decoration;
        }
        return plain(base) + decoration;
    }

    private static String plain(String name) {
        if (name.contains("_")) {
            return "\\mathit{" + name.replace("_", "\\_") + "}";
        }
        if (name.codePointCount(0, name.length()) > 1) {
            return "\\mathit{" + name + "}";
        }
        return name;
    }

    private static String toSubscriptForm(String name) {
        var sb = new StringBuilder(name.length() + 2);
        boolean inDigits = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c >= '₀' && c <= '₉') {
                if (!inDigits) {
                    sb.append('_');
                    inDigits = true;
                }
                sb.append((char) ('0' + (c - '₀')));
            }else {
                inDigits = false;
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String visitNumeral(Expr.Numeral numeral) {
        return numeral.value();
    }

    @Override
    public String visitSetLiteral(Expr.SetLiteral set) {
        if (set.elements().isEmpty()) {
            return symbol(Symbol.SET_OPEN) + symbol(Symbol.SET_CLOSE);
        }
        return symbol(Symbol.SET_OPEN) + " " + list(set.elements()) + " " + symbol(Symbol.SET_CLOSE);
    }

    @Override
    public String visitSequenceLiteral(Expr.SequenceLiteral sequence) {
        if (sequence.elements().isEmpty()) {
            return symbol(Symbol.SEQ_OPEN) + " " + symbol(Symbol.SEQ_CLOSE);
        }
        return symbol(Symbol.SEQ_OPEN) + " " + list(sequence.elements()) + " " + symbol(Symbol.SEQ_CLOSE);
    }

    @Override
    public String visitBagLiteral(Expr.BagLiteral bag) {
        if (bag.elements().isEmpty()) {
            return symbol(Symbol.BAG_OPEN) + " " + symbol(Symbol.BAG_CLOSE);
        }
        return symbol(Symbol.BAG_OPEN) + " " + list(bag.elements()) + " " + symbol(Symbol.BAG_CLOSE);
    }

    @Override
    public String visitComprehension(Expr.Comprehension comprehension) {
        var sb = new StringBuilder();
        var open = switch (comprehension.kind()) {
            case SET -> Symbol.COMPREHENSION_OPEN;
            case SEQUENCE -> Symbol.SEQ_OPEN;
            case BAG -> Symbol.BAG_OPEN;
        };
        var close = switch (comprehension.kind()) {
            case SET -> Symbol.COMPREHENSION_CLOSE;
            case SEQUENCE -> Symbol.SEQ_CLOSE;
            case BAG -> Symbol.BAG_CLOSE;
        };
        sb.append(symbol(open)).append(' ').append(binders(comprehension.binders()));
        comprehension.predicate()
                     .ifPresent(predicate -> sb.append(' ')
                                               .append(symbol(Symbol.SUCH_THAT))
                                               .append(' ')
                                               .append(render(predicate)));
        comprehension.yield()
                     .ifPresent(value -> sb.append(' ')
                                           .append(symbol(Symbol.BULLET))
                                           .append(' ')
                                           .append(render(value)));
        return sb.append(' ').append(symbol(close)).toString();
    }

    @Override
    public String visitTuple(Expr.Tuple tuple) {
        return "(" + list(tuple.elements()) + ")";
    }

    // === Operators ===

    @Override
    public String visitUnaryOp(Expr.UnaryOp unary) {
        var operator = unary.operator();
        var operand = child(unary.operand(), operator.precedence());
        return switch (operator) {
            case NOT -> symbol(Symbol.NOT) + " " + operand;
            case NEGATE -> symbol(Symbol.NEGATE) + operand;
            case CARDINALITY -> symbol(Symbol.CARDINALITY) + " " + operand;
        };
    }

    @Override
    public String visitBinaryOp(Expr.BinaryOp binary) {
        var operator = binary.operator();
        var left = leftChild(binary.left(), operator.leftOperandPrecedence());
        var right = child(binary.right(), operator.rightOperandPrecedence());
        return left + " " + symbol(Symbol.forOperator(operator)) + " " + right;
    }

    @Override
    public String visitRange(Expr.Range range) {
        var required = Precedence.RANGE.tighter();
        return leftChild(range.from(), required) + " " + symbol(Symbol.UPTO) + " " + child(range.to(), required);
    }

    // === Binder forms ===

    @Override
    public String visitQuantifier(Expr.Quantifier quantifier) {
        var sb = new StringBuilder();
        sb.append(symbol(Symbol.forQuantifier(quantifier.kind())))
          .append(' ')
          .append(binders(quantifier.binders()));
        quantifier.constraint()
                  .ifPresent(constraint -> sb.append(' ')
                                             .append(symbol(Symbol.SUCH_THAT))
                                             .append(' ')
                                             .append(render(constraint)));
        sb.append(' ')
          .append(symbol(Symbol.BULLET))
          .append(' ')
          .append(render(quantifier.body()));
        return sb.toString();
    }

    @Override
    public String visitMu(Expr.Mu mu) {
        var sb = new StringBuilder();
        sb.append(symbol(Symbol.MU))
          .append(' ')
          .append(binders(mu.binders()))
          .append(' ')
          .append(symbol(Symbol.SUCH_THAT))
          .append(' ')
          .append(render(mu.predicate()));
        mu.yield()
          .ifPresent(value -> sb.append(' ')
                                .append(symbol(Symbol.BULLET))
                                .append(' ')
                                .append(render(value)));
        return sb.toString();
    }

    @Override
    public String visitLambda(Expr.Lambda lambda) {
        return symbol(Symbol.LAMBDA) + " " + binders(lambda.binders()) + " " + symbol(Symbol.BULLET) + " "
               + render(lambda.body());
    }

    @Override
    public String visitConditional(Expr.Conditional conditional) {
        return symbol(Symbol.IF) + " " + render(conditional.condition())
               + " " + symbol(Symbol.THEN) + " " + render(conditional.thenBranch())
               + " " + symbol(Symbol.ELSE) + " " + render(conditional.elseBranch());
    }

    @Override
    public String visitGuardedCases(Expr.GuardedCases cases) {
        return cases.branches()
                    .stream()
                    .map(branch -> render(branch.expression()) + " & " + symbol(Symbol.IF) + " "
                                   + render(branch.guard()))
                    .collect(Collectors.joining(" \\\\ ", "\\begin{cases} ", " \\end{cases}"));
    }

    // === Postfix forms ===

    @Override
    public String visitApplication(Expr.Application application) {
        var function = application.function();
        if (application.style() == ApplicationStyle.PARENTHESIZED) {
            return child(function, Precedence.POSTFIX) + "(" + list(application.arguments()) + ")";
        }
        var projection = projectionFunction(function);
        if (projection.isPresent() && application.arguments().size() == 1) {
            return projection.get().apply(mode, child(application.arguments().get(0), Precedence.ATOM));
        }
        var sb = new StringBuilder(child(function, Precedence.POSTFIX));
        var separator = isMacro(function) ? " " : "~";
        for (var argument : application.arguments()) {
            sb.append(separator).append(argument(argument));
            separator = "~";
        }
        return sb.toString();
    }

    private Optional<Symbol> projectionFunction(Expr function) {
        if (function instanceof Expr.Identifier identifier) {
            return switch (identifier.name()) {
                case "first" -> Optional.of(Symbol.FIRST);
                case "second" -> Optional.of(Symbol.SECOND);
                default -> Optional.empty();
            };
        }
        return Optional.empty();
    }

    private static boolean isMacro(Expr function) {
        return function instanceof Expr.Identifier identifier && Symbol.forName(identifier.name()).isPresent();
    }

    private String argument(Expr argument) {
        if (argument instanceof Expr.Application application && application.style() == ApplicationStyle.JUXTAPOSED) {
            return "(" + render(argument) + ")";
        }
        return child(argument, Precedence.POSTFIX);
    }

    @Override
    public String visitGenericInstantiation(Expr.GenericInstantiation instantiation) {
        return child(instantiation.base(), Precedence.POSTFIX) + "[" + list(instantiation.arguments()) + "]";
    }

    @Override
    public String visitTupleProjection(Expr.TupleProjection projection) {
        var tuple = child(projection.tuple(), Precedence.POSTFIX);
        if (projection.component().equals("1")) {
            return Symbol.FIRST.apply(mode, tuple);
        }
        if (projection.component().equals("2")) {
            return Symbol.SECOND.apply(mode, tuple);
        }
        if (projection.isPositional()) {
            return tuple + "." + projection.component();
        }
        return tuple + "." + identifier(projection.component());
    }

    @Override
    public String visitRelationalImage(Expr.RelationalImage image) {
        return child(image.relation(), Precedence.POSTFIX) + " " + symbol(Symbol.IMAGE_OPEN) + " "
               + render(image.set()) + " " + symbol(Symbol.IMAGE_CLOSE);
    }

    @Override
    public String visitClosure(Expr.Closure closure) {
        return child(closure.operand(), Precedence.POSTFIX) + symbol(Symbol.forClosure(closure.kind()));
    }

    @Override
    public String visitSuperscript(Expr.Superscript superscript) {
        return child(superscript.base(), Precedence.ATOM) + symbol(Symbol.SUPERSCRIPT_OPEN)
               + render(superscript.exponent()) + symbol(Symbol.SUPERSCRIPT_CLOSE);
    }

    @Override
    public String visitSubscript(Expr.Subscript subscript) {
        return child(subscript.base(), Precedence.ATOM) + "_{" + render(subscript.index()) + "}";
    }

    // === Helper methods ===

    String binders(List<BinderGroup> groups) {
        return groups.stream()
                     .map(this::binder)
                     .collect(Collectors.joining("; "));
    }

    private String binder(BinderGroup group) {
        var names = group.names()
                         .stream()
                         .map(this::identifier)
                         .collect(Collectors.joining(", "));
        return group.domain()
                    .map(domain -> names + " " + symbol(Symbol.DECLARATION_COLON) + " " + render(domain))
                    .orElse(names);
    }

    private String list(List<Expr> elements) {
        return elements.stream()
                       .map(this::render)
                       .collect(Collectors.joining(", "));
    }

    private String child(Expr expr, Precedence required) {
        var text = render(expr);
        return expr.precedence().bindsLooserThan(required) ? "(" + text + ")" : text;
    }

    /**
     * A binder form that is followed by more text would swallow it, so a left operand whose
     * rightmost unparenthesized part is a binder is parenthesized whatever its precedence.
     */
    private String leftChild(Expr expr, Precedence required) {
        if (!expr.precedence().bindsLooserThan(required) && endsWithBinder(expr)) {
            return "(" + render(expr) + ")";
        }
        return child(expr, required);
    }

    private static boolean endsWithBinder(Expr expr) {
        if (expr.precedence() == Precedence.BINDER) {
            return true;
        }
        if (expr instanceof Expr.BinaryOp binary) {
            return exposesBinder(binary.right(), binary.operator().rightOperandPrecedence());
        }
        if (expr instanceof Expr.UnaryOp unary) {
            return exposesBinder(unary.operand(), unary.operator().precedence());
        }
        if (expr instanceof Expr.Range range) {
            return exposesBinder(range.to(), Precedence.RANGE.tighter());
        }
        return false;
    }

    private static boolean exposesBinder(Expr operand, Precedence required) {
        return !operand.precedence().bindsLooserThan(required) && endsWithBinder(operand);
    }

    private String symbol(Symbol symbol) {
        return symbol.latex(mode);
    }
}
