package org.pragmatica.txt2tex.generator;

import org.pragmatica.txt2tex.ast.BibliographyMetadata;
import org.pragmatica.txt2tex.ast.Declaration;
import org.pragmatica.txt2tex.ast.Document;
import org.pragmatica.txt2tex.ast.DocumentItem;
import org.pragmatica.txt2tex.ast.DocumentMetadata;
import org.pragmatica.txt2tex.ast.DocumentVisitor;
import org.pragmatica.txt2tex.ast.Expr;
import org.pragmatica.txt2tex.ast.ZedContentVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Generates a LaTeX document from a parsed {@link Document}.
 *
 * <p>Every document item kind has one emission method. Expressions go through
 * {@link ExpressionRenderer}, proofs through {@link ProofRenderer} and smart text through
 * {@link TextPipeline}; all of them use the dialect of the {@link GeneratorConfig}.
 */
public final class LatexGenerator implements DocumentVisitor<String> {
    private static final Logger log = LoggerFactory.getLogger(LatexGenerator.class);

    private final GenerationContext context;
    private final ExpressionRenderer expressions;
    private final ProofRenderer proofs;
    private final TextPipeline text;
    private final ZedLines zedLines = new ZedLines();

    private LatexGenerator(GenerationContext context) {
        this.context = context;
        this.expressions = new ExpressionRenderer(context.mode());
        this.proofs = new ProofRenderer(expressions, context.mode());
        this.text = new TextPipeline(context.mode());
    }

    public static GenerationResult generate(Document document) {
        return generate(document, GeneratorConfig.DEFAULT);
    }

    public static GenerationResult generate(Document document, GeneratorConfig config) {
        var context = new GenerationContext(config);
        var output = new LatexGenerator(context).generateDocument(document);
        OverflowScanner.scan(output, config.overflowThreshold())
                       .forEach(warning -> {
                           log.debug("{}", warning.message());
                           context.warn(warning);
                       });
        log.debug("Generated {} characters with {} warnings", output.length(), context.warnings().size());
        return new GenerationResult(output, context.warnings());
    }

    private String generateDocument(Document document) {
        var sb = new StringBuilder();
        if (context.config().standalone()) {
            generatePreamble(sb, document.metadata());
            sb.append("\\begin{document}\n");
            if (document.metadata().title().isPresent()) {
                sb.append("\\maketitle\n");
            }
            sb.append('\n');
        }
        generateItems(sb, document.items());
        generateBibliography(sb, document.bibliography());
        if (context.config().standalone()) {
            sb.append("\\end{document}\n");
        }
        return sb.toString();
    }

    private void generatePreamble(StringBuilder sb, DocumentMetadata metadata) {
        sb.append("\\documentclass[a4paper,10pt,fleqn]{article}\n");
        sb.append("\\usepackage[margin=2cm]{geometry}\n");
        sb.append("\\usepackage{amsmath}\n");
        sb.append("\\usepackage{amssymb}\n");
        sb.append("\\usepackage{proof}\n");
        sb.append("\\usepackage{natbib}\n");
        for (var dialectPackage : context.mode().packages()) {
            sb.append("\\usepackage{").append(dialectPackage).append("}\n");
        }
        metadata.title()
                .ifPresent(title -> {
                    sb.append("\\title{").append(escape(title));
                    metadata.subtitle()
                            .ifPresent(subtitle -> sb.append("\\\\\n\\large ").append(escape(subtitle)));
                    sb.append("}\n");
                });
        metadata.author()
                .ifPresent(author -> {
                    sb.append("\\author{").append(escape(author));
                    metadata.institution()
                            .ifPresent(institution -> sb.append("\\\\\n").append(escape(institution)));
                    sb.append("}\n");
                });
        if (metadata.title().isPresent()) {
            sb.append("\\date{").append(metadata.date().map(LatexGenerator::escape).orElse("")).append("}\n");
        }
        sb.append('\n');
    }

    private static void generateBibliography(StringBuilder sb, BibliographyMetadata bibliography) {
        bibliography.file()
                    .ifPresent(file -> {
                        var database = file.endsWith(".bib") ? file.substring(0, file.length() - 4) : file;
                        sb.append("\\bibliographystyle{")
                          .append(bibliography.style().orElse("plainnat"))
                          .append("}\n");
                        sb.append("\\bibliography{").append(database).append("}\n\n");
                    });
    }

    private void generateItems(StringBuilder sb, List<DocumentItem> items) {
        for (var item : items) {
            sb.append(item.accept(this)).append('\n');
        }
    }

    private String block(List<DocumentItem> items) {
        var sb = new StringBuilder();
        generateItems(sb, items);
        return sb.toString();
    }

    // === Structure ===

    @Override
    public String visitSection(DocumentItem.Section section) {
        var title = escape(section.title());
        return "\\section*{" + title + "}\n\\addcontentsline{toc}{section}{" + title + "}\n\n"
               + block(section.items());
    }

    @Override
    public String visitSolution(DocumentItem.Solution solution) {
        var label = escape(solution.label());
        return "\\subsection*{" + label + "}\n\\addcontentsline{toc}{subsection}{" + label + "}\n\n"
               + block(solution.items());
    }

    @Override
    public String visitPart(DocumentItem.Part part) {
        var label = "(" + escape(part.label()) + ")";
        var heading = switch (part.format()) {
            case INLINE -> "\\noindent\\textbf{" + label + "}\n\n";
            case SUBSECTION -> "\\subsection*{" + label + "}\n\n";
        };
        return heading + block(part.items());
    }

    @Override
    public String visitPageBreak(DocumentItem.PageBreak pageBreak) {
        return "\\newpage\n";
    }

    @Override
    public String visitContents(DocumentItem.Contents contents) {
        return "\\setcounter{tocdepth}{" + contents.depth().tocDepth() + "}\n\\tableofcontents\n";
    }

    @Override
    public String visitTextBlock(DocumentItem.TextBlock textBlock) {
        var body = switch (textBlock.kind()) {
            case SMART -> text.render(textBlock.text());
            case ESCAPED -> escape(textBlock.text());
            case RAW -> textBlock.text();
        };
        return body + "\n";
    }

    @Override
    public String visitExpression(DocumentItem.ExpressionItem item) {
        return "\\[\n" + math(item.expression()) + "\n\\]\n";
    }

    // === Z paragraphs ===

    @Override
    public String visitGivenType(DocumentItem.GivenType givenType) {
        return zed(zedLine(givenType));
    }

    @Override
    public String visitFreeType(DocumentItem.FreeType freeType) {
        return zed(zedLine(freeType));
    }

    @Override
    public String visitAbbreviation(DocumentItem.Abbreviation abbreviation) {
        return zed(zedLine(abbreviation));
    }

    @Override
    public String visitZedBlock(DocumentItem.ZedBlock zedBlock) {
        return zed(zedBlock.contents()
                           .stream()
                           .map(this::zedLine)
                           .collect(Collectors.joining(" \\\\\n")));
    }

    @Override
    public String visitSyntaxBlock(DocumentItem.SyntaxBlock syntaxBlock) {
        return "\\begin{syntax}\n"
               + syntaxBlock.groups()
                            .stream()
                            .map(group -> group.stream()
                                               .map(this::syntaxDefinition)
                                               .collect(Collectors.joining(" \\\\\n")))
                            .collect(Collectors.joining("\n\\also\n"))
               + "\n\\end{syntax}\n";
    }

    /**
     * First row carries the name and {@code ::=}; continuation rows start with a bar in the same column.
     */
    private String syntaxDefinition(DocumentItem.SyntaxDefinition definition) {
        var rows = new ArrayList<String>();
        for (var row : definition.rows()) {
            var branches = row.stream()
                              .map(this::branch)
                              .collect(Collectors.joining(" | "));
            rows.add(rows.isEmpty()
                     ? expressions.identifier(definition.name()) + " & ::= & " + branches
                     : "& | & " + branches);
        }
        return String.join(" \\\\\n", rows);
    }

    private static String zed(String body) {
        return "\\begin{zed}\n" + body + "\n\\end{zed}\n";
    }

    private String zedLine(DocumentItem.ZedContent content) {
        return content.accept(zedLines);
    }

    /**
     * One line of a {@code zed} environment per paragraph.
     */
    private final class ZedLines implements ZedContentVisitor<String> {
        @Override
        public String visitGivenType(DocumentItem.GivenType givenType) {
            return "[" + identifiers(givenType.names()) + "]";
        }

        @Override
        public String visitFreeType(DocumentItem.FreeType freeType) {
            return expressions.identifier(freeType.name()) + parameters(freeType.parameters()) + " ::= "
                   + freeType.branches()
                             .stream()
                             .map(LatexGenerator.this::branch)
                             .collect(Collectors.joining(" | "));
        }

        @Override
        public String visitAbbreviation(DocumentItem.Abbreviation abbreviation) {
            return expressions.identifier(abbreviation.name()) + parameters(abbreviation.parameters()) + " == "
                   + math(abbreviation.definition());
        }

        @Override
        public String visitExpression(DocumentItem.ExpressionItem item) {
            return math(item.expression());
        }
    }

    private String branch(DocumentItem.FreeBranch branch) {
        var constructor = expressions.identifier(branch.constructor());
        return branch.payload()
                     .map(payload -> constructor + " " + context.symbol(Symbol.DATA_OPEN) + " " + math(payload)
                                     + " " + context.symbol(Symbol.DATA_CLOSE))
                     .orElse(constructor);
    }

    @Override
    public String visitAxiomaticDefinition(DocumentItem.AxiomaticDefinition definition) {
        return box("\\begin{axdef}", "axdef", definition.declarations(), definition.predicates());
    }

    @Override
    public String visitGenericDefinition(DocumentItem.GenericDefinition definition) {
        return box("\\begin{gendef}" + parameters(definition.parameters()), "gendef",
                   definition.declarations(), definition.predicates());
    }

    @Override
    public String visitSchema(DocumentItem.Schema schema) {
        // the box title is set upright by the environment
        var name = schema.name().map(title -> title.replace("_", "\\_")).orElse("");
        return box("\\begin{schema}{" + name + "}" + parameters(schema.parameters()), "schema",
                   schema.declarations(), schema.predicates());
    }

    private String box(String opening, String environment, List<Declaration> declarations,
                       List<List<Expr>> predicates) {
        var sb = new StringBuilder();
        sb.append(opening).append('\n');
        sb.append(declarations.stream()
                              .map(this::declaration)
                              .collect(Collectors.joining(" \\\\\n")));
        if (!declarations.isEmpty()) {
            sb.append('\n');
        }
        if (!predicates.isEmpty()) {
            sb.append("\\where\n");
            sb.append(predicates.stream()
                                .map(group -> group.stream()
                                                   .map(this::math)
                                                   .collect(Collectors.joining(" \\\\\n")))
                                .collect(Collectors.joining("\n\\also\n")));
            sb.append('\n');
        }
        sb.append("\\end{").append(environment).append("}\n");
        return sb.toString();
    }

    private String declaration(Declaration declaration) {
        return identifiers(declaration.names()) + " " + context.symbol(Symbol.DECLARATION_COLON) + " "
               + math(declaration.type());
    }

    // === Derivations ===

    @Override
    public String visitTruthTable(DocumentItem.TruthTable truthTable) {
        var sb = new StringBuilder();
        var columns = String.join("|", Collections.nCopies(truthTable.headers().size(), "c"));
        sb.append("\\begin{center}\n");
        sb.append("\\begin{tabular}{").append(columns).append("}\n");
        sb.append(truthTable.headers()
                            .stream()
                            .map(header -> "$" + math(header) + "$")
                            .collect(Collectors.joining(" & ")))
          .append(" \\\\\n");
        sb.append("\\hline\n");
        for (var row : truthTable.rows()) {
            sb.append(row.stream()
                         .map(value -> value ? "T" : "F")
                         .collect(Collectors.joining(" & ")))
              .append(" \\\\\n");
        }
        sb.append("\\end{tabular}\n");
        sb.append("\\end{center}\n");
        return sb.toString();
    }

    @Override
    public String visitEquivalenceChain(DocumentItem.EquivalenceChain chain) {
        var sb = new StringBuilder();
        sb.append("\\begin{argue}\n");
        sb.append(math(chain.first()));
        for (var step : chain.steps()) {
            sb.append(" \\\\\n")
              .append(context.symbol(Symbol.IFF))
              .append(" ")
              .append(math(step.expression()));
            step.justification()
                .ifPresent(justification -> sb.append(" & [")
                                              .append(ProofRenderer.justification(justification, context.mode()))
                                              .append("]"));
        }
        sb.append("\n\\end{argue}\n");
        return sb.toString();
    }

    @Override
    public String visitInferenceRule(DocumentItem.InferenceRule rule) {
        var name = rule.name()
                       .map(text -> "[" + ProofRenderer.justification(text, context.mode()) + "]")
                       .orElse("");
        var premises = rule.premises()
                           .stream()
                           .map(this::math)
                           .collect(Collectors.joining(" & "));
        return "\\[\n\\infer" + name + "{" + math(rule.conclusion()) + "}{" + premises + "}\n\\]\n";
    }

    @Override
    public String visitProofTree(DocumentItem.ProofTree proofTree) {
        DischargeChecker.check(proofTree).forEach(context::warn);
        return "\\[\n" + proofs.render(proofTree) + "\n\\]\n";
    }

    // === Helper methods ===

    private String math(Expr expr) {
        return expressions.render(expr);
    }

    private String identifiers(List<String> names) {
        return names.stream()
                    .map(expressions::identifier)
                    .collect(Collectors.joining(", "));
    }

    private String parameters(List<String> names) {
        return names.isEmpty() ? "" : "[" + identifiers(names) + "]";
    }

    private static String escape(String text) {
        return TextPipeline.escape(text);
    }
}
