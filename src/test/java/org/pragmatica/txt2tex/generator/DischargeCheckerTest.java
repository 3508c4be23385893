package org.pragmatica.txt2tex.generator;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pragmatica.txt2tex.ast.DocumentItem;
import org.pragmatica.txt2tex.parser.Parser;

import static org.assertj.core.api.Assertions.assertThat;

class DischargeCheckerTest {

    private static DocumentItem.ProofTree proof(String input) {
        return (DocumentItem.ProofTree) Parser.parse(input).items().get(0);
    }

    @Nested
    class Citations {

        @Test
        void singleLabel() {
            assertThat(DischargeChecker.citedLabels("=> intro from 1")).containsExactly("1");
        }

        @Test
        void severalLabels_inOrder() {
            assertThat(DischargeChecker.citedLabels("or elim from 2, 3")).containsExactly("2", "3");
            assertThat(DischargeChecker.citedLabels("from 4 and 1")).containsExactly("4", "1");
        }

        @Test
        void ruleWithoutCitation() {
            assertThat(DischargeChecker.citedLabels("and intro")).isEmpty();
            assertThat(DischargeChecker.citedLabels("from p")).isEmpty();
        }

        @Test
        void longNumber_isKeptAsWritten() {
            assertThat(DischargeChecker.citedLabels("=> intro from 99999999999")).containsExactly("99999999999");
        }
    }

    @Nested
    class Scoping {

        @Test
        void labelOnEnclosingAssumption_resolves() {
            var tree = proof("""
                PROOF:
                [1] p [assumption]
                  q [=> intro from 1]
                """);

            assertThat(DischargeChecker.check(tree)).isEmpty();
        }

        @Test
        void labelOnGrandparent_resolves() {
            var tree = proof("""
                PROOF:
                [1] p [assumption]
                  q
                    r [=> intro from 1]
                """);

            assertThat(DischargeChecker.check(tree)).isEmpty();
        }

        @Test
        void unknownLabel_isFlagged() {
            var tree = proof("""
                PROOF:
                [1] p [assumption]
                  q [=> intro from 2]
                """);

            assertThat(DischargeChecker.check(tree)).singleElement()
                .isInstanceOfSatisfying(GenerationWarning.UnresolvedDischarge.class, warning -> {
                    assertThat(warning.label()).isEqualTo("2");
                    assertThat(warning.nodeId()).isEqualTo(1);
                    assertThat(warning.line()).isEqualTo(3);
                    assertThat(warning.reason()).isEqualTo("cites a label no step in this proof introduces");
                });
        }

        @Test
        void labelBeyondAnyProofLabel_isFlagged() {
            var tree = proof("""
                PROOF:
                p => q [=> intro from 99999999999]
                  q [assumption]
                """);

            assertThat(DischargeChecker.check(tree)).singleElement()
                .isInstanceOfSatisfying(GenerationWarning.UnresolvedDischarge.class, warning -> {
                    assertThat(warning.label()).isEqualTo("99999999999");
                    assertThat(warning.reason()).isEqualTo("cites a label no step in this proof introduces");
                });
        }

        @Test
        void ownLabel_isFlagged() {
            var tree = proof("PROOF:\n[1] p [=> intro from 1]\n");

            assertThat(DischargeChecker.check(tree)).singleElement()
                .extracting(warning -> ((GenerationWarning.UnresolvedDischarge) warning).reason())
                .isEqualTo("cites the label introduced by the same step");
        }

        @Test
        void descendantLabel_isFlagged() {
            var tree = proof("""
                PROOF:
                p => p [=> intro from 1]
                  [1] p [assumption]
                """);

            assertThat(DischargeChecker.check(tree)).singleElement()
                .extracting(warning -> ((GenerationWarning.UnresolvedDischarge) warning).reason())
                .isEqualTo("cites a label that is not introduced by an enclosing step");
        }

        @Test
        void siblingLabel_isFlagged() {
            var tree = proof("""
                PROOF:
                r
                  [1] p [assumption]
                  q [=> intro from 1]
                """);

            assertThat(DischargeChecker.check(tree)).hasSize(1);
        }

        @Test
        void citationsInsideCaseBranches_seeTheEnclosingSteps() {
            var tree = proof("""
                PROOF:
                [1] p or q [assumption]
                  case p:
                    r [or elim from 1]
                  case q:
                    r [or elim from 3]
                """);

            assertThat(DischargeChecker.check(tree)).singleElement()
                .extracting(warning -> ((GenerationWarning.UnresolvedDischarge) warning).label())
                .isEqualTo("3");
        }
    }
}
