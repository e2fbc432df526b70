package io.fmengine.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fmengine.core.spec.FormulaParser;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FormulaTest {

    private static final Formula.Atom A = new Formula.Atom("A", 0);
    private static final Formula.Atom B = new Formula.Atom("B", 1);

    private static Formula.Valuation valuation(Truth a, Truth b) {
        Map<String, Truth> values = Map.of("A", a, "B", b);
        return atom -> values.get(atom.name());
    }

    @Nested
    @DisplayName("Three-valued evaluation")
    class Evaluation {

        @Test
        void andIsFalseAsSoonAsOneSideIsFalse() {
            Formula and = new Formula.And(A, B);

            assertThat(and.evaluate(valuation(Truth.UNKNOWN, Truth.FALSE))).isEqualTo(Truth.FALSE);
            assertThat(and.evaluate(valuation(Truth.TRUE, Truth.UNKNOWN))).isEqualTo(Truth.UNKNOWN);
            assertThat(and.evaluate(valuation(Truth.TRUE, Truth.TRUE))).isEqualTo(Truth.TRUE);
        }

        @Test
        void orIsTrueAsSoonAsOneSideIsTrue() {
            Formula or = new Formula.Or(A, B);

            assertThat(or.evaluate(valuation(Truth.UNKNOWN, Truth.TRUE))).isEqualTo(Truth.TRUE);
            assertThat(or.evaluate(valuation(Truth.FALSE, Truth.UNKNOWN))).isEqualTo(Truth.UNKNOWN);
            assertThat(or.evaluate(valuation(Truth.FALSE, Truth.FALSE))).isEqualTo(Truth.FALSE);
        }

        @Test
        void implicationWithFalsePremiseHoldsWhateverTheConclusion() {
            Formula implies = new Formula.Implies(A, B);

            assertThat(implies.evaluate(valuation(Truth.FALSE, Truth.UNKNOWN))).isEqualTo(Truth.TRUE);
            assertThat(implies.evaluate(valuation(Truth.TRUE, Truth.FALSE))).isEqualTo(Truth.FALSE);
            assertThat(implies.evaluate(valuation(Truth.UNKNOWN, Truth.FALSE))).isEqualTo(Truth.UNKNOWN);
        }

        @Test
        void biImplicationNeedsBothSides() {
            Formula iff = new Formula.BiImplication(A, B);

            assertThat(iff.evaluate(valuation(Truth.FALSE, Truth.FALSE))).isEqualTo(Truth.TRUE);
            assertThat(iff.evaluate(valuation(Truth.TRUE, Truth.FALSE))).isEqualTo(Truth.FALSE);
            assertThat(iff.evaluate(valuation(Truth.TRUE, Truth.UNKNOWN))).isEqualTo(Truth.UNKNOWN);
        }

        @Test
        void notFlipsKnownValuesOnly() {
            assertThat(new Formula.Not(A).evaluate(valuation(Truth.TRUE, Truth.TRUE))).isEqualTo(Truth.FALSE);
            assertThat(new Formula.Not(A).evaluate(valuation(Truth.UNKNOWN, Truth.TRUE)))
                    .isEqualTo(Truth.UNKNOWN);
        }

        @Test
        void evaluationShortCircuitsLeftToRight() {
            AtomicInteger lookups = new AtomicInteger();
            Formula and = new Formula.And(A, B);

            Truth result = and.evaluate(atom -> {
                lookups.incrementAndGet();
                return atom.name().equals("A") ? Truth.FALSE : Truth.TRUE;
            });

            assertThat(result).isEqualTo(Truth.FALSE);
            assertThat(lookups).hasValue(1);
        }
    }

    @Nested
    @DisplayName("Atoms and rendering")
    class AtomsAndRendering {

        @Test
        void atomsAreDistinctAndInReadingOrder() {
            Formula formula = FormulaParser.parse("B & (A | B) => !C");

            assertThat(formula.atoms())
                    .extracting(Formula.Atom::name)
                    .containsExactly("B", "A", "C");
        }

        @Test
        void mapAtomsBindsEveryOccurrence() {
            Formula bound = FormulaParser.parse("A => B | A").mapAtoms(atom ->
                    new Formula.Atom("Root/" + atom.name(), atom.name().equals("A") ? 0 : 1));

            assertThat(bound.atoms()).allMatch(Formula.Atom::isBound);
            assertThat(bound.render()).isEqualTo("Root/A => Root/B | Root/A");
        }

        @Test
        void renderingUsesMinimalParentheses() {
            assertThat(FormulaParser.parse("!A => B & C").render()).isEqualTo("!A => B & C");
            assertThat(FormulaParser.parse("(A | B) & C").render()).isEqualTo("(A | B) & C");
            assertThat(FormulaParser.parse("!(A & B)").render()).isEqualTo("!(A & B)");
            assertThat(FormulaParser.parse("(A => B) => C").render()).isEqualTo("(A => B) => C");
            assertThat(FormulaParser.parse("A => B => C").render()).isEqualTo("A => B => C");
        }

        @Test
        void renderedTextParsesBackToTheSameFormula() {
            for (String text : List.of("!Connectives => !LExpr & Var2", "A <=> B <=> C", "A | B & !C")) {
                Formula parsed = FormulaParser.parse(text);
                assertThat(FormulaParser.parse(parsed.render())).isEqualTo(parsed);
            }
        }

        @Test
        void atomRequiresName() {
            assertThatThrownBy(() -> Formula.Atom.unbound(null)).isInstanceOf(NullPointerException.class);
            assertThat(Formula.Atom.unbound("X").isBound()).isFalse();
        }
    }
}
