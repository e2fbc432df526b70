package io.fmengine.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fmengine.core.error.ModelSyntaxException;
import io.fmengine.core.model.Formula;
import io.fmengine.core.model.Formula.And;
import io.fmengine.core.model.Formula.Atom;
import io.fmengine.core.model.Formula.BiImplication;
import io.fmengine.core.model.Formula.Implies;
import io.fmengine.core.model.Formula.Not;
import io.fmengine.core.model.Formula.Or;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FormulaParserTest {

    private static Atom atom(String name) {
        return Atom.unbound(name);
    }

    @Nested
    @DisplayName("Precedence and associativity")
    class Precedence {

        @Test
        void negationBindsTighterThanConjunction() {
            assertThat(FormulaParser.parse("!A & B")).isEqualTo(new And(new Not(atom("A")), atom("B")));
        }

        @Test
        void conjunctionBindsTighterThanDisjunction() {
            assertThat(FormulaParser.parse("A | B & C")).isEqualTo(new Or(atom("A"), new And(atom("B"), atom("C"))));
        }

        @Test
        void disjunctionBindsTighterThanImplication() {
            assertThat(FormulaParser.parse("A | B => C"))
                    .isEqualTo(new Implies(new Or(atom("A"), atom("B")), atom("C")));
        }

        @Test
        void implicationBindsTighterThanBiImplication() {
            assertThat(FormulaParser.parse("A => B <=> C"))
                    .isEqualTo(new BiImplication(new Implies(atom("A"), atom("B")), atom("C")));
        }

        @Test
        void implicationIsRightAssociative() {
            assertThat(FormulaParser.parse("A => B => C"))
                    .isEqualTo(new Implies(atom("A"), new Implies(atom("B"), atom("C"))));
        }

        @Test
        void biImplicationIsLeftAssociative() {
            assertThat(FormulaParser.parse("A <=> B <=> C"))
                    .isEqualTo(new BiImplication(new BiImplication(atom("A"), atom("B")), atom("C")));
        }

        @Test
        void parenthesesOverridePrecedence() {
            assertThat(FormulaParser.parse("(A | B) & C"))
                    .isEqualTo(new And(new Or(atom("A"), atom("B")), atom("C")));
        }

        @Test
        void bundledConstraintParses() {
            Formula formula = FormulaParser.parse("!Connectives => !LExpr & Var2");

            assertThat(formula)
                    .isEqualTo(new Implies(
                            new Not(atom("Connectives")), new And(new Not(atom("LExpr")), atom("Var2"))));
        }
    }

    @Nested
    @DisplayName("Names")
    class Names {

        @Test
        void quotedNamesMayContainSpaces() {
            assertThat(FormulaParser.parse("\"Binary Op\" => LExpr"))
                    .isEqualTo(new Implies(atom("Binary Op"), atom("LExpr")));
        }

        @Test
        void identifiersMayContainDigitsAndUnderscores() {
            assertThat(FormulaParser.parse("Var_1 & Expr2")).isEqualTo(new And(atom("Var_1"), atom("Expr2")));
        }

        @Test
        void unquotedIdentifiersAreAsciiOnly() {
            assertThatThrownBy(() -> FormulaParser.parse("Café | A", 1, 0))
                    .isInstanceOf(ModelSyntaxException.class)
                    .hasMessage("1:4: Unexpected character 'é' in constraint");
        }

        @Test
        void quotedNamesMayUseAnyCharacter() {
            assertThat(FormulaParser.parse("\"Café\" | A")).isEqualTo(new Or(atom("Café"), atom("A")));
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class Malformed {

        @ParameterizedTest
        @ValueSource(strings = {"A &", "A =>", "!", "(A | B", "A | B)", "A B", "A # B", "\"A", "", "   "})
        void rejectsMalformedFormulas(String text) {
            assertThatThrownBy(() -> FormulaParser.parse(text)).isInstanceOf(ModelSyntaxException.class);
        }

        @Test
        void danglingOperatorReportsEndOfLine() {
            assertThatThrownBy(() -> FormulaParser.parse("A &", 9, 4))
                    .isInstanceOf(ModelSyntaxException.class)
                    .hasMessageContaining("Unterminated constraint")
                    .satisfies(e -> {
                        ModelSyntaxException syntax = (ModelSyntaxException) e;
                        assertThat(syntax.line()).isEqualTo(9);
                        assertThat(syntax.column()).isEqualTo(8);
                    });
        }

        @Test
        void unbalancedParenthesesAreNamed() {
            assertThatThrownBy(() -> FormulaParser.parse("(A | B"))
                    .hasMessageContaining("Missing ')'");
            assertThatThrownBy(() -> FormulaParser.parse("A | B)"))
                    .hasMessageContaining("Unbalanced ')'");
        }

        @Test
        void unexpectedCharacterReportsItsColumn() {
            assertThatThrownBy(() -> FormulaParser.parse("A # B", 2, 4))
                    .isInstanceOf(ModelSyntaxException.class)
                    .hasMessage("2:7: Unexpected character '#' in constraint");
        }
    }
}
