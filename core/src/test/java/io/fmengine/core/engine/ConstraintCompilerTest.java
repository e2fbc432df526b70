package io.fmengine.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fmengine.core.error.ConstraintCompileException;
import io.fmengine.core.error.ModelSyntaxException;
import io.fmengine.core.model.CompiledConstraint;
import io.fmengine.core.model.CompiledConstraints;
import io.fmengine.core.model.ConstraintLine;
import io.fmengine.core.model.ExpandedTree;
import io.fmengine.core.model.Formula;
import io.fmengine.core.model.Truth;
import io.fmengine.core.spec.ModelParser;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConstraintCompilerTest {

    private final ConstraintCompiler compiler = new ConstraintCompiler();

    private static ExpandedTree expand(String text, int maxDepth) {
        return new RecursionExpander()
                .expand(new FeatureTreeBuilder().build(new ModelParser().parse(text)), maxDepth);
    }

    private static ExpandedTree logicFormula(int maxDepth) {
        return expand(FeatureModelEngine.readBundledModel(), maxDepth);
    }

    @Nested
    @DisplayName("Scoping")
    class Scoping {

        @Test
        void withoutRecursionEveryLineCompilesOnceInTheRootScope() {
            CompiledConstraints compiled = compiler.compile(logicFormula(0));

            assertThat(compiled.size()).isEqualTo(3);
            assertThat(compiled.all()).extracting(CompiledConstraint::scopeId).containsOnly("Expr");
            assertThat(compiled.all().get(1).formula().render())
                    .isEqualTo("Expr/Connectives/BinaryOp => Expr/Operands/LExpr");
        }

        @Test
        void everyExpandedReferenceGetsItsOwnGuardedCopy() {
            CompiledConstraints compiled = compiler.compile(logicFormula(1));

            assertThat(compiled.size()).isEqualTo(9);
            assertThat(compiled.all())
                    .filteredOn(c -> c.source().equals("BinaryOp => LExpr"))
                    .extracting(c -> c.formula().render())
                    .containsExactly(
                            "Expr/Connectives/BinaryOp => Expr/Operands/LExpr",
                            "Expr/Operands/LExpr/Expr1 => Expr/Operands/LExpr/Expr1/Connectives/BinaryOp"
                                    + " => Expr/Operands/LExpr/Expr1/Operands/LExpr",
                            "Expr/Operands/RExpr/Expr2 => Expr/Operands/RExpr/Expr2/Connectives/BinaryOp"
                                    + " => Expr/Operands/RExpr/Expr2/Operands/LExpr");
        }

        @Test
        void copiesBindToDistinctInstances() {
            ExpandedTree tree = logicFormula(1);
            CompiledConstraints compiled = compiler.compile(tree);

            List<CompiledConstraint> notCopies = compiled.all().stream()
                    .filter(c -> c.source().equals("Not => !LExpr"))
                    .toList();

            assertThat(notCopies).hasSize(3);
            assertThat(notCopies)
                    .extracting(CompiledConstraint::scopeId)
                    .containsExactly("Expr", "Expr/Operands/LExpr/Expr1", "Expr/Operands/RExpr/Expr2");
            assertThat(notCopies.get(0).slots()).doesNotContain(notCopies.get(1).slots());
        }

        @Test
        void guardedCopyHoldsWhileTheCloneIsUnselected() {
            ExpandedTree tree = logicFormula(1);
            CompiledConstraint guarded = compiler.compile(tree).all().stream()
                    .filter(c -> c.scopeId().equals("Expr/Operands/LExpr/Expr1"))
                    .findFirst()
                    .orElseThrow();
            Boolean[] values = new Boolean[tree.size()];
            values[tree.require("Expr/Operands/LExpr/Expr1").ordinal()] = false;

            assertThat(guarded.evaluate(values)).isEqualTo(Truth.TRUE);
        }

        @Test
        void atomsMissingFromTheCloneResolveInTheEnclosingScope() {
            ExpandedTree tree = expand("""
                    namespace Program
                    features
                        Program
                            mandatory
                                Body
                                    optional
                                        Nested {rec Body}
                                        Stmt
                            optional
                                Debug
                    constraints
                        Stmt => Debug
                    """, 1);

            CompiledConstraints compiled = compiler.compile(tree);

            assertThat(compiled.all())
                    .extracting(c -> c.formula().render())
                    .containsExactly(
                            "Program/Body/Stmt => Program/Debug",
                            "Program/Body/Nested => Program/Body/Nested/Stmt => Program/Debug");
        }

        @Test
        void indexesConstraintsBySlot() {
            ExpandedTree tree = logicFormula(0);
            CompiledConstraints compiled = compiler.compile(tree);

            int not = tree.require("Expr/Connectives/Not").ordinal();
            int lexpr = tree.require("Expr/Operands/LExpr").ordinal();

            assertThat(compiled.mentioning(not)).extracting(CompiledConstraint::source).containsExactly("Not => !LExpr");
            assertThat(compiled.mentioning(lexpr)).hasSize(3);
            assertThat(compiled.mentioning(tree.root().ordinal())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Compile errors")
    class CompileErrors {

        @Test
        void unknownAtomIsReportedWithItsLine() {
            ExpandedTree tree = logicFormula(0);

            assertThatThrownBy(() -> compiler.compile(tree, List.of(new ConstraintLine("Xor => Not", 31))))
                    .isInstanceOf(ConstraintCompileException.class)
                    .hasMessageContaining("unknown feature 'Xor'")
                    .satisfies(e -> {
                        ConstraintCompileException compile = (ConstraintCompileException) e;
                        assertThat(compile.unresolvedAtom()).isEqualTo("Xor");
                        assertThat(compile.line()).isEqualTo(31);
                    });
        }

        @Test
        void malformedLineWrapsTheSyntaxError() {
            ExpandedTree tree = logicFormula(0);

            assertThatThrownBy(() -> compiler.compile(tree, List.of(ConstraintLine.of("Not & (LExpr"))))
                    .isInstanceOf(ConstraintCompileException.class)
                    .hasMessageContaining("Malformed constraint")
                    .hasCauseInstanceOf(ModelSyntaxException.class);
        }

        @Test
        void directlyGivenLinesCompile() {
            ExpandedTree tree = logicFormula(0);

            CompiledConstraints compiled = compiler.compile(tree, List.of(ConstraintLine.of("Or | And => Var1")));

            assertThat(compiled.all()).singleElement().satisfies(c -> {
                assertThat(c.line()).isZero();
                assertThat(c.formula()).isInstanceOf(Formula.Implies.class);
            });
        }
    }
}
