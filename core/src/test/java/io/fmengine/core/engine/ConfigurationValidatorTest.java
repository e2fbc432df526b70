package io.fmengine.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.fmengine.core.model.CompiledConstraint;
import io.fmengine.core.model.Configuration;
import io.fmengine.core.model.ValidationResult;
import io.fmengine.core.model.Violation;
import io.fmengine.core.model.Violation.Rule;
import io.fmengine.core.testkit.TestModels;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConfigurationValidatorTest {

    private final ConfigurationValidator validator = new ConfigurationValidator();

    private static final String EXPR = "Expr";
    private static final String OPERANDS = "Expr/Operands";
    private static final String LEXPR = "Expr/Operands/LExpr";
    private static final String VAR1 = "Expr/Operands/LExpr/Var1";
    private static final String REXPR = "Expr/Operands/RExpr";
    private static final String VAR2 = "Expr/Operands/RExpr/Var2";
    private static final String EXPR2 = "Expr/Operands/RExpr/Expr2";

    @Nested
    @DisplayName("LogicFormula at maxDepth 1")
    class LogicFormulaDepthOne {

        private final LoadedModel model = TestModels.logicFormula(1);

        private ValidationResult validate(Configuration.Builder builder) {
            return validator.validate(
                    model.expanded(), model.constraints(), builder.deselectRemaining(model.expanded()).build());
        }

        @Test
        void singleVariableIsValid() {
            ValidationResult result = validate(Configuration.builder().select(EXPR, OPERANDS, REXPR, VAR2));

            assertThat(result.isValid()).isTrue();
            assertThat(result).isSameAs(ValidationResult.VALID);
        }

        @Test
        void leftOperandWithoutConnectiveIsRejected() {
            ValidationResult result =
                    validate(Configuration.builder().select(EXPR, OPERANDS, LEXPR, VAR1, REXPR, VAR2));

            assertThat(result.violations()).hasSize(1);
            assertThat(result.violatedConstraints())
                    .extracting(CompiledConstraint::source, CompiledConstraint::scopeId)
                    .containsExactly(tuple("!Connectives => !LExpr & Var2", "Expr"));
        }

        @Test
        void missingConnectiveWithNestedRightOperandIsRejected() {
            ValidationResult result = validate(Configuration.builder()
                    .select(EXPR, OPERANDS, REXPR, EXPR2)
                    .select(EXPR2 + "/Operands", EXPR2 + "/Operands/RExpr", EXPR2 + "/Operands/RExpr/Var2"));

            assertThat(result.violations()).hasSize(1);
            assertThat(result.violatedConstraints())
                    .singleElement()
                    .extracting(CompiledConstraint::source)
                    .isEqualTo("!Connectives => !LExpr & Var2");
        }

        @Test
        void nestedExpressionIsCheckedInItsOwnScope() {
            ValidationResult result = validate(Configuration.builder()
                    .select(EXPR, "Expr/Connectives", "Expr/Connectives/Not", OPERANDS, REXPR, EXPR2)
                    .select(EXPR2 + "/Operands", EXPR2 + "/Operands/LExpr", EXPR2 + "/Operands/LExpr/Var1")
                    .select(EXPR2 + "/Operands/RExpr", EXPR2 + "/Operands/RExpr/Var2"));

            assertThat(result.violatedConstraints())
                    .singleElement()
                    .satisfies(c -> {
                        assertThat(c.source()).isEqualTo("!Connectives => !LExpr & Var2");
                        assertThat(c.scopeId()).isEqualTo(EXPR2);
                    });
        }

        @Test
        void everythingUnselectedReportsRootAndConstraint() {
            ValidationResult result = validate(Configuration.builder());

            assertThat(result.structural(Rule.ROOT_UNSELECTED))
                    .singleElement()
                    .extracting(Violation.Structural::instanceId)
                    .isEqualTo(EXPR);
            assertThat(result.violatedConstraints())
                    .extracting(CompiledConstraint::source)
                    .containsExactly("!Connectives => !LExpr & Var2");
        }
    }

    @Nested
    @DisplayName("Structural rules")
    class Structure {

        private final LoadedModel vehicle = TestModels.load("Vehicle", 0);

        private ValidationResult validate(Configuration configuration) {
            return validator.validate(vehicle.expanded(), vehicle.constraints(), configuration);
        }

        private Configuration complete(String... selected) {
            return Configuration.builder().select(selected).deselectRemaining(vehicle.expanded()).build();
        }

        @Test
        void validConfiguration() {
            assertThat(validate(complete("Car", "Car/Engine", "Car/Engine/Petrol", "Car/Radio", "Car/Paint"))
                            .isValid())
                    .isTrue();
        }

        @Test
        void mandatoryChildMustFollowItsParent() {
            ValidationResult result = validate(complete("Car", "Car/Paint"));

            assertThat(result.structural(Rule.MANDATORY_CHILD))
                    .singleElement()
                    .extracting(Violation.Structural::instanceId)
                    .isEqualTo("Car");
        }

        @Test
        void childOfUnselectedParentIsReported() {
            ValidationResult result = validate(complete("Car", "Car/Engine/Petrol", "Car/Paint"));

            assertThat(result.structural(Rule.PARENT_UNSELECTED))
                    .singleElement()
                    .extracting(Violation.Structural::instanceId)
                    .isEqualTo("Car/Engine/Petrol");
            assertThat(result.structural(Rule.MANDATORY_CHILD)).hasSize(1);
        }

        @Test
        void alternativeNeedsExactlyOneChild() {
            ValidationResult two = validate(
                    complete("Car", "Car/Engine", "Car/Engine/Petrol", "Car/Engine/Electric", "Car/Paint"));

            assertThat(two.structural(Rule.ALTERNATIVE_CARDINALITY))
                    .singleElement()
                    .extracting(Violation.Structural::instanceId)
                    .isEqualTo("Car/Engine");
        }

        @Test
        void emptyAlternativeUnderAbstractFeatureReportsBothRules() {
            ValidationResult none = validate(complete("Car", "Car/Engine", "Car/Paint"));

            assertThat(none.violations()).hasSize(2);
            assertThat(none.structural(Rule.ALTERNATIVE_CARDINALITY)).hasSize(1);
            assertThat(none.structural(Rule.ABSTRACT_WITHOUT_CHILD))
                    .singleElement()
                    .extracting(Violation.Structural::instanceId)
                    .isEqualTo("Car/Engine");
        }

        @Test
        void orNeedsAtLeastOneChild() {
            ValidationResult result = validate(complete("Car", "Car/Engine", "Car/Engine/Petrol"));

            assertThat(result.structural(Rule.OR_CARDINALITY))
                    .singleElement()
                    .extracting(Violation.Structural::instanceId)
                    .isEqualTo("Car");
        }

        @Test
        void constraintAndStructureAreReportedTogether() {
            ValidationResult result = validate(complete("Car", "Car/Engine/Electric", "Car/Radio", "Car/Decals"));

            assertThat(result.violations()).hasSize(3);
            assertThat(result.structural(Rule.MANDATORY_CHILD)).hasSize(1);
            assertThat(result.structural(Rule.PARENT_UNSELECTED)).hasSize(1);
            assertThat(result.violatedConstraints())
                    .extracting(CompiledConstraint::source)
                    .containsExactly("Electric => !Radio");
        }

        @Test
        void unknownIdsAreReported() {
            ValidationResult result = validate(Configuration.builder()
                    .select("Car/Turbo")
                    .select("Car", "Car/Engine", "Car/Engine/Petrol", "Car/Paint")
                    .deselectRemaining(vehicle.expanded())
                    .build());

            assertThat(result.violations()).containsExactly(new Violation.UnknownFeature("Car/Turbo"));
        }

        @Test
        void absentReferenceCannotBeSelected() {
            LoadedModel model = TestModels.logicFormula(0);
            Configuration configuration = Configuration.builder()
                    .select(EXPR, "Expr/Connectives", "Expr/Connectives/Not", OPERANDS, REXPR, EXPR2)
                    .deselectRemaining(model.expanded())
                    .build();

            ValidationResult result = validator.validate(model.expanded(), model.constraints(), configuration);

            assertThat(result.structural(Rule.ABSENT_SELECTED))
                    .singleElement()
                    .extracting(Violation.Structural::instanceId)
                    .isEqualTo(EXPR2);
        }
    }

    @Nested
    @DisplayName("Partial configurations")
    class Partial {

        private final LoadedModel vehicle = TestModels.load("Vehicle", 0);

        private ValidationResult validate(Configuration configuration) {
            return validator.validate(vehicle.expanded(), vehicle.constraints(), configuration);
        }

        @Test
        void emptyConfigurationIsValid() {
            assertThat(validate(Configuration.empty()).isValid()).isTrue();
        }

        @Test
        void rulesOverUnboundInstancesAreSkipped() {
            assertThat(validate(Configuration.builder().select("Car", "Car/Engine").build()).isValid()).isTrue();
        }

        @Test
        void overfullAlternativeIsReportedBeforeTheGroupIsComplete() {
            ValidationResult result = validate(Configuration.builder()
                    .select("Car", "Car/Engine", "Car/Engine/Petrol", "Car/Engine/Electric")
                    .build());

            assertThat(result.structural(Rule.ALTERNATIVE_CARDINALITY)).hasSize(1);
            assertThat(result.violatedConstraints()).isEmpty();
        }

        @Test
        void onlyDefinitelyFalseConstraintsCount() {
            assertThat(validate(Configuration.builder().select("Car/Engine/Electric").build()).isValid())
                    .isTrue();

            ValidationResult result =
                    validate(Configuration.builder().select("Car/Engine/Electric", "Car/Radio").build());

            assertThat(result.violations()).singleElement().isInstanceOf(Violation.ConstraintViolated.class);
        }
    }
}
