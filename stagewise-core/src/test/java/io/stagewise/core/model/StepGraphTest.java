package io.stagewise.core.model;

import static io.stagewise.core.BehaviorFixtures.INCOMING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stagewise.core.BehaviorFixtures.FirstBehavior;
import io.stagewise.core.exception.PipelineConfigurationException;
import io.stagewise.core.registration.BehaviorSignature;
import io.stagewise.core.registration.RegisterStep;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StepGraph")
class StepGraphTest {

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("keeps registration order when nothing is constrained")
        void shouldKeepRegistrationOrder() {
            var steps = List.of(step("A"), step("B"), step("C"), step("D"));

            assertThat(ids(StepGraph.sort(steps))).containsExactly("A", "B", "C", "D");
        }

        @Test
        @DisplayName("orders A, B after A, C before A as C, A, B")
        void shouldResolveBeforeAndAfter() {
            var a = step("A");
            var b = step("B").insertAfter("A");
            var c = step("C").insertBefore("A");

            assertThat(ids(StepGraph.sort(List.of(a, b, c)))).containsExactly("C", "A", "B");
        }

        @Test
        @DisplayName("moves a later registration in front of the step it must precede")
        void shouldMoveStepForwardForInsertBefore() {
            var b = step("B");
            var a = step("A").insertBefore("B");

            assertThat(ids(StepGraph.sort(List.of(b, a)))).containsExactly("A", "B");
        }

        @Test
        @DisplayName("matches referenced ids ignoring case")
        void shouldMatchIdsIgnoringCase() {
            var second = step("Second").insertAfter("FIRST");
            var first = step("first");

            assertThat(ids(StepGraph.sort(List.of(second, first))))
                    .containsExactly("first", "Second");
        }

        @Test
        @DisplayName("produces the same order on every call")
        void shouldBeDeterministic() {
            var steps =
                    List.of(
                            step("A"),
                            step("B").insertBefore("A"),
                            step("C").insertAfter("A"),
                            step("D").insertBefore("C").insertAfter("B"));

            var first = ids(StepGraph.sort(steps));
            var second = ids(StepGraph.sort(steps));

            assertThat(first).containsExactly("B", "A", "D", "C");
            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("returns an empty list for no steps")
        void shouldReturnEmptyForNoSteps() {
            assertThat(StepGraph.sort(List.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("missing references")
    class MissingReferences {

        @Test
        @DisplayName("fails naming the missing step of an enforced constraint")
        void shouldFailOnMissingEnforcedReference() {
            var a = step("A").insertBefore("Missing");

            assertThatThrownBy(() -> StepGraph.sort(List.of(a, step("B"))))
                    .isInstanceOf(PipelineConfigurationException.class)
                    .hasMessageContaining("'Missing'")
                    .hasMessageContaining("insertBefore of step 'A'")
                    .hasMessageContaining("'A', 'B'");
        }

        @Test
        @DisplayName("fails for an enforced insertAfter reference as well")
        void shouldFailOnMissingEnforcedAfterReference() {
            var a = step("A").insertAfter("Ghost");

            assertThatThrownBy(() -> StepGraph.sort(List.of(a)))
                    .isInstanceOf(PipelineConfigurationException.class)
                    .hasMessageContaining("'Ghost'")
                    .hasMessageContaining("insertAfter");
        }

        @Test
        @DisplayName("ignores a missing step referenced by a soft constraint")
        void shouldIgnoreMissingSoftReference() {
            var a = step("A").insertAfterIfExists("Ghost");
            var b = step("B").insertBeforeIfExists("Phantom");

            assertThat(ids(StepGraph.sort(List.of(a, b)))).containsExactly("A", "B");
        }

        @Test
        @DisplayName("honours a soft constraint when the referenced step exists")
        void shouldHonourSoftReferenceWhenPresent() {
            var a = step("A").insertAfterIfExists("B");
            var b = step("B");

            assertThat(ids(StepGraph.sort(List.of(a, b)))).containsExactly("B", "A");
        }
    }

    @Nested
    @DisplayName("cycles")
    class Cycles {

        @Test
        @DisplayName("rejects two steps that must each run after the other")
        void shouldRejectTwoStepCycle() {
            var a = step("A").insertAfter("B");
            var b = step("B").insertAfter("A");

            assertThatThrownBy(() -> StepGraph.sort(List.of(a, b)))
                    .isInstanceOf(PipelineConfigurationException.class)
                    .hasMessageContaining("Circular")
                    .hasMessageContaining("'A' -> 'B' -> 'A'");
        }

        @Test
        @DisplayName("rejects a cycle mixing insertBefore and insertAfter")
        void shouldRejectMixedCycle() {
            var a = step("A").insertBefore("B");
            var b = step("B").insertBefore("C");
            var c = step("C").insertBefore("A");

            assertThatThrownBy(() -> StepGraph.sort(List.of(a, b, c)))
                    .isInstanceOf(PipelineConfigurationException.class)
                    .hasMessageContaining("Circular");
        }

        @Test
        @DisplayName("rejects a step ordered against itself")
        void shouldRejectSelfReference() {
            var a = step("A").insertAfter("A");

            assertThatThrownBy(() -> StepGraph.sort(List.of(a)))
                    .isInstanceOf(PipelineConfigurationException.class)
                    .hasMessageContaining("'A' -> 'A'");
        }
    }

    // --- Test Helpers ---

    private static RegisterStep step(String id) {
        return RegisterStep.create(
                id, FirstBehavior.class, BehaviorSignature.behavior(INCOMING), id + " step");
    }

    private static List<String> ids(List<RegisterStep> steps) {
        return steps.stream().map(RegisterStep::getStepId).toList();
    }
}
