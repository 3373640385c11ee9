package io.stagewise.core.behavior;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stagewise.core.BehaviorFixtures.IncomingContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ContextShape")
class ContextShapeTest {

    @Test
    @DisplayName("names a shape after the simple name of its context type")
    void shouldUseSimpleName() {
        var shape = ContextShape.of(IncomingContext.class);

        assertThat(shape.name()).isEqualTo("IncomingContext");
        assertThat(shape).hasToString("IncomingContext");
        assertThat(shape.isTerminated()).isFalse();
    }

    @Test
    @DisplayName("compares shapes by name and type")
    void shouldCompareByValue() {
        assertThat(ContextShape.of(IncomingContext.class))
                .isEqualTo(ContextShape.of("IncomingContext", IncomingContext.class))
                .isNotEqualTo(ContextShape.of("raw", IncomingContext.class));
    }

    @Test
    @DisplayName("recognizes the terminating marker")
    void shouldRecognizeTerminated() {
        assertThat(ContextShape.TERMINATED.isTerminated()).isTrue();
        assertThat(ContextShape.TERMINATED.contextType())
                .isEqualTo(PipelineTerminator.TerminatingContext.class);
    }

    @Test
    @DisplayName("rejects a blank name")
    void shouldRejectBlankName() {
        assertThatThrownBy(() -> ContextShape.of(" ", IncomingContext.class))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
