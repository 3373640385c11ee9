package io.stagewise.cli.demo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stagewise.core.PipelineFactory;
import io.stagewise.core.cancellation.CancellationSignal;
import io.stagewise.core.cancellation.CancellationSource;
import io.stagewise.core.exception.PipelineConfigurationException;
import io.stagewise.core.settings.SettingsHolder;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DemoPipeline")
class DemoPipelineTest {

    @Nested
    @DisplayName("execution")
    class Execution {

        @Test
        @DisplayName("runs every demo step in order")
        void shouldRunAllSteps() {
            // Given
            try (var pipeline = DemoPipeline.register(PipelineFactory.builder()).build(DemoPipeline.INCOMING)) {
                var context = new IncomingContext("hello");

                // When
                pipeline.execute(context, CancellationSignal.none()).toCompletableFuture().join();

                // Then
                assertThat(context.trace())
                        .containsExactly(
                                "LogMessageBehavior: hello",
                                "AuditBehavior: message #1",
                                "CancellationCheckBehavior",
                                "IncomingToOutgoingConnector: HELLO",
                                "DispatchTerminator: sent HELLO");
            }
        }

        @Test
        @DisplayName("keeps the audit counter across executions")
        void shouldShareAuditCounter() {
            try (var pipeline = DemoPipeline.register(PipelineFactory.builder()).build(DemoPipeline.INCOMING)) {
                pipeline.execute(new IncomingContext("one")).toCompletableFuture().join();
                var second = new IncomingContext("two");

                pipeline.execute(second).toCompletableFuture().join();

                assertThat(second.trace()).contains("AuditBehavior: message #2");
            }
        }

        @Test
        @DisplayName("stops at the cancellation check when cancelled")
        void shouldStopWhenCancelled() {
            try (var pipeline = DemoPipeline.register(PipelineFactory.builder()).build(DemoPipeline.INCOMING)) {
                var source = new CancellationSource();
                source.cancel();
                var context = new IncomingContext("late");

                assertThatThrownBy(
                                () -> pipeline.execute(context, source.signal())
                                        .toCompletableFuture()
                                        .join())
                        .isInstanceOfAny(CancellationException.class, CompletionException.class);
                assertThat(context.trace()).noneMatch(line -> line.startsWith("Dispatch"));
            }
        }
    }

    @Nested
    @DisplayName("settings")
    class Settings {

        @Test
        @DisplayName("builds the settings key from the step id")
        void shouldBuildDisabledKey() {
            assertThat(DemoPipeline.disabledKey(DemoPipeline.AUDIT)).isEqualTo("stagewise.disabled.Audit");
        }

        @Test
        @DisplayName("rejects a blank step id")
        void shouldRejectBlankStepId() {
            assertThatThrownBy(() -> DemoPipeline.disabledKey(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("leaves out a disabled ordinary step")
        void shouldSkipDisabledStep() {
            var settings = new SettingsHolder();
            settings.set(DemoPipeline.disabledKey(DemoPipeline.LOG_MESSAGE), true);

            var model = DemoPipeline.register(PipelineFactory.builder().settings(settings))
                    .buildModel(DemoPipeline.INCOMING);

            assertThat(model.stepIds())
                    .containsExactly("Audit", "CheckCancellation", "ToOutgoing", "Dispatch");
        }

        @Test
        @DisplayName("ends after the connector stage when the terminator is disabled")
        void shouldAllowDisabledTerminator() {
            var settings = new SettingsHolder();
            settings.set(DemoPipeline.disabledKey(DemoPipeline.DISPATCH), true);

            try (var pipeline = DemoPipeline.register(PipelineFactory.builder().settings(settings))
                    .build(DemoPipeline.INCOMING)) {
                var context = new IncomingContext("quiet");
                pipeline.execute(context).toCompletableFuture().join();

                assertThat(context.trace()).last().isEqualTo("IncomingToOutgoingConnector: QUIET");
            }
        }

        @Test
        @DisplayName("fails when the connector is disabled")
        void shouldFailWithoutConnector() {
            var settings = new SettingsHolder();
            settings.set(DemoPipeline.disabledKey(DemoPipeline.TO_OUTGOING), true);
            var factory = DemoPipeline.register(PipelineFactory.builder().settings(settings));

            assertThatThrownBy(() -> factory.buildModel(DemoPipeline.INCOMING))
                    .isInstanceOf(PipelineConfigurationException.class)
                    .hasMessageContaining("No stage connector found");
        }
    }
}
