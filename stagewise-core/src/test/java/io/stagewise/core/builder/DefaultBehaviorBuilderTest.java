package io.stagewise.core.builder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stagewise.core.BehaviorFixtures.ClosableBehavior;
import io.stagewise.core.BehaviorFixtures.FirstBehavior;
import io.stagewise.core.BehaviorFixtures.RecordingBehavior;
import io.stagewise.core.BehaviorFixtures.SecondBehavior;
import io.stagewise.core.behavior.SimpleBehavior;
import io.stagewise.core.exception.BehaviorConstructionException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DefaultBehaviorBuilder")
class DefaultBehaviorBuilderTest {

    private DefaultBehaviorBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DefaultBehaviorBuilder();
    }

    @Nested
    @DisplayName("build")
    class Build {

        @Test
        @DisplayName("constructs an unregistered concrete type through its no-arg constructor")
        void shouldConstructReflectively() {
            var behavior = builder.build(FirstBehavior.class);

            assertThat(behavior).isInstanceOf(FirstBehavior.class);
            assertThat(builder.build(FirstBehavior.class)).isNotSameAs(behavior);
        }

        @Test
        @DisplayName("uses the last registered supplier")
        void shouldUseLastRegistration() {
            builder.register(RecordingBehavior.class, FirstBehavior::new);
            builder.register(RecordingBehavior.class, SecondBehavior::new);

            assertThat(builder.build(RecordingBehavior.class)).isInstanceOf(SecondBehavior.class);
        }

        @Test
        @DisplayName("fails for an abstract type without registration")
        void shouldFailForAbstractType() {
            assertThatThrownBy(() -> builder.build(SimpleBehavior.class))
                    .isInstanceOf(BehaviorConstructionException.class)
                    .hasMessageContaining("abstract");
        }

        @Test
        @DisplayName("fails for a type without no-arg constructor")
        void shouldFailWithoutNoArgConstructor() {
            assertThatThrownBy(() -> builder.build(NeedsArgument.class))
                    .isInstanceOf(BehaviorConstructionException.class)
                    .hasCauseInstanceOf(NoSuchMethodException.class);
        }

        @Test
        @DisplayName("unwraps a failing constructor")
        void shouldUnwrapConstructorFailure() {
            assertThatThrownBy(() -> builder.build(ExplodingConstructor.class))
                    .isInstanceOf(BehaviorConstructionException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("fails when a supplier returns null")
        void shouldFailForNullSupplierResult() {
            builder.register(FirstBehavior.class, () -> null);

            assertThatThrownBy(() -> builder.build(FirstBehavior.class))
                    .isInstanceOf(BehaviorConstructionException.class)
                    .hasMessageContaining("returned null");
        }
    }

    @Nested
    @DisplayName("child builders")
    class ChildBuilders {

        @Test
        @DisplayName("resolves registrations from the parent")
        void shouldResolveFromParent() {
            builder.register(RecordingBehavior.class, SecondBehavior::new);

            var child = builder.createChildBuilder();

            assertThat(child.build(RecordingBehavior.class)).isInstanceOf(SecondBehavior.class);
        }

        @Test
        @DisplayName("lets a child registration shadow the parent")
        void shouldShadowParent() {
            builder.register(RecordingBehavior.class, SecondBehavior::new);
            var child = (DefaultBehaviorBuilder) builder.createChildBuilder();
            child.register(RecordingBehavior.class, FirstBehavior::new);

            assertThat(child.build(RecordingBehavior.class)).isInstanceOf(FirstBehavior.class);
            assertThat(builder.build(RecordingBehavior.class)).isInstanceOf(SecondBehavior.class);
        }

        @Test
        @DisplayName("lists parent registrations before its own in buildAll")
        void shouldBuildAllParentFirst() {
            builder.register(RecordingBehavior.class, FirstBehavior::new);
            var child = (DefaultBehaviorBuilder) builder.createChildBuilder();
            child.register(RecordingBehavior.class, SecondBehavior::new);

            assertThat(child.buildAll(RecordingBehavior.class))
                    .hasExactlyElementsOfTypes(FirstBehavior.class, SecondBehavior.class);
        }
    }

    @Nested
    @DisplayName("release")
    class Release {

        @Test
        @DisplayName("closes a released instance it built")
        void shouldCloseReleasedInstance() {
            var behavior = builder.build(ClosableBehavior.class);

            builder.release(behavior);

            assertThat(behavior.isClosed()).isTrue();
            assertThat(builder.ownedCount()).isZero();
        }

        @Test
        @DisplayName("never closes a registered singleton")
        void shouldNotCloseSingleton() {
            var singleton = new ClosableBehavior();
            builder.registerInstance(ClosableBehavior.class, singleton);

            var built = builder.build(ClosableBehavior.class);
            builder.release(built);
            builder.close();

            assertThat(built).isSameAs(singleton);
            assertThat(singleton.isClosed()).isFalse();
        }

        @Test
        @DisplayName("ignores an instance it did not build")
        void shouldIgnoreForeignInstance() {
            var foreign = new ClosableBehavior();

            builder.release(foreign);

            assertThat(foreign.isClosed()).isFalse();
        }

        @Test
        @DisplayName("closes remaining instances newest first")
        void shouldCloseNewestFirst() {
            var order = new ArrayList<String>();
            builder.register(Tracked.class, () -> new Tracked("first", order));
            var first = builder.build(Tracked.class);
            builder.register(Tracked.class, () -> new Tracked("second", order));
            var second = builder.build(Tracked.class);

            builder.close();

            assertThat(order).containsExactly("second", "first");
            assertThat(first).isNotSameAs(second);
        }

        @Test
        @DisplayName("releases the instance after dispatching it")
        void shouldReleaseAfterDispatch() {
            var seen = new AtomicReference<ClosableBehavior>();

            builder.buildAndDispatch(
                    ClosableBehavior.class,
                    behavior -> {
                        assertThat(behavior.isClosed()).isFalse();
                        seen.set(behavior);
                    });

            assertThat(seen.get().isClosed()).isTrue();
        }
    }

    // --- Test Helpers ---

    static final class NeedsArgument {
        NeedsArgument(String value) {}
    }

    static final class ExplodingConstructor {
        ExplodingConstructor() {
            throw new IllegalStateException("boom");
        }
    }

    static final class Tracked implements AutoCloseable {
        private final String name;
        private final List<String> order;

        Tracked(String name, List<String> order) {
            this.name = name;
            this.order = order;
        }

        @Override
        public void close() {
            order.add(name);
        }
    }
}
