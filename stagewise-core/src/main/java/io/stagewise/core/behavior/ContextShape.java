package io.stagewise.core.behavior;

import java.util.Objects;

/// Registration-time identifier of a context type.
///
/// Shapes group registered steps into stages and name the stage a
/// {@link StageConnector} leads to. Two shapes are equal when both their name and
/// context type are equal.
///
/// @param name human-readable shape name used in diagnostics, not blank
/// @param contextType the Java type of contexts of this shape, not null
/// @param <C> the context type
public record ContextShape<C extends BehaviorContext>(String name, Class<C> contextType) {

    /// Output shape of every {@link PipelineTerminator}. Never a stage key.
    public static final ContextShape<PipelineTerminator.TerminatingContext> TERMINATED =
            new ContextShape<>("terminated", PipelineTerminator.TerminatingContext.class);

    public ContextShape {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(contextType, "contextType must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    /// Creates a shape named after the simple name of `contextType`.
    ///
    /// @param contextType the context type, not null
    /// @param <C> the context type
    /// @return new shape, never null
    public static <C extends BehaviorContext> ContextShape<C> of(Class<C> contextType) {
        Objects.requireNonNull(contextType, "contextType must not be null");
        return new ContextShape<>(contextType.getSimpleName(), contextType);
    }

    /// Creates a shape with an explicit name.
    ///
    /// @param name shape name, not blank
    /// @param contextType the context type, not null
    /// @param <C> the context type
    /// @return new shape, never null
    public static <C extends BehaviorContext> ContextShape<C> of(
            String name, Class<C> contextType) {
        return new ContextShape<>(name, contextType);
    }

    /// Returns whether this is the {@link #TERMINATED} marker.
    ///
    /// @return `true` for the terminating marker
    public boolean isTerminated() {
        return TERMINATED.equals(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
