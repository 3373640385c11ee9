package io.stagewise.core.builder;

import java.util.List;
import java.util.function.Consumer;

/// Object-construction service used to instantiate behaviors.
///
/// The chain compiler calls {@link #build(Class)} once per registered step that
/// has no factory of its own; a step factory receives the builder instead and
/// may use it to resolve its own collaborators.
///
/// ### Ownership
/// Instances produced by a builder are owned by it until {@link #release(Object)}
/// is called or the builder is closed. Closing a builder releases everything it
/// still owns; child builders are closed independently of their parent.
///
/// @see DefaultBehaviorBuilder for the built-in implementation
public interface BehaviorBuilder extends AutoCloseable {

    /// Builds one instance of `type`.
    ///
    /// @param type the type to build, not null
    /// @param <T> instance type
    /// @return a live instance, never null
    /// @throws io.stagewise.core.exception.BehaviorConstructionException if `type` cannot be built
    <T> T build(Class<T> type);

    /// Builds every instance registered for `type`.
    ///
    /// @param type the type to build, not null
    /// @param <T> instance type
    /// @return built instances in registration order, never null (may be empty)
    <T> List<T> buildAll(Class<T> type);

    /// Creates a builder that sees this builder's registrations and may add its own.
    ///
    /// @return new child builder, never null
    BehaviorBuilder createChildBuilder();

    /// Gives up ownership of `instance`, closing it when it is {@link AutoCloseable}.
    ///
    /// Instances this builder does not own are ignored.
    ///
    /// @param instance the instance to release, not null
    void release(Object instance);

    /// Builds an instance, passes it to `action`, then releases it.
    ///
    /// @param type the type to build, not null
    /// @param action receives the instance, not null
    /// @param <T> instance type
    default <T> void buildAndDispatch(Class<T> type, Consumer<? super T> action) {
        T instance = build(type);
        try {
            action.accept(instance);
        } finally {
            release(instance);
        }
    }

    /// Releases every instance this builder still owns.
    @Override
    void close();
}
