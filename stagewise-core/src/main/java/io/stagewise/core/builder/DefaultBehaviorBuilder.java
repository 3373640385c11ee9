package io.stagewise.core.builder;

import io.stagewise.core.exception.BehaviorConstructionException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Minimal {@link BehaviorBuilder}: registered suppliers first, public no-arg
/// constructors otherwise.
///
/// Registrations are looked up in this builder, then in its ancestors; the most
/// recent registration for a type wins for {@link #build(Class)}, while
/// {@link #buildAll(Class)} returns one instance per registration, ancestors
/// first.
///
/// ### Ownership
/// Instances created from a supplier or a constructor are tracked and closed on
/// {@link #release(Object)} or {@link #close()} when they implement
/// {@link AutoCloseable}. Instances registered with
/// {@link #registerInstance(Class, Object)} stay with their owner and are never
/// closed here.
///
/// @implNote Not thread-safe. Registration and building happen while the
/// pipeline is assembled, on a single thread.
public class DefaultBehaviorBuilder implements BehaviorBuilder {

    private static final Logger logger = Logger.getLogger(DefaultBehaviorBuilder.class.getName());

    private final DefaultBehaviorBuilder parent;
    private final Map<Class<?>, List<Supplier<?>>> registrations = new LinkedHashMap<>();
    private final List<Object> owned = new ArrayList<>();
    private final List<Object> singletons = new ArrayList<>();

    /// Creates a root builder with no registrations.
    public DefaultBehaviorBuilder() {
        this(null);
    }

    private DefaultBehaviorBuilder(DefaultBehaviorBuilder parent) {
        this.parent = parent;
    }

    /// Registers a supplier for `type`.
    ///
    /// @param type the type the supplier builds, not null
    /// @param supplier creates a new instance per call, not null
    /// @param <T> instance type
    /// @return this builder for chaining
    public <T> DefaultBehaviorBuilder register(Class<T> type, Supplier<? extends T> supplier) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(supplier, "supplier must not be null");
        registrations.computeIfAbsent(type, key -> new ArrayList<>()).add(supplier);
        return this;
    }

    /// Registers an existing instance for `type`; every build returns it.
    ///
    /// @param type the type the instance is built for, not null
    /// @param instance the instance, not null
    /// @param <T> instance type
    /// @return this builder for chaining
    public <T> DefaultBehaviorBuilder registerInstance(Class<T> type, T instance) {
        Objects.requireNonNull(instance, "instance must not be null");
        singletons.add(instance);
        return register(type, () -> instance);
    }

    @Override
    public <T> T build(Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        Supplier<?> supplier = findLast(type);
        T instance = supplier != null ? type.cast(supplier.get()) : construct(type);
        if (instance == null) {
            throw new BehaviorConstructionException(
                    "Supplier registered for " + type.getName() + " returned null");
        }
        track(instance);
        logger.fine("Built " + instance.getClass().getName() + " for " + type.getName());
        return instance;
    }

    @Override
    public <T> List<T> buildAll(Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        List<Supplier<?>> suppliers = new ArrayList<>();
        collect(type, suppliers);
        List<T> instances = new ArrayList<>(suppliers.size());
        for (Supplier<?> supplier : suppliers) {
            T instance = type.cast(supplier.get());
            track(instance);
            instances.add(instance);
        }
        return instances;
    }

    @Override
    public BehaviorBuilder createChildBuilder() {
        return new DefaultBehaviorBuilder(this);
    }

    @Override
    public void release(Object instance) {
        Objects.requireNonNull(instance, "instance must not be null");
        if (removeOwned(instance)) {
            closeInstance(instance);
        }
    }

    /// Releases every owned instance, newest first.
    ///
    /// Every instance is closed even when some fail; the first failure is
    /// rethrown afterwards with the others suppressed.
    ///
    /// @throws IllegalStateException if closing any instance failed
    @Override
    public void close() {
        List<RuntimeException> failures = new ArrayList<>();
        for (int i = owned.size() - 1; i >= 0; i--) {
            try {
                closeInstance(owned.get(i));
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }
        owned.clear();
        if (!failures.isEmpty()) {
            RuntimeException first = failures.get(0);
            failures.subList(1, failures.size()).forEach(first::addSuppressed);
            throw first;
        }
    }

    /// Returns the number of instances this builder currently owns.
    ///
    /// @return owned instance count, always non-negative
    public int ownedCount() {
        return owned.size();
    }

    private Supplier<?> findLast(Class<?> type) {
        List<Supplier<?>> suppliers = registrations.get(type);
        if (suppliers != null && !suppliers.isEmpty()) {
            return suppliers.get(suppliers.size() - 1);
        }
        return parent != null ? parent.findLast(type) : null;
    }

    private void collect(Class<?> type, List<Supplier<?>> into) {
        if (parent != null) {
            parent.collect(type, into);
        }
        into.addAll(registrations.getOrDefault(type, List.of()));
    }

    private void track(Object instance) {
        if (!isSingleton(instance)) {
            owned.add(instance);
        }
    }

    private boolean isSingleton(Object instance) {
        for (DefaultBehaviorBuilder b = this; b != null; b = b.parent) {
            for (Object singleton : b.singletons) {
                if (singleton == instance) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean removeOwned(Object instance) {
        for (int i = 0; i < owned.size(); i++) {
            if (owned.get(i) == instance) {
                owned.remove(i);
                return true;
            }
        }
        return false;
    }

    private static void closeInstance(Object instance) {
        if (instance instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                throw new IllegalStateException(
                        "Failed to release " + instance.getClass().getName(), e);
            }
        }
    }

    private static <T> T construct(Class<T> type) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new BehaviorConstructionException(
                    "Cannot build " + type.getName() + ": no registration for an abstract type");
        }
        try {
            Constructor<T> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new BehaviorConstructionException(
                    "Cannot build " + type.getName() + ": no no-arg constructor and no registration",
                    e);
        } catch (InvocationTargetException e) {
            throw new BehaviorConstructionException(
                    "Constructor of " + type.getName() + " failed", e.getCause());
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new BehaviorConstructionException("Cannot build " + type.getName(), e);
        }
    }
}
