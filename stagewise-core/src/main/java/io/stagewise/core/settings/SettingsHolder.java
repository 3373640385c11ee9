package io.stagewise.core.settings;

import io.stagewise.core.exception.PipelineConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Supplier;

/// Default {@link ReadOnlySettings} implementation with writable layers.
///
/// Configuration code writes defaults and overrides, then the owner calls
/// {@link #lock()} before the pipeline is assembled. After locking every write
/// or merge fails with {@link PipelineConfigurationException}; reads remain
/// available.
///
/// ### Teardown
/// {@link #clear()} is the explicit teardown of the holder: it closes every
/// {@link AutoCloseable} value it holds and empties both layers.
///
/// @implNote Thread-safe. Both layers are concurrent maps ordered with
/// {@link String#CASE_INSENSITIVE_ORDER}. Values must not be null.
public class SettingsHolder implements ReadOnlySettings {

    private final ConcurrentMap<String, Object> defaults =
            new ConcurrentSkipListMap<>(String.CASE_INSENSITIVE_ORDER);
    private final ConcurrentMap<String, Object> overrides =
            new ConcurrentSkipListMap<>(String.CASE_INSENSITIVE_ORDER);
    private volatile boolean locked;

    @Override
    public Object get(String key) {
        return lookup(key)
                .orElseThrow(
                        () ->
                                new NoSuchElementException(
                                        "The given key (" + key + ") was not present in the settings."));
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        return type.cast(get(key));
    }

    @Override
    public <T> Optional<T> tryGet(String key, Class<T> type) {
        return lookup(key).filter(type::isInstance).map(type::cast);
    }

    @Override
    public <T> T getOrDefault(String key, Class<T> type, T defaultValue) {
        return lookup(key).map(type::cast).orElse(defaultValue);
    }

    @Override
    public boolean hasSetting(String key) {
        return overrides.containsKey(key) || defaults.containsKey(key);
    }

    @Override
    public boolean hasExplicitValue(String key) {
        return overrides.containsKey(key);
    }

    /// Sets an override.
    ///
    /// @param key setting key, not null
    /// @param value the value, not null
    /// @throws PipelineConfigurationException if the holder is locked
    public void set(String key, Object value) {
        ensureWriteEnabled(key);
        overrides.put(key, Objects.requireNonNull(value, "value must not be null"));
    }

    /// Sets an override keyed by the name of `type`.
    ///
    /// @param type the type whose name is the key, not null
    /// @param value the value, not null
    /// @param <T> value type
    public <T> void set(Class<T> type, T value) {
        set(type.getName(), value);
    }

    /// Sets a default.
    ///
    /// @param key setting key, not null
    /// @param value the value, not null
    /// @throws PipelineConfigurationException if the holder is locked
    public void setDefault(String key, Object value) {
        ensureWriteEnabled(key);
        defaults.put(key, Objects.requireNonNull(value, "value must not be null"));
    }

    /// Sets a default keyed by the name of `type`.
    ///
    /// @param type the type whose name is the key, not null
    /// @param value the value, not null
    /// @param <T> value type
    public <T> void setDefault(Class<T> type, T value) {
        setDefault(type.getName(), value);
    }

    /// Returns the value keyed by the name of `type`, creating and storing it as
    /// an override when absent.
    ///
    /// @param type value type and key, not null
    /// @param factory creates the value when absent, not null
    /// @param <T> value type
    /// @return existing or newly created value, never null
    /// @throws PipelineConfigurationException if a value must be created and the holder is locked
    public <T> T getOrCreate(Class<T> type, Supplier<? extends T> factory) {
        Optional<T> existing = tryGet(type);
        if (existing.isPresent()) {
            return existing.get();
        }
        T created = factory.get();
        set(type, created);
        return created;
    }

    /// Copies both layers of `other` into this holder, overwriting equal keys.
    ///
    /// @param other the settings to merge, not null
    /// @throws PipelineConfigurationException if this holder is locked
    public void merge(SettingsHolder other) {
        if (locked) {
            throw new PipelineConfigurationException(
                    "Unable to merge settings: the settings have been locked for modifications."
                            + " Move any configuration code earlier in the configuration sequence.");
        }
        defaults.putAll(other.defaults);
        overrides.putAll(other.overrides);
    }

    /// Prevents any further write or merge.
    public void lock() {
        locked = true;
    }

    /// Returns whether {@link #lock()} has been called.
    ///
    /// @return `true` if locked
    public boolean isLocked() {
        return locked;
    }

    /// Closes every {@link AutoCloseable} value and empties both layers.
    ///
    /// Every value is closed even when some fail; the first failure is rethrown
    /// afterwards with the others suppressed.
    ///
    /// @throws IllegalStateException if closing any value failed
    public void clear() {
        List<Exception> failures = new ArrayList<>();
        closeAll(defaults, failures);
        closeAll(overrides, failures);
        if (!failures.isEmpty()) {
            IllegalStateException error =
                    new IllegalStateException("Failed to close settings values", failures.get(0));
            failures.subList(1, failures.size()).forEach(error::addSuppressed);
            throw error;
        }
    }

    private static void closeAll(Map<String, Object> layer, List<Exception> failures) {
        for (Object value : layer.values()) {
            if (value instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    failures.add(e);
                }
            }
        }
        layer.clear();
    }

    private Optional<Object> lookup(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Object value = overrides.get(key);
        if (value == null) {
            value = defaults.get(key);
        }
        return Optional.ofNullable(value);
    }

    private void ensureWriteEnabled(String key) {
        Objects.requireNonNull(key, "key must not be null");
        if (locked) {
            throw new PipelineConfigurationException(
                    "Unable to set the value for key: "
                            + key
                            + ". The settings have been locked for modifications."
                            + " Move any configuration code earlier in the configuration sequence.");
        }
    }
}
