package io.stagewise.core.settings;

import java.util.NoSuchElementException;
import java.util.Optional;

/// Read-only key/value lookup consulted while a pipeline is assembled.
///
/// Values live in two layers, defaults and explicit overrides; an override
/// always wins over a default for the same key. Keys compare case-insensitively.
/// Type-keyed lookups use the fully qualified name of the type as key.
///
/// ### Typed lookups
/// Typed accessors check the stored value against the requested class. Use
/// wrapper types for primitives (`Boolean.class`, not `boolean.class`).
///
/// @see SettingsHolder for the default implementation
/// @see io.stagewise.core.registration.RegisterStep#isEnabled(ReadOnlySettings)
public interface ReadOnlySettings {

    /// Returns the raw value for `key`.
    ///
    /// @param key setting key, not null
    /// @return the stored value, never null
    /// @throws NoSuchElementException if neither layer holds `key`
    Object get(String key);

    /// Returns the value for `key` as `type`.
    ///
    /// @param key setting key, not null
    /// @param type expected value type, not null
    /// @param <T> value type
    /// @return the stored value, never null
    /// @throws NoSuchElementException if neither layer holds `key`
    /// @throws ClassCastException if the stored value is not a `type`
    <T> T get(String key, Class<T> type);

    /// Returns the value keyed by the name of `type`.
    ///
    /// @param type value type and key, not null
    /// @param <T> value type
    /// @return the stored value, never null
    /// @throws NoSuchElementException if no value is stored under the type name
    default <T> T get(Class<T> type) {
        return get(type.getName(), type);
    }

    /// Looks up `key` without failing.
    ///
    /// @param key setting key, not null
    /// @param type expected value type, not null
    /// @param <T> value type
    /// @return the value, or empty if absent or of another type
    <T> Optional<T> tryGet(String key, Class<T> type);

    /// Looks up the value keyed by the name of `type` without failing.
    ///
    /// @param type value type and key, not null
    /// @param <T> value type
    /// @return the value, or empty if absent
    default <T> Optional<T> tryGet(Class<T> type) {
        return tryGet(type.getName(), type);
    }

    /// Returns the value for `key`, or `defaultValue` when absent.
    ///
    /// @param key setting key, not null
    /// @param type expected value type, not null
    /// @param defaultValue fallback, may be null
    /// @param <T> value type
    /// @return stored value or `defaultValue`
    /// @throws ClassCastException if a stored value is not a `type`
    <T> T getOrDefault(String key, Class<T> type, T defaultValue);

    /// Returns the value keyed by the name of `type`, or `defaultValue` when absent.
    ///
    /// @param type value type and key, not null
    /// @param defaultValue fallback, may be null
    /// @param <T> value type
    /// @return stored value or `defaultValue`
    default <T> T getOrDefault(Class<T> type, T defaultValue) {
        return getOrDefault(type.getName(), type, defaultValue);
    }

    /// Returns whether either layer holds `key`.
    ///
    /// @param key setting key, not null
    /// @return `true` if a default or override exists
    boolean hasSetting(String key);

    /// Returns whether either layer holds a value keyed by the name of `type`.
    ///
    /// @param type the type whose name is the key, not null
    /// @return `true` if a default or override exists
    default boolean hasSetting(Class<?> type) {
        return hasSetting(type.getName());
    }

    /// Returns whether an override (not just a default) exists for `key`.
    ///
    /// @param key setting key, not null
    /// @return `true` if explicitly set
    boolean hasExplicitValue(String key);

    /// Returns whether an override exists for the name of `type`.
    ///
    /// @param type the type whose name is the key, not null
    /// @return `true` if explicitly set
    default boolean hasExplicitValue(Class<?> type) {
        return hasExplicitValue(type.getName());
    }
}
