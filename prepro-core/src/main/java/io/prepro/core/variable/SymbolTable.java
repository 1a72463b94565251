package io.prepro.core.variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/// Name to value mapping backing `#define` directives and explicit variables.
///
/// Names are case sensitive and restricted to letters, digits, `_`, `.` and
/// `-`. Values are stored verbatim and may themselves contain references;
/// they are resolved when a line is expanded, not when they are defined.
///
/// @implNote **Not thread-safe**. Owned by a single
/// {@link io.prepro.core.PreprocessReader}.
public class SymbolTable {

    private static final Pattern NAME_PATTERN = Pattern.compile(VariableStyle.NAME_CHARS + "+");

    private final Map<String, String> variables = new LinkedHashMap<>();

    /// Checks whether a string is a legal variable name.
    ///
    /// @param name candidate name, may be null
    /// @return `true` if the name is non-empty and uses only legal characters
    public static boolean isValidName(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }

    /// Sets a variable, replacing any existing value.
    ///
    /// @param name variable name, not null
    /// @param value the value; null is stored as the empty string
    /// @throws IllegalArgumentException if the name is not a legal variable name
    public void set(String name, String value) {
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Invalid variable name: [" + name + "]");
        }
        variables.put(name, value == null ? "" : value);
    }

    /// Sets a variable to `true` or `false`.
    ///
    /// @param name variable name, not null
    /// @param value the value
    /// @throws IllegalArgumentException if the name is not a legal variable name
    public void set(String name, boolean value) {
        set(name, value ? "true" : "false");
    }

    /// Sets a variable to the string form of an object.
    ///
    /// @param name variable name, not null
    /// @param value the value; null is stored as the empty string
    /// @throws IllegalArgumentException if the name is not a legal variable name
    public void set(String name, Object value) {
        set(name, value == null ? "" : value.toString());
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    /// Removes a variable.
    ///
    /// @param name variable name, not null
    /// @return `true` if the variable existed
    public boolean remove(String name) {
        return variables.remove(name) != null;
    }

    /// Returns the defined names in definition order.
    ///
    /// @return unmodifiable view, never null
    public Set<String> names() {
        return Collections.unmodifiableSet(variables.keySet());
    }

    public int size() {
        return variables.size();
    }
}
