package com.formflow.formflow_engine.variable;

import com.formflow.formflow_engine.exception.LoopUsageException;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Identifier checks for user-chosen variable names. Pure functions, no state.
 */
public final class VariableNameValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$]*$");

    private static final Set<String> RESERVED_LOWER = Stream
            .concat(VariableConstants.INTERNAL_VARIABLE_NAMES.stream(),
                    VariableConstants.SYSTEM_RESERVED_LOOP_VARIABLES.stream())
            .map(name -> name.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());

    private static final int MAX_SUFFIX = 10_000;

    private VariableNameValidator() {
    }

    public static boolean isValid(String name) {
        String trimmed = normalize(name);
        return trimmed != null && IDENTIFIER.matcher(trimmed).matches();
    }

    /** Returns the trimmed name when valid, otherwise the fallback. */
    public static String sanitize(String name, String fallback) {
        return isValid(name) ? name.trim() : fallback;
    }

    public static void requireValid(String name, String role) {
        if (!isValid(name)) {
            throw new LoopUsageException(
                    "Invalid " + role + " name '" + name + "'. Use letters, digits, '_' or '$', not starting with a digit.");
        }
    }

    /** Trimmed name, or null when blank. Case is preserved: names are case-sensitive. */
    public static String normalize(String name) {
        if (name == null) return null;
        String trimmed = name.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static boolean isReservedName(String name) {
        String trimmed = normalize(name);
        return trimmed != null && RESERVED_LOWER.contains(trimmed.toLowerCase(Locale.ROOT));
    }

    /**
     * First of base, base_1, base_2, ... that is not in existingNames.
     */
    public static String suggestAlternativeName(String baseName, Iterable<String> existingNames) {
        String base = normalize(baseName);
        if (base == null) base = "variable";

        Set<String> existing = new HashSet<>();
        if (existingNames != null) {
            for (String name : existingNames) {
                String normalized = normalize(name);
                if (normalized != null) existing.add(normalized);
            }
        }

        if (!existing.contains(base)) return base;
        for (int i = 1; i < MAX_SUFFIX; i++) {
            String candidate = base + "_" + i;
            if (!existing.contains(candidate)) return candidate;
        }
        return base + "_" + System.currentTimeMillis();
    }
}
