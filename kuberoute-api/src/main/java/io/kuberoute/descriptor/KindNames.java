/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.descriptor;

import java.util.Locale;
import java.util.regex.Pattern;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Checks on the shape of a resource kind.
 */
public final class KindNames {

    private static final Pattern PASCAL_CASE = Pattern.compile("^[A-Z][a-zA-Z0-9]*$");

    private KindNames() {
    }

    /**
     * Returns true if the kind starts with an upper-case letter and contains only letters and digits.
     * Acronyms such as {@code CSIDriver} are accepted.
     *
     * @param kind kind to test
     * @return true if PascalCase
     */
    public static boolean isPascalCase(@Nullable String kind) {
        return kind != null && PASCAL_CASE.matcher(kind).matches();
    }

    /**
     * Validates a kind: it must be non-empty, PascalCase, and not already plural.
     *
     * @param kind the kind
     * @param pluralizer the pluralizer used to detect plural forms
     * @return the kind
     * @throws IllegalArgumentException if the kind is malformed
     */
    public static String requireValidKind(@Nullable String kind, Pluralizer pluralizer) {
        if (kind == null || kind.isEmpty()) {
            throw new IllegalArgumentException("A resource kind must not be empty");
        }
        if (!isPascalCase(kind)) {
            throw new IllegalArgumentException("Resource kind '" + kind + "' is not PascalCase");
        }
        if (pluralizer.isPlural(kind.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Resource kind '" + kind + "' appears to be plural, supply the singular form");
        }
        return kind;
    }
}
