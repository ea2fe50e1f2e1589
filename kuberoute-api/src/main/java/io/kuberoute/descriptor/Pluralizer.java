/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.descriptor;

import javax.annotation.concurrent.ThreadSafe;

/**
 * Derives the collection name of a resource from its singular, lower-cased kind.
 * <br/>
 * Implementations must be deterministic and free of side effects, as the result is cached
 * by every {@link ResourceDescriptor} built with them.
 */
@ThreadSafe
public interface Pluralizer {

    /**
     * The pluralizer used when none is supplied.
     *
     * @return English pluralizer.
     */
    static Pluralizer english() {
        return EnglishPluralizer.INSTANCE;
    }

    /**
     * Returns the plural form of a lower-case word. Words that are already plural are
     * returned unchanged.
     *
     * @param word lower-case singular word
     * @return plural form
     */
    String toPlural(String word);

    /**
     * Returns true if the lower-case word already appears to be plural.
     * This is a heuristic; it is used to reject kinds like {@code Foos}.
     *
     * @param word lower-case word
     * @return true if the word looks plural
     */
    default boolean isPlural(String word) {
        return toPlural(word).equals(word);
    }
}
