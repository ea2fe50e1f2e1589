/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.descriptor;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.concurrent.ThreadSafe;

/**
 * Pluralizes regular English nouns, the common irregular ones, and leaves uncountable
 * nouns as they are.
 */
@ThreadSafe
public final class EnglishPluralizer implements Pluralizer {

    static final EnglishPluralizer INSTANCE = new EnglishPluralizer();

    private static final Set<String> UNCOUNTABLE = Set.of(
            "deer",
            "endpoints",
            "equipment",
            "fish",
            "information",
            "money",
            "news",
            "rice",
            "series",
            "sheep",
            "species");

    private static final Map<String, String> IRREGULAR = Map.of(
            "child", "children",
            "foot", "feet",
            "goose", "geese",
            "man", "men",
            "mouse", "mice",
            "ox", "oxen",
            "person", "people",
            "tooth", "teeth",
            "woman", "women");

    private static final Set<String> IRREGULAR_PLURALS = Set.copyOf(IRREGULAR.values());

    // first match wins
    private static final List<Rule> RULES = List.of(
            new Rule("(quiz)$", "$1zes"),
            new Rule("([^aeiouy]|qu)y$", "$1ies"),
            new Rule("(x|ch|ss|sh|z)$", "$1es"),
            new Rule("([lr])f$", "$1ves"),
            new Rule("(kni|wi|li)fe$", "$1ves"),
            new Rule("sis$", "ses"),
            new Rule("(alias|atlas|bias|canvas|gas|us)$", "$1es"),
            new Rule("s$", "s"),
            new Rule("$", "s"));

    private EnglishPluralizer() {
    }

    @Override
    public String toPlural(String word) {
        Objects.requireNonNull(word, "word");
        if (word.isEmpty() || UNCOUNTABLE.contains(word) || IRREGULAR_PLURALS.contains(word)) {
            return word;
        }
        var irregular = IRREGULAR.get(word);
        if (irregular != null) {
            return irregular;
        }
        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(word);
            if (matcher.find()) {
                return matcher.replaceFirst(rule.replacement());
            }
        }
        return word;
    }

    @Override
    public boolean isPlural(String word) {
        Objects.requireNonNull(word, "word");
        if (UNCOUNTABLE.contains(word)) {
            // singular and plural coincide, so the word is acceptable as a kind
            return false;
        }
        return IRREGULAR_PLURALS.contains(word) || Pluralizer.super.isPlural(word);
    }

    private record Rule(Pattern pattern, String replacement) {
        Rule(String regex, String replacement) {
            this(Pattern.compile(regex), replacement);
        }
    }
}
