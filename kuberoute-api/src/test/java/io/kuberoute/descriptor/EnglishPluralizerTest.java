/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.descriptor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnglishPluralizerTest {

    private final Pluralizer pluralizer = Pluralizer.english();

    @ParameterizedTest
    @CsvSource({
            "foo, foos",
            "policy, policies",
            "networkpolicy, networkpolicies",
            "box, boxes",
            "match, matches",
            "wish, wishes",
            "buzz, buzzes",
            "quiz, quizzes",
            "ingress, ingresses",
            "status, statuses",
            "alias, aliases",
            "analysis, analyses",
            "gateway, gateways",
            "key, keys",
            "shelf, shelves",
            "knife, knives",
            "wife, wives",
            "safe, safes",
            "cafe, cafes",
            "person, people",
            "child, children",
            "configmap, configmaps",
            "namespace, namespaces",
            "customresourcedefinition, customresourcedefinitions"
    })
    void pluralizesSingularWords(String singular, String expected) {
        assertThat(pluralizer.toPlural(singular)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = { "foos", "policies", "boxes", "people", "statuses" })
    void leavesPluralWordsUnchanged(String plural) {
        assertThat(pluralizer.toPlural(plural)).isEqualTo(plural);
        assertThat(pluralizer.isPlural(plural)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = { "sheep", "series", "endpoints" })
    void uncountableWordsAreTheirOwnPluralButNotReportedAsPlural(String word) {
        assertThat(pluralizer.toPlural(word)).isEqualTo(word);
        assertThat(pluralizer.isPlural(word)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = { "foo", "policy", "box", "status", "person" })
    void singularWordsAreNotPlural(String word) {
        assertThat(pluralizer.isPlural(word)).isFalse();
    }

    @Test
    void isDeterministic() {
        assertThat(pluralizer.toPlural("policy")).isEqualTo(pluralizer.toPlural("policy"));
    }

    @Test
    void emptyWordIsUnchanged() {
        assertThat(pluralizer.toPlural("")).isEmpty();
    }

    @Test
    void nullWordRejected() {
        assertThatThrownBy(() -> pluralizer.toPlural(null))
                .isInstanceOf(NullPointerException.class);
    }
}
