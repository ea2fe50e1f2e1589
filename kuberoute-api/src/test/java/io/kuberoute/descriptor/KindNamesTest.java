/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.descriptor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KindNamesTest {

    @ParameterizedTest
    @ValueSource(strings = { "Foo", "FooBar", "ConfigMap", "CSIDriver", "V1Thing" })
    void acceptsPascalCase(String kind) {
        assertThat(KindNames.isPascalCase(kind)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = { "foo", "fooBar", "Foo_Bar", "Foo-Bar", "Foo Bar", "1Foo", "" })
    void rejectsOtherCases(String kind) {
        assertThat(KindNames.isPascalCase(kind)).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    void emptyKindIsInvalid(String kind) {
        var pluralizer = Pluralizer.english();
        assertThatThrownBy(() -> KindNames.requireValidKind(kind, pluralizer))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("A resource kind must not be empty");
    }

    @Test
    void pluralKindIsInvalid() {
        var pluralizer = Pluralizer.english();
        assertThatThrownBy(() -> KindNames.requireValidKind("Foos", pluralizer))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Resource kind 'Foos' appears to be plural, supply the singular form");
    }

    @Test
    void snakeCaseKindIsInvalid() {
        var pluralizer = Pluralizer.english();
        assertThatThrownBy(() -> KindNames.requireValidKind("foo_bar", pluralizer))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Resource kind 'foo_bar' is not PascalCase");
    }

    @Test
    void uncountableKindIsValid() {
        assertThat(KindNames.requireValidKind("Sheep", Pluralizer.english())).isEqualTo("Sheep");
    }

    @Test
    void pluralCheckUsesSuppliedPluralizer() {
        Pluralizer neverPlural = new Pluralizer() {
            @Override
            public String toPlural(String word) {
                return word + "s";
            }

            @Override
            public boolean isPlural(String word) {
                return false;
            }
        };
        assertThat(KindNames.requireValidKind("Foos", neverPlural)).isEqualTo("Foos");
    }
}
