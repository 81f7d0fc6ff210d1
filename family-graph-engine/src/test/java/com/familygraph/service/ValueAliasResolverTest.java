package com.familygraph.service;

import com.familygraph.config.GraphEngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ValueAliasResolverTest {

    private ValueAliasResolver resolver;

    @BeforeEach
    void setUp() {
        GraphEngineProperties properties = new GraphEngineProperties();
        Map<ValueAliasField, Map<String, String>> aliases = new EnumMap<>(ValueAliasField.class);
        aliases.put(ValueAliasField.SEX, Map.of("Bloke", "M", "male", "F"));
        aliases.put(ValueAliasField.NOTE_TYPE, Map.of("ancestor", "person"));
        properties.setValueAliases(aliases);
        resolver = new ValueAliasResolver(properties);
    }

    @Test
    void canonicalValueMatchesIgnoringCase() {
        assertThat(resolver.resolve(ValueAliasField.SEX, "m")).isEqualTo("M");
        assertThat(resolver.resolve(ValueAliasField.MARRIAGE_STATUS, "Divorced")).isEqualTo("divorced");
    }

    @Test
    void userSynonymMatchesIgnoringCase() {
        assertThat(resolver.resolve(ValueAliasField.SEX, "bloke")).isEqualTo("M");
        assertThat(resolver.resolve(ValueAliasField.NOTE_TYPE, "Ancestor")).isEqualTo("person");
    }

    @Test
    void userSynonymOverridesBuiltIn() {
        assertThat(resolver.resolve(ValueAliasField.SEX, "Male")).isEqualTo("F");
    }

    @Test
    void builtInSynonymUsedWhenNoUserSynonym() {
        assertThat(resolver.resolve(ValueAliasField.SEX, "female")).isEqualTo("F");
        assertThat(resolver.resolve(ValueAliasField.MARRIAGE_STATUS, "widower")).isEqualTo("widowed");
    }

    @Test
    void unknownValuePassesThroughUnchanged() {
        assertThat(resolver.resolve(ValueAliasField.SEX, "Sometimes")).isEqualTo("Sometimes");
    }

    @Test
    void blankAndNullPassThrough() {
        assertThat(resolver.resolve(ValueAliasField.SEX, null)).isNull();
        assertThat(resolver.resolve(ValueAliasField.SEX, "  ")).isEqualTo("  ");
    }

    @Test
    void isCanonical() {
        assertThat(resolver.isCanonical(ValueAliasField.NOTE_TYPE, "Place")).isTrue();
        assertThat(resolver.isCanonical(ValueAliasField.NOTE_TYPE, "ancestor")).isFalse();
    }
}
