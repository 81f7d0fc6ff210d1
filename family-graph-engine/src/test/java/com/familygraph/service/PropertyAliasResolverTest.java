package com.familygraph.service;

import com.familygraph.config.GraphEngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PropertyAliasResolverTest {

    private PropertyAliasResolver resolver;

    @BeforeEach
    void setUp() {
        GraphEngineProperties properties = new GraphEngineProperties();
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("birthdate", "born");
        aliases.put("dob", "born");
        aliases.put("dad", "father");
        properties.setPropertyAliases(aliases);
        resolver = new PropertyAliasResolver(properties);
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        void canonicalPropertyWinsOverAlias() {
            Map<String, Object> record = Map.of("born", "1850", "birthdate", "1851");

            assertThat(resolver.resolve(record, "born")).contains("1850");
        }

        @Test
        void fallsBackToAlias() {
            assertThat(resolver.resolve(Map.of("birthdate", "1851"), "born")).contains("1851");
        }

        @Test
        void firstConfiguredAliasWins() {
            Map<String, Object> record = Map.of("dob", "1852", "birthdate", "1851");

            assertThat(resolver.resolve(record, "born")).contains("1851");
        }

        @Test
        void emptyWhenNeitherPresent() {
            assertThat(resolver.resolve(Map.of("died", "1900"), "born")).isEmpty();
        }

        @Test
        void aliasOfAnotherCanonicalIsIgnored() {
            assertThat(resolver.resolve(Map.of("dad", "[[John]]"), "mother")).isEmpty();
        }
    }

    @Nested
    @DisplayName("resolveString")
    class ResolveString {

        @Test
        void skipsBlankValuesAndTriesNextName() {
            Map<String, Object> record = Map.of("sex", " ", "gender", "female");

            assertThat(resolver.resolveString(record, "sex", "gender")).contains("female");
        }

        @Test
        void takesFirstElementOfList() {
            Map<String, Object> record = Map.of("born", List.of("1850", "1851"));

            assertThat(resolver.resolveString(record, "born")).contains("1850");
        }

        @Test
        void convertsNumbers() {
            assertThat(resolver.resolveString(Map.of("dob", 1850), "born")).contains("1850");
        }
    }
}
