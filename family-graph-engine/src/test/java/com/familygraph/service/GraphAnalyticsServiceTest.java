package com.familygraph.service;

import com.familygraph.config.GraphEngineProperties;
import com.familygraph.model.AnalyticsReport;
import com.familygraph.model.FamilyGraph;
import com.familygraph.model.RawRecord;
import com.familygraph.testutil.TestEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.familygraph.testutil.Records.person;
import static org.assertj.core.api.Assertions.assertThat;

class GraphAnalyticsServiceTest {

    private final TestEngine engine = TestEngine.create();

    private static List<RawRecord> family() {
        return List.of(
            person("GF", "George", "sex", "M", "born", "abt 1820", "living", "no"),
            person("F", "Frank", "sex", "M", "born", "1850", "died", "1900", "father_id", "GF",
                "spouse1_id", "M", "spouse1_marriage_date", "1875"),
            person("M", "Martha", "sex", "F", "born", "1855"),
            person("A", "Alice", "sex", "U", "born", "1880-02-01", "father_id", "F", "mother_id", "M"),
            person("O", "Orphan Annie"),
            person("S", "Step Sam", "stepfather_id", "GF"));
    }

    @Nested
    @DisplayName("completeness and relationships")
    class Counts {

        private final AnalyticsReport report = engine.analytics.analytics(engine.builder.build(family()));

        @Test
        void countsCompleteness() {
            assertThat(report.totalPeople()).isEqualTo(6);
            assertThat(report.peopleWithBirthDate()).isEqualTo(4);
            assertThat(report.birthDatePercent()).isEqualTo(67);
            assertThat(report.peopleWithDeathDate()).isEqualTo(1);
            assertThat(report.deathDatePercent()).isEqualTo(17);
            assertThat(report.peopleWithSex()).isEqualTo(3);
            assertThat(report.sexPercent()).isEqualTo(50);
        }

        @Test
        void countsRelationships() {
            assertThat(report.peopleWithParents()).isEqualTo(2);
            assertThat(report.peopleWithSpouses()).isEqualTo(1);
            assertThat(report.peopleWithChildren()).isEqualTo(3);
        }

        @Test
        void personWithNoEdgesIsOrphaned() {
            assertThat(report.orphanedPeople()).isEqualTo(1);
        }

        @Test
        void livingHonoursOverride() {
            assertThat(report.livingPeople()).isEqualTo(2);
        }

        @Test
        void yearRangeIncludesAllDateFields() {
            assertThat(report.earliestYear()).isEqualTo(1820);
            assertThat(report.latestYear()).isEqualTo(1900);
            assertThat(report.dateSpanYears()).isEqualTo(80);
        }

        @Test
        void collectionSizesCoverComponents() {
            assertThat(report.totalComponents()).isEqualTo(3);
            assertThat(report.totalUserCollections()).isZero();
            assertThat(report.averageCollectionSize()).isEqualTo(2.0);
            assertThat(report.largestCollection().size()).isEqualTo(4);
            assertThat(report.smallestCollection().size()).isEqualTo(1);
            assertThat(report.topConnections()).isEmpty();
        }
    }

    @Test
    void emptyGraphHasNoYearsOrSizes() {
        AnalyticsReport report = engine.analytics.analytics(FamilyGraph.empty());

        assertThat(report.totalPeople()).isZero();
        assertThat(report.birthDatePercent()).isZero();
        assertThat(report.earliestYear()).isNull();
        assertThat(report.dateSpanYears()).isNull();
        assertThat(report.largestCollection()).isNull();
        assertThat(report.averageCollectionSize()).isZero();
    }

    @Test
    void topConnectionsAreLimited() {
        GraphEngineProperties properties = new GraphEngineProperties();
        properties.getAnalytics().setTopConnections(1);
        TestEngine limited = TestEngine.create(properties);

        FamilyGraph graph = limited.builder.build(List.of(
            person("F", "Frank", "collection", "Smith", "spouse_id", "M"),
            person("M", "Martha", "collection", "Brown"),
            person("X", "Xena", "collection", "Jones", "father_id", "F")));

        AnalyticsReport report = limited.analytics.analytics(graph);

        assertThat(report.topConnections()).hasSize(1);
        assertThat(report.topConnections().get(0).relationshipCount()).isEqualTo(2);
        assertThat(report.totalUserCollections()).isEqualTo(3);
    }
}
