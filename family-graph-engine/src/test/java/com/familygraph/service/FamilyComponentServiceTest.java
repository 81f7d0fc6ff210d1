package com.familygraph.service;

import com.familygraph.model.CollectionConnection;
import com.familygraph.model.FamilyComponent;
import com.familygraph.model.FamilyGraph;
import com.familygraph.model.PersonNode;
import com.familygraph.model.RawRecord;
import com.familygraph.model.UserCollection;
import com.familygraph.testutil.TestEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.familygraph.testutil.Records.person;
import static org.assertj.core.api.Assertions.assertThat;

class FamilyComponentServiceTest {

    private final TestEngine engine = TestEngine.create();
    private final FamilyComponentService service = engine.components;

    private FamilyGraph graphOf(RawRecord... records) {
        return engine.builder.build(List.of(records));
    }

    @Nested
    @DisplayName("findComponents")
    class FindComponents {

        @Test
        void separatesDisjointFamiliesLargestFirst() {
            FamilyGraph graph = graphOf(
                person("Z", "Zoe"),
                person("X", "Xavier", "spouse_id", "Y"),
                person("Y", "Yvonne"),
                person("GF", "George"),
                person("F", "Frank", "father_id", "GF"),
                person("A", "Alice", "father_id", "F"));

            List<FamilyComponent> components = service.findComponents(graph);

            assertThat(components).extracting(FamilyComponent::size).containsExactly(3, 2, 1);
            assertThat(components).extracting(FamilyComponent::index).containsExactly(0, 1, 2);
            assertThat(components.get(0).people()).extracting(PersonNode::id)
                .containsExactlyInAnyOrder("GF", "F", "A");
        }

        @Test
        void spouseDeclaredOnOneSideStillJoins() {
            FamilyGraph graph = graphOf(
                person("Y", "Yvonne"),
                person("X", "Xavier", "spouse_id", "Y"));

            assertThat(service.findComponents(graph)).hasSize(1);
        }

        @Test
        void stepLinksDoNotJoinComponents() {
            FamilyGraph graph = graphOf(
                person("S", "Sam"),
                person("A", "Alice", "stepfather_id", "S"));

            assertThat(service.findComponents(graph)).hasSize(2);
        }

        @Test
        void equallyFrequentLabelsResolveAlphabetically() {
            FamilyGraph graph = graphOf(
                person("A", "Alice", "group_name", "Smith"),
                person("B", "Bob", "group_name", "Jones", "spouse_id", "A"),
                person("C", "Carol", "group_name", "Smith", "father_id", "B"),
                person("D", "Dan", "group_name", "Jones", "father_id", "B"));

            assertThat(service.findComponents(graph).get(0).name()).isEqualTo("Jones");
        }

        @Test
        void mostFrequentLabelWins() {
            FamilyGraph graph = graphOf(
                person("A", "Alice", "group_name", "Smith"),
                person("B", "Bob", "group_name", "Jones", "spouse_id", "A"),
                person("C", "Carol", "group_name", "Smith", "father_id", "B"));

            FamilyComponent component = service.findComponents(graph).get(0);
            assertThat(component.name()).isEqualTo("Smith");
            assertThat(component.isNamed()).isTrue();
        }

        @Test
        void componentWithoutLabelsIsUnnamed() {
            FamilyComponent component = service.findComponents(graphOf(person("A", "Alice"))).get(0);

            assertThat(component.name()).isEqualTo(FamilyComponent.UNNAMED);
            assertThat(component.isNamed()).isFalse();
        }

        @Test
        void representativeIsEarliestBorn() {
            FamilyGraph graph = graphOf(
                person("A", "Alice", "born", "1880-05-01"),
                person("B", "Bob", "spouse_id", "A"),
                person("C", "Carol", "born", "abt 1879", "father_id", "B"));

            assertThat(service.findComponents(graph).get(0).representative().id()).isEqualTo("C");
        }

        @Test
        void sameYearFallsBackToNameWhateverTheDateWording() {
            FamilyGraph graph = graphOf(
                person("Z", "Zed", "born", "1850"),
                person("A", "Abe", "born", "abt 1850", "spouse_id", "Z"));

            assertThat(service.findComponents(graph).get(0).representative().id()).isEqualTo("A");
        }

        @Test
        void undatedMembersFallBackToName() {
            FamilyGraph graph = graphOf(
                person("B", "Bob"),
                person("A", "Alice", "spouse_id", "B"));

            assertThat(service.findComponents(graph).get(0).representative().id()).isEqualTo("A");
        }
    }

    @Test
    void userCollectionsSortBySizeThenName() {
        FamilyGraph graph = graphOf(
            person("A", "Alice", "collection", "Yorkshire"),
            person("B", "Bob", "collection", "Lancashire"),
            person("C", "Carol", "collection", "Yorkshire"),
            person("D", "Dan", "collection", "Durham"),
            person("E", "Eve"));

        List<UserCollection> collections = service.userCollections(graph);

        assertThat(collections).extracting(UserCollection::name).containsExactly("Yorkshire", "Durham", "Lancashire");
        assertThat(collections.get(0).size()).isEqualTo(2);
    }

    @Test
    void crossCollectionConnectionsCountBothEnds() {
        FamilyGraph graph = graphOf(
            person("F", "Frank", "collection", "Smith", "spouse_id", "M"),
            person("M", "Martha", "collection", "Brown"),
            person("A", "Alice", "collection", "Smith", "father_id", "F", "mother_id", "M"),
            person("X", "Xena", "collection", "Jones", "father_id", "A"),
            person("N", "Nobody", "father_id", "A"));

        List<CollectionConnection> connections = service.crossCollectionConnections(graph);

        assertThat(connections).hasSize(2);
        CollectionConnection first = connections.get(0);
        assertThat(first.fromCollection()).isEqualTo("Brown");
        assertThat(first.toCollection()).isEqualTo("Smith");
        assertThat(first.relationshipCount()).isEqualTo(3);
        assertThat(first.bridgePeople()).extracting(PersonNode::id).containsExactlyInAnyOrder("F", "M", "A");

        CollectionConnection second = connections.get(1);
        assertThat(second.fromCollection()).isEqualTo("Jones");
        assertThat(second.toCollection()).isEqualTo("Smith");
        assertThat(second.relationshipCount()).isEqualTo(2);
    }
}
