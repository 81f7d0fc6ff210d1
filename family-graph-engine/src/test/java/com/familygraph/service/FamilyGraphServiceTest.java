package com.familygraph.service;

import com.familygraph.model.AnalyticsReport;
import com.familygraph.model.CollectionConnection;
import com.familygraph.model.FamilyComponent;
import com.familygraph.model.FamilyGraph;
import com.familygraph.model.FamilyTree;
import com.familygraph.model.PersonNode;
import com.familygraph.model.Sex;
import com.familygraph.model.TreeOptions;
import com.familygraph.model.TreeType;
import com.familygraph.repository.RecordStore;
import com.familygraph.repository.RecordStoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static com.familygraph.testutil.Records.person;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Sql("/smith-vault.sql")
class FamilyGraphServiceTest {

    @Autowired
    private FamilyGraphService graphService;

    @SpyBean
    private RecordStore recordStore;

    @Autowired
    private JdbcTemplate jdbc;

    @Nested
    @DisplayName("refreshGraph")
    class RefreshGraph {

        @Test
        void buildsSnapshotFromStore() {
            FamilyGraph graph = graphService.refreshGraph();

            assertThat(graph.nodesById()).containsOnlyKeys("GF", "F", "M", "A", "B");
            assertThat(graphService.getCurrentGraph()).isSameAs(graph);
            assertThat(graph.stats().recordsScanned()).isEqualTo(7);
        }

        @Test
        void recordWithMalformedJsonDoesNotBlockTheRest() {
            jdbc.update("INSERT INTO vault_record (path, properties, tags) VALUES (?, ?, ?)",
                "People/Broken.md", "{\"cr_type\": \"person\", ", null);

            FamilyGraph graph = graphService.refreshGraph();

            assertThat(graph.nodesById()).containsOnlyKeys("GF", "F", "M", "A", "B");
            assertThat(graphService.getCurrentGraph()).isSameAs(graph);
        }

        @Test
        void appliesConfiguredAliases() {
            FamilyGraph graph = graphService.refreshGraph();

            PersonNode george = graphService.getNode(graph, "GF").orElseThrow();
            PersonNode frank = graphService.getNode(graph, "F").orElseThrow();
            PersonNode bill = graphService.getNode(graph, "B").orElseThrow();

            assertThat(george.birthDate()).isEqualTo("1820");
            assertThat(frank.familyLabel()).isEqualTo("Smith");
            assertThat(frank.sex()).isEqualTo(Sex.M);
            assertThat(bill.sex()).isEqualTo(Sex.M);
            assertThat(bill.fatherId()).isNull();
        }

        @Test
        void resolvesLinksAndCountsEvidence() {
            FamilyGraph graph = graphService.refreshGraph();

            PersonNode frank = graphService.getNode(graph, "F").orElseThrow();
            assertThat(frank.fatherId()).isEqualTo("GF");
            assertThat(frank.spouseIds()).containsExactly("M");
            assertThat(frank.childIds()).containsExactly("A");
            assertThat(frank.sourceCount()).isEqualTo(1);
        }

        @Test
        void storeFailureKeepsPreviousSnapshot() {
            FamilyGraph before = graphService.refreshGraph();
            doThrow(new RecordStoreException("database unavailable", new IllegalStateException("connection refused"))).when(recordStore).findAll();

            FamilyGraph after = graphService.refreshGraph();

            assertThat(after).isSameAs(before);
            assertThat(graphService.getCurrentGraph()).isSameAs(before);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        void unknownNodeIsEmpty() {
            assertThat(graphService.getNode(graphService.refreshGraph(), "NOPE")).isEmpty();
        }

        @Test
        void traversesCurrentSnapshot() {
            FamilyGraph graph = graphService.refreshGraph();

            FamilyTree tree = graphService.traverse(graph, "A", TreeOptions.of(TreeType.ANCESTORS)).orElseThrow();

            assertThat(tree.nodes()).containsOnlyKeys("A", "F", "M", "GF");
            assertThat(graphService.ancestorsOf(graph, "A", false).orElseThrow())
                .extracting(PersonNode::id).containsExactlyInAnyOrder("F", "M", "GF");
            assertThat(graphService.descendantsOf(graph, "GF", false, false).orElseThrow())
                .extracting(PersonNode::id).containsExactlyInAnyOrder("F", "A");
        }

        @Test
        void analysesComponentsAndCollections() {
            FamilyGraph graph = graphService.refreshGraph();

            List<FamilyComponent> components = graphService.findComponents(graph);
            assertThat(components).hasSize(2);
            assertThat(components.get(0).name()).isEqualTo("Smith");
            assertThat(components.get(0).representative().id()).isEqualTo("GF");

            assertThat(graphService.userCollections(graph)).hasSize(2);
            List<CollectionConnection> connections = graphService.crossCollectionConnections(graph);
            assertThat(connections).hasSize(1);
            assertThat(connections.get(0).relationshipCount()).isEqualTo(2);

            AnalyticsReport report = graphService.analytics(graph);
            assertThat(report.totalPeople()).isEqualTo(5);
            assertThat(report.orphanedPeople()).isEqualTo(1);
        }

        @Test
        void buildGraphDoesNotInstallSnapshot() {
            FamilyGraph installed = graphService.refreshGraph();

            FamilyGraph standalone = graphService.buildGraph(List.of(person("X", "Xena")));

            assertThat(standalone.nodesById()).containsOnlyKeys("X");
            assertThat(graphService.getCurrentGraph()).isSameAs(installed);
        }
    }
}
