package com.familygraph.service;

import com.familygraph.config.GraphEngineProperties;
import com.familygraph.model.AnalyticsReport;
import com.familygraph.model.CollectionConnection;
import com.familygraph.model.FamilyComponent;
import com.familygraph.model.FamilyGraph;
import com.familygraph.model.FamilyTree;
import com.familygraph.model.PersonNode;
import com.familygraph.model.RawRecord;
import com.familygraph.model.TreeOptions;
import com.familygraph.model.UserCollection;
import com.familygraph.repository.RecordStore;
import com.familygraph.repository.RecordStoreException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Query surface of the engine. Holds the current snapshot and delegates
 * traversal and analysis to the specialised services.
 *
 * A rebuild reads every record from the store, builds a new snapshot and
 * swaps it in. Readers take the reference once and keep working on that
 * snapshot; it is never mutated.
 */
@Service
public class FamilyGraphService {

    private static final Logger log = LoggerFactory.getLogger(FamilyGraphService.class);

    private final RecordStore recordStore;
    private final FamilyGraphBuilder graphBuilder;
    private final TreeTraversalService traversalService;
    private final FamilyComponentService componentService;
    private final GraphAnalyticsService analyticsService;
    private final GraphEngineProperties properties;

    private volatile FamilyGraph currentGraph = FamilyGraph.empty();

    public FamilyGraphService(RecordStore recordStore,
                              FamilyGraphBuilder graphBuilder,
                              TreeTraversalService traversalService,
                              FamilyComponentService componentService,
                              GraphAnalyticsService analyticsService,
                              GraphEngineProperties properties) {
        this.recordStore = recordStore;
        this.graphBuilder = graphBuilder;
        this.traversalService = traversalService;
        this.componentService = componentService;
        this.analyticsService = analyticsService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (properties.isLoadOnStartup()) {
            refreshGraph();
        }
    }

    // ========== SNAPSHOT ==========

    /**
     * Rebuild from the record store and install the result. When the store
     * cannot be read the previous snapshot stays current.
     *
     * @return the snapshot current after the call
     */
    public synchronized FamilyGraph refreshGraph() {
        log.info("Refreshing family graph...");
        List<RawRecord> records;
        try {
            records = recordStore.findAll();
        } catch (RecordStoreException e) {
            log.warn("Failed to read records for graph build, keeping previous snapshot: {}", e.getMessage());
            return currentGraph;
        }

        FamilyGraph graph = graphBuilder.build(records);
        currentGraph = graph;
        return graph;
    }

    /** Build a standalone snapshot without installing it. */
    public FamilyGraph buildGraph(Collection<RawRecord> records) {
        return graphBuilder.build(records);
    }

    public FamilyGraph getCurrentGraph() {
        return currentGraph;
    }

    // ========== QUERIES ==========

    public Optional<PersonNode> getNode(FamilyGraph graph, String id) {
        return graph.findById(id);
    }

    public Optional<FamilyTree> traverse(FamilyGraph graph, String rootId, TreeOptions options) {
        return traversalService.traverse(graph, rootId, options);
    }

    public Optional<List<PersonNode>> ancestorsOf(FamilyGraph graph, String id, boolean includeRoot) {
        return traversalService.ancestorsOf(graph, id, includeRoot);
    }

    public Optional<List<PersonNode>> descendantsOf(FamilyGraph graph, String id,
                                                    boolean includeRoot, boolean includeSpouses) {
        return traversalService.descendantsOf(graph, id, includeRoot, includeSpouses);
    }

    public List<FamilyComponent> findComponents(FamilyGraph graph) {
        return componentService.findComponents(graph);
    }

    public List<UserCollection> userCollections(FamilyGraph graph) {
        return componentService.userCollections(graph);
    }

    public List<CollectionConnection> crossCollectionConnections(FamilyGraph graph) {
        return componentService.crossCollectionConnections(graph);
    }

    public AnalyticsReport analytics(FamilyGraph graph) {
        return analyticsService.analytics(graph);
    }
}
