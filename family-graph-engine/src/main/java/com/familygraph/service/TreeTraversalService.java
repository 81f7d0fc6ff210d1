package com.familygraph.service;

import com.familygraph.model.DefaultRelationshipTypes;
import com.familygraph.model.EdgeType;
import com.familygraph.model.FamilyEdge;
import com.familygraph.model.FamilyGraph;
import com.familygraph.model.FamilyTree;
import com.familygraph.model.PersonNode;
import com.familygraph.model.Sex;
import com.familygraph.model.SpouseRelation;
import com.familygraph.model.TreeOptions;
import com.familygraph.model.TreeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ancestor, descendant and full-network traversal over a graph snapshot.
 * Every walk keeps its own visited state, so malformed data with parent cycles
 * terminates. Step, adoptive and guardian links are emitted as RELATIONSHIP
 * edges whose label names the role of the {@code from} person; they are never
 * followed further up or down.
 */
@Service
public class TreeTraversalService {

    private static final Logger log = LoggerFactory.getLogger(TreeTraversalService.class);

    private final RelationshipTypeRegistry relationshipTypes;

    public TreeTraversalService(RelationshipTypeRegistry relationshipTypes) {
        this.relationshipTypes = relationshipTypes;
    }

    /**
     * Traverse from a root person.
     *
     * @return the tree, or empty when the root is not in the graph
     */
    public Optional<FamilyTree> traverse(FamilyGraph graph, String rootId, TreeOptions options) {
        Optional<PersonNode> root = graph.findById(rootId);
        if (root.isEmpty()) {
            log.debug("Traversal root {} not found in graph of {} people", rootId, graph.size());
            return Optional.empty();
        }

        Walk walk = new Walk(graph, options);
        switch (options.treeType()) {
            case ANCESTORS -> walk.ancestors(root.get(), 0, new HashSet<>());
            case DESCENDANTS -> walk.descendants(root.get(), 0, new HashSet<>());
            case FULL -> walk.full(root.get());
        }

        log.debug("Built {} tree for {}: {} people, {} edges",
            options.treeType(), rootId, walk.nodes.size(), walk.edges.size());
        return Optional.of(new FamilyTree(root.get(), walk.nodes, new ArrayList<>(walk.edges)));
    }

    /**
     * Every ancestor through biological and gender-neutral parent links, in walk
     * order: each parent is followed by that parent's whole line before the next.
     *
     * @return empty when the person is not in the graph
     */
    public Optional<List<PersonNode>> ancestorsOf(FamilyGraph graph, String personId, boolean includeRoot) {
        return traverse(graph, personId, TreeOptions.of(TreeType.ANCESTORS))
            .map(tree -> peopleOf(tree, includeRoot));
    }

    /**
     * Every descendant through child links, optionally with each descendant's spouses.
     *
     * @return empty when the person is not in the graph
     */
    public Optional<List<PersonNode>> descendantsOf(FamilyGraph graph, String personId,
                                                    boolean includeRoot, boolean includeSpouses) {
        return traverse(graph, personId, TreeOptions.of(TreeType.DESCENDANTS).withSpouses(includeSpouses))
            .map(tree -> peopleOf(tree, includeRoot));
    }

    private static List<PersonNode> peopleOf(FamilyTree tree, boolean includeRoot) {
        List<PersonNode> people = new ArrayList<>(tree.nodes().values());
        if (!includeRoot) {
            people.removeIf(p -> p.id().equals(tree.root().id()));
        }
        return people;
    }

    // ========== LABELS ==========

    private static String stepLabel(PersonNode parent) {
        return parent.sex() == Sex.M ? "Step-father" : parent.sex() == Sex.F ? "Step-mother" : "Step-parent";
    }

    private static String adoptiveLabel(PersonNode parent) {
        return parent.sex() == Sex.M ? "Adoptive father" : parent.sex() == Sex.F ? "Adoptive mother" : "Adoptive parent";
    }

    /**
     * State of one traversal call. Not shared between calls.
     */
    private final class Walk {

        private final FamilyGraph graph;
        private final TreeOptions options;
        private final Map<String, PersonNode> nodes = new LinkedHashMap<>();
        private final Set<FamilyEdge> edges = new LinkedHashSet<>();
        // Shallowest generation at which each person was expanded
        private final Map<String, Integer> expandedAt = new HashMap<>();
        // parent|child pairs already joined, so a pair gets one edge whichever side declared it
        private final Set<String> lineagePairs = new HashSet<>();
        // Unordered couples already joined by a spouse edge
        private final Set<String> spousePairs = new HashSet<>();

        Walk(FamilyGraph graph, TreeOptions options) {
            this.graph = graph;
            this.options = options;
        }

        // ========== ANCESTORS ==========

        void ancestors(PersonNode person, int generation, Set<String> path) {
            nodes.put(person.id(), person);
            if (!shouldExpand(person, generation)) {
                return;
            }
            path.add(person.id());

            for (String parentId : person.biologicalParentIds()) {
                Optional<PersonNode> parent = admitted(parentId);
                if (parent.isEmpty()) {
                    continue;
                }
                if (path.contains(parentId)) {
                    log.warn("Cycle in parent links: {} is its own ancestor via {}", parentId, person.id());
                    continue;
                }
                addLineageEdge(parent.get(), person, EdgeType.PARENT);
                ancestors(parent.get(), generation + 1, path);
            }

            if (options.includeSpouses()) {
                addParentCoupleEdge(person);
            }
            addNonBloodParents(person, false);

            path.remove(person.id());
        }

        // ========== DESCENDANTS ==========

        void descendants(PersonNode person, int generation, Set<String> path) {
            nodes.put(person.id(), person);
            if (!shouldExpand(person, generation)) {
                return;
            }
            path.add(person.id());

            if (options.includeSpouses()) {
                for (SpouseRelation relation : person.spouses()) {
                    admitted(relation.personId()).ifPresent(spouse -> {
                        nodes.put(spouse.id(), spouse);
                        addSpouseEdge(person, spouse);
                    });
                }
            }

            for (String childId : person.childIds()) {
                Optional<PersonNode> child = admitted(childId);
                if (child.isEmpty()) {
                    continue;
                }
                if (path.contains(childId)) {
                    log.warn("Cycle in child links: {} is its own descendant via {}", childId, person.id());
                    continue;
                }
                addLineageEdge(person, child.get(), EdgeType.CHILD);
                descendants(child.get(), generation + 1, path);
            }

            if (options.includeAdoptiveParents()) {
                for (String adoptedId : person.adoptedChildIds()) {
                    admitted(adoptedId).ifPresent(adopted -> {
                        nodes.put(adopted.id(), adopted);
                        edges.add(adoptionEdge(person, adopted));
                    });
                }
            }

            path.remove(person.id());
        }

        // ========== FULL NETWORK ==========

        void full(PersonNode root) {
            Deque<PersonNode> queue = new ArrayDeque<>();
            Map<String, Integer> depth = new HashMap<>();
            queue.add(root);
            depth.put(root.id(), 0);

            while (!queue.isEmpty()) {
                PersonNode person = queue.poll();
                nodes.put(person.id(), person);
                int d = depth.get(person.id());
                if (!options.isUnbounded() && d >= options.maxGenerations()) {
                    continue;
                }

                List<PersonNode> related = new ArrayList<>();

                for (String parentId : person.biologicalParentIds()) {
                    admitted(parentId).ifPresent(parent -> {
                        addLineageEdge(parent, person, EdgeType.PARENT);
                        related.add(parent);
                    });
                }
                if (options.includeSpouses()) {
                    addParentCoupleEdge(person);
                    for (SpouseRelation relation : person.spouses()) {
                        admitted(relation.personId()).ifPresent(spouse -> {
                            addSpouseEdge(person, spouse);
                            related.add(spouse);
                        });
                    }
                }
                for (String childId : person.childIds()) {
                    admitted(childId).ifPresent(child -> {
                        addLineageEdge(person, child, EdgeType.CHILD);
                        related.add(child);
                    });
                }
                related.addAll(addNonBloodParents(person, true));

                for (PersonNode next : related) {
                    if (!depth.containsKey(next.id())) {
                        depth.put(next.id(), d + 1);
                        queue.add(next);
                    }
                }
            }
        }

        // ========== EDGES ==========

        /**
         * Step, adoptive and guardian links of one person, as enabled by the options.
         * In full mode adopted children are included too.
         *
         * @return the people linked
         */
        private List<PersonNode> addNonBloodParents(PersonNode person, boolean withAdoptedChildren) {
            List<PersonNode> linked = new ArrayList<>();
            if (options.includeStepParents()) {
                for (String stepId : person.allStepParentIds()) {
                    admitted(stepId).ifPresent(step -> {
                        edges.add(FamilyEdge.relationship(step.id(), person.id(),
                            DefaultRelationshipTypes.STEP_PARENT_TYPE, stepLabel(step)));
                        linked.add(step);
                    });
                }
            }
            if (options.includeAdoptiveParents()) {
                for (String adoptiveId : person.adoptiveParentIdsAll()) {
                    admitted(adoptiveId).ifPresent(adoptive -> {
                        edges.add(adoptionEdge(adoptive, person));
                        linked.add(adoptive);
                    });
                }
                if (withAdoptedChildren) {
                    for (String adoptedId : person.adoptedChildIds()) {
                        admitted(adoptedId).ifPresent(adopted -> {
                            edges.add(adoptionEdge(person, adopted));
                            linked.add(adopted);
                        });
                    }
                }
            }
            if (options.includeGuardians()) {
                for (String fosterId : person.fosterParentIds()) {
                    admitted(fosterId).ifPresent(foster -> {
                        edges.add(FamilyEdge.relationship(foster.id(), person.id(),
                            DefaultRelationshipTypes.FOSTER_PARENT_TYPE,
                            relationshipTypes.labelFor(DefaultRelationshipTypes.FOSTER_PARENT_TYPE)));
                        linked.add(foster);
                    });
                }
                for (String guardianId : person.guardianIds()) {
                    admitted(guardianId).ifPresent(guardian -> {
                        edges.add(FamilyEdge.relationship(guardian.id(), person.id(),
                            DefaultRelationshipTypes.GUARDIAN_TYPE,
                            relationshipTypes.labelFor(DefaultRelationshipTypes.GUARDIAN_TYPE)));
                        linked.add(guardian);
                    });
                }
            }
            // Non-blood relatives appear in the tree but are not expanded from here
            if (options.treeType() != TreeType.FULL) {
                linked.forEach(p -> nodes.put(p.id(), p));
            }
            return linked;
        }

        private FamilyEdge adoptionEdge(PersonNode parent, PersonNode child) {
            return FamilyEdge.relationship(parent.id(), child.id(),
                DefaultRelationshipTypes.ADOPTIVE_PARENT_TYPE, adoptiveLabel(parent));
        }

        /**
         * One edge per parent/child pair. Ancestor and full walks emit PARENT edges,
         * descendant walks CHILD edges; both point from parent to child. A custom
         * relationship type that supplied the link is carried on the edge.
         */
        private void addLineageEdge(PersonNode parent, PersonNode child, EdgeType type) {
            if (!lineagePairs.add(parent.id() + "|" + child.id())) {
                return;
            }
            String customType = child.overrideFor(parent.id());
            if (customType != null) {
                edges.add(new FamilyEdge(parent.id(), child.id(), type, customType, relationshipTypes.labelFor(customType)));
            } else {
                edges.add(FamilyEdge.of(parent.id(), child.id(), type));
            }
        }

        private void addSpouseEdge(PersonNode person, PersonNode spouse) {
            if (!spousePairs.add(coupleKey(person.id(), spouse.id()))) {
                return;
            }
            String customType = person.overrideFor(spouse.id());
            if (customType == null) {
                customType = spouse.overrideFor(person.id());
            }
            if (customType != null) {
                edges.add(new FamilyEdge(person.id(), spouse.id(), EdgeType.SPOUSE, customType,
                    relationshipTypes.labelFor(customType)));
            } else {
                edges.add(FamilyEdge.of(person.id(), spouse.id(), EdgeType.SPOUSE));
            }
        }

        // One spouse edge between a person's father and mother when both are in the tree
        private void addParentCoupleEdge(PersonNode person) {
            if (person.fatherId() == null || person.motherId() == null) {
                return;
            }
            if (!nodes.containsKey(person.fatherId()) && options.treeType() != TreeType.FULL) {
                return;
            }
            Optional<PersonNode> father = admitted(person.fatherId());
            Optional<PersonNode> mother = admitted(person.motherId());
            if (father.isPresent() && mother.isPresent()) {
                addSpouseEdge(father.get(), mother.get());
            }
        }

        private static String coupleKey(String a, String b) {
            return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
        }

        // ========== HELPERS ==========

        /** Present in this snapshot and passing the membership and place filters. */
        private Optional<PersonNode> admitted(String id) {
            return graph.findById(id).filter(options::admits);
        }

        /**
         * False when the generation cap is reached, or the person was already
         * expanded at this generation or a shallower one.
         */
        private boolean shouldExpand(PersonNode person, int generation) {
            if (!options.isUnbounded() && generation >= options.maxGenerations()) {
                return false;
            }
            Integer previous = expandedAt.get(person.id());
            if (previous != null && previous <= generation) {
                return false;
            }
            expandedAt.put(person.id(), generation);
            return true;
        }
    }
}
