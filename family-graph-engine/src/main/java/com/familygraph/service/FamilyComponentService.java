package com.familygraph.service;

import com.familygraph.model.CollectionConnection;
import com.familygraph.model.FamilyComponent;
import com.familygraph.model.FamilyGraph;
import com.familygraph.model.PersonNode;
import com.familygraph.model.UserCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Disjoint family detection, user collections and the relationships that
 * bridge collections.
 */
@Service
public class FamilyComponentService {

    private static final Logger log = LoggerFactory.getLogger(FamilyComponentService.class);

    private static final Comparator<PersonNode> REPRESENTATIVE_ORDER =
        Comparator.comparing(PersonNode::birthDate, PartialDates.EARLIEST_FIRST)
            .thenComparing(PersonNode::name, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(PersonNode::id);

    /**
     * Connected components over father, mother, parents, spouses and children,
     * largest first. Indexes follow that order.
     */
    public List<FamilyComponent> findComponents(FamilyGraph graph) {
        Set<String> visited = new HashSet<>();
        List<List<PersonNode>> groups = new ArrayList<>();

        for (PersonNode start : graph.people()) {
            if (visited.contains(start.id())) {
                continue;
            }
            List<PersonNode> members = new ArrayList<>();
            Deque<PersonNode> queue = new ArrayDeque<>();
            queue.add(start);
            visited.add(start.id());

            while (!queue.isEmpty()) {
                PersonNode person = queue.poll();
                members.add(person);
                for (String relatedId : directRelatives(person)) {
                    if (visited.add(relatedId)) {
                        graph.findById(relatedId).ifPresent(queue::add);
                    }
                }
            }
            groups.add(members);
        }

        groups.sort(Comparator.comparingInt((List<PersonNode> g) -> g.size()).reversed());

        List<FamilyComponent> components = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            List<PersonNode> members = groups.get(i);
            components.add(new FamilyComponent(i, nameOf(members), representativeOf(members), members));
        }
        log.debug("Found {} family components among {} people", components.size(), graph.size());
        return components;
    }

    /** People grouped by collection tag, largest first, ties by name. */
    public List<UserCollection> userCollections(FamilyGraph graph) {
        Map<String, List<PersonNode>> byName = new HashMap<>();
        for (PersonNode person : graph.people()) {
            if (hasCollection(person)) {
                byName.computeIfAbsent(person.collection(), k -> new ArrayList<>()).add(person);
            }
        }
        return byName.entrySet().stream()
            .map(e -> new UserCollection(e.getKey(), e.getValue()))
            .sorted(Comparator.comparingInt(UserCollection::size).reversed()
                .thenComparing(UserCollection::name))
            .toList();
    }

    /**
     * Every unordered pair of collections joined by a direct parent, spouse or
     * child relationship. Each relationship is counted from both of its ends.
     */
    public List<CollectionConnection> crossCollectionConnections(FamilyGraph graph) {
        Map<String, PairTally> tallies = new LinkedHashMap<>();

        for (PersonNode person : graph.people()) {
            if (!hasCollection(person)) {
                continue;
            }
            for (String relatedId : directRelatives(person)) {
                graph.findById(relatedId)
                    .filter(FamilyComponentService::hasCollection)
                    .filter(related -> !related.collection().equals(person.collection()))
                    .ifPresent(related -> {
                        String first = min(person.collection(), related.collection());
                        String second = max(person.collection(), related.collection());
                        tallies.computeIfAbsent(first + "\u0000" + second, k -> new PairTally(first, second))
                            .record(person);
                    });
            }
        }

        return tallies.values().stream()
            .map(PairTally::toConnection)
            .sorted(Comparator.comparingInt(CollectionConnection::relationshipCount).reversed()
                .thenComparing(CollectionConnection::fromCollection)
                .thenComparing(CollectionConnection::toCollection))
            .toList();
    }

    // ========== HELPERS ==========

    private static Set<String> directRelatives(PersonNode person) {
        Set<String> ids = new LinkedHashSet<>(person.biologicalParentIds());
        ids.addAll(person.spouseIds());
        ids.addAll(person.childIds());
        return ids;
    }

    /**
     * Most frequent family label; ties go to the lexicographically smallest label.
     */
    static String nameOf(List<PersonNode> members) {
        Map<String, Integer> counts = new HashMap<>();
        for (PersonNode person : members) {
            String label = person.familyLabel();
            if (label != null && !label.isBlank()) {
                counts.merge(label, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
            .min(Map.Entry.<String, Integer>comparingByValue().reversed()
                .thenComparing(Map.Entry.comparingByKey()))
            .map(Map.Entry::getKey)
            .orElse(FamilyComponent.UNNAMED);
    }

    static PersonNode representativeOf(List<PersonNode> members) {
        return members.stream().min(REPRESENTATIVE_ORDER).orElseThrow();
    }

    private static boolean hasCollection(PersonNode person) {
        return person.collection() != null && !person.collection().isBlank();
    }

    private static String min(String a, String b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static String max(String a, String b) {
        return a.compareTo(b) <= 0 ? b : a;
    }

    private static final class PairTally {
        private final String first;
        private final String second;
        private final Map<String, PersonNode> bridgePeople = new LinkedHashMap<>();
        private int count;

        PairTally(String first, String second) {
            this.first = first;
            this.second = second;
        }

        void record(PersonNode bridge) {
            bridgePeople.putIfAbsent(bridge.id(), bridge);
            count++;
        }

        CollectionConnection toConnection() {
            return new CollectionConnection(first, second, new ArrayList<>(bridgePeople.values()), count);
        }
    }
}
