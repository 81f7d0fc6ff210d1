package com.familygraph.service;

import com.familygraph.config.GraphEngineProperties;
import com.familygraph.model.AnalyticsReport;
import com.familygraph.model.AnalyticsReport.CollectionSize;
import com.familygraph.model.CollectionConnection;
import com.familygraph.model.FamilyComponent;
import com.familygraph.model.FamilyGraph;
import com.familygraph.model.PersonNode;
import com.familygraph.model.Sex;
import com.familygraph.model.SpouseRelation;
import com.familygraph.model.UserCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Completeness, relationship and date-range statistics for one snapshot.
 */
@Service
public class GraphAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(GraphAnalyticsService.class);

    private final FamilyComponentService componentService;
    private final GraphEngineProperties properties;

    public GraphAnalyticsService(FamilyComponentService componentService, GraphEngineProperties properties) {
        this.componentService = componentService;
        this.properties = properties;
    }

    public AnalyticsReport analytics(FamilyGraph graph) {
        int total = graph.size();
        int withBirth = 0;
        int withDeath = 0;
        int withSex = 0;
        int withParents = 0;
        int withSpouses = 0;
        int withChildren = 0;
        int orphaned = 0;
        int living = 0;
        Integer earliest = null;
        Integer latest = null;

        for (PersonNode person : graph.people()) {
            if (person.hasBirthDate()) withBirth++;
            if (person.hasDeathDate()) withDeath++;
            if (person.sex() != Sex.U) withSex++;
            if (person.hasParents()) withParents++;
            if (!person.spouses().isEmpty()) withSpouses++;
            if (!person.childIds().isEmpty()) withChildren++;
            if (person.isOrphaned()) orphaned++;
            if (person.isLiving()) living++;

            for (String date : datesOf(person)) {
                OptionalInt year = PartialDates.extractYear(date);
                if (year.isPresent()) {
                    int y = year.getAsInt();
                    earliest = earliest == null ? y : Math.min(earliest, y);
                    latest = latest == null ? y : Math.max(latest, y);
                }
            }
        }

        List<FamilyComponent> components = componentService.findComponents(graph);
        List<UserCollection> collections = componentService.userCollections(graph);
        List<CollectionConnection> connections = componentService.crossCollectionConnections(graph);

        // Components and user collections are measured together
        List<CollectionSize> sizes = new ArrayList<>();
        for (FamilyComponent component : components) {
            sizes.add(new CollectionSize(component.name(), component.size()));
        }
        for (UserCollection collection : collections) {
            sizes.add(new CollectionSize(collection.name(), collection.size()));
        }

        double average = sizes.isEmpty() ? 0.0
            : sizes.stream().mapToInt(CollectionSize::size).average().orElse(0.0);
        CollectionSize largest = null;
        CollectionSize smallest = null;
        for (CollectionSize size : sizes) {
            if (largest == null || size.size() > largest.size()) largest = size;
            if (smallest == null || size.size() < smallest.size()) smallest = size;
        }

        int topN = Math.max(0, properties.getAnalytics().getTopConnections());
        List<CollectionConnection> top = connections.stream().limit(topN).toList();

        log.debug("Analytics over {} people: {} components, {} collections, {} connections",
            total, components.size(), collections.size(), connections.size());

        return new AnalyticsReport(
            total,
            withBirth, percent(withBirth, total),
            withDeath, percent(withDeath, total),
            withSex, percent(withSex, total),
            withParents,
            withSpouses,
            withChildren,
            orphaned,
            living,
            earliest,
            latest,
            earliest != null ? latest - earliest : null,
            components.size(),
            collections.size(),
            average,
            largest,
            smallest,
            top
        );
    }

    private static List<String> datesOf(PersonNode person) {
        List<String> dates = new ArrayList<>();
        dates.add(person.birthDate());
        dates.add(person.deathDate());
        for (SpouseRelation spouse : person.spouses()) {
            dates.add(spouse.marriageDate());
            dates.add(spouse.divorceDate());
        }
        return dates;
    }

    private static int percent(int part, int total) {
        return total == 0 ? 0 : (int) Math.round(part * 100.0 / total);
    }
}
