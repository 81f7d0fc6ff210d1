package com.familygraph.service;

import com.familygraph.config.GraphEngineProperties;
import com.familygraph.model.RawRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies records by their type property ("cr_type" or "type", whichever is
 * configured as primary, then the other), then by tags such as "#person" or
 * "#genealogy/person". A record with an identity key and no type is a person
 * unless it carries place, event or source marker properties.
 */
@Component
public class NoteTypeClassifier implements RecordKindClassifier {

    private static final Set<String> PLACE_MARKERS = Set.of(
        "place_category", "coordinates", "coordinates_lat", "custom_coordinates",
        "custom_coordinates_x", "contained_by");
    private static final Set<String> EVENT_MARKERS = Set.of("event_type", "date_end", "participants");
    private static final Set<String> SOURCE_MARKERS = Set.of("source_type", "repository", "citation_template");

    private static final Map<String, String> TAG_KINDS = Map.ofEntries(
        Map.entry("person", "person"),
        Map.entry("place", "place"),
        Map.entry("event", "event"),
        Map.entry("source", "source"),
        Map.entry("map", "map"),
        Map.entry("organization", "organization"),
        Map.entry("schema", "schema"),
        Map.entry("universe", "universe"),
        Map.entry("proof-summary", "proof_summary"),
        Map.entry("proof_summary", "proof_summary"),
        Map.entry("timeline", "timeline")
    );

    private final ValueAliasResolver valueAliases;
    private final PropertyAliasResolver propertyAliases;
    private final String primaryTypeProperty;
    private final String fallbackTypeProperty;
    private final boolean tagDetection;

    public NoteTypeClassifier(ValueAliasResolver valueAliases,
                              PropertyAliasResolver propertyAliases,
                              GraphEngineProperties properties) {
        this.valueAliases = valueAliases;
        this.propertyAliases = propertyAliases;
        this.primaryTypeProperty = properties.getNoteTypeDetection().getPrimaryTypeProperty();
        this.fallbackTypeProperty = "cr_type".equals(primaryTypeProperty) ? "type" : "cr_type";
        this.tagDetection = properties.getNoteTypeDetection().isEnableTagDetection();
    }

    @Override
    public String classify(RawRecord record) {
        Map<String, Object> properties = record.properties();

        String declared = declaredKind(properties.get(primaryTypeProperty));
        if (declared == null) {
            declared = declaredKind(properties.get(fallbackTypeProperty));
        }
        if (declared == null && tagDetection) {
            declared = kindFromTags(allTags(record));
        }
        if (declared != null) {
            return declared;
        }

        boolean hasId = propertyAliases.resolveString(properties, "cr_id").isPresent();
        if (hasId && !hasAny(properties, PLACE_MARKERS)
                && !hasAny(properties, EVENT_MARKERS)
                && !hasAny(properties, SOURCE_MARKERS)) {
            return PERSON;
        }
        return UNKNOWN;
    }

    private String declaredKind(Object value) {
        if (!(value instanceof String) || ((String) value).isBlank()) {
            return null;
        }
        String resolved = valueAliases.resolve(ValueAliasField.NOTE_TYPE, (String) value);
        return valueAliases.isCanonical(ValueAliasField.NOTE_TYPE, resolved) ? resolved.toLowerCase() : null;
    }

    private static String kindFromTags(List<String> tags) {
        for (String tag : tags) {
            String clean = tag.startsWith("#") ? tag.substring(1) : tag;
            if (TAG_KINDS.containsKey(clean)) {
                return TAG_KINDS.get(clean);
            }
            // nested tags: #genealogy/person
            String last = clean.substring(clean.lastIndexOf('/') + 1);
            if (TAG_KINDS.containsKey(last)) {
                return TAG_KINDS.get(last);
            }
        }
        return null;
    }

    private static List<String> allTags(RawRecord record) {
        List<String> tags = new ArrayList<>(record.tags());
        Object fmTags = record.properties().get("tags");
        if (fmTags instanceof List) {
            for (Object tag : (List<?>) fmTags) {
                if (tag instanceof String) {
                    tags.add((String) tag);
                }
            }
        } else if (fmTags instanceof String) {
            tags.add((String) fmTags);
        }
        return tags;
    }

    private static boolean hasAny(Map<String, Object> properties, Set<String> keys) {
        for (String key : keys) {
            if (properties.containsKey(key)) {
                return true;
            }
        }
        return false;
    }
}
