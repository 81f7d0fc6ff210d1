package com.familygraph.service;

import com.familygraph.config.GraphEngineProperties;
import com.familygraph.model.DefaultRelationshipTypes;
import com.familygraph.model.ExtractionResult;
import com.familygraph.model.FamilyGraphMapping;
import com.familygraph.model.MarriageStatus;
import com.familygraph.model.PersonDraft;
import com.familygraph.model.RawRecord;
import com.familygraph.model.RelationshipTypeDefinition;
import com.familygraph.model.Sex;
import com.familygraph.model.SpouseRelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns one raw record into a person node. Every property goes through the
 * alias resolvers; downstream code never sees the raw map.
 *
 * Relationship references are read from three encodings, merged in this order:
 * <ol>
 *   <li>direct identifier properties ({@code father_id}, {@code spouse_id}, ...)</li>
 *   <li>textual references ({@code father: "[[John Smith]]"}) looked up in the link index</li>
 *   <li>generic declarations keyed by relationship type, flat ({@code mentor_id: [...]})
 *       or the legacy nested {@code relationships} list</li>
 * </ol>
 * Identifiers that look like untranslated import handles are dropped everywhere.
 */
@Component
public class PersonRecordExtractor {

    private static final Logger log = LoggerFactory.getLogger(PersonRecordExtractor.class);

    private static final String LEGACY_RELATIONSHIPS = "relationships";
    private static final int MAX_INDEXED_SPOUSES = 50;

    private final PropertyAliasResolver propertyAliases;
    private final ValueAliasResolver valueAliases;
    private final RelationshipTypeRegistry relationshipTypes;
    private final RecordKindClassifier classifier;
    private final Pattern unresolvedReference;

    public PersonRecordExtractor(PropertyAliasResolver propertyAliases,
                                 ValueAliasResolver valueAliases,
                                 RelationshipTypeRegistry relationshipTypes,
                                 RecordKindClassifier classifier,
                                 GraphEngineProperties properties) {
        this.propertyAliases = propertyAliases;
        this.valueAliases = valueAliases;
        this.relationshipTypes = relationshipTypes;
        this.classifier = classifier;
        this.unresolvedReference = Pattern.compile(properties.getUnresolvedReferencePattern());
    }

    /**
     * Extract a person node from a record.
     *
     * @param record the raw record
     * @param index  lookup for textual references
     * @return a PERSON result, or NOT_A_PERSON / MISSING_ID when the record is excluded
     */
    public ExtractionResult extract(RawRecord record, LinkResolutionIndex index) {
        String kind = classifier.classify(record);
        if (!RecordKindClassifier.PERSON.equals(kind)) {
            return ExtractionResult.notAPerson(kind);
        }

        String id = identityOf(record);
        if (id == null) {
            log.debug("Skipping person record without an identity key: {}", record.path());
            return ExtractionResult.missingId();
        }

        Map<String, Object> props = record.properties();
        PersonDraft draft = new PersonDraft(id);

        draft.setName(text(props, "name").orElse(record.basename()));
        draft.setBirthDate(text(props, "born", "birth_date").orElse(null));
        draft.setDeathDate(text(props, "died", "death_date").orElse(null));
        draft.setBirthPlace(text(props, "birth_place").orElse(null));
        draft.setDeathPlace(text(props, "death_place").orElse(null));
        draft.setBurialPlace(text(props, "burial_place").orElse(null));
        draft.setOccupation(text(props, "occupation").orElse(null));
        draft.setSex(text(props, "sex", "gender")
            .map(raw -> Sex.fromCanonical(valueAliases.resolve(ValueAliasField.SEX, raw)))
            .orElse(Sex.U));
        draft.setLiving(propertyAliases.resolve(props, "living").map(PersonRecordExtractor::asBoolean).orElse(null));
        draft.setFamilyLabel(text(props, "group_name").orElse(null));
        draft.setCollection(text(props, "collection").orElse(null));
        draft.setUniverse(text(props, "universe").orElse(null));

        ReferenceReader refs = new ReferenceReader(props, index, id, record.path());

        refs.single("father_id", "father").ifPresent(draft::setFatherId);
        refs.single("mother_id", "mother").ifPresent(draft::setMotherId);
        draft.getParentIds().addAll(refs.list("parents_id", "parents"));
        draft.getStepfatherIds().addAll(refs.list("stepfather_id", "stepfather"));
        draft.getStepmotherIds().addAll(refs.list("stepmother_id", "stepmother"));
        refs.single("adoptive_father_id", "adoptive_father").ifPresent(draft::setAdoptiveFatherId);
        refs.single("adoptive_mother_id", "adoptive_mother").ifPresent(draft::setAdoptiveMotherId);
        for (String adoptive : refs.list("adoptive_parents_id", "adoptive_parents")) {
            if (!draft.hasAdoptiveParent(adoptive)) {
                draft.getAdoptiveParentIds().add(adoptive);
            }
        }
        draft.getAdoptedChildIds().addAll(refs.list("adopted_children_id", "adopted_children"));
        draft.getChildIds().addAll(refs.list("children_id", "children", "child", "son", "daughter"));

        readSpouses(refs, draft);
        applyDeclarations(readDeclarations(refs), draft);

        return ExtractionResult.person(draft);
    }

    /** Identity key of a record, or null when it has none. */
    public String identityOf(RawRecord record) {
        return text(record.properties(), "cr_id").orElse(null);
    }

    /**
     * People a non-person record cites as evidence ({@code person}, {@code persons}
     * and their {@code _id} forms). Used for source counts.
     */
    public List<String> citedPeople(RawRecord record, LinkResolutionIndex index) {
        ReferenceReader refs = new ReferenceReader(record.properties(), index, null, record.path());
        Set<String> cited = new LinkedHashSet<>(refs.list("person_id", "person"));
        cited.addAll(refs.list("persons_id", "persons"));
        return new ArrayList<>(cited);
    }

    boolean isUnresolvedImportReference(String id) {
        return unresolvedReference.matcher(id).matches();
    }

    // ========== SPOUSES ==========

    private void readSpouses(ReferenceReader refs, PersonDraft draft) {
        Map<String, Object> props = refs.props;
        int lastIndex = 0;
        for (int n = 1; n <= MAX_INDEXED_SPOUSES; n++) {
            String prefix = "spouse" + n;
            if (props.get(prefix) == null && props.get(prefix + "_id") == null) {
                break;
            }
            lastIndex = n;
            Optional<String> spouseId = refs.single(prefix + "_id", prefix);
            if (spouseId.isEmpty()) {
                continue;
            }
            MarriageStatus status = text(props, prefix + "_marriage_status")
                .map(raw -> MarriageStatus.fromCanonical(valueAliases.resolve(ValueAliasField.MARRIAGE_STATUS, raw)))
                .orElse(null);
            draft.addSpouse(new SpouseRelation(
                spouseId.get(),
                text(props, prefix + "_marriage_date").orElse(null),
                text(props, prefix + "_divorce_date").orElse(null),
                status,
                text(props, prefix + "_marriage_location").orElse(null),
                n
            ));
        }

        int order = lastIndex;
        for (String spouseId : refs.list("spouse_id", "spouse")) {
            if (draft.addSpouse(SpouseRelation.of(spouseId, order + 1))) {
                order++;
            }
        }
    }

    // ========== GENERIC DECLARATIONS ==========

    private record Declaration(RelationshipTypeDefinition type, String targetId) {}

    private List<Declaration> readDeclarations(ReferenceReader refs) {
        List<Declaration> declarations = new ArrayList<>();

        for (RelationshipTypeDefinition type : relationshipTypes.familyTreeTypes()) {
            for (String target : refs.list(type.id() + "_id", type.id())) {
                declarations.add(new Declaration(type, target));
            }
        }

        Object legacy = refs.props.get(LEGACY_RELATIONSHIPS);
        if (legacy instanceof List) {
            for (Object entry : (List<?>) legacy) {
                if (!(entry instanceof Map)) {
                    continue;
                }
                Map<?, ?> item = (Map<?, ?>) entry;
                Object typeId = item.get("type");
                Optional<RelationshipTypeDefinition> type = typeId == null
                    ? Optional.empty()
                    : relationshipTypes.get(typeId.toString()).filter(RelationshipTypeDefinition::isFamilyTreeEligible);
                if (type.isEmpty()) {
                    continue;
                }
                Object targetId = item.get("target_id");
                Object target = item.get("target");
                Optional<String> resolved = targetId != null
                    ? refs.directId(targetId.toString())
                    : target != null ? refs.textReference(target.toString()) : Optional.empty();
                resolved.ifPresent(id -> declarations.add(new Declaration(type.get(), id)));
            }
        }
        return declarations;
    }

    private void applyDeclarations(List<Declaration> declarations, PersonDraft draft) {
        for (Declaration declaration : declarations) {
            String typeId = declaration.type().id();
            String target = declaration.targetId();
            FamilyGraphMapping mapping = declaration.type().familyGraphMapping();

            switch (mapping) {
                case PARENT -> {
                    if (draft.getParentIds().add(target) && !DefaultRelationshipTypes.PARENTS_TYPE.equals(typeId)) {
                        draft.getRelationshipTypeOverrides().putIfAbsent(target, typeId);
                    }
                }
                case FATHER -> {
                    // First writer wins; a later claim on an occupied slot is dropped
                    if (draft.getFatherId() == null) {
                        draft.setFatherId(target);
                    } else if (!draft.getFatherId().equals(target)) {
                        log.debug("{}: father slot already holds {}, ignoring {} from '{}'",
                            draft.getId(), draft.getFatherId(), target, typeId);
                    }
                }
                case MOTHER -> {
                    if (draft.getMotherId() == null) {
                        draft.setMotherId(target);
                    } else if (!draft.getMotherId().equals(target)) {
                        log.debug("{}: mother slot already holds {}, ignoring {} from '{}'",
                            draft.getId(), draft.getMotherId(), target, typeId);
                    }
                }
                case STEPPARENT -> {
                    if (!draft.getStepfatherIds().contains(target) && !draft.getStepmotherIds().contains(target)) {
                        draft.getStepParentIds().add(target);
                    }
                }
                case ADOPTIVE_PARENT -> {
                    if (!draft.hasAdoptiveParent(target)) {
                        draft.getAdoptiveParentIds().add(target);
                    }
                }
                case FOSTER_PARENT -> draft.getFosterParentIds().add(target);
                case GUARDIAN -> draft.getGuardianIds().add(target);
                case SPOUSE -> {
                    boolean added = draft.addSpouse(SpouseRelation.of(target, draft.getSpouses().size() + 1));
                    if (added && !DefaultRelationshipTypes.SPOUSE_TYPE.equals(typeId)) {
                        draft.getRelationshipTypeOverrides().putIfAbsent(target, typeId);
                    }
                }
                case CHILD -> applyChildDeclaration(typeId, target, draft);
            }
        }
    }

    /**
     * A child-mapped type lands where its inverse points: adopted, step, foster and
     * ward links are recorded for the child's side and never become blood lines.
     */
    private void applyChildDeclaration(String typeId, String target, PersonDraft draft) {
        FamilyGraphMapping inverse = relationshipTypes.inverseOf(typeId)
            .map(RelationshipTypeDefinition::familyGraphMapping)
            .orElse(null);
        if (inverse == null) {
            draft.getChildIds().add(target);
            return;
        }
        switch (inverse) {
            case ADOPTIVE_PARENT -> draft.getAdoptedChildIds().add(target);
            case STEPPARENT, FOSTER_PARENT, GUARDIAN -> draft.getInverseLinks().putIfAbsent(target, inverse);
            default -> draft.getChildIds().add(target);
        }
    }

    // ========== HELPERS ==========

    private Optional<String> text(Map<String, Object> props, String... canonical) {
        return propertyAliases.resolveString(props, canonical);
    }

    private static Boolean asBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String s = PropertyAliasResolver.asString(value).toLowerCase();
        if (s.equals("true") || s.equals("yes")) return Boolean.TRUE;
        if (s.equals("false") || s.equals("no")) return Boolean.FALSE;
        return null;
    }

    private static List<String> values(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().trim());
                }
            }
        } else if (!value.toString().isBlank()) {
            result.add(value.toString().trim());
        }
        return result;
    }

    /**
     * Reads reference properties of one record, merging direct ids and textual
     * references into one de-duplicated list per field.
     */
    private final class ReferenceReader {

        private final Map<String, Object> props;
        private final LinkResolutionIndex index;
        private final String ownId;
        private final String path;

        ReferenceReader(Map<String, Object> props, LinkResolutionIndex index, String ownId, String path) {
            this.props = props;
            this.index = index;
            this.ownId = ownId;
            this.path = path;
        }

        List<String> list(String idProperty, String... textProperties) {
            Set<String> ids = new LinkedHashSet<>();
            for (String raw : values(propertyAliases.resolve(props, idProperty).orElse(null))) {
                directId(raw).ifPresent(ids::add);
            }
            for (String textProperty : textProperties) {
                for (String raw : values(propertyAliases.resolve(props, textProperty).orElse(null))) {
                    textReference(raw).ifPresent(ids::add);
                }
            }
            return new ArrayList<>(ids);
        }

        Optional<String> single(String idProperty, String textProperty) {
            List<String> ids = list(idProperty, textProperty);
            return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
        }

        Optional<String> directId(String raw) {
            return accept(raw.trim());
        }

        /**
         * Wikilinks must resolve through the index. Plain text is tried against the
         * index and otherwise taken as an identifier; the graph builder drops it if
         * no such node exists.
         */
        Optional<String> textReference(String raw) {
            String value = raw.trim();
            Optional<String> resolved = index.resolve(value);
            if (resolved.isPresent()) {
                return accept(resolved.get());
            }
            if (value.startsWith("[[")) {
                log.debug("Unresolved reference {} in {}", value, path);
                return Optional.empty();
            }
            return accept(value);
        }

        private Optional<String> accept(String id) {
            if (id.isEmpty() || id.equals(ownId)) {
                return Optional.empty();
            }
            if (isUnresolvedImportReference(id)) {
                log.debug("Dropping untranslated import reference {} in {}", id, path);
                return Optional.empty();
            }
            return Optional.of(id);
        }
    }
}
