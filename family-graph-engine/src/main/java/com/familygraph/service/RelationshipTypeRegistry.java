package com.familygraph.service;

import com.familygraph.config.GraphEngineProperties;
import com.familygraph.config.GraphEngineProperties.RelationshipTypeProperties;
import com.familygraph.model.DefaultRelationshipTypes;
import com.familygraph.model.FamilyGraphMapping;
import com.familygraph.model.LineStyle;
import com.familygraph.model.RelationshipCategory;
import com.familygraph.model.RelationshipTypeDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of relationship types: built-ins merged with user definitions.
 * A user definition with a built-in's id replaces it.
 */
@Service
public class RelationshipTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(RelationshipTypeRegistry.class);

    private final Map<String, RelationshipTypeDefinition> typesById;

    public RelationshipTypeRegistry(GraphEngineProperties properties) {
        Map<String, RelationshipTypeDefinition> types = new LinkedHashMap<>();
        for (RelationshipTypeDefinition builtIn : DefaultRelationshipTypes.ALL) {
            types.put(builtIn.id(), builtIn);
        }
        for (RelationshipTypeProperties custom : properties.getRelationshipTypes()) {
            if (custom.getId() == null || custom.getId().isBlank()) {
                log.warn("Ignoring relationship type without an id: {}", custom.getName());
                continue;
            }
            types.put(custom.getId(), toDefinition(custom));
        }
        for (String hidden : properties.getHiddenRelationshipTypes()) {
            types.remove(hidden);
        }
        this.typesById = Collections.unmodifiableMap(types);
    }

    public List<RelationshipTypeDefinition> listTypes() {
        return new ArrayList<>(typesById.values());
    }

    public Optional<RelationshipTypeDefinition> get(String typeId) {
        if (typeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(typesById.get(typeId));
    }

    /** Types that both opt in to family trees and name a structural slot. */
    public List<RelationshipTypeDefinition> familyTreeTypes() {
        return typesById.values().stream()
            .filter(RelationshipTypeDefinition::isFamilyTreeEligible)
            .toList();
    }

    public Optional<RelationshipTypeDefinition> inverseOf(String typeId) {
        return get(typeId).flatMap(type -> type.symmetric() ? Optional.of(type) : get(type.inverse()));
    }

    /** Display name for a type id, falling back to the id itself. */
    public String labelFor(String typeId) {
        return get(typeId).map(RelationshipTypeDefinition::name).orElse(typeId);
    }

    private RelationshipTypeDefinition toDefinition(RelationshipTypeProperties custom) {
        FamilyGraphMapping mapping = null;
        if (custom.getFamilyGraphMapping() != null && !custom.getFamilyGraphMapping().isBlank()) {
            mapping = FamilyGraphMapping.fromValue(custom.getFamilyGraphMapping()).orElse(null);
            if (mapping == null) {
                log.warn("Relationship type '{}' has unknown family graph mapping '{}'; it will not appear on trees",
                    custom.getId(), custom.getFamilyGraphMapping());
            }
        }
        return new RelationshipTypeDefinition(
            custom.getId(),
            custom.getName() != null ? custom.getName() : custom.getId(),
            custom.getDescription(),
            parseEnum(RelationshipCategory.class, custom.getCategory(), RelationshipCategory.SOCIAL, custom.getId()),
            custom.getColor(),
            parseEnum(LineStyle.class, custom.getLineStyle(), LineStyle.SOLID, custom.getId()),
            custom.getInverse(),
            custom.isSymmetric(),
            false,
            custom.isIncludeOnFamilyTree(),
            mapping
        );
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, E fallback, String typeId) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            log.warn("Relationship type '{}' has unknown {} '{}', using {}",
                typeId, type.getSimpleName(), value, fallback);
            return fallback;
        }
    }
}
