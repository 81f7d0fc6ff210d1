package com.familygraph.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A person in one graph snapshot. Relationship fields hold identity keys of
 * other nodes in the same snapshot, never raw text. Instances are immutable;
 * build them through {@link PersonDraft}.
 */
public record PersonNode(
    String id,
    String name,
    String birthDate,
    String deathDate,
    String birthPlace,
    String deathPlace,
    String burialPlace,
    String occupation,
    Sex sex,
    Boolean living,
    String fatherId,
    String motherId,
    List<String> parentIds,
    List<String> stepfatherIds,
    List<String> stepmotherIds,
    List<String> stepParentIds,
    String adoptiveFatherId,
    String adoptiveMotherId,
    List<String> adoptiveParentIds,
    List<String> adoptedChildIds,
    List<String> fosterParentIds,
    List<String> guardianIds,
    List<SpouseRelation> spouses,
    List<String> childIds,
    Map<String, String> relationshipTypeOverrides,
    String familyLabel,
    String collection,
    String universe,
    int sourceCount,
    Integer researchCoverage,
    Integer researchConflicts
) {
    public PersonNode {
        sex = sex != null ? sex : Sex.U;
        parentIds = List.copyOf(parentIds);
        stepfatherIds = List.copyOf(stepfatherIds);
        stepmotherIds = List.copyOf(stepmotherIds);
        stepParentIds = List.copyOf(stepParentIds);
        adoptiveParentIds = List.copyOf(adoptiveParentIds);
        adoptedChildIds = List.copyOf(adoptedChildIds);
        fosterParentIds = List.copyOf(fosterParentIds);
        guardianIds = List.copyOf(guardianIds);
        spouses = List.copyOf(spouses);
        childIds = List.copyOf(childIds);
        relationshipTypeOverrides = Map.copyOf(relationshipTypeOverrides);
    }

    public List<String> spouseIds() {
        return spouses.stream().map(SpouseRelation::personId).toList();
    }

    /** Father, mother and gender-neutral parents, in that order, without repeats. */
    public List<String> biologicalParentIds() {
        Set<String> ids = new LinkedHashSet<>();
        if (fatherId != null) ids.add(fatherId);
        if (motherId != null) ids.add(motherId);
        ids.addAll(parentIds);
        return new ArrayList<>(ids);
    }

    public List<String> adoptiveParentIdsAll() {
        Set<String> ids = new LinkedHashSet<>();
        if (adoptiveFatherId != null) ids.add(adoptiveFatherId);
        if (adoptiveMotherId != null) ids.add(adoptiveMotherId);
        ids.addAll(adoptiveParentIds);
        return new ArrayList<>(ids);
    }

    public boolean hasBirthDate() {
        return birthDate != null && !birthDate.isBlank();
    }

    public boolean hasDeathDate() {
        return deathDate != null && !deathDate.isBlank();
    }

    public boolean hasParents() {
        return fatherId != null || motherId != null || !parentIds.isEmpty();
    }

    /** No relationship of any kind, including step, adoptive, foster and guardian links. */
    public boolean isOrphaned() {
        return !hasParents()
            && stepfatherIds.isEmpty()
            && stepmotherIds.isEmpty()
            && stepParentIds.isEmpty()
            && adoptiveFatherId == null
            && adoptiveMotherId == null
            && adoptiveParentIds.isEmpty()
            && adoptedChildIds.isEmpty()
            && fosterParentIds.isEmpty()
            && guardianIds.isEmpty()
            && spouses.isEmpty()
            && childIds.isEmpty();
    }

    public boolean isLiving() {
        if (living != null) {
            return living;
        }
        return hasBirthDate() && !hasDeathDate();
    }

    /** Step-fathers, step-mothers and step-parents of unrecorded sex, without repeats. */
    public List<String> allStepParentIds() {
        Set<String> ids = new LinkedHashSet<>(stepfatherIds);
        ids.addAll(stepmotherIds);
        ids.addAll(stepParentIds);
        return new ArrayList<>(ids);
    }

    /** Custom relationship type id that supplied the edge to this target, or null. */
    public String overrideFor(String targetId) {
        return relationshipTypeOverrides.get(targetId);
    }
}
