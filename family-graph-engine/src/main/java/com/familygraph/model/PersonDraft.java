package com.familygraph.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Mutable working form of a {@link PersonNode}, used while a record is
 * extracted and while the graph builder reconciles reverse edges.
 * List-valued relationships are insertion-ordered sets, so adding the same
 * target twice keeps it once.
 */
public class PersonDraft {

    private String id;
    private String name;
    private String birthDate;
    private String deathDate;
    private String birthPlace;
    private String deathPlace;
    private String burialPlace;
    private String occupation;
    private Sex sex = Sex.U;
    private Boolean living;
    private String fatherId;
    private String motherId;
    private String adoptiveFatherId;
    private String adoptiveMotherId;
    private String familyLabel;
    private String collection;
    private String universe;
    private int sourceCount;
    private Integer researchCoverage;
    private Integer researchConflicts;

    private final Set<String> parentIds = new LinkedHashSet<>();
    private final Set<String> stepfatherIds = new LinkedHashSet<>();
    private final Set<String> stepmotherIds = new LinkedHashSet<>();
    private final Set<String> stepParentIds = new LinkedHashSet<>();
    private final Set<String> adoptiveParentIds = new LinkedHashSet<>();
    private final Set<String> adoptedChildIds = new LinkedHashSet<>();
    private final Set<String> fosterParentIds = new LinkedHashSet<>();
    private final Set<String> guardianIds = new LinkedHashSet<>();
    private final Set<String> childIds = new LinkedHashSet<>();
    private final Map<String, SpouseRelation> spouses = new LinkedHashMap<>();
    private final Map<String, String> relationshipTypeOverrides = new LinkedHashMap<>();
    // Children declared through a non-blood type, with the slot the child gets pointing back here
    private final Map<String, FamilyGraphMapping> inverseLinks = new LinkedHashMap<>();

    public PersonDraft(String id) {
        this.id = id;
    }

    public PersonNode toNode() {
        List<SpouseRelation> orderedSpouses = new ArrayList<>(spouses.values());
        orderedSpouses.sort(Comparator.comparingInt(SpouseRelation::order));
        return new PersonNode(
            id, name, birthDate, deathDate, birthPlace, deathPlace, burialPlace, occupation,
            sex, living, fatherId, motherId,
            new ArrayList<>(parentIds),
            new ArrayList<>(stepfatherIds),
            new ArrayList<>(stepmotherIds),
            new ArrayList<>(stepParentIds),
            adoptiveFatherId, adoptiveMotherId,
            new ArrayList<>(adoptiveParentIds),
            new ArrayList<>(adoptedChildIds),
            new ArrayList<>(fosterParentIds),
            new ArrayList<>(guardianIds),
            orderedSpouses,
            new ArrayList<>(childIds),
            relationshipTypeOverrides,
            familyLabel, collection, universe,
            sourceCount, researchCoverage, researchConflicts
        );
    }

    /**
     * Drops every reference that fails the predicate, including single slots and
     * override entries whose target no longer appears in a parent or spouse list.
     */
    public void retainReferences(Predicate<String> known) {
        if (fatherId != null && !known.test(fatherId)) fatherId = null;
        if (motherId != null && !known.test(motherId)) motherId = null;
        if (adoptiveFatherId != null && !known.test(adoptiveFatherId)) adoptiveFatherId = null;
        if (adoptiveMotherId != null && !known.test(adoptiveMotherId)) adoptiveMotherId = null;
        parentIds.removeIf(known.negate());
        stepfatherIds.removeIf(known.negate());
        stepmotherIds.removeIf(known.negate());
        stepParentIds.removeIf(known.negate());
        adoptiveParentIds.removeIf(known.negate());
        adoptedChildIds.removeIf(known.negate());
        fosterParentIds.removeIf(known.negate());
        guardianIds.removeIf(known.negate());
        childIds.removeIf(known.negate());
        spouses.keySet().removeIf(known.negate());
        inverseLinks.keySet().removeIf(known.negate());
        relationshipTypeOverrides.keySet()
            .removeIf(target -> !parentIds.contains(target) && !spouses.containsKey(target));
    }

    /** Adds a spouse unless already present; returns true when added. */
    public boolean addSpouse(SpouseRelation spouse) {
        if (spouses.containsKey(spouse.personId())) {
            return false;
        }
        spouses.put(spouse.personId(), spouse);
        return true;
    }

    public boolean hasAdoptiveParent(String parentId) {
        return parentId.equals(adoptiveFatherId)
            || parentId.equals(adoptiveMotherId)
            || adoptiveParentIds.contains(parentId);
    }

    public String getId() { return id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getBirthDate() { return birthDate; }
    public void setBirthDate(String birthDate) { this.birthDate = birthDate; }

    public String getDeathDate() { return deathDate; }
    public void setDeathDate(String deathDate) { this.deathDate = deathDate; }

    public String getBirthPlace() { return birthPlace; }
    public void setBirthPlace(String birthPlace) { this.birthPlace = birthPlace; }

    public String getDeathPlace() { return deathPlace; }
    public void setDeathPlace(String deathPlace) { this.deathPlace = deathPlace; }

    public String getBurialPlace() { return burialPlace; }
    public void setBurialPlace(String burialPlace) { this.burialPlace = burialPlace; }

    public String getOccupation() { return occupation; }
    public void setOccupation(String occupation) { this.occupation = occupation; }

    public Sex getSex() { return sex; }
    public void setSex(Sex sex) { this.sex = sex != null ? sex : Sex.U; }

    public Boolean getLiving() { return living; }
    public void setLiving(Boolean living) { this.living = living; }

    public String getFatherId() { return fatherId; }
    public void setFatherId(String fatherId) { this.fatherId = fatherId; }

    public String getMotherId() { return motherId; }
    public void setMotherId(String motherId) { this.motherId = motherId; }

    public String getAdoptiveFatherId() { return adoptiveFatherId; }
    public void setAdoptiveFatherId(String adoptiveFatherId) { this.adoptiveFatherId = adoptiveFatherId; }

    public String getAdoptiveMotherId() { return adoptiveMotherId; }
    public void setAdoptiveMotherId(String adoptiveMotherId) { this.adoptiveMotherId = adoptiveMotherId; }

    public String getFamilyLabel() { return familyLabel; }
    public void setFamilyLabel(String familyLabel) { this.familyLabel = familyLabel; }

    public String getCollection() { return collection; }
    public void setCollection(String collection) { this.collection = collection; }

    public String getUniverse() { return universe; }
    public void setUniverse(String universe) { this.universe = universe; }

    public int getSourceCount() { return sourceCount; }
    public void setSourceCount(int sourceCount) { this.sourceCount = sourceCount; }

    public Integer getResearchCoverage() { return researchCoverage; }
    public void setResearchCoverage(Integer researchCoverage) { this.researchCoverage = researchCoverage; }

    public Integer getResearchConflicts() { return researchConflicts; }
    public void setResearchConflicts(Integer researchConflicts) { this.researchConflicts = researchConflicts; }

    public Set<String> getParentIds() { return parentIds; }
    public Set<String> getStepfatherIds() { return stepfatherIds; }
    public Set<String> getStepmotherIds() { return stepmotherIds; }
    public Set<String> getStepParentIds() { return stepParentIds; }
    public Set<String> getAdoptiveParentIds() { return adoptiveParentIds; }
    public Set<String> getAdoptedChildIds() { return adoptedChildIds; }
    public Set<String> getFosterParentIds() { return fosterParentIds; }
    public Set<String> getGuardianIds() { return guardianIds; }
    public Set<String> getChildIds() { return childIds; }
    public Map<String, SpouseRelation> getSpouses() { return spouses; }
    public Map<String, String> getRelationshipTypeOverrides() { return relationshipTypeOverrides; }
    public Map<String, FamilyGraphMapping> getInverseLinks() { return inverseLinks; }
}
