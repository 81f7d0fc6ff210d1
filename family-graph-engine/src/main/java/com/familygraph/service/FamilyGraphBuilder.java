package com.familygraph.service;

import com.familygraph.model.ExtractionResult;
import com.familygraph.model.ExtractionStats;
import com.familygraph.model.FamilyGraph;
import com.familygraph.model.FamilyGraphMapping;
import com.familygraph.model.PersonDraft;
import com.familygraph.model.PersonNode;
import com.familygraph.model.RawRecord;
import com.familygraph.model.Sex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a graph snapshot from a full set of records.
 *
 * Pass 1 extracts people and indexes them by identity key; source records are
 * counted as evidence. Pass 2 reconciles reverse edges (parent to child,
 * adoptive parent and adopted child, step, foster and ward links declared on
 * the parent side) and drops every reference to a person
 * outside the snapshot.
 */
@Component
public class FamilyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(FamilyGraphBuilder.class);

    private final PersonRecordExtractor extractor;
    private final ResearchScoreProvider researchScores;

    public FamilyGraphBuilder(PersonRecordExtractor extractor, ResearchScoreProvider researchScores) {
        this.extractor = extractor;
        this.researchScores = researchScores;
    }

    public FamilyGraph build(Collection<RawRecord> records) {
        return build(records, RecordPathLinkIndex.of(records, extractor::identityOf));
    }

    public FamilyGraph build(Collection<RawRecord> records, LinkResolutionIndex index) {
        Instant start = Instant.now();

        // Pass 1: extract
        Map<String, PersonDraft> drafts = new LinkedHashMap<>();
        List<RawRecord> evidenceRecords = new ArrayList<>();
        int nonPerson = 0;
        int missingId = 0;
        int duplicates = 0;

        for (RawRecord record : records) {
            ExtractionResult result;
            try {
                result = extractor.extract(record, index);
            } catch (RuntimeException e) {
                log.warn("Failed to extract record {}: {}", record.path(), e.getMessage());
                continue;
            }
            switch (result.outcome()) {
                case PERSON -> {
                    PersonDraft draft = result.draft();
                    if (drafts.containsKey(draft.getId())) {
                        log.warn("Duplicate identity key {} in {}; keeping the first record", draft.getId(), record.path());
                        duplicates++;
                    } else {
                        drafts.put(draft.getId(), draft);
                    }
                }
                case NOT_A_PERSON -> {
                    nonPerson++;
                    if ("source".equals(result.recordKind())) {
                        evidenceRecords.add(record);
                    }
                }
                case MISSING_ID -> missingId++;
            }
        }

        countEvidence(evidenceRecords, drafts, index);

        // Pass 2: reconcile
        reconcile(drafts);

        Map<String, PersonNode> nodes = new LinkedHashMap<>();
        for (PersonDraft draft : drafts.values()) {
            researchScores.scoresFor(draft.getId()).ifPresent(scores -> {
                draft.setResearchCoverage(scores.coverage());
                draft.setResearchConflicts(scores.conflicts());
            });
            nodes.put(draft.getId(), draft.toNode());
        }

        ExtractionStats stats = new ExtractionStats(records.size(), nodes.size(), nonPerson, missingId, duplicates);
        log.info("Family graph built: {} people from {} records ({} non-person, {} without id), took {}ms",
            nodes.size(), records.size(), nonPerson, missingId,
            Duration.between(start, Instant.now()).toMillis());

        return new FamilyGraph(nodes, Instant.now(), stats);
    }

    private void countEvidence(List<RawRecord> sources, Map<String, PersonDraft> drafts, LinkResolutionIndex index) {
        Map<String, Integer> counts = new HashMap<>();
        for (RawRecord source : sources) {
            for (String personId : extractor.citedPeople(source, index)) {
                counts.merge(personId, 1, Integer::sum);
            }
        }
        counts.forEach((personId, count) -> {
            PersonDraft draft = drafts.get(personId);
            if (draft != null) {
                draft.setSourceCount(count);
            }
        });
    }

    void reconcile(Map<String, PersonDraft> drafts) {
        for (PersonDraft person : drafts.values()) {
            String id = person.getId();

            // Parent-side inference: every parent lists this person as a child
            addChild(drafts.get(person.getFatherId()), id);
            addChild(drafts.get(person.getMotherId()), id);
            for (String parentId : person.getParentIds()) {
                addChild(drafts.get(parentId), id);
            }

            // Adoptive parents list this person as an adopted child
            for (String adoptiveId : adoptiveParentsOf(person)) {
                PersonDraft adoptive = drafts.get(adoptiveId);
                if (adoptive != null) {
                    adoptive.getAdoptedChildIds().add(id);
                }
            }
        }

        // Adopted children name the owner as an adoptive parent
        for (PersonDraft owner : drafts.values()) {
            for (String childId : owner.getAdoptedChildIds()) {
                PersonDraft child = drafts.get(childId);
                if (child != null && !child.hasAdoptiveParent(owner.getId())) {
                    addAdoptiveParent(child, owner);
                }
            }
        }

        // Step, foster and ward declarations on the parent side reach the child
        for (PersonDraft owner : drafts.values()) {
            owner.getInverseLinks().forEach((childId, mapping) -> {
                PersonDraft child = drafts.get(childId);
                if (child != null) {
                    addNonBloodParent(child, owner.getId(), mapping);
                }
            });
        }

        for (PersonDraft person : drafts.values()) {
            person.retainReferences(drafts::containsKey);
        }
    }

    private static void addNonBloodParent(PersonDraft child, String parentId, FamilyGraphMapping mapping) {
        switch (mapping) {
            case STEPPARENT -> {
                if (!child.getStepfatherIds().contains(parentId) && !child.getStepmotherIds().contains(parentId)) {
                    child.getStepParentIds().add(parentId);
                }
            }
            case FOSTER_PARENT -> child.getFosterParentIds().add(parentId);
            case GUARDIAN -> child.getGuardianIds().add(parentId);
            default -> log.debug("No reverse slot for {} on {}", mapping, child.getId());
        }
    }

    private static void addChild(PersonDraft parent, String childId) {
        if (parent != null) {
            parent.getChildIds().add(childId);
        }
    }

    private static List<String> adoptiveParentsOf(PersonDraft person) {
        List<String> ids = new ArrayList<>();
        if (person.getAdoptiveFatherId() != null) ids.add(person.getAdoptiveFatherId());
        if (person.getAdoptiveMotherId() != null) ids.add(person.getAdoptiveMotherId());
        ids.addAll(person.getAdoptiveParentIds());
        return ids;
    }

    // Fill the sex-matching slot when it is free, otherwise the gender-neutral list
    private static void addAdoptiveParent(PersonDraft child, PersonDraft parent) {
        if (parent.getSex() == Sex.M && child.getAdoptiveFatherId() == null) {
            child.setAdoptiveFatherId(parent.getId());
        } else if (parent.getSex() == Sex.F && child.getAdoptiveMotherId() == null) {
            child.setAdoptiveMotherId(parent.getId());
        } else {
            child.getAdoptiveParentIds().add(parent.getId());
        }
    }
}
