package com.familygraph.model;

/**
 * Outcome of extracting one record. Only {@link Outcome#PERSON} results carry a draft;
 * the graph builder reconciles it with the other drafts before freezing it.
 */
public record ExtractionResult(Outcome outcome, PersonDraft draft, String recordKind) {

    public enum Outcome {
        PERSON,
        NOT_A_PERSON,
        MISSING_ID
    }

    public static ExtractionResult person(PersonDraft draft) {
        return new ExtractionResult(Outcome.PERSON, draft, "person");
    }

    public static ExtractionResult notAPerson(String recordKind) {
        return new ExtractionResult(Outcome.NOT_A_PERSON, null, recordKind);
    }

    public static ExtractionResult missingId() {
        return new ExtractionResult(Outcome.MISSING_ID, null, "person");
    }

    public boolean isPerson() {
        return outcome == Outcome.PERSON;
    }

    /** The extracted person as it reads from its own record, before reconciliation. */
    public PersonNode node() {
        return draft != null ? draft.toNode() : null;
    }
}
