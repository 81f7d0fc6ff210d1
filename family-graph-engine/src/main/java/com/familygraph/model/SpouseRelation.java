package com.familygraph.model;

/**
 * One marriage or partnership as declared on a person record.
 *
 * @param personId     identity key of the partner
 * @param marriageDate free-form date, may be null
 * @param divorceDate  free-form date, may be null
 * @param status       may be null when not recorded
 * @param location     marriage place name, may be null
 * @param order        display position; indexed spouses use their index, others follow
 */
public record SpouseRelation(
    String personId,
    String marriageDate,
    String divorceDate,
    MarriageStatus status,
    String location,
    int order
) {
    public static SpouseRelation of(String personId, int order) {
        return new SpouseRelation(personId, null, null, null, null, order);
    }
}
