package com.familygraph.model;

/**
 * Traversal options.
 *
 * @param maxGenerations    0 means unbounded
 * @param collectionFilter  when set, only people in this user collection are kept
 * @param placeFilter       when set, only people associated with the place are kept
 */
public record TreeOptions(
    TreeType treeType,
    int maxGenerations,
    boolean includeSpouses,
    boolean includeStepParents,
    boolean includeAdoptiveParents,
    boolean includeGuardians,
    String collectionFilter,
    PlaceFilter placeFilter
) {
    public TreeOptions {
        treeType = treeType != null ? treeType : TreeType.FULL;
        maxGenerations = Math.max(0, maxGenerations);
    }

    public static TreeOptions of(TreeType treeType) {
        return new TreeOptions(treeType, 0, false, false, false, false, null, null);
    }

    public TreeOptions withMaxGenerations(int generations) {
        return new TreeOptions(treeType, generations, includeSpouses, includeStepParents,
            includeAdoptiveParents, includeGuardians, collectionFilter, placeFilter);
    }

    public TreeOptions withSpouses(boolean include) {
        return new TreeOptions(treeType, maxGenerations, include, includeStepParents,
            includeAdoptiveParents, includeGuardians, collectionFilter, placeFilter);
    }

    public TreeOptions withStepParents(boolean include) {
        return new TreeOptions(treeType, maxGenerations, includeSpouses, include,
            includeAdoptiveParents, includeGuardians, collectionFilter, placeFilter);
    }

    public TreeOptions withAdoptiveParents(boolean include) {
        return new TreeOptions(treeType, maxGenerations, includeSpouses, includeStepParents,
            include, includeGuardians, collectionFilter, placeFilter);
    }

    public TreeOptions withGuardians(boolean include) {
        return new TreeOptions(treeType, maxGenerations, includeSpouses, includeStepParents,
            includeAdoptiveParents, include, collectionFilter, placeFilter);
    }

    public TreeOptions withCollection(String collection) {
        return new TreeOptions(treeType, maxGenerations, includeSpouses, includeStepParents,
            includeAdoptiveParents, includeGuardians, collection, placeFilter);
    }

    public TreeOptions withPlace(PlaceFilter filter) {
        return new TreeOptions(treeType, maxGenerations, includeSpouses, includeStepParents,
            includeAdoptiveParents, includeGuardians, collectionFilter, filter);
    }

    public boolean isUnbounded() {
        return maxGenerations == 0;
    }

    /** Membership and place filters combined. */
    public boolean admits(PersonNode person) {
        if (collectionFilter != null && !collectionFilter.isBlank()
                && !collectionFilter.equals(person.collection())) {
            return false;
        }
        return placeFilter == null || placeFilter.matches(person);
    }
}
