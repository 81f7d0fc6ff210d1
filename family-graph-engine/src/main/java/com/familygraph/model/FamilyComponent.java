package com.familygraph.model;

import java.util.List;

/**
 * A maximal set of people joined by parent, spouse or child links.
 *
 * @param name           most frequent family label among members, or {@link #UNNAMED}
 * @param representative earliest-born member
 */
public record FamilyComponent(
    int index,
    String name,
    PersonNode representative,
    List<PersonNode> people
) {
    public static final String UNNAMED = "Unnamed";

    public FamilyComponent {
        people = List.copyOf(people);
    }

    public int size() {
        return people.size();
    }

    public boolean isNamed() {
        return !UNNAMED.equals(name);
    }
}
