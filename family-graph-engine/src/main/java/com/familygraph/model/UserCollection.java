package com.familygraph.model;

import java.util.List;

public record UserCollection(String name, List<PersonNode> people) {

    public UserCollection {
        people = List.copyOf(people);
    }

    public int size() {
        return people.size();
    }
}
