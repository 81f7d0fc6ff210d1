package com.familygraph.model;

public enum EdgeType {
    PARENT,
    SPOUSE,
    CHILD,
    RELATIONSHIP
}
