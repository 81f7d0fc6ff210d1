package com.familygraph.model;

public enum TreeType {
    ANCESTORS,
    DESCENDANTS,
    FULL
}
