package com.familygraph.model;

public enum RelationshipCategory {
    FAMILY,
    LEGAL,
    RELIGIOUS,
    PROFESSIONAL,
    SOCIAL,
    FEUDAL,
    DNA
}
