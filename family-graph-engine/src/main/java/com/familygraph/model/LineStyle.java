package com.familygraph.model;

public enum LineStyle {
    SOLID,
    DASHED,
    DOTTED
}
