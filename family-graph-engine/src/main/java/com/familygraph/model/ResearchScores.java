package com.familygraph.model;

/**
 * Research-tracking figures for one person, supplied from outside the engine.
 */
public record ResearchScores(Integer coverage, Integer conflicts) {}
