package com.bulkops.model;

/**
 * A rule that fired during scoring.
 */
public record Finding(String ruleId, RubricCategory category, int delta, String message) {}
