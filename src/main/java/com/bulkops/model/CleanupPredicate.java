package com.bulkops.model;

/**
 * Deletion predicate for records that could not be rolled back in-process.
 *
 * @param objectName object to clean
 * @param predicate  filter expression, e.g. {@code Id IN ('001A','001B')}
 * @param query      full selection query for the records to delete
 * @param idCount    number of explicit ids in the predicate, 0 for pattern predicates
 */
public record CleanupPredicate(String objectName, String predicate, String query, int idCount) {}
