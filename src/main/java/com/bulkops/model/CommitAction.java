package com.bulkops.model;

/**
 * What the backend actually did to a row it committed.
 */
public enum CommitAction {
    CREATED,
    UPDATED,
    DELETED,
    RESTORED,
    NONE
}
