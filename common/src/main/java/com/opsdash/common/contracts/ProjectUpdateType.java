package com.opsdash.common.contracts;

/**
 * Kind of change carried by a project.updated event.
 */
public enum ProjectUpdateType {
    PROGRESS,
    BUDGET,
    STATUS,
    OTHER
}
