package org.terrastories.policy.domain.model;

/**
 * Operations a caller can request on community content.
 */
public enum Operation {
    READ,
    WRITE,
    DELETE,
    CREATE
}
