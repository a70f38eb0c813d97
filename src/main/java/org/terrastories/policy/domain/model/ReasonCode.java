package org.terrastories.policy.domain.model;

/**
 * Closed set of reasons attached to every policy decision.
 *
 * <p>Callers switch on this exhaustively. Adding a value is a breaking change.
 */
public enum ReasonCode {

    /** All guards passed. */
    OK,

    /** Platform operators never touch community content. */
    SOVEREIGNTY_BLOCK,

    /** Actor and resource belong to different communities. */
    COMMUNITY_MISMATCH,

    /** Elder-only tier and the actor is neither elder nor admin. */
    ELDER_ONLY,

    /** Ceremonial content and the actor is neither elder nor admin. */
    CEREMONIAL_RESTRICTED,

    /** Modification of elder-approval content by a non-elder. */
    ELDER_APPROVAL_REQUIRED,

    /** The role is not eligible for the operation. */
    ROLE_INSUFFICIENT,

    /** An editor modifying content created by someone else. */
    NOT_CREATOR
}
