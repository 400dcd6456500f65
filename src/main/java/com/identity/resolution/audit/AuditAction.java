package com.identity.resolution.audit;

/**
 * Types of auditable actions in the identity resolution system.
 */
public enum AuditAction {
    RUN_STARTED,
    RUN_COMMITTED,
    RUN_ABORTED,
    MENTION_REJECTED,
    REVIEW_REQUESTED,
    REVIEW_APPROVED,
    REVIEW_REJECTED,
    ENTITY_SUPPRESSED,
    SUPPRESSION_LIFTED
}
