package com.identity.resolution.core.model;

/**
 * Why an entity is withheld from public projections.
 */
public enum SuppressionReason {
    PROTECTED_MARKER,
    PLACEHOLDER_IDENTITY,
    PREVIOUSLY_SUPPRESSED,
    K_ANONYMITY
}
