package com.identity.resolution.suppression;

import com.identity.resolution.audit.AuditAction;
import com.identity.resolution.audit.AuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Administrative operations on the suppression registry. Never called by the pipeline.
 */
public class SuppressionService {
    private static final Logger log = LoggerFactory.getLogger(SuppressionService.class);

    private final SuppressionRegistry registry;
    private final AuditService auditService;

    public SuppressionService(SuppressionRegistry registry, AuditService auditService) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
    }

    /**
     * Removes a mention from the registry so the next run re-evaluates it from scratch.
     * Member-level rules (protected marker, placeholder) still apply on that run.
     *
     * @throws IllegalArgumentException if adminId or reason is blank
     * @return true if the mention was suppressed
     */
    public boolean liftSuppression(String mentionId, String adminId, String reason) {
        Objects.requireNonNull(mentionId, "mentionId is required");
        if (adminId == null || adminId.isBlank()) {
            throw new IllegalArgumentException("adminId must not be blank");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A reason is required to lift a suppression");
        }

        boolean lifted = registry.lift(mentionId);
        auditService.record(AuditAction.SUPPRESSION_LIFTED, mentionId, adminId, Map.of(
                "reason", reason,
                "wasSuppressed", lifted
        ));
        log.warn("suppression.lifted mentionId={} adminId={} wasSuppressed={}", mentionId, adminId, lifted);
        return lifted;
    }

    public boolean isSuppressed(String mentionId) {
        return registry.isSuppressed(mentionId);
    }
}
