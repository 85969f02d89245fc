package tech.noetzold.verification_api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tech.noetzold.verification_api.model.AuditEntry;
import tech.noetzold.verification_api.model.VerificationRecord;
import tech.noetzold.verification_api.repository.VerificationRecordRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Best-effort, append-only audit trail. A write that keeps failing is logged and dropped; the
 * verification result it describes has already been returned.
 */
@Slf4j
@Service
public class AuditService {

    private final VerificationRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final Duration retention;
    private final int maxAttempts;
    private final Duration retryDelay;

    public AuditService(VerificationRecordRepository repository,
                        ObjectMapper objectMapper,
                        @Value("${verification.audit.retention-days:30}") long retentionDays,
                        @Value("${verification.audit.max-attempts:3}") int maxAttempts,
                        @Value("${verification.audit.retry-delay-ms:200}") long retryDelayMs) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.retention = Duration.ofDays(retentionDays);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelay = Duration.ofMillis(retryDelayMs);
    }

    @Async("auditExecutor")
    public CompletableFuture<Void> record(AuditEntry entry) {
        write(entry);
        return CompletableFuture.completedFuture(null);
    }

    boolean write(AuditEntry entry) {
        VerificationRecord rec;
        try {
            rec = toRecord(entry);
        } catch (RuntimeException e) {
            log.error("Audit record for verification {} dropped: cannot build record: {}",
                    entry.verificationId(), e.getMessage(), e);
            return false;
        }
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                repository.save(rec);
                log.debug("Audit record stored for verification {}", entry.verificationId());
                return true;
            } catch (Exception e) {
                log.warn("Audit write attempt {}/{} failed for verification {}: {}",
                        attempt, maxAttempts, entry.verificationId(), e.getMessage());
                if (attempt < maxAttempts && !sleepQuietly(retryDelay.multipliedBy(attempt))) {
                    break;
                }
            }
        }
        log.error("Audit record for verification {} dropped after {} attempt(s)", entry.verificationId(), maxAttempts);
        return false;
    }

    @Transactional
    public long purgeExpired(Instant now) {
        long removed = repository.deleteByExpiresAtBefore(now);
        if (removed > 0) {
            log.info("Removed {} expired verification records", removed);
        }
        return removed;
    }

    private VerificationRecord toRecord(AuditEntry entry) {
        return VerificationRecord.builder()
                .verificationId(entry.verificationId())
                .ontologyName(entry.ontologyName())
                .ontologyVersion(entry.ontologyVersion())
                .verified(entry.verified())
                .violationCount(entry.violations().size())
                .violationsJson(objectMapper.valueToTree(entry.violations()))
                .inputDigest(entry.inputDigest())
                .certificateDigest(entry.certificateDigest())
                .certificateSignature(entry.certificateSignature())
                .executionTimeMs(entry.executionTimeMs())
                .createdAt(entry.createdAt())
                .expiresAt(entry.createdAt().plus(retention))
                .build();
    }

    private boolean sleepQuietly(Duration d) {
        if (d.isZero()) return true;
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
