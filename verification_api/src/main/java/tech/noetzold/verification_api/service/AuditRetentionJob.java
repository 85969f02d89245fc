package tech.noetzold.verification_api.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Slf4j
@Component
@RequiredArgsConstructor
public class AuditRetentionJob {

    private final AuditService auditService;

    @Scheduled(cron = "${verification.audit.cleanup-cron:0 0 * * * *}")
    public void purge() {
        try {
            auditService.purgeExpired(Instant.now());
        } catch (Exception e) {
            log.error("Audit retention sweep failed: {}", e.getMessage(), e);
        }
    }
}
