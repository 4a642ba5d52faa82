package com.jay.compliance.forget;

import com.jay.compliance.config.ComplianceConfig;
import com.jay.compliance.entity.ForgetRequest;
import com.jay.compliance.layer3_cache.ForgetTombstones;
import com.jay.compliance.layer3_cache.StoreUnavailableException;
import com.jay.compliance.layer6_audit.AuditLogger;
import com.jay.compliance.layer6_audit.PiiRedactor;
import com.jay.compliance.repository.ForgetRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Accepts removal requests and applies them asynchronously.
 *
 * submit()         — hash the identifier, persist a PENDING job, return it
 * processPending() — write a tombstone per job so cached profiles for the subject
 *                    are dropped on next read, then mark the job COMPLETED
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForgetService {

    private final ForgetRequestRepository repository;
    private final ForgetTombstones tombstones;
    private final PiiRedactor redactor;
    private final AuditLogger auditLogger;
    private final ComplianceConfig config;
    private final Clock clock;

    public ForgetRequest submit(String companyId) {
        String digits = companyId == null ? "" : companyId.replaceAll("\\s+", "");
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("companyId is required");
        }
        ForgetRequest saved = repository.save(ForgetRequest.builder()
            .subjectHash(redactor.hashIdentifier(digits))
            .status(ForgetRequest.Status.PENDING)
            .requestedAt(clock.instant())
            .build());
        auditLogger.forgetRequested(saved.getSubjectHash(), saved.getId());
        return saved;
    }

    /** @return number of jobs completed in this pass */
    public int processPending() {
        List<ForgetRequest> pending = repository.findByStatusOrderByIdAsc(
            ForgetRequest.Status.PENDING, PageRequest.of(0, config.forget().getBatchSize()));
        int done = 0;
        for (ForgetRequest job : pending) {
            Instant now = clock.instant();
            try {
                tombstones.record(job.getSubjectHash(), now);
            } catch (StoreUnavailableException e) {
                log.warn("Forget job {} left pending, store unavailable: {}", job.getId(), e.getMessage());
                continue;
            }
            job.setStatus(ForgetRequest.Status.COMPLETED);
            job.setCompletedAt(now);
            repository.save(job);
            done++;
        }
        if (done > 0) log.info("Processed {} forget request(s)", done);
        return done;
    }
}
