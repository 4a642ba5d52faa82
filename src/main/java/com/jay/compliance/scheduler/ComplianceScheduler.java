package com.jay.compliance.scheduler;

import com.jay.compliance.forget.ForgetService;
import com.jay.compliance.layer3_cache.LocalKeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background housekeeping.
 *
 *   Forget requests : every forget.process_interval_ms — apply pending removals
 *   Local store     : every 5 minutes — drop expired in-process entries
 */
@Slf4j
@Component
public class ComplianceScheduler {

    private final ForgetService forgetService;
    private final LocalKeyValueStore localStore;

    public ComplianceScheduler(ForgetService forgetService, @Qualifier("localStore") LocalKeyValueStore localStore) {
        this.forgetService = forgetService;
        this.localStore = localStore;
    }

    @Scheduled(fixedDelayString = "#{@complianceConfig.forget().processIntervalMs}", initialDelay = 10_000)
    public void processForgetRequests() {
        try {
            forgetService.processPending();
        } catch (Exception e) {
            log.error("Forget request processing failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelay = 300_000, initialDelay = 300_000)
    public void purgeLocalStore() {
        int removed = localStore.purgeExpired();
        if (removed > 0) log.debug("Purged {} expired local store entries, {} remain", removed, localStore.size());
    }
}
