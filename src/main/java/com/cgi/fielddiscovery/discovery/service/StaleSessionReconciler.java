package com.cgi.fielddiscovery.discovery.service;

import com.cgi.fielddiscovery.common.exception.PersistenceException;
import com.cgi.fielddiscovery.discovery.repository.DiscoverySessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Fails sessions that stopped reporting progress, such as runs lost with a worker restart.
 */
@Component
public class StaleSessionReconciler {
    private static final Logger log = LoggerFactory.getLogger(StaleSessionReconciler.class);

    static final String STALE_MESSAGE = "Session exceeded stale-progress threshold";

    private final DiscoverySessionRepository sessionRepository;
    private final long staleThresholdMinutes;

    public StaleSessionReconciler(DiscoverySessionRepository sessionRepository,
                                  @Value("${fielddiscovery.discovery.stale-threshold-minutes:30}") long staleThresholdMinutes) {
        this.sessionRepository = sessionRepository;
        this.staleThresholdMinutes = staleThresholdMinutes;
    }

    /**
     * Marks every pending or processing session without a recent update as failed.
     *
     * @return Number of sessions failed by this pass
     */
    @Scheduled(fixedDelayString = "${fielddiscovery.discovery.reconcile-interval-ms:300000}")
    public int reconcile() {
        LocalDateTime now = LocalDateTime.now();
        try {
            List<String> staleIds = sessionRepository.findStaleIds(now.minusMinutes(staleThresholdMinutes));
            int failed = 0;
            for (String id : staleIds) {
                if (sessionRepository.fail(id, STALE_MESSAGE, now)) {
                    failed++;
                    log.warn("Session {} marked failed: no progress for {} minutes", id, staleThresholdMinutes);
                }
            }
            return failed;
        } catch (PersistenceException e) {
            log.error("Stale session reconciliation failed: {}", e.getMessage());
            return 0;
        }
    }
}
