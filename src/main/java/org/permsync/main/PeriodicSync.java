package org.permsync.main;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Reruns full sync passes on a fixed interval until shut down.  Each pass
 * starts from scratch; the only state kept between passes is a count of
 * consecutive failures per group, used for alerting.
 */
public class PeriodicSync extends Thread {
    private static Logger logger = LoggerFactory.getLogger(PeriodicSync.class);

    private long pollIntervalMs;
    private long allowableFailures;
    private SyncOrchestrator orchestrator;

    private volatile boolean running = true;

    private Map<String, Long> failureCountsByGroupName = new HashMap<>();

    public PeriodicSync(long pollIntervalMs, long allowableFailures, SyncOrchestrator orchestrator) {
        super("periodic-sync");

        this.pollIntervalMs = pollIntervalMs;
        this.allowableFailures = allowableFailures;
        this.orchestrator = orchestrator;

        if (this.pollIntervalMs <= 0) {
            logger.warn("Bogus value for sync interval ({}).  Defaulting to one hour", this.pollIntervalMs);
            this.pollIntervalMs = 3600000;
        }
    }

    public void shutdown() {
        running = false;
        interrupt();
    }

    public void run() {
        while (running) {
            try {
                SyncReport report = orchestrator.runPass();
                recordFailures(report);
            } catch (Exception e) {
                Monitoring.recordException(e);
                logger.error("Caught an exception during sync pass: {}", e.getMessage(), e);
            }

            try {
                Thread.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                if (running) {
                    logger.info("Sync interval interrupted; starting the next pass early");
                }
            }
        }

        logger.info("Periodic sync stopped");
    }

    void recordFailures(SyncReport report) {
        for (SyncReport.GroupResult result : report.getGroupResults()) {
            if (result.isSuccessful()) {
                failureCountsByGroupName.remove(result.upstreamGroup);
                continue;
            }

            long failures = failureCountsByGroupName.merge(result.upstreamGroup, 1L, Long::sum);

            if (failures > allowableFailures) {
                logger.error("Group {} has failed {} passes in a row.  Last failure: {}",
                             result.upstreamGroup, failures, result.failureReason);
            }
        }
    }

    long consecutiveFailures(String upstreamGroup) {
        return failureCountsByGroupName.getOrDefault(upstreamGroup, 0L);
    }
}
