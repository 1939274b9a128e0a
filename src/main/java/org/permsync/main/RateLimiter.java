package org.permsync.main;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caps the number of queries issued within a sliding window of timesteps.
 * Callers block until their queries fit.
 */
public class RateLimiter {
    private static Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private long queriesPerTimestep;
    private long timestepMs;

    private List<Long> times = new ArrayList<>();
    private Map<Long, Long> queryCounts = new HashMap<>();

    public RateLimiter(long queriesPerTimestep, long timestepMs) {
        if (queriesPerTimestep <= 0 || timestepMs <= 0) {
            throw new IllegalArgumentException(String.format("Invalid rate limit: %d queries per %d ms",
                                                             queriesPerTimestep, timestepMs));
        }

        this.queriesPerTimestep = queriesPerTimestep;
        this.timestepMs = timestepMs;
    }

    // Express an interest in running `count` queries.  Block until that's OK.
    public synchronized void wantQueries(long count) {
        if (count > queriesPerTimestep) {
            throw new IllegalArgumentException("Can't execute that many concurrent queries: " + count);
        }

        while ((queriesInLastTimestep() + count) > queriesPerTimestep) {
            logger.warn("Waiting for rate limiter to allow another {} queries", count);
            try {
                Thread.sleep(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for the rate limiter", e);
            }
        }

        recordQueries(count);
    }

    synchronized long queriesInLastTimestep() {
        long result = 0;
        long timestepStart = (System.currentTimeMillis() - timestepMs) / timestepMs;

        Iterator<Long> it = times.iterator();
        while (it.hasNext()) {
            long time = it.next();

            if (time < timestepStart) {
                // Expired
                it.remove();
                queryCounts.remove(time);
            } else {
                result += queryCounts.get(time);
            }
        }

        return result;
    }

    private void recordQueries(long count) {
        long now = System.currentTimeMillis() / timestepMs;

        if (times.contains(now)) {
            queryCounts.put(now, queryCounts.get(now) + count);
        } else {
            times.add(now);
            queryCounts.put(now, count);
        }
    }

    public void rateLimitHit(String system) {
        logger.warn("{} rate limit hit!", system);
    }
}
