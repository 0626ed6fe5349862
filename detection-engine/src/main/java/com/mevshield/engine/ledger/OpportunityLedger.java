package com.mevshield.engine.ledger;

import com.mevshield.common.model.Opportunity;
import com.mevshield.engine.config.MevShieldProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, insertion-ordered store of accepted opportunities.
 *
 * <p>Once {@code mevshield.ledger.capacity} is exceeded the oldest entries are evicted
 * first (FIFO, not time based). One {@link ReentrantLock} guards every read and write,
 * so cycle appends, external inserts, correlation lookups and stats queries never
 * observe a half-applied batch.
 */
@Component
public class OpportunityLedger {

    private static final Logger log = LoggerFactory.getLogger(OpportunityLedger.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<Opportunity> entries;
    private final int capacity;

    public OpportunityLedger(MevShieldProperties properties) {
        this.capacity = properties.getLedger().getCapacity();
        this.entries  = new ArrayDeque<>(capacity + 1);
    }

    public void append(Opportunity opportunity) {
        appendAll(List.of(opportunity));
    }

    /** Appends the batch atomically, then evicts down to capacity. */
    public void appendAll(Collection<Opportunity> batch) {
        if (batch.isEmpty()) {
            return;
        }
        int evicted = 0;
        lock.lock();
        try {
            entries.addAll(batch);
            while (entries.size() > capacity) {
                entries.pollFirst();
                evicted++;
            }
        } finally {
            lock.unlock();
        }
        if (evicted > 0) {
            log.debug("LEDGER_EVICTED count={} capacity={}", evicted, capacity);
        }
    }

    /**
     * Same-pool entries with {@code detectedAt} in {@code [reference - window, reference]},
     * oldest first.
     */
    public List<Opportunity> recentForPool(String poolId, Instant reference, Duration window) {
        Instant from = reference.minus(window);
        List<Opportunity> result = new ArrayList<>();
        lock.lock();
        try {
            for (Opportunity o : entries) {
                if (o.poolId().equals(poolId)
                        && !o.detectedAt().isBefore(from)
                        && !o.detectedAt().isAfter(reference)) {
                    result.add(o);
                }
            }
        } finally {
            lock.unlock();
        }
        return result;
    }

    /** Newest first, optionally filtered by pool; {@code poolId == null} means all pools. */
    public List<Opportunity> latest(String poolId, int limit) {
        List<Opportunity> result = new ArrayList<>(Math.min(limit, capacity));
        lock.lock();
        try {
            Iterator<Opportunity> it = entries.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                Opportunity o = it.next();
                if (poolId == null || poolId.equals(o.poolId())) {
                    result.add(o);
                }
            }
        } finally {
            lock.unlock();
        }
        return result;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
