package com.mevshield.engine.detector;

import com.mevshield.common.model.Opportunity;
import com.mevshield.common.model.OpportunityKind;
import com.mevshield.engine.snapshot.PoolSnapshot;

import java.time.Instant;
import java.util.Optional;

/**
 * Stateless classifier mapping one pool snapshot to zero or one candidate.
 *
 * <p>Implementations must be pure: no shared mutable state, no I/O, safe to call
 * concurrently for different pools and independent of the other detectors.
 */
public interface OpportunityDetector {

    Optional<Opportunity> detect(PoolSnapshot pool, long blockReference, Instant detectedAt);

    OpportunityKind kind();

    default String detectorName() {
        return getClass().getSimpleName();
    }
}
