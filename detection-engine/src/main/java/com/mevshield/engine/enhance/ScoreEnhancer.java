package com.mevshield.engine.enhance;

import com.mevshield.common.model.Opportunity;

import java.util.List;

/**
 * Scoring adjustment stage applied to fresh candidates before they are sealed
 * into the ledger.
 *
 * <p>Current implementation: {@link CorrelationScoreEnhancer} (in-process correlation
 * rules). An external reasoning backend can be plugged in by registering a different
 * bean; the cycle service only depends on this interface.
 *
 * <p>Implementations may throw; the caller then keeps the unmodified candidate.
 */
public interface ScoreEnhancer {

    /**
     * @param candidate freshly produced opportunity
     * @param history   ledger entries for the same pool inside the correlation window,
     *                  oldest first, never containing {@code candidate} itself
     * @return the adjusted opportunity, or {@code candidate} when nothing applies
     */
    Opportunity enhance(Opportunity candidate, List<Opportunity> history);
}
