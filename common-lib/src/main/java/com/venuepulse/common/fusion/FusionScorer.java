package com.venuepulse.common.fusion;

import com.venuepulse.common.exception.EnsembleExhaustedException;
import com.venuepulse.common.model.ModelOutcome;

import java.util.List;

/**
 * Contract for reconciling per-model outcomes into one calibrated result.
 *
 * <p>Implementations must be stateless, free of side effects, and independent of the order
 * of {@code outcomes}.
 */
public interface FusionScorer {

    /**
     * @param outcomes every adapter outcome for one mention, successes and failures alike
     * @return the fused sentiment and, if any model emitted one, the emotion profile
     * @throws EnsembleExhaustedException when no sentiment model succeeded
     */
    FusionResult fuse(List<ModelOutcome> outcomes);
}
