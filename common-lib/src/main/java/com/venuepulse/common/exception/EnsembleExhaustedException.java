package com.venuepulse.common.exception;

import java.util.List;

/**
 * No sentiment model succeeded for a mention, so there is nothing to fuse.
 */
public class EnsembleExhaustedException extends SentimentEngineException {
    private final List<String> failedModels;

    public EnsembleExhaustedException(List<String> failedModels) {
        super("All sentiment models failed: " + failedModels);
        this.failedModels = List.copyOf(failedModels);
    }

    public List<String> getFailedModels() {
        return failedModels;
    }
}
