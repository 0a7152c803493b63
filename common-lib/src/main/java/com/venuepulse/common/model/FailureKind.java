package com.venuepulse.common.model;

public enum FailureKind {
    MODEL_UNAVAILABLE,
    MODEL_TIMEOUT,
    MODEL_ERROR
}
