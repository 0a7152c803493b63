package com.venuepulse.common.model;

/**
 * What a scoring model contributes: a sentiment polarity or an emotion vector.
 */
public enum ModelRole {
    SENTIMENT,
    EMOTION
}
