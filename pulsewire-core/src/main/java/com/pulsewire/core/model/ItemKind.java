package com.pulsewire.core.model;

/**
 * Closed set of item variants. Engagement is normalised within a kind.
 */
public enum ItemKind {
    NEWS,
    FINANCIAL,
    SOCIAL,
    AWARD,
    DEAL
}
