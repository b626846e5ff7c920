package com.reims.anomaly.model;

/**
 * CANDIDATE -> CONSENSUS -> {ACTIVE | SUPPRESSED}. ACTIVE and SUPPRESSED are terminal here;
 * resolution and acceptance happen downstream.
 */
public enum ConsensusState {
    CANDIDATE,
    CONSENSUS,
    ACTIVE,
    SUPPRESSED
}
