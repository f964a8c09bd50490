package com.fleetload.scaler.refresh;

/**
 * Phase of the refresh cycle currently running. The loop cycles
 * {@code IDLE -> COLLECTING -> REDUCING -> PUBLISHING -> IDLE} until shutdown.
 */
public enum RefreshState {
    IDLE,
    COLLECTING,
    REDUCING,
    PUBLISHING
}
