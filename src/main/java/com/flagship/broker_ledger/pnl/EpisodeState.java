package com.flagship.broker_ledger.pnl;

/**
 * Where an account stands against its capital.
 *
 * LOSS and PROFIT never follow each other directly; an episode has to be
 * settled back to NEUTRAL first.
 */
public enum EpisodeState {
    NEUTRAL,
    LOSS,
    PROFIT
}
