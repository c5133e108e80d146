package com.rms.relay.core.command;

/**
 * =====================================================================
 * CommandState
 * =====================================================================
 *
 * Lifecycle of one cloud command invocation.
 *
 *   RECEIVED ──dispatch──▶ DISPATCHED ──┬──▶ SUCCEEDED ──┐
 *                                       └──▶ FAILED ─────┴──▶ COMPLETED
 *
 * RECEIVED may go straight to FAILED when the arguments cannot be
 * decoded. SUCCEEDED and FAILED are terminal for the outcome; the first
 * one reached wins.
 */
public enum CommandState {
    RECEIVED,
    DISPATCHED,
    SUCCEEDED,
    FAILED,
    COMPLETED
}
