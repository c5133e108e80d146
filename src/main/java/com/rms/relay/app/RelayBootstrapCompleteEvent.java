package com.rms.relay.app;

/**
 * =====================================================================
 * RelayBootstrapCompleteEvent
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Signals that persisted relays have been restored and the cloud
 * callbacks are live.
 *
 *   ┌──────────────────────┐
 *   │ restore persisted    │
 *   └─────────┬────────────┘
 *             ▼
 *   ┌──────────────────────┐
 *   │ wire cloud callbacks │
 *   └─────────┬────────────┘
 *             │ publishes
 *             ▼
 *   RelayBootstrapCompleteEvent
 *
 * Published exactly once by {@link RelayBootstrapper}, synchronously on
 * the startup thread.
 *
 * @param restoredRelays number of relays restored from the snapshot
 */
public record RelayBootstrapCompleteEvent(int restoredRelays) {
}
