package com.rms.relay.app;

import com.rms.relay.core.command.CommandBridge;
import com.rms.relay.core.model.ChannelDescriptor;
import com.rms.relay.core.port.CloudChannel;
import com.rms.relay.core.port.RelayStateStore;
import com.rms.relay.core.reconcile.DesiredStateReconciler;
import com.rms.relay.core.relay.InboundMessageRouter;
import com.rms.relay.core.relay.RelayRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * =====================================================================
 * RelayBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Brings the relay to life in a fixed order:
 *
 *   1. read the persisted snapshot and replay it into the registry
 *   2. register the cloud callbacks (desired state, inbound, commands)
 *   3. start the cloud channel
 *   4. publish {@link RelayBootstrapCompleteEvent}
 *
 * Step 1 finishes before any cloud callback can fire, so a restored
 * relay is never raced by a desired-state push.
 *
 * DESIRED STATE
 * -------------
 * Each push is reconciled, then the resulting relay list is reported
 * back to the cloud. A failed report is logged only.
 */
@Component
@ConditionalOnProperty(prefix = "cloudrelay.bootstrap", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RelayBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RelayBootstrapper.class);

    private final RelayStateStore store;
    private final RelayRegistry registry;
    private final DesiredStateReconciler reconciler;
    private final InboundMessageRouter router;
    private final CommandBridge bridge;
    private final CloudChannel cloud;
    private final ApplicationEventPublisher publisher;

    public RelayBootstrapper(RelayStateStore store,
                             RelayRegistry registry,
                             DesiredStateReconciler reconciler,
                             InboundMessageRouter router,
                             CommandBridge bridge,
                             CloudChannel cloud,
                             ApplicationEventPublisher publisher) {
        this.store = store;
        this.registry = registry;
        this.reconciler = reconciler;
        this.router = router;
        this.bridge = bridge;
        this.cloud = cloud;
        this.publisher = publisher;
    }

    @Override
    public void run(ApplicationArguments args) {
        int restored = restore();

        cloud.onDesiredState(doc -> {
            reconciler.reconcile(doc);
            reportState();
        });
        cloud.onInboundMessage(router::route);
        cloud.onCommand(bridge::invoke);
        cloud.start();

        publisher.publishEvent(new RelayBootstrapCompleteEvent(restored));
        log.info("Relay bootstrap complete (restored={}, relays={})", restored, registry.size());
    }

    int restore() {
        List<ChannelDescriptor> persisted = store.read().orElse(List.of());
        if (persisted.isEmpty()) {
            return 0;
        }
        return registry.restore(persisted);
    }

    private void reportState() {
        try {
            cloud.reportState(reconciler.reportedState());
        } catch (RuntimeException e) {
            log.warn("Reporting relay state to cloud failed: {}", e.toString());
        }
    }
}
