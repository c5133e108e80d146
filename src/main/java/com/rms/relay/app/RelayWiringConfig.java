package com.rms.relay.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.relay.core.command.CommandBridge;
import com.rms.relay.core.port.CloudChannel;
import com.rms.relay.core.port.LocalBus;
import com.rms.relay.core.port.RelayStateStore;
import com.rms.relay.core.reconcile.DesiredStateReconciler;
import com.rms.relay.core.relay.CloudForwarder;
import com.rms.relay.core.relay.InboundMessageRouter;
import com.rms.relay.core.relay.RelayRegistry;
import com.rms.relay.nats.cloud.CloudSubjects;
import com.rms.relay.nats.cloud.NatsCloudChannel;
import com.rms.relay.nats.config.CloudRelayProperties;
import com.rms.relay.nats.config.ConnectionString;
import com.rms.relay.nats.local.FieldKind;
import com.rms.relay.nats.local.MessageType;
import com.rms.relay.nats.local.MessageTypeRegistry;
import com.rms.relay.nats.local.NatsLocalBus;
import com.rms.relay.store.FileRelayStateStore;
import io.nats.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assembles the relay core on top of the NATS adapters.
 *
 * <p>The core classes carry no Spring annotations; this class is the only
 * place that knows which adapter backs which port.</p>
 */
@Configuration
public class RelayWiringConfig {

    private static final Logger log = LoggerFactory.getLogger(RelayWiringConfig.class);

    @Bean
    public MessageTypeRegistry messageTypeRegistry(CloudRelayProperties props) {
        MessageTypeRegistry registry = MessageTypeRegistry.withBuiltins();
        for (Map.Entry<String, Map<String, String>> t : props.getLocal().getMessageTypes().entrySet()) {
            Map<String, FieldKind> fields = new LinkedHashMap<>();
            t.getValue().forEach((field, kind) -> fields.put(field, FieldKind.parse(kind)));
            registry.register(new MessageType(t.getKey(), fields));
            log.info("Registered message type {} fields={}", t.getKey(), fields);
        }
        return registry;
    }

    @Bean
    public LocalBus localBus(@Qualifier("localConnection") Connection connection,
                             MessageTypeRegistry types,
                             ObjectMapper mapper,
                             CloudRelayProperties props) {
        CloudRelayProperties.Local local = props.getLocal();
        return new NatsLocalBus(connection, types, mapper, local.getTextEncoding(),
                local.getServicePrefix(), local.getServiceTimeout());
    }

    @Bean(destroyMethod = "close")
    public NatsCloudChannel cloudChannel(@Qualifier("cloudConnection") Connection connection,
                                         ConnectionString cs,
                                         ObjectMapper mapper,
                                         CloudRelayProperties props) {
        return new NatsCloudChannel(connection, new CloudSubjects(cs.deviceId()), mapper,
                props.getCloud().getTwinFetchTimeout(), Schedulers.boundedElastic());
    }

    @Bean(destroyMethod = "close")
    public CloudForwarder cloudForwarder(CloudChannel cloud, CloudRelayProperties props) {
        return new CloudForwarder(cloud, props.getForwarding().getBufferSize(), Schedulers.boundedElastic());
    }

    @Bean
    public RelayStateStore relayStateStore(CloudRelayProperties props, ObjectMapper mapper) {
        return new FileRelayStateStore(Path.of(props.getPersistence().getFile()), mapper);
    }

    @Bean(destroyMethod = "close")
    public RelayRegistry relayRegistry(LocalBus bus, CloudForwarder forwarder, RelayStateStore store) {
        return new RelayRegistry(bus, forwarder, store);
    }

    @Bean
    public DesiredStateReconciler desiredStateReconciler(RelayRegistry registry, ObjectMapper mapper) {
        return new DesiredStateReconciler(registry, mapper);
    }

    @Bean
    public InboundMessageRouter inboundMessageRouter(RelayRegistry registry) {
        return new InboundMessageRouter(registry);
    }

    @Bean
    public CommandBridge commandBridge(LocalBus bus, ObjectMapper mapper, CloudRelayProperties props) {
        CloudRelayProperties.Command c = props.getCommand();
        return new CommandBridge(bus, mapper, c.getSuccessStatus(), c.getFailureStatus(), c.getTimeout());
    }
}
