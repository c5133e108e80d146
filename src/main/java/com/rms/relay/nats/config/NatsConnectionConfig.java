package com.rms.relay.nats.config;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration that wires up the two NATS connections:
 * <ul>
 *   <li>{@code localConnection}: the local bus the relays bind to.</li>
 *   <li>{@code cloudConnection}: the device's cloud endpoint, addressed by the
 *       connection string.</li>
 * </ul>
 *
 * <h2>Connection strategy</h2>
 * <ol>
 *   <li>Parse the cloud connection string first. A missing or malformed value
 *       fails the context here, before any relay is bound.</li>
 *   <li>Build {@link Options} from properties (timeouts, queue size, echo, auth, TLS).</li>
 *   <li>Connect with unlimited reconnects; connection events are logged.</li>
 * </ol>
 *
 * <h2>Security note</h2>
 * Secrets are never logged; user names are masked and tokens omitted.
 */
@Configuration
@EnableConfigurationProperties(CloudRelayProperties.class)
public class NatsConnectionConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsConnectionConfig.class);

    /**
     * The parsed connection string. Startup stops here if it cannot be resolved.
     */
    @Bean
    public ConnectionString cloudConnectionString(CloudRelayProperties props) {
        ConnectionString cs = ConnectionString.parse(props.getCloud().getConnectionString());
        log.info("Cloud endpoint resolved: {}", cs);
        return cs;
    }

    @Bean(name = "localConnection", destroyMethod = "close")
    public Connection localConnection(CloudRelayProperties props) throws Exception {
        Connection c = Nats.connect(localOptions(props));
        log.info("Connected to local bus (url={}, queueSize={}, noEcho={})",
                props.getLocal().getNatsUrl(), props.getLocal().getQueueSize(), props.getLocal().isNoEcho());
        return c;
    }

    @Bean(name = "cloudConnection", destroyMethod = "close")
    public Connection cloudConnection(CloudRelayProperties props,
                                      @Qualifier("cloudConnectionString") ConnectionString cs) throws Exception {
        Connection c = Nats.connect(cloudOptions(props, cs));
        log.info("Connected to cloud (server={}, device={}, tls={}, user={})",
                cs.server(), cs.deviceId(), cs.tls(), cs.user() == null ? "" : ConnectionString.mask(cs.user()));
        return c;
    }

    static Options localOptions(CloudRelayProperties props) {
        CloudRelayProperties.Local local = props.getLocal();
        Options.Builder b = Options.builder()
                .server(local.getNatsUrl())
                .connectionName("cloud-relay-local")
                .maxMessagesInOutgoingQueue(local.getQueueSize())
                .maxReconnects(-1)
                .connectionListener(logging("local"));
        if (local.isNoEcho()) {
            // a BIDIRECTIONAL relay must not receive its own republished messages
            b.noEcho();
        }
        return b.build();
    }

    static Options cloudOptions(CloudRelayProperties props, ConnectionString cs) throws Exception {
        CloudRelayProperties.Cloud cloud = props.getCloud();
        Options.Builder b = Options.builder()
                .server(cs.server())
                .connectionName("cloud-relay-" + cs.deviceId())
                .connectionTimeout(cloud.getConnectTimeout())
                .pingInterval(cloud.getPingInterval())
                .reconnectWait(cloud.getReconnectWait())
                .maxReconnects(-1)
                .connectionListener(logging("cloud"));

        if (cs.tls() && !cs.server().toLowerCase().startsWith("tls://")) {
            b.secure();
        }
        if (cs.token() != null) {
            b.token(cs.token().toCharArray());
        }
        if (cs.user() != null) {
            b.userInfo(cs.user(), cs.password() == null ? "" : cs.password());
        }
        if (cs.creds() != null) {
            b.authHandler(Nats.credentials(cs.creds()));
        }
        return b.build();
    }

    private static ConnectionListener logging(String name) {
        return (conn, type) -> log.info("NATS {} connection event: {}", name, type);
    }
}
