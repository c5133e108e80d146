package com.rms.relay.nats.config;

import com.rms.relay.nats.local.TextEncodingPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Relay configuration bound from {@code cloudrelay.*}.
 *
 * <h2>Layout</h2>
 * <pre>
 * cloudrelay:
 *   cloud:
 *     connection-string: Server=nats://cloud:4222;DeviceId=robot-01;Token=...
 *     connect-timeout: 5s
 *     ping-interval: 2m
 *     reconnect-wait: 2s
 *     twin-fetch-timeout: 5s
 *   local:
 *     nats-url: nats://localhost:4222
 *     queue-size: 1000
 *     service-prefix: svc
 *     service-timeout: 30s
 *     no-echo: true
 *     text-encoding: UTF8_REPLACE
 *     message-types:
 *       "[acme_msgs/Battery]": { voltage: float64, percentage: float32 }
 *   command:
 *     success-status: 200
 *     failure-status: 500
 *     timeout: 0s
 *   persistence:
 *     file: ./data/relays.json
 *   forwarding:
 *     buffer-size: 1024
 * </pre>
 *
 * <h2>Fatal configuration</h2>
 * The connection string is the only mandatory setting. A missing value fails
 * validation and the application exits before any relay is established.
 */
@Validated
@ConfigurationProperties(prefix = "cloudrelay")
public class CloudRelayProperties {

    @Valid
    private Cloud cloud = new Cloud();

    @Valid
    private Local local = new Local();

    @Valid
    private Command command = new Command();

    @Valid
    private Persistence persistence = new Persistence();

    @Valid
    private Forwarding forwarding = new Forwarding();

    public Cloud getCloud() { return cloud; }
    public void setCloud(Cloud cloud) { this.cloud = cloud; }

    public Local getLocal() { return local; }
    public void setLocal(Local local) { this.local = local; }

    public Command getCommand() { return command; }
    public void setCommand(Command command) { this.command = command; }

    public Persistence getPersistence() { return persistence; }
    public void setPersistence(Persistence persistence) { this.persistence = persistence; }

    public Forwarding getForwarding() { return forwarding; }
    public void setForwarding(Forwarding forwarding) { this.forwarding = forwarding; }

    /**
     * Cloud endpoint.
     */
    public static class Cloud {

        /**
         * {@code Server=...;DeviceId=...[;Token=...][;User=...;Password=...][;Creds=...]}.
         * See {@link ConnectionString}.
         */
        @NotBlank(message = "cloudrelay.cloud.connection-string is required")
        private String connectionString;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration pingInterval = Duration.ofMinutes(2);

        @NotNull
        private Duration reconnectWait = Duration.ofSeconds(2);

        /** Wait for the initial full desired-state fetch; 0 disables the fetch. */
        @NotNull
        private Duration twinFetchTimeout = Duration.ofSeconds(5);

        public String getConnectionString() { return connectionString; }
        public void setConnectionString(String connectionString) { this.connectionString = connectionString; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getPingInterval() { return pingInterval; }
        public void setPingInterval(Duration pingInterval) { this.pingInterval = pingInterval; }

        public Duration getReconnectWait() { return reconnectWait; }
        public void setReconnectWait(Duration reconnectWait) { this.reconnectWait = reconnectWait; }

        public Duration getTwinFetchTimeout() { return twinFetchTimeout; }
        public void setTwinFetchTimeout(Duration twinFetchTimeout) { this.twinFetchTimeout = twinFetchTimeout; }
    }

    /**
     * Local bus.
     */
    public static class Local {

        @NotBlank
        private String natsUrl = "nats://localhost:4222";

        /** Outgoing queue bound for messages republished on the local bus. */
        @Min(1)
        private int queueSize = 1000;

        /** Subject prefix for local services; blank means none. */
        private String servicePrefix = "svc";

        @NotNull
        private Duration serviceTimeout = Duration.ofSeconds(30);

        /** Suppress delivery of the relay's own publishes back to its subscriptions. */
        private boolean noEcho = true;

        @NotNull
        private TextEncodingPolicy textEncoding = TextEncodingPolicy.UTF8_REPLACE;

        /** Extra message types: type name → (field → kind). */
        private Map<String, Map<String, String>> messageTypes = new LinkedHashMap<>();

        public String getNatsUrl() { return natsUrl; }
        public void setNatsUrl(String natsUrl) { this.natsUrl = natsUrl; }

        public int getQueueSize() { return queueSize; }
        public void setQueueSize(int queueSize) { this.queueSize = queueSize; }

        public String getServicePrefix() { return servicePrefix; }
        public void setServicePrefix(String servicePrefix) { this.servicePrefix = servicePrefix; }

        public Duration getServiceTimeout() { return serviceTimeout; }
        public void setServiceTimeout(Duration serviceTimeout) { this.serviceTimeout = serviceTimeout; }

        public boolean isNoEcho() { return noEcho; }
        public void setNoEcho(boolean noEcho) { this.noEcho = noEcho; }

        public TextEncodingPolicy getTextEncoding() { return textEncoding; }
        public void setTextEncoding(TextEncodingPolicy textEncoding) { this.textEncoding = textEncoding; }

        public Map<String, Map<String, String>> getMessageTypes() { return messageTypes; }
        public void setMessageTypes(Map<String, Map<String, String>> messageTypes) { this.messageTypes = messageTypes; }
    }

    /**
     * Command responses.
     */
    public static class Command {

        private int successStatus = 200;

        private int failureStatus = 500;

        /** Bound on the wait for a local service result; 0 waits forever. */
        @NotNull
        private Duration timeout = Duration.ZERO;

        public int getSuccessStatus() { return successStatus; }
        public void setSuccessStatus(int successStatus) { this.successStatus = successStatus; }

        public int getFailureStatus() { return failureStatus; }
        public void setFailureStatus(int failureStatus) { this.failureStatus = failureStatus; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    /**
     * Relay-state snapshot file.
     */
    public static class Persistence {

        @NotBlank
        private String file = "./data/relays.json";

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
    }

    /**
     * Local → cloud forwarding queue.
     */
    public static class Forwarding {

        @Min(1)
        private int bufferSize = 1024;

        public int getBufferSize() { return bufferSize; }
        public void setBufferSize(int bufferSize) { this.bufferSize = bufferSize; }
    }
}
