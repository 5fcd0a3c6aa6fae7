package io.fwaas.orchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "fwaas.orchestrator")
public class OrchestratorProperties {

    private final String host;
    private final int maxFirewallsPerTenant;
    private final Rabbit rabbit;
    private final NetworkService networkService;
    private final DeletionLedger deletionLedger;

    public OrchestratorProperties(@NotBlank String host,
                                  @NotNull @Min(0) Integer maxFirewallsPerTenant,
                                  @Valid Rabbit rabbit,
                                  @Valid NetworkService networkService,
                                  @Valid DeletionLedger deletionLedger) {
        this.host = requireNonBlank(host, "host");
        this.maxFirewallsPerTenant = requireNonNegative(maxFirewallsPerTenant, "maxFirewallsPerTenant");
        this.rabbit = Objects.requireNonNull(rabbit, "rabbit");
        this.networkService = Objects.requireNonNull(networkService, "networkService");
        this.deletionLedger = Objects.requireNonNull(deletionLedger, "deletionLedger");
    }

    public String getHost() {
        return host;
    }

    /**
     * Firewalls a single tenant may own; {@code 0} disables the quota.
     */
    public int getMaxFirewallsPerTenant() {
        return maxFirewallsPerTenant;
    }

    public Rabbit getRabbit() {
        return rabbit;
    }

    public NetworkService getNetworkService() {
        return networkService;
    }

    public DeletionLedger getDeletionLedger() {
        return deletionLedger;
    }

    @Validated
    public static final class Rabbit {

        private final String agentExchange;
        private final String pluginQueue;

        public Rabbit(@NotBlank String agentExchange, @NotBlank String pluginQueue) {
            this.agentExchange = requireNonBlank(agentExchange, "agentExchange");
            this.pluginQueue = requireNonBlank(pluginQueue, "pluginQueue");
        }

        public String getAgentExchange() {
            return agentExchange;
        }

        public String getPluginQueue() {
            return pluginQueue;
        }
    }

    @Validated
    public static final class NetworkService {

        private final String url;
        private final @Valid Http http;

        public NetworkService(@NotBlank String url, @Valid Http http) {
            String trimmed = requireNonBlank(url, "url").trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            this.url = requireNonBlank(trimmed, "url");
            this.http = Objects.requireNonNull(http, "http");
        }

        public String getUrl() {
            return url;
        }

        public Http getHttp() {
            return http;
        }
    }

    @Validated
    public static final class Http {

        private final Duration connectTimeout;
        private final Duration readTimeout;

        public Http(@NotNull Duration connectTimeout, @NotNull Duration readTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }
    }

    @Validated
    public static final class DeletionLedger {

        private final Duration ttl;
        private final int capacity;

        public DeletionLedger(@NotNull Duration ttl, @NotNull @Min(1) Integer capacity) {
            this.ttl = Objects.requireNonNull(ttl, "ttl");
            if (ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("ttl must be positive");
            }
            this.capacity = requireNonNegative(capacity, "capacity");
            if (this.capacity == 0) {
                throw new IllegalArgumentException("capacity must be positive");
            }
        }

        public Duration getTtl() {
            return ttl;
        }

        public int getCapacity() {
            return capacity;
        }
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    private static int requireNonNegative(Integer value, String name) {
        if (value == null || value < 0) {
            throw new IllegalArgumentException(name + " must be zero or positive");
        }
        return value;
    }
}
