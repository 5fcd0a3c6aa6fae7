package io.fwaas.orchestrator.infra;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fwaas.orchestrator.config.OrchestratorProperties;
import io.fwaas.orchestrator.domain.RouterDirectory;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client listing a tenant's routers from the network service.
 */
@Component
public class NetworkServiceRouterDirectory implements RouterDirectory {
    private static final Logger log = LoggerFactory.getLogger(NetworkServiceRouterDirectory.class);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final TypeReference<List<RouterEntry>> ROUTER_LIST = new TypeReference<>() {
    };

    private final HttpClient http;
    private final ObjectMapper json;
    private final String baseUrl;
    private final Duration requestTimeout;

    public NetworkServiceRouterDirectory(ObjectMapper json, OrchestratorProperties properties) {
        this.json = Objects.requireNonNull(json, "json");
        OrchestratorProperties.NetworkService network = properties.getNetworkService();
        Objects.requireNonNull(network, "networkService");
        this.http = HttpClient.newBuilder()
            .connectTimeout(resolveTimeout(network.getHttp().getConnectTimeout(), DEFAULT_CONNECT_TIMEOUT))
            .build();
        this.baseUrl = network.getUrl();
        this.requestTimeout = resolveTimeout(network.getHttp().getReadTimeout(), DEFAULT_REQUEST_TIMEOUT);
    }

    @Override
    public List<String> listRoutersForTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        String url = baseUrl + "/routers?tenant_id=" + URLEncoder.encode(tenantId, StandardCharsets.UTF_8);
        HttpResponse<String> resp = sendGet(url, "routers of tenant " + tenantId);
        try {
            List<RouterEntry> routers = json.readValue(resp.body(), ROUTER_LIST);
            return routers.stream()
                .filter(router -> tenantId.equals(router.tenantId()))
                .map(RouterEntry::id)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        } catch (IOException e) {
            throw new IllegalStateException("Malformed router list for tenant " + tenantId, e);
        }
    }

    private HttpResponse<String> sendGet(String url, String label) {
        log.debug("fetching {} from {}", label, url);
        HttpRequest req = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Accept", "application/json")
            .timeout(requestTimeout)
            .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new IllegalStateException(label + " fetch failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(label + " fetch interrupted", e);
        }
        log.debug("{} response status {} length {}", label, resp.statusCode(),
            resp.body() != null ? resp.body().length() : 0);
        if (resp.statusCode() != 200) {
            throw new IllegalStateException(label + " fetch status " + resp.statusCode());
        }
        return resp;
    }

    private static Duration resolveTimeout(Duration candidate, Duration fallback) {
        if (candidate == null || candidate.isZero() || candidate.isNegative()) {
            return fallback;
        }
        return candidate;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RouterEntry(@JsonProperty("id") String id, @JsonProperty("tenant_id") String tenantId) {
    }
}
