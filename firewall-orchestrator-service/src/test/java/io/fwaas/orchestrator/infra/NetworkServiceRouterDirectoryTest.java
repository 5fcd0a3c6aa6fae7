package io.fwaas.orchestrator.infra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sun.net.httpserver.HttpServer;
import io.fwaas.orchestrator.OrchestratorTestProperties;
import io.fwaas.orchestrator.app.JacksonConfiguration;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NetworkServiceRouterDirectoryTest {

    private HttpServer server;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String body = "[]";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/routers", exchange -> {
            lastQuery.set(exchange.getRequestURI().getRawQuery());
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void returnsOnlyRoutersOwnedByTenant() {
        body = """
            [
              {"id": "r1", "tenant_id": "tenant-a", "name": "edge"},
              {"id": "r2", "tenant_id": "tenant-b"},
              {"id": "r3", "tenant_id": "tenant-a"}
            ]
            """;

        List<String> routers = directory().listRoutersForTenant("tenant-a");

        assertThat(routers).containsExactly("r1", "r3");
        assertThat(lastQuery.get()).isEqualTo("tenant_id=tenant-a");
    }

    @Test
    void encodesTenantInQuery() {
        directory().listRoutersForTenant("tenant a&b");

        assertThat(lastQuery.get()).isEqualTo("tenant_id=tenant+a%26b");
    }

    @Test
    void failsOnNonOkStatus() {
        status = 503;

        assertThatThrownBy(() -> directory().listRoutersForTenant("tenant-a"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("503");
    }

    @Test
    void failsOnMalformedBody() {
        body = "{not json";

        assertThatThrownBy(() -> directory().listRoutersForTenant("tenant-a"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("tenant-a");
    }

    private NetworkServiceRouterDirectory directory() {
        String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        return new NetworkServiceRouterDirectory(new JacksonConfiguration().objectMapper(),
            OrchestratorTestProperties.withNetworkService(url, 0));
    }
}
