package com.ryuqq.pipeline.adapter.runner.transport;

import com.ryuqq.pipeline.core.contract.ModuleName;
import com.ryuqq.pipeline.core.spi.DirectDeliveryException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HttpDirectDelivery 테스트 (JDK HttpServer 사용).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class HttpDirectDeliveryTest {

    private HttpServer server;
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private final List<String> contentTypes = new CopyOnWriteArrayList<>();
    private final AtomicInteger status = new AtomicInteger(200);
    private URI endpoint;
    private boolean stopped;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/cfo/events/receive", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                bodies.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            contentTypes.add(exchange.getRequestHeaders().getFirst("Content-Type"));
            exchange.sendResponseHeaders(status.get(), -1);
            exchange.close();
        });
        server.start();
        endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/cfo/events/receive");
    }

    @AfterEach
    void tearDown() {
        if (!stopped) {
            server.stop(0);
        }
    }

    @Test
    void 응답이_2xx면_전달_성공() {
        // given
        HttpDirectDelivery delivery = new HttpDirectDelivery();

        // when
        delivery.deliver(ModuleName.FINANCE, endpoint, "{\"id\":\"e-1\"}");

        // then
        assertThat(bodies).containsExactly("{\"id\":\"e-1\"}");
        assertThat(contentTypes).containsExactly("application/json");
    }

    @Test
    void 응답이_2xx가_아니면_상태_코드를_담은_예외() {
        // given
        status.set(503);
        HttpDirectDelivery delivery = new HttpDirectDelivery();

        // when & then
        assertThatThrownBy(() -> delivery.deliver(ModuleName.FINANCE, endpoint, "{}"))
            .isInstanceOf(DirectDeliveryException.class)
            .hasMessageContaining("503")
            .satisfies(e -> assertThat(((DirectDeliveryException) e).getStatusCode()).isEqualTo(503));
    }

    @Test
    void 연결_실패는_상태_코드_없는_예외() {
        // given
        HttpDirectDelivery delivery = new HttpDirectDelivery();
        server.stop(0);
        stopped = true;

        // when & then
        assertThatThrownBy(() -> delivery.deliver(ModuleName.FINANCE, endpoint, "{}"))
            .isInstanceOf(DirectDeliveryException.class)
            .satisfies(e -> assertThat(((DirectDeliveryException) e).getStatusCode()).isEqualTo(-1));
    }
}
