package com.lottointel.activo.service;

import com.lottointel.activo.TestFixtures;
import com.lottointel.activo.config.LottoScraperProperties;
import com.lottointel.activo.service.DrawPageTransport.TransportResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("RestTemplateDrawPageTransport Tests")
class RestTemplateDrawPageTransportTest {

    private static final String URL = "https://results.test/historico/2025-01-13/2025-01-20/";

    private LottoScraperProperties properties;
    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties(Path.of("target"));
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    private RestTemplateDrawPageTransport transport() {
        return new RestTemplateDrawPageTransport(restTemplate, properties);
    }

    @Test
    @DisplayName("Sends the configured headers and returns the body")
    void okResponse() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Accept-Language", "es-ES,es;q=0.9,en;q=0.8"))
                .andRespond(withSuccess("<table></table>", MediaType.TEXT_HTML));

        TransportResponse response = transport().get(URL);

        assertFalse(response.isFailed());
        assertEquals(200, response.statusCode());
        assertEquals("<table></table>", response.body());
        server.verify();
    }

    @Test
    @DisplayName("Error statuses come back as responses, not exceptions")
    void errorStatuses() {
        server.expect(requestTo(URL)).andRespond(withServerError());
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));
        RestTemplateDrawPageTransport transport = transport();

        assertEquals(500, transport.get(URL).statusCode());
        assertEquals(404, transport.get(URL).statusCode());
    }

    @Test
    @DisplayName("Body above the ceiling is reported as PayloadTooLargeException")
    void oversizeBody() {
        properties.getSource().setMaxDataSizeMb(0.00001);
        server.expect(requestTo(URL)).andRespond(withSuccess("x".repeat(200), MediaType.TEXT_HTML));

        TransportResponse response = transport().get(URL);

        assertTrue(response.isFailed());
        assertInstanceOf(PayloadTooLargeException.class, response.error());
    }

    @Test
    @DisplayName("Closed transport refuses requests and close is idempotent")
    void closed() {
        RestTemplateDrawPageTransport transport = transport();
        transport.close();
        transport.close();

        assertThrows(IllegalStateException.class, () -> transport.get(URL));
    }
}
