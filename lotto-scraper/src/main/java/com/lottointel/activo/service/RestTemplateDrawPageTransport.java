package com.lottointel.activo.service;

import com.lottointel.activo.config.LottoScraperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link DrawPageTransport} over Spring's RestTemplate.
 *
 * Connect/read timeouts are set on the RestTemplate (see HttpClientConfig).
 * The body is streamed and abandoned as soon as it passes the payload ceiling,
 * so an oversize page never sits fully in memory.
 */
@Component
@Slf4j
public class RestTemplateDrawPageTransport implements DrawPageTransport {

    private final RestTemplate restTemplate;
    private final Map<String, String> headers;
    private final long maxBytes;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RestTemplateDrawPageTransport(@Qualifier("drawPageRestTemplate") RestTemplate restTemplate,
                                         LottoScraperProperties properties) {
        this.restTemplate = restTemplate;
        Map<String, String> configured = properties.getSource().getHeaders();
        this.headers = configured == null ? Map.of() : Map.copyOf(configured);
        this.maxBytes = properties.getSource().maxDataSizeBytes();
    }

    @Override
    public TransportResponse get(String url) {
        if (closed.get()) {
            throw new IllegalStateException("Transport is closed");
        }
        log.debug("GET {}", url);
        try {
            return restTemplate.execute(
                    URI.create(url),
                    HttpMethod.GET,
                    request -> headers.forEach((name, value) -> request.getHeaders().set(name, value)),
                    this::toResponse);

        } catch (HttpStatusCodeException e) {
            // 4xx/5xx: hand the status back for the fetcher to classify
            return TransportResponse.status(e.getStatusCode().value(), e.getResponseBodyAsString());

        } catch (PayloadTooLargeException | ResourceAccessException e) {
            return TransportResponse.failed(e);

        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("GET {} failed: {}", url, e.getMessage());
            return TransportResponse.failed(e);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Draw page transport closed");
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private TransportResponse toResponse(ClientHttpResponse response) throws IOException {
        long declared = response.getHeaders().getContentLength();
        if (declared > maxBytes) {
            throw new PayloadTooLargeException(maxBytes);
        }
        byte[] bytes = readUpToMax(response.getBody(), maxBytes);
        return TransportResponse.status(response.getStatusCode().value(), new String(bytes, charsetOf(response)));
    }

    private static byte[] readUpToMax(InputStream in, long maxBytes) throws IOException {
        try (InputStream input = in; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            byte[] buf = new byte[8192];
            long total = 0;
            int r;
            while ((r = input.read(buf)) >= 0) {
                total += r;
                if (total > maxBytes) {
                    throw new PayloadTooLargeException(maxBytes);
                }
                out.write(buf, 0, r);
            }
            return out.toByteArray();
        }
    }

    private static Charset charsetOf(ClientHttpResponse response) {
        MediaType contentType = response.getHeaders().getContentType();
        if (contentType != null && contentType.getCharset() != null) {
            return contentType.getCharset();
        }
        return StandardCharsets.UTF_8;
    }
}
