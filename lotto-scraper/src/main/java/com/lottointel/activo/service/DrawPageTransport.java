package com.lottointel.activo.service;

/**
 * The single network capability the fetcher needs: GET a URL.
 * Implementations report transport failures in the response instead of throwing.
 */
public interface DrawPageTransport extends AutoCloseable {

    TransportResponse get(String url);

    /** Releases held connection resources. Safe to call more than once. */
    @Override
    void close();

    /**
     * @param statusCode HTTP status, 0 when no response was received
     * @param body       response body, may be null
     * @param error      transport-level failure, null when a response arrived
     */
    record TransportResponse(int statusCode, String body, Exception error) {

        public static TransportResponse ok(String body) {
            return new TransportResponse(200, body, null);
        }

        public static TransportResponse status(int statusCode, String body) {
            return new TransportResponse(statusCode, body, null);
        }

        public static TransportResponse failed(Exception error) {
            return new TransportResponse(0, null, error);
        }

        public boolean isFailed() {
            return error != null;
        }
    }
}
