package com.vitals.metricsserver.infrastructure.web;

import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * Builds the responses of the health and stats endpoints.
 *
 * <p>Successful responses are never cached and may be read cross-origin. Error responses carry no
 * body, so nothing about the failure reaches the client.
 */
public final class ResponseWriter {

    public static final String CACHE_CONTROL = "no-store, no-cache, must-revalidate, private";
    public static final String ALLOWED_ORIGIN = "*";
    public static final String ALLOWED_METHODS = "GET,POST,OPTIONS";
    public static final String ALLOWED_HEADERS = "Content-Type";

    private ResponseWriter() {
        // utility class
    }

    public static ResponseEntity<String> ok(String body, String contentType) {
        return ResponseEntity.ok()
                .header(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, ALLOWED_ORIGIN)
                .header(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, ALLOWED_METHODS)
                .header(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, ALLOWED_HEADERS)
                .header(HttpHeaders.CACHE_CONTROL, CACHE_CONTROL)
                .contentType(MediaType.parseMediaType(contentType))
                .body(body);
    }

    public static ResponseEntity<String> forbidden() {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
    }

    public static ResponseEntity<String> serverError() {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }

    /**
     * Answers a request outside the two endpoints with an empty {@code text/plain} 404.
     */
    public static void writeNotFound(HttpServletResponse response) throws IOException {
        response.setStatus(HttpStatus.NOT_FOUND.value());
        response.setContentType(MediaType.TEXT_PLAIN_VALUE);
        response.setContentLength(0);
        response.flushBuffer();
    }
}
