package com.vitals.metricsserver.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

@DisplayName("ResponseWriter")
class ResponseWriterTest {

    @Test
    @DisplayName("adds CORS and no-cache headers to successful responses")
    void okCarriesHeaders() {
        var response = ResponseWriter.ok("{}", MediaType.APPLICATION_JSON_VALUE);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo("{}");
        HttpHeaders headers = response.getHeaders();
        assertThat(headers.getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
        assertThat(headers.getFirst("Access-Control-Allow-Origin")).isEqualTo("*");
        assertThat(headers.getFirst("Access-Control-Allow-Methods")).isEqualTo("GET,POST,OPTIONS");
        assertThat(headers.getFirst("Access-Control-Allow-Headers")).isEqualTo("Content-Type");
        assertThat(headers.getCacheControl()).isEqualTo("no-store, no-cache, must-revalidate, private");
    }

    @Test
    @DisplayName("keeps content type parameters")
    void keepsContentTypeParameters() {
        var response = ResponseWriter.ok("", "text/plain; version=0.0.4; charset=utf-8");

        MediaType type = response.getHeaders().getContentType();
        assertThat(type.getParameter("version")).isEqualTo("0.0.4");
        assertThat(type.getCharset()).hasToString("UTF-8");
    }

    @Test
    @DisplayName("error responses have no body and no cache headers")
    void errorsAreBare() {
        assertThat(ResponseWriter.forbidden().getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(ResponseWriter.forbidden().hasBody()).isFalse();
        assertThat(ResponseWriter.serverError().getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(ResponseWriter.serverError().getHeaders().getCacheControl()).isNull();
    }
}
