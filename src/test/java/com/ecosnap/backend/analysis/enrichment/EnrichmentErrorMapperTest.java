package com.ecosnap.backend.analysis.enrichment;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class EnrichmentErrorMapperTest {

    @Test
    void wrapped_socket_timeout_should_map_to_PROVIDER_TIMEOUT() {
        var e = new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out"));

        assertThat(EnrichmentErrorMapper.map(e).code()).isEqualTo("PROVIDER_TIMEOUT");
        assertThat(EnrichmentErrorMapper.toException(e)).isInstanceOf(EnrichmentTimeoutException.class);
    }

    @Test
    void plain_network_error_should_map_to_PROVIDER_NETWORK_ERROR() {
        var e = new ResourceAccessException("Connection refused");

        EnrichmentException ex = EnrichmentErrorMapper.toException(e);

        assertThat(ex).isInstanceOf(TransportException.class);
        assertThat(ex.getCode()).isEqualTo("PROVIDER_NETWORK_ERROR");
        assertThat(ex.getCause()).isSameAs(e);
    }

    @Test
    void status_429_should_keep_retry_after() {
        HttpHeaders h = new HttpHeaders();
        h.add("Retry-After", "12");
        var e = HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", h,
                "{}".getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);

        EnrichmentErrorMapper.Mapped m = EnrichmentErrorMapper.map(e);

        assertThat(m.code()).isEqualTo("PROVIDER_RATE_LIMITED");
        assertThat(m.retryAfterSec()).isEqualTo(12);
        assertThat(((TransportException) EnrichmentErrorMapper.toException(e)).retryAfterSec()).isEqualTo(12);
    }

    @Test
    void auth_and_upstream_statuses_should_map_to_codes() {
        var unauthorized = HttpClientErrorException.create(HttpStatus.UNAUTHORIZED, "Unauthorized",
                HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);
        var unavailable = HttpServerErrorException.create(HttpStatus.SERVICE_UNAVAILABLE, "Unavailable",
                HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);
        var badRequest = HttpClientErrorException.create(HttpStatus.BAD_REQUEST, "Bad Request",
                HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);

        assertThat(EnrichmentErrorMapper.map(unauthorized).code()).isEqualTo("PROVIDER_AUTH_FAILED");
        assertThat(EnrichmentErrorMapper.map(unavailable).code()).isEqualTo("PROVIDER_UPSTREAM_5XX");
        assertThat(EnrichmentErrorMapper.map(badRequest).code()).isEqualTo("PROVIDER_BAD_REQUEST");
    }

    @Test
    void policy_block_in_body_should_map_to_PROVIDER_BLOCKED() {
        var e = HttpClientErrorException.create(HttpStatus.BAD_REQUEST, "Bad Request", HttpHeaders.EMPTY,
                "{\"error\":\"request blocked by SAFETY\"}".getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);

        assertThat(EnrichmentErrorMapper.map(e).code()).isEqualTo("PROVIDER_BLOCKED");
    }

    @Test
    void explicit_provider_code_in_illegal_state_should_be_kept() {
        assertThat(EnrichmentErrorMapper.map(new IllegalStateException("GEMINI_API_KEY_MISSING")).code())
                .isEqualTo("GEMINI_API_KEY_MISSING");
    }

    @Test
    void existing_enrichment_exception_should_pass_through() {
        var e = new SchemaValidationException("NO_VALID_SCHEMA_FIELD");

        assertThat(EnrichmentErrorMapper.toException(e)).isSameAs(e);
        assertThat(EnrichmentErrorMapper.map(e).code()).isEqualTo(SchemaValidationException.CODE);
    }

    @Test
    void anything_else_should_map_to_PROVIDER_FAILED() {
        assertThat(EnrichmentErrorMapper.map(new RuntimeException()).code()).isEqualTo("PROVIDER_FAILED");
        assertThat(EnrichmentErrorMapper.map(null).code()).isEqualTo("PROVIDER_FAILED");
    }
}
