package com.didvault.api.integration;

import com.didvault.api.DidVaultApiApplication;
import com.didvault.api.config.RateLimitConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for rate limiting.
 */
@SpringBootTest(
    classes = DidVaultApiApplication.class,
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class RateLimitIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private RateLimitConfig rateLimitConfig;

    private String baseUrl;

    @BeforeEach
    void setUp() {
        baseUrl = "http://localhost:" + port + "/api/v1";
    }

    @Test
    void rateLimitHeader_shouldBePresentOnRateLimitedEndpoints() {
        String caller = UUID.randomUUID().toString();

        ResponseEntity<String> response = restTemplate.exchange(
            baseUrl + "/identities/" + caller + "/active",
            HttpMethod.GET,
            new HttpEntity<>(headers(caller)),
            String.class
        );

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getHeaders().getFirst("X-Rate-Limit-Remaining")).isEqualTo("999");
    }

    @Test
    void strictLimit_returnsTooManyRequestsWhenExhausted() {
        String caller = UUID.randomUUID().toString();
        long strictLimit = rateLimitConfig.getStrictLimit();

        for (int i = 0; i < strictLimit; i++) {
            ResponseEntity<String> response = revoke(caller);
            // No identity to revoke, but the request still draws a token
            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        }

        ResponseEntity<String> limited = revoke(caller);
        assertThat(limited.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(limited.getBody()).contains("RATE_001");
        assertThat(limited.getHeaders().containsKey("X-Rate-Limit-Retry-After-Seconds")).isTrue();

        rateLimitConfig.clearBucket(caller);
        assertThat(revoke(caller).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void differentClients_shouldHaveSeparateLimits() {
        String exhausted = UUID.randomUUID().toString();
        for (int i = 0; i <= rateLimitConfig.getStrictLimit(); i++) {
            revoke(exhausted);
        }

        ResponseEntity<String> other = revoke(UUID.randomUUID().toString());

        assertThat(revoke(exhausted).getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(other.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void healthEndpoint_shouldBeExemptFromRateLimit() {
        for (int i = 0; i < 20; i++) {
            ResponseEntity<String> response = restTemplate.getForEntity(baseUrl + "/health", String.class);
            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(response.getHeaders().containsKey("X-Rate-Limit-Remaining")).isFalse();
        }
    }

    @Test
    void infoEndpoint_reportsLedgerHeight() {
        ResponseEntity<String> response = restTemplate.getForEntity(baseUrl + "/info", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).contains("ledgerHeight");
    }

    private ResponseEntity<String> revoke(String caller) {
        return restTemplate.exchange(
            baseUrl + "/identities",
            HttpMethod.DELETE,
            new HttpEntity<>(headers(caller)),
            String.class
        );
    }

    private static HttpHeaders headers(String caller) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Caller-Principal", caller);
        return headers;
    }
}
