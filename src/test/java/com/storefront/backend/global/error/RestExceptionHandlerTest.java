package com.storefront.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

class RestExceptionHandlerTest {

    private final RestExceptionHandler handler = new RestExceptionHandler();
    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/auth/refresh");

    @Test
    void retryableProblemCarriesRetryAfterHeader() {
        ResponseEntity<ProblemResponse> response = handler.handleRetryableProblem(
                new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, "REFRESH_TOO_SOON", "slow down", 4), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("4");
        assertThat(response.getBody().code()).isEqualTo("REFRESH_TOO_SOON");
        assertThat(response.getBody().instance()).isEqualTo("/auth/refresh");
    }

    @Test
    void problemKeepsCodeAndDetail() {
        ResponseEntity<ProblemResponse> response = handler.handleProblem(
                new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid credentials"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody().status()).isEqualTo(401);
        assertThat(response.getBody().detail()).isEqualTo("Invalid credentials");
    }

    @Test
    void unexpectedErrorsHideInternals() {
        ResponseEntity<ProblemResponse> response = handler.handleGenericException(
                new IllegalStateException("connection string leaked"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().detail()).isEqualTo("Unexpected server error");
    }

    @Test
    void frameworkErrorResponsesKeepTheirStatus() {
        ResponseEntity<ProblemResponse> notFound = handler.handleGenericException(
                new NoResourceFoundException(HttpMethod.GET, "auth/nope"), request);
        assertThat(notFound.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(notFound.getBody().code()).isEqualTo("not_found");

        ResponseEntity<ProblemResponse> wrongMethod = handler.handleGenericException(
                new HttpRequestMethodNotSupportedException("DELETE", List.of("POST")), request);
        assertThat(wrongMethod.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
        assertThat(wrongMethod.getHeaders().getAllow()).containsExactly(HttpMethod.POST);
        assertThat(wrongMethod.getBody().code()).isEqualTo("method_not_allowed");
    }
}
