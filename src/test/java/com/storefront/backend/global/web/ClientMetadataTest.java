package com.storefront.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class ClientMetadataTest {

    @Test
    void prefersFirstForwardedHop() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.2");
        request.addHeader("X-Real-IP", "198.51.100.1");
        request.addHeader("User-Agent", "Firefox");
        request.setRemoteAddr("10.0.0.3");

        ClientMetadata client = ClientMetadata.from(request);

        assertThat(client.ip()).isEqualTo("203.0.113.7");
        assertThat(client.userAgent()).isEqualTo("Firefox");
    }

    @Test
    void fallsBackToRealIpThenRemoteAddress() {
        MockHttpServletRequest proxied = new MockHttpServletRequest();
        proxied.addHeader("X-Real-IP", "198.51.100.1");
        assertThat(ClientMetadata.from(proxied).ip()).isEqualTo("198.51.100.1");

        MockHttpServletRequest direct = new MockHttpServletRequest();
        direct.setRemoteAddr("192.0.2.4");
        assertThat(ClientMetadata.from(direct).ip()).isEqualTo("192.0.2.4");
        assertThat(ClientMetadata.from(direct).userAgent()).isEqualTo(ClientMetadata.UNKNOWN_USER_AGENT);
    }

    @Test
    void truncatesOversizedUserAgent() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("User-Agent", "x".repeat(2000));

        assertThat(ClientMetadata.from(request).userAgent()).hasSize(512);
    }

    @Test
    void truncatesOversizedForwardedAddress() {
        MockHttpServletRequest forwarded = new MockHttpServletRequest();
        forwarded.addHeader("X-Forwarded-For", "x".repeat(300) + ", 10.0.0.1");
        assertThat(ClientMetadata.from(forwarded).ip()).hasSize(100);

        MockHttpServletRequest realIp = new MockHttpServletRequest();
        realIp.addHeader("X-Real-IP", "y".repeat(150));
        assertThat(ClientMetadata.from(realIp).ip()).hasSize(100);
    }
}
