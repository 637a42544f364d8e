package com.kitchzero.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class ClientAddressResolverTest {

    @Test
    void takesFirstForwardedAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", " 203.0.113.7 , 10.0.0.1");
        request.addHeader("X-Real-IP", "198.51.100.1");

        assertThat(ClientAddressResolver.resolve(request)).isEqualTo("203.0.113.7");
    }

    @Test
    void fallsBackThroughHeaders() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Client-IP", "198.51.100.9");

        assertThat(ClientAddressResolver.resolve(request)).isEqualTo("198.51.100.9");
    }

    @Test
    void ignoresSocketAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("192.0.2.1");

        assertThat(ClientAddressResolver.resolve(request)).isEqualTo(ClientAddressResolver.UNKNOWN);
    }

    @Test
    void commaOnlyForwardedHeaderFallsThroughToNextHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", ",");
        request.addHeader("X-Real-IP", "198.51.100.4");

        assertThat(ClientAddressResolver.resolve(request)).isEqualTo("198.51.100.4");
    }

    @Test
    void emptyLeadingForwardedEntryResolvesToUnknown() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", " , 10.0.0.1");

        assertThat(ClientAddressResolver.resolve(request)).isEqualTo(ClientAddressResolver.UNKNOWN);
    }
}
