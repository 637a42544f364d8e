package com.kitchzero.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.util.StringUtils;

/**
 * Client address as reported by the fronting proxy. Only forwarded headers are consulted; when none is
 * present the address is {@value #UNKNOWN}.
 */
public final class ClientAddressResolver {

    public static final String UNKNOWN = "unknown";
    private static final String[] HEADERS = {"X-Forwarded-For", "X-Real-IP", "X-Client-IP"};
    private static final int MAX_LENGTH = 64;

    private ClientAddressResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        for (String header : HEADERS) {
            String value = request.getHeader(header);
            if (StringUtils.hasText(value)) {
                int comma = value.indexOf(',');
                String first = (comma >= 0 ? value.substring(0, comma) : value).trim();
                if (!first.isEmpty()) {
                    return first.length() > MAX_LENGTH ? first.substring(0, MAX_LENGTH) : first;
                }
            }
        }
        return UNKNOWN;
    }
}
