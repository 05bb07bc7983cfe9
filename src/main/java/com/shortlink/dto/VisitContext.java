package com.shortlink.dto;

/**
 * Request details of a redirect, as far as the caller knows them. Every field may be null.
 */
public record VisitContext(String ipAddress, String userAgent, String referrer, String country, String city) {
}
