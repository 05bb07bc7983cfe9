package com.shortlink.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * One logged redirect with the request details the caller passed along. Rows are append-only.
 */
@Entity
@Table(name = "visits", indexes = @Index(name = "idx_visits_code_time", columnList = "code, visited_at"))
public class Visit {

    public static final int MAX_IP_ADDRESS_LENGTH = 45;
    public static final int MAX_USER_AGENT_LENGTH = 255;
    public static final int MAX_REFERRER_LENGTH = 2048;
    public static final int COUNTRY_LENGTH = 2;
    public static final int MAX_CITY_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "code", nullable = false, updatable = false, length = ShortLink.MAX_CODE_LENGTH)
    private String code;

    @Column(name = "visited_at", nullable = false, updatable = false)
    private Instant visitedAt;

    @Column(name = "ip_address", updatable = false, length = MAX_IP_ADDRESS_LENGTH)
    private String ipAddress;

    @Column(name = "user_agent", updatable = false, length = MAX_USER_AGENT_LENGTH)
    private String userAgent;

    @Column(name = "referrer", updatable = false, length = MAX_REFERRER_LENGTH)
    private String referrer;

    @Column(name = "country", updatable = false, length = COUNTRY_LENGTH)
    private String country;

    @Column(name = "city", updatable = false, length = MAX_CITY_LENGTH)
    private String city;

    protected Visit() {
        // for JPA
    }

    public Visit(String code, Instant visitedAt, String ipAddress, String userAgent,
                 String referrer, String country, String city) {
        this.code = code;
        this.visitedAt = visitedAt;
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
        this.referrer = referrer;
        this.country = country;
        this.city = city;
    }

    public Long getId() {
        return id;
    }

    public String getCode() {
        return code;
    }

    public Instant getVisitedAt() {
        return visitedAt;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getReferrer() {
        return referrer;
    }

    public String getCountry() {
        return country;
    }

    public String getCity() {
        return city;
    }
}
