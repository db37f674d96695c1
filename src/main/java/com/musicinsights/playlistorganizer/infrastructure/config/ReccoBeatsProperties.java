package com.musicinsights.playlistorganizer.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * ReccoBeats 연동 설정({@code app.reccobeats.*}).
 */
@ConfigurationProperties(prefix = "app.reccobeats")
public class ReccoBeatsProperties {

    private String baseUrl = "https://api.reccobeats.com";

    /** 429 응답에 대한 최대 재시도 횟수(최초 시도 제외) */
    private int maxRetries = 3;

    /** Retry-After 헤더가 없을 때 사용할 대기 시간 */
    private Duration defaultRetryAfter = Duration.ofSeconds(2);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getDefaultRetryAfter() {
        return defaultRetryAfter;
    }

    public void setDefaultRetryAfter(Duration defaultRetryAfter) {
        this.defaultRetryAfter = defaultRetryAfter;
    }
}
