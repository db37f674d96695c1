package com.musicinsights.playlistorganizer.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Spotify 연동 설정({@code app.spotify.*}).
 */
@ConfigurationProperties(prefix = "app.spotify")
public class SpotifyProperties {

    /** Web API base URL */
    private String apiBaseUrl = "https://api.spotify.com/v1";

    /** Accounts(authorize/token) base URL */
    private String accountsBaseUrl = "https://accounts.spotify.com";

    private String clientId;
    private String clientSecret;
    private String redirectUri;

    /** 공백으로 구분된 OAuth scope 목록 */
    private String scopes = "playlist-read-private playlist-modify-private playlist-modify-public user-read-recently-played";

    /** {@code GET /artists?ids=} 한 번에 보낼 수 있는 최대 ID 수 */
    private int artistBatchSize = 50;

    /** 이 시간 동안 쓰이지 않은 세션 자격 증명은 폐기한다. WebSession 기본 유휴 만료(30분)와 맞춘다 */
    private Duration credentialIdleTimeout = Duration.ofMinutes(30);

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
        this.apiBaseUrl = apiBaseUrl;
    }

    public String getAccountsBaseUrl() {
        return accountsBaseUrl;
    }

    public void setAccountsBaseUrl(String accountsBaseUrl) {
        this.accountsBaseUrl = accountsBaseUrl;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
        this.clientSecret = clientSecret;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public void setRedirectUri(String redirectUri) {
        this.redirectUri = redirectUri;
    }

    public String getScopes() {
        return scopes;
    }

    public void setScopes(String scopes) {
        this.scopes = scopes;
    }

    public int getArtistBatchSize() {
        return artistBatchSize;
    }

    public void setArtistBatchSize(int artistBatchSize) {
        this.artistBatchSize = artistBatchSize;
    }

    public Duration getCredentialIdleTimeout() {
        return credentialIdleTimeout;
    }

    public void setCredentialIdleTimeout(Duration credentialIdleTimeout) {
        this.credentialIdleTimeout = credentialIdleTimeout;
    }
}
