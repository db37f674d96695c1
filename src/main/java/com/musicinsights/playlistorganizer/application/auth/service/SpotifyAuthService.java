package com.musicinsights.playlistorganizer.application.auth.service;

import com.musicinsights.playlistorganizer.application.common.error.BadRequestException;
import com.musicinsights.playlistorganizer.application.common.error.ReauthenticationRequiredException;
import com.musicinsights.playlistorganizer.infrastructure.config.SpotifyProperties;
import com.musicinsights.playlistorganizer.infrastructure.spotify.auth.SpotifyCredential;
import com.musicinsights.playlistorganizer.infrastructure.spotify.auth.SpotifyCredentialStore;
import com.musicinsights.playlistorganizer.infrastructure.spotify.auth.SpotifyTokenClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Spotify OAuth(authorization code) 로그인 서비스.
 *
 * <p>authorize URL 생성, 콜백 코드 교환, 세션별 로그인 여부 확인을 담당한다.</p>
 */
@Service
public class SpotifyAuthService {

    private static final Logger log = LoggerFactory.getLogger(SpotifyAuthService.class);

    private final SpotifyProperties props;
    private final SpotifyTokenClient tokenClient;
    private final SpotifyCredentialStore credentialStore;

    public SpotifyAuthService(SpotifyProperties props,
                              SpotifyTokenClient tokenClient,
                              SpotifyCredentialStore credentialStore) {
        this.props = props;
        this.tokenClient = tokenClient;
        this.credentialStore = credentialStore;
    }

    /**
     * Spotify authorize 페이지 URL을 만든다.
     *
     * @param state CSRF 방지용 state 값
     * @return authorize URL
     */
    public URI authorizeUri(String state) {
        return UriComponentsBuilder.fromUriString(props.getAccountsBaseUrl())
                .path("/authorize")
                .queryParam("client_id", props.getClientId())
                .queryParam("response_type", "code")
                .queryParam("redirect_uri", props.getRedirectUri())
                .queryParam("scope", props.getScopes())
                .queryParam("state", state)
                .encode()
                .build()
                .toUri();
    }

    /**
     * 콜백으로 받은 인가 코드를 토큰 쌍으로 교환해 세션에 저장한다.
     *
     * @param sessionId 세션 ID
     * @param code      인가 코드
     * @return 완료 신호. 교환 실패 시 {@link BadRequestException}(TOKEN_EXCHANGE_FAILED)
     */
    public Mono<Void> completeLogin(String sessionId, String code) {
        if (code == null || code.isBlank()) {
            return Mono.error(new BadRequestException("authorization code is missing", "AUTH_CODE_MISSING"));
        }

        return tokenClient.exchangeCode(code)
                .filter(resp -> resp.accessToken() != null && !resp.accessToken().isBlank())
                .switchIfEmpty(Mono.error(new IllegalStateException("Token endpoint returned no access token")))
                .doOnNext(resp -> {
                    credentialStore.save(sessionId, new SpotifyCredential(resp.accessToken(), resp.refreshToken()));
                    log.info("Spotify login completed for session {}", sessionId);
                })
                .onErrorMap(e -> !(e instanceof BadRequestException), e -> {
                    log.error("Spotify authorization code exchange failed for session {}", sessionId, e);
                    return new BadRequestException("Spotify authorization failed", "TOKEN_EXCHANGE_FAILED", e);
                })
                .then();
    }

    public boolean isSignedIn(String sessionId) {
        return credentialStore.find(sessionId).isPresent();
    }

    /**
     * 로그인된 세션인지 확인한다.
     *
     * @param sessionId 세션 ID
     * @return 세션 ID. 로그인 전이면 {@link ReauthenticationRequiredException}
     */
    public Mono<String> requireSignedIn(String sessionId) {
        if (!isSignedIn(sessionId)) {
            return Mono.error(new ReauthenticationRequiredException("Not signed in to Spotify"));
        }
        return Mono.just(sessionId);
    }

    public void logout(String sessionId) {
        credentialStore.remove(sessionId);
        log.info("Spotify credentials cleared for session {}", sessionId);
    }
}
