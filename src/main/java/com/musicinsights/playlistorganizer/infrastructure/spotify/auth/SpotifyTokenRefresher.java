package com.musicinsights.playlistorganizer.infrastructure.spotify.auth;

import com.musicinsights.playlistorganizer.application.common.error.ReauthenticationRequiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 세션 단위 access token 갱신기.
 *
 * <p>같은 세션에서 동시에 401을 받은 호출들은 진행 중인 하나의 갱신 결과를 공유한다.
 * 거절된 토큰이 이미 다른 호출에 의해 교체된 상태라면 토큰 엔드포인트를 다시 부르지 않고
 * 현재 토큰을 돌려준다.</p>
 *
 * <p>갱신에 실패하면 항상 {@link ReauthenticationRequiredException}으로 끝난다.</p>
 */
@Component
public class SpotifyTokenRefresher {

    private static final Logger log = LoggerFactory.getLogger(SpotifyTokenRefresher.class);

    private final SpotifyCredentialStore credentialStore;
    private final SpotifyTokenClient tokenClient;

    /** 세션별 진행 중인 갱신(완료되면 제거) */
    private final ConcurrentMap<String, Mono<String>> inFlight = new ConcurrentHashMap<>();

    public SpotifyTokenRefresher(SpotifyCredentialStore credentialStore, SpotifyTokenClient tokenClient) {
        this.credentialStore = credentialStore;
        this.tokenClient = tokenClient;
    }

    /**
     * 거절된 access token을 대신할 새 토큰을 얻는다.
     *
     * @param sessionId     세션 ID
     * @param rejectedToken 401을 받은 요청에 실었던 토큰(nullable)
     * @return 새 access token
     */
    public Mono<String> refresh(String sessionId, String rejectedToken) {
        return Mono.defer(() -> {
            SpotifyCredential current = credentialStore.find(sessionId).orElse(null);
            if (current == null || !current.hasRefreshToken()) {
                log.error("Cannot refresh Spotify token for session {}: no refresh token stored", sessionId);
                return Mono.<String>error(new ReauthenticationRequiredException("No Spotify refresh token available"));
            }

            String latest = current.accessToken();
            if (latest != null && !latest.isBlank() && !latest.equals(rejectedToken)) {
                log.debug("Access token for session {} was already refreshed; reusing it", sessionId);
                return Mono.just(latest);
            }

            return inFlight.computeIfAbsent(sessionId, id -> exchange(id, current.refreshToken()));
        });
    }

    /**
     * 토큰 엔드포인트 호출 하나를 공유 가능한 Mono로 만든다.
     *
     * <p>결과가 호출자에게 전달되기 전에 {@link #inFlight}에서 자기 자신만 제거한다.
     * 그 뒤에 등록된 다른 갱신은 건드리지 않는다.</p>
     */
    private Mono<String> exchange(String sessionId, String refreshToken) {
        AtomicReference<Mono<String>> self = new AtomicReference<>();
        Mono<String> shared = tokenClient.refresh(refreshToken)
                .switchIfEmpty(Mono.error(new IllegalStateException("Token endpoint returned an empty body")))
                .flatMap(resp -> {
                    if (resp.accessToken() == null || resp.accessToken().isBlank()) {
                        return Mono.<String>error(new IllegalStateException("Token endpoint returned no access token"));
                    }
                    credentialStore.updateAccessToken(sessionId, resp.accessToken(), resp.refreshToken());
                    log.info("Refreshed Spotify access token for session {}", sessionId);
                    return Mono.just(resp.accessToken());
                })
                .onErrorMap(e -> !(e instanceof ReauthenticationRequiredException), e -> {
                    log.error("Spotify token refresh failed for session {}", sessionId, e);
                    return new ReauthenticationRequiredException("Spotify token refresh failed", e);
                })
                .doOnTerminate(() -> inFlight.remove(sessionId, self.get()))
                .cache();
        self.set(shared);
        return shared;
    }
}
