package com.musicinsights.playlistorganizer.infrastructure.spotify.auth;

import com.musicinsights.playlistorganizer.infrastructure.config.SpotifyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 세션 ID별 Spotify 자격 증명 저장소.
 *
 * <p>모든 Spotify 호출이 읽고, OAuth 콜백과 토큰 갱신 경로만 쓴다.
 * 값 교체는 키 단위로 원자적으로 이루어진다.</p>
 *
 * <p>유휴 시간({@code app.spotify.credential-idle-timeout})을 넘긴 항목은 만료된 세션의 것으로 보고 버린다.
 * 조회 시점에 해당 항목을, 새 로그인 저장 시점에 전체를 정리한다.</p>
 */
@Component
public class SpotifyCredentialStore {

    private static final Logger log = LoggerFactory.getLogger(SpotifyCredentialStore.class);

    private final ConcurrentMap<String, Entry> credentials = new ConcurrentHashMap<>();
    private final Duration idleTimeout;
    private final Clock clock;

    @Autowired
    public SpotifyCredentialStore(SpotifyProperties props) {
        this(props.getCredentialIdleTimeout(), Clock.systemUTC());
    }

    SpotifyCredentialStore(Duration idleTimeout, Clock clock) {
        this.idleTimeout = idleTimeout;
        this.clock = clock;
    }

    /**
     * 세션의 자격 증명을 조회한다. 만료된 항목은 제거하고 empty를 돌려준다.
     *
     * @param sessionId 세션 ID
     * @return 자격 증명(없으면 empty)
     */
    public Optional<SpotifyCredential> find(String sessionId) {
        if (sessionId == null) return Optional.empty();
        Instant now = clock.instant();
        Entry entry = credentials.computeIfPresent(sessionId,
                (id, current) -> current.isIdle(now, idleTimeout) ? null : current.touched(now));
        return Optional.ofNullable(entry).map(Entry::credential);
    }

    /**
     * 세션의 현재 access token을 조회한다.
     *
     * @param sessionId 세션 ID
     * @return access token, 로그인 전이면 null
     */
    public String accessToken(String sessionId) {
        return find(sessionId).map(SpotifyCredential::accessToken).orElse(null);
    }

    /**
     * 로그인(인가 코드 교환) 직후 자격 증명을 저장한다.
     *
     * @param sessionId  세션 ID
     * @param credential 자격 증명
     */
    public void save(String sessionId, SpotifyCredential credential) {
        evictIdle();
        credentials.put(sessionId, new Entry(credential, clock.instant()));
    }

    /**
     * 토큰 갱신 결과를 반영한다. refresh token은 새 값이 있을 때만 바뀐다.
     *
     * @param sessionId       세션 ID
     * @param accessToken     새 access token
     * @param newRefreshToken 새 refresh token(nullable)
     * @return 반영 후 자격 증명, 그 사이 세션이 제거되었으면 null
     */
    public SpotifyCredential updateAccessToken(String sessionId, String accessToken, String newRefreshToken) {
        Instant now = clock.instant();
        Entry entry = credentials.computeIfPresent(sessionId, (id, current) ->
                new Entry(current.credential().refreshed(accessToken, newRefreshToken), now));
        return entry == null ? null : entry.credential();
    }

    public void remove(String sessionId) {
        if (sessionId != null) credentials.remove(sessionId);
    }

    /**
     * 유휴 시간을 넘긴 항목을 모두 제거한다.
     *
     * @return 제거한 항목 수
     */
    int evictIdle() {
        Instant now = clock.instant();
        int before = credentials.size();
        credentials.values().removeIf(entry -> entry.isIdle(now, idleTimeout));
        int evicted = before - credentials.size();
        if (evicted > 0) log.debug("Evicted {} idle Spotify credential(s)", evicted);
        return Math.max(evicted, 0);
    }

    int size() {
        return credentials.size();
    }

    private record Entry(SpotifyCredential credential, Instant lastAccess) {

        boolean isIdle(Instant now, Duration idleTimeout) {
            return lastAccess.plus(idleTimeout).isBefore(now);
        }

        Entry touched(Instant now) {
            return new Entry(credential, now);
        }
    }
}
