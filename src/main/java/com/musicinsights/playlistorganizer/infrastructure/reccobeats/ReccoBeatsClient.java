package com.musicinsights.playlistorganizer.infrastructure.reccobeats;

import com.musicinsights.playlistorganizer.infrastructure.config.ReccoBeatsProperties;
import com.musicinsights.playlistorganizer.infrastructure.reccobeats.dto.ReccoBeatsAudioFeatures;
import com.musicinsights.playlistorganizer.infrastructure.reccobeats.dto.ReccoBeatsTrackLookupResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * ReccoBeats 오디오 특성 클라이언트.
 *
 * <p>Spotify 트랙 ID 하나에 대해 두 번 호출한다.</p>
 * <ol>
 *   <li>{@code GET /v1/track?ids={spotifyId}}로 ReccoBeats 트랙 ID를 찾는다.</li>
 *   <li>{@code GET /v1/track/{id}/audio-features}로 특성을 가져온다.</li>
 * </ol>
 *
 * <p>429를 받으면 Retry-After(초, 없으면 기본값)만큼 타이머로 기다린 뒤 재시도한다.
 * 재시도 횟수는 두 호출을 합쳐 센다. 최대 재시도 횟수를 넘기면 값 없음으로 끝난다. 404도 값 없음이다.
 * 그 밖의 오류는 로그만 남기고 값 없음(empty)으로 돌려준다. 구독 취소는 그대로 전파된다.</p>
 */
@Component
public class ReccoBeatsClient {

    private static final Logger log = LoggerFactory.getLogger(ReccoBeatsClient.class);

    private final WebClient webClient;
    private final int maxRetries;
    private final Duration defaultRetryAfter;
    private final Scheduler retryTimer;

    public ReccoBeatsClient(@Qualifier("reccoBeatsWebClient") WebClient webClient,
                            ReccoBeatsProperties props,
                            @Qualifier("reccoBeatsRetryScheduler") Scheduler retryTimer) {
        this.webClient = webClient;
        this.maxRetries = props.getMaxRetries();
        this.defaultRetryAfter = props.getDefaultRetryAfter();
        this.retryTimer = retryTimer;
    }

    /**
     * Spotify 트랙의 오디오 특성을 조회한다.
     *
     * @param spotifyTrackId Spotify 트랙 ID
     * @return 오디오 특성, 데이터가 없거나 실패하면 empty
     */
    public Mono<ReccoBeatsAudioFeatures> fetchAudioFeatures(String spotifyTrackId) {
        if (spotifyTrackId == null || spotifyTrackId.isBlank()) return Mono.empty();

        return Mono.defer(() -> {
                    AtomicInteger retries = new AtomicInteger();
                    return lookupReccoBeatsId(spotifyTrackId, retries)
                            .flatMap(reccoId -> getWithRateLimit(
                                    uri -> uri.path("/v1/track/{id}/audio-features").build(reccoId),
                                    ReccoBeatsAudioFeatures.class,
                                    "audio-features " + spotifyTrackId,
                                    retries));
                })
                .doOnNext(f -> log.debug("Fetched audio features for track {}", spotifyTrackId))
                .onErrorResume(e -> {
                    log.warn("Failed to fetch audio features for track {}: {}", spotifyTrackId, e.toString());
                    return Mono.empty();
                });
    }

    /**
     * Spotify 트랙 ID에 대응하는 ReccoBeats 트랙 ID를 찾는다.
     *
     * @param spotifyTrackId Spotify 트랙 ID
     * @param retries        이번 조회에서 지금까지 쓴 재시도 횟수
     * @return ReccoBeats ID, 없으면 empty
     */
    private Mono<String> lookupReccoBeatsId(String spotifyTrackId, AtomicInteger retries) {
        return getWithRateLimit(
                uri -> uri.path("/v1/track").queryParam("ids", spotifyTrackId).build(),
                ReccoBeatsTrackLookupResponse.class,
                "track lookup " + spotifyTrackId,
                retries)
                .flatMap(resp -> Mono.justOrEmpty(resp.firstId()))
                .doOnSuccess(id -> {
                    if (id == null) log.debug("Track {} is not known to ReccoBeats", spotifyTrackId);
                });
    }

    /**
     * 429 응답에 대해 제한된 횟수만큼 재시도하는 GET.
     *
     * @param uri     요청 URI 생성 함수
     * @param type    응답 바디 타입
     * @param label   로그용 호출 설명
     * @param retries 두 호출이 함께 쓰는 재시도 카운터
     * @param <T>     응답 타입
     * @return 응답 바디. 404 또는 재시도 소진이면 empty
     */
    private <T> Mono<T> getWithRateLimit(Function<UriBuilder, URI> uri, Class<T> type, String label,
                                         AtomicInteger retries) {
        return webClient.get()
                .uri(uri)
                .exchangeToMono(response -> {
                    int status = response.statusCode().value();
                    if (status == 429) {
                        Duration wait = retryAfter(response.headers().header(HttpHeaders.RETRY_AFTER));
                        return response.releaseBody().then(Mono.<T>error(new RateLimitedException(wait)));
                    }
                    if (status == 404) {
                        return response.releaseBody().then(Mono.<T>empty());
                    }
                    if (response.statusCode().isError()) {
                        return response.<T>createError();
                    }
                    return response.bodyToMono(type);
                })
                .onErrorResume(RateLimitedException.class, e -> {
                    if (retries.get() >= maxRetries) {
                        log.warn("Rate limit retries exhausted for {} after {} retries", label, retries.get());
                        return Mono.empty();
                    }
                    int retry = retries.incrementAndGet();
                    log.info("Rate limited on {}; waiting {} ms before retry {}/{}",
                            label, e.wait.toMillis(), retry, maxRetries);
                    return Mono.delay(e.wait, retryTimer)
                            .then(Mono.defer(() -> getWithRateLimit(uri, type, label, retries)));
                });
    }

    /**
     * Retry-After 헤더(정수 초)를 해석한다. 없거나 해석할 수 없으면 기본 대기 시간을 쓴다.
     *
     * @param values 헤더 값 목록
     * @return 대기 시간
     */
    Duration retryAfter(List<String> values) {
        if (values == null || values.isEmpty()) return defaultRetryAfter;
        try {
            long seconds = Long.parseLong(values.get(0).trim());
            return seconds < 0 ? defaultRetryAfter : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            return defaultRetryAfter;
        }
    }

    /** 429 응답을 재시도 루프로 전달하기 위한 내부 신호 */
    private static final class RateLimitedException extends RuntimeException {
        private final Duration wait;

        RateLimitedException(Duration wait) {
            super("rate limited", null, false, false);
            this.wait = wait;
        }
    }
}
