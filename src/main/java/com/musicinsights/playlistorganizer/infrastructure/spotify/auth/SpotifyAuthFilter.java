package com.musicinsights.playlistorganizer.infrastructure.spotify.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Spotify Web API 호출에 Bearer 토큰을 붙이고, 401이면 한 번만 갱신 후 재시도하는 필터.
 *
 * <p>세션은 요청 attribute({@link #SESSION_ATTRIBUTE})로 전달받는다.
 * 흐름은 다음과 같다.</p>
 * <ol>
 *   <li>저장소의 현재 access token을 Authorization 헤더에 싣고 보낸다.</li>
 *   <li>401이 아니면 응답을 그대로 돌려준다(성공이든 다른 오류든).</li>
 *   <li>401이면 {@link SpotifyTokenRefresher}로 갱신한 뒤 새 토큰으로 정확히 한 번 더 보낸다.
 *       두 번째 응답은 결과와 무관하게 그대로 돌려준다.</li>
 *   <li>갱신이 실패하면 재전송 없이 재인증 필요 예외로 끝난다.</li>
 * </ol>
 */
@Component
public class SpotifyAuthFilter implements ExchangeFilterFunction {

    private static final Logger log = LoggerFactory.getLogger(SpotifyAuthFilter.class);

    /** 요청을 보낸 사용자 세션 ID를 담는 ClientRequest attribute 키 */
    public static final String SESSION_ATTRIBUTE = SpotifyAuthFilter.class.getName() + ".sessionId";

    private final SpotifyCredentialStore credentialStore;
    private final SpotifyTokenRefresher tokenRefresher;

    public SpotifyAuthFilter(SpotifyCredentialStore credentialStore, SpotifyTokenRefresher tokenRefresher) {
        this.credentialStore = credentialStore;
        this.tokenRefresher = tokenRefresher;
    }

    /**
     * {@code WebClient.RequestHeadersSpec#attributes}에 넘길 세션 지정자.
     *
     * @param sessionId 세션 ID
     * @return attribute 설정 함수
     */
    public static Consumer<Map<String, Object>> session(String sessionId) {
        return attrs -> attrs.put(SESSION_ATTRIBUTE, sessionId);
    }

    @Override
    public Mono<ClientResponse> filter(ClientRequest request, ExchangeFunction next) {
        String sessionId = request.attribute(SESSION_ATTRIBUTE)
                .map(Object::toString)
                .orElseThrow(() -> new IllegalStateException(
                        "Spotify request without session attribute: " + request.method() + " " + request.url()));

        String token = credentialStore.accessToken(sessionId);

        return next.exchange(withBearer(request, token))
                .flatMap(response -> {
                    if (response.statusCode().value() != 401) {
                        return Mono.just(response);
                    }

                    log.warn("Spotify returned 401 for {} {}; refreshing access token",
                            request.method(), request.url().getPath());

                    return response.releaseBody()
                            .then(tokenRefresher.refresh(sessionId, token))
                            .flatMap(newToken -> next.exchange(withBearer(request, newToken)));
                });
    }

    private static ClientRequest withBearer(ClientRequest request, String token) {
        return ClientRequest.from(request)
                .headers(h -> {
                    h.remove(HttpHeaders.AUTHORIZATION);
                    if (token != null && !token.isBlank()) {
                        h.setBearerAuth(token);
                    }
                })
                .build();
    }
}
