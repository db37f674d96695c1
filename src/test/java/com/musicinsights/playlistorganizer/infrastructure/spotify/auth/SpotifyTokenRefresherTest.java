package com.musicinsights.playlistorganizer.infrastructure.spotify.auth;

import com.musicinsights.playlistorganizer.application.common.error.ReauthenticationRequiredException;
import com.musicinsights.playlistorganizer.infrastructure.config.SpotifyProperties;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyTokenResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * {@link SpotifyTokenRefresher} 단위 테스트.
 */
@DisplayName("spotify token refresher 테스트")
class SpotifyTokenRefresherTest {

    private static final String SESSION = "s1";

    private SpotifyCredentialStore store;
    private SpotifyTokenClient tokenClient;
    private SpotifyTokenRefresher refresher;

    @BeforeEach
    void setUp() {
        store = new SpotifyCredentialStore(new SpotifyProperties());
        tokenClient = mock(SpotifyTokenClient.class);
        refresher = new SpotifyTokenRefresher(store, tokenClient);
    }

    @Test
    @DisplayName("새 refresh token이 내려오면 저장소의 refresh token도 교체")
    void rotatedRefreshToken_isStored() {
        // given
        store.save(SESSION, new SpotifyCredential("a1", "r1"));
        when(tokenClient.refresh("r1"))
                .thenReturn(Mono.just(new SpotifyTokenResponse("a2", "Bearer", 3600, "r2", null)));

        // when / then
        StepVerifier.create(refresher.refresh(SESSION, "a1"))
                .expectNext("a2")
                .verifyComplete();

        assertThat(store.find(SESSION).orElseThrow()).isEqualTo(new SpotifyCredential("a2", "r2"));
    }

    /**
     * 거절된 토큰이 이미 다른 호출에 의해 교체되었다면 토큰 엔드포인트를 부르지 않는지 검증한다.
     */
    @Test
    @DisplayName("거절된 토큰이 이미 교체되어 있으면 현재 토큰을 재사용")
    void alreadyRefreshed_reusesCurrentToken() {
        // given
        store.save(SESSION, new SpotifyCredential("a2", "r1"));

        // when / then
        StepVerifier.create(refresher.refresh(SESSION, "a1"))
                .expectNext("a2")
                .verifyComplete();

        verifyNoInteractions(tokenClient);
    }

    /**
     * 진행 중인 갱신이 있으면 동시에 들어온 호출이 같은 결과를 공유하는지 검증한다.
     */
    @Test
    @DisplayName("동시에 들어온 갱신 요청은 토큰 엔드포인트 호출 하나를 공유")
    void concurrentRefreshes_shareOneExchange() {
        // given
        store.save(SESSION, new SpotifyCredential("a1", "r1"));
        Sinks.One<SpotifyTokenResponse> pending = Sinks.one();
        when(tokenClient.refresh("r1")).thenReturn(pending.asMono());

        // when
        Mono<String> first = refresher.refresh(SESSION, "a1");
        Mono<String> second = refresher.refresh(SESSION, "a1");

        // then
        StepVerifier.create(Mono.zip(first, second))
                .then(() -> pending.tryEmitValue(new SpotifyTokenResponse("a2", "Bearer", 3600, null, null)))
                .assertNext(t -> {
                    assertThat(t.getT1()).isEqualTo("a2");
                    assertThat(t.getT2()).isEqualTo("a2");
                })
                .verifyComplete();

        verify(tokenClient, times(1)).refresh(anyString());
    }

    /**
     * 갱신 결과를 받은 직후 새 토큰이 다시 거절되면 끝난 갱신을 재사용하지 않고 새로 교환하며,
     * 그 새 교환은 이후 호출과 공유되는지 검증한다.
     */
    @Test
    @DisplayName("끝난 갱신은 결과 전달 전에 정리되어, 뒤이은 갱신이 새 교환을 등록하고 공유")
    void completedExchange_doesNotShadowNextOne() {
        // given
        store.save(SESSION, new SpotifyCredential("a1", "r1"));
        Sinks.One<SpotifyTokenResponse> next = Sinks.one();
        when(tokenClient.refresh("r1")).thenReturn(
                Mono.just(new SpotifyTokenResponse("a2", "Bearer", 3600, null, null)),
                next.asMono());
        AtomicReference<String> concurrent = new AtomicReference<>();

        Mono<String> refreshedTwice = refresher.refresh(SESSION, "a1")
                .flatMap(token -> refresher.refresh(SESSION, token));

        // when / then
        StepVerifier.create(refreshedTwice)
                .then(() -> refresher.refresh(SESSION, "a2").subscribe(concurrent::set))
                .then(() -> next.tryEmitValue(new SpotifyTokenResponse("a3", "Bearer", 3600, null, null)))
                .expectNext("a3")
                .verifyComplete();

        assertThat(concurrent.get()).isEqualTo("a3");
        assertThat(store.accessToken(SESSION)).isEqualTo("a3");
        verify(tokenClient, times(2)).refresh("r1");
    }

    @Test
    @DisplayName("access token이 빈 응답은 ReauthenticationRequiredException")
    void blankAccessToken_isFatal() {
        // given
        store.save(SESSION, new SpotifyCredential("a1", "r1"));
        when(tokenClient.refresh("r1"))
                .thenReturn(Mono.just(new SpotifyTokenResponse(" ", "Bearer", 3600, null, null)));

        // when / then
        StepVerifier.create(refresher.refresh(SESSION, "a1"))
                .expectError(ReauthenticationRequiredException.class)
                .verify();

        assertThat(store.accessToken(SESSION)).isEqualTo("a1");
    }

    @Test
    @DisplayName("토큰 엔드포인트 오류는 ReauthenticationRequiredException으로 변환")
    void endpointError_isMappedToReauth() {
        // given
        store.save(SESSION, new SpotifyCredential("a1", "r1"));
        when(tokenClient.refresh("r1")).thenReturn(Mono.error(new RuntimeException("boom")));

        // when / then
        StepVerifier.create(refresher.refresh(SESSION, "a1"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(ReauthenticationRequiredException.class)
                        .hasCauseInstanceOf(RuntimeException.class))
                .verify();
    }

    @Test
    @DisplayName("로그인하지 않은 세션은 ReauthenticationRequiredException")
    void unknownSession_isFatal() {
        StepVerifier.create(refresher.refresh("nobody", null))
                .expectError(ReauthenticationRequiredException.class)
                .verify();

        verifyNoInteractions(tokenClient);
    }
}
