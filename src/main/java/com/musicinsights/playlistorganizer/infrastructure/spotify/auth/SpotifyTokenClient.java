package com.musicinsights.playlistorganizer.infrastructure.spotify.auth;

import com.musicinsights.playlistorganizer.infrastructure.config.SpotifyProperties;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyTokenResponse;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Spotify 토큰 엔드포인트({@code POST /api/token}) 클라이언트.
 *
 * <p>client id/secret으로 만든 Basic 인증 헤더와 form-urlencoded 바디를 보낸다.
 * 상태를 가지지 않으며, 결과 저장은 호출자 책임이다.</p>
 */
@Component
public class SpotifyTokenClient {

    private final WebClient accountsWebClient;
    private final SpotifyProperties props;

    public SpotifyTokenClient(@Qualifier("spotifyAccountsWebClient") WebClient accountsWebClient,
                              SpotifyProperties props) {
        this.accountsWebClient = accountsWebClient;
        this.props = props;
    }

    /**
     * refresh token으로 새 access token을 발급받는다.
     *
     * @param refreshToken refresh token
     * @return 토큰 응답(비 2xx면 WebClientResponseException)
     */
    public Mono<SpotifyTokenResponse> refresh(String refreshToken) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);
        return requestToken(form);
    }

    /**
     * OAuth 콜백으로 받은 인가 코드를 최초 토큰 쌍으로 교환한다.
     *
     * @param code 인가 코드
     * @return 토큰 응답(access + refresh)
     */
    public Mono<SpotifyTokenResponse> exchangeCode(String code) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("redirect_uri", props.getRedirectUri());
        return requestToken(form);
    }

    private Mono<SpotifyTokenResponse> requestToken(MultiValueMap<String, String> form) {
        return accountsWebClient.post()
                .uri("/api/token")
                .headers(h -> h.setBasicAuth(props.getClientId(), props.getClientSecret()))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(SpotifyTokenResponse.class);
    }
}
