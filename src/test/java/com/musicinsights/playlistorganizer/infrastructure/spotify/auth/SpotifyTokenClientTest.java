package com.musicinsights.playlistorganizer.infrastructure.spotify.auth;

import com.musicinsights.playlistorganizer.infrastructure.config.SpotifyProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link SpotifyTokenClient} 단위 테스트.
 */
@DisplayName("spotify token client 테스트")
class SpotifyTokenClientTest {

    private final List<ClientRequest> sent = new ArrayList<>();
    private HttpStatus status = HttpStatus.OK;
    private SpotifyTokenClient client;

    @BeforeEach
    void setUp() {
        SpotifyProperties props = new SpotifyProperties();
        props.setClientId("client");
        props.setClientSecret("secret");
        props.setRedirectUri("http://localhost:8080/callback");

        WebClient webClient = WebClient.builder()
                .baseUrl("https://accounts.spotify.com")
                .exchangeFunction(req -> {
                    sent.add(req);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, "application/json")
                            .body("""
                                    {"access_token":"a2","token_type":"Bearer","expires_in":3600,"scope":"playlist-read-private"}
                                    """)
                            .build());
                })
                .build();

        client = new SpotifyTokenClient(webClient, props);
    }

    /**
     * refresh 요청이 Basic 인증 헤더와 form 콘텐츠 타입으로 토큰 엔드포인트에 POST 되는지 검증한다.
     */
    @Test
    @DisplayName("refresh 요청은 Basic 인증과 form-urlencoded로 POST /api/token")
    void refresh_postsFormWithBasicAuth() {
        // when / then
        StepVerifier.create(client.refresh("r1"))
                .assertNext(resp -> {
                    assertThat(resp.accessToken()).isEqualTo("a2");
                    assertThat(resp.refreshToken()).isNull();
                    assertThat(resp.expiresIn()).isEqualTo(3600);
                })
                .verifyComplete();

        ClientRequest req = sent.get(0);
        String expectedBasic = "Basic " + Base64.getEncoder()
                .encodeToString("client:secret".getBytes(StandardCharsets.UTF_8));

        assertThat(req.method()).isEqualTo(HttpMethod.POST);
        assertThat(req.url().getPath()).isEqualTo("/api/token");
        assertThat(req.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo(expectedBasic);
        assertThat(req.headers().getContentType()).isEqualTo(MediaType.APPLICATION_FORM_URLENCODED);
    }

    @Test
    @DisplayName("토큰 엔드포인트의 오류 응답은 WebClientResponseException으로 전파")
    void errorStatus_isPropagated() {
        status = HttpStatus.BAD_REQUEST;

        StepVerifier.create(client.exchangeCode("code-1"))
                .expectError(WebClientResponseException.class)
                .verify();
    }
}
