package com.musicinsights.playlistorganizer.application.auth.controller;

import com.musicinsights.playlistorganizer.application.auth.service.SpotifyAuthService;
import com.musicinsights.playlistorganizer.application.common.error.BadRequestException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.WebSession;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Map;
import java.util.UUID;

/**
 * Spotify 로그인 API 컨트롤러.
 *
 * <p>{@code /spotify-auth}에서 authorize 페이지로 보내고, {@code /callback}에서 코드를 교환한 뒤 홈으로 돌려보낸다.</p>
 */
@RestController
public class SpotifyAuthController {

    static final String STATE_ATTRIBUTE = "spotify.oauth.state";

    private final SpotifyAuthService authService;

    public SpotifyAuthController(SpotifyAuthService authService) {
        this.authService = authService;
    }

    /**
     * Spotify authorize 페이지로 리다이렉트한다.
     *
     * @param session 웹 세션
     * @return 302 응답
     */
    @GetMapping("/spotify-auth")
    public Mono<ResponseEntity<Void>> login(WebSession session) {
        session.start();
        String state = UUID.randomUUID().toString();
        session.getAttributes().put(STATE_ATTRIBUTE, state);

        return Mono.just(ResponseEntity.status(HttpStatus.FOUND)
                .location(authService.authorizeUri(state))
                .build());
    }

    /**
     * OAuth 콜백. state를 확인하고 인가 코드를 토큰으로 교환한다.
     *
     * @param code    인가 코드
     * @param state   authorize 요청 때 보낸 state
     * @param error   사용자가 거부한 경우 Spotify가 보내는 오류
     * @param session 웹 세션
     * @return 홈({@code /})으로 302
     */
    @GetMapping("/callback")
    public Mono<ResponseEntity<Void>> callback(
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String error,
            WebSession session
    ) {
        if (error != null) {
            return Mono.error(new BadRequestException("Spotify authorization denied: " + error, "AUTH_DENIED"));
        }

        Object expected = session.getAttributes().remove(STATE_ATTRIBUTE);
        if (expected == null || !expected.equals(state)) {
            return Mono.error(new BadRequestException("OAuth state mismatch", "AUTH_STATE_MISMATCH"));
        }

        return authService.completeLogin(session.getId(), code)
                .thenReturn(ResponseEntity.status(HttpStatus.FOUND).location(URI.create("/")).<Void>build());
    }

    /**
     * 현재 세션의 로그인 여부.
     *
     * @param session 웹 세션
     * @return {"authenticated": true|false}
     */
    @GetMapping("/api/auth/status")
    public Mono<Map<String, Boolean>> status(WebSession session) {
        return Mono.just(Map.of("authenticated", authService.isSignedIn(session.getId())));
    }

    @PostMapping("/api/auth/logout")
    public Mono<ResponseEntity<Void>> logout(WebSession session) {
        authService.logout(session.getId());
        return session.invalidate().thenReturn(ResponseEntity.noContent().<Void>build());
    }
}
