package com.musicinsights.playlistorganizer.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 토큰 엔드포인트 응답.
 *
 * <p>refresh 응답에서는 refreshToken이 생략될 수 있다.</p>
 *
 * @param accessToken  새 access token
 * @param tokenType    토큰 타입(Bearer)
 * @param expiresIn    만료까지 남은 초
 * @param refreshToken 새 refresh token(없으면 null)
 * @param scope        부여된 scope
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyTokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") Integer expiresIn,
        @JsonProperty("refresh_token") String refreshToken,
        String scope
) {}
