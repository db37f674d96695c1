package com.musicinsights.playlistorganizer.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 현재 로그인한 Spotify 사용자.
 *
 * @param id          사용자 ID
 * @param displayName 표시 이름
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyUser(
        String id,
        @JsonProperty("display_name") String displayName
) {}
