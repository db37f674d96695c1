package com.musicinsights.playlistorganizer.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Spotify 이미지 객체.
 *
 * @param url    이미지 URL
 * @param height 높이(px, 없을 수 있음)
 * @param width  너비(px, 없을 수 있음)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyImage(
        String url,
        Integer height,
        Integer width
) {}
