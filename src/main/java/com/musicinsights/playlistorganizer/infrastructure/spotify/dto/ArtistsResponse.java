package com.musicinsights.playlistorganizer.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * {@code GET /artists?ids=...} 응답.
 *
 * <p>존재하지 않는 ID는 배열 안에 null로 내려온다.</p>
 *
 * @param artists 아티스트 목록
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtistsResponse(List<SpotifyArtist> artists) {}
