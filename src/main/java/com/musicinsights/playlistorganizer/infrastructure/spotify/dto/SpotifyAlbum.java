package com.musicinsights.playlistorganizer.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Spotify 앨범 객체.
 *
 * @param id          앨범 ID
 * @param name        앨범 이름
 * @param images      커버 이미지 목록
 * @param releaseDate 발매일(YYYY, YYYY-MM, YYYY-MM-DD 중 하나)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyAlbum(
        String id,
        String name,
        List<SpotifyImage> images,
        @JsonProperty("release_date") String releaseDate
) {
    /**
     * 대표 이미지 URL을 반환한다.
     *
     * @return 첫 번째 이미지 URL, 없으면 빈 문자열
     */
    public String imageUrl() {
        if (images == null || images.isEmpty() || images.get(0) == null) return "";
        String url = images.get(0).url();
        return url == null ? "" : url;
    }
}
