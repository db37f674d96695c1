package com.musicinsights.playlistorganizer.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Spotify 아티스트 객체.
 *
 * <p>트랙 응답 안의 simplified artist에는 genres가 없으므로 null일 수 있다.</p>
 *
 * @param id     아티스트 ID
 * @param name   아티스트 이름
 * @param genres 장르 목록(없으면 null)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyArtist(
        String id,
        String name,
        List<String> genres
) {
    /**
     * 첫 번째 장르를 반환한다.
     *
     * @return 첫 장르, 없으면 null
     */
    public String firstGenre() {
        if (genres == null) return null;
        return genres.stream()
                .filter(g -> g != null && !g.isBlank())
                .findFirst()
                .orElse(null);
    }
}
