package com.musicinsights.playlistorganizer.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Spotify 트랙 객체.
 *
 * <p>응답 그대로의 불변 값이다. 장르/오디오 특성은 별도 enrichment 결과로 덧씌운다.</p>
 *
 * @param id      트랙 ID
 * @param name    트랙 이름
 * @param artists 참여 아티스트 목록
 * @param album   수록 앨범
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyTrack(
        String id,
        String name,
        List<SpotifyArtist> artists,
        SpotifyAlbum album
) {
    /**
     * 대표(첫 번째) 아티스트 ID를 반환한다.
     *
     * @return 대표 아티스트 ID, 아티스트가 없으면 null
     */
    public String primaryArtistId() {
        if (artists == null || artists.isEmpty() || artists.get(0) == null) return null;
        String id = artists.get(0).id();
        return (id == null || id.isBlank()) ? null : id;
    }
}
