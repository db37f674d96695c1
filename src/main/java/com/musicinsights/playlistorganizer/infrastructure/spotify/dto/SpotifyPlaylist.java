package com.musicinsights.playlistorganizer.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Spotify 플레이리스트 객체.
 *
 * @param id          플레이리스트 ID
 * @param name        이름
 * @param description 설명
 * @param images      커버 이미지 목록
 * @param tracks      트랙 메타(총 개수)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyPlaylist(
        String id,
        String name,
        String description,
        List<SpotifyImage> images,
        TrackRef tracks
) {

    /**
     * 플레이리스트 응답에 포함되는 트랙 참조 정보.
     *
     * @param href  트랙 목록 URL
     * @param total 총 트랙 수
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TrackRef(String href, int total) {}

    public String imageUrl() {
        if (images == null || images.isEmpty() || images.get(0) == null) return "";
        String url = images.get(0).url();
        return url == null ? "" : url;
    }

    public int trackCount() {
        return tracks == null ? 0 : tracks.total();
    }
}
