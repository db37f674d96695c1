package com.musicinsights.playlistorganizer.application.playlist.dto.response;

import com.musicinsights.playlistorganizer.application.playlist.model.Playlist;

/**
 * 플레이리스트 API 응답 DTO.
 *
 * @param id          플레이리스트 ID
 * @param name        이름
 * @param description 설명
 * @param imageUrl    커버 이미지 URL
 * @param trackCount  트랙 수
 */
public record PlaylistResponse(
        String id,
        String name,
        String description,
        String imageUrl,
        int trackCount
) {
    public static PlaylistResponse from(Playlist p) {
        return new PlaylistResponse(p.id(), p.name(), p.description(), p.imageUrl(), p.trackCount());
    }
}
