package com.musicinsights.playlistorganizer.application.playlist.model;

/**
 * 플레이리스트 도메인 객체.
 *
 * @param id          Spotify 플레이리스트 ID
 * @param name        이름
 * @param description 설명
 * @param imageUrl    커버 이미지 URL(없으면 빈 문자열)
 * @param trackCount  트랙 수
 */
public record Playlist(
        String id,
        String name,
        String description,
        String imageUrl,
        int trackCount
) {}
