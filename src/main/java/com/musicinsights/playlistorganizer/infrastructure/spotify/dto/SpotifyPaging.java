package com.musicinsights.playlistorganizer.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Spotify paging object.
 *
 * @param items  현재 페이지 아이템
 * @param total  전체 아이템 수
 * @param offset 현재 offset
 * @param limit  요청 limit
 * @param next   다음 페이지 URL(없으면 null)
 * @param <T>    아이템 타입
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpotifyPaging<T>(
        List<T> items,
        int total,
        int offset,
        int limit,
        String next
) {
    public boolean hasNext() {
        return next != null && !next.isBlank();
    }
}
