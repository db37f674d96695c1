package com.musicinsights.playlistorganizer.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 플레이리스트 생성 요청 바디.
 *
 * @param name        이름
 * @param description 설명
 * @param isPublic    공개 여부
 */
public record CreatePlaylistRequest(
        String name,
        String description,
        @JsonProperty("public") boolean isPublic
) {}
