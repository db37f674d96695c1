package com.musicinsights.playlistorganizer.application.playlist.dto.response;

/**
 * 현재 사용자 응답 DTO.
 *
 * @param id          Spotify 사용자 ID
 * @param displayName 표시 이름
 */
public record UserResponse(String id, String displayName) {}
