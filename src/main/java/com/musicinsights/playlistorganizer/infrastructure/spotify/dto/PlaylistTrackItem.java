package com.musicinsights.playlistorganizer.infrastructure.spotify.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 플레이리스트 트랙 목록의 한 항목.
 *
 * <p>로컬 파일이나 삭제된 트랙이면 track이 null일 수 있다.</p>
 *
 * @param track 트랙
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaylistTrackItem(SpotifyTrack track) {}
