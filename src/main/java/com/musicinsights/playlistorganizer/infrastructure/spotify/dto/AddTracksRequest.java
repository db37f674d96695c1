package com.musicinsights.playlistorganizer.infrastructure.spotify.dto;

import java.util.List;

/**
 * 플레이리스트 트랙 추가 요청 바디.
 *
 * @param uris {@code spotify:track:{id}} 형식 URI 목록(최대 100개)
 */
public record AddTracksRequest(List<String> uris) {}
