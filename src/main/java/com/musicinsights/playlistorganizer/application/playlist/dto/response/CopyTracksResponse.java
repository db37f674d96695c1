package com.musicinsights.playlistorganizer.application.playlist.dto.response;

/**
 * 필터링된 트랙 복사 결과.
 *
 * @param playlistId   대상 플레이리스트 ID
 * @param playlistName 대상 플레이리스트 이름
 * @param created      이번 요청으로 새로 만들었는지 여부
 * @param filter       적용된 필터 설명
 * @param addedCount   추가한 트랙 수
 */
public record CopyTracksResponse(
        String playlistId,
        String playlistName,
        boolean created,
        String filter,
        int addedCount
) {}
