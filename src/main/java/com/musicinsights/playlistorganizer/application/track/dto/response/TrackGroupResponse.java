package com.musicinsights.playlistorganizer.application.track.dto.response;

import java.util.List;

/**
 * 장르/연대별 트랙 그룹.
 *
 * @param key    그룹 키(장르 또는 연대)
 * @param count  트랙 수
 * @param tracks 트랙 목록
 */
public record TrackGroupResponse(
        String key,
        int count,
        List<TrackResponse> tracks
) {}
