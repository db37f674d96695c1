package com.musicinsights.playlistorganizer.infrastructure.persistence.r2dbc.row;

/**
 * track_cache 테이블의 한 행입니다.
 *
 * @param trackId         Spotify 트랙 ID(PK)
 * @param serializedValue 오디오 특성 JSON
 */
public record TrackCacheRow(
        String trackId,
        String serializedValue
) {}
