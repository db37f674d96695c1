package com.musicinsights.playlistorganizer.application.track.model;

import com.musicinsights.playlistorganizer.infrastructure.reccobeats.dto.ReccoBeatsAudioFeatures;

import java.util.Map;

/**
 * 트랙 ID 기준 enrichment 결과 오버레이.
 *
 * <p>원본 Spotify 트랙을 바꾸지 않고, 도메인 {@link Track}을 만들 때 이 결과를 합친다.</p>
 *
 * @param genreByTrackId    트랙 ID → 장르(항상 비어 있지 않음)
 * @param featuresByTrackId 트랙 ID → 오디오 특성(찾은 것만)
 */
public record TrackEnrichment(
        Map<String, String> genreByTrackId,
        Map<String, ReccoBeatsAudioFeatures> featuresByTrackId
) {
    public static final TrackEnrichment EMPTY = new TrackEnrichment(Map.of(), Map.of());

    public TrackEnrichment {
        genreByTrackId = genreByTrackId == null ? Map.of() : Map.copyOf(genreByTrackId);
        featuresByTrackId = featuresByTrackId == null ? Map.of() : Map.copyOf(featuresByTrackId);
    }

    public String genreOf(String trackId) {
        if (trackId == null) return Track.UNKNOWN_GENRE;
        return genreByTrackId.getOrDefault(trackId, Track.UNKNOWN_GENRE);
    }

    public ReccoBeatsAudioFeatures featuresOf(String trackId) {
        return trackId == null ? null : featuresByTrackId.get(trackId);
    }
}
