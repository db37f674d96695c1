package com.musicinsights.playlistorganizer.infrastructure.reccobeats.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * ReccoBeats {@code /v1/track?ids=} 응답.
 *
 * @param content 조회된 트랙 목록(Spotify ID에 대응하는 ReccoBeats 트랙)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReccoBeatsTrackLookupResponse(List<TrackInfo> content) {

    /**
     * ReccoBeats 트랙 정보.
     *
     * @param id         ReccoBeats 내부 ID
     * @param trackTitle 트랙 제목
     * @param href       Spotify 트랙 URL
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TrackInfo(String id, String trackTitle, String href) {}

    /**
     * 첫 번째 결과의 ReccoBeats ID를 반환한다.
     *
     * @return ReccoBeats ID, 결과가 없으면 null
     */
    public String firstId() {
        if (content == null || content.isEmpty() || content.get(0) == null) return null;
        String id = content.get(0).id();
        return (id == null || id.isBlank()) ? null : id;
    }
}
