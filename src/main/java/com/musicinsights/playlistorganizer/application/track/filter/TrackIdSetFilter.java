package com.musicinsights.playlistorganizer.application.track.filter;

import com.musicinsights.playlistorganizer.application.track.model.Track;

import java.util.Set;

/**
 * 미리 계산된 트랙 ID 집합으로 거르는 필터.
 *
 * <p>자연어(AI) 필터처럼 외부에서 한 번 평가한 결과를 받아 쓴다.</p>
 *
 * @param description           필터 조건 설명(예: 사용자가 입력한 문장)
 * @param suggestedPlaylistName 외부에서 제안한 플레이리스트 이름
 * @param trackIds              조건을 만족하는 트랙 ID
 */
public record TrackIdSetFilter(String description, String suggestedPlaylistName, Set<String> trackIds)
        implements TrackFilter {

    public TrackIdSetFilter {
        trackIds = trackIds == null ? Set.of() : Set.copyOf(trackIds);
        description = description == null || description.isBlank() ? "Selected tracks" : description;
        suggestedPlaylistName = suggestedPlaylistName == null || suggestedPlaylistName.isBlank()
                ? description
                : suggestedPlaylistName;
    }

    @Override
    public String label() {
        return "AI: " + description;
    }

    @Override
    public boolean matches(Track track) {
        return trackIds.contains(track.id());
    }
}
