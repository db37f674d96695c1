package com.musicinsights.playlistorganizer.application.track.filter;

import com.musicinsights.playlistorganizer.application.track.model.Track;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 모든 하위 필터를 만족해야 통과하는 AND 결합 필터.
 *
 * @param filters 하위 필터(1개 이상)
 */
public record CompositeFilter(List<TrackFilter> filters) implements TrackFilter {

    public CompositeFilter {
        if (filters == null || filters.isEmpty()) {
            throw new IllegalArgumentException("At least one filter is required");
        }
        filters = List.copyOf(filters);
    }

    @Override
    public String label() {
        return filters.stream().map(TrackFilter::label).collect(Collectors.joining(" + "));
    }

    @Override
    public String suggestedPlaylistName() {
        return filters.get(0).suggestedPlaylistName();
    }

    @Override
    public boolean matches(Track track) {
        return filters.stream().allMatch(f -> f.matches(track));
    }
}
