package com.musicinsights.playlistorganizer.application.track.filter;

import com.musicinsights.playlistorganizer.application.track.model.Track;

/**
 * 발매 연도 범위 필터. 상한이 없으면 minYear 이후 전부다.
 *
 * <p>발매 연도를 알 수 없는 트랙은 통과하지 못한다.</p>
 *
 * @param minYear 최소 연도(포함)
 * @param maxYear 최대 연도(포함, nullable)
 */
public record YearRangeFilter(int minYear, Integer maxYear) implements TrackFilter {

    public YearRangeFilter {
        if (maxYear != null && maxYear < minYear) {
            throw new IllegalArgumentException("maxYear must not be before minYear");
        }
    }

    @Override
    public String label() {
        return maxYear != null
                ? "Songs " + minYear + "-" + maxYear
                : "Songs from " + minYear + " onwards";
    }

    @Override
    public String suggestedPlaylistName() {
        return maxYear != null
                ? "Classics " + minYear + "-" + maxYear
                : "Modern Classics (" + minYear + "+)";
    }

    @Override
    public boolean matches(Track track) {
        Integer year = track.releaseYear();
        if (year == null) return false;
        if (year < minYear) return false;
        return maxYear == null || year <= maxYear;
    }
}
