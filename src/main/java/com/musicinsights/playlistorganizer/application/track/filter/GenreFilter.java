package com.musicinsights.playlistorganizer.application.track.filter;

import com.musicinsights.playlistorganizer.application.track.model.Track;

/**
 * 장르 일치(대소문자 무시) 필터.
 *
 * @param genre 장르
 */
public record GenreFilter(String genre) implements TrackFilter {

    public GenreFilter {
        if (genre == null || genre.isBlank()) {
            throw new IllegalArgumentException("genre must not be blank");
        }
        genre = genre.trim();
    }

    @Override
    public String label() {
        return "Genre: " + genre;
    }

    @Override
    public String suggestedPlaylistName() {
        return "Best of " + genre;
    }

    @Override
    public boolean matches(Track track) {
        return genre.equalsIgnoreCase(track.genre());
    }
}
