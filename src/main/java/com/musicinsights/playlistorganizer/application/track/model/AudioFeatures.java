package com.musicinsights.playlistorganizer.application.track.model;

/**
 * 트랙의 오디오 특성.
 *
 * <p>enrichment에 실패한 트랙은 {@link #NONE}(모든 값 0)을 가진다.</p>
 */
public record AudioFeatures(
        float acousticness,
        float danceability,
        float energy,
        float instrumentalness,
        int key,
        float liveness,
        float loudness,
        int mode,
        float speechiness,
        float tempo,
        float valence
) {
    public static final AudioFeatures NONE = new AudioFeatures(0f, 0f, 0f, 0f, 0, 0f, 0f, 0, 0f, 0f, 0f);
}
