package com.musicinsights.playlistorganizer.application.track.model;

/**
 * valence(긍정도)와 energy로 나눈 트랙 분위기.
 */
public enum Mood {
    UPBEAT("Upbeat/Happy"),
    CHILL("Chill/Calm"),
    SAD("Sad/Gloomy"),
    ANGRY("Angry/Aggressive"),
    NEUTRAL("Neutral");

    private final String label;

    Mood(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * 위에서부터 처음 맞는 구간으로 분류한다.
     *
     * @param valence 긍정도(0~1)
     * @param energy  에너지(0~1)
     * @return 분위기
     */
    public static Mood of(float valence, float energy) {
        if (valence > 0.6f && energy > 0.6f) return UPBEAT;
        if (valence > 0.5f && energy < 0.4f) return CHILL;
        if (valence < 0.3f && energy < 0.3f) return SAD;
        if (valence < 0.3f && energy > 0.7f) return ANGRY;
        return NEUTRAL;
    }
}
