package com.musicinsights.playlistorganizer.infrastructure.reccobeats.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * ReccoBeats {@code /v1/track/{id}/audio-features} 응답.
 *
 * <p>로컬 캐시에도 이 형태의 JSON이 그대로 저장된다.</p>
 *
 * @param acousticness     어쿠스틱 정도(0~1)
 * @param danceability     춤추기 적합도(0~1)
 * @param energy           에너지(0~1)
 * @param instrumentalness 보컬이 없는 정도(0~1)
 * @param key              조성(피치 클래스, -1이면 미검출)
 * @param liveness         라이브 정도(0~1)
 * @param loudness         평균 음량(dB)
 * @param mode             장조(1)/단조(0)
 * @param speechiness      음성 비중(0~1)
 * @param tempo            템포(BPM)
 * @param valence          긍정도(0~1)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReccoBeatsAudioFeatures(
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
) {}
