package com.musicinsights.playlistorganizer.application.track.dto.response;

import com.musicinsights.playlistorganizer.application.track.model.AudioFeatures;
import com.musicinsights.playlistorganizer.application.track.model.Track;

/**
 * 트랙 API 응답 DTO.
 *
 * @param id          트랙 ID
 * @param name        트랙 이름
 * @param artists     아티스트 이름(콤마 구분)
 * @param albumName   앨범 이름
 * @param imageUrl    앨범 커버 URL
 * @param releaseYear 발매 연도(모르면 null)
 * @param decade      연대("1990s" 또는 "unknown")
 * @param genre       장르("unknown" 포함)
 * @param mood        분위기 라벨
 * @param uri         Spotify URI
 * @param features    오디오 특성(없으면 0 값)
 */
public record TrackResponse(
        String id,
        String name,
        String artists,
        String albumName,
        String imageUrl,
        Integer releaseYear,
        String decade,
        String genre,
        String mood,
        String uri,
        AudioFeatures features
) {
    public static TrackResponse from(Track t) {
        return new TrackResponse(
                t.id(),
                t.name(),
                t.artistDisplay(),
                t.album() == null ? "" : t.album().name(),
                t.album() == null ? "" : t.album().imageUrl(),
                t.releaseYear(),
                t.decade(),
                t.genre(),
                t.mood().label(),
                t.spotifyUri(),
                t.features()
        );
    }
}
