package com.musicinsights.playlistorganizer.application.track.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 장르와 오디오 특성이 덧씌워진 트랙 도메인 객체.
 *
 * <p>생성 시점에 enrichment 결과를 합쳐 만들며 이후 바뀌지 않는다.
 * 장르는 비어 있을 수 없고, 알 수 없으면 {@link #UNKNOWN_GENRE}이다.</p>
 *
 * @param id       Spotify 트랙 ID
 * @param name     트랙 이름
 * @param artists  아티스트 목록
 * @param album    앨범
 * @param genre    대표 아티스트의 첫 장르
 * @param features 오디오 특성
 */
public record Track(
        String id,
        String name,
        List<Artist> artists,
        Album album,
        String genre,
        AudioFeatures features
) {
    public static final String UNKNOWN_GENRE = "unknown";
    public static final String UNKNOWN_DECADE = "unknown";

    public Track {
        artists = artists == null ? List.of() : List.copyOf(artists);
        genre = (genre == null || genre.isBlank()) ? UNKNOWN_GENRE : genre;
        features = features == null ? AudioFeatures.NONE : features;
    }

    /**
     * 앨범 발매일 앞 네 자리로 발매 연도를 구한다.
     *
     * @return 발매 연도, 알 수 없으면 null
     */
    public Integer releaseYear() {
        if (album == null || album.releaseDate() == null || album.releaseDate().length() < 4) return null;
        try {
            return Integer.parseInt(album.releaseDate().substring(0, 4));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * "1990s" 형식의 연대.
     *
     * @return 연대, 발매 연도를 모르면 {@link #UNKNOWN_DECADE}
     */
    public String decade() {
        Integer year = releaseYear();
        if (year == null) return UNKNOWN_DECADE;
        return (year / 10 * 10) + "s";
    }

    /**
     * valence/energy로 분류한 분위기.
     *
     * @return 분위기
     */
    public Mood mood() {
        return Mood.of(features.valence(), features.energy());
    }

    public String artistDisplay() {
        return artists.stream()
                .map(Artist::name)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(", "));
    }

    public String spotifyUri() {
        return "spotify:track:" + id;
    }
}
