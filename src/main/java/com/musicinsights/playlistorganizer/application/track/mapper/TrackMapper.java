package com.musicinsights.playlistorganizer.application.track.mapper;

import com.musicinsights.playlistorganizer.application.playlist.model.Playlist;
import com.musicinsights.playlistorganizer.application.track.model.Album;
import com.musicinsights.playlistorganizer.application.track.model.Artist;
import com.musicinsights.playlistorganizer.application.track.model.AudioFeatures;
import com.musicinsights.playlistorganizer.application.track.model.Track;
import com.musicinsights.playlistorganizer.application.track.model.TrackEnrichment;
import com.musicinsights.playlistorganizer.infrastructure.reccobeats.dto.ReccoBeatsAudioFeatures;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyAlbum;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyPlaylist;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyTrack;

import java.util.List;
import java.util.Objects;

/**
 * Spotify 응답 DTO를 도메인 객체로 변환하는 매퍼.
 *
 * <p>트랙은 enrichment 오버레이를 합쳐서 만든다. 오디오 특성이 없으면 0 값, 장르가 없으면 "unknown"이다.</p>
 */
public final class TrackMapper {

    private TrackMapper() {}

    /**
     * Spotify 트랙 목록을 도메인 트랙 목록으로 변환한다. ID 없는 항목은 버린다.
     *
     * @param tracks     Spotify 트랙
     * @param enrichment 장르/특성 오버레이
     * @return 도메인 트랙
     */
    public static List<Track> toTracks(List<SpotifyTrack> tracks, TrackEnrichment enrichment) {
        return tracks.stream()
                .filter(Objects::nonNull)
                .filter(t -> t.id() != null && !t.id().isBlank())
                .map(t -> toTrack(t, enrichment))
                .toList();
    }

    public static Track toTrack(SpotifyTrack track, TrackEnrichment enrichment) {
        List<Artist> artists = track.artists() == null ? List.of() : track.artists().stream()
                .filter(Objects::nonNull)
                .map(a -> new Artist(a.id(), a.name()))
                .toList();

        return new Track(
                track.id(),
                track.name(),
                artists,
                toAlbum(track.album()),
                enrichment.genreOf(track.id()),
                toFeatures(enrichment.featuresOf(track.id()))
        );
    }

    public static Playlist toPlaylist(SpotifyPlaylist playlist) {
        return new Playlist(
                playlist.id(),
                playlist.name(),
                playlist.description() == null ? "" : playlist.description(),
                playlist.imageUrl(),
                playlist.trackCount()
        );
    }

    private static Album toAlbum(SpotifyAlbum album) {
        if (album == null) return new Album(null, "", "", null);
        return new Album(album.id(), album.name(), album.imageUrl(), album.releaseDate());
    }

    private static AudioFeatures toFeatures(ReccoBeatsAudioFeatures f) {
        if (f == null) return AudioFeatures.NONE;
        return new AudioFeatures(
                f.acousticness(),
                f.danceability(),
                f.energy(),
                f.instrumentalness(),
                f.key(),
                f.liveness(),
                f.loudness(),
                f.mode(),
                f.speechiness(),
                f.tempo(),
                f.valence()
        );
    }
}
