package com.musicinsights.playlistorganizer.application.track.mapper;

import com.musicinsights.playlistorganizer.application.playlist.model.Playlist;
import com.musicinsights.playlistorganizer.application.track.model.AudioFeatures;
import com.musicinsights.playlistorganizer.application.track.model.Track;
import com.musicinsights.playlistorganizer.application.track.model.TrackEnrichment;
import com.musicinsights.playlistorganizer.infrastructure.reccobeats.dto.ReccoBeatsAudioFeatures;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyAlbum;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyArtist;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyImage;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyPlaylist;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyTrack;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@link TrackMapper} 테스트.
 */
@DisplayName("track mapper 테스트")
class TrackMapperTest {

    /**
     * enrichment 오버레이의 장르/특성이 트랙에 입혀지고, 원본 Spotify 트랙은 그대로인지 검증한다.
     */
    @Test
    @DisplayName("장르/오디오 특성 오버레이를 트랙에 적용하고 ID 없는 항목은 버림")
    void appliesOverlay() {
        // given
        SpotifyTrack t1 = new SpotifyTrack("t1", "One",
                List.of(new SpotifyArtist("a1", "Artist", List.of("pop"))),
                new SpotifyAlbum("al1", "Album", List.of(new SpotifyImage("http://img/1", 640, 640)), "2015-02-02"));
        SpotifyTrack t2 = new SpotifyTrack("t2", "Two", null, null);
        SpotifyTrack noId = new SpotifyTrack(null, "Broken", null, null);

        ReccoBeatsAudioFeatures f = new ReccoBeatsAudioFeatures(0.1f, 0.7f, 0.9f, 0f, 2, 0.1f, -4f, 1, 0.04f, 128f, 0.8f);
        TrackEnrichment enrichment = new TrackEnrichment(Map.of("t1", "dance pop"), Map.of("t1", f));

        // when
        List<Track> tracks = TrackMapper.toTracks(Arrays.asList(t1, t2, noId, null), enrichment);

        // then
        assertThat(tracks).extracting(Track::id).containsExactly("t1", "t2");

        Track first = tracks.get(0);
        assertThat(first.genre()).isEqualTo("dance pop");
        assertThat(first.features().tempo()).isEqualTo(128f);
        assertThat(first.album().imageUrl()).isEqualTo("http://img/1");
        assertThat(first.releaseYear()).isEqualTo(2015);

        Track second = tracks.get(1);
        assertThat(second.genre()).isEqualTo("unknown");
        assertThat(second.features()).isEqualTo(AudioFeatures.NONE);
        assertThat(second.album().imageUrl()).isEmpty();

        assertThat(t1.artists().get(0).genres()).containsExactly("pop");
    }

    @Test
    @DisplayName("플레이리스트 설명이 없으면 빈 문자열, 트랙 수는 tracks.total")
    void toPlaylist() {
        SpotifyPlaylist sp = new SpotifyPlaylist("p1", "Mix", null, List.of(),
                new SpotifyPlaylist.TrackRef("https://api/p1/tracks", 42));

        Playlist playlist = TrackMapper.toPlaylist(sp);

        assertThat(playlist.description()).isEmpty();
        assertThat(playlist.trackCount()).isEqualTo(42);
        assertThat(playlist.imageUrl()).isEmpty();
    }
}
