package com.musicinsights.playlistorganizer.application.track.service;

import com.musicinsights.playlistorganizer.application.common.error.BadRequestException;
import com.musicinsights.playlistorganizer.application.common.pagination.CursorCodec;
import com.musicinsights.playlistorganizer.application.track.model.Track;
import com.musicinsights.playlistorganizer.application.track.model.TrackEnrichment;
import com.musicinsights.playlistorganizer.infrastructure.spotify.SpotifyApiClient;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.PlaylistTrackItem;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyAlbum;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyArtist;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyPaging;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyTrack;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * {@link TrackService} 단위 테스트.
 */
@DisplayName("track service 테스트")
class TrackServiceTest {

    private static final String SESSION = "s1";

    private SpotifyApiClient api;
    private TrackEnricher enricher;
    private TrackService service;

    @BeforeEach
    void setUp() {
        api = mock(SpotifyApiClient.class);
        enricher = mock(TrackEnricher.class);
        service = new TrackService(api, enricher);
    }

    /**
     * 첫 페이지 조회 시 다음 offset이 커서로 인코딩되어 내려가는지 검증한다.
     */
    @Test
    @DisplayName("다음 페이지가 있으면 다음 offset을 담은 커서를 반환")
    void trackPage_encodesNextCursor() {
        // given
        when(api.getPlaylistTracks(SESSION, "p1", 0, 2))
                .thenReturn(Mono.just(page(List.of(track("t1", "1995-05-01"), track("t2", "2004")), 0, "next-url")));
        when(enricher.enrich(eq(SESSION), anyList()))
                .thenReturn(Mono.just(new TrackEnrichment(Map.of("t1", "rock"), Map.of())));

        // when / then
        StepVerifier.create(service.getTrackPage(SESSION, "p1", null, 2))
                .assertNext(page -> {
                    assertThat(page.items()).extracting(Track::id).containsExactly("t1", "t2");
                    assertThat(page.items()).extracting(Track::genre).containsExactly("rock", "unknown");
                    assertThat(page.hasNext()).isTrue();
                    assertThat(CursorCodec.decodeOffset(page.nextCursor())).isEqualTo(2);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("커서의 offset으로 다음 페이지를 요청하고 마지막 페이지면 커서가 없음")
    void trackPage_usesCursorOffset() {
        // given
        when(api.getPlaylistTracks(SESSION, "p1", 2, 2))
                .thenReturn(Mono.just(page(List.of(track("t3", "2010")), 2, null)));
        when(enricher.enrich(eq(SESSION), anyList())).thenReturn(Mono.just(TrackEnrichment.EMPTY));

        // when / then
        StepVerifier.create(service.getTrackPage(SESSION, "p1", CursorCodec.encodeOffset(2), 2))
                .assertNext(page -> {
                    assertThat(page.items()).hasSize(1);
                    assertThat(page.hasNext()).isFalse();
                    assertThat(page.nextCursor()).isNull();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("손상된 커서는 INVALID_CURSOR 400")
    void trackPage_invalidCursor() {
        StepVerifier.create(service.getTrackPage(SESSION, "p1", "not-a-cursor!!", 10))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(BadRequestException.class);
                    assertThat(((BadRequestException) e).code()).isEqualTo("INVALID_CURSOR");
                })
                .verify();

        verifyNoInteractions(api);
    }

    /**
     * 전체 조회는 100개 단위로 페이지를 끝까지 따라간 뒤 enrichment를 한 번만 수행하는지 검증한다.
     */
    @Test
    @DisplayName("모든 페이지를 순차 조회한 뒤 enrichment는 한 번만 수행")
    void allTracks_followsPagination_andEnrichesOnce() {
        // given
        List<SpotifyTrack> first = new ArrayList<>();
        for (int i = 0; i < 100; i++) first.add(track("t" + i, "2001"));

        when(api.getPlaylistTracks(SESSION, "p1", 0, 100))
                .thenReturn(Mono.just(page(first, 0, "next-url")));
        when(api.getPlaylistTracks(SESSION, "p1", 100, 100))
                .thenReturn(Mono.just(page(List.of(track("t100", "1987")), 100, null)));
        when(enricher.enrich(eq(SESSION), anyList())).thenReturn(Mono.just(TrackEnrichment.EMPTY));

        // when / then
        StepVerifier.create(service.getAllTracks(SESSION, "p1"))
                .assertNext(tracks -> assertThat(tracks).hasSize(101))
                .verifyComplete();

        verify(enricher, times(1)).enrich(eq(SESSION), argThat(l -> l.size() == 101));
    }

    @Test
    @DisplayName("연대 기준 그룹은 키 오름차순이며 발매일을 모르면 unknown")
    void groupByDecade() {
        // given
        when(api.getPlaylistTracks(SESSION, "p1", 0, 100))
                .thenReturn(Mono.just(page(List.of(
                        track("t1", "1995-01-01"),
                        track("t2", "1999"),
                        track("t3", "2003-07"),
                        track("t4", null)), 0, null)));
        when(enricher.enrich(eq(SESSION), anyList())).thenReturn(Mono.just(TrackEnrichment.EMPTY));

        // when / then
        StepVerifier.create(service.groupTracks(SESSION, "p1", TrackGrouping.DECADE))
                .assertNext(groups -> {
                    assertThat(groups.keySet()).containsExactly("1990s", "2000s", "unknown");
                    assertThat(groups.get("1990s")).extracting(Track::id).containsExactly("t1", "t2");
                })
                .verifyComplete();
    }

    private static SpotifyPaging<PlaylistTrackItem> page(List<SpotifyTrack> tracks, int offset, String next) {
        List<PlaylistTrackItem> items = tracks.stream().map(PlaylistTrackItem::new).toList();
        return new SpotifyPaging<>(items, 0, offset, items.size(), next);
    }

    private static SpotifyTrack track(String id, String releaseDate) {
        return new SpotifyTrack(id, "song-" + id,
                List.of(new SpotifyArtist("a-" + id, "Artist", null)),
                new SpotifyAlbum("al-" + id, "Album", List.of(), releaseDate));
    }
}
