package com.musicinsights.playlistorganizer.application.track.service;

import com.musicinsights.playlistorganizer.application.common.error.ReauthenticationRequiredException;
import com.musicinsights.playlistorganizer.application.track.model.TrackEnrichment;
import com.musicinsights.playlistorganizer.infrastructure.persistence.r2dbc.repo.TrackCacheRepo;
import com.musicinsights.playlistorganizer.infrastructure.reccobeats.ReccoBeatsClient;
import com.musicinsights.playlistorganizer.infrastructure.reccobeats.dto.ReccoBeatsAudioFeatures;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyArtist;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyTrack;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.publisher.PublisherProbe;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * {@link TrackEnricher} 단위 테스트.
 *
 * <p>장르 조회, 캐시, ReccoBeats 클라이언트를 모두 mocking하고 조합 순서와 결과 오버레이를 검증한다.</p>
 */
@DisplayName("track enricher 테스트")
class TrackEnricherTest {

    private static final String SESSION = "s1";

    private ArtistGenreLookup genreLookup;
    private TrackCacheRepo cacheRepo;
    private ReccoBeatsClient reccoBeats;
    private TrackEnricher enricher;

    @BeforeEach
    void setUp() {
        genreLookup = mock(ArtistGenreLookup.class);
        cacheRepo = mock(TrackCacheRepo.class);
        reccoBeats = mock(ReccoBeatsClient.class);
        enricher = new TrackEnricher(genreLookup, cacheRepo, reccoBeats);

        when(cacheRepo.saveFeatures(anyString(), any())).thenReturn(Mono.just(true));
    }

    /**
     * 세 트랙(t1, t2는 아티스트 A, t3는 B)에서 아티스트 조회는 한 번만, 장르는 트랙별로 매핑되는지 검증한다.
     */
    @Test
    @DisplayName("대표 아티스트의 첫 장르가 트랙 장르가 되고, 없는 아티스트는 unknown")
    void genresAreMappedPerTrack() {
        // given
        List<SpotifyTrack> tracks = List.of(track("t1", "A"), track("t2", "A"), track("t3", "B"));
        when(genreLookup.resolveGenres(SESSION, List.of("A", "B")))
                .thenReturn(Mono.just(Map.of("A", "rock")));
        when(cacheRepo.findFeatures(anyCollection())).thenReturn(Mono.just(Map.of()));
        when(reccoBeats.fetchAudioFeatures(anyString())).thenReturn(Mono.empty());

        // when
        Mono<TrackEnrichment> result = enricher.enrich(SESSION, tracks);

        // then
        StepVerifier.create(result)
                .assertNext(e -> {
                    assertThat(e.genreOf("t1")).isEqualTo("rock");
                    assertThat(e.genreOf("t2")).isEqualTo("rock");
                    assertThat(e.genreOf("t3")).isEqualTo("unknown");
                    assertThat(e.featuresByTrackId()).isEmpty();
                })
                .verifyComplete();

        verify(genreLookup, times(1)).resolveGenres(eq(SESSION), anyCollection());
        verify(cacheRepo, never()).saveFeatures(anyString(), any());
    }

    /**
     * 아티스트가 없는 트랙(t3)은 장르 조회 대상에서 빠지고 unknown이 되는지 검증한다.
     */
    @Test
    @DisplayName("아티스트가 없는 트랙은 장르 조회에서 빠지고 unknown")
    void trackWithoutArtists_isUnknown() {
        // given
        SpotifyTrack noArtists = new SpotifyTrack("t3", "song-t3", List.of(), null);
        List<SpotifyTrack> tracks = List.of(track("t1", "A"), track("t2", "A"), noArtists);
        when(genreLookup.resolveGenres(SESSION, List.of("A")))
                .thenReturn(Mono.just(Map.of("A", "rock")));
        when(cacheRepo.findFeatures(anyCollection())).thenReturn(Mono.just(Map.of()));
        when(reccoBeats.fetchAudioFeatures(anyString())).thenReturn(Mono.empty());

        // when / then
        StepVerifier.create(enricher.enrich(SESSION, tracks))
                .assertNext(e -> {
                    assertThat(e.genreOf("t1")).isEqualTo("rock");
                    assertThat(e.genreOf("t2")).isEqualTo("rock");
                    assertThat(e.genreOf("t3")).isEqualTo("unknown");
                })
                .verifyComplete();

        verify(genreLookup).resolveGenres(SESSION, List.of("A"));
        verify(reccoBeats).fetchAudioFeatures("t3");
    }

    /**
     * 첫 번째 ReccoBeats 호출이 진행 중일 때 구독을 취소하면 나머지 트랙은 조회하지 않는지 검증한다.
     */
    @Test
    @DisplayName("조회 중 취소하면 남은 트랙의 오디오 특성은 조회하지 않음")
    void cancel_stopsRemainingFetches() {
        // given
        PublisherProbe<ReccoBeatsAudioFeatures> pending = PublisherProbe.of(Mono.never());
        when(cacheRepo.findFeatures(anyCollection())).thenReturn(Mono.just(Map.of()));
        when(reccoBeats.fetchAudioFeatures("t1")).thenReturn(pending.mono());

        // when / then
        StepVerifier.create(enricher.getAudioFeatures(List.of("t1", "t2", "t3")))
                .expectSubscription()
                .thenCancel()
                .verify();

        pending.assertWasSubscribed();
        pending.assertWasCancelled();
        verify(reccoBeats).fetchAudioFeatures("t1");
        verify(reccoBeats, never()).fetchAudioFeatures("t2");
        verify(reccoBeats, never()).fetchAudioFeatures("t3");
        verify(cacheRepo, never()).saveFeatures(anyString(), any());
    }

    /**
     * 캐시에 t1이 있으면 ReccoBeats는 t2에 대해서만 호출되고, 찾은 값은 캐시에 저장되는지 검증한다.
     */
    @Test
    @DisplayName("캐시 미스만 ReccoBeats로 조회하고 찾은 값을 캐시에 저장")
    void cacheFirst_thenFetchMissing_andPersist() {
        // given
        ReccoBeatsAudioFeatures cached = features(0.2f);
        ReccoBeatsAudioFeatures fetched = features(0.8f);
        when(cacheRepo.findFeatures(List.of("t1", "t2"))).thenReturn(Mono.just(Map.of("t1", cached)));
        when(reccoBeats.fetchAudioFeatures("t2")).thenReturn(Mono.just(fetched));

        // when / then
        StepVerifier.create(enricher.getAudioFeatures(List.of("t1", "t2")))
                .assertNext(m -> assertThat(m).containsEntry("t1", cached).containsEntry("t2", fetched))
                .verifyComplete();

        InOrder order = inOrder(cacheRepo, reccoBeats);
        order.verify(cacheRepo).findFeatures(List.of("t1", "t2"));
        order.verify(reccoBeats).fetchAudioFeatures("t2");
        order.verify(cacheRepo).saveFeatures("t2", fetched);
        verify(reccoBeats, never()).fetchAudioFeatures("t1");
    }

    @Test
    @DisplayName("모두 캐시에 있으면 ReccoBeats를 호출하지 않음")
    void allCached_noNetwork() {
        // given
        when(cacheRepo.findFeatures(List.of("t1")))
                .thenReturn(Mono.just(Map.of("t1", features(0.5f))));

        // when / then
        StepVerifier.create(enricher.getAudioFeatures(List.of("t1", "t1")))
                .assertNext(m -> assertThat(m).containsOnlyKeys("t1"))
                .verifyComplete();

        verifyNoInteractions(reccoBeats);
    }

    @Test
    @DisplayName("ReccoBeats에 값이 없는 트랙은 결과에서 빠지고 캐시에도 저장하지 않음")
    void missingFeatures_areOmitted() {
        // given
        when(cacheRepo.findFeatures(anyCollection())).thenReturn(Mono.just(Map.of()));
        when(reccoBeats.fetchAudioFeatures("t1")).thenReturn(Mono.empty());
        when(reccoBeats.fetchAudioFeatures("t2")).thenReturn(Mono.just(features(0.4f)));

        // when / then
        StepVerifier.create(enricher.getAudioFeatures(List.of("t1", "t2")))
                .assertNext(m -> assertThat(m).containsOnlyKeys("t2"))
                .verifyComplete();

        verify(cacheRepo, never()).saveFeatures(eq("t1"), any());
    }

    @Test
    @DisplayName("장르 조회의 재인증 필요 예외는 그대로 전파")
    void reauthentication_isPropagated() {
        // given
        when(genreLookup.resolveGenres(eq(SESSION), anyCollection()))
                .thenReturn(Mono.error(new ReauthenticationRequiredException("expired")));

        // when / then
        StepVerifier.create(enricher.enrich(SESSION, List.of(track("t1", "A"))))
                .expectError(ReauthenticationRequiredException.class)
                .verify();

        verifyNoInteractions(reccoBeats);
    }

    @Test
    @DisplayName("트랙이 없으면 외부 호출 없이 빈 결과")
    void emptyInput_isEmptyEnrichment() {
        StepVerifier.create(enricher.enrich(SESSION, List.of()))
                .expectNext(TrackEnrichment.EMPTY)
                .verifyComplete();

        verifyNoInteractions(genreLookup, reccoBeats);
    }

    private static SpotifyTrack track(String id, String artistId) {
        return new SpotifyTrack(id, "song-" + id, List.of(new SpotifyArtist(artistId, "artist-" + artistId, null)), null);
    }

    private static ReccoBeatsAudioFeatures features(float valence) {
        return new ReccoBeatsAudioFeatures(0.1f, 0.5f, 0.5f, 0f, 1, 0.1f, -6f, 1, 0.05f, 110f, valence);
    }
}
