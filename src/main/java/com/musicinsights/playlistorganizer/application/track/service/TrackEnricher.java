package com.musicinsights.playlistorganizer.application.track.service;

import com.musicinsights.playlistorganizer.application.track.model.Track;
import com.musicinsights.playlistorganizer.application.track.model.TrackEnrichment;
import com.musicinsights.playlistorganizer.infrastructure.persistence.r2dbc.repo.TrackCacheRepo;
import com.musicinsights.playlistorganizer.infrastructure.reccobeats.ReccoBeatsClient;
import com.musicinsights.playlistorganizer.infrastructure.reccobeats.dto.ReccoBeatsAudioFeatures;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyTrack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 트랙에 장르와 오디오 특성을 덧씌우는 enrichment 오케스트레이터.
 *
 * <p>처리 순서:</p>
 * <ol>
 *   <li>트랙마다 대표(첫 번째) 아티스트 ID를 모아 중복 제거</li>
 *   <li>{@link ArtistGenreLookup}으로 장르 조회(없으면 "unknown")</li>
 *   <li>오디오 특성은 로컬 캐시를 먼저 보고, 없는 것만 ReccoBeats에서 하나씩 순차 조회 후 캐시에 저장</li>
 *   <li>트랙 ID 기준 오버레이({@link TrackEnrichment})로 반환</li>
 * </ol>
 *
 * <p>장르/특성 조회 실패는 부분 결과로 강등되며, 재인증 필요 예외와 구독 취소만 호출자에게 전파된다.</p>
 */
@Service
public class TrackEnricher {

    private static final Logger log = LoggerFactory.getLogger(TrackEnricher.class);

    private final ArtistGenreLookup artistGenreLookup;
    private final TrackCacheRepo trackCacheRepo;
    private final ReccoBeatsClient reccoBeatsClient;

    public TrackEnricher(ArtistGenreLookup artistGenreLookup,
                         TrackCacheRepo trackCacheRepo,
                         ReccoBeatsClient reccoBeatsClient) {
        this.artistGenreLookup = artistGenreLookup;
        this.trackCacheRepo = trackCacheRepo;
        this.reccoBeatsClient = reccoBeatsClient;
    }

    /**
     * 트랙 목록의 장르와 오디오 특성을 조회한다.
     *
     * @param sessionId 세션 ID
     * @param tracks    Spotify 트랙 목록
     * @return 트랙 ID 기준 enrichment 결과
     */
    public Mono<TrackEnrichment> enrich(String sessionId, List<SpotifyTrack> tracks) {
        List<SpotifyTrack> valid = tracks == null ? List.of() : tracks.stream()
                .filter(Objects::nonNull)
                .filter(t -> t.id() != null && !t.id().isBlank())
                .toList();
        if (valid.isEmpty()) return Mono.just(TrackEnrichment.EMPTY);

        List<String> artistIds = valid.stream()
                .map(SpotifyTrack::primaryArtistId)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        List<String> trackIds = valid.stream().map(SpotifyTrack::id).distinct().toList();

        return artistGenreLookup.resolveGenres(sessionId, artistIds)
                .flatMap(genreByArtist -> getAudioFeatures(trackIds)
                        .map(features -> {
                            Map<String, String> genreByTrack = new LinkedHashMap<>();
                            for (SpotifyTrack track : valid) {
                                String artistId = track.primaryArtistId();
                                String genre = artistId == null ? null : genreByArtist.get(artistId);
                                genreByTrack.put(track.id(), genre == null ? Track.UNKNOWN_GENRE : genre);
                            }
                            log.info("Enriched {} tracks ({} with audio features)", valid.size(), features.size());
                            return new TrackEnrichment(genreByTrack, features);
                        }));
    }

    /**
     * 트랙들의 오디오 특성을 캐시 우선으로 조회한다.
     *
     * <p>캐시에 없는 ID만 ReccoBeats를 한 건씩 순차 호출하고, 찾은 값은 즉시 캐시에 저장한다.
     * 도중에 실패하면 그때까지 모은 결과를 돌려준다.</p>
     *
     * @param trackIds 트랙 ID 목록
     * @return 트랙 ID → 오디오 특성(찾은 것만)
     */
    public Mono<Map<String, ReccoBeatsAudioFeatures>> getAudioFeatures(Collection<String> trackIds) {
        List<String> ids = trackIds == null ? List.of() : trackIds.stream()
                .filter(Objects::nonNull)
                .filter(id -> !id.isBlank())
                .distinct()
                .toList();
        if (ids.isEmpty()) return Mono.just(Map.of());

        return trackCacheRepo.findFeatures(ids)
                .flatMap(cached -> {
                    List<String> missing = ids.stream().filter(id -> !cached.containsKey(id)).toList();
                    log.info("Audio features cache: {} hit(s), {} miss(es)", cached.size(), missing.size());

                    Map<String, ReccoBeatsAudioFeatures> result = new LinkedHashMap<>(cached);
                    if (missing.isEmpty()) return Mono.just(result);

                    return Flux.fromIterable(missing)
                            .concatMap(id -> reccoBeatsClient.fetchAudioFeatures(id)
                                    .flatMap(features -> trackCacheRepo.saveFeatures(id, features)
                                            .thenReturn(Map.entry(id, features))))
                            .doOnNext(e -> result.put(e.getKey(), e.getValue()))
                            .onErrorResume(e -> {
                                log.warn("Audio feature fetch stopped early; keeping {} results", result.size(), e);
                                return Flux.empty();
                            })
                            .then(Mono.fromSupplier(() -> result));
                });
    }
}
