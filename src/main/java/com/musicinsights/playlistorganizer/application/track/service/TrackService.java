package com.musicinsights.playlistorganizer.application.track.service;

import com.musicinsights.playlistorganizer.application.common.error.BadRequestException;
import com.musicinsights.playlistorganizer.application.common.pagination.CursorCodec;
import com.musicinsights.playlistorganizer.application.common.pagination.PageResult;
import com.musicinsights.playlistorganizer.application.track.mapper.TrackMapper;
import com.musicinsights.playlistorganizer.application.track.model.Track;
import com.musicinsights.playlistorganizer.infrastructure.spotify.SpotifyApiClient;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.PlaylistTrackItem;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyPaging;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyTrack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 플레이리스트 트랙 조회 서비스.
 *
 * <p>Spotify에서 트랙을 가져온 뒤 {@link TrackEnricher}로 장르/오디오 특성을 덧씌운다.
 * enrichment가 일부 실패해도 트랙 목록 자체는 항상 반환한다.</p>
 */
@Service
public class TrackService {

    private static final Logger log = LoggerFactory.getLogger(TrackService.class);

    /** Spotify 플레이리스트 트랙 API의 최대 페이지 크기 */
    static final int MAX_PAGE_SIZE = 100;

    private final SpotifyApiClient spotifyApiClient;
    private final TrackEnricher trackEnricher;

    public TrackService(SpotifyApiClient spotifyApiClient, TrackEnricher trackEnricher) {
        this.spotifyApiClient = spotifyApiClient;
        this.trackEnricher = trackEnricher;
    }

    /**
     * 플레이리스트 트랙 한 페이지를 enrichment 후 반환한다.
     *
     * @param sessionId  세션 ID
     * @param playlistId 플레이리스트 ID
     * @param cursor     다음 페이지 커서(첫 페이지면 null)
     * @param size       페이지 크기(1~100)
     * @return 트랙 페이지
     */
    public Mono<PageResult<Track>> getTrackPage(String sessionId, String playlistId, String cursor, int size) {
        int offset;
        try {
            offset = CursorCodec.decodeOffset(cursor);
        } catch (IllegalArgumentException e) {
            return Mono.error(new BadRequestException("invalid cursor", "INVALID_CURSOR", e));
        }

        return spotifyApiClient.getPlaylistTracks(sessionId, playlistId, offset, size)
                .flatMap(page -> {
                    List<SpotifyTrack> tracks = tracksOf(page);
                    int nextOffset = offset + itemCount(page);
                    boolean hasNext = page.hasNext() && itemCount(page) > 0;

                    return trackEnricher.enrich(sessionId, tracks)
                            .map(enrichment -> new PageResult<>(
                                    TrackMapper.toTracks(tracks, enrichment),
                                    hasNext,
                                    hasNext ? CursorCodec.encodeOffset(nextOffset) : null
                            ));
                });
    }

    /**
     * 플레이리스트의 모든 트랙을 순차 페이지 조회한 뒤 한 번에 enrichment 한다.
     *
     * @param sessionId  세션 ID
     * @param playlistId 플레이리스트 ID
     * @return 전체 트랙
     */
    public Mono<List<Track>> getAllTracks(String sessionId, String playlistId) {
        return fetchPage(sessionId, playlistId, 0)
                .expand(page -> page.hasNext() && itemCount(page) > 0
                        ? fetchPage(sessionId, playlistId, page.offset() + itemCount(page))
                        : Mono.empty())
                .concatMapIterable(TrackService::tracksOf)
                .collectList()
                .flatMap(tracks -> {
                    log.debug("Loaded {} tracks from playlist {}", tracks.size(), playlistId);
                    return trackEnricher.enrich(sessionId, tracks)
                            .map(enrichment -> TrackMapper.toTracks(tracks, enrichment));
                });
    }

    /**
     * 플레이리스트의 모든 트랙을 장르 또는 연대로 묶는다.
     *
     * @param sessionId  세션 ID
     * @param playlistId 플레이리스트 ID
     * @param grouping   그룹 기준
     * @return 그룹 키 → 트랙 목록
     */
    public Mono<Map<String, List<Track>>> groupTracks(String sessionId, String playlistId, TrackGrouping grouping) {
        return getAllTracks(sessionId, playlistId).map(grouping::group);
    }

    private Mono<SpotifyPaging<PlaylistTrackItem>> fetchPage(String sessionId, String playlistId, int offset) {
        return spotifyApiClient.getPlaylistTracks(sessionId, playlistId, offset, MAX_PAGE_SIZE);
    }

    private static List<SpotifyTrack> tracksOf(SpotifyPaging<PlaylistTrackItem> page) {
        if (page.items() == null) return List.of();
        return page.items().stream()
                .filter(Objects::nonNull)
                .map(PlaylistTrackItem::track)
                .filter(Objects::nonNull)
                .toList();
    }

    private static int itemCount(SpotifyPaging<PlaylistTrackItem> page) {
        return page.items() == null ? 0 : page.items().size();
    }
}
