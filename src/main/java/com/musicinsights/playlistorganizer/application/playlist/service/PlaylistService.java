package com.musicinsights.playlistorganizer.application.playlist.service;

import com.musicinsights.playlistorganizer.application.common.error.BadRequestException;
import com.musicinsights.playlistorganizer.application.playlist.dto.request.CopyTracksRequest;
import com.musicinsights.playlistorganizer.application.playlist.dto.response.CopyTracksResponse;
import com.musicinsights.playlistorganizer.application.playlist.dto.response.UserResponse;
import com.musicinsights.playlistorganizer.application.playlist.model.Playlist;
import com.musicinsights.playlistorganizer.application.track.filter.CompositeFilter;
import com.musicinsights.playlistorganizer.application.track.filter.GenreFilter;
import com.musicinsights.playlistorganizer.application.track.filter.TrackFilter;
import com.musicinsights.playlistorganizer.application.track.filter.TrackIdSetFilter;
import com.musicinsights.playlistorganizer.application.track.filter.YearRangeFilter;
import com.musicinsights.playlistorganizer.application.track.mapper.TrackMapper;
import com.musicinsights.playlistorganizer.application.track.model.Track;
import com.musicinsights.playlistorganizer.application.track.service.TrackService;
import com.musicinsights.playlistorganizer.infrastructure.spotify.SpotifyApiClient;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyPaging;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyPlaylist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 플레이리스트 조회/생성/복사 서비스.
 *
 * <p>복사는 원본의 모든 트랙을 불러와 필터(AND 결합)로 거른 뒤,
 * 같은 이름(대소문자 무시)의 플레이리스트가 있으면 재사용하고 없으면 새로 만들어 추가한다.</p>
 */
@Service
public class PlaylistService {

    private static final Logger log = LoggerFactory.getLogger(PlaylistService.class);

    /** {@code GET /me/playlists} 최대 페이지 크기 */
    static final int PLAYLIST_PAGE_SIZE = 50;

    /** {@code POST /playlists/{id}/tracks} 요청당 최대 URI 수 */
    static final int ADD_TRACKS_CHUNK = 100;

    private final SpotifyApiClient spotifyApiClient;
    private final TrackService trackService;

    public PlaylistService(SpotifyApiClient spotifyApiClient, TrackService trackService) {
        this.spotifyApiClient = spotifyApiClient;
        this.trackService = trackService;
    }

    /**
     * 현재 로그인한 사용자를 조회한다.
     *
     * @param sessionId 세션 ID
     * @return 사용자
     */
    public Mono<UserResponse> getCurrentUser(String sessionId) {
        return spotifyApiClient.getCurrentUser(sessionId)
                .map(u -> new UserResponse(u.id(), u.displayName()));
    }

    /**
     * 사용자의 모든 플레이리스트를 순차 페이지 조회한다.
     *
     * @param sessionId 세션 ID
     * @return 플레이리스트 목록
     */
    public Mono<List<Playlist>> getUserPlaylists(String sessionId) {
        return spotifyApiClient.getUserPlaylists(sessionId, 0, PLAYLIST_PAGE_SIZE)
                .expand(page -> hasMore(page)
                        ? spotifyApiClient.getUserPlaylists(sessionId, page.offset() + page.items().size(), PLAYLIST_PAGE_SIZE)
                        : Mono.empty())
                .concatMapIterable(page -> page.items() == null ? List.<SpotifyPlaylist>of() : page.items())
                .filter(Objects::nonNull)
                .map(TrackMapper::toPlaylist)
                .collectList();
    }

    public Mono<Playlist> getPlaylist(String sessionId, String playlistId) {
        return spotifyApiClient.getPlaylist(sessionId, playlistId)
                .map(TrackMapper::toPlaylist);
    }

    /**
     * 이름이 같은(대소문자 무시) 플레이리스트를 찾는다.
     *
     * @param sessionId 세션 ID
     * @param name      이름
     * @return 첫 번째로 일치하는 플레이리스트, 없으면 empty
     */
    public Mono<Playlist> findPlaylistByName(String sessionId, String name) {
        return getUserPlaylists(sessionId)
                .flatMapMany(Flux::fromIterable)
                .filter(p -> p.name() != null && p.name().equalsIgnoreCase(name))
                .next();
    }

    /**
     * 같은 이름의 플레이리스트가 있으면 재사용하고, 없으면 비공개로 새로 만든다.
     *
     * @param sessionId   세션 ID
     * @param name        이름
     * @param description 새로 만들 때 쓸 설명
     * @return 대상 플레이리스트와 생성 여부
     */
    public Mono<TargetPlaylist> getOrCreatePlaylist(String sessionId, String name, String description) {
        return findPlaylistByName(sessionId, name)
                .map(existing -> new TargetPlaylist(existing, false))
                .switchIfEmpty(Mono.defer(() -> spotifyApiClient.getCurrentUser(sessionId)
                        .flatMap(user -> spotifyApiClient.createPlaylist(sessionId, user.id(), name, description))
                        .map(created -> {
                            log.info("Created playlist '{}' ({})", name, created.id());
                            return new TargetPlaylist(TrackMapper.toPlaylist(created), true);
                        })));
    }

    /**
     * 트랙 URI를 100개 단위로 나누어 순차 추가한다.
     *
     * @param sessionId  세션 ID
     * @param playlistId 대상 플레이리스트 ID
     * @param uris       트랙 URI
     * @return 추가한 URI 수
     */
    public Mono<Integer> addTracks(String sessionId, String playlistId, List<String> uris) {
        if (uris == null || uris.isEmpty()) return Mono.just(0);

        return Flux.fromIterable(uris)
                .buffer(ADD_TRACKS_CHUNK)
                .concatMap(chunk -> spotifyApiClient.addTracks(sessionId, playlistId, chunk)
                        .thenReturn(chunk.size()))
                .reduce(0, Integer::sum);
    }

    /**
     * 원본 플레이리스트에서 필터를 만족하는 트랙을 대상 플레이리스트로 복사한다.
     *
     * @param sessionId        세션 ID
     * @param sourcePlaylistId 원본 플레이리스트 ID
     * @param request          필터/대상 정보
     * @return 복사 결과
     */
    public Mono<CopyTracksResponse> copyFilteredTracks(String sessionId, String sourcePlaylistId,
                                                       CopyTracksRequest request) {
        TrackFilter filter;
        try {
            filter = buildFilter(request);
        } catch (BadRequestException e) {
            return Mono.error(e);
        }

        String targetName = isBlank(request.name()) ? filter.suggestedPlaylistName() : request.name().trim();

        return getPlaylist(sessionId, sourcePlaylistId)
                .flatMap(source -> trackService.getAllTracks(sessionId, sourcePlaylistId)
                        .map(tracks -> new SourceTracks(source, tracks)))
                .flatMap(src -> {
                    Playlist source = src.playlist();
                    List<Track> matched = filter.apply(src.tracks());
                    log.info("Filter '{}' matched {}/{} tracks of playlist {}",
                            filter.label(), matched.size(), src.tracks().size(), sourcePlaylistId);

                    if (matched.isEmpty()) {
                        return Mono.<CopyTracksResponse>error(new BadRequestException("no tracks match the filter", "NO_MATCHING_TRACKS"));
                    }

                    String description = isBlank(request.description())
                            ? "Filtered from " + source.name() + ": " + filter.label()
                            : request.description();
                    List<String> uris = matched.stream().map(Track::spotifyUri).distinct().toList();

                    return getOrCreatePlaylist(sessionId, targetName, description)
                            .flatMap(target -> addTracks(sessionId, target.playlist().id(), uris)
                                    .map(added -> new CopyTracksResponse(
                                            target.playlist().id(),
                                            target.playlist().name(),
                                            target.created(),
                                            filter.label(),
                                            added
                                    )));
                });
    }

    /**
     * 요청에 지정된 조건들을 AND로 결합한 필터를 만든다.
     *
     * @param request 복사 요청
     * @return 결합 필터
     * @throws BadRequestException 조건이 없거나 잘못된 경우
     */
    static TrackFilter buildFilter(CopyTracksRequest request) {
        List<TrackFilter> filters = new ArrayList<>();
        try {
            if (!isBlank(request.genre())) {
                filters.add(new GenreFilter(request.genre()));
            }
            if (request.minYear() != null) {
                filters.add(new YearRangeFilter(request.minYear(), request.maxYear()));
            } else if (request.maxYear() != null) {
                throw new BadRequestException("maxYear requires minYear", "INVALID_FILTER");
            }
            if (request.trackIds() != null) {
                filters.add(new TrackIdSetFilter(request.selectionLabel(), request.suggestedName(), request.trackIds()));
            }
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage(), "INVALID_FILTER", e);
        }

        if (filters.isEmpty()) {
            throw new BadRequestException("at least one filter is required", "FILTER_REQUIRED");
        }
        return filters.size() == 1 ? filters.get(0) : new CompositeFilter(filters);
    }

    private static boolean hasMore(SpotifyPaging<SpotifyPlaylist> page) {
        return page.hasNext() && page.items() != null && !page.items().isEmpty();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * 복사 대상 플레이리스트.
     *
     * @param playlist 플레이리스트
     * @param created  이번에 새로 만들었는지 여부
     */
    public record TargetPlaylist(Playlist playlist, boolean created) {}

    private record SourceTracks(Playlist playlist, List<Track> tracks) {}
}
