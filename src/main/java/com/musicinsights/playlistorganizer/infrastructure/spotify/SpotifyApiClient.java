package com.musicinsights.playlistorganizer.infrastructure.spotify;

import com.musicinsights.playlistorganizer.application.common.error.NotFoundException;
import com.musicinsights.playlistorganizer.infrastructure.spotify.auth.SpotifyAuthFilter;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.AddTracksRequest;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.ArtistsResponse;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.CreatePlaylistRequest;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.PlaylistTrackItem;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyArtist;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyPaging;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyPlaylist;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Spotify Web API 클라이언트.
 *
 * <p>모든 호출은 세션 ID를 요청 attribute로 실어 {@link SpotifyAuthFilter}를 거친다.
 * 2xx가 아닌 응답은 {@code WebClientResponseException}으로 전파된다.</p>
 */
@Component
public class SpotifyApiClient {

    private static final Logger log = LoggerFactory.getLogger(SpotifyApiClient.class);

    private static final ParameterizedTypeReference<SpotifyPaging<SpotifyPlaylist>> PLAYLIST_PAGE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<SpotifyPaging<PlaylistTrackItem>> TRACK_PAGE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;

    public SpotifyApiClient(@Qualifier("spotifyApiWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * 현재 로그인한 사용자를 조회한다({@code GET /me}).
     *
     * @param sessionId 세션 ID
     * @return 사용자
     */
    public Mono<SpotifyUser> getCurrentUser(String sessionId) {
        return webClient.get()
                .uri("/me")
                .attributes(SpotifyAuthFilter.session(sessionId))
                .retrieve()
                .bodyToMono(SpotifyUser.class);
    }

    /**
     * 사용자 플레이리스트 한 페이지를 조회한다({@code GET /me/playlists}).
     *
     * @param sessionId 세션 ID
     * @param offset    시작 위치
     * @param limit     페이지 크기(최대 50)
     * @return 플레이리스트 페이지
     */
    public Mono<SpotifyPaging<SpotifyPlaylist>> getUserPlaylists(String sessionId, int offset, int limit) {
        return webClient.get()
                .uri(uri -> uri.path("/me/playlists")
                        .queryParam("offset", offset)
                        .queryParam("limit", limit)
                        .build())
                .attributes(SpotifyAuthFilter.session(sessionId))
                .retrieve()
                .bodyToMono(PLAYLIST_PAGE);
    }

    /**
     * 플레이리스트 단건 조회({@code GET /playlists/{id}}).
     *
     * @param sessionId  세션 ID
     * @param playlistId 플레이리스트 ID
     * @return 플레이리스트, 없으면 {@link NotFoundException}
     */
    public Mono<SpotifyPlaylist> getPlaylist(String sessionId, String playlistId) {
        return webClient.get()
                .uri("/playlists/{id}", playlistId)
                .attributes(SpotifyAuthFilter.session(sessionId))
                .retrieve()
                .onStatus(s -> s.value() == HttpStatus.NOT_FOUND.value(),
                        r -> r.releaseBody().then(Mono.error(
                                new NotFoundException("playlist not found: " + playlistId, "PLAYLIST_NOT_FOUND"))))
                .bodyToMono(SpotifyPlaylist.class);
    }

    /**
     * 플레이리스트 트랙 한 페이지를 조회한다({@code GET /playlists/{id}/tracks}).
     *
     * @param sessionId  세션 ID
     * @param playlistId 플레이리스트 ID
     * @param offset     시작 위치
     * @param limit      페이지 크기(최대 100)
     * @return 트랙 페이지
     */
    public Mono<SpotifyPaging<PlaylistTrackItem>> getPlaylistTracks(String sessionId, String playlistId,
                                                                    int offset, int limit) {
        return webClient.get()
                .uri(uri -> uri.path("/playlists/{id}/tracks")
                        .queryParam("offset", offset)
                        .queryParam("limit", limit)
                        .build(playlistId))
                .attributes(SpotifyAuthFilter.session(sessionId))
                .retrieve()
                .onStatus(s -> s.value() == HttpStatus.NOT_FOUND.value(),
                        r -> r.releaseBody().then(Mono.error(
                                new NotFoundException("playlist not found: " + playlistId, "PLAYLIST_NOT_FOUND"))))
                .bodyToMono(TRACK_PAGE);
    }

    /**
     * 여러 아티스트를 한 번에 조회한다({@code GET /artists?ids=a,b,c}, 최대 50개).
     *
     * <p>응답 배열에서 null(존재하지 않는 ID)은 제외한다.</p>
     *
     * @param sessionId 세션 ID
     * @param artistIds 아티스트 ID(최대 50개)
     * @return 아티스트 목록
     */
    public Mono<List<SpotifyArtist>> getArtists(String sessionId, List<String> artistIds) {
        if (artistIds == null || artistIds.isEmpty()) return Mono.just(List.of());

        String ids = String.join(",", artistIds);
        log.debug("Looking up {} artists", artistIds.size());

        return webClient.get()
                .uri(uri -> uri.path("/artists").queryParam("ids", ids).build())
                .attributes(SpotifyAuthFilter.session(sessionId))
                .retrieve()
                .bodyToMono(ArtistsResponse.class)
                .map(resp -> resp.artists() == null ? List.<SpotifyArtist>of()
                        : resp.artists().stream().filter(a -> a != null && a.id() != null).toList());
    }

    /**
     * 비공개 플레이리스트를 생성한다({@code POST /users/{userId}/playlists}).
     *
     * @param sessionId   세션 ID
     * @param userId      소유자 ID
     * @param name        이름
     * @param description 설명
     * @return 생성된 플레이리스트
     */
    public Mono<SpotifyPlaylist> createPlaylist(String sessionId, String userId, String name, String description) {
        return webClient.post()
                .uri("/users/{userId}/playlists", userId)
                .attributes(SpotifyAuthFilter.session(sessionId))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new CreatePlaylistRequest(name, description, false))
                .retrieve()
                .bodyToMono(SpotifyPlaylist.class);
    }

    /**
     * 플레이리스트에 트랙을 추가한다({@code POST /playlists/{id}/tracks}, 요청당 최대 100개).
     *
     * @param sessionId  세션 ID
     * @param playlistId 플레이리스트 ID
     * @param uris       트랙 URI
     * @return 완료 신호
     */
    public Mono<Void> addTracks(String sessionId, String playlistId, List<String> uris) {
        if (uris == null || uris.isEmpty()) return Mono.empty();

        return webClient.post()
                .uri("/playlists/{id}/tracks", playlistId)
                .attributes(SpotifyAuthFilter.session(sessionId))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new AddTracksRequest(uris))
                .retrieve()
                .toBodilessEntity()
                .then();
    }
}
