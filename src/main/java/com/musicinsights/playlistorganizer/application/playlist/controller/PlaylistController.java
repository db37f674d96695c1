package com.musicinsights.playlistorganizer.application.playlist.controller;

import com.musicinsights.playlistorganizer.application.auth.service.SpotifyAuthService;
import com.musicinsights.playlistorganizer.application.common.pagination.PageResult;
import com.musicinsights.playlistorganizer.application.playlist.dto.request.CopyTracksRequest;
import com.musicinsights.playlistorganizer.application.playlist.dto.response.CopyTracksResponse;
import com.musicinsights.playlistorganizer.application.playlist.dto.response.PlaylistResponse;
import com.musicinsights.playlistorganizer.application.playlist.dto.response.UserResponse;
import com.musicinsights.playlistorganizer.application.playlist.service.PlaylistService;
import com.musicinsights.playlistorganizer.application.track.dto.response.TrackGroupResponse;
import com.musicinsights.playlistorganizer.application.track.dto.response.TrackResponse;
import com.musicinsights.playlistorganizer.application.track.service.TrackGrouping;
import com.musicinsights.playlistorganizer.application.track.service.TrackService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.WebSession;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 플레이리스트/트랙 API 컨트롤러.
 *
 * <p>모든 요청은 Spotify 로그인된 세션이어야 하며, 아니면 401(REAUTH_REQUIRED)이다.</p>
 */
@RestController
@RequestMapping("/api")
@Validated
public class PlaylistController {
    private final SpotifyAuthService authService;
    private final PlaylistService playlistService;
    private final TrackService trackService;

    public PlaylistController(SpotifyAuthService authService,
                              PlaylistService playlistService,
                              TrackService trackService) {
        this.authService = authService;
        this.playlistService = playlistService;
        this.trackService = trackService;
    }

    @GetMapping("/me")
    public Mono<UserResponse> me(WebSession session) {
        return authService.requireSignedIn(session.getId())
                .flatMap(playlistService::getCurrentUser);
    }

    /**
     * 사용자의 플레이리스트 목록을 조회한다.
     *
     * @param session 웹 세션
     * @return 플레이리스트 목록
     */
    @GetMapping("/playlists")
    public Mono<List<PlaylistResponse>> playlists(WebSession session) {
        return authService.requireSignedIn(session.getId())
                .flatMap(playlistService::getUserPlaylists)
                .map(list -> list.stream().map(PlaylistResponse::from).toList());
    }

    @GetMapping("/playlists/{playlistId}")
    public Mono<PlaylistResponse> playlist(@PathVariable @NotBlank String playlistId, WebSession session) {
        return authService.requireSignedIn(session.getId())
                .flatMap(sid -> playlistService.getPlaylist(sid, playlistId))
                .map(PlaylistResponse::from);
    }

    /**
     * 플레이리스트 트랙을 커서 페이지 단위로 조회한다(장르/오디오 특성 포함).
     *
     * @param playlistId 플레이리스트 ID
     * @param cursor     다음 페이지 커서
     * @param size       페이지 크기
     * @param session    웹 세션
     * @return 트랙 페이지
     */
    @GetMapping("/playlists/{playlistId}/tracks")
    public Mono<PageResult<TrackResponse>> tracks(
            @PathVariable @NotBlank String playlistId,
            @RequestParam(required = false) String cursor,
            @RequestParam(defaultValue = "50") @Min(1) @Max(100) int size,
            WebSession session
    ) {
        return authService.requireSignedIn(session.getId())
                .flatMap(sid -> trackService.getTrackPage(sid, playlistId, cursor, size))
                .map(page -> page.map(TrackResponse::from));
    }

    /**
     * 플레이리스트 전체 트랙을 장르 또는 연대로 묶어 조회한다.
     *
     * @param playlistId 플레이리스트 ID
     * @param by         그룹 기준(GENRE, DECADE)
     * @param session    웹 세션
     * @return 키 오름차순 그룹 목록
     */
    @GetMapping("/playlists/{playlistId}/tracks/grouped")
    public Mono<List<TrackGroupResponse>> groupedTracks(
            @PathVariable @NotBlank String playlistId,
            @RequestParam(defaultValue = "GENRE") TrackGrouping by,
            WebSession session
    ) {
        return authService.requireSignedIn(session.getId())
                .flatMap(sid -> trackService.groupTracks(sid, playlistId, by))
                .map(groups -> groups.entrySet().stream()
                        .map(e -> new TrackGroupResponse(
                                e.getKey(),
                                e.getValue().size(),
                                e.getValue().stream().map(TrackResponse::from).toList()))
                        .toList());
    }

    /**
     * 필터를 만족하는 트랙을 같은 이름의 플레이리스트(없으면 새로 생성)로 복사한다.
     *
     * @param playlistId 원본 플레이리스트 ID
     * @param request    필터/대상 정보
     * @param session    웹 세션
     * @return 복사 결과
     */
    @PostMapping("/playlists/{playlistId}/copy")
    public Mono<CopyTracksResponse> copy(
            @PathVariable @NotBlank String playlistId,
            @Valid @RequestBody CopyTracksRequest request,
            WebSession session
    ) {
        return authService.requireSignedIn(session.getId())
                .flatMap(sid -> playlistService.copyFilteredTracks(sid, playlistId, request));
    }
}
