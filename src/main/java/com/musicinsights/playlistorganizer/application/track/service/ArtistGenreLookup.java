package com.musicinsights.playlistorganizer.application.track.service;

import com.musicinsights.playlistorganizer.application.common.error.ReauthenticationRequiredException;
import com.musicinsights.playlistorganizer.application.track.model.Track;
import com.musicinsights.playlistorganizer.infrastructure.config.SpotifyProperties;
import com.musicinsights.playlistorganizer.infrastructure.spotify.SpotifyApiClient;
import com.musicinsights.playlistorganizer.infrastructure.spotify.dto.SpotifyArtist;
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
 * 아티스트 ID 묶음으로 장르를 조회하는 배치 조회 서비스.
 *
 * <p>중복을 제거한 ID를 Spotify 제한(기본 50개) 단위로 나누고 한 chunk씩 순차 호출한다.
 * 어느 chunk가 실패하면 나머지 chunk는 건너뛰고 그때까지 모은 결과를 돌려준다.
 * 단, 재인증 필요 예외는 흡수하지 않고 전파한다.</p>
 */
@Service
public class ArtistGenreLookup {

    private static final Logger log = LoggerFactory.getLogger(ArtistGenreLookup.class);

    private final SpotifyApiClient spotifyApiClient;
    private final int batchSize;

    public ArtistGenreLookup(SpotifyApiClient spotifyApiClient, SpotifyProperties props) {
        this.spotifyApiClient = spotifyApiClient;
        this.batchSize = props.getArtistBatchSize();
    }

    /**
     * 아티스트별 대표 장르(첫 장르, 없으면 {@link Track#UNKNOWN_GENRE})를 조회한다.
     *
     * @param sessionId 세션 ID
     * @param artistIds 아티스트 ID(중복/빈 값 허용)
     * @return 아티스트 ID → 장르. 응답에 없던 아티스트는 포함되지 않는다
     */
    public Mono<Map<String, String>> resolveGenres(String sessionId, Collection<String> artistIds) {
        List<String> distinct = artistIds == null ? List.of() : artistIds.stream()
                .filter(Objects::nonNull)
                .filter(id -> !id.isBlank())
                .distinct()
                .toList();
        if (distinct.isEmpty()) return Mono.just(Map.of());

        return Flux.fromIterable(distinct)
                .buffer(batchSize)
                .concatMap(chunk -> spotifyApiClient.getArtists(sessionId, chunk))
                .onErrorResume(e -> !(e instanceof ReauthenticationRequiredException), e -> {
                    log.warn("Artist genre lookup failed; returning partial result", e);
                    return Flux.empty();
                })
                .collect(LinkedHashMap<String, String>::new, (acc, artists) -> {
                    for (SpotifyArtist artist : artists) {
                        String genre = artist.firstGenre();
                        acc.putIfAbsent(artist.id(), genre == null ? Track.UNKNOWN_GENRE : genre);
                    }
                })
                .map(resolved -> {
                    log.debug("Resolved genres for {}/{} artists", resolved.size(), distinct.size());
                    return (Map<String, String>) resolved;
                });
    }
}
