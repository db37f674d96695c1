package com.musicinsights.playlistorganizer.application.track.filter;

import com.musicinsights.playlistorganizer.application.track.model.Track;

import java.util.List;
import java.util.function.Predicate;

/**
 * 트랙 필터.
 *
 * <p>닫힌 변형 집합이며, 여러 필터는 {@link CompositeFilter}로 AND 결합한다.</p>
 */
public sealed interface TrackFilter extends Predicate<Track>
        permits GenreFilter, YearRangeFilter, TrackIdSetFilter, CompositeFilter {

    /**
     * 화면/로그에 보여줄 필터 설명.
     *
     * @return 설명
     */
    String label();

    /**
     * 필터 결과를 복사할 때 기본으로 쓸 플레이리스트 이름.
     *
     * @return 제안 이름
     */
    String suggestedPlaylistName();

    boolean matches(Track track);

    @Override
    default boolean test(Track track) {
        return track != null && matches(track);
    }

    /**
     * 조건을 만족하는 트랙만 남긴다. 입력 순서는 유지된다.
     *
     * @param tracks 트랙 목록
     * @return 필터링된 트랙 목록
     */
    default List<Track> apply(List<Track> tracks) {
        return tracks.stream().filter(this).toList();
    }
}
