package com.musicinsights.playlistorganizer.application.track.service;

import com.musicinsights.playlistorganizer.application.track.model.Track;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 트랙 그룹핑 기준. 그룹 키는 사전순으로 정렬된다.
 */
public enum TrackGrouping {
    GENRE(Track::genre),
    DECADE(Track::decade);

    private final Function<Track, String> keyFn;

    TrackGrouping(Function<Track, String> keyFn) {
        this.keyFn = keyFn;
    }

    /**
     * 트랙을 기준 키로 묶는다. 그룹 안의 순서는 입력 순서를 따른다.
     *
     * @param tracks 트랙 목록
     * @return 키 → 트랙 목록(키 오름차순)
     */
    public Map<String, List<Track>> group(List<Track> tracks) {
        return tracks.stream()
                .collect(Collectors.groupingBy(keyFn, TreeMap::new, Collectors.toList()));
    }
}
