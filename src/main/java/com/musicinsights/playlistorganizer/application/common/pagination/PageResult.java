package com.musicinsights.playlistorganizer.application.common.pagination;

import java.util.List;
import java.util.function.Function;

/**
 * 커서 기반 페이지 결과 DTO.
 *
 * @param items      현재 페이지 아이템 목록
 * @param hasNext    다음 페이지 존재 여부
 * @param nextCursor 다음 페이지 조회용 커서(없으면 null)
 * @param <T>        아이템 타입
 */
public record PageResult<T>(
        List<T> items,
        boolean hasNext,
        String nextCursor
) {
    /**
     * 페이지 정보는 유지한 채 아이템만 변환한다.
     *
     * @param mapper 아이템 변환 함수
     * @param <R>    변환 후 타입
     * @return 변환된 페이지
     */
    public <R> PageResult<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new PageResult<>(mapped, hasNext, nextCursor);
    }
}
