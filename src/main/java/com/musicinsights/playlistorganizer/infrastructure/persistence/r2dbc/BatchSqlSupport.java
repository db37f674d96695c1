package com.musicinsights.playlistorganizer.infrastructure.persistence.r2dbc;

import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * R2DBC 기반 배치 SQL 처리를 위한 공통 베이스 클래스입니다.
 * <p>
 * 대량 키 조회를 chunk 단위의 {@code IN (...)} 쿼리로 나누어 순차 실행하는 기능과
 * named placeholder 목록 생성 헬퍼를 제공합니다.
 */
public abstract class BatchSqlSupport {

    /** R2DBC SQL 실행을 위한 DatabaseClient */
    protected final DatabaseClient db;

    /**
     * {@link DatabaseClient}를 주입받아 초기화합니다.
     *
     * @param db R2DBC DatabaseClient
     */
    protected BatchSqlSupport(DatabaseClient db) {
        this.db = db;
    }

    /**
     * 키 목록을 chunk 단위로 분할하여 순차(concat) 조회하고 결과를 하나의 스트림으로 이어 붙입니다.
     * <p>
     * 한 쿼리의 바인딩 파라미터 수를 chunk 크기 이하로 제한합니다.
     *
     * @param keys    조회할 전체 키 목록
     * @param chunk   한 번에 조회할 최대 키 수
     * @param onceFn  chunk 단위로 실행할 조회 함수
     * @param <K>     키 타입
     * @param <R>     결과 타입
     * @return chunk 순서대로 이어 붙인 조회 결과
     */
    protected <K, R> Flux<R> chunkedSelect(
            Collection<K> keys,
            int chunk,
            Function<List<K>, Flux<R>> onceFn
    ) {
        if (keys == null || keys.isEmpty()) return Flux.empty();
        return Flux.fromIterable(keys)
                .buffer(chunk)
                .concatMap(onceFn);
    }

    /**
     * {@code :prefix0, :prefix1, ...} 형태의 placeholder 목록을 만듭니다.
     *
     * @param prefix 파라미터 이름 접두사
     * @param size   파라미터 개수
     * @return 콤마로 구분된 placeholder 문자열
     */
    protected static String placeholders(String prefix, int size) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < size; i++) {
            if (i > 0) sb.append(", ");
            sb.append(':').append(prefix).append(i);
        }
        return sb.toString();
    }
}
