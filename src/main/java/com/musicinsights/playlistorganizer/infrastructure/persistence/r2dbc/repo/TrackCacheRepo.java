package com.musicinsights.playlistorganizer.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.playlistorganizer.infrastructure.config.TrackCacheProperties;
import com.musicinsights.playlistorganizer.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.musicinsights.playlistorganizer.infrastructure.persistence.r2dbc.row.TrackCacheRow;
import com.musicinsights.playlistorganizer.infrastructure.reccobeats.dto.ReccoBeatsAudioFeatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import tools.jackson.databind.ObjectMapper;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 오디오 특성 로컬 캐시(track_cache 테이블) Repository입니다.
 * <p>
 * 캐시는 최적화 수단이므로 어떤 실패도 호출자에게 예외로 전파하지 않습니다.
 * 조회 실패는 그때까지 읽은 결과(또는 빈 결과)로, 저장 실패는 {@code false}로 끝납니다.
 * JSON으로 해석할 수 없는 행은 해당 키만 캐시 미스로 취급합니다.
 */
@Component
public class TrackCacheRepo extends BatchSqlSupport {

    private static final Logger log = LoggerFactory.getLogger(TrackCacheRepo.class);

    private final ObjectMapper objectMapper;
    private final int chunkSize;

    /**
     * @param db           R2DBC DatabaseClient
     * @param objectMapper 캐시 값 직렬화용 ObjectMapper
     * @param props        캐시 설정(조회 chunk 크기)
     */
    public TrackCacheRepo(DatabaseClient db, ObjectMapper objectMapper, TrackCacheProperties props) {
        super(db);
        this.objectMapper = objectMapper;
        this.chunkSize = props.getLookupChunkSize();
    }

    /**
     * 여러 트랙의 캐시된 오디오 특성을 한꺼번에 조회합니다.
     * <p>
     * 중복 키는 제거하고, 최대 chunk 크기 단위의 IN 쿼리를 순차 실행합니다.
     *
     * @param trackIds 조회할 트랙 ID 목록
     * @return 트랙 ID → 오디오 특성(캐시에 있는 것만)
     */
    public Mono<Map<String, ReccoBeatsAudioFeatures>> findFeatures(Collection<String> trackIds) {
        List<String> keys = trackIds == null ? List.of() : trackIds.stream()
                .filter(Objects::nonNull)
                .filter(id -> !id.isBlank())
                .distinct()
                .toList();
        if (keys.isEmpty()) return Mono.just(Map.of());

        return Mono.defer(() -> {
            Map<String, ReccoBeatsAudioFeatures> found = new LinkedHashMap<>();
            return chunkedSelect(keys, chunkSize, this::selectOnce)
                    .doOnNext(row -> {
                        ReccoBeatsAudioFeatures features = parse(row);
                        if (features != null) found.put(row.trackId(), features);
                    })
                    .onErrorResume(e -> {
                        log.error("Failed to read track cache; continuing with {} cached entries", found.size(), e);
                        return Flux.empty();
                    })
                    .then(Mono.fromSupplier(() -> {
                        log.debug("Track cache lookup: {} requested, {} found", keys.size(), found.size());
                        return found;
                    }));
        });
    }

    /**
     * 오디오 특성을 캐시에 저장합니다(같은 트랙 ID면 덮어쓰기).
     *
     * @param trackId  트랙 ID
     * @param features 오디오 특성
     * @return 저장 성공 여부
     */
    public Mono<Boolean> saveFeatures(String trackId, ReccoBeatsAudioFeatures features) {
        if (trackId == null || trackId.isBlank() || features == null) return Mono.just(false);

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(features))
                .flatMap(json -> db.sql("""
                                MERGE INTO track_cache (track_id, serialized_value, created_at)
                                KEY (track_id)
                                VALUES (:trackId, :value, CURRENT_TIMESTAMP)
                                """)
                        .bind("trackId", trackId)
                        .bind("value", json)
                        .fetch()
                        .rowsUpdated())
                .map(updated -> updated > 0)
                .onErrorResume(e -> {
                    log.error("Failed to write track cache entry for {}", trackId, e);
                    return Mono.just(false);
                });
    }

    /**
     * 한 chunk에 대한 IN 쿼리를 실행합니다.
     *
     * @param ids 조회할 트랙 ID(비어있지 않음)
     * @return 조회된 행
     */
    private Flux<TrackCacheRow> selectOnce(List<String> ids) {
        String sql = "SELECT track_id, serialized_value FROM track_cache WHERE track_id IN ("
                + placeholders("id", ids.size()) + ")";

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql);
        for (int i = 0; i < ids.size(); i++) {
            spec = spec.bind("id" + i, ids.get(i));
        }

        return spec.map((row, meta) -> new TrackCacheRow(
                        row.get(0, String.class),
                        row.get(1, String.class)
                ))
                .all();
    }

    /**
     * 캐시 행을 역직렬화합니다. 손상된 행이면 null을 반환합니다.
     *
     * @param row 캐시 행
     * @return 오디오 특성 또는 null
     */
    private ReccoBeatsAudioFeatures parse(TrackCacheRow row) {
        if (row.serializedValue() == null || row.serializedValue().isBlank()) {
            log.warn("Skipping empty track cache entry for {}", row.trackId());
            return null;
        }
        try {
            return objectMapper.readValue(row.serializedValue(), ReccoBeatsAudioFeatures.class);
        } catch (Exception e) {
            log.warn("Skipping corrupt track cache entry for {}: {}", row.trackId(), e.getMessage());
            return null;
        }
    }
}
