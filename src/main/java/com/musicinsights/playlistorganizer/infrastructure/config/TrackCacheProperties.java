package com.musicinsights.playlistorganizer.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 오디오 특성 로컬 캐시 설정({@code app.track-cache.*}).
 */
@ConfigurationProperties(prefix = "app.track-cache")
public class TrackCacheProperties {

    /** 기동 시 Flyway 마이그레이션 실행 여부 */
    private boolean migrateOnStartup = true;

    /** IN 절 하나에 넣을 최대 키 수 */
    private int lookupChunkSize = 500;

    public boolean isMigrateOnStartup() {
        return migrateOnStartup;
    }

    public void setMigrateOnStartup(boolean migrateOnStartup) {
        this.migrateOnStartup = migrateOnStartup;
    }

    public int getLookupChunkSize() {
        return lookupChunkSize;
    }

    public void setLookupChunkSize(int lookupChunkSize) {
        this.lookupChunkSize = lookupChunkSize;
    }
}
