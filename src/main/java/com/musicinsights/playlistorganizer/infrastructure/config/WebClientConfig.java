package com.musicinsights.playlistorganizer.infrastructure.config;

import com.musicinsights.playlistorganizer.infrastructure.spotify.auth.SpotifyAuthFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * 외부 API별 {@link WebClient} 구성.
 *
 * <ul>
 *   <li>spotifyApiWebClient: Web API 호출용. {@link SpotifyAuthFilter}가 토큰 주입/갱신을 담당한다.</li>
 *   <li>spotifyAccountsWebClient: 토큰 엔드포인트 전용. 인증 필터를 거치지 않는다.</li>
 *   <li>reccoBeatsWebClient: 오디오 특성 조회용. 인증 없음.</li>
 * </ul>
 */
@Configuration
public class WebClientConfig {

    /** 응답 버퍼 상한(플레이리스트 100곡 페이지 기준 여유) */
    private static final int MAX_IN_MEMORY_SIZE = 4 * 1024 * 1024;

    @Bean
    public WebClient spotifyApiWebClient(SpotifyProperties props, SpotifyAuthFilter authFilter) {
        return WebClient.builder()
                .baseUrl(props.getApiBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .filter(authFilter)
                .build();
    }

    @Bean
    public WebClient spotifyAccountsWebClient(SpotifyProperties props) {
        return WebClient.builder()
                .baseUrl(props.getAccountsBaseUrl())
                .build();
    }

    @Bean
    public WebClient reccoBeatsWebClient(ReccoBeatsProperties props) {
        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * 429 재시도 대기에 쓰는 타이머.
     *
     * <p>공유 parallel 스케줄러라서 컨텍스트 종료 시 dispose하지 않는다.</p>
     *
     * @return 타이머 스케줄러
     */
    @Bean(destroyMethod = "")
    public Scheduler reccoBeatsRetryScheduler() {
        return Schedulers.parallel();
    }
}
