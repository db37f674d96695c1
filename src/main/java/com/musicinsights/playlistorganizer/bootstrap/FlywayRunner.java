package com.musicinsights.playlistorganizer.bootstrap;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;

/**
 * 애플리케이션 시작 시점에 트랙 캐시 스키마(Flyway 마이그레이션)를 적용하는 설정 클래스입니다.
 *
 * <p>R2DBC 드라이버로는 Flyway를 실행할 수 없으므로, 같은 H2 파일을 가리키는
 * JDBC URL({@code spring.datasource.*})로 {@link Flyway#migrate()}를 수행합니다.</p>
 *
 * <p>{@code app.track-cache.migrate-on-startup=false}이면 등록되지 않습니다.</p>
 */
@Configuration
@ConditionalOnProperty(prefix = "app.track-cache", name = "migrate-on-startup", havingValue = "true", matchIfMissing = true)
public class FlywayRunner {

    private static final Logger log = LoggerFactory.getLogger(FlywayRunner.class);

    /**
     * 애플리케이션 시작 직후 Flyway 마이그레이션을 실행하는 Runner Bean을 생성합니다.
     *
     * @param env application.yml 설정을 조회하기 위한 {@link Environment}
     * @return Flyway 마이그레이션을 수행하는 {@link ApplicationRunner}
     */
    @Bean
    @Order(0)
    ApplicationRunner runFlyway(Environment env) {
        return args -> {
            String url = env.getRequiredProperty("spring.datasource.url");
            String user = env.getProperty("spring.datasource.username");
            String pass = env.getProperty("spring.datasource.password");

            Flyway flyway = Flyway.configure()
                    .dataSource(url, user, pass)
                    .locations(env.getProperty("spring.flyway.locations", "classpath:db/migration"))
                    .baselineOnMigrate(Boolean.parseBoolean(
                            env.getProperty("spring.flyway.baseline-on-migrate", "false")
                    ))
                    .baselineVersion(env.getProperty("spring.flyway.baseline-version", "0"))
                    .load();

            MigrateResult result = flyway.migrate();
            log.info("Track cache schema ready ({} migration(s) applied, target {})",
                    result.migrationsExecuted, result.targetSchemaVersion);
        };
    }
}
