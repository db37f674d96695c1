package com.musicinsights.playlistorganizer.bootstrap;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.env.Environment;

import java.sql.Connection;
import java.sql.DriverManager;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * FlywayRunner가 track_cache 스키마를 만드는지 검증하는 통합 테스트.
 *
 * <p>러너를 다시 실행해도(이미 적용된 상태) 실패하지 않아야 하며,
 * 실행 후 JDBC로 히스토리 테이블과 track_cache 테이블을 확인한다.</p>
 */
@SpringBootTest
class FlywayRunnerTest {

    @Autowired Environment env;

    @Autowired ApplicationRunner flywayRunner;

    /**
     * @throws Exception JDBC 연결/쿼리 수행 과정에서 발생할 수 있는 예외
     */
    @Test
    @DisplayName("FlywayRunner가 마이그레이션을 수행하고 track_cache 테이블을 만듦")
    void runFlyway() throws Exception {
        flywayRunner.run(new DefaultApplicationArguments(new String[0]));

        String url = env.getProperty("spring.datasource.url");
        String user = env.getProperty("spring.datasource.username");
        String pass = env.getProperty("spring.datasource.password");

        assertThat(url).isNotNull();

        try (Connection conn = DriverManager.getConnection(url, user, pass);
             var st = conn.createStatement()) {
            try (var rs = st.executeQuery("SELECT COUNT(*) FROM \"flyway_schema_history\" WHERE \"success\" = TRUE")) {
                rs.next();
                assertThat(rs.getInt(1)).isGreaterThanOrEqualTo(1);
            }
            try (var rs = st.executeQuery("SELECT COUNT(*) FROM track_cache")) {
                assertThat(rs.next()).isTrue();
            }
        }
    }
}
