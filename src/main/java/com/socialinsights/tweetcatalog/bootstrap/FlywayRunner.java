package com.socialinsights.tweetcatalog.bootstrap;

import com.socialinsights.tweetcatalog.application.ingest.config.LoaderProperties;
import com.socialinsights.tweetcatalog.application.ingest.policy.SchemaVariant;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;

import java.util.Locale;

/**
 * 애플리케이션 시작 시점에 Flyway 마이그레이션을 실행하는 설정 클래스입니다.
 *
 * <p>{@link ApplicationRunner}를 Bean으로 등록해, 컨텍스트 초기화 직후
 * JDBC datasource 설정을 기반으로 {@link Flyway#migrate()}를 수행합니다.
 * 적재 러너보다 먼저 실행되도록 가장 높은 우선순위를 가집니다.</p>
 *
 * <p>마이그레이션 위치는 {@code spring.flyway.locations}가 있으면 그 값을,
 * 없으면 {@code loader.schema-variant}에 맞는 위치를 사용합니다.</p>
 */
@Configuration
@Profile("local")
public class FlywayRunner {

    private static final Logger LOG = LoggerFactory.getLogger(FlywayRunner.class);

    /**
     * 애플리케이션 시작 직후 Flyway 마이그레이션을 실행하는 Runner Bean을 생성합니다.
     *
     * @param env   application.yml 및 profile 설정을 조회하기 위한 {@link Environment}
     * @param props loader 설정(스키마 종류)
     * @return Flyway 마이그레이션을 수행하는 {@link ApplicationRunner}
     */
    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE)
    ApplicationRunner runFlyway(Environment env, LoaderProperties props) {
        return args -> {
            String url = env.getProperty("spring.datasource.url");
            String user = env.getProperty("spring.datasource.username");
            String pass = env.getProperty("spring.datasource.password");
            String locations = env.getProperty("spring.flyway.locations", locationOf(props.schemaVariant()));

            Flyway flyway = Flyway.configure()
                    .dataSource(url, user, pass)
                    .locations(locations)
                    .baselineOnMigrate(Boolean.parseBoolean(
                            env.getProperty("spring.flyway.baseline-on-migrate", "false")
                    ))
                    .baselineVersion(env.getProperty("spring.flyway.baseline-version", "0"))
                    .load();

            int applied = flyway.migrate().migrationsExecuted;
            LOG.info("Flyway applied {} migrations from {}", applied, locations);
        };
    }

    /**
     * 스키마 종류별 마이그레이션 위치.
     *
     * @param variant 스키마 종류
     * @return classpath 위치
     */
    static String locationOf(SchemaVariant variant) {
        return "classpath:db/migration/" + variant.name().toLowerCase(Locale.ROOT);
    }
}
