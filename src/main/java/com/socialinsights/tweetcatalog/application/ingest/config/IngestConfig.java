package com.socialinsights.tweetcatalog.application.ingest.config;

import com.socialinsights.tweetcatalog.application.ingest.policy.WritePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.json.JsonMapper;

/**
 * ingest 파이프라인 공통 Bean 설정.
 */
@Configuration
@EnableConfigurationProperties(LoaderProperties.class)
public class IngestConfig {

    private static final Logger LOG = LoggerFactory.getLogger(IngestConfig.class);

    /**
     * 설정값으로부터 엔티티별 쓰기 정책을 확정한다.
     * <p>
     * 이 정책은 외부에서 프로비저닝된 스키마와 일치해야 한다.
     *
     * @param props loader 설정
     * @return 확정된 쓰기 정책
     */
    @Bean
    public WritePolicy writePolicy(LoaderProperties props) {
        WritePolicy policy = props.writePolicy();
        LOG.info("Write policy: variant={}, modes={}, authorMerge={}",
                props.schemaVariant(), policy.modes(), policy.authorMergePolicy());
        return policy;
    }

    /**
     * 트윗 라인 디코딩용 JSON 매퍼.
     * <p>
     * 웹 스타터가 없어 Jackson 자동 설정이 보장되지 않으므로 직접 등록한다.
     * 알 수 없는 필드는 DTO의 {@code @JsonIgnoreProperties}로 무시한다.
     *
     * @return JsonMapper
     */
    @Bean
    public JsonMapper jsonMapper() {
        return JsonMapper.builder().build();
    }
}
