package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.reactive.TransactionalOperator;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * R2DBC 환경에서 Reactive 트랜잭션을 사용하기 위한 설정 클래스입니다.
 * <p>
 * 배치 커밋 시도 1회가 트랜잭션 1개이며, 트랜잭션은 커넥션 풀에서 커넥션 하나를 잡고 끝날 때 돌려줍니다.
 * 따라서 동시에 도는 워커끼리 커넥션을 공유하지 않습니다.
 */
@Configuration
public class R2dbcTxConfig {

    /** 배치 트랜잭션 이름 (로그/모니터링용) */
    static final String BATCH_TX_NAME = "tweet-batch-commit";

    /**
     * R2DBC용 트랜잭션 매니저를 생성합니다.
     *
     * @param cf R2DBC {@link ConnectionFactory}
     * @return Reactive 트랜잭션 매니저
     */
    @Bean
    public ReactiveTransactionManager reactiveTransactionManager(ConnectionFactory cf) {
        return new R2dbcTransactionManager(cf);
    }

    /**
     * 배치 커밋 시도를 감싸는 {@link TransactionalOperator}를 생성합니다.
     * <p>
     * 오류 시그널이면 롤백하므로, 데드락으로 실패한 시도는 부분 적용 없이 사라집니다.
     * 격리 수준은 READ COMMITTED로 고정해 InnoDB gap lock으로 생기는 워커 간 락 경합을 줄입니다.
     *
     * @param tm Reactive 트랜잭션 매니저
     * @return 트랜잭션 적용용 operator
     */
    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager tm) {
        return TransactionalOperator.create(tm, batchDefinition());
    }

    static TransactionDefinition batchDefinition() {
        DefaultTransactionDefinition def = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        def.setName(BATCH_TX_NAME);
        def.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        return def;
    }
}
