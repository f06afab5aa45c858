package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.TransactionDefinition;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link R2dbcTxConfig} 배치 트랜잭션 정의 테스트.
 */
@DisplayName("배치 트랜잭션 설정 테스트")
class R2dbcTxConfigTest {

    @DisplayName("배치 커밋은 독립 트랜잭션, READ COMMITTED")
    @Test
    void batchDefinition() {
        TransactionDefinition def = R2dbcTxConfig.batchDefinition();

        assertEquals(TransactionDefinition.PROPAGATION_REQUIRES_NEW, def.getPropagationBehavior());
        assertEquals(TransactionDefinition.ISOLATION_READ_COMMITTED, def.getIsolationLevel());
        assertEquals("tweet-batch-commit", def.getName());
        assertFalse(def.isReadOnly());
    }
}
