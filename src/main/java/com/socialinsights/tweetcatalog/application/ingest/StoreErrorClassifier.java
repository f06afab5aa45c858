package com.socialinsights.tweetcatalog.application.ingest;

import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.R2dbcRollbackException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * 저장소 오류 중 "재시도하면 되는" 데드락/직렬화 실패 신호를 골라낸다.
 *
 * <p>예외 cause 체인 어디에든 다음 중 하나가 있으면 데드락으로 본다.</p>
 * <ul>
 *     <li>Spring {@link PessimisticLockingFailureException} 계열 (CannotAcquireLockException 포함)</li>
 *     <li>R2DBC {@link R2dbcRollbackException}</li>
 *     <li>SQLSTATE 40001(serialization failure), 40P01(deadlock detected)</li>
 *     <li>MySQL 오류 코드 1213(deadlock), 1205(lock wait timeout)</li>
 * </ul>
 * 그 외 오류는 모두 재시도하지 않는 치명적 오류다.
 */
@Component
public class StoreErrorClassifier {

    private static final Set<String> RETRYABLE_SQL_STATES = Set.of("40001", "40P01");
    private static final Set<Integer> RETRYABLE_ERROR_CODES = Set.of(1213, 1205);

    private static final int MAX_CAUSE_DEPTH = 16;

    /**
     * @param error 저장소 작업 중 발생한 오류
     * @return 데드락/직렬화 실패면 true
     */
    public boolean isDeadlock(Throwable error) {
        Throwable t = error;
        for (int depth = 0; t != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (isDeadlockSignal(t)) return true;
            if (t.getCause() == t) break;
            t = t.getCause();
        }
        return false;
    }

    private static boolean isDeadlockSignal(Throwable t) {
        if (t instanceof PessimisticLockingFailureException) return true;
        if (t instanceof R2dbcRollbackException) return true;
        if (t instanceof R2dbcException) {
            R2dbcException r = (R2dbcException) t;
            String sqlState = r.getSqlState();
            return (sqlState != null && RETRYABLE_SQL_STATES.contains(sqlState))
                    || RETRYABLE_ERROR_CODES.contains(r.getErrorCode());
        }
        return false;
    }
}
