package com.draftpilot.orchestrator.resilience;

import com.draftpilot.orchestrator.service.ClaimLostException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.net.ConnectException;
import java.sql.SQLTransientConnectionException;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class TransientErrorsTest {

    @Test
    void lockTimeoutsAndLostConnections_areTransient() {
        assertThat(TransientErrors.isTransientDatabaseError(new QueryTimeoutException("lock wait"))).isTrue();
        assertThat(TransientErrors.isTransientDatabaseError(
                new CannotCreateTransactionException("pool exhausted",
                        new SQLTransientConnectionException("timeout after 2000ms")))).isTrue();
    }

    @Test
    void causeChainIsSearched() {
        RuntimeException wrapped = new IllegalStateException("write failed",
                new RuntimeException(new ConnectException("refused")));

        assertThat(TransientErrors.isTransientDatabaseError(wrapped)).isTrue();
    }

    @Test
    void constraintViolationsAndDomainErrors_areNot() {
        assertThat(TransientErrors.isTransientDatabaseError(
                new DataIntegrityViolationException("duplicate key"))).isFalse();
        assertThat(TransientErrors.isTransientDatabaseError(
                new ClaimLostException(UUID.randomUUID(), "claimed by other"))).isFalse();
        assertThat(TransientErrors.isTransientDatabaseError(null)).isFalse();
    }
}
