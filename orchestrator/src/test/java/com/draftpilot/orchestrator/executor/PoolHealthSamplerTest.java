package com.draftpilot.orchestrator.executor;

import com.draftpilot.orchestrator.resilience.ConnectionPoolHealthMonitor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PoolHealthSamplerTest {

    @Mock ConnectionPoolHealthMonitor monitor;

    @Test
    void sample_refreshesMonitor() {
        new PoolHealthSampler(monitor).sample();

        verify(monitor).sample();
    }

    @Test
    void sample_monitorError_loggedNotThrown() {
        when(monitor.sample()).thenThrow(new IllegalStateException("pool closed"));

        assertThatCode(() -> new PoolHealthSampler(monitor).sample()).doesNotThrowAnyException();
    }
}
