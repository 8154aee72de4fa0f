package com.example.jobscheduler.service.dispatch;

import com.example.jobscheduler.service.job.JobHandlerRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobDispatchRouter Tests")
class JobDispatchRouterTest {

    @Mock
    private JobHandlerRegistry handlerRegistry;

    @Mock
    private JobWorkQueue workQueue;

    @InjectMocks
    private JobDispatchRouter router;

    @Test
    @DisplayName("Known job type is enqueued")
    void knownJobTypeEnqueued() {
        var scheduleId = UUID.randomUUID();
        when(handlerRegistry.hasHandler("orders.fetch_new")).thenReturn(true);

        assertThat(router.dispatch("orders.fetch_new", scheduleId)).isTrue();
        verify(workQueue).enqueue("orders.fetch_new", scheduleId);
    }

    @Test
    @DisplayName("Unknown job type returns false without throwing")
    void unknownJobTypeReturnsFalse() {
        when(handlerRegistry.hasHandler("unknown.type")).thenReturn(false);

        assertThat(router.dispatch("unknown.type", UUID.randomUUID())).isFalse();
        verifyNoInteractions(workQueue);
    }

    @Test
    @DisplayName("Queue rejection propagates to the caller")
    void rejectionPropagates() {
        var scheduleId = UUID.randomUUID();
        when(handlerRegistry.hasHandler("orders.fetch_new")).thenReturn(true);
        doThrow(new TaskRejectedException("full")).when(workQueue).enqueue("orders.fetch_new", scheduleId);

        assertThatThrownBy(() -> router.dispatch("orders.fetch_new", scheduleId))
                .isInstanceOf(TaskRejectedException.class);
    }
}
