package com.example.icc.service;

import com.example.icc.error.StoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ApplauseSchedulerTest {

    @Mock
    private ApplauseService applauseService;

    @InjectMocks
    private ApplauseScheduler scheduler;

    @Test
    void testPublishLevel_FailureIsNotFatal() {
        when(applauseService.publishLevel()).thenThrow(new StoreException("zcount", new IllegalStateException("down")));

        assertDoesNotThrow(scheduler::publishLevel);
        assertDoesNotThrow(scheduler::publishLevel);

        verify(applauseService, times(2)).publishLevel();
    }

    @Test
    void testPruneOldData_RetriesNextTick() {
        when(applauseService.pruneOldData())
                .thenThrow(new StoreException("zremrangebyscore", new IllegalStateException("down")))
                .thenReturn(100L);

        assertDoesNotThrow(scheduler::pruneOldData);
        assertDoesNotThrow(scheduler::pruneOldData);

        verify(applauseService, times(2)).pruneOldData();
    }
}
