package com.jobkeeper.core;

import com.jobkeeper.model.ExecutionLogEntry;
import com.jobkeeper.model.LogQuery;
import com.jobkeeper.model.LogStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class LogRetentionSweeperTest {
    private EngineFixture fx;

    @BeforeEach
    public void setUp() throws Exception {
        fx = new EngineFixture();
    }

    @AfterEach
    public void tearDown() {
        fx.shutdown();
    }

    private void addLog(String name, LocalDateTime created) {
        ExecutionLogEntry e = new ExecutionLogEntry(name, "tests");
        e.setStatus(LogStatus.SUCCESS);
        e.setStartTime(created);
        e.setCreateTime(created);
        fx.store.addExecutionLog(e);
    }

    @Test
    public void testSweepRemovesOnlyExpiredRows() {
        addLog("old", LocalDateTime.now().minusDays(40));
        addLog("recent", LocalDateTime.now().minusDays(2));
        LogRetentionSweeper sweeper = new LogRetentionSweeper(fx.orchestrator, 30);
        assertEquals(1, sweeper.sweep());
        assertEquals(0, sweeper.sweep());
        assertEquals(1, fx.store.getExecutionLogs(new LogQuery()).getTotalCount());
    }

    @Test
    public void testStartRunsPeriodically() throws Exception {
        LogRetentionSweeper sweeper = new LogRetentionSweeper(fx.orchestrator, 30, 100);
        sweeper.start();
        try {
            addLog("old", LocalDateTime.now().minusDays(40));
            assertTrue(EngineFixture.waitFor(() -> fx.store.getExecutionLogs(new LogQuery()).getTotalCount() == 0, 3000));
        } finally {
            sweeper.stop();
        }
    }
}
