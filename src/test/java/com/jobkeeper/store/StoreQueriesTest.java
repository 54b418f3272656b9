package com.jobkeeper.store;

import com.jobkeeper.model.DistributionEntry;
import com.jobkeeper.model.ExecutionLogEntry;
import com.jobkeeper.model.JobDefinition;
import com.jobkeeper.model.JobQuery;
import com.jobkeeper.model.LogStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StoreQueriesTest {
    @Test
    public void testBucketBoundaries() {
        assertEquals(0, StoreQueries.bucketOf(999));
        assertEquals(1, StoreQueries.bucketOf(1000));
        assertEquals(2, StoreQueries.bucketOf(5000));
        assertEquals(5, StoreQueries.bucketOf(299_999));
        assertEquals(6, StoreQueries.bucketOf(300_000));
    }

    @Test
    public void testHistogramSkipsRunningRows() {
        ExecutionLogEntry running = new ExecutionLogEntry("a", "g");
        running.setDurationMillis(10L);
        ExecutionLogEntry done = new ExecutionLogEntry("a", "g");
        done.setStatus(LogStatus.SUCCESS);
        done.setDurationMillis(10L);
        ExecutionLogEntry noDuration = new ExecutionLogEntry("a", "g");
        noDuration.setStatus(LogStatus.FAILED);

        List<DistributionEntry> h = StoreQueries.durationHistogram(List.of(running, done, noDuration));
        assertEquals(7, h.size());
        assertEquals(1, h.get(0).getCount());
        assertEquals(100.0, h.get(0).getPercentage(), 0.001);
    }

    @Test
    public void testPercentageRounding() {
        assertEquals(33.33, StoreQueries.percentage(1, 3), 0.0001);
        assertEquals(0.0, StoreQueries.percentage(1, 0), 0.0001);
    }

    @Test
    public void testUnknownSortKeyFallsBackToNewestFirst() {
        LocalDateTime t = LocalDateTime.of(2024, 1, 1, 0, 0);
        List<JobDefinition> jobs = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            JobDefinition j = new JobDefinition("j" + i, "g");
            j.setCreateTime(t.plusDays(i));
            jobs.add(j);
        }
        JobDefinition undated = new JobDefinition("undated", "g");
        jobs.add(undated);

        JobQuery q = new JobQuery();
        q.sort("1; DROP TABLE", "asc");
        List<JobDefinition> sorted = StoreQueries.queryJobs(jobs, q).getItems();
        assertEquals("j2", sorted.get(0).getJobName());
        assertEquals("undated", sorted.get(3).getJobName());
    }

    @Test
    public void testNameFilterIsCaseInsensitive() {
        JobDefinition j = new JobDefinition("NightlyReport", "g");
        JobQuery q = new JobQuery();
        q.setJobName("nightlyrep");
        assertTrue(StoreQueries.matches(j, q));
        q.setJobName("weekly");
        assertFalse(StoreQueries.matches(j, q));
    }
}
