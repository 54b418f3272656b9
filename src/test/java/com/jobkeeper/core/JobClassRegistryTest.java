package com.jobkeeper.core;

import org.junit.jupiter.api.Test;
import org.quartz.Job;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JobClassRegistryTest {
    public static class NoopJob implements Job {
        @Override
        public void execute(org.quartz.JobExecutionContext context) {
        }
    }

    @Test
    public void testRegisterAndCreate() {
        JobClassRegistry registry = new JobClassRegistry().register(NoopJob.class, NoopJob::new);
        assertTrue(registry.contains(NoopJob.class.getName()));
        Job a = registry.create(NoopJob.class.getName());
        Job b = registry.create(NoopJob.class.getName());
        assertNotNull(a);
        assertNotSame(a, b);
    }

    @Test
    public void testUnknownNames() {
        JobClassRegistry registry = new JobClassRegistry();
        assertFalse(registry.contains(null));
        assertFalse(registry.contains("java.lang.Runtime"));
        assertNull(registry.create("java.lang.Runtime"));
        assertNull(registry.create(null));
    }

    @Test
    public void testNamesAreSortedAndLatestWins() {
        JobClassRegistry registry = new JobClassRegistry()
                .register("zeta", NoopJob::new)
                .register("alpha", NoopJob::new);
        Job replacement = new NoopJob();
        registry.register("alpha", () -> replacement);
        assertEquals(List.of("alpha", "zeta"), registry.names());
        assertSame(replacement, registry.create("alpha"));
    }
}
