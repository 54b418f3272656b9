package com.jobkeeper.store;

import com.jobkeeper.model.JobDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class FileJobStoreTest extends AbstractJobStoreTest {
    @TempDir
    Path dir;

    @Override
    protected JobStore createStore() {
        return new FileJobStore(dir.resolve("data"));
    }

    @Test
    public void testSurvivesReopen() {
        store.addJob(job("persisted", "g"));
        FileJobStore reopened = new FileJobStore(dir.resolve("data"));
        assertTrue(reopened.isInitialized());
        assertNotNull(reopened.getJob("persisted", "g"));
        assertTrue(Files.exists(dir.resolve("data").resolve("jobs.json")));
    }

    @Test
    public void testCorruptFileIsNotOverwritten() throws Exception {
        Path jobs = dir.resolve("data").resolve("jobs.json");
        store.addJob(job("a", "g"));
        Files.writeString(jobs, "{not json");
        assertFalse(store.addJob(job("b", "g")));
        assertEquals("{not json", Files.readString(jobs));
        assertNull(store.getJob("a", "g"));
    }

    @Test
    public void testBackupsArePrunedToLimit() throws Exception {
        Path backups = dir.resolve("backups");
        FileJobStore backed = new FileJobStore(dir.resolve("backed"), backups, 2, Duration.ZERO);
        for (int i = 0; i < 5; i++) {
            JobDefinition j = job("job" + i, "g");
            assertTrue(backed.addJob(j));
            Thread.sleep(5);
        }
        long count;
        try (Stream<Path> s = Files.list(backups)) {
            count = s.filter(p -> p.getFileName().toString().startsWith("jobs_")).count();
        }
        assertEquals(2, count);
    }

    @Test
    public void testBackupIntervalLimitsCopies() throws Exception {
        Path backups = dir.resolve("backups");
        FileJobStore backed = new FileJobStore(dir.resolve("backed"), backups, 10, Duration.ofHours(1));
        for (int i = 0; i < 4; i++) {
            backed.addJob(job("job" + i, "g"));
        }
        long count;
        try (Stream<Path> s = Files.list(backups)) {
            count = s.filter(p -> p.getFileName().toString().startsWith("jobs_")).count();
        }
        assertEquals(1, count);
    }
}
