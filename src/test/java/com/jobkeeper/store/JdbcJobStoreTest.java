package com.jobkeeper.store;

import com.jobkeeper.model.JobDefinition;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcJobStoreTest extends AbstractJobStoreTest {
    private JdbcDataSource ds;

    @Override
    protected JobStore createStore() {
        ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:jk_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1");
        return new JdbcJobStore(ds);
    }

    @Test
    public void testSchemaCreationIsRepeatable() {
        store.addJob(job("kept", "g"));
        JdbcJobStore again = new JdbcJobStore(ds);
        assertTrue(again.isInitialized());
        JobDefinition loaded = again.getJob("kept", "g");
        assertNotNull(loaded);
        assertEquals("com.example.Job", loaded.getTarget());
    }

    @Test
    public void testLikeWildcardsAreLiteral() {
        store.addJob(job("a_b", "g"));
        store.addJob(job("axb", "g"));
        com.jobkeeper.model.JobQuery q = new com.jobkeeper.model.JobQuery();
        q.setJobName("a_");
        assertEquals(1, store.getJobs(q).getTotalCount());
    }
}
