package com.jobkeeper.store;

public class InMemoryJobStoreTest extends AbstractJobStoreTest {
    @Override
    protected JobStore createStore() {
        return new InMemoryJobStore();
    }
}
