package com.abathur.core.store;

class InMemoryTaskStoreTest extends AbstractTaskStoreTest {

    @Override
    protected TaskStore createStore() {
        return new InMemoryTaskStore(clock);
    }
}
