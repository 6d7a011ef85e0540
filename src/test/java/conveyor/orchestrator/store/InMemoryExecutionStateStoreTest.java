package conveyor.orchestrator.store;

import conveyor.orchestrator.repository.ExecutionStateStore;

class InMemoryExecutionStateStoreTest extends ExecutionStateStoreContractTest {

    @Override
    protected ExecutionStateStore createStore() {
        return new InMemoryExecutionStateStore();
    }
}
