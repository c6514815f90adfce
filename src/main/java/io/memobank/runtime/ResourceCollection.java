package io.memobank.runtime;

import io.memobank.compute.ComputeFunction;
import io.memobank.storage.ResourceStore;
import io.memobank.storage.StatusIndex;

public final class ResourceCollection implements AutoCloseable {
    private final String name;
    private final ComputeFunction function;
    private final ResourceStore store;
    private final StatusIndex index;
    private final ResourceLifecycle lifecycle;

    ResourceCollection(String name, ComputeFunction function, ResourceStore store, StatusIndex index) {
        this.name = name;
        this.function = function;
        this.store = store;
        this.index = index;
        this.lifecycle = new ResourceLifecycle(name, store, index);
    }

    public String name() {
        return name;
    }

    public ComputeFunction function() {
        return function;
    }

    public ResourceStore store() {
        return store;
    }

    public StatusIndex statusIndex() {
        return index;
    }

    ResourceLifecycle lifecycle() {
        return lifecycle;
    }

    @Override
    public void close() {
        index.close();
    }
}
