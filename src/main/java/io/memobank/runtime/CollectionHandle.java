package io.memobank.runtime;

import io.memobank.model.CollectionStatus;
import io.memobank.model.ResourceView;

import java.util.List;
import java.util.Map;

/** Returned by {@link MemoProject#register}; binds every call to one collection name. */
public final class CollectionHandle {
    private final MemoProject project;
    private final String name;

    CollectionHandle(MemoProject project, String name) {
        this.project = project;
        this.name = name;
    }

    public String name() {
        return name;
    }

    public ResourceHandle fetch(String identifier) {
        return project.fetch(name, identifier);
    }

    public ResourceHandle fetch(String identifier, Map<String, Object> args) {
        return project.fetch(name, identifier, args, false, false);
    }

    public ResourceHandle fetch(String identifier, Map<String, Object> args, boolean recompute, boolean block) {
        return project.fetch(name, identifier, args, recompute, block);
    }

    public ResourceHandle fetchBlocking(String identifier, Map<String, Object> args) {
        return project.fetch(name, identifier, args, false, true);
    }

    public ResourceHandle recompute(String identifier, Map<String, Object> args, boolean block) {
        return project.fetch(name, identifier, args, true, block);
    }

    public String status(String identifier) {
        return project.status(name, identifier);
    }

    public ResourceView inspect(String identifier) {
        return project.inspect(name, identifier);
    }

    public CollectionStatus status() {
        return project.status(name);
    }

    public List<String> findByStatus(String status) {
        return project.findByStatus(name, status);
    }

    public String fetchLog(String identifier) {
        return project.fetchLog(name, identifier);
    }

    public String fetchError(String identifier) {
        return project.fetchError(name, identifier);
    }
}
