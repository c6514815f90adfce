package io.memobank.runtime;

import io.memobank.compute.ComputeFunction;
import io.memobank.config.MemoBankConfig;
import io.memobank.config.ProjectSettings;
import io.memobank.model.CollectionStatus;
import io.memobank.model.ResourceStatus;
import io.memobank.model.ResourceView;
import io.memobank.model.StatusCounts;
import io.memobank.storage.ResourceStore;
import io.memobank.storage.SqliteStatusIndex;
import io.memobank.storage.StatusIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One deployment rooted at a base directory. Collections are registered explicitly, each with
 * its compute function, before they can be fetched. Closing the project releases every
 * collection's status index.
 */
public final class MemoProject implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MemoProject.class);

    private final MemoBankConfig config;
    private final ProjectSettings settings;
    private final FetchOrchestrator orchestrator;
    private final Map<String, ResourceCollection> collections;
    private volatile boolean closed;

    public MemoProject(MemoBankConfig config) {
        this.config = config;
        initRoot(config.rootDir());
        this.settings = ProjectSettings.load(config);
        this.orchestrator = new FetchOrchestrator(settings.runLogTimestampFormatter());
        this.collections = new LinkedHashMap<>();
        this.closed = false;
    }

    public static MemoProject open(String root) {
        return new MemoProject(MemoBankConfig.fromRoot(root));
    }

    public static MemoProject open(Path root) {
        return new MemoProject(MemoBankConfig.fromRoot(root));
    }

    public MemoBankConfig config() {
        return config;
    }

    public ProjectSettings settings() {
        return settings;
    }

    public synchronized CollectionHandle register(String name, ComputeFunction function) {
        ensureOpen();
        MemoBankConfig.requireSafeName("Collection name", name);
        Objects.requireNonNull(function, "function");
        if (collections.containsKey(name)) {
            throw new IllegalArgumentException("Collection name has already been used: '" + name + "'");
        }
        Path dir = config.collectionDir(name);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create collection directory: " + dir, e);
        }
        StatusIndex index = SqliteStatusIndex.open(config.indexDbFile(name), settings.indexBusyTimeoutMs());
        ResourceStore store = new ResourceStore(config, name, settings.prettyResults());
        collections.put(name, new ResourceCollection(name, function, store, index));
        log.debug("Registered collection {} at {}", name, dir);
        return new CollectionHandle(this, name);
    }

    public CollectionHandle collection(String name) {
        requireCollection(name);
        return new CollectionHandle(this, name);
    }

    public synchronized List<String> collectionNames() {
        return List.copyOf(collections.keySet());
    }

    public ResourceHandle fetch(String collection, String identifier) {
        return fetch(collection, identifier, Map.of(), false, false);
    }

    public ResourceHandle fetch(
            String collection,
            String identifier,
            Map<String, Object> args,
            boolean recompute,
            boolean block
    ) {
        ResourceCollection coll = requireCollection(collection);
        String id = MemoBankConfig.requireSafeName("Resource identifier", identifier);
        return orchestrator.fetch(coll, id, args == null ? Map.of() : args, recompute, block);
    }

    /** Status token of one resource; fails if it was never fetched. */
    public String status(String collection, String identifier) {
        return inspect(collection, identifier).statusToken();
    }

    public ResourceView inspect(String collection, String identifier) {
        ResourceCollection coll = requireCollection(collection);
        String id = MemoBankConfig.requireSafeName("Resource identifier", identifier);
        return coll.lifecycle().inspect(id);
    }

    public CollectionStatus status(String collection) {
        ResourceCollection coll = requireCollection(collection);
        StatusCounts counts = StatusCounts.empty();
        for (ResourceStatus status : statusesOf(coll).values()) {
            counts = counts.plus(status);
        }
        return new CollectionStatus(coll.name(), counts);
    }

    public Map<String, CollectionStatus> status() {
        Map<String, CollectionStatus> out = new LinkedHashMap<>();
        for (String name : collectionNames()) {
            out.put(name, status(name));
        }
        return out;
    }

    public List<String> findByStatus(String collection, String status) {
        return findByStatus(collection, ResourceStatus.fromQuery(status));
    }

    public List<String> findByStatus(String collection, ResourceStatus status) {
        ResourceCollection coll = requireCollection(collection);
        List<String> ids = new ArrayList<>();
        for (Map.Entry<String, ResourceStatus> entry : statusesOf(coll).entrySet()) {
            if (entry.getValue() == status) {
                ids.add(entry.getKey());
            }
        }
        return ids;
    }

    public String fetchLog(String collection, String identifier) {
        ResourceCollection coll = requireCollection(collection);
        return coll.store().readLog(requireResource(coll, identifier));
    }

    public String fetchError(String collection, String identifier) {
        ResourceCollection coll = requireCollection(collection);
        return coll.store().readError(requireResource(coll, identifier));
    }

    public boolean isComputing(String collection, String identifier) {
        return orchestrator.isInFlight(collection, identifier);
    }

    ResourceCollection resourceCollection(String name) {
        return requireCollection(name);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        int running = orchestrator.inFlightCount();
        if (running > 0) {
            log.warn("Closing project {} with {} computation(s) still running", config.rootDir(), running);
        }
        for (ResourceCollection coll : collections.values()) {
            coll.close();
        }
    }

    private synchronized ResourceCollection requireCollection(String name) {
        ensureOpen();
        ResourceCollection coll = collections.get(name);
        if (coll == null) {
            throw new UnknownCollectionException(name);
        }
        Path dir = config.collectionDir(name);
        if (!Files.isDirectory(dir)) {
            throw new IllegalStateException("Collection directory is missing: " + dir);
        }
        return coll;
    }

    /**
     * Indexed statuses, plus every resource directory the index has no entry for. The index
     * never holds {@code unknown}, so those directories are what the {@code unknown} count
     * is made of.
     */
    private static Map<String, ResourceStatus> statusesOf(ResourceCollection coll) {
        Map<String, ResourceStatus> statuses = new TreeMap<>();
        for (StatusIndex.Entry entry : coll.statusIndex().scan()) {
            statuses.put(entry.identifier(), entry.status());
        }
        for (String identifier : coll.store().listIdentifiers()) {
            statuses.putIfAbsent(identifier, ResourceStatus.UNKNOWN);
        }
        return statuses;
    }

    private String requireResource(ResourceCollection coll, String identifier) {
        String id = MemoBankConfig.requireSafeName("Resource identifier", identifier);
        if (!coll.store().exists(id)) {
            throw new UnknownResourceException(coll.name(), id);
        }
        return id;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Project is closed: " + config.rootDir());
        }
    }

    private static void initRoot(Path root) {
        if (Files.exists(root) && !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Project base path is not a directory: " + root);
        }
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create project directory: " + root, e);
        }
    }
}
