package io.memobank.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.memobank.compute.ComputeContext;
import io.memobank.compute.RunLog;
import io.memobank.config.MemoBankConfig.ResourcePaths;
import io.memobank.model.ResourceStatus;
import io.memobank.model.ResourceView;
import io.memobank.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decides between cache hit and computation, and runs computations inline or on a dedicated
 * daemon thread. At most one computation per (collection, identifier) is in flight inside
 * this process; concurrent fetches of the same resource join it.
 */
public final class FetchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);
    private static final int LOCK_STRIPES = 64;

    private final ConcurrentMap<InFlightKey, InFlight> inFlight;
    private final Object[] dispatchLocks;
    private final AtomicLong threadSeq;
    private final DateTimeFormatter runLogTimestamps;

    public FetchOrchestrator(DateTimeFormatter runLogTimestamps) {
        this.inFlight = new ConcurrentHashMap<>();
        this.dispatchLocks = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            dispatchLocks[i] = new Object();
        }
        this.threadSeq = new AtomicLong(0L);
        this.runLogTimestamps = runLogTimestamps;
    }

    public ResourceHandle fetch(
            ResourceCollection collection,
            String identifier,
            Map<String, Object> args,
            boolean recompute,
            boolean block
    ) {
        InFlightKey key = new InFlightKey(collection.name(), identifier);
        ResourcePaths paths = collection.store().paths(identifier);
        Decision decision;
        synchronized (lockFor(key)) {
            decision = decide(collection, identifier, recompute, key);
        }
        if (decision.joined() != null) {
            return join(decision.joined(), paths, block);
        }
        if (decision.cached() != null) {
            return new ResourceHandle(decision.cached(), ResourceHandle.Source.CACHE, paths,
                    CompletableFuture.completedFuture(decision.cached()));
        }
        InFlight owned = decision.owned();

        Map<String, Object> safeArgs = args == null ? Map.of() : args;
        log.info("Computing resource \"{}\" in \"{}\"", identifier, collection.name());
        if (block) {
            ResourceView terminal = run(collection, identifier, safeArgs, key, owned);
            return new ResourceHandle(terminal, ResourceHandle.Source.COMPUTED, paths, owned.future().copy());
        }
        Thread worker = new Thread(
                () -> run(collection, identifier, safeArgs, key, owned),
                "memobank-compute-" + collection.name() + "-" + threadSeq.incrementAndGet()
        );
        worker.setDaemon(true);
        worker.start();
        return new ResourceHandle(owned.pending(), ResourceHandle.Source.COMPUTED, paths, owned.future().copy());
    }

    /** Caller holds the key's dispatch lock. */
    private Decision decide(ResourceCollection collection, String identifier, boolean recompute, InFlightKey key) {
        InFlight running = inFlight.get(key);
        if (running != null) {
            return new Decision(running, null, null);
        }
        ResourceView snapshot = collection.lifecycle().load(identifier);
        if (!recompute && snapshot.status().isTerminal()) {
            return new Decision(null, snapshot, null);
        }
        if (snapshot.status() == ResourceStatus.PENDING) {
            log.warn("Resource \"{}\" in \"{}\" is pending with no computation in flight; recomputing",
                    identifier, collection.name());
        }
        ResourceView pending = collection.lifecycle().begin(identifier, nowMs());
        InFlight entry = new InFlight(pending, new CompletableFuture<>());
        inFlight.put(key, entry);
        return new Decision(null, null, entry);
    }

    public boolean isInFlight(String collection, String identifier) {
        return inFlight.containsKey(new InFlightKey(collection, identifier));
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private ResourceHandle join(InFlight running, ResourcePaths paths, boolean block) {
        if (block) {
            ResourceView terminal = running.future().join();
            return new ResourceHandle(terminal, ResourceHandle.Source.IN_FLIGHT, paths, running.future().copy());
        }
        return new ResourceHandle(running.pending(), ResourceHandle.Source.IN_FLIGHT, paths, running.future().copy());
    }

    private ResourceView run(
            ResourceCollection collection,
            String identifier,
            Map<String, Object> args,
            InFlightKey key,
            InFlight entry
    ) {
        ResourceView terminal;
        try {
            terminal = execute(collection, identifier, args);
        } catch (RuntimeException | Error e) {
            inFlight.remove(key, entry);
            entry.future().completeExceptionally(e);
            log.error("Computation of \"{}\" in \"{}\" aborted", identifier, collection.name(), e);
            throw e;
        }
        inFlight.remove(key, entry);
        entry.future().complete(terminal);
        return terminal;
    }

    private ResourceView execute(ResourceCollection collection, String identifier, Map<String, Object> args) {
        ResourcePaths paths = collection.store().paths(identifier);
        RunLog runLog = new RunLog(collection.name(), identifier, paths.log(), runLogTimestamps);
        ComputeContext context = new ComputeContext(collection.name(), identifier, paths.storage(), paths.log(), runLog);
        try {
            Object value = collection.function().compute(identifier, args, context);
            JsonNode result = Jsons.toTree(value);
            return collection.lifecycle().complete(identifier, result, nowMs());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("Computation of \"{}\" in \"{}\" failed", identifier, collection.name(), e);
            return collection.lifecycle().fail(identifier, stackTrace(e), nowMs());
        } catch (Error e) {
            collection.lifecycle().fail(identifier, stackTrace(e), nowMs());
            throw e;
        }
    }

    private Object lockFor(InFlightKey key) {
        return dispatchLocks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    private static String stackTrace(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    private static long nowMs() {
        return Instant.now().toEpochMilli();
    }

    private record InFlightKey(String collection, String identifier) {
    }

    /** The future stays private to the orchestrator; handles only ever see copies of it. */
    private record InFlight(ResourceView pending, CompletableFuture<ResourceView> future) {
    }

    private record Decision(InFlight joined, ResourceView cached, InFlight owned) {
    }
}
