package io.memobank.cli;

import io.memobank.config.MemoBankConfig;
import io.memobank.model.ResourceView;
import io.memobank.runtime.MemoProject;
import io.memobank.runtime.ResourceHandle;
import io.memobank.runtime.UnknownCollectionException;
import io.memobank.runtime.UnknownResourceException;
import io.memobank.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "memobank",
        mixinStandardHelpOptions = true,
        description = "Persistent memoization store CLI",
        subcommands = {
                MemoBankCommand.CollectionsCommand.class,
                MemoBankCommand.FetchCommand.class,
                MemoBankCommand.StatusCommand.class,
                MemoBankCommand.FindCommand.class,
                MemoBankCommand.LogCommand.class,
                MemoBankCommand.ErrorCommand.class
        }
)
public final class MemoBankCommand implements Runnable {
    @Option(names = {"--root"}, description = "Project base directory", defaultValue = "data")
    String root;

    @Option(names = {"--collections"}, description = "Script collections JSON file (default: <root>/collections.json)")
    String collectionsFile;

    @Override
    public void run() {
        System.out.println("Use subcommands: collections | fetch | status | find | log | error");
    }

    MemoProject project() {
        MemoBankConfig config = MemoBankConfig.fromRoot(root);
        Path file = collectionsFile == null || collectionsFile.isBlank()
                ? config.collectionsFile()
                : Path.of(collectionsFile);
        MemoProject project = new MemoProject(config);
        try {
            CollectionsFile.read(file).registerAll(project);
        } catch (RuntimeException e) {
            project.close();
            throw e;
        }
        return project;
    }

    static Integer misuse(RuntimeException e) {
        System.err.println(e.getMessage());
        return 1;
    }

    static Map<String, Object> viewJson(ResourceView view) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("collection", view.collection());
        out.put("id", view.identifier());
        out.put("status", view.statusToken());
        out.put("start_time", view.startTime());
        out.put("end_time", view.endTime());
        out.put("result", view.result());
        return out;
    }

    @Command(name = "collections", description = "List registered collections with status counts")
    static final class CollectionsCommand implements Callable<Integer> {
        @ParentCommand
        MemoBankCommand parent;

        @Override
        public Integer call() {
            try (MemoProject project = parent.project()) {
                System.out.println(Jsons.toJson(project.status()));
                return 0;
            }
        }
    }

    @Command(name = "fetch", description = "Fetch a resource, computing it if it is not cached")
    static final class FetchCommand implements Callable<Integer> {
        @ParentCommand
        MemoBankCommand parent;

        @Option(names = {"--collection"}, required = true, description = "Collection name")
        String collection;

        @Option(names = {"--id"}, required = true, description = "Resource identifier")
        String id;

        @Option(names = {"--args"}, description = "Arguments as a JSON object")
        String args;

        @Option(names = {"--recompute"}, description = "Discard the cached result and compute again")
        boolean recompute;

        @Override
        public Integer call() {
            try (MemoProject project = parent.project()) {
                Map<String, Object> parsed = Jsons.parseArgs(args);
                // A CLI process exits when the command returns, so computation always blocks here.
                ResourceHandle handle = project.fetch(collection, id, parsed, recompute, true);
                Map<String, Object> out = viewJson(handle.view());
                out.put("source", handle.source().name().toLowerCase(Locale.ROOT));
                System.out.println(Jsons.toJson(out));
                return 0;
            } catch (UnknownCollectionException | IllegalArgumentException e) {
                return misuse(e);
            }
        }
    }

    @Command(name = "status", description = "Show a resource status, or aggregate counts for a collection")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        MemoBankCommand parent;

        @Option(names = {"--collection"}, required = true, description = "Collection name")
        String collection;

        @Option(names = {"--id"}, description = "Resource identifier")
        String id;

        @Override
        public Integer call() {
            try (MemoProject project = parent.project()) {
                if (id == null || id.isBlank()) {
                    System.out.println(Jsons.toJson(project.status(collection)));
                } else {
                    System.out.println(Jsons.toJson(viewJson(project.inspect(collection, id))));
                }
                return 0;
            } catch (UnknownCollectionException | UnknownResourceException | IllegalArgumentException e) {
                return misuse(e);
            }
        }
    }

    @Command(name = "find", description = "List resource ids with a given status")
    static final class FindCommand implements Callable<Integer> {
        @ParentCommand
        MemoBankCommand parent;

        @Option(names = {"--collection"}, required = true, description = "Collection name")
        String collection;

        @Option(names = {"--status"}, defaultValue = "complete", description = "pending|complete|error|unknown")
        String status;

        @Override
        public Integer call() {
            try (MemoProject project = parent.project()) {
                List<String> ids = project.findByStatus(collection, status);
                System.out.println(Jsons.toJson(ids));
                return 0;
            } catch (UnknownCollectionException | IllegalArgumentException e) {
                return misuse(e);
            }
        }
    }

    @Command(name = "log", description = "Print the run log of a resource")
    static final class LogCommand implements Callable<Integer> {
        @ParentCommand
        MemoBankCommand parent;

        @Option(names = {"--collection"}, required = true, description = "Collection name")
        String collection;

        @Option(names = {"--id"}, required = true, description = "Resource identifier")
        String id;

        @Override
        public Integer call() {
            try (MemoProject project = parent.project()) {
                System.out.print(project.fetchLog(collection, id));
                return 0;
            } catch (UnknownCollectionException | UnknownResourceException | IllegalArgumentException e) {
                return misuse(e);
            }
        }
    }

    @Command(name = "error", description = "Print the captured error trace of a resource")
    static final class ErrorCommand implements Callable<Integer> {
        @ParentCommand
        MemoBankCommand parent;

        @Option(names = {"--collection"}, required = true, description = "Collection name")
        String collection;

        @Option(names = {"--id"}, required = true, description = "Resource identifier")
        String id;

        @Override
        public Integer call() {
            try (MemoProject project = parent.project()) {
                System.out.print(project.fetchError(collection, id));
                return 0;
            } catch (UnknownCollectionException | UnknownResourceException | IllegalArgumentException e) {
                return misuse(e);
            }
        }
    }
}
