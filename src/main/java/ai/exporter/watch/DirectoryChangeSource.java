package ai.exporter.watch;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.exporter.repo.AssetHandle;
import ai.exporter.repo.FileAssetRepository;

/**
 * Turns file changes below a snapshot root into asset events.
 * <p>
 * create -> ASSET_ADDED, modify -> ASSET_MODIFIED, delete -> ASSET_REMOVED.
 * Only *.json files are considered; directories the repository skips are not watched.
 * Events are dispatched on the polling thread (or the caller of {@link #pollOnce()}).
 */
public final class DirectoryChangeSource extends InMemoryChangeSource implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(DirectoryChangeSource.class);

    private final FileAssetRepository repository;
    private final Path root;
    private final WatchService watchService;
    private final Set<Path> registered = ConcurrentHashMap.newKeySet();

    // last known handle per file; deleted files can no longer be read
    private final Map<Path, AssetHandle> known = new ConcurrentHashMap<>();

    private ScheduledExecutorService scheduler;

    public DirectoryChangeSource(FileAssetRepository repository) throws IOException {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.root = repository.root();
        this.watchService = FileSystems.getDefault().newWatchService();
        registerAll(root);
        log.info("Watching snapshots below {}", root);
    }

    /** Starts polling on a daemon thread. */
    public synchronized void start(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "snapshot-watcher");
            t.setDaemon(true);
            return t;
        });
        final long millis = Math.max(1L, interval.toMillis());
        scheduler.scheduleWithFixedDelay(this::pollSafely, millis, millis, TimeUnit.MILLISECONDS);
    }

    /** Drains pending file events and publishes them; returns the number of events published. */
    public int pollOnce() {
        int published = 0;
        WatchKey key;
        while ((key = watchService.poll()) != null) {
            final Path watchedDir = (Path) key.watchable();

            for (WatchEvent<?> ev : key.pollEvents()) {
                final WatchEvent.Kind<?> kind = ev.kind();
                if (kind == OVERFLOW) {
                    log.warn("Watch event overflow in {}; some changes were missed", watchedDir);
                    continue;
                }
                @SuppressWarnings("unchecked")
                final WatchEvent<Path> pev = (WatchEvent<Path>) ev;
                final Path abs = watchedDir.resolve(pev.context()).toAbsolutePath().normalize();

                if (kind == ENTRY_CREATE && Files.isDirectory(abs)) {
                    try {
                        // files may land before the directory is registered
                        for (AssetHandle added : registerAll(abs)) {
                            publish(new AssetEvent(AssetEventType.ASSET_ADDED, added));
                            published++;
                        }
                    } catch (IOException ex) {
                        log.warn("Cannot watch new directory {}: {}", abs, ex.getMessage());
                    }
                    continue;
                }
                if (!abs.getFileName().toString().endsWith(".json")) {
                    continue;
                }

                final AssetEvent event = toEvent(kind, abs);
                if (event != null) {
                    log.debug("Snapshot change: {} {}", event.type(), abs);
                    publish(event);
                    published++;
                }
            }

            if (!key.reset()) {
                registered.remove(watchedDir);
            }
        }
        return published;
    }

    private AssetEvent toEvent(WatchEvent.Kind<?> kind, Path file) {
        if (kind == ENTRY_DELETE) {
            final AssetHandle gone = known.remove(file);
            return gone == null ? null : new AssetEvent(AssetEventType.ASSET_REMOVED, gone);
        }
        final AssetHandle handle = repository.handleFor(file);
        if (handle == null) {
            return null;
        }
        final boolean seen = known.put(file, handle) != null;
        final AssetEventType type = kind == ENTRY_CREATE || !seen
                ? AssetEventType.ASSET_ADDED
                : AssetEventType.ASSET_MODIFIED;
        return new AssetEvent(type, handle);
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (RuntimeException ex) {
            log.error("Snapshot watcher poll failed", ex);
        }
    }

    /** Registers start and its sub-directories; returns the snapshots found below them. */
    private List<AssetHandle> registerAll(Path start) throws IOException {
        final List<AssetHandle> found = new ArrayList<>();
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (repository.isSkippedDirectory(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                final Path norm = dir.toAbsolutePath().normalize();
                if (registered.add(norm)) {
                    norm.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                final Path norm = file.toAbsolutePath().normalize();
                if (norm.getFileName().toString().endsWith(".json")) {
                    final AssetHandle handle = repository.handleFor(norm);
                    if (handle != null) {
                        known.put(norm, handle);
                        found.add(handle);
                    }
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return found;
    }

    @Override
    public synchronized void close() throws IOException {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        watchService.close();
        registered.clear();
        known.clear();
    }
}
