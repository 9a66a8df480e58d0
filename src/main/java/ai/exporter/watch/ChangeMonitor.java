package ai.exporter.watch;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.exporter.model.ScriptAsset;
import ai.exporter.repo.AssetRepository;
import ai.exporter.repo.AssetResolutionException;

/**
 * Relays added / modified Blueprint assets to one listener.
 * <p>
 * States: IDLE (no subscription) and MONITORING (subscribed, one listener).
 * Starting again replaces the listener and the subscriptions; stopping while idle does nothing.
 * Removal events are received but not relayed.
 */
public final class ChangeMonitor {

    private static final Logger log = LoggerFactory.getLogger(ChangeMonitor.class);

    public enum State {
        IDLE,
        MONITORING
    }

    private final ChangeNotificationSource source;
    private final AssetRepository repository;
    private final String monitoredKind;

    private State state = State.IDLE;
    private BlueprintChangedListener listener;

    public ChangeMonitor(ChangeNotificationSource source, AssetRepository repository) {
        this(source, repository, ScriptAsset.KIND);
    }

    public ChangeMonitor(ChangeNotificationSource source, AssetRepository repository, String monitoredKind) {
        this.source = Objects.requireNonNull(source, "source");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.monitoredKind = Objects.requireNonNull(monitoredKind, "monitoredKind");
    }

    public synchronized void start(BlueprintChangedListener onChanged) {
        Objects.requireNonNull(onChanged, "onChanged");
        if (state == State.MONITORING) {
            source.unsubscribeAll(this);
        }
        listener = onChanged;
        source.subscribe(AssetEventType.ASSET_ADDED, this, this::onAssetAdded);
        source.subscribe(AssetEventType.ASSET_REMOVED, this, this::onAssetRemoved);
        source.subscribe(AssetEventType.ASSET_MODIFIED, this, this::onAssetModified);
        state = State.MONITORING;
        log.info("Blueprint change monitoring started");
    }

    public synchronized void stop() {
        if (state == State.IDLE) {
            return;
        }
        source.unsubscribeAll(this);
        listener = null;
        state = State.IDLE;
        log.info("Blueprint change monitoring stopped");
    }

    public synchronized State state() {
        return state;
    }

    void onAssetAdded(AssetEvent event) {
        relay(event);
    }

    void onAssetRemoved(AssetEvent event) {
        // removal is not relayed
    }

    void onAssetModified(AssetEvent event) {
        relay(event);
    }

    private void relay(AssetEvent event) {
        final BlueprintChangedListener current;
        synchronized (this) {
            if (state != State.MONITORING || listener == null) {
                return;
            }
            current = listener;
        }
        if (!monitoredKind.equals(event.assetKind())) {
            return;
        }

        final ScriptAsset asset;
        try {
            asset = repository.resolve(event.handle());
        } catch (AssetResolutionException ex) {
            log.warn("Ignoring {} of {}: {}", event.type(), event.handle().path(), ex.getMessage());
            return;
        }
        current.onBlueprintChanged(asset);
    }
}
