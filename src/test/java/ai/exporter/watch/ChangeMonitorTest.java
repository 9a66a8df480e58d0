package ai.exporter.watch;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import ai.exporter.Fixtures;
import ai.exporter.model.ScriptAsset;
import ai.exporter.repo.AssetHandle;
import ai.exporter.repo.AssetRepository;
import ai.exporter.repo.AssetResolutionException;

@ExtendWith(MockitoExtension.class)
class ChangeMonitorTest {

    private static final AssetHandle DOOR = new AssetHandle("/Game/BP_Door", ScriptAsset.KIND, null);

    @Mock
    private AssetRepository repository;

    private InMemoryChangeSource source;
    private ChangeMonitor monitor;
    private List<ScriptAsset> received;

    @BeforeEach
    void setUp() {
        source = new InMemoryChangeSource();
        monitor = new ChangeMonitor(source, repository);
        received = new ArrayList<>();
    }

    @Test
    void startsIdle() {
        assertEquals(ChangeMonitor.State.IDLE, monitor.state());
        assertEquals(0, source.subscriptionCount());
    }

    @Test
    void modifiedBlueprintIsRelayedOnce() throws Exception {
        when(repository.resolve(DOOR)).thenReturn(Fixtures.door());
        monitor.start(received::add);

        source.publish(new AssetEvent(AssetEventType.ASSET_MODIFIED, DOOR));

        assertEquals(1, received.size());
        assertEquals("BP_Door", received.get(0).name());
    }

    @Test
    void addedBlueprintIsRelayed() throws Exception {
        when(repository.resolve(DOOR)).thenReturn(Fixtures.door());
        monitor.start(received::add);

        source.publish(new AssetEvent(AssetEventType.ASSET_ADDED, DOOR));

        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("removal is not relayed")
    void removedIsIgnored() throws Exception {
        monitor.start(received::add);

        source.publish(new AssetEvent(AssetEventType.ASSET_REMOVED, DOOR));

        assertTrue(received.isEmpty());
        verify(repository, never()).resolve(any());
    }

    @Test
    void otherAssetKindsAreIgnored() throws Exception {
        monitor.start(received::add);

        source.publish(new AssetEvent(AssetEventType.ASSET_MODIFIED,
                new AssetHandle("/Game/DT_Items", "DataTable", null)));

        assertTrue(received.isEmpty());
        verify(repository, never()).resolve(any());
    }

    @Test
    @DisplayName("starting twice keeps one subscription set and the latest listener")
    void restartReplacesListener() throws Exception {
        when(repository.resolve(DOOR)).thenReturn(Fixtures.door());
        final List<ScriptAsset> first = new ArrayList<>();
        monitor.start(first::add);
        final int subscriptions = source.subscriptionCount();

        monitor.start(received::add);
        source.publish(new AssetEvent(AssetEventType.ASSET_MODIFIED, DOOR));

        assertEquals(3, subscriptions);
        assertEquals(subscriptions, source.subscriptionCount());
        assertTrue(first.isEmpty());
        assertEquals(1, received.size());
    }

    @Test
    void stopUnsubscribes() throws Exception {
        monitor.start(received::add);

        monitor.stop();
        source.publish(new AssetEvent(AssetEventType.ASSET_MODIFIED, DOOR));

        assertEquals(ChangeMonitor.State.IDLE, monitor.state());
        assertEquals(0, source.subscriptionCount());
        assertTrue(received.isEmpty());
        verify(repository, never()).resolve(any());
    }

    @Test
    void stopWhileIdleDoesNothing() {
        monitor.stop();
        monitor.stop();

        assertEquals(ChangeMonitor.State.IDLE, monitor.state());
    }

    @Test
    void unresolvableAssetIsSkipped() throws Exception {
        when(repository.resolve(DOOR)).thenThrow(new AssetResolutionException("deleted"));
        monitor.start(received::add);

        source.publish(new AssetEvent(AssetEventType.ASSET_MODIFIED, DOOR));

        assertTrue(received.isEmpty());
        assertEquals(ChangeMonitor.State.MONITORING, monitor.state());
    }

    @Test
    void otherSubscribersAreUntouched() {
        final Object owner = new Object();
        source.subscribe(AssetEventType.ASSET_ADDED, owner, e -> { });
        monitor.start(received::add);

        monitor.stop();

        assertEquals(1, source.subscriptionCount());
    }
}
