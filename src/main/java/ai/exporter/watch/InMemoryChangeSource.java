package ai.exporter.watch;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Plain subscriber list. {@link #publish(AssetEvent)} dispatches on the caller's thread.
 */
public class InMemoryChangeSource implements ChangeNotificationSource {

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    @Override
    public void subscribe(AssetEventType type, Object owner, AssetEventHandler handler) {
        subscriptions.add(new Subscription(
                Objects.requireNonNull(type, "type"),
                Objects.requireNonNull(owner, "owner"),
                Objects.requireNonNull(handler, "handler")));
    }

    @Override
    public void unsubscribeAll(Object owner) {
        subscriptions.removeIf(s -> s.owner() == owner);
    }

    public void publish(AssetEvent event) {
        Objects.requireNonNull(event, "event");
        for (Subscription s : subscriptions) {
            if (s.type() == event.type()) {
                s.handler().onEvent(event);
            }
        }
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    private record Subscription(AssetEventType type, Object owner, AssetEventHandler handler) {
    }
}
