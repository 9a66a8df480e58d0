package ai.exporter.watch;

/**
 * Publishes asset added / removed / modified events. Handlers are invoked synchronously
 * on the publishing thread, in the order the source produces events.
 */
public interface ChangeNotificationSource {

    void subscribe(AssetEventType type, Object owner, AssetEventHandler handler);

    /** Removes every subscription registered by owner, for all event types. */
    void unsubscribeAll(Object owner);
}
