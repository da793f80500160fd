package wattsched.scheduler.protocol;

import java.util.List;

/**
 * One message from the backend: the current simulated time and its events, in order.
 */
public record EventBatch(double timestamp, List<SchedulerEvent> events) {

    public EventBatch {
        events = List.copyOf(events);
    }

    public boolean contains(EventType type) {
        return events.stream().anyMatch(e -> e.type() == type);
    }
}
