package io.hearthwarrio.pagelens.core.page;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Append-only, bounded log of network events for one page.
 * <p>
 * When the capacity is reached the oldest event is dropped. Only document, xhr and fetch traffic is kept.
 */
public final class NetworkLog {

    public static final int MIN_CAPACITY = 100;
    public static final int DEFAULT_CAPACITY = 600;

    private static final Set<String> TRACKED_TYPES = Set.of("document", "xhr", "fetch", "navigation");

    private final int capacity;
    private final Deque<NetworkEvent> events = new ArrayDeque<>();
    private long totalRecorded;

    public NetworkLog() {
        this(DEFAULT_CAPACITY);
    }

    public NetworkLog(int capacity) {
        this.capacity = Math.max(MIN_CAPACITY, capacity);
    }

    /**
     * Appends an event when its resource type is tracked.
     *
     * @return true when the event was recorded
     */
    public synchronized boolean append(NetworkEvent event) {
        if (event == null || !TRACKED_TYPES.contains(event.getResourceType())) {
            return false;
        }
        if (events.size() == capacity) {
            events.removeFirst();
        }
        events.addLast(event);
        totalRecorded++;
        return true;
    }

    /**
     * @param limit maximum number of events, newest last
     */
    public synchronized List<NetworkEvent> recent(int limit) {
        int n = Math.max(0, Math.min(limit, events.size()));
        List<NetworkEvent> all = new ArrayList<>(events);
        return List.copyOf(all.subList(all.size() - n, all.size()));
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized long totalRecorded() {
        return totalRecorded;
    }

    public int capacity() {
        return capacity;
    }
}
