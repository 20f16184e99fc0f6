package io.ration.queue;

import io.ration.core.QueueItem;

import java.util.ArrayList;
import java.util.List;

/**
 * List kept in descending priority order. An item is inserted after every item of equal or higher priority, so
 * equal priorities leave in arrival order. Not thread-safe; {@link QueueManager} guards it.
 */
final class RequestQueue {
    private final WaitClass waitClass;
    private final List<QueueItem> items = new ArrayList<>();

    RequestQueue(WaitClass waitClass) {
        this.waitClass = waitClass;
    }

    WaitClass waitClass() { return waitClass; }

    /** Returns the zero-based position the item landed at. */
    int insert(QueueItem item) {
        for (int i = 0; i < items.size(); i++) {
            if (item.priority() > items.get(i).priority()) {
                items.add(i, item);
                return i;
            }
        }
        items.add(item);
        return items.size() - 1;
    }

    QueueItem peek() { return items.isEmpty() ? null : items.get(0); }

    QueueItem poll() { return items.isEmpty() ? null : items.remove(0); }

    boolean remove(String requestId) {
        int i = position(requestId);
        if (i < 0) return false;
        items.remove(i);
        return true;
    }

    int position(String requestId) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).requestId().equals(requestId)) return i;
        }
        return -1;
    }

    QueueItem get(int position) { return items.get(position); }

    int size() { return items.size(); }

    int countAtOrAbove(int priority) {
        int n = 0;
        for (QueueItem item : items) {
            if (item.priority() < priority) break;
            n++;
        }
        return n;
    }

    /** Items that first entered the system more than {@code thresholdMillis} ago; requeues do not reset the clock. */
    List<QueueItem> starved(long now, long thresholdMillis) {
        List<QueueItem> out = new ArrayList<>();
        for (QueueItem item : items) {
            if (now - item.firstEnqueuedAt() > thresholdMillis) out.add(item);
        }
        return out;
    }

    List<QueueItem> snapshot() { return List.copyOf(items); }

    void replaceAll(List<QueueItem> restored) {
        items.clear();
        for (QueueItem item : restored) insert(item);
    }
}
