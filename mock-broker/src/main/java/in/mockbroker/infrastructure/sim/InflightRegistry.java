package in.mockbroker.infrastructure.sim;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Idempotency and inflight bookkeeping for one gateway instance.
 *
 * - seen: every accepted client order id, kept for the life of the gateway
 * - inflight: id -> live state, only until the order reaches a terminal state
 *
 * Not thread-safe on its own; the owning gateway serializes access.
 */
final class InflightRegistry {

    private final Set<String> seen = new HashSet<>();
    private final Map<String, LiveOrderState> inflight = new HashMap<>();

    /**
     * Record an id as seen.
     *
     * @return true if the id was new, false for a duplicate
     */
    boolean markSeen(String clientOrderId) {
        return seen.add(clientOrderId);
    }

    /**
     * Drop an id from the seen-set. Only for an accept that could not be completed.
     */
    void forget(String clientOrderId) {
        seen.remove(clientOrderId);
    }

    boolean hasSeen(String clientOrderId) {
        return seen.contains(clientOrderId);
    }

    void register(LiveOrderState state) {
        inflight.put(state.clientOrderId(), state);
    }

    LiveOrderState get(String clientOrderId) {
        return inflight.get(clientOrderId);
    }

    /**
     * Whether this exact state object is still the registered live order for its id.
     */
    boolean isLive(LiveOrderState state) {
        return inflight.get(state.clientOrderId()) == state;
    }

    /**
     * Cancel every pending event of the order and forget it. Safe to call repeatedly.
     *
     * @return true if an entry was removed
     */
    boolean cleanup(String clientOrderId) {
        LiveOrderState state = inflight.remove(clientOrderId);
        if (state == null) {
            return false;
        }
        state.cancelPendingEvents();
        return true;
    }

    int inflightCount() {
        return inflight.size();
    }

    List<String> inflightIds() {
        return List.copyOf(inflight.keySet());
    }

    int seenCount() {
        return seen.size();
    }
}
