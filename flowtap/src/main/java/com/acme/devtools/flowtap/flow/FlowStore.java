package com.acme.devtools.flowtap.flow;

import com.acme.devtools.flowtap.util.FlowtapDefaults;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Authoritative registry of flows and the pause/resume rendezvous.
 *
 * <p>Each entry owns a lock and a resolution future. State transitions happen under the
 * entry lock so a resume and a {@link #cancelAll(String)} racing on the same flow resolve it
 * exactly once. Futures are completed outside the lock.
 *
 * <p>Retention is bounded: once more than {@code maxFlows} entries are held, the oldest
 * entry that is not paused is evicted.
 */
public final class FlowStore {
    private static final Logger LOG = Logger.getLogger(FlowStore.class.getName());

    private final ConcurrentHashMap<String, Entry> flows = new ConcurrentHashMap<>();
    private final LinkedHashSet<String> order = new LinkedHashSet<>();
    private final Object orderLock = new Object();
    private final List<FlowListener> listeners = new CopyOnWriteArrayList<>();
    private final int maxFlows;

    public FlowStore() {
        this(FlowtapDefaults.DEFAULT_MAX_FLOWS);
    }

    public FlowStore(int maxFlows) {
        if (maxFlows <= 0) {
            throw new IllegalArgumentException("maxFlows must be > 0");
        }
        this.maxFlows = maxFlows;
    }

    public void addListener(FlowListener listener) {
        listeners.add(listener);
    }

    public void removeListener(FlowListener listener) {
        listeners.remove(listener);
    }

    public String create(FlowCapture capture) {
        String proposed = capture.proposedId();
        Entry entry = null;
        if (proposed != null && !proposed.isBlank()) {
            Entry candidate = new Entry(proposed, capture);
            if (flows.putIfAbsent(proposed, candidate) == null) {
                entry = candidate;
            }
        }
        while (entry == null) {
            String id = UUID.randomUUID().toString();
            Entry candidate = new Entry(id, capture);
            if (flows.putIfAbsent(id, candidate) == null) {
                entry = candidate;
            }
        }
        List<Entry> evicted;
        synchronized (orderLock) {
            order.add(entry.id);
            evicted = evictOverflowLocked();
        }
        for (Entry e : evicted) {
            LOG.fine(() -> "Evicted flow " + e.id);
        }
        Flow snapshot = entry.snapshot();
        notifyListeners(l -> l.onFlowAdded(snapshot));
        return entry.id;
    }

    /**
     * Moves a pending flow to {@code PAUSED} and returns a future that completes with the
     * resolution once the flow is resumed or cancelled.
     */
    public CompletableFuture<ModifiedResponse> pause(String flowId) {
        Entry entry = require(flowId);
        Flow snapshot;
        synchronized (entry) {
            if (!entry.state.canTransitionTo(FlowState.PAUSED)) {
                throw new FlowStoreException(FlowError.INVALID_STATE, flowId,
                    "Cannot pause flow in state " + entry.state);
            }
            entry.state = FlowState.PAUSED;
            snapshot = entry.snapshotLocked();
        }
        notifyListeners(l -> l.onFlowUpdated(snapshot));
        return entry.resolution.copy();
    }

    public ResumeResult resume(String flowId, ModifiedResponse modifiedResponse) {
        Entry entry = flowId == null ? null : flows.get(flowId);
        if (entry == null) {
            return ResumeResult.UNKNOWN_FLOW;
        }
        ModifiedResponse applied = modifiedResponse == null ? ModifiedResponse.PASS_THROUGH : modifiedResponse;
        Flow snapshot;
        synchronized (entry) {
            switch (entry.state) {
                case PENDING:
                    return ResumeResult.NOT_PAUSED;
                case RESUMED:
                case COMPLETED:
                    return ResumeResult.ALREADY_RESUMED;
                default:
                    break;
            }
            entry.state = FlowState.RESUMED;
            entry.appliedResolution = applied;
            entry.modified = !applied.isPassThrough();
            snapshot = entry.snapshotLocked();
        }
        entry.resolution.complete(applied);
        notifyListeners(l -> l.onFlowUpdated(snapshot));
        return ResumeResult.RESUMED;
    }

    public boolean complete(String flowId) {
        return complete(flowId, null);
    }

    /**
     * Marks a flow {@code COMPLETED}. A flow completed straight from {@code PENDING} records
     * {@code resolution} (pass-through when {@code null}) as its outcome.
     */
    public boolean complete(String flowId, ModifiedResponse resolution) {
        Entry entry = flowId == null ? null : flows.get(flowId);
        if (entry == null) {
            return false;
        }
        Flow snapshot;
        ModifiedResponse toComplete = null;
        synchronized (entry) {
            if (!entry.state.canTransitionTo(FlowState.COMPLETED)) {
                return false;
            }
            if (entry.state == FlowState.PENDING) {
                toComplete = resolution == null ? ModifiedResponse.PASS_THROUGH : resolution;
                entry.appliedResolution = toComplete;
                entry.modified = !toComplete.isPassThrough();
            }
            entry.state = FlowState.COMPLETED;
            snapshot = entry.snapshotLocked();
        }
        if (toComplete != null) {
            entry.resolution.complete(toComplete);
        }
        notifyListeners(l -> l.onFlowUpdated(snapshot));
        return true;
    }

    /** Records the mock rule that answered or seeded a flow. Ignored once the flow completed. */
    public boolean tag(String flowId, String ruleId, String ruleName) {
        Entry entry = require(flowId);
        Flow snapshot;
        synchronized (entry) {
            if (entry.state == FlowState.COMPLETED) {
                return false;
            }
            entry.mockRuleId = ruleId;
            entry.mockRuleName = ruleName;
            snapshot = entry.snapshotLocked();
        }
        notifyListeners(l -> l.onFlowUpdated(snapshot));
        return true;
    }

    /** Replaces the displayed response, used when a mock stands in for the upstream answer. */
    public boolean replaceResponse(String flowId, ResponseSnapshot response) {
        Entry entry = require(flowId);
        Flow snapshot;
        synchronized (entry) {
            if (entry.state == FlowState.COMPLETED) {
                return false;
            }
            entry.response = response;
            snapshot = entry.snapshotLocked();
        }
        notifyListeners(l -> l.onFlowUpdated(snapshot));
        return true;
    }

    /**
     * Resolves every paused flow with {@link ModifiedResponse#PASS_THROUGH}.
     *
     * @return number of flows released
     */
    public int cancelAll(String reason) {
        int released = 0;
        for (Entry entry : flows.values()) {
            try {
                Flow snapshot;
                synchronized (entry) {
                    if (entry.state != FlowState.PAUSED) {
                        continue;
                    }
                    entry.state = FlowState.RESUMED;
                    entry.appliedResolution = ModifiedResponse.PASS_THROUGH;
                    entry.modified = false;
                    snapshot = entry.snapshotLocked();
                }
                entry.resolution.complete(ModifiedResponse.PASS_THROUGH);
                released++;
                notifyListeners(l -> l.onFlowUpdated(snapshot));
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Failed to release flow " + entry.id, e);
            }
        }
        if (released > 0) {
            int count = released;
            LOG.info(() -> "Released " + count + " paused flow(s): " + reason);
        }
        return released;
    }

    public Optional<Flow> get(String flowId) {
        Entry entry = flowId == null ? null : flows.get(flowId);
        return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
    }

    /**
     * The resolution future of a known flow. Completing the returned copy has no effect on
     * the flow.
     */
    public Optional<CompletableFuture<ModifiedResponse>> resolution(String flowId) {
        Entry entry = flowId == null ? null : flows.get(flowId);
        return entry == null ? Optional.empty() : Optional.of(entry.resolution.copy());
    }

    /** Flows in capture order. */
    public List<Flow> list() {
        List<String> ids;
        synchronized (orderLock) {
            ids = new ArrayList<>(order);
        }
        List<Flow> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            Entry entry = flows.get(id);
            if (entry != null) {
                out.add(entry.snapshot());
            }
        }
        return out;
    }

    public List<String> pausedIds() {
        List<String> out = new ArrayList<>();
        for (Flow flow : list()) {
            if (flow.paused()) {
                out.add(flow.id());
            }
        }
        return out;
    }

    public int size() {
        return flows.size();
    }

    /**
     * Drops every flow that is not paused. Paused flows stay so their waiters can still be
     * resumed.
     */
    public int clear() {
        int removed = 0;
        synchronized (orderLock) {
            Iterator<String> it = order.iterator();
            while (it.hasNext()) {
                String id = it.next();
                Entry entry = flows.get(id);
                if (entry == null) {
                    it.remove();
                    continue;
                }
                synchronized (entry) {
                    if (entry.state == FlowState.PAUSED) {
                        continue;
                    }
                }
                flows.remove(id, entry);
                it.remove();
                removed++;
            }
        }
        notifyListeners(FlowListener::onFlowsCleared);
        return removed;
    }

    private List<Entry> evictOverflowLocked() {
        List<Entry> evicted = new ArrayList<>();
        if (order.size() <= maxFlows) {
            return evicted;
        }
        Iterator<String> it = order.iterator();
        while (order.size() > maxFlows && it.hasNext()) {
            String id = it.next();
            Entry entry = flows.get(id);
            if (entry == null) {
                it.remove();
                continue;
            }
            synchronized (entry) {
                if (entry.state == FlowState.PAUSED) {
                    continue;
                }
            }
            flows.remove(id, entry);
            it.remove();
            evicted.add(entry);
        }
        return evicted;
    }

    private Entry require(String flowId) {
        Entry entry = flowId == null ? null : flows.get(flowId);
        if (entry == null) {
            throw new FlowStoreException(FlowError.UNKNOWN_FLOW, flowId, "Unknown flow");
        }
        return entry;
    }

    private void notifyListeners(Consumer<FlowListener> event) {
        for (FlowListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Flow listener failed: " + listener, e);
            }
        }
    }

    private static final class Entry {
        private final String id;
        private final RequestSnapshot request;
        private final long capturedAtMillis;
        private final long durationMillis;
        private final CompletableFuture<ModifiedResponse> resolution = new CompletableFuture<>();

        private ResponseSnapshot response;
        private FlowState state = FlowState.PENDING;
        private String mockRuleId;
        private String mockRuleName;
        private boolean modified;
        private ModifiedResponse appliedResolution;

        private Entry(String id, FlowCapture capture) {
            this.id = id;
            this.request = capture.request();
            this.response = capture.response();
            this.capturedAtMillis = capture.capturedAtMillis();
            this.durationMillis = capture.durationMillis();
        }

        private synchronized Flow snapshot() {
            return snapshotLocked();
        }

        private Flow snapshotLocked() {
            return new Flow(id, request, response, capturedAtMillis, durationMillis, state,
                mockRuleId, mockRuleName, modified, appliedResolution);
        }
    }
}
