package fr.lapetina.inference.router.infrastructure.health;

import fr.lapetina.inference.router.domain.model.NodeHealth;
import fr.lapetina.inference.router.domain.model.WorkerEndpoint;
import fr.lapetina.inference.router.domain.ring.DuplicateNodeException;
import fr.lapetina.inference.router.domain.ring.EmptyRingException;
import fr.lapetina.inference.router.domain.ring.HashRing;
import fr.lapetina.inference.router.domain.ring.UnknownNodeException;
import fr.lapetina.inference.router.infrastructure.config.ConfigChangeListener;
import fr.lapetina.inference.router.infrastructure.config.RouterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of the workers known to the gateway.
 *
 * Owns the hash ring: a worker is on the ring exactly when it is registered here.
 * Membership changes are serialized; routing reads the ring without locking.
 */
public final class WorkerRegistry implements ConfigChangeListener {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final HashRing ring;
    private final Map<String, WorkerEndpoint> workers = new ConcurrentHashMap<>();
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Object membershipLock = new Object();

    public WorkerRegistry(HashRing ring) {
        this.ring = ring;
    }

    public WorkerRegistry(int virtualNodesPerPhysical) {
        this(new HashRing(virtualNodesPerPhysical));
    }

    /**
     * Registers a worker and places it on the ring.
     *
     * @throws DuplicateNodeException if a worker with the same id is registered
     */
    public WorkerEndpoint addWorker(WorkerEndpoint worker) {
        synchronized (membershipLock) {
            if (workers.containsKey(worker.getId())) {
                throw new DuplicateNodeException(worker.getId());
            }
            // Endpoint first so a lookup never lands on an id without one
            workers.put(worker.getId(), worker);
            try {
                ring.addNode(worker.getId());
            } catch (RuntimeException e) {
                workers.remove(worker.getId());
                throw e;
            }
        }
        log.info("Worker registered: workerId={}, url={}", worker.getId(), worker.getBaseUrl());
        notifyListeners(new RegistryEvent(RegistryEvent.Type.ADDED, worker));
        return worker;
    }

    public WorkerEndpoint addWorker(String id, String url) {
        return addWorker(WorkerEndpoint.builder().id(id).baseUrl(url).build());
    }

    /**
     * Takes a worker off the ring and forgets it.
     *
     * @throws UnknownNodeException if no worker has this id
     */
    public WorkerEndpoint removeWorker(String workerId) {
        WorkerEndpoint removed;
        synchronized (membershipLock) {
            if (!workers.containsKey(workerId)) {
                throw new UnknownNodeException(workerId);
            }
            ring.removeNode(workerId);
            removed = workers.remove(workerId);
        }
        log.info("Worker removed: workerId={}", workerId);
        notifyListeners(new RegistryEvent(RegistryEvent.Type.REMOVED, removed));
        return removed;
    }

    /**
     * Resolves the worker owning a routing key.
     *
     * @throws EmptyRingException if no worker is registered
     */
    public WorkerEndpoint route(String routingKey) {
        WorkerEndpoint worker = workers.get(ring.lookup(routingKey));
        if (worker == null) {
            // Removed between the ring read and the map read: the ring has moved on
            worker = workers.get(ring.lookup(routingKey));
        }
        if (worker == null) {
            throw new EmptyRingException();
        }
        return worker;
    }

    /**
     * Up to {@code count} distinct workers in ring order from the key, owner first.
     */
    public List<WorkerEndpoint> candidates(String routingKey, int count) {
        List<WorkerEndpoint> result = new ArrayList<>(count);
        for (String id : ring.successors(routingKey, count)) {
            WorkerEndpoint worker = workers.get(id);
            if (worker != null) {
                result.add(worker);
            }
        }
        if (result.isEmpty()) {
            throw new EmptyRingException();
        }
        return result;
    }

    public Optional<WorkerEndpoint> getWorker(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    /**
     * Workers in ring insertion order.
     */
    public List<WorkerEndpoint> getAllWorkers() {
        List<WorkerEndpoint> result = new ArrayList<>();
        for (String id : ring.nodes()) {
            WorkerEndpoint worker = workers.get(id);
            if (worker != null) {
                result.add(worker);
            }
        }
        return result;
    }

    public List<String> getWorkerIds() {
        return ring.nodes();
    }

    public HashRing getRing() {
        return ring;
    }

    public int size() {
        return workers.size();
    }

    /**
     * Updates the health status of a worker.
     */
    public void updateWorkerHealth(String workerId, NodeHealth health) {
        WorkerEndpoint worker = workers.get(workerId);
        if (worker != null) {
            NodeHealth previous = worker.getHealth();
            worker.setHealth(health);
            if (previous != health) {
                log.info("Worker health changed: workerId={}, {} -> {}", workerId, previous, health);
                notifyListeners(new RegistryEvent(RegistryEvent.Type.HEALTH_CHANGED, worker));
            }
        }
    }

    /**
     * Brings the ring in line with a configured worker list. Workers whose URL
     * changed are removed and added again. The diff is computed and applied under
     * the membership lock, so admin changes land either before or after it.
     */
    public void syncWorkers(List<RouterConfig.WorkerConfig> configured) {
        Map<String, URI> wanted = new LinkedHashMap<>();
        for (RouterConfig.WorkerConfig config : configured) {
            wanted.put(config.effectiveId(), URI.create(config.getUrl()));
        }

        synchronized (membershipLock) {
            for (WorkerEndpoint existing : getAllWorkers()) {
                URI url = wanted.get(existing.getId());
                if (url == null || !existing.sameTarget(existing.getId(), url)) {
                    removeWorker(existing.getId());
                }
            }
            for (Map.Entry<String, URI> entry : wanted.entrySet()) {
                if (!workers.containsKey(entry.getKey())) {
                    addWorker(WorkerEndpoint.builder().id(entry.getKey()).baseUrl(entry.getValue()).build());
                }
            }
            log.info("Worker registry synchronized: {} workers on the ring", workers.size());
        }
    }

    @Override
    public void onConfigChanged(RouterConfig oldConfig, RouterConfig newConfig) {
        if (oldConfig != null && oldConfig.getWorkers().equals(newConfig.getWorkers())) {
            return;
        }
        syncWorkers(newConfig.getWorkers());
    }

    /**
     * Adds a listener for registry events.
     */
    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Error notifying registry listener", e);
            }
        }
    }

    /**
     * Event for worker registry changes.
     */
    public record RegistryEvent(Type type, WorkerEndpoint worker) {
        public enum Type {
            ADDED,
            REMOVED,
            HEALTH_CHANGED
        }
    }
}
