package io.github.drompincen.tapbridge.runtime.registry;

import io.github.drompincen.tapbridge.protocol.api.ConnectionStatus;
import io.github.drompincen.tapbridge.protocol.api.ConnectionStatusDto;
import io.github.drompincen.tapbridge.protocol.api.MachineDto;
import io.github.drompincen.tapbridge.protocol.api.SessionInfo;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import io.github.drompincen.tapbridge.runtime.connection.MachineConnection;
import io.github.drompincen.tapbridge.runtime.connection.MachineConnectionFactory;
import io.github.drompincen.tapbridge.runtime.connection.MachineConnectionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Owns the per-machine connections and their states, and derives the aggregate status.
 * <p>
 * Every state mutation happens under one lock, so transitions for a machine are totally
 * ordered and the aggregate is always re-derived from a complete snapshot. Calls into
 * connections are made outside the lock; listeners are notified outside it too.
 */
@Service
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final MachineConnectionFactory connectionFactory;
    private final MachineDirectory machineDirectory;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ConnectionStatus> machineStates = new LinkedHashMap<>();
    private volatile Map<String, ConnectionStatus> stateSnapshot = Map.of();
    private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private volatile String error;
    private volatile Instant lastConnected;

    private final Map<String, MachineConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Disposable> eventSubscriptions = new ConcurrentHashMap<>();
    private final List<MachineEventListener> listeners = new CopyOnWriteArrayList<>();

    @Autowired
    public ConnectionRegistry(MachineConnectionFactory connectionFactory, MachineDirectory machineDirectory) {
        this(connectionFactory, machineDirectory, Clock.systemUTC());
    }

    ConnectionRegistry(MachineConnectionFactory connectionFactory, MachineDirectory machineDirectory, Clock clock) {
        this.connectionFactory = connectionFactory;
        this.machineDirectory = machineDirectory;
        this.clock = clock;
    }

    public void addListener(MachineEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(MachineEventListener listener) {
        listeners.remove(listener);
    }

    // ---- per-machine state ----

    public void setMachineStatus(String machineId, ConnectionStatus state) {
        lock.lock();
        try {
            if (state == ConnectionStatus.DISCONNECTED) {
                machineStates.remove(machineId);
            } else {
                machineStates.put(machineId, state);
            }
            stateSnapshot = Map.copyOf(machineStates);
            applyStatus(AggregateStatusReducer.derive(machineStates.values()));
        } finally {
            lock.unlock();
        }
        log.debug("Machine {} is {}; aggregate {}", machineId, state, status);
        for (MachineEventListener listener : listeners) {
            try {
                listener.onMachineStatus(machineId, state);
            } catch (Exception e) {
                log.error("Listener error for status {} of machine {}", state, machineId, e);
            }
        }
    }

    /**
     * Explicit override of the aggregate status; the way callers leave {@code ERROR}.
     */
    public void setStatus(ConnectionStatus next) {
        lock.lock();
        try {
            applyStatus(next);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the aggregate to {@code ERROR} whatever the machines report.
     * <p>
     * Passing null or an empty message clears the stored message but
     * leaves the status at {@code ERROR}; only {@link #setStatus} or the next machine
     * transition moves it.
     */
    public void setError(String message) {
        lock.lock();
        try {
            error = message == null || message.isEmpty() ? null : message;
            status = ConnectionStatus.ERROR;
        } finally {
            lock.unlock();
        }
        if (message != null && !message.isEmpty()) {
            log.warn("Bridge error: {}", message);
        }
    }

    private void applyStatus(ConnectionStatus next) {
        status = next;
        if (next == ConnectionStatus.CONNECTED) {
            lastConnected = clock.instant();
            error = null;
        }
    }

    public ConnectionStatus status() {
        return status;
    }

    public String error() {
        return error;
    }

    public Instant lastConnected() {
        return lastConnected;
    }

    public ConnectionStatus machineStatus(String machineId) {
        return stateSnapshot.getOrDefault(machineId, ConnectionStatus.DISCONNECTED);
    }

    public Map<String, ConnectionStatus> machineStatuses() {
        return stateSnapshot;
    }

    public ConnectionStatusDto snapshot() {
        lock.lock();
        try {
            return new ConnectionStatusDto(status, stateSnapshot, error, lastConnected);
        } finally {
            lock.unlock();
        }
    }

    public Optional<MachineConnection> connection(String machineId) {
        return Optional.ofNullable(connections.get(machineId));
    }

    // ---- connection lifecycle ----

    /**
     * Connects every online machine that has a tunnel, and drops connections to machines that
     * no longer qualify. Machines failing the filter are skipped without error.
     */
    public void connectAll() {
        List<MachineDto> connectable = machineDirectory.list().stream()
                .filter(MachineDto::isConnectable)
                .collect(Collectors.toList());
        Set<String> ids = connectable.stream().map(MachineDto::id).collect(Collectors.toSet());

        for (String machineId : List.copyOf(connections.keySet())) {
            if (!ids.contains(machineId)) {
                log.info("Machine {} is no longer reachable, disconnecting", machineId);
                disconnectMachine(machineId);
            }
        }
        for (MachineDto machine : connectable) {
            connectMachine(machine);
        }
    }

    public void connectMachine(MachineDto machine) {
        MachineConnection existing = connections.get(machine.id());
        if (existing != null) {
            if (existing.status() == ConnectionStatus.CONNECTED) {
                return;
            }
            dropConnection(machine.id());
        }

        ConnectionCallbacks callbacks = new ConnectionCallbacks(machine.id());
        MachineConnection connection = connectionFactory.create(machine, callbacks);
        callbacks.connection = connection;
        connections.put(machine.id(), connection);
        eventSubscriptions.put(machine.id(), connection.events().subscribe(
                this::dispatchEvent,
                e -> log.warn("Event stream of machine {} failed: {}", machine.id(), e.getMessage())));
        connection.connect();
    }

    public void disconnectMachine(String machineId) {
        dropConnection(machineId);
        setMachineStatus(machineId, ConnectionStatus.DISCONNECTED);
    }

    /**
     * Destroys everything held for a machine the user unlinked.
     */
    public void unlink(String machineId) {
        disconnectMachine(machineId);
        log.info("Machine {} unlinked", machineId);
    }

    public void disconnectAll() {
        for (String machineId : List.copyOf(connections.keySet())) {
            disconnectMachine(machineId);
        }
        lock.lock();
        try {
            machineStates.clear();
            stateSnapshot = Map.of();
            applyStatus(ConnectionStatus.DISCONNECTED);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every connection and reconnects, so machines resend fresh session listings.
     */
    public void refreshAll() {
        disconnectAll();
        connectAll();
    }

    private void dropConnection(String machineId) {
        MachineConnection connection = connections.remove(machineId);
        Disposable subscription = eventSubscriptions.remove(machineId);
        if (subscription != null) {
            subscription.dispose();
        }
        if (connection != null) {
            connection.disconnect();
        }
    }

    private void dispatchEvent(BridgeEvent event) {
        for (MachineEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("Listener error for {} event in session {}", event.kind(), event.sessionId(), e);
            }
        }
    }

    /**
     * Routes one connection's callbacks; callbacks from a replaced connection are ignored.
     */
    private class ConnectionCallbacks implements MachineConnectionListener {

        private final String machineId;
        private volatile MachineConnection connection;

        ConnectionCallbacks(String machineId) {
            this.machineId = machineId;
        }

        private boolean isCurrent() {
            return connection != null && connections.get(machineId) == connection;
        }

        @Override
        public void onStatusChange(String machineId, ConnectionStatus status) {
            if (isCurrent()) {
                setMachineStatus(machineId, status);
            }
        }

        @Override
        public void onSessionsListed(String machineId, List<SessionInfo> sessions) {
            if (!isCurrent()) {
                return;
            }
            for (MachineEventListener listener : listeners) {
                try {
                    listener.onSessionsListed(machineId, sessions);
                } catch (Exception e) {
                    log.error("Listener error for session listing of machine {}", machineId, e);
                }
            }
        }

        @Override
        public void onHistoryComplete(String machineId, String sessionId) {
            if (!isCurrent()) {
                return;
            }
            for (MachineEventListener listener : listeners) {
                try {
                    listener.onHistoryComplete(machineId, sessionId);
                } catch (Exception e) {
                    log.error("Listener error for history of session {}", sessionId, e);
                }
            }
        }

        @Override
        public void onError(String machineId, String message) {
            if (isCurrent()) {
                setError(message);
            }
        }
    }
}
