package io.github.drompincen.tapbridge.runtime.registry;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.drompincen.tapbridge.protocol.api.ConnectionStatus;
import io.github.drompincen.tapbridge.protocol.api.MachineDto;
import io.github.drompincen.tapbridge.protocol.event.BridgeEvent;
import io.github.drompincen.tapbridge.protocol.event.EventKind;
import io.github.drompincen.tapbridge.runtime.connection.MachineConnectionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConnectionRegistryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock
    private MachineDirectory machineDirectory;

    private final Map<String, FakeMachineConnection> created = new HashMap<>();
    private final List<FakeMachineConnection> history = new ArrayList<>();
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        MachineConnectionFactory factory = (machine, listener) -> {
            FakeMachineConnection connection = new FakeMachineConnection(machine.id(), listener);
            created.put(machine.id(), connection);
            history.add(connection);
            return connection;
        };
        registry = new ConnectionRegistry(factory, machineDirectory, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void aggregateFollowsMachinesAndDropsDisconnectedEntries() {
        registry.setMachineStatus("m1", ConnectionStatus.CONNECTED);
        registry.setMachineStatus("m2", ConnectionStatus.ERROR);
        assertThat(registry.status()).isEqualTo(ConnectionStatus.CONNECTED);

        registry.setMachineStatus("m1", ConnectionStatus.DISCONNECTED);

        assertThat(registry.status()).isEqualTo(ConnectionStatus.ERROR);
        assertThat(registry.machineStatuses()).containsOnlyKeys("m2");
        assertThat(registry.machineStatus("m1")).isEqualTo(ConnectionStatus.DISCONNECTED);
    }

    @Test
    void twoMachinesWalkThroughConnectingConnectedAndBackToError() {
        registry.setError("relay lost");
        registry.setMachineStatus("m1", ConnectionStatus.CONNECTING);
        registry.setMachineStatus("m2", ConnectionStatus.ERROR);

        assertThat(registry.status()).isEqualTo(ConnectionStatus.CONNECTING);
        assertThat(registry.lastConnected()).isNull();
        assertThat(registry.error()).isEqualTo("relay lost");

        registry.setMachineStatus("m1", ConnectionStatus.CONNECTED);

        assertThat(registry.status()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(registry.lastConnected()).isEqualTo(NOW);
        assertThat(registry.error()).isNull();

        registry.setMachineStatus("m1", ConnectionStatus.DISCONNECTED);

        assertThat(registry.status()).isEqualTo(ConnectionStatus.ERROR);
        assertThat(registry.machineStatuses()).containsOnly(Map.entry("m2", ConnectionStatus.ERROR));
        assertThat(registry.lastConnected()).isEqualTo(NOW);
        assertThat(registry.snapshot().status()).isEqualTo(ConnectionStatus.ERROR);
    }

    @Test
    void connectedStampsLastConnectedAndClearsError() {
        registry.setError("boom");
        registry.setMachineStatus("m1", ConnectionStatus.CONNECTED);

        assertThat(registry.status()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(registry.lastConnected()).isEqualTo(NOW);
        assertThat(registry.error()).isNull();
    }

    @Test
    void connectingLeavesLastConnectedUntouched() {
        registry.setMachineStatus("m1", ConnectionStatus.CONNECTING);

        assertThat(registry.status()).isEqualTo(ConnectionStatus.CONNECTING);
        assertThat(registry.lastConnected()).isNull();
    }

    @Test
    void setErrorOverridesConnectedMachines() {
        registry.setMachineStatus("m1", ConnectionStatus.CONNECTED);

        registry.setError("token expired");

        assertThat(registry.status()).isEqualTo(ConnectionStatus.ERROR);
        assertThat(registry.error()).isEqualTo("token expired");
        assertThat(registry.machineStatus("m1")).isEqualTo(ConnectionStatus.CONNECTED);
    }

    @Test
    void setErrorWithNullClearsMessageButKeepsErrorStatus() {
        registry.setError("token expired");

        registry.setError(null);

        assertThat(registry.error()).isNull();
        assertThat(registry.status()).isEqualTo(ConnectionStatus.ERROR);

        registry.setError("");
        assertThat(registry.status()).isEqualTo(ConnectionStatus.ERROR);
    }

    @Test
    void setStatusLeavesError() {
        registry.setError("token expired");

        registry.setStatus(ConnectionStatus.CONNECTED);

        assertThat(registry.status()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(registry.error()).isNull();
        assertThat(registry.lastConnected()).isEqualTo(NOW);
    }

    @Test
    void connectAllSkipsMachinesWithoutTunnelOrOffline() {
        when(machineDirectory.list()).thenReturn(List.of(
                new MachineDto("m1", "laptop", true, "https://m1.example.com"),
                new MachineDto("m2", "desktop", false, "https://m2.example.com"),
                new MachineDto("m3", "server", true, null)));

        registry.connectAll();

        assertThat(created).containsOnlyKeys("m1");
        assertThat(created.get("m1").connectCalls).isEqualTo(1);
        assertThat(registry.machineStatus("m1")).isEqualTo(ConnectionStatus.CONNECTING);
        assertThat(registry.status()).isEqualTo(ConnectionStatus.CONNECTING);
    }

    @Test
    void connectAllKeepsConnectedMachinesAndDropsIneligibleOnes() {
        MachineDto m1 = new MachineDto("m1", "laptop", true, "https://m1.example.com");
        MachineDto m2 = new MachineDto("m2", "desktop", true, "https://m2.example.com");
        when(machineDirectory.list()).thenReturn(List.of(m1, m2), List.of(m1));

        registry.connectAll();
        created.get("m1").moveTo(ConnectionStatus.CONNECTED);
        FakeMachineConnection m2Connection = created.get("m2");
        registry.connectAll();

        assertThat(history).hasSize(2);
        assertThat(m2Connection.disconnectCalls).isEqualTo(1);
        assertThat(registry.connection("m2")).isEmpty();
        assertThat(registry.machineStatuses()).containsOnlyKeys("m1");
    }

    @Test
    void callbacksFromReplacedConnectionAreIgnored() {
        MachineDto m1 = new MachineDto("m1", "laptop", true, "https://m1.example.com");
        registry.connectMachine(m1);
        FakeMachineConnection first = created.get("m1");
        first.moveTo(ConnectionStatus.ERROR);

        registry.connectMachine(m1);
        first.moveTo(ConnectionStatus.CONNECTED);

        assertThat(registry.machineStatus("m1")).isEqualTo(ConnectionStatus.CONNECTING);
        assertThat(first.disconnectCalls).isEqualTo(1);
    }

    @Test
    void forwardsConnectionEventsToListeners() {
        List<BridgeEvent> received = new ArrayList<>();
        registry.addListener(received::add);
        registry.connectMachine(new MachineDto("m1", "laptop", true, "https://m1.example.com"));

        BridgeEvent event = new BridgeEvent("m1", "s1", EventKind.MESSAGE_DELTA, 1,
                JsonNodeFactory.instance.objectNode(), NOW);
        created.get("m1").sink.tryEmitNext(event);

        assertThat(received).containsExactly(event);
    }

    @Test
    void notifiesListenersOfMachineStatus() {
        List<ConnectionStatus> seen = new ArrayList<>();
        registry.addListener(new MachineEventListener() {
            @Override
            public void onEvent(BridgeEvent event) {
            }

            @Override
            public void onMachineStatus(String machineId, ConnectionStatus status) {
                seen.add(status);
            }
        });

        registry.setMachineStatus("m1", ConnectionStatus.CONNECTING);
        registry.setMachineStatus("m1", ConnectionStatus.CONNECTED);

        assertThat(seen).containsExactly(ConnectionStatus.CONNECTING, ConnectionStatus.CONNECTED);
    }

    @Test
    void disconnectAllClearsEverything() {
        registry.connectMachine(new MachineDto("m1", "laptop", true, "https://m1.example.com"));
        created.get("m1").moveTo(ConnectionStatus.CONNECTED);

        registry.disconnectAll();

        assertThat(registry.status()).isEqualTo(ConnectionStatus.DISCONNECTED);
        assertThat(registry.machineStatuses()).isEmpty();
        assertThat(registry.connection("m1")).isEmpty();
    }

    @Test
    void unlinkRemovesMachineState() {
        registry.connectMachine(new MachineDto("m1", "laptop", true, "https://m1.example.com"));

        registry.unlink("m1");

        assertThat(registry.connection("m1")).isEmpty();
        assertThat(registry.machineStatuses()).doesNotContainKey("m1");
    }
}
