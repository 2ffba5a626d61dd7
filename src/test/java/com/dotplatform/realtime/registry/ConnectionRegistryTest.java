package com.dotplatform.realtime.registry;

import com.dotplatform.common.security.UserRole;
import com.dotplatform.realtime.FakeConnection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionRegistryTest {

    private final ConnectionRegistry registry = new ConnectionRegistry();

    @Test
    @DisplayName("A user may hold several connections; removing one keeps the others")
    void multipleConnectionsPerUser() {
        // Given
        FakeConnection phone = new FakeConnection("a", 1L, UserRole.CUSTOMER);
        FakeConnection browser = new FakeConnection("b", 1L, UserRole.CUSTOMER);
        registry.register(phone);
        registry.register(browser);

        // When
        boolean removed = registry.unregister(phone);

        // Then
        assertThat(removed).isTrue();
        assertThat(registry.connectionsOf(1L)).containsExactly(browser);
    }

    @Test
    @DisplayName("Removing the last connection drops the user entry; removing twice is a no-op")
    void unregisterLast() {
        FakeConnection connection = new FakeConnection("a", 2L, UserRole.DRIVER);
        registry.register(connection);

        assertThat(registry.unregister(connection)).isTrue();
        assertThat(registry.unregister(connection)).isFalse();
        assertThat(registry.connectionsOf(2L)).isEmpty();
        assertThat(registry.connectionsWithRole(UserRole.DRIVER)).isEmpty();
    }

    @Test
    @DisplayName("Role index contains only connections of that role")
    void roleIndex() {
        FakeConnection driver = new FakeConnection("d", 2L, UserRole.DRIVER);
        FakeConnection admin = new FakeConnection("x", 3L, UserRole.ADMIN);
        registry.register(driver);
        registry.register(admin);

        assertThat(registry.connectionsWithRole(UserRole.DRIVER)).containsExactly(driver);
        assertThat(registry.connectionsWithRole(UserRole.ADMIN)).containsExactly(admin);
        assertThat(registry.connectionsWithRole(UserRole.CUSTOMER)).isEmpty();
        assertThat(registry.allConnections()).containsExactlyInAnyOrder(driver, admin);
    }

    @Test
    @DisplayName("Snapshots are not affected by later registrations")
    void snapshot() {
        registry.register(new FakeConnection("a", 1L, UserRole.CUSTOMER));
        List<RealtimeConnection> snapshot = registry.connectionsOf(1L);

        registry.register(new FakeConnection("b", 1L, UserRole.CUSTOMER));

        assertThat(snapshot).hasSize(1);
        assertThat(registry.connectionsOf(1L)).hasSize(2);
    }

    @Test
    @DisplayName("Concurrent register and unregister of one user leave a consistent index")
    void concurrentRegistration() throws InterruptedException {
        // Given
        int threads = 8;
        int perThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<FakeConnection> kept = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            kept.add(new FakeConnection("kept-" + t, 1L, UserRole.DRIVER));
        }

        // When
        for (int t = 0; t < threads; t++) {
            FakeConnection keep = kept.get(t);
            int thread = t;
            executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    FakeConnection temp = new FakeConnection("tmp-" + thread + "-" + i, 1L, UserRole.DRIVER);
                    registry.register(temp);
                    registry.unregister(temp);
                }
                registry.register(keep);
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // Then
        assertThat(registry.connectionsOf(1L)).containsExactlyInAnyOrderElementsOf(kept);
        assertThat(registry.connectionsWithRole(UserRole.DRIVER)).containsExactlyInAnyOrderElementsOf(kept);
    }
}
