package com.simbridge.bridge.hub;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ConnectionRegistryTest {

  @Test
  void registerAndRemoveTrackConnections() {
    ConnectionRegistry registry = new ConnectionRegistry();
    RecordingConnection first = new RecordingConnection("a");
    RecordingConnection second = new RecordingConnection("b");

    assertThat(registry.register(first)).isTrue();
    assertThat(registry.register(second)).isTrue();
    assertThat(registry.size()).isEqualTo(2);

    assertThat(registry.remove(first)).isTrue();
    assertThat(registry.remove(first)).isFalse();
    assertThat(registry.connections()).containsExactly(second);
  }

  @Test
  void connectionsReturnsIndependentCopy() {
    ConnectionRegistry registry = new ConnectionRegistry();
    RecordingConnection connection = new RecordingConnection("a");
    registry.register(connection);

    List<ClientConnection> copy = registry.connections();
    registry.remove(connection);

    assertThat(copy).containsExactly(connection);
    assertThat(registry.size()).isZero();
  }

  @Test
  void closeAllClosesEveryConnectionAndRefusesNewOnes() {
    ConnectionRegistry registry = new ConnectionRegistry();
    RecordingConnection first = new RecordingConnection("a");
    RecordingConnection second = new RecordingConnection("b");
    registry.register(first);
    registry.register(second);

    assertThat(registry.closeAll()).isEqualTo(2);

    assertThat(first.isOpen()).isFalse();
    assertThat(second.isOpen()).isFalse();
    assertThat(registry.size()).isZero();
    assertThat(registry.isClosed()).isTrue();
    assertThat(registry.register(new RecordingConnection("late"))).isFalse();
    assertThat(registry.size()).isZero();
  }

  @Test
  void closeAllRacingWithRegistrationLeavesNothingBehind() throws Exception {
    ConnectionRegistry registry = new ConnectionRegistry();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger accepted = new AtomicInteger();
    List<RecordingConnection> all = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      all.add(new RecordingConnection("c" + i));
    }

    for (RecordingConnection connection : all) {
      pool.submit(() -> {
        start.await();
        if (registry.register(connection)) {
          accepted.incrementAndGet();
        }
        return null;
      });
    }
    start.countDown();
    Thread.sleep(5);
    int closed = registry.closeAll();
    pool.shutdown();
    assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

    assertThat(registry.size()).isZero();
    assertThat(closed).isEqualTo(accepted.get());
    assertThat(all.stream().filter(c -> c.closeCalls() > 0).count()).isEqualTo(accepted.get());
  }
}
