package org.harmar.kv.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.netty.channel.embedded.EmbeddedChannel;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.harmar.kv.security.ConnectionAdmission;
import org.junit.jupiter.api.Test;

class ConnectionSlotTest {
  private final InetAddress address = InetAddress.getLoopbackAddress();

  @Test
  void closeReleasesExactlyOnce() {
    ConnectionAdmission admission = new ConnectionAdmission(2, 10);
    assertTrue(admission.tryAccept(address));
    assertTrue(admission.tryAccept(address));

    ConnectionSlot slot = new ConnectionSlot(admission, address);
    slot.close();
    slot.close();

    assertEquals(ConnectionState.CLOSED, slot.getState());
    assertEquals(1, admission.activeConnections());
  }

  @Test
  void stateMovesFromAcceptedToServingToClosed() {
    ConnectionAdmission admission = new ConnectionAdmission(1, 10);
    admission.tryAccept(address);
    ConnectionSlot slot = new ConnectionSlot(admission, address);

    assertEquals(ConnectionState.ACCEPTED, slot.getState());
    assertTrue(slot.markServing());
    assertEquals(ConnectionState.SERVING, slot.getState());
    assertFalse(slot.markServing());

    slot.close();
    assertFalse(slot.markServing());
    assertEquals(ConnectionState.CLOSED, slot.getState());
  }

  @Test
  void concurrentClosesReleaseOnce() throws Exception {
    ConnectionAdmission admission = new ConnectionAdmission(8, 10);
    for (int i = 0; i < 8; i++) {
      admission.tryAccept(address);
    }
    ConnectionSlot slot = new ConnectionSlot(admission, address);

    int threads = 8;
    CyclicBarrier barrier = new CyclicBarrier(threads);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(executor.submit(() -> {
          barrier.await();
          slot.close();
          return null;
        }));
      }
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(7, admission.activeConnections());
  }

  @Test
  void closingBoundChannelReleasesSlot() {
    ConnectionAdmission admission = new ConnectionAdmission(1, 10);
    assertTrue(admission.tryAccept(address));

    EmbeddedChannel channel = new EmbeddedChannel();
    ConnectionSlot slot = ConnectionSlot.bind(channel, new ConnectionSlot(admission, address));
    assertSame(slot, ConnectionSlot.of(channel));

    channel.close();
    channel.runPendingTasks();

    assertEquals(ConnectionState.CLOSED, slot.getState());
    assertEquals(0, admission.activeConnections());
    assertTrue(admission.tryAccept(address));
  }

  @Test
  void bindingToClosedChannelReleasesImmediately() {
    ConnectionAdmission admission = new ConnectionAdmission(1, 10);
    assertTrue(admission.tryAccept(address));

    EmbeddedChannel channel = new EmbeddedChannel();
    channel.close();
    ConnectionSlot.bind(channel, new ConnectionSlot(admission, address));
    channel.runPendingTasks();

    assertEquals(0, admission.activeConnections());
  }
}
