package com.obsidiandynamics.bedlam.worker;

import com.obsidiandynamics.bedlam.*;
import com.obsidiandynamics.bedlam.event.*;
import com.obsidiandynamics.bedlam.pool.*;
import org.junit.jupiter.api.*;

import static com.obsidiandynamics.bedlam.RecordingEventLog.*;
import static org.assertj.core.api.Assertions.*;

final class DischargeWorkerTest {
  @Test
  void testDischargesUntilEmpty() throws InterruptedException {
    final var bedPool = new BedPool(3);
    bedPool.tryAdmit();
    bedPool.tryAdmit();
    final var eventLog = new RecordingEventLog();
    final var worker = new DischargeWorker(bedPool, eventLog, 5);
    worker.start();
    try {
      assertThat(awaitCondition(() -> bedPool.snapshot().getOccupied() == 0, 5_000)).isTrue();
      Thread.sleep(20);
      assertThat(eventLog.count(EventType.DISCHARGED)).isEqualTo(2);
      assertThat(eventLog.patientsFor(EventType.DISCHARGED)).containsOnlyNulls();
      assertThat(eventLog.occupancies()).containsExactly(1, 0);
    } finally {
      worker.signalShutdown();
      assertThat(worker.join(5_000)).isTrue();
    }
  }

  @Test
  void testShutdownCutsIntervalShort() throws InterruptedException {
    final var worker = new DischargeWorker(new BedPool(1), EventLog.NOP, 60_000);
    worker.start();
    Thread.sleep(10);
    final var started = System.currentTimeMillis();
    worker.signalShutdown();
    assertThat(worker.join(5_000)).isTrue();
    assertThat(System.currentTimeMillis() - started).isLessThan(5_000);
  }
}
