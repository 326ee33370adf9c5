package com.obsidiandynamics.bedlam.pool;

import com.obsidiandynamics.bedlam.util.*;
import nl.jqno.equalsverifier.*;
import org.junit.jupiter.api.*;

import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

import static org.assertj.core.api.Assertions.*;

final class BedPoolTest {
  @Test
  void testInvalidCapacity() {
    assertThat(catchThrowable(() -> new BedPool(0))).isExactlyInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testAdmitUpToCapacity() {
    final var pool = new BedPool(2);
    assertThat(pool.tryAdmit()).isTrue();
    assertThat(pool.tryAdmit()).isTrue();
    assertThat(pool.tryAdmit()).isFalse();
    assertThat(pool.snapshot()).isEqualTo(new BedSnapshot(2, 2));
  }

  @Test
  void testFailedAdmitHasNoSideEffect() {
    final var pool = new BedPool(1);
    pool.tryAdmit();
    for (var i = 0; i < 3; i++) {
      assertThat(pool.tryAdmit()).isFalse();
    }
    assertThat(pool.discharge()).isTrue();
    assertThat(pool.snapshot().getOccupied()).isEqualTo(0);
  }

  @Test
  void testDischargeOnEmptyIsNoOp() {
    final var pool = new BedPool(3);
    assertThat(pool.discharge()).isFalse();
    assertThat(pool.discharge()).isFalse();
    assertThat(pool.snapshot()).isEqualTo(new BedSnapshot(0, 3));
  }

  @Test
  void testAdmitDischargeCycle() {
    final var pool = new BedPool(1);
    for (var i = 0; i < 3; i++) {
      assertThat(pool.tryAdmit()).isTrue();
      assertThat(pool.discharge()).isTrue();
    }
    assertThat(pool.snapshot().getVacant()).isEqualTo(1);
  }

  @Test
  void testAwaitVacancy_immediate() throws InterruptedException {
    final var pool = new BedPool(1);
    assertThat(pool.awaitVacancy(0)).isTrue();
  }

  @Test
  void testAwaitVacancy_timesOutWhenFull() throws InterruptedException {
    final var pool = new BedPool(1);
    pool.tryAdmit();
    assertThat(pool.awaitVacancy(5)).isFalse();
  }

  @Test
  void testAwaitVacancy_wokenByDischarge() throws Exception {
    final var pool = new BedPool(1);
    pool.tryAdmit();
    final var executor = Executors.newSingleThreadExecutor();
    try {
      final var awaiting = executor.submit(() -> pool.awaitVacancy(Long.MAX_VALUE));
      Thread.sleep(10);
      assertThat(awaiting.isDone()).isFalse();
      pool.discharge();
      assertThat(awaiting.get(10, TimeUnit.SECONDS)).isTrue();
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void testToString() {
    final var pool = new BedPool(4);
    assertThat(pool.toString()).contains(BedPool.class.getSimpleName()).contains("occupied=0").contains("totalCapacity=4");
  }

  @Nested
  class ContentionTests {
    @Test
    void testConcurrentAdmitsSucceedExactlyUpToCapacity() throws InterruptedException {
      final var capacity = 7;
      final var contenders = 32;
      for (var run = 0; run < 20; run++) {
        final var pool = new BedPool(capacity);
        final var admitted = new AtomicInteger();
        Contention.run(contenders, thread -> {
          if (pool.tryAdmit()) {
            admitted.incrementAndGet();
          }
        });
        assertThat(admitted.get()).isEqualTo(Math.min(contenders, capacity));
        assertThat(pool.snapshot().getOccupied()).isEqualTo(capacity);
      }
    }

    @Test
    void testEachAdmitAndDischargeSeesItsOwnOccupancy() throws InterruptedException {
      final var capacity = 16;
      final var pool = new BedPool(capacity);
      final var admitOccupancies = new ConcurrentLinkedQueue<Integer>();
      Contention.run(capacity * 2, thread -> {
        final var snapshot = pool.tryAdmitAndSnapshot();
        if (snapshot != null) {
          admitOccupancies.add(snapshot.getOccupied());
        }
      });
      assertThat(admitOccupancies).hasSize(capacity).doesNotHaveDuplicates().allMatch(occupied -> occupied >= 1 && occupied <= capacity);

      final var dischargeOccupancies = new ConcurrentLinkedQueue<Integer>();
      Contention.run(capacity * 2, thread -> {
        final var snapshot = pool.dischargeAndSnapshot();
        if (snapshot != null) {
          dischargeOccupancies.add(snapshot.getOccupied());
        }
      });
      assertThat(dischargeOccupancies).hasSize(capacity).doesNotHaveDuplicates().allMatch(occupied -> occupied >= 0 && occupied < capacity);
      assertThat(pool.dischargeAndSnapshot()).isNull();
    }

    @Test
    void testFewerContendersThanCapacity() throws InterruptedException {
      final var pool = new BedPool(10);
      final var admitted = new AtomicInteger();
      Contention.run(4, thread -> {
        if (pool.tryAdmit()) {
          admitted.incrementAndGet();
        }
      });
      assertThat(admitted.get()).isEqualTo(4);
    }

    @Test
    void testMixedAdmitsAndDischargesStayInBounds() throws InterruptedException {
      final var capacity = 3;
      final var pool = new BedPool(capacity);
      final var outOfBounds = new AtomicBoolean();
      Contention.run(8, thread -> {
        for (var i = 0; i < 1_000; i++) {
          if (thread % 2 == 0) {
            pool.tryAdmit();
          } else {
            pool.discharge();
          }
          final var occupied = pool.snapshot().getOccupied();
          if (occupied < 0 || occupied > capacity) {
            outOfBounds.set(true);
          }
        }
      });
      assertThat(outOfBounds.get()).isFalse();
    }
  }

  @Nested
  class BedSnapshotTests {
    @Test
    void testEqualsAndHashCode() {
      EqualsVerifier.forClass(BedSnapshot.class).verify();
    }

    @Test
    void testToString() {
      final var toString = new BedSnapshot(2, 5).toString();
      assertThat(toString).contains(BedSnapshot.class.getSimpleName()).contains("occupied=2").contains("totalCapacity=5");
    }
  }
}
