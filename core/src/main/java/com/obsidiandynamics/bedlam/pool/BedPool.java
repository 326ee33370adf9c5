package com.obsidiandynamics.bedlam.pool;

import com.obsidiandynamics.bedlam.util.*;

import java.util.concurrent.*;
import java.util.concurrent.locks.*;

public final class BedPool {
  private final Lock lock = new ReentrantLock();

  private final Condition vacancy = lock.newCondition();

  private final int totalCapacity;

  private int occupied;

  public BedPool(int totalCapacity) {
    Assert.argument(totalCapacity > 0, () -> "Total capacity must be positive: " + totalCapacity);
    this.totalCapacity = totalCapacity;
  }

  public boolean tryAdmit() {
    return tryAdmitAndSnapshot() != null;
  }

  /**
   * Reserves a bed if one is vacant.
   *
   * @return The occupancy immediately after the reservation, taken in the same critical section,
   *        or {@code null} if the pool is full.
   */
  public BedSnapshot tryAdmitAndSnapshot() {
    lock.lock();
    try {
      if (occupied < totalCapacity) {
        occupied++;
        checkInvariant();
        return new BedSnapshot(occupied, totalCapacity);
      } else {
        return null;
      }
    } finally {
      lock.unlock();
    }
  }

  public boolean discharge() {
    return dischargeAndSnapshot() != null;
  }

  public BedSnapshot dischargeAndSnapshot() {
    lock.lock();
    try {
      if (occupied > 0) {
        occupied--;
        checkInvariant();
        vacancy.signal();
        return new BedSnapshot(occupied, totalCapacity);
      } else {
        return null;
      }
    } finally {
      lock.unlock();
    }
  }

  // a vacancy seen here may be taken before the caller acts on it; callers still go through tryAdmit
  public boolean awaitVacancy(long timeoutMs) throws InterruptedException {
    lock.lock();
    try {
      var remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
      while (occupied == totalCapacity) {
        if (remainingNanos <= 0) {
          return false;
        }
        remainingNanos = vacancy.awaitNanos(remainingNanos);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  public BedSnapshot snapshot() {
    lock.lock();
    try {
      return new BedSnapshot(occupied, totalCapacity);
    } finally {
      lock.unlock();
    }
  }

  public int getTotalCapacity() {
    return totalCapacity;
  }

  private void checkInvariant() {
    Assert.inRange(occupied, 0, totalCapacity, "Occupied beds");
  }

  @Override
  public String toString() {
    return BedPool.class.getSimpleName() + "[snapshot=" + snapshot() + ']';
  }
}
