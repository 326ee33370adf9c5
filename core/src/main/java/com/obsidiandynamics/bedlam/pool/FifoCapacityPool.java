package com.obsidiandynamics.bedlam.pool;

import com.obsidiandynamics.bedlam.util.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.*;

// a released slot goes straight to the longest waiter; newcomers never barge past a queued waiter
public final class FifoCapacityPool implements CapacityPool {
  private static final class Waiter {
    final Condition condition;

    boolean granted;

    Waiter(Condition condition) {
      this.condition = condition;
    }
  }

  private final Lock lock = new ReentrantLock();

  private final Deque<Waiter> waiters = new ArrayDeque<>();

  private final int capacity;

  private int available;

  public FifoCapacityPool(int capacity) {
    Assert.argument(capacity > 0, () -> "Capacity must be positive: " + capacity);
    this.capacity = capacity;
    available = capacity;
  }

  @Override
  public boolean tryAcquire(long timeoutMs) throws InterruptedException {
    lock.lock();
    try {
      if (waiters.isEmpty() && available > 0) {
        available--;
        return true;
      } else if (timeoutMs <= 0) {
        return false;
      }

      final var waiter = new Waiter(lock.newCondition());
      waiters.addLast(waiter);
      var remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
      try {
        while (!waiter.granted) {
          if (remainingNanos <= 0) {
            waiters.remove(waiter);
            return false;
          }
          remainingNanos = waiter.condition.awaitNanos(remainingNanos);
        }
        return true;
      } catch (InterruptedException e) {
        if (waiter.granted) {
          // the slot was handed over before the interrupt landed; pass it on
          releaseLocked();
        } else {
          waiters.remove(waiter);
        }
        throw e;
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void release() {
    lock.lock();
    try {
      releaseLocked();
    } finally {
      lock.unlock();
    }
  }

  private void releaseLocked() {
    final var next = waiters.pollFirst();
    if (next != null) {
      next.granted = true;
      next.condition.signal();
    } else {
      Assert.that(available < capacity, () -> String.format("Released more slots than acquired (capacity %d)", capacity));
      available++;
    }
  }

  @Override
  public int available() {
    lock.lock();
    try {
      return available;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int capacity() {
    return capacity;
  }

  int waiting() {
    lock.lock();
    try {
      return waiters.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return FifoCapacityPool.class.getSimpleName() + "[capacity=" + capacity + ", available=" + available() + ']';
  }
}
