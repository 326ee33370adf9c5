package com.obsidiandynamics.bedlam.pool;

import com.obsidiandynamics.bedlam.util.*;

import java.util.concurrent.*;

public final class SemaphoreCapacityPool implements CapacityPool {
  private final Semaphore semaphore;

  private final int capacity;

  public SemaphoreCapacityPool(int capacity) {
    Assert.argument(capacity > 0, () -> "Capacity must be positive: " + capacity);
    this.capacity = capacity;
    semaphore = new Semaphore(capacity, true);
  }

  @Override
  public void acquire() throws InterruptedException {
    semaphore.acquire();
  }

  @Override
  public boolean tryAcquire(long timeoutMs) throws InterruptedException {
    return semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void release() {
    // a legitimate release always finds at least one permit outstanding
    Assert.that(semaphore.availablePermits() < capacity, () -> String.format("Released more slots than acquired (capacity %d)", capacity));
    semaphore.release();
  }

  @Override
  public int available() {
    return semaphore.availablePermits();
  }

  @Override
  public int capacity() {
    return capacity;
  }

  @Override
  public String toString() {
    return SemaphoreCapacityPool.class.getSimpleName() + "[capacity=" + capacity + ", available=" + available() + ']';
  }
}
