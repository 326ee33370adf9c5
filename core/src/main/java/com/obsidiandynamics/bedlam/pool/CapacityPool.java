package com.obsidiandynamics.bedlam.pool;

public interface CapacityPool {
  @FunctionalInterface
  interface Factory {
    CapacityPool create(int capacity);
  }

  default void acquire() throws InterruptedException {
    tryAcquire(Long.MAX_VALUE);
  }

  boolean tryAcquire(long timeoutMs) throws InterruptedException;

  /**
   * Returns a slot, waking at most one blocked acquirer. Releasing a slot that was never
   * acquired is a programming error and fails with an {@link AssertionError}.
   */
  void release();

  int available();

  int capacity();
}
