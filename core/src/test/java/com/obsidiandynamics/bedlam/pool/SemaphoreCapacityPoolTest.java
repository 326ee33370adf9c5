package com.obsidiandynamics.bedlam.pool;

public final class SemaphoreCapacityPoolTest extends AbstractCapacityPoolTest {
  @Override
  CapacityPool newPool(int capacity) {
    return new SemaphoreCapacityPool(capacity);
  }
}
