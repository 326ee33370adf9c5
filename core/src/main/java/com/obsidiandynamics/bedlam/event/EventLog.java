package com.obsidiandynamics.bedlam.event;

import com.obsidiandynamics.bedlam.*;

/**
 * Receives notifications of state transitions in the allocation core. A {@code Check-In} is
 * recorded while the admission queue lock is held, so implementations must not block on the
 * queue. Implementations that touch shared output synchronize themselves.
 */
public interface EventLog {
  EventLog NOP = new EventLog() {
    @Override
    public void record(EventType type, Patient patient) {}

    @Override
    public void recordCapacity(int total, int occupied) {}
  };

  void record(EventType type, Patient patient);

  default void record(EventType type) {
    record(type, null);
  }

  void recordCapacity(int total, int occupied);

  default EventLog andThen(EventLog other) {
    final var first = this;
    return new EventLog() {
      @Override
      public void record(EventType type, Patient patient) {
        first.record(type, patient);
        other.record(type, patient);
      }

      @Override
      public void recordCapacity(int total, int occupied) {
        first.recordCapacity(total, occupied);
        other.recordCapacity(total, occupied);
      }
    };
  }
}
