package com.obsidiandynamics.bedlam.queue;

import com.obsidiandynamics.bedlam.*;
import com.obsidiandynamics.bedlam.util.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.*;
import java.util.function.*;

public final class PriorityAdmissionQueue {
  private final Lock lock = new ReentrantLock();

  private final Condition notEmpty = lock.newCondition();

  private final List<Patient> patients;

  private final int capacity;

  public PriorityAdmissionQueue(int capacity) {
    Assert.argument(capacity > 0, () -> "Capacity must be positive: " + capacity);
    this.capacity = capacity;
    patients = new ArrayList<>(capacity);
  }

  public boolean push(Patient patient) {
    return push(patient, __ -> {});
  }

  /**
   * Inserts the patient behind every entry that precedes it in admission order.
   *
   * @param patient The patient to enqueue.
   * @param onAccepted Runs under the queue lock once the patient is accepted, before any
   *       consumer can pop it. Must not call back into this queue.
   * @return {@code true} if enqueued, {@code false} if the queue was full.
   */
  public boolean push(Patient patient, Consumer<Patient> onAccepted) {
    Objects.requireNonNull(patient, "patient");
    lock.lock();
    try {
      if (patients.size() >= capacity) {
        return false;
      }

      var index = patients.size();
      while (index > 0 && Patient.ADMISSION_ORDER.compare(patient, patients.get(index - 1)) < 0) {
        index--;
      }
      patients.add(index, patient);
      onAccepted.accept(patient);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  public Patient pop() {
    lock.lock();
    try {
      return patients.isEmpty() ? null : patients.remove(0);
    } finally {
      lock.unlock();
    }
  }

  public boolean awaitNonEmpty(long timeoutMs) throws InterruptedException {
    lock.lock();
    try {
      var remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
      while (patients.isEmpty()) {
        if (remainingNanos <= 0) {
          return false;
        }
        remainingNanos = notEmpty.awaitNanos(remainingNanos);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    lock.lock();
    try {
      return patients.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return patients.size();
    } finally {
      lock.unlock();
    }
  }

  public int capacity() {
    return capacity;
  }

  public List<Patient> snapshot() {
    lock.lock();
    try {
      return List.copyOf(patients);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return PriorityAdmissionQueue.class.getSimpleName() + "[size=" + size() + ", capacity=" + capacity + ']';
  }
}
