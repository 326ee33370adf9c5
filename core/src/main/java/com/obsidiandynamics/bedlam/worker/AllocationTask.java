package com.obsidiandynamics.bedlam.worker;

import com.obsidiandynamics.bedlam.*;
import com.obsidiandynamics.bedlam.event.*;
import com.obsidiandynamics.bedlam.pool.*;
import org.slf4j.*;

public final class AllocationTask implements Runnable {
  private static final Logger LOG = LoggerFactory.getLogger(AllocationTask.class);

  private final Patient patient;

  private final CapacityPool pool;

  private final EventLog eventLog;

  private final long holdMs;

  public AllocationTask(Patient patient, CapacityPool pool, EventLog eventLog, long holdMs) {
    this.patient = patient;
    this.pool = pool;
    this.eventLog = eventLog;
    this.holdMs = holdMs;
  }

  public Patient getPatient() {
    return patient;
  }

  @Override
  public void run() {
    eventLog.record(EventType.ALLOCATION_REQUESTED, patient);
    try {
      pool.acquire();
    } catch (InterruptedException e) {
      LOG.warn("Interrupted while awaiting a {} slot for patient {}", patient.getCareUnit(), patient.getId());
      Thread.currentThread().interrupt();
      return;
    }

    try {
      eventLog.record(EventType.ALLOCATED, patient);
      Thread.sleep(holdMs);
    } catch (InterruptedException e) {
      LOG.warn("Hold for patient {} cut short", patient.getId());
      Thread.currentThread().interrupt();
    } finally {
      pool.release();
    }
    eventLog.record(EventType.RELEASED, patient);
  }

  @Override
  public String toString() {
    return AllocationTask.class.getSimpleName() + "[patient=" + patient + ", holdMs=" + holdMs + ']';
  }
}
