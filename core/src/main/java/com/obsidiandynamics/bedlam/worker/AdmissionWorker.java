package com.obsidiandynamics.bedlam.worker;

import com.obsidiandynamics.bedlam.event.*;
import com.obsidiandynamics.bedlam.pool.*;
import com.obsidiandynamics.bedlam.queue.*;
import org.slf4j.*;

public final class AdmissionWorker extends Worker {
  private static final Logger LOG = LoggerFactory.getLogger(AdmissionWorker.class);

  private final PriorityAdmissionQueue queue;

  private final BedPool bedPool;

  private final EventLog eventLog;

  private final long idleWaitMs;

  private final long admissionIntervalMs;

  public AdmissionWorker(PriorityAdmissionQueue queue, BedPool bedPool, EventLog eventLog, long idleWaitMs, long admissionIntervalMs) {
    super("admission-worker");
    this.queue = queue;
    this.bedPool = bedPool;
    this.eventLog = eventLog;
    this.idleWaitMs = idleWaitMs;
    this.admissionIntervalMs = admissionIntervalMs;
  }

  @Override
  protected void cycle() throws InterruptedException {
    if (!queue.awaitNonEmpty(idleWaitMs)) {
      return;
    }

    final var snapshot = bedPool.tryAdmitAndSnapshot();
    if (snapshot == null) {
      bedPool.awaitVacancy(idleWaitMs);
      return;
    }

    final var patient = queue.pop();
    if (patient == null) {
      bedPool.discharge(); // return the reservation
      return;
    }

    LOG.debug("Admitted {}", patient);
    eventLog.record(EventType.ADMITTED, patient);
    eventLog.recordCapacity(snapshot.getTotalCapacity(), snapshot.getOccupied());

    if (admissionIntervalMs > 0) {
      awaitShutdown(admissionIntervalMs);
    }
  }
}
