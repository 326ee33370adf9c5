package com.obsidiandynamics.bedlam.worker;

import com.obsidiandynamics.bedlam.pool.*;

import java.util.*;

public final class StatusReport {
  private final BedSnapshot beds;

  private final int queued;

  private final int criticalCareAvailable;

  private final int criticalCareCapacity;

  private final int generalWardAvailable;

  private final int generalWardCapacity;

  public StatusReport(BedSnapshot beds, int queued,
                      int criticalCareAvailable, int criticalCareCapacity,
                      int generalWardAvailable, int generalWardCapacity) {
    this.beds = beds;
    this.queued = queued;
    this.criticalCareAvailable = criticalCareAvailable;
    this.criticalCareCapacity = criticalCareCapacity;
    this.generalWardAvailable = generalWardAvailable;
    this.generalWardCapacity = generalWardCapacity;
  }

  public BedSnapshot getBeds() {
    return beds;
  }

  public int getQueued() {
    return queued;
  }

  public int getCriticalCareAvailable() {
    return criticalCareAvailable;
  }

  public int getCriticalCareCapacity() {
    return criticalCareCapacity;
  }

  public int getGeneralWardAvailable() {
    return generalWardAvailable;
  }

  public int getGeneralWardCapacity() {
    return generalWardCapacity;
  }

  public String describe() {
    return String.format("Beds Occupied: %d/%d%nPatients in Queue: %d%nCritical Care Available: %d/%d%nGeneral Ward Available: %d/%d",
                         beds.getOccupied(), beds.getTotalCapacity(), queued,
                         criticalCareAvailable, criticalCareCapacity,
                         generalWardAvailable, generalWardCapacity);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (StatusReport) o;
    if (queued != that.queued) return false;
    if (criticalCareAvailable != that.criticalCareAvailable) return false;
    if (criticalCareCapacity != that.criticalCareCapacity) return false;
    if (generalWardAvailable != that.generalWardAvailable) return false;
    if (generalWardCapacity != that.generalWardCapacity) return false;
    return Objects.equals(beds, that.beds);
  }

  @Override
  public int hashCode() {
    return Objects.hash(beds, queued, criticalCareAvailable, criticalCareCapacity, generalWardAvailable, generalWardCapacity);
  }

  @Override
  public String toString() {
    return StatusReport.class.getSimpleName() + "[beds=" + beds +
        ", queued=" + queued +
        ", criticalCareAvailable=" + criticalCareAvailable +
        ", criticalCareCapacity=" + criticalCareCapacity +
        ", generalWardAvailable=" + generalWardAvailable +
        ", generalWardCapacity=" + generalWardCapacity + ']';
  }
}
