package com.obsidiandynamics.bedlam;

public enum CareUnit {
  CRITICAL_CARE,
  GENERAL_WARD;

  public static final int CRITICAL_SEVERITY_THRESHOLD = 6;

  public static CareUnit forSeverity(int severity) {
    return severity > CRITICAL_SEVERITY_THRESHOLD ? CRITICAL_CARE : GENERAL_WARD;
  }
}
