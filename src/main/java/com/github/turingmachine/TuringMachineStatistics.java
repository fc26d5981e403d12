package com.github.turingmachine;

/**
 * Holder of statistics for one machine instance. A copy of a machine starts with its own, empty
 * statistics.
 */
public final class TuringMachineStatistics {
  private final String machineId;

  TuringMachineStatistics(final String machineId) {
    this.machineId = machineId;
  }

  private final long startTstampMillis = System.currentTimeMillis();
  long totalMoves;
  long totalLocks;
  long totalRuns;

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public String getMachineId() {
    return machineId;
  }

  public long getTotalMoves() {
    return totalMoves;
  }

  public long getTotalLocks() {
    return totalLocks;
  }

  public long getTotalRuns() {
    return totalRuns;
  }

  @Override
  public String toString() {
    return "TuringMachineStatistics [machineId=" + machineId + ", startTstampMillis="
        + startTstampMillis + ", totalMoves=" + totalMoves + ", totalLocks=" + totalLocks
        + ", totalRuns=" + totalRuns + "]";
  }

}
