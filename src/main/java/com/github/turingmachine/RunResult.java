package com.github.turingmachine;

/**
 * This object encapsulates the outcome of a bounded {@link TuringMachine#run(int)}.
 *
 * A run either used up its step budget, with {@link #isLocked()} false, or stopped early on the
 * halting signal, in which case {@link #getLockError()} carries the pair that could not be
 * resolved.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class RunResult {
  private final int steps;
  private final MachineLockedException lockError;

  public RunResult(final int steps, final MachineLockedException lockError) {
    this.steps = steps;
    this.lockError = lockError;
  }

  /**
   * Number of completed moves.
   */
  public int getSteps() {
    return steps;
  }

  public MachineLockedException getLockError() {
    return lockError;
  }

  public boolean isLocked() {
    return lockError != null;
  }

  @Override
  public String toString() {
    return "RunResult [steps=" + steps + ", locked=" + isLocked() + ", lockError=" + lockError
        + "]";
  }
}
