package com.github.turingmachine;

/**
 * The halting signal: neither an exact nor a fallback rule resolves the current
 * (m-configuration, symbol) pair. Callers should treat this as normal termination.
 */
public final class MachineLockedException extends TuringMachineException {
  private static final long serialVersionUID = 1L;
  private final String mConfiguration;
  private final String symbol;

  public MachineLockedException(final String mConfiguration, final String symbol) {
    super(Code.MACHINE_LOCKED, "m-configuration=" + mConfiguration + ", symbol=" + symbol);
    this.mConfiguration = mConfiguration;
    this.symbol = symbol;
  }

  public String getMConfiguration() {
    return mConfiguration;
  }

  public String getSymbol() {
    return symbol;
  }
}
