package com.github.turingmachine;

/**
 * This class encapsulates all the configuration parameters for a TuringMachine. Use the
 * {@code TuringMachineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. commentSymbol marks the start of a comment in rule source; the rest of the line is dropped.
 * Defaults to "#".<br>
 * 2. defaultRunSteps bounds {@link TuringMachine#run()}. A machine that never locks would
 * otherwise run forever, so there is no "unbounded" setting. Defaults to 3000 steps.<br>
 */
public final class TuringMachineConfiguration {
  public static final int DEFAULT_RUN_STEPS = 3000;

  private final String commentSymbol;
  private final int defaultRunSteps;

  public String getCommentSymbol() {
    return commentSymbol;
  }

  public int getDefaultRunSteps() {
    return defaultRunSteps;
  }

  public static TuringMachineConfiguration defaults() {
    return new TuringMachineConfiguration(LineFilter.DEFAULT_COMMENT_SYMBOL, DEFAULT_RUN_STEPS);
  }

  public final static class TuringMachineConfigurationBuilder {
    private String commentSymbol = LineFilter.DEFAULT_COMMENT_SYMBOL;
    private int defaultRunSteps = DEFAULT_RUN_STEPS;

    public static TuringMachineConfigurationBuilder newBuilder() {
      return new TuringMachineConfigurationBuilder();
    }

    public TuringMachineConfigurationBuilder commentSymbol(final String commentSymbol) {
      this.commentSymbol = commentSymbol;
      return this;
    }

    public TuringMachineConfigurationBuilder defaultRunSteps(final int defaultRunSteps) {
      this.defaultRunSteps = defaultRunSteps;
      return this;
    }

    public TuringMachineConfiguration build() throws TuringMachineException {
      final TuringMachineConfiguration config =
          new TuringMachineConfiguration(commentSymbol, defaultRunSteps);
      config.validate();
      return config;
    }

    private TuringMachineConfigurationBuilder() {}
  }

  private void validate() throws TuringMachineException {
    StringBuilder messages = new StringBuilder();
    if (commentSymbol == null || commentSymbol.isEmpty()) {
      messages.append("commentSymbol cannot be null or empty. ");
    } else if (!commentSymbol.trim().equals(commentSymbol)) {
      messages.append("commentSymbol cannot contain leading or trailing whitespace. ");
    }
    if (defaultRunSteps <= 0) {
      messages.append("defaultRunSteps must be positive. ");
    }
    if (messages.length() > 0) {
      throw new TuringMachineException(TuringMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "TuringMachineConfiguration [commentSymbol=" + commentSymbol + ", defaultRunSteps="
        + defaultRunSteps + "]";
  }

  private TuringMachineConfiguration(final String commentSymbol, final int defaultRunSteps) {
    this.commentSymbol = commentSymbol;
    this.defaultRunSteps = defaultRunSteps;
  }

}
