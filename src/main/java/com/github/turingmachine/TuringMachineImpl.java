package com.github.turingmachine;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turing a-machine stepping over a compiled {@link TransitionTable}.
 *
 * Notes for users:<br>
 * 1. this instance is not thread-safe; see {@link TuringMachine}<br>
 *
 * 2. the transition table is immutable and shared with copies. All mutable state lives in the
 * {@link CompleteConfiguration} owned by this instance. {@link #getTape()} hands out this
 * machine's live tape, {@link #copy()} deep copies it<br>
 */
public final class TuringMachineImpl implements TuringMachine {
  private static final Logger logger =
      LogManager.getLogger(TuringMachineImpl.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();
  private final TuringMachineConfiguration config;
  private final TransitionTable transitionTable;
  private final CompleteConfiguration configuration;
  private final TuringMachineStatistics machineStats;

  public TuringMachineImpl(final TuringMachineConfiguration config,
      final TransitionTable transitionTable) {
    this(config, transitionTable, new CompleteConfiguration(0,
        transitionTable.getInitialMConfiguration().orElse(null), new Tape()));
    logInfo(machineId, "Built machine with " + transitionTable);
  }

  private TuringMachineImpl(final TuringMachineConfiguration config,
      final TransitionTable transitionTable, final CompleteConfiguration configuration) {
    this.config = config;
    this.transitionTable = transitionTable;
    this.configuration = configuration;
    this.machineStats = new TuringMachineStatistics(machineId);
  }

  @Override
  public String scan() {
    return configuration.tape.read(configuration.index);
  }

  @Override
  public void perform(final Task task) {
    switch (task.getKind()) {
      case RIGHT:
        configuration.index = Math.incrementExact(configuration.index);
        break;
      case LEFT:
        configuration.index = Math.decrementExact(configuration.index);
        break;
      case NOOP:
        break;
      case ERASE:
        configuration.tape.erase(configuration.index);
        break;
      case PRINT:
        configuration.tape.print(configuration.index, task.getSymbol());
        break;
      default:
        throw new IllegalArgumentException("Unknown task: " + task);
    }
  }

  @Override
  public void move() throws MachineLockedException {
    final String mConfiguration = configuration.mConfiguration;
    final String symbol = scan();
    final Optional<Action> action = transitionTable.lookup(mConfiguration, symbol);
    if (!action.isPresent()) {
      machineStats.totalLocks++;
      throw new MachineLockedException(mConfiguration, symbol);
    }
    requireHeadStaysOnTape(action.get());
    for (final Task task : action.get().getTasks()) {
      perform(task);
    }
    configuration.mConfiguration = action.get().getNextMConfiguration();
    machineStats.totalMoves++;
    if (logger.isDebugEnabled()) {
      logDebug(machineId, String.format("(%s, %s) -> %s, index:%d", mConfiguration, symbol,
          action.get(), configuration.index));
    }
  }

  /**
   * The head index is an int. Fails before any task runs if the action would walk it past either
   * end, so a move never applies half of its tasks.
   */
  private void requireHeadStaysOnTape(final Action action) {
    long index = configuration.index;
    for (final Task task : action.getTasks()) {
      if (task.getKind() == Task.Kind.RIGHT) {
        index++;
      } else if (task.getKind() == Task.Kind.LEFT) {
        index--;
      }
      if (index > Integer.MAX_VALUE || index < Integer.MIN_VALUE) {
        throw new IllegalStateException(String.format(
            "Head would leave the addressable tape from index:%d, m-configuration:%s",
            configuration.index, configuration.mConfiguration));
      }
    }
  }

  @Override
  public RunResult run(final int maxSteps) {
    machineStats.totalRuns++;
    int steps = 0;
    MachineLockedException lockError = null;
    while (steps < maxSteps) {
      try {
        move();
      } catch (MachineLockedException locked) {
        lockError = locked;
        break;
      }
      steps++;
    }
    final RunResult result = new RunResult(steps, lockError);
    if (result.isLocked()) {
      logInfo(machineId, String.format("Machine locked after %d steps at index:%d, %s", steps,
          configuration.index, lockError.getMessage()));
    } else {
      logInfo(machineId, String.format("Machine ran its %d steps, m-configuration:%s, index:%d",
          steps, configuration.mConfiguration, configuration.index));
    }
    return result;
  }

  @Override
  public RunResult run() {
    return run(config.getDefaultRunSteps());
  }

  @Override
  public Tape getTape() {
    return configuration.tape;
  }

  @Override
  public void setTape(final List<String> symbols) {
    configuration.tape = Tape.of(symbols);
  }

  @Override
  public void setTape(final Map<Integer, String> symbols) {
    configuration.tape = Tape.of(symbols);
  }

  @Override
  public void setTape(final Tape tape) {
    configuration.tape = tape.copy();
  }

  @Override
  public int getIndex() {
    return configuration.index;
  }

  @Override
  public void setIndex(final int index) {
    configuration.index = index;
  }

  @Override
  public String getMConfiguration() {
    return configuration.mConfiguration;
  }

  @Override
  public void setMConfiguration(final String mConfiguration) {
    configuration.mConfiguration = mConfiguration;
  }

  @Override
  public TuringMachine copy() {
    final TuringMachineImpl copy =
        new TuringMachineImpl(config, transitionTable, configuration.copy());
    logDebug(machineId, "Copied machine into m:" + copy.machineId);
    return copy;
  }

  @Override
  public TransitionTable getTransitionTable() {
    return transitionTable;
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public TuringMachineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public TuringMachineStatistics getStatistics() {
    return machineStats;
  }

  @Override
  public String toString() {
    return "TuringMachineImpl [machineId=" + machineId + ", mConfiguration="
        + configuration.mConfiguration + ", index=" + configuration.index + ", tape="
        + configuration.tape.render() + "]";
  }

  private static void logInfo(final String machineId, final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String machineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(message).toString());
    }
  }

  /**
   * The complete configuration: head index, current m-configuration and tape. Each machine owns
   * exactly one, and it is the only state that changes while the machine moves.
   */
  final static class CompleteConfiguration {
    private int index;
    private String mConfiguration;
    private Tape tape;

    private CompleteConfiguration(final int index, final String mConfiguration,
        final Tape tape) {
      this.index = index;
      this.mConfiguration = mConfiguration;
      this.tape = tape;
    }

    private CompleteConfiguration copy() {
      return new CompleteConfiguration(index, mConfiguration, tape.copy());
    }
  }

}
