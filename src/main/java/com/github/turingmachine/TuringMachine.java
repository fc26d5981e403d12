package com.github.turingmachine;

import java.util.List;
import java.util.Map;

/**
 * Turing a-machine (automatic machine), after his model in "On computable numbers, with an
 * application to the Entscheidungsproblem" (1936), built from a textual rule table.
 *
 * Notes for users:<br>
 * 1. a machine is NOT thread-safe. Its complete configuration (head index, m-configuration and
 * tape) must only be stepped by one thread at a time<br>
 *
 * 2. the transition table is compiled once, at build time, and never changes afterwards. Copies
 * made with {@link #copy()} share it, so stepping copies from different threads is fine<br>
 *
 * 3. there is no halted state. A machine halts when a move cannot be resolved, which surfaces as
 * a {@link MachineLockedException}. That's the normal way for a computation to end, not a
 * failure<br>
 *
 * 4. the starting complete configuration is index 0, an empty tape and the m-configuration of the
 * first rule in the source. Empty source leaves the m-configuration unset, so it should be
 * assigned before moving<br>
 */
public interface TuringMachine {

  ///// Single step API /////
  /**
   * Returns the symbol under the head, or "None" for a blank cell.
   */
  String scan();

  /**
   * Applies one task to the complete configuration.
   */
  void perform(final Task task);

  /**
   * Performs one rule: resolves the action for the current m-configuration and scanned symbol,
   * performs its tasks in order and switches to its next m-configuration. Nothing changes when
   * the lookup fails.
   */
  void move() throws MachineLockedException;

  /**
   * Moves up to maxSteps times, stopping early if the machine locks.
   */
  RunResult run(final int maxSteps);

  /**
   * Moves up to {@link TuringMachineConfiguration#getDefaultRunSteps()} times.
   */
  RunResult run();


  ///// Complete configuration /////
  Tape getTape();

  /**
   * Symbols are laid out contiguously from index 0; "None" entries stay blank.
   */
  void setTape(final List<String> symbols);

  void setTape(final Map<Integer, String> symbols);

  void setTape(final Tape tape);

  int getIndex();

  void setIndex(final int index);

  /**
   * Current m-configuration, null when the machine has none yet.
   */
  String getMConfiguration();

  void setMConfiguration(final String mConfiguration);


  ///// Machine level functions /////
  /**
   * An independent machine sharing this one's transition table, with its own copy of the index,
   * the m-configuration and the tape.
   */
  TuringMachine copy();

  TransitionTable getTransitionTable();

  /**
   * Reports the id of this TuringMachine instance.
   */
  String getId();

  TuringMachineConfiguration getConfiguration();

  TuringMachineStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build machines.
   */
  public final static class TuringMachineBuilder {
    private TuringMachineConfiguration config;
    private String source = "";

    public static TuringMachineBuilder newBuilder() {
      return new TuringMachineBuilder();
    }

    public TuringMachineBuilder config(final TuringMachineConfiguration config) {
      this.config = config;
      return this;
    }

    public TuringMachineBuilder source(final String source) {
      this.source = source;
      return this;
    }

    public TuringMachine build() throws RuleSyntaxException {
      final TuringMachineConfiguration machineConfig =
          config == null ? TuringMachineConfiguration.defaults() : config;
      return new TuringMachineImpl(machineConfig,
          TransitionTable.compile(source, machineConfig.getCommentSymbol()));
    }

    private TuringMachineBuilder() {}
  }

}
