package com.github.turingmachine;

import org.openjdk.jmh.annotations.Benchmark;

import com.github.turingmachine.TuringMachine.TuringMachineBuilder;
import com.github.turingmachine.TuringMachineConfiguration.TuringMachineConfigurationBuilder;

public class TuringMachineBenchmarkTest {

  @Benchmark
  public void testCompileAndRun() throws TuringMachineException {
    // 1. compile the rules
    final TuringMachineConfiguration config =
        TuringMachineConfigurationBuilder.newBuilder().defaultRunSteps(1000).build();
    final TuringMachine machine = TuringMachineBuilder.newBuilder().config(config)
        .source(TuringMachineTest.DIVISIBLE_BY_THREE).build();

    // 2. load up the tape
    machine.setTape(Tape.parse("1 1 0 1 0 0 1 1 1 0 1"));

    // 3. run until the machine locks
    RunResult result = machine.run();
    String tape = machine.getTape().render();
  }

  @Benchmark
  public void testMoves() throws TuringMachineException {
    final TuringMachine machine =
        TuringMachineBuilder.newBuilder().source(TuringMachineTest.ALTERNATING).build();
    for (int step = 0; step < 10000; step++) {
      machine.move();
    }
  }

  public static void main(String args[]) throws TuringMachineException {
    TuringMachineBenchmarkTest test = new TuringMachineBenchmarkTest();
    test.testCompileAndRun();
    test.testMoves();
  }

}
