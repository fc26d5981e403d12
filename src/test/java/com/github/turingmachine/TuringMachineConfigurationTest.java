package com.github.turingmachine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.turingmachine.TuringMachineConfiguration.TuringMachineConfigurationBuilder;
import com.github.turingmachine.TuringMachineException.Code;

public class TuringMachineConfigurationTest {

  @Test
  public void testDefaults() throws TuringMachineException {
    final TuringMachineConfiguration config =
        TuringMachineConfigurationBuilder.newBuilder().build();
    assertEquals("#", config.getCommentSymbol());
    assertEquals(3000, config.getDefaultRunSteps());
    assertEquals(config.toString(), TuringMachineConfiguration.defaults().toString());
  }

  @Test
  public void testInvalidValuesAreReportedTogether() {
    try {
      TuringMachineConfigurationBuilder.newBuilder().commentSymbol("").defaultRunSteps(0).build();
      fail("invalid configuration was accepted");
    } catch (TuringMachineException problem) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, problem.getCode());
      assertTrue(problem.getMessage().contains("commentSymbol"));
      assertTrue(problem.getMessage().contains("defaultRunSteps"));
    }
  }

  @Test
  public void testCommentSymbolWithWhitespace() {
    try {
      TuringMachineConfigurationBuilder.newBuilder().commentSymbol(" ;").build();
      fail("comment symbol with whitespace was accepted");
    } catch (TuringMachineException problem) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, problem.getCode());
    }
  }

}
