package com.github.turingmachine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.junit.Test;

public class TapeTest {

  @Test
  public void testBlankCells() {
    final Tape tape = new Tape();
    assertEquals("None", tape.read(0));
    assertEquals("None", tape.read(-42));
    assertTrue(tape.isEmpty());
    assertEquals("", tape.render());
    assertEquals(Optional.empty(), tape.firstIndex());
  }

  @Test
  public void testPrintingBlankDeletes() {
    final Tape tape = new Tape();
    tape.print(3, "x");
    assertFalse(tape.isBlank(3));
    tape.print(3, "None");
    assertTrue(tape.isBlank(3));
    assertTrue(tape.asMap().isEmpty());
    tape.print(-1, "y");
    tape.erase(-1);
    tape.erase(7);
    assertTrue(tape.isEmpty());
  }

  @Test
  public void testFromListDropsBlanks() {
    final Tape tape = Tape.of(Arrays.asList("1", "None", "0"));
    final Map<Integer, String> expected = new HashMap<>();
    expected.put(0, "1");
    expected.put(2, "0");
    assertEquals(expected, tape.asMap());
  }

  @Test
  public void testFromMapDropsBlanks() {
    final Map<Integer, String> cells = new HashMap<>();
    cells.put(-5, "a");
    cells.put(2, "None");
    cells.put(4, "b");
    final Tape tape = Tape.of(cells);
    assertEquals(2, tape.size());
    assertEquals(Optional.of(-5), tape.firstIndex());
    assertEquals(Optional.of(4), tape.lastIndex());
  }

  @Test
  public void testParseAndRender() {
    final Tape tape = Tape.parse("  1 0  None 1\t0 ");
    assertEquals("1 0 None 1 0", tape.render());
    tape.print(-2, "$");
    assertEquals("$ None 1 0 None 1 0", tape.render());
    assertTrue(Tape.parse("   ").isEmpty());
  }

  @Test
  public void testCopyIsIndependent() {
    final Tape tape = Tape.parse("a b c");
    final Tape copy = tape.copy();
    assertEquals(tape, copy);
    copy.print(1, "z");
    copy.erase(0);
    assertEquals("a b c", tape.render());
    assertEquals("z c", copy.render());
  }

}
