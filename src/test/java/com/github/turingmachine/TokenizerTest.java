package com.github.turingmachine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of the Tokenizer.
 */
public class TokenizerTest {

  private static List<String> tokens(final String source) {
    final List<String> tokens = new ArrayList<>();
    final Iterator<String> tokenizer = Tokenizer.tokenize(source);
    while (tokenizer.hasNext()) {
      tokens.add(tokenizer.next());
    }
    return tokens;
  }

  @Test
  public void testEmptySource() {
    assertEquals(Arrays.asList("\n"), tokens(""));
    assertEquals(Arrays.asList("\n"), tokens(null));
  }

  @Test
  public void testOnlyCommentsAndBlankLines() {
    final String source = "# a machine with no rules\n\n   \n  # indented comment\n\t\n";
    assertEquals(Arrays.asList("\n"), tokens(source));
  }

  @Test
  public void testSimpleFullLineRule() {
    assertEquals(Arrays.asList("q1", "1", "->", "P0", "R", "q2", "\n"),
        tokens("q1 1 -> P0 R q2"));
  }

  @Test
  public void testThreeFullLineRules() {
    final String source = "q1 1 -> P0 R q2\n" + "q2 0 -> P1 q2\n" + "q2 1 -> E L q1\n";
    final List<String> expected = Arrays.asList("q1", "1", "->", "P0", "R", "q2", "\n", "q2", "0",
        "->", "P1", "q2", "\n", "q2", "1", "->", "E", "L", "q1", "\n");
    assertEquals(expected, tokens(source));
  }

  @Test
  public void testWrappedTaskListContinuesRule() {
    final String source = "q3 0 -> P1 R\n" + "        P0 R q2\n";
    assertEquals(Arrays.asList("q3", "0", "->", "P1", "R", "P0", "R", "q2", "\n"),
        tokens(source));
  }

  @Test
  public void testIndentedRuleReusesMConfiguration() {
    final String source = "q4 0 -> P1 R q3\n" + "   1 -> Px q4\n";
    final List<String> expected = Arrays.asList("q4", "0", "->", "P1", "R", "q3", "\n", " ", "1",
        "->", "Px", "q4", "\n");
    assertEquals(expected, tokens(source));
    // the second rule's m-configuration slot is the indent marker
    assertEquals(Tokenizer.INDENT, expected.get(7));
  }

  @Test
  public void testUnindentedLineWithoutArrowStartsNewRule() {
    final String source = "b -> P0 R c\n" + "c\n" + " None -> P1 b\n";
    final List<String> expected =
        Arrays.asList("b", "->", "P0", "R", "c", "\n", "c", "None", "->", "P1", "b", "\n");
    assertEquals(expected, tokens(source));
  }

  @Test
  public void testIndentedFirstLine() {
    assertEquals(Arrays.asList(" ", "0", "->", "R", "q1", "\n"), tokens("  0 -> R q1"));
  }

  @Test
  public void testBracketGroupsTokenizeEachSymbol() {
    assertEquals(Arrays.asList("[", "0", "4", "]", "\n"), tokens("[0 4]"));
    assertEquals(Arrays.asList("q", "Not", "[", "x", "y", "]", "->", "R", "q", "\n"),
        tokens("q Not[x y] -> R q"));
  }

  @Test
  public void testArrowWithoutSpaces() {
    assertEquals(Arrays.asList("a", "->", "P0", "b", "\n"), tokens("a ->P0 b"));
  }

  @Test
  public void testArrowInsideIdentifierDoesNotSplitRules() {
    // "c->d" is one identifier, so the indented line continues the task list
    final String source = "a -> P0 R\n" + "  c->d b\n";
    assertEquals(Arrays.asList("a", "->", "P0", "R", "c->d", "b", "\n"), tokens(source));
    assertEquals(Arrays.asList("x->y", "->", "q", "\n"), tokens("x->y -> q"));
  }

  @Test
  public void testCommentsAreStripped() {
    final String source = "a -> P0 R b # print zero\n" + "# whole line comment\n" + "b -> R a";
    assertEquals(Arrays.asList("a", "->", "P0", "R", "b", "\n", "b", "->", "R", "a", "\n"),
        tokens(source));
  }

  @Test
  public void testCustomCommentSymbol() {
    final Iterator<String> tokenizer = Tokenizer.tokenize("a -> P# b ; comment", ";");
    final List<String> tokens = new ArrayList<>();
    while (tokenizer.hasNext()) {
      tokens.add(tokenizer.next());
    }
    assertEquals(Arrays.asList("a", "->", "P#", "b", "\n"), tokens);
  }

  @Test
  public void testTokenizerIsLazy() {
    final Iterator<String> tokenizer = Tokenizer.tokenize("a -> R a\nb -> L b");
    assertTrue(tokenizer.hasNext());
    assertEquals("a", tokenizer.next());
    assertEquals("->", tokenizer.next());
    assertEquals("R", tokenizer.next());
    assertEquals("a", tokenizer.next());
    assertEquals("\n", tokenizer.next());
    assertEquals("b", tokenizer.next());
    assertEquals("->", tokenizer.next());
    assertEquals("L", tokenizer.next());
    assertEquals("b", tokenizer.next());
    assertEquals("\n", tokenizer.next());
    assertFalse(tokenizer.hasNext());
  }

}
