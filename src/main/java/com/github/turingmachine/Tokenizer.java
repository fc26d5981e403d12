package com.github.turingmachine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical tokenizer for rule source.
 *
 * Tokens are plain strings: "[", "]", "->", identifiers (any run of non-whitespace, non-bracket
 * characters), the {@link #NEWLINE} token ending a rule and the {@link #INDENT} marker standing
 * for "the m-configuration of the previous rule".
 *
 * A rule may span several lines. Once the buffered rule has its arrow, the next line starts a new
 * rule if it has an arrow of its own or if it is not indented; an indented line with an arrow
 * starts a new rule that reuses the previous m-configuration. Indented lines without an arrow
 * just continue the buffered rule, so long task lists can be wrapped.
 */
public final class Tokenizer implements Iterator<String> {
  public static final String OPEN_GROUP = "[";
  public static final String CLOSE_GROUP = "]";
  public static final String ARROW = "->";
  public static final String NEWLINE = "\n";
  public static final String INDENT = " ";

  private static final Pattern TOKEN_PATTERN = Pattern.compile("\\[|\\]|->|[^\\s\\[\\]]+");

  private final Iterator<String> lines;
  private final Deque<String> pending = new ArrayDeque<>();
  private List<String> buffer = new ArrayList<>();
  private boolean exhausted;

  public Tokenizer(final Iterable<String> lines) {
    this.lines = lines.iterator();
  }

  public static Tokenizer tokenize(final String source) {
    return new Tokenizer(new LineFilter(source));
  }

  public static Tokenizer tokenize(final String source, final String commentSymbol) {
    return new Tokenizer(new LineFilter(source, commentSymbol));
  }

  /**
   * Splits a single line into its tokens.
   */
  static List<String> tokensOf(final String line) {
    final List<String> tokens = new ArrayList<>();
    final Matcher matcher = TOKEN_PATTERN.matcher(line);
    while (matcher.find()) {
      tokens.add(matcher.group());
    }
    return tokens;
  }

  @Override
  public boolean hasNext() {
    while (pending.isEmpty() && !exhausted) {
      if (lines.hasNext()) {
        consume(lines.next());
      } else {
        flush();
        exhausted = true;
      }
    }
    return !pending.isEmpty();
  }

  @Override
  public String next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return pending.poll();
  }

  private void consume(final String line) {
    final boolean indented = line.startsWith(INDENT);
    final List<String> lineTokens = tokensOf(line);
    if (buffer.contains(ARROW) && (lineTokens.contains(ARROW) || !indented)) {
      flush();
      buffer = new ArrayList<>();
      if (indented) {
        buffer.add(INDENT);
      }
    } else if (indented && buffer.isEmpty()) {
      // source starting with an indented line
      buffer.add(INDENT);
    }
    buffer.addAll(lineTokens);
  }

  private void flush() {
    pending.addAll(buffer);
    pending.add(NEWLINE);
  }

}
