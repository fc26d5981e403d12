package com.github.turingmachine;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Strips comments and blank lines out of rule source. Leading whitespace of the surviving lines
 * is kept as is since the {@link Tokenizer} relies on it for continuation lines.
 *
 * Only "\n", "\r\n" and "\r" end a line. Other separators (form feed, vertical tab, U+2028 and
 * the like) stay inside the line; form feed and vertical tab then separate tokens like spaces.
 */
public final class LineFilter implements Iterable<String> {
  public static final String DEFAULT_COMMENT_SYMBOL = "#";

  private final String source;
  private final String commentSymbol;

  public LineFilter(final String source) {
    this(source, DEFAULT_COMMENT_SYMBOL);
  }

  public LineFilter(final String source, final String commentSymbol) {
    this.source = source == null ? "" : source;
    this.commentSymbol = commentSymbol;
  }

  /**
   * Every call walks the source again from its first line.
   */
  @Override
  public Iterator<String> iterator() {
    return new LineIterator();
  }

  /**
   * Truncates the raw line at the comment symbol and right-trims it. Returns null when nothing is
   * left.
   */
  String filter(final String rawLine) {
    String line = rawLine;
    if (commentSymbol != null && !commentSymbol.isEmpty()) {
      final int commentStart = line.indexOf(commentSymbol);
      if (commentStart >= 0) {
        line = line.substring(0, commentStart);
      }
    }
    line = line.stripTrailing();
    return line.isEmpty() ? null : line;
  }

  private final class LineIterator implements Iterator<String> {
    private int position;
    private String nextLine;

    @Override
    public boolean hasNext() {
      while (nextLine == null && position < source.length()) {
        nextLine = filter(readRawLine());
      }
      return nextLine != null;
    }

    @Override
    public String next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      final String line = nextLine;
      nextLine = null;
      return line;
    }

    // \n, \r\n and \r all end a line
    private String readRawLine() {
      int end = position;
      while (end < source.length() && source.charAt(end) != '\n' && source.charAt(end) != '\r') {
        end++;
      }
      final String rawLine = source.substring(position, end);
      if (end < source.length() && source.charAt(end) == '\r' && end + 1 < source.length()
          && source.charAt(end + 1) == '\n') {
        end++;
      }
      position = end + 1;
      return rawLine;
    }
  }

}
