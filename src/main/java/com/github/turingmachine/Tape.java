package com.github.turingmachine;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Sparse, unbounded tape. Cells are addressed by signed indices and hold one symbol each; a cell
 * missing from the map is blank. The blank symbol itself is never stored.
 */
public final class Tape {
  private final TreeMap<Integer, String> cells = new TreeMap<>();

  public Tape() {}

  /**
   * Contiguous cells starting at index 0.
   */
  public static Tape of(final List<String> symbols) {
    final Tape tape = new Tape();
    for (int index = 0; index < symbols.size(); index++) {
      tape.print(index, symbols.get(index));
    }
    return tape;
  }

  public static Tape of(final Map<Integer, String> symbols) {
    final Tape tape = new Tape();
    for (final Map.Entry<Integer, String> cell : symbols.entrySet()) {
      tape.print(cell.getKey(), cell.getValue());
    }
    return tape;
  }

  /**
   * Whitespace separated symbols, laid out from index 0.
   */
  public static Tape parse(final String text) {
    final String trimmed = text == null ? "" : text.trim();
    if (trimmed.isEmpty()) {
      return new Tape();
    }
    final Tape tape = new Tape();
    final String[] symbols = trimmed.split("\\s+");
    for (int index = 0; index < symbols.length; index++) {
      tape.print(index, symbols[index]);
    }
    return tape;
  }

  public String read(final int index) {
    final String symbol = cells.get(index);
    return symbol == null ? SymbolQuery.BLANK : symbol;
  }

  /**
   * Writes the symbol at the given cell. Printing the blank symbol (or null) erases the cell.
   */
  public void print(final int index, final String symbol) {
    if (symbol == null || SymbolQuery.BLANK.equals(symbol)) {
      cells.remove(index);
    } else {
      cells.put(index, symbol);
    }
  }

  public void erase(final int index) {
    cells.remove(index);
  }

  public boolean isBlank(final int index) {
    return !cells.containsKey(index);
  }

  public boolean isEmpty() {
    return cells.isEmpty();
  }

  public int size() {
    return cells.size();
  }

  public Optional<Integer> firstIndex() {
    return cells.isEmpty() ? Optional.<Integer>empty() : Optional.of(cells.firstKey());
  }

  public Optional<Integer> lastIndex() {
    return cells.isEmpty() ? Optional.<Integer>empty() : Optional.of(cells.lastKey());
  }

  /**
   * Read-only view of the written cells ordered by index.
   */
  public SortedMap<Integer, String> asMap() {
    return Collections.unmodifiableSortedMap(cells);
  }

  public Tape copy() {
    final Tape copy = new Tape();
    copy.cells.putAll(cells);
    return copy;
  }

  /**
   * Cells from the first to the last written index, separated by a single space, with blanks in
   * between shown as "None". An empty tape renders as the empty string.
   */
  public String render() {
    if (cells.isEmpty()) {
      return "";
    }
    final StringBuilder builder = new StringBuilder();
    final long first = cells.firstKey();
    final long last = cells.lastKey();
    for (long index = first; index <= last; index++) {
      if (index > first) {
        builder.append(' ');
      }
      builder.append(read((int) index));
    }
    return builder.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Tape)) {
      return false;
    }
    return cells.equals(((Tape) o).cells);
  }

  @Override
  public int hashCode() {
    return cells.hashCode();
  }

  @Override
  public String toString() {
    return "Tape " + cells;
  }
}
