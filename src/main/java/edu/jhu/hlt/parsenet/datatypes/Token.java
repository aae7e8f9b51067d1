package edu.jhu.hlt.parsenet.datatypes;

import java.util.Arrays;

/**
 * One line of a CoNLL-U file. Values are kept as strings, "_" for missing.
 */
public class Token {

  private final String[] columns;

  public Token(String[] columns) {
    if (columns.length != Field.values().length)
      throw new IllegalArgumentException("expected " + Field.values().length
          + " columns but got " + columns.length + ": " + Arrays.toString(columns));
    this.columns = Arrays.copyOf(columns, columns.length);
  }

  public static Token parse(String line) {
    return new Token(line.split("\t", -1));
  }

  public String get(Field f) {
    return columns[f.column()];
  }

  public void set(Field f, String value) {
    if (value == null || value.isEmpty())
      value = Field.EMPTY;
    columns[f.column()] = value;
  }

  /** 1-based position in the sentence. */
  public int getId() {
    return Integer.parseInt(columns[Field.ID.column()]);
  }

  /** -1 if the head column is missing. */
  public int getHead() {
    String h = get(Field.HEAD);
    return Field.EMPTY.equals(h) ? -1 : Integer.parseInt(h);
  }

  /**
   * Multi-word tokens (1-2) and empty nodes (3.1) are not rows for the model,
   * they are only carried through to the output.
   */
  public static boolean isWordLine(String line) {
    int tab = line.indexOf('\t');
    String id = tab < 0 ? line : line.substring(0, tab);
    return id.indexOf('-') < 0 && id.indexOf('.') < 0;
  }

  public Token copy() {
    return new Token(columns);
  }

  @Override
  public String toString() {
    return String.join("\t", columns);
  }
}
