package edu.jhu.hlt.parsenet.datatypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A CoNLL-U sentence: comment lines, the word tokens the model sees, and any
 * other lines (multi-word tokens, empty nodes) which are written back out
 * untouched at their original positions.
 */
public class Sentence {

  private final List<String> comments;
  private final List<Token> tokens;
  // Non-word lines keyed by how many word tokens precede them
  private final List<String> extraLines;
  private final List<Integer> extraPositions;

  public Sentence(List<String> comments, List<Token> tokens) {
    this(comments, tokens, Collections.<String>emptyList(), Collections.<Integer>emptyList());
  }

  public Sentence(List<String> comments, List<Token> tokens,
      List<String> extraLines, List<Integer> extraPositions) {
    if (extraLines.size() != extraPositions.size())
      throw new IllegalArgumentException();
    this.comments = new ArrayList<>(comments);
    this.tokens = new ArrayList<>(tokens);
    this.extraLines = new ArrayList<>(extraLines);
    this.extraPositions = new ArrayList<>(extraPositions);
  }

  public int size() {
    return tokens.size();
  }

  public Token getToken(int i) {
    return tokens.get(i);
  }

  public List<Token> getTokens() {
    return Collections.unmodifiableList(tokens);
  }

  public List<String> getComments() {
    return Collections.unmodifiableList(comments);
  }

  /** A deep copy, so predictions can be written into it. */
  public Sentence copy() {
    List<Token> t = new ArrayList<>(tokens.size());
    for (Token tok : tokens)
      t.add(tok.copy());
    return new Sentence(comments, t, extraLines, extraPositions);
  }

  /** CoNLL-U lines for this sentence, without the trailing blank line. */
  public List<String> toLines() {
    List<String> lines = new ArrayList<>(comments);
    int e = 0;
    for (int i = 0; i <= tokens.size(); i++) {
      while (e < extraLines.size() && extraPositions.get(e) == i) {
        lines.add(extraLines.get(e));
        e++;
      }
      if (i < tokens.size())
        lines.add(tokens.get(i).toString());
    }
    return lines;
  }

  @Override
  public String toString() {
    return String.join("\n", toLines());
  }
}
