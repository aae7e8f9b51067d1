package edu.jhu.hlt.parsenet.datatypes;

/**
 * The ten CoNLL-U columns, in file order.
 */
public enum Field {
  ID,
  FORM,
  LEMMA,
  UPOS,
  XPOS,
  FEATS,
  HEAD,
  DEPREL,
  DEPS,
  MISC;

  public static final String EMPTY = "_";

  public int column() {
    return ordinal();
  }
}
