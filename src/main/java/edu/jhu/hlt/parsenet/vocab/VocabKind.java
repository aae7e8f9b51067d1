package edu.jhu.hlt.parsenet.vocab;

import java.io.File;

import edu.jhu.hlt.parsenet.datatypes.Field;
import edu.jhu.hlt.parsenet.network.ConfigurationException;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;

/**
 * Every kind of vocabulary a network may declare, by the class name used in
 * configuration files (e.g. "input_vocab_classes = FormVocab UPOSVocab").
 */
public enum VocabKind {
  ID_INDEX("IDIndexVocab", "id"),
  FORM("FormVocab", "form"),
  LEMMA("LemmaVocab", "lemma"),
  UPOS("UPOSVocab", "upos"),
  XPOS("XPOSVocab", "xpos"),
  UFEATS("UFeatsVocab", "ufeats"),
  DEPTREE("DepTreeVocab", "deprel"),
  SEMGRAPH("SemGraphVocab", "semrel");

  private final String className;
  private final String field;

  VocabKind(String className, String field) {
    this.className = className;
    this.field = field;
  }

  public String getClassName() {
    return className;
  }

  public String getField() {
    return field;
  }

  public static VocabKind forClassName(String className) {
    for (VocabKind k : values())
      if (k.className.equals(className))
        return k;
    throw new ConfigurationException("unknown vocab class: " + className
        + ", expected one of " + classNames());
  }

  private static String classNames() {
    StringBuilder sb = new StringBuilder();
    for (VocabKind k : values()) {
      if (sb.length() > 0)
        sb.append(", ");
      sb.append(k.className);
    }
    return sb.toString();
  }

  /** A new, not yet loaded or counted, instance whose files live in dir. */
  public Vocab create(ExperimentProperties config, File dir) {
    switch (this) {
      case ID_INDEX:
        return new IndexVocab(config);
      case FORM:
        return new TokenVocab(this, Field.FORM, config, dir);
      case LEMMA:
        return new TokenVocab(this, Field.LEMMA, config, dir);
      case UPOS:
        return new TokenVocab(this, Field.UPOS, config, dir);
      case XPOS:
        return new TokenVocab(this, Field.XPOS, config, dir);
      case UFEATS:
        return new TokenVocab(this, Field.FEATS, config, dir);
      case DEPTREE:
        return new GraphVocab(this, "dep", config, dir);
      case SEMGRAPH:
        return new GraphVocab(this, "sem", config, dir);
      default:
        throw new RuntimeException("unhandled: " + this);
    }
  }
}
