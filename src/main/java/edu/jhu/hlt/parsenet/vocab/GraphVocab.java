package edu.jhu.hlt.parsenet.vocab;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.log4j.Logger;

import edu.jhu.hlt.parsenet.data.ConllUReader;
import edu.jhu.hlt.parsenet.datatypes.Field;
import edu.jhu.hlt.parsenet.datatypes.Sentence;
import edu.jhu.hlt.parsenet.datatypes.Token;
import edu.jhu.hlt.parsenet.util.Counts;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;

/**
 * Labeled head attachments: the basic tree (HEAD and DEPREL columns) or the
 * first arc of the enhanced graph (DEPS column).
 *
 * A head is encoded as its offset from the dependent ("-1", "+2") or "root".
 * If factorized, a structure is two decisions, "&lt;prefix&gt;head" over
 * offsets and "&lt;prefix&gt;label" over relations. Otherwise it is a single
 * decision, named like the field, over joint "rel@offset" labels.
 */
public class GraphVocab extends Vocab {
  public static final Logger LOG = Logger.getLogger(GraphVocab.class);

  public static final String ROOT = "root";
  public static final String FALLBACK_REL = "dep";

  private static final String REL = "rel";
  private static final String HEAD = "head";
  private static final String JOINT = "joint";

  private final String headDecision;
  private final String labelDecision;
  private final boolean factorized;
  private final File file;
  private IndexTable rels, heads, joint;

  public GraphVocab(VocabKind kind, String prefix, ExperimentProperties config, File dir) {
    super(kind, config);
    this.headDecision = prefix + "head";
    this.labelDecision = prefix + "label";
    this.factorized = config.getBoolean(kind.getClassName(), "factorized", true);
    this.file = new File(dir, kind.getField() + ".lst");
  }

  public File getFile() {
    return file;
  }

  public String getHeadDecision() {
    return headDecision;
  }

  public String getLabelDecision() {
    return labelDecision;
  }

  @Override
  public boolean isFactorized() {
    return factorized;
  }

  @Override
  public List<String> getDecisions() {
    if (factorized)
      return Arrays.asList(headDecision, labelDecision);
    return Collections.singletonList(getField());
  }

  @Override
  public int size(String decision) {
    checkDecision(decision);
    checkPopulated();
    return table(decision).size();
  }

  private IndexTable table(String decision) {
    if (!factorized)
      return joint;
    return decision.equals(headDecision) ? heads : rels;
  }

  private boolean isTree() {
    return kind == VocabKind.DEPTREE;
  }

  /** (head, rel) of token i, or null if the column is empty. */
  private String[] arc(Token t) {
    if (isTree()) {
      String h = t.get(Field.HEAD);
      String r = t.get(Field.DEPREL);
      if (Field.EMPTY.equals(h) || Field.EMPTY.equals(r))
        return null;
      return new String[] {h, r};
    }
    String deps = t.get(Field.DEPS);
    if (Field.EMPTY.equals(deps))
      return null;
    String first = deps.split("\\|")[0];
    int colon = first.indexOf(':');
    if (colon < 0)
      return null;
    return new String[] {first.substring(0, colon), first.substring(colon + 1)};
  }

  static String offset(int dependent, int head) {
    if (head == 0)
      return ROOT;
    int d = head - dependent;
    return d > 0 ? "+" + d : String.valueOf(d);
  }

  /** 0 (root) for unknown or out of range offsets. */
  static int head(int dependent, String offset, int sentenceLength) {
    if (offset == null || ROOT.equals(offset) || IndexTable.UNK.equals(offset))
      return 0;
    int h = dependent + Integer.parseInt(offset.startsWith("+") ? offset.substring(1) : offset);
    return h < 0 || h > sentenceLength ? 0 : h;
  }

  private static String jointLabel(String rel, String offset) {
    return rel + "@" + offset;
  }

  @Override
  public int[] indices(Sentence s, String decision) {
    checkDecision(decision);
    checkPopulated();
    int[] idx = new int[s.size()];
    for (int i = 0; i < idx.length; i++) {
      Token t = s.getToken(i);
      String[] arc = arc(t);
      if (arc == null)
        continue;
      // Enhanced heads may be empty nodes ("3.1"), which we can't encode
      if (arc[0].indexOf('.') >= 0)
        continue;
      String off = offset(t.getId(), Integer.parseInt(arc[0]));
      if (!factorized)
        idx[i] = joint.lookupIndex(jointLabel(arc[1], off));
      else if (decision.equals(headDecision))
        idx[i] = heads.lookupIndex(off);
      else
        idx[i] = rels.lookupIndex(arc[1]);
    }
    return idx;
  }

  @Override
  public void assign(Sentence s, Map<String, int[]> predictions) {
    checkPopulated();
    for (String d : getDecisions()) {
      int[] p = predictions.get(d);
      if (p == null || p.length != s.size())
        throw new IllegalArgumentException("need one " + d + " prediction per token");
    }
    for (int i = 0; i < s.size(); i++) {
      String off, rel;
      if (factorized) {
        off = heads.lookupString(predictions.get(headDecision)[i]);
        rel = rels.lookupString(predictions.get(labelDecision)[i]);
      } else {
        String label = joint.lookupString(predictions.get(getField())[i]);
        int at = label.lastIndexOf('@');
        rel = at < 0 ? IndexTable.UNK : label.substring(0, at);
        off = at < 0 ? ROOT : label.substring(at + 1);
      }
      if (IndexTable.UNK.equals(rel))
        rel = FALLBACK_REL;
      Token t = s.getToken(i);
      int h = head(t.getId(), off, s.size());
      if (isTree()) {
        t.set(Field.HEAD, String.valueOf(h));
        t.set(Field.DEPREL, rel);
      } else {
        t.set(Field.DEPS, h + ":" + rel);
      }
    }
  }

  @Override
  public boolean load() {
    if (!file.isFile())
      return false;
    IndexTable r = new IndexTable(), h = new IndexTable(), j = new IndexTable();
    try {
      LineIterator it = FileUtils.lineIterator(file, "UTF-8");
      try {
        while (it.hasNext()) {
          String line = it.nextLine();
          if (line.isEmpty())
            continue;
          String[] toks = line.split("\t");
          if (toks.length != 3)
            throw new IOException("bad line in " + file.getPath() + ": " + line);
          IndexTable t = REL.equals(toks[0]) ? r : HEAD.equals(toks[0]) ? h : j;
          t.add(toks[1], Integer.parseInt(toks[2]));
        }
      } finally {
        it.close();
      }
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    rels = r;
    heads = h;
    joint = j;
    populated = true;
    LOG.info("[load] " + this + " from " + file.getPath());
    return true;
  }

  @Override
  public void count(List<File> trainFiles) {
    if (trainFiles.isEmpty())
      throw new IllegalArgumentException("no training files to count " + getClassName() + " from");
    Counts<String> cr = new Counts<>(), ch = new Counts<>(), cj = new Counts<>();
    try {
      for (File f : trainFiles) {
        try (ConllUReader reader = new ConllUReader(f)) {
          while (reader.hasNext()) {
            for (Token t : reader.next().getTokens()) {
              String[] arc = arc(t);
              if (arc == null || arc[0].indexOf('.') >= 0)
                continue;
              String off = offset(t.getId(), Integer.parseInt(arc[0]));
              cr.increment(arc[1]);
              ch.increment(off);
              cj.increment(jointLabel(arc[1], off));
            }
          }
        }
      }
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    int minCount = config.getInt(getClassName(), "min_occur_count", 1);
    rels = IndexTable.fromCounts(cr, minCount);
    heads = IndexTable.fromCounts(ch, minCount);
    joint = IndexTable.fromCounts(cj, minCount);
    populated = true;
    LOG.info("[count] " + this + " from " + trainFiles.size() + " files, minCount=" + minCount);
    save();
  }

  private void save() {
    try {
      FileUtils.forceMkdirParent(file);
      try (BufferedWriter w = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
        write(w, REL, rels);
        write(w, HEAD, heads);
        write(w, JOINT, joint);
      }
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  private static void write(BufferedWriter w, String name, IndexTable t) throws IOException {
    for (int i = 1; i < t.size(); i++) {
      w.write(name + "\t" + t.lookupString(i) + "\t" + t.getCount(i));
      w.newLine();
    }
  }
}
