package edu.jhu.hlt.parsenet.vocab;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
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
 * Strings in one token column (form, lemma, tags, features). Strings seen
 * fewer than min_occur_count times in training map to {@link IndexTable#UNK}.
 */
public class TokenVocab extends Vocab {
  public static final Logger LOG = Logger.getLogger(TokenVocab.class);

  private final Field column;
  private final File file;
  private IndexTable table;

  public TokenVocab(VocabKind kind, Field column, ExperimentProperties config, File dir) {
    super(kind, config);
    this.column = column;
    this.file = new File(dir, kind.getField() + ".lst");
  }

  public Field getColumn() {
    return column;
  }

  public File getFile() {
    return file;
  }

  @Override
  public boolean isFactorized() {
    return false;
  }

  @Override
  public List<String> getDecisions() {
    return Collections.singletonList(getField());
  }

  @Override
  public int size(String decision) {
    checkDecision(decision);
    checkPopulated();
    return table.size();
  }

  public int lookupIndex(String s) {
    checkPopulated();
    return table.lookupIndex(s);
  }

  public String lookupString(int i) {
    checkPopulated();
    return table.lookupString(i);
  }

  @Override
  public int[] indices(Sentence s, String decision) {
    checkDecision(decision);
    checkPopulated();
    int[] idx = new int[s.size()];
    for (int i = 0; i < idx.length; i++)
      idx[i] = table.lookupIndex(s.getToken(i).get(column));
    return idx;
  }

  @Override
  public void assign(Sentence s, Map<String, int[]> predictions) {
    checkPopulated();
    int[] p = predictions.get(getField());
    if (p == null || p.length != s.size())
      throw new IllegalArgumentException("need one " + getField() + " prediction per token");
    for (int i = 0; i < p.length; i++) {
      String value = p[i] == 0 ? Field.EMPTY : table.lookupString(p[i]);
      s.getToken(i).set(column, value);
    }
  }

  @Override
  public boolean load() {
    if (!file.isFile())
      return false;
    IndexTable t = new IndexTable();
    try {
      LineIterator it = FileUtils.lineIterator(file, "UTF-8");
      try {
        while (it.hasNext()) {
          String line = it.nextLine();
          if (line.isEmpty())
            continue;
          int tab = line.lastIndexOf('\t');
          t.add(line.substring(0, tab), Integer.parseInt(line.substring(tab + 1)));
        }
      } finally {
        it.close();
      }
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    table = t;
    populated = true;
    LOG.info("[load] " + this + " from " + file.getPath());
    return true;
  }

  @Override
  public void count(List<File> trainFiles) {
    if (trainFiles.isEmpty())
      throw new IllegalArgumentException("no training files to count " + getClassName() + " from");
    Counts<String> c = new Counts<>();
    try {
      for (File f : trainFiles) {
        try (ConllUReader r = new ConllUReader(f)) {
          while (r.hasNext()) {
            for (Token t : r.next().getTokens()) {
              String v = t.get(column);
              if (!Field.EMPTY.equals(v))
                c.increment(v);
            }
          }
        }
      }
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    int minCount = config.getInt(getClassName(), "min_occur_count", 1);
    table = IndexTable.fromCounts(c, minCount);
    populated = true;
    LOG.info("[count] " + this + " from " + trainFiles.size() + " files, minCount=" + minCount);
    save();
  }

  private void save() {
    try {
      FileUtils.forceMkdirParent(file);
      try (BufferedWriter w = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
        for (int i = 1; i < table.size(); i++) {
          w.write(table.lookupString(i) + "\t" + table.getCount(i));
          w.newLine();
        }
      }
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}
