package edu.jhu.hlt.parsenet.data;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.apache.log4j.Logger;

import com.google.common.collect.Lists;

import edu.jhu.hlt.parsenet.datatypes.Sentence;
import edu.jhu.hlt.parsenet.util.BatchProvider;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;
import edu.jhu.hlt.parsenet.vocab.Vocab;

/**
 * The rows (sentences) of one or more CoNLL-U files, addressed by a global
 * row index, plus the vocabs used to turn rows into index tensors.
 */
public class Dataset {
  public static final Logger LOG = Logger.getLogger(Dataset.class);

  private final List<File> files;
  private final List<Sentence> rows;
  private final int[] fileStarts;   // fileStarts[i] = index of first row in file i, length numFiles+1
  private final List<Vocab> vocabs;
  private final int batchSize;
  private final BatchProvider batches;

  public Dataset(List<File> files, Collection<Vocab> vocabs, int batchSize, Random rand) {
    this.files = new ArrayList<>(files);
    this.rows = new ArrayList<>();
    this.fileStarts = new int[files.size() + 1];
    for (int i = 0; i < files.size(); i++) {
      fileStarts[i] = rows.size();
      try {
        rows.addAll(ConllUReader.readAll(files.get(i)));
      } catch (IOException e) {
        throw new RuntimeException(e);
      }
    }
    fileStarts[files.size()] = rows.size();
    this.vocabs = new ArrayList<>(vocabs);
    this.batchSize = batchSize;
    this.batches = new BatchProvider(rand, rows.size());
    LOG.info("[init] read " + rows.size() + " sentences from " + files.size() + " files");
  }

  /** A dataset of sentences which are already in memory, seen as one file. */
  public Dataset(File name, List<Sentence> sentences, Collection<Vocab> vocabs, int batchSize, Random rand) {
    this.files = Collections.singletonList(name);
    this.rows = new ArrayList<>(sentences);
    this.fileStarts = new int[] {0, rows.size()};
    this.vocabs = new ArrayList<>(vocabs);
    this.batchSize = batchSize;
    this.batches = new BatchProvider(rand, rows.size());
  }

  /**
   * @param section config section (a network class name).
   * @param key e.g. "train_conllus".
   */
  public static Dataset fromConfig(ExperimentProperties config, String section, String key,
      Collection<Vocab> vocabs, Random rand) {
    List<File> files = config.getFiles(section, key);
    int batchSize = config.getInt(section, "batch_size");
    LOG.info("[fromConfig] " + key + "=" + files);
    return new Dataset(files, vocabs, batchSize, rand);
  }

  public List<File> getFiles() {
    return Collections.unmodifiableList(files);
  }

  public int numFiles() {
    return files.size();
  }

  public int size() {
    return rows.size();
  }

  public int getBatchSize() {
    return batchSize;
  }

  /** One pass over every row in a new random order. */
  public Iterator<List<Integer>> shuffledBatchIterator() {
    return batches.shuffledPass(batchSize).iterator();
  }

  /** Every row of file i, in file order. */
  public Iterator<List<Integer>> fileBatchIterator(int i) {
    return rowBatches(fileStarts[i], fileStarts[i + 1]).iterator();
  }

  /** Every row, in order. */
  public Iterator<List<Integer>> batchIterator() {
    return rowBatches(0, rows.size()).iterator();
  }

  private List<List<Integer>> rowBatches(int start, int end) {
    List<Integer> idx = new ArrayList<>(end - start);
    for (int i = start; i < end; i++)
      idx.add(i);
    return Lists.partition(idx, batchSize);
  }

  /** Index tensors for every decision of every vocab, for the given rows. */
  public Batch setPlaceholders(List<Integer> indices) {
    List<Sentence> sents = new ArrayList<>(indices.size());
    for (int i : indices)
      sents.add(rows.get(i));
    Map<String, int[][]> features = new LinkedHashMap<>();
    for (Vocab v : vocabs) {
      for (String d : v.getDecisions()) {
        int[][] f = new int[sents.size()][];
        for (int s = 0; s < sents.size(); s++)
          f[s] = v.indices(sents.get(s), d);
        features.put(d, f);
      }
    }
    return new Batch(new ArrayList<>(indices), sents, features);
  }

  /** Copies of the given rows, safe to overwrite with predictions. */
  public List<Sentence> getTokens(List<Integer> indices) {
    List<Sentence> copies = new ArrayList<>(indices.size());
    for (int i : indices)
      copies.add(rows.get(i).copy());
    return copies;
  }

  public Sentence get(int row) {
    return rows.get(row);
  }
}
