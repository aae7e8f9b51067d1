package edu.jhu.hlt.parsenet.parse;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.log4j.Logger;

import edu.jhu.hlt.parsenet.data.Batch;
import edu.jhu.hlt.parsenet.data.ConllUWriter;
import edu.jhu.hlt.parsenet.data.Dataset;
import edu.jhu.hlt.parsenet.datatypes.Sentence;
import edu.jhu.hlt.parsenet.evaluation.GraphOutputs;
import edu.jhu.hlt.parsenet.evaluation.Probabilities;
import edu.jhu.hlt.parsenet.evaluation.Scores;
import edu.jhu.hlt.parsenet.network.Graph;
import edu.jhu.hlt.parsenet.util.Timer;
import edu.jhu.hlt.parsenet.vocab.Vocab;

/**
 * Predicts the output fields of every sentence of a dataset, a file at a
 * time and in fixed size batches, and writes each file back out as CoNLL-U
 * with the predicted columns filled in. All other columns, comments and
 * multi-word lines are kept as they were.
 *
 * Unless told otherwise, input dir/name.conllu ends up as
 * save_dir/parsed/dir/name.conllu (an absolute dir loses its leading root).
 */
public class BatchedParser {
  public static final Logger LOG = Logger.getLogger(BatchedParser.class);

  public static final String PARSED = "parsed";

  private final File saveDir;
  private final PredictionCache cache = new PredictionCache();

  public BatchedParser(File saveDir) {
    this.saveDir = saveDir;
  }

  /** Where predictions for input go when no output dir is given. */
  public File defaultOutputDir(File input) {
    return new File(new File(saveDir, PARSED), FilenameUtils.getPath(input.getPath()));
  }

  /**
   * Parses the first (only) file of dataset.
   * @param outputDir may be null, see {@link #defaultOutputDir(File)}.
   * @param outputFilename may be null, meaning the input file's name.
   * @return the file written.
   */
  public File parseFile(Dataset dataset, Graph graph, GraphOutputs outputs,
      File outputDir, String outputFilename) {
    if (dataset.numFiles() != 1)
      throw new UsageException("parseFile needs exactly one file, got " + dataset.getFiles());
    Timer t = Timer.start("parseFile");
    File out = parse(dataset, 0, graph, outputs, outputDir, outputFilename);
    t.stop();
    LOG.info(String.format("[parseFile] parsing 1 file took %.1f seconds", t.totalTimeInSeconds()));
    return out;
  }

  /**
   * Parses every file of dataset, each to its own output file with the same
   * name as the input.
   * @param outputDir may be null, see {@link #defaultOutputDir(File)}.
   */
  public List<File> parseFiles(Dataset dataset, Graph graph, GraphOutputs outputs, File outputDir) {
    Timer t = Timer.start("parseFiles");
    List<File> written = new ArrayList<>();
    for (int i = 0; i < dataset.numFiles(); i++)
      written.add(parse(dataset, i, graph, outputs, outputDir, null));
    t.stop();
    LOG.info(String.format("[parseFiles] parsing %d file%s took %.1f seconds",
        written.size(), written.size() == 1 ? "" : "s", t.totalTimeInSeconds()));
    return written;
  }

  private File parse(Dataset dataset, int fileIndex, Graph graph, GraphOutputs outputs,
      File outputDir, String outputFilename) {
    File input = dataset.getFiles().get(fileIndex);
    outputs.restartTimer();
    Scores scores = new Scores();
    Iterator<List<Integer>> it = dataset.fileBatchIterator(fileIndex);
    while (it.hasNext()) {
      List<Integer> indices = it.next();
      Batch batch = dataset.setPlaceholders(indices);
      Probabilities probs = graph.run(batch);
      scores.add(outputs.score(batch, probs));
      Map<String, int[][]> preds = outputs.probsToPreds(probs);
      List<Sentence> tokens = dataset.getTokens(indices);
      for (int s = 0; s < tokens.size(); s++) {
        for (Vocab v : outputs.getOutputVocabs()) {
          Map<String, int[]> sp = new HashMap<>();
          for (String d : v.getDecisions())
            sp.put(d, preds.get(d)[s]);
          v.assign(tokens.get(s), sp);
        }
      }
      cache.put(indices, tokens);
    }

    File dir = outputDir != null ? outputDir : defaultOutputDir(input);
    File out = new File(dir, outputFilename != null ? outputFilename : input.getName());
    try {
      FileUtils.forceMkdir(dir);
      try (Writer w = Files.newBufferedWriter(out.toPath(), StandardCharsets.UTF_8)) {
        cache.dump(new ConllUWriter(w));
      }
    } catch (IOException e) {
      throw new RuntimeException(e);
    } finally {
      cache.clear();
    }
    LOG.info(String.format("[parse] %s -> %s, %d tokens, accuracy against the input columns %.2f, %.1f seconds",
        input.getPath(), out.getPath(), scores.getNumTokens(), 100 * scores.getAccuracy(),
        outputs.secondsSinceRestart()));
    return out;
  }
}
