package edu.jhu.hlt.parsenet.experiment;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import edu.jhu.hlt.parsenet.network.BaseNetwork;
import edu.jhu.hlt.parsenet.network.Networks;
import edu.jhu.hlt.parsenet.parse.UsageException;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;
import edu.jhu.hlt.parsenet.vocab.VocabRegistry;

/**
 * Command line entry point.
 * <pre>
 * ParserMain train --config parser.properties --network ParserNetwork [key=value ...]
 * ParserMain parse --config parser.properties --network ParserNetwork
 *     [--output-dir dir] [--output-file name] file.conllu ... [key=value ...]
 * </pre>
 * key=value arguments override the config file, e.g. "ParserNetwork.max_steps=100".
 */
public class ParserMain {
  public static final Logger LOG = Logger.getLogger(ParserMain.class);

  public static final String USAGE =
      "usage: ParserMain (train|parse) --config FILE --network CLASS"
      + " [--output-dir DIR] [--output-file NAME] [FILE ...] [key=value ...]";

  public static class Options {
    public String command;
    public File config;
    public String network;
    public File outputDir;
    public String outputFile;
    public List<File> files = new ArrayList<>();
    public List<String> overrides = new ArrayList<>();

    /** @throws UsageException for anything malformed. */
    public static Options parse(String[] args) {
      if (args.length == 0)
        throw new UsageException("no command given");
      Options o = new Options();
      o.command = args[0];
      if (!"train".equals(o.command) && !"parse".equals(o.command))
        throw new UsageException("unknown command: " + o.command);
      for (int i = 1; i < args.length; i++) {
        String a = args[i];
        if (a.startsWith("--")) {
          if (i + 1 >= args.length)
            throw new UsageException(a + " needs a value");
          String v = args[++i];
          switch (a) {
            case "--config":
              o.config = new File(v);
              break;
            case "--network":
              o.network = v;
              break;
            case "--output-dir":
              o.outputDir = new File(v);
              break;
            case "--output-file":
              o.outputFile = v;
              break;
            default:
              throw new UsageException("unknown option: " + a);
          }
        } else if (a.indexOf('=') > 0) {
          o.overrides.add(a);
        } else {
          o.files.add(new File(a));
        }
      }
      if (o.network == null)
        throw new UsageException("--network is required");
      if ("train".equals(o.command)) {
        if (!o.files.isEmpty() || o.outputDir != null || o.outputFile != null)
          throw new UsageException("train reads its files from the config, got " + o.files);
      } else if (o.files.isEmpty()) {
        throw new UsageException("parse needs at least one file");
      } else if (o.outputFile != null && o.files.size() > 1) {
        throw new UsageException("--output-file needs exactly one input file, got " + o.files);
      }
      return o;
    }
  }

  public static ExperimentProperties loadConfig(Options o) throws IOException {
    ExperimentProperties config = ExperimentProperties.withDefaults();
    if (o.config != null)
      config.load(o.config);
    config.putAll(o.overrides.toArray(new String[0]));
    return config;
  }

  public static void main(String[] args) throws Exception {
    Options o;
    try {
      o = Options.parse(args);
    } catch (UsageException e) {
      System.err.println(e.getMessage());
      System.err.println(USAGE);
      System.exit(2);
      return;
    }
    ExperimentProperties config = loadConfig(o);

    String level = config.getString(o.network, "log_level", "INFO");
    Logger.getRootLogger().setLevel(Level.toLevel(level, Level.INFO));
    LOG.info("[main] device=" + config.getString(o.network, "device", "cpu")
        + " (computation runs on the JVM, this is only recorded)");

    VocabRegistry registry = new VocabRegistry(config);
    BaseNetwork network = Networks.build(o.network, registry, config);

    if ("train".equals(o.command)) {
      CountDownLatch finished = new CountDownLatch(1);
      Thread hook = new Thread(() -> {
        LOG.info("[main] shutting down, asking " + network.getClassName() + " to stop");
        network.requestStop();
        try {
          finished.await(1, TimeUnit.MINUTES);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      });
      Runtime.getRuntime().addShutdownHook(hook);
      try {
        network.train();
      } finally {
        finished.countDown();
      }
      LOG.info("[main] config used:\n" + config);
    } else {
      network.parse(o.files, o.outputDir, o.outputFile);
    }
  }
}
