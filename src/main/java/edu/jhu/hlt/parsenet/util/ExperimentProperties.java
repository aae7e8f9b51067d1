package edu.jhu.hlt.parsenet.util;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.log4j.Logger;

/**
 * Configuration for a run. Values are looked up by (section, key): first
 * "section.key", then the global "key", then the bundled defaults. Sections
 * are the class names of networks and vocabularies, so a network can
 * override e.g. "save_dir" without touching anybody else.
 *
 * Methods with a default value return it when the key is missing everywhere
 * and also record it in this map, so that {@link #toString()} shows every
 * value a run actually used.
 */
public class ExperimentProperties extends Properties {
  private static final long serialVersionUID = 1L;
  public static final Logger LOG = Logger.getLogger(ExperimentProperties.class);

  public static final String DEFAULTS_RESOURCE = "parsenet-defaults.properties";

  public ExperimentProperties() {
    super();
  }

  public ExperimentProperties(Properties defaults) {
    super(defaults);
  }

  /** An empty config whose fallbacks are the bundled defaults. */
  public static ExperimentProperties withDefaults() {
    Properties defaults = new Properties();
    try (InputStream is = ExperimentProperties.class.getClassLoader()
        .getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (is == null)
        throw new IllegalStateException("missing resource: " + DEFAULTS_RESOURCE);
      defaults.load(is);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    return new ExperimentProperties(defaults);
  }

  public void load(File f) throws IOException {
    LOG.info("reading config from " + f.getPath());
    try (Reader r = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8)) {
      load(r);
    }
  }

  /** Accepts "key=value" pairs, e.g. trailing command line arguments. */
  public void putAll(String[] keyValues) {
    for (String kv : keyValues) {
      int eq = kv.indexOf('=');
      if (eq <= 0)
        throw new IllegalArgumentException("expected key=value: " + kv);
      put(kv.substring(0, eq).trim(), kv.substring(eq + 1).trim());
    }
  }

  /**
   * Returns null if neither section.key nor key is set. Values set on this
   * object always win over the defaults, even a global key over a default
   * for the section.
   */
  public String lookup(String section, String key) {
    String value = find(this, section, key);
    if (value == null && defaults != null)
      value = find(defaults, section, key);
    return value;
  }

  // Hashtable.get only sees p's own entries, not its defaults
  private static String find(Properties p, String section, String key) {
    Object value = null;
    if (section != null)
      value = p.get(section + "." + key);
    if (value == null)
      value = p.get(key);
    return value instanceof String ? (String) value : null;
  }

  public boolean containsKey(String section, String key) {
    return lookup(section, key) != null;
  }

  private String require(String section, String key) {
    String value = lookup(section, key);
    if (value == null)
      throw new IllegalArgumentException("no value for " + qualify(section, key));
    return value.trim();
  }

  private static String qualify(String section, String key) {
    return section == null ? key : section + "." + key;
  }

  public int getInt(String section, String key) {
    return Integer.parseInt(require(section, key));
  }

  public int getInt(String section, String key, int defaultValue) {
    String value = lookup(section, key);
    if (value == null) {
      put(qualify(section, key), String.valueOf(defaultValue));
      return defaultValue;
    }
    return Integer.parseInt(value.trim());
  }

  public double getDouble(String section, String key) {
    return Double.parseDouble(require(section, key));
  }

  public double getDouble(String section, String key, double defaultValue) {
    String value = lookup(section, key);
    if (value == null) {
      put(qualify(section, key), String.valueOf(defaultValue));
      return defaultValue;
    }
    return Double.parseDouble(value.trim());
  }

  public boolean getBoolean(String section, String key) {
    return parseBoolean(section, key, require(section, key));
  }

  public boolean getBoolean(String section, String key, boolean defaultValue) {
    String value = lookup(section, key);
    if (value == null) {
      put(qualify(section, key), String.valueOf(defaultValue));
      return defaultValue;
    }
    return parseBoolean(section, key, value.trim());
  }

  // Boolean.parseBoolean is too forgiving, "ture" would silently be false
  private static boolean parseBoolean(String section, String key, String value) {
    if ("true".equalsIgnoreCase(value) || "yes".equalsIgnoreCase(value) || "1".equals(value))
      return true;
    if ("false".equalsIgnoreCase(value) || "no".equalsIgnoreCase(value) || "0".equals(value))
      return false;
    throw new IllegalArgumentException(qualify(section, key) + " is not a boolean: " + value);
  }

  public String getString(String section, String key) {
    return require(section, key);
  }

  public String getString(String section, String key, String defaultValue) {
    String value = lookup(section, key);
    if (value == null) {
      put(qualify(section, key), defaultValue);
      return defaultValue;
    }
    return value.trim();
  }

  /** Whitespace or comma separated list, empty if the key is missing or blank. */
  public List<String> getList(String section, String key) {
    String value = lookup(section, key);
    if (value == null || value.trim().isEmpty())
      return Collections.emptyList();
    List<String> items = new ArrayList<>();
    for (String s : value.trim().split("[\\s,]+"))
      if (!s.isEmpty())
        items.add(s);
    return items;
  }

  public File getFile(String section, String key) {
    return new File(require(section, key));
  }

  /**
   * Like {@link #getList(String, String)} but every item is a path which may
   * contain a glob pattern (e.g. "data/train/*.conllu"). Globs are expanded
   * and sorted, plain paths are returned as they are.
   */
  public List<File> getFiles(String section, String key) {
    List<File> files = new ArrayList<>();
    for (String item : getList(section, key)) {
      if (isGlob(item))
        files.addAll(expandGlob(item));
      else
        files.add(new File(item));
    }
    return files;
  }

  private static boolean isGlob(String path) {
    return path.indexOf('*') >= 0 || path.indexOf('?') >= 0 || path.indexOf('[') >= 0;
  }

  /** glob should look like "dir/**\/*.conllu" -- without the escape backslash of course */
  static List<File> expandGlob(String glob) {
    // Walk from the longest directory prefix that has no wildcards
    String[] parts = glob.split("/");
    int k = 0;
    while (k < parts.length - 1 && !isGlob(parts[k]))
      k++;
    String prefix = String.join("/", Arrays.copyOfRange(parts, 0, k));
    if (k > 0 && prefix.isEmpty())
      prefix = "/";
    Path root = prefix.isEmpty() ? Paths.get(".") : Paths.get(prefix);
    if (!Files.isDirectory(root)) {
      LOG.warn("[getFiles] no directory for glob " + glob);
      return Collections.emptyList();
    }
    String pattern;
    if (prefix.isEmpty())
      pattern = glob;
    else if (prefix.equals("/"))
      pattern = glob.substring(1);
    else
      pattern = glob.substring(prefix.length() + 1);
    PathMatcher pm = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    List<File> matches = new ArrayList<>();
    try {
      Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
        @Override
        public FileVisitResult visitFile(Path path, BasicFileAttributes attrs) {
          if (pm.matches(root.relativize(path)))
            matches.add(path.normalize().toFile());
          return FileVisitResult.CONTINUE;
        }
      });
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    Collections.sort(matches);
    return matches;
  }

  @Override
  public synchronized String toString() {
    List<String> keys = new ArrayList<>(stringPropertyNames());
    Collections.sort(keys);
    StringBuilder sb = new StringBuilder("(ExperimentProperties");
    for (String k : keys)
      sb.append("\n  " + k + "=" + getProperty(k));
    sb.append(')');
    return sb.toString();
  }

  /** Convenience for tests and programmatic setup. */
  public static ExperimentProperties of(String... keyValues) {
    ExperimentProperties p = withDefaults();
    p.putAll(keyValues);
    return p;
  }
}
