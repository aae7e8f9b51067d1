package edu.jhu.hlt.parsenet.train;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import edu.jhu.hlt.parsenet.network.Parameter;
import edu.jhu.hlt.parsenet.network.ParameterStore;

/**
 * Saves and restores the persistent parameters of one network (one scope of
 * a {@link ParameterStore}) as dir/ckpt-SCOPE-STEP. Only the checkpoint written
 * last is kept, per scope, so several networks may share a directory and a
 * new run into an old directory replaces the old run's checkpoint whatever
 * its step. Frozen sub-networks have their own scope, so they are never part
 * of a dependent network's checkpoint.
 *
 * Format: header, version, scope, step, epoch, number of parameters, then for
 * each: name, rows, cols, and rows*cols doubles in row major order.
 */
public class CheckpointManager {
  public static final Logger LOG = Logger.getLogger(CheckpointManager.class);

  public static final String PREFIX = "ckpt-";
  public static final String HEADER = "parsenet-checkpoint";
  public static final int VERSION = 1;
  private static final Pattern NAME = Pattern.compile(Pattern.quote(PREFIX) + "(.+)-(\\d+)");

  /** What a checkpoint says about when it was written. */
  public static class Info {
    public final File file;
    public final int step;
    public final int epoch;
    public Info(File file, int step, int epoch) {
      this.file = file;
      this.step = step;
      this.epoch = epoch;
    }
    @Override
    public String toString() {
      return "(Checkpoint " + file.getPath() + " step=" + step + " epoch=" + epoch + ")";
    }
  }

  private final File dir;
  private final String scope;
  private int numSaved;

  public CheckpointManager(File dir, String scope) {
    this.dir = dir;
    this.scope = scope;
    this.numSaved = 0;
  }

  public File getDir() {
    return dir;
  }

  public String getScope() {
    return scope;
  }

  public int getNumSaved() {
    return numSaved;
  }

  public static String fileName(String scope, int step) {
    return PREFIX + scope + "-" + step;
  }

  /** -1 if f is not named like a checkpoint. */
  public static int stepOf(File f) {
    Matcher m = NAME.matcher(f.getName());
    return m.matches() ? Integer.parseInt(m.group(2)) : -1;
  }

  /** null if f is not named like a checkpoint. */
  public static String scopeOf(File f) {
    Matcher m = NAME.matcher(f.getName());
    return m.matches() ? m.group(1) : null;
  }

  /**
   * Every checkpoint of scope in dir, oldest first: by modification time,
   * then by step.
   */
  public static List<File> checkpoints(File dir, String scope) {
    List<File> l = new ArrayList<>();
    File[] fs = dir.listFiles();
    if (fs == null)
      return l;
    for (File f : fs)
      if (f.isFile() && scope.equals(scopeOf(f)))
        l.add(f);
    Collections.sort(l, (a, b) -> {
      int c = Long.compare(a.lastModified(), b.lastModified());
      return c != 0 ? c : Integer.compare(stepOf(a), stepOf(b));
    });
    return l;
  }

  /** The checkpoint of scope written last in dir, or null. */
  public static File latest(File dir, String scope) {
    List<File> l = checkpoints(dir, scope);
    return l.isEmpty() ? null : l.get(l.size() - 1);
  }

  public List<File> checkpoints() {
    return checkpoints(dir, scope);
  }

  public File latest() {
    return latest(dir, scope);
  }

  /**
   * Writes the persistent parameters of this scope. The file appears
   * atomically, every other checkpoint of this scope is deleted afterwards.
   */
  public File save(ParameterStore store, int step, int epoch) {
    List<Parameter> params = store.persistent(scope);
    File f = new File(dir, fileName(scope, step));
    try {
      FileUtils.forceMkdir(dir);
      File tmp = File.createTempFile(PREFIX, ".tmp", dir);
      try (DataOutputStream dos = new DataOutputStream(
          new BufferedOutputStream(new FileOutputStream(tmp)))) {
        dos.writeUTF(HEADER);
        dos.writeInt(VERSION);
        dos.writeUTF(scope);
        dos.writeInt(step);
        dos.writeInt(epoch);
        dos.writeInt(params.size());
        for (Parameter p : params) {
          dos.writeUTF(p.getName());
          dos.writeInt(p.rows());
          dos.writeInt(p.cols());
          for (double v : p.getValues())
            dos.writeDouble(v);
        }
      }
      Files.move(tmp.toPath(), f.toPath(),
          StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    for (File old : checkpoints()) {
      if (!old.equals(f) && !old.delete())
        LOG.warn("[save] could not delete " + old.getPath());
    }
    numSaved++;
    LOG.info("[save] wrote " + params.size() + " parameters of " + scope + " to " + f.getPath());
    return f;
  }

  /**
   * Reads the checkpoint of this scope written last in dir into the persistent parameters of this
   * scope, which must already exist in store.
   *
   * @throws RestoreException if there is no checkpoint, it belongs to another
   * scope, or it lacks (or has a different shape for) one of the parameters.
   */
  public Info restore(ParameterStore store) {
    File f = latest();
    if (f == null)
      throw new RestoreException("no checkpoint for " + scope + " in " + dir.getPath());
    Map<String, double[]> values = new HashMap<>();
    Map<String, int[]> shapes = new HashMap<>();
    int step, epoch;
    try (DataInputStream dis = new DataInputStream(
        new BufferedInputStream(new FileInputStream(f)))) {
      String header = dis.readUTF();
      int version = dis.readInt();
      if (!HEADER.equals(header) || version != VERSION)
        throw new RestoreException(f.getPath() + " is not a checkpoint (version " + VERSION + ")");
      String fileScope = dis.readUTF();
      if (!scope.equals(fileScope))
        throw new RestoreException(f.getPath() + " holds " + fileScope + ", not " + scope);
      step = dis.readInt();
      epoch = dis.readInt();
      int n = dis.readInt();
      for (int i = 0; i < n; i++) {
        String name = dis.readUTF();
        int rows = dis.readInt();
        int cols = dis.readInt();
        double[] v = new double[rows * cols];
        for (int j = 0; j < v.length; j++)
          v[j] = dis.readDouble();
        values.put(name, v);
        shapes.put(name, new int[] {rows, cols});
      }
    } catch (IOException e) {
      throw new RestoreException("could not read " + f.getPath(), e);
    }

    List<Parameter> params = store.persistent(scope);
    for (Parameter p : params) {
      int[] shape = shapes.get(p.getName());
      if (shape == null)
        throw new RestoreException(f.getPath() + " has no value for " + p.getName());
      if (!p.sameShape(shape[0], shape[1]))
        throw new RestoreException(f.getPath() + " has shape " + shape[0] + "x" + shape[1]
            + " for " + p);
    }
    for (Parameter p : params)
      System.arraycopy(values.get(p.getName()), 0, p.getValues(), 0, p.size());
    if (values.size() > params.size())
      LOG.warn("[restore] " + f.getPath() + " has " + (values.size() - params.size())
          + " parameters which " + scope + " does not use");
    Info info = new Info(f, step, epoch);
    LOG.info("[restore] " + scope + " from " + info);
    return info;
  }
}
