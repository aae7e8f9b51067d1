package edu.jhu.hlt.parsenet.network;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Every parameter of a composition, by name. The TRAIN and DEV graphs of a
 * network read the same store, a PARSE graph is built against a fresh one.
 */
public class ParameterStore {
  public static final Logger LOG = Logger.getLogger(ParameterStore.class);

  public static interface Initializer {
    void init(Parameter p);
  }

  private final Map<String, Parameter> params = new LinkedHashMap<>();

  /**
   * @param reuse if false the parameter must not exist yet and is created, if
   * true it must already exist (with the same shape).
   * @throws IllegalStateException if either requirement does not hold.
   */
  public Parameter getOrCreate(String name, int rows, int cols, boolean persistent,
      Initializer init, boolean reuse) {
    Parameter p = params.get(name);
    if (reuse) {
      if (p == null)
        throw new IllegalStateException("reuse requested but " + name + " does not exist");
      if (!p.sameShape(rows, cols))
        throw new IllegalStateException("reuse of " + p + " with shape " + rows + "x" + cols);
      return p;
    }
    if (p != null)
      throw new IllegalStateException(name + " already exists, did you mean to reuse it?");
    p = new Parameter(name, rows, cols, persistent);
    init.init(p);
    params.put(name, p);
    if (LOG.isDebugEnabled())
      LOG.debug("[getOrCreate] " + p);
    return p;
  }

  public Parameter get(String name) {
    return params.get(name);
  }

  public boolean contains(String name) {
    return params.containsKey(name);
  }

  public boolean hasScope(String scope) {
    for (Parameter p : params.values())
      if (p.getScope().equals(scope))
        return true;
    return false;
  }

  public List<Parameter> inScope(String scope) {
    List<Parameter> l = new ArrayList<>();
    for (Parameter p : params.values())
      if (p.getScope().equals(scope))
        l.add(p);
    return l;
  }

  /** What an optimizer for the network named scope may update. */
  public List<Parameter> trainable(String scope) {
    List<Parameter> l = new ArrayList<>();
    for (Parameter p : inScope(scope))
      if (p.isTrainable())
        l.add(p);
    return l;
  }

  /** What a checkpoint for the network named scope contains. */
  public List<Parameter> persistent(String scope) {
    List<Parameter> l = new ArrayList<>();
    for (Parameter p : inScope(scope))
      if (p.isPersistent())
        l.add(p);
    return l;
  }

  public void freeze(String scope) {
    int n = 0;
    for (Parameter p : inScope(scope)) {
      p.freeze();
      n++;
    }
    LOG.info("[freeze] froze " + n + " parameters of " + scope);
  }

  public void zeroGradients() {
    for (Parameter p : params.values())
      p.zeroGradient();
  }

  public Collection<Parameter> all() {
    return Collections.unmodifiableCollection(params.values());
  }

  public int size() {
    return params.size();
  }
}
