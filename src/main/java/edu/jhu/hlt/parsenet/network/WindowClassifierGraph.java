package edu.jhu.hlt.parsenet.network;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.apache.commons.math3.util.FastMath;
import org.apache.log4j.Logger;

import edu.jhu.hlt.parsenet.data.Batch;
import edu.jhu.hlt.parsenet.evaluation.Probabilities;
import edu.jhu.hlt.parsenet.util.ExperimentProperties;
import edu.jhu.hlt.parsenet.vocab.Vocab;

/**
 * Classifies every token from a window around it. The input of a token is
 * the concatenation of
 * <ul>
 * <li>input_func(embedding) of every input decision at each of the conv_width
 * positions centered on the token (positions outside the sentence use a
 * padding row), and</li>
 * <li>output_func(W f + b) of the hidden features f of each frozen input
 * network.</li>
 * </ul>
 * followed by one hidden_func layer of hidden_size and a softmax per output
 * decision. The loss is the per-token mean of the summed cross entropies plus
 * l2_reg times half the squared norm of the weight matrices.
 */
public class WindowClassifierGraph implements Graph {
  public static final Logger LOG = Logger.getLogger(WindowClassifierGraph.class);

  public static class Config {
    public int inputSize = 50;
    public int hiddenSize = 100;
    public int outputSize = 50;
    public int convWidth = 3;
    public double inputKeepProb = 1;
    public double hiddenKeepProb = 1;
    public double outputKeepProb = 1;
    public Nonlinearity inputFunc = Nonlinearity.IDENTITY;
    public Nonlinearity hiddenFunc = Nonlinearity.RELU;
    public Nonlinearity outputFunc = Nonlinearity.RELU;
    public double l2Reg = 0;

    /** @throws ConfigurationException for unknown function names. */
    public static Config fromProperties(ExperimentProperties p, String section) {
      Config c = new Config();
      c.inputSize = p.getInt(section, "input_size", c.inputSize);
      c.hiddenSize = p.getInt(section, "hidden_size", c.hiddenSize);
      c.outputSize = p.getInt(section, "output_size", c.outputSize);
      c.convWidth = p.getInt(section, "conv_width", c.convWidth);
      c.inputKeepProb = p.getDouble(section, "input_keep_prob", c.inputKeepProb);
      c.hiddenKeepProb = p.getDouble(section, "hidden_keep_prob", c.hiddenKeepProb);
      c.outputKeepProb = p.getDouble(section, "output_keep_prob", c.outputKeepProb);
      c.inputFunc = Nonlinearity.forName(p.getString(section, "input_func", c.inputFunc.getName()));
      c.hiddenFunc = Nonlinearity.forName(p.getString(section, "hidden_func", c.hiddenFunc.getName()));
      c.outputFunc = Nonlinearity.forName(p.getString(section, "output_func", c.outputFunc.getName()));
      c.l2Reg = p.getDouble(section, "l2_reg", c.l2Reg);
      c.check();
      return c;
    }

    public void check() {
      if (inputSize < 1 || hiddenSize < 1 || outputSize < 1 || convWidth < 1)
        throw new ConfigurationException("sizes must be positive: " + this);
      checkProb("input_keep_prob", inputKeepProb);
      checkProb("hidden_keep_prob", hiddenKeepProb);
      checkProb("output_keep_prob", outputKeepProb);
    }

    private static void checkProb(String name, double p) {
      if (!(p > 0 && p <= 1))
        throw new ConfigurationException(name + " must be in (0, 1]: " + p);
    }

    @Override
    public String toString() {
      return "(Config input=" + inputSize + " hidden=" + hiddenSize + " output=" + outputSize
          + " conv=" + convWidth + " keep=" + inputKeepProb + "/" + hiddenKeepProb + "/" + outputKeepProb
          + " funcs=" + inputFunc.getName() + "/" + hiddenFunc.getName() + "/" + outputFunc.getName()
          + " l2=" + l2Reg + ")";
    }
  }

  private final String scope;
  private final Config conf;
  private final NetworkMode mode;
  private final Random rand;

  // one entry per input decision
  private final List<String> inputDecisions = new ArrayList<>();
  private final List<Parameter> embeddings = new ArrayList<>();

  // one entry per frozen input network
  private final List<Graph> inputGraphs;
  private final List<Parameter> projW = new ArrayList<>();
  private final List<Parameter> projB = new ArrayList<>();

  private final Parameter hiddenW, hiddenB;

  // one entry per output decision
  private final List<String> outputDecisions = new ArrayList<>();
  private final List<Parameter> outW = new ArrayList<>();
  private final List<Parameter> outB = new ArrayList<>();

  private final int embDim;   // width of the embedding part of the input
  private final int inputDim;

  public WindowClassifierGraph(String scope, Config conf, NetworkMode mode,
      List<Vocab> inputVocabs, List<Vocab> outputVocabs, List<Graph> inputGraphs,
      ParameterStore store, boolean reuse, Random rand) {
    this.scope = scope;
    this.conf = conf;
    this.mode = mode;
    this.rand = rand;
    this.inputGraphs = new ArrayList<>(inputGraphs);

    ParameterStore.Initializer glorot = p -> p.initUniform(rand);
    ParameterStore.Initializer zero = p -> {};
    ParameterStore.Initializer gauss = p -> p.initGaussian(rand, 1d / Math.sqrt(conf.inputSize));

    for (Vocab v : inputVocabs) {
      for (String d : v.getDecisions()) {
        inputDecisions.add(d);
        // last row is padding
        embeddings.add(store.getOrCreate(scope + "/emb/" + d, v.size(d) + 1, conf.inputSize, true, gauss, reuse));
      }
    }
    for (Graph g : inputGraphs) {
      String base = scope + "/" + g.getScope() + "_proj/";
      projW.add(store.getOrCreate(base + "W", conf.outputSize, g.featureDim(), true, glorot, reuse));
      projB.add(store.getOrCreate(base + "b", conf.outputSize, 1, true, zero, reuse));
    }
    this.embDim = conf.convWidth * inputDecisions.size() * conf.inputSize;
    this.inputDim = embDim + inputGraphs.size() * conf.outputSize;
    if (inputDim == 0)
      throw new ConfigurationException(scope + " has neither input vocabs nor input networks");
    hiddenW = store.getOrCreate(scope + "/hidden/W", conf.hiddenSize, inputDim, true, glorot, reuse);
    hiddenB = store.getOrCreate(scope + "/hidden/b", conf.hiddenSize, 1, true, zero, reuse);
    for (Vocab v : outputVocabs) {
      for (String d : v.getDecisions()) {
        outputDecisions.add(d);
        outW.add(store.getOrCreate(scope + "/out/" + d + "/W", v.size(d), conf.hiddenSize, true, glorot, reuse));
        outB.add(store.getOrCreate(scope + "/out/" + d + "/b", v.size(d), 1, true, zero, reuse));
      }
    }
    if (LOG.isDebugEnabled())
      LOG.debug("[init] " + scope + " " + mode + " inputs=" + inputDecisions
          + " outputs=" + outputDecisions + " " + conf);
  }

  @Override
  public NetworkMode getMode() {
    return mode;
  }

  @Override
  public String getScope() {
    return scope;
  }

  @Override
  public int featureDim() {
    return conf.hiddenSize;
  }

  /** The values one token passes through, kept for backprop. */
  private static class Activations {
    int[] rows;          // embedding row per (window position, input decision)
    double[] xPre;       // inputs before their non-linearity
    double[] xAct;       // after it, before dropout
    double[] xMask;
    double[] x;          // what the hidden layer sees
    double[][] f;        // features of each input network
    double[] hPre, hAct, hMask, h;
  }

  private double mask(boolean dropout, double keep) {
    if (!dropout || keep >= 1)
      return 1;
    return rand.nextDouble() < keep ? 1d / keep : 0;
  }

  private Activations forward(Batch batch, List<double[][][]> sub, int s, int t, boolean dropout) {
    int n = batch.sentenceLength(s);
    int half = conf.convWidth / 2;
    Activations a = new Activations();
    a.rows = new int[conf.convWidth * inputDecisions.size()];
    a.xPre = new double[inputDim];
    a.xAct = new double[inputDim];
    a.xMask = new double[inputDim];
    a.x = new double[inputDim];
    a.f = new double[inputGraphs.size()][];

    int off = 0;
    for (int w = 0; w < conf.convWidth; w++) {
      int pos = t + w - half;
      for (int di = 0; di < inputDecisions.size(); di++) {
        Parameter e = embeddings.get(di);
        int row = pos < 0 || pos >= n ? e.rows() - 1 : batch.get(inputDecisions.get(di))[s][pos];
        a.rows[w * inputDecisions.size() + di] = row;
        for (int j = 0; j < conf.inputSize; j++, off++) {
          a.xPre[off] = e.get(row, j);
          a.xAct[off] = conf.inputFunc.apply(a.xPre[off]);
          a.xMask[off] = mask(dropout, conf.inputKeepProb);
        }
      }
    }
    for (int gi = 0; gi < inputGraphs.size(); gi++) {
      double[] f = sub.get(gi)[s][t];
      a.f[gi] = f;
      Parameter pw = projW.get(gi), pb = projB.get(gi);
      for (int r = 0; r < conf.outputSize; r++, off++) {
        double z = pb.get(r, 0);
        for (int c = 0; c < f.length; c++)
          z += pw.get(r, c) * f[c];
        a.xPre[off] = z;
        a.xAct[off] = conf.outputFunc.apply(z);
        a.xMask[off] = mask(dropout, conf.outputKeepProb);
      }
    }
    for (int i = 0; i < inputDim; i++)
      a.x[i] = a.xAct[i] * a.xMask[i];

    int hs = conf.hiddenSize;
    a.hPre = new double[hs];
    a.hAct = new double[hs];
    a.hMask = new double[hs];
    a.h = new double[hs];
    for (int r = 0; r < hs; r++) {
      double z = hiddenB.get(r, 0);
      for (int c = 0; c < inputDim; c++)
        z += hiddenW.get(r, c) * a.x[c];
      a.hPre[r] = z;
      a.hAct[r] = conf.hiddenFunc.apply(z);
      a.hMask[r] = mask(dropout, conf.hiddenKeepProb);
      a.h[r] = a.hAct[r] * a.hMask[r];
    }
    return a;
  }

  /** dh is the gradient of the loss w.r.t. a.h */
  private void backward(Activations a, double[] dh) {
    double[] dx = new double[inputDim];
    for (int r = 0; r < conf.hiddenSize; r++) {
      double dz = dh[r] * a.hMask[r] * conf.hiddenFunc.derivative(a.hPre[r], a.hAct[r]);
      if (dz == 0)
        continue;
      hiddenB.addGradient(r, 0, dz);
      for (int c = 0; c < inputDim; c++) {
        hiddenW.addGradient(r, c, dz * a.x[c]);
        dx[c] += hiddenW.get(r, c) * dz;
      }
    }
    int off = 0;
    for (int k = 0; k < a.rows.length; k++) {
      Parameter e = embeddings.get(k % inputDecisions.size());
      for (int j = 0; j < conf.inputSize; j++, off++) {
        double dz = dx[off] * a.xMask[off] * conf.inputFunc.derivative(a.xPre[off], a.xAct[off]);
        if (dz != 0)
          e.addGradient(a.rows[k], j, dz);
      }
    }
    for (int gi = 0; gi < inputGraphs.size(); gi++) {
      Parameter pw = projW.get(gi), pb = projB.get(gi);
      double[] f = a.f[gi];
      for (int r = 0; r < conf.outputSize; r++, off++) {
        double dz = dx[off] * a.xMask[off] * conf.outputFunc.derivative(a.xPre[off], a.xAct[off]);
        if (dz == 0)
          continue;
        pb.addGradient(r, 0, dz);
        for (int c = 0; c < f.length; c++)
          pw.addGradient(r, c, dz * f[c]);
      }
    }
  }

  private List<double[][][]> inputFeatures(Batch batch) {
    List<double[][][]> sub = new ArrayList<>(inputGraphs.size());
    for (Graph g : inputGraphs)
      sub.add(g.features(batch));
    return sub;
  }

  @Override
  public Probabilities run(Batch batch) {
    boolean train = mode.isTraining();
    double perToken = batch.numTokens() == 0 ? 0 : 1d / batch.numTokens();
    List<double[][][]> sub = inputFeatures(batch);

    Map<String, double[][][]> probs = new LinkedHashMap<>();
    for (String d : outputDecisions)
      probs.put(d, new double[batch.size()][][]);

    double loss = 0;
    for (int s = 0; s < batch.size(); s++) {
      int n = batch.sentenceLength(s);
      for (String d : outputDecisions)
        probs.get(d)[s] = new double[n][];
      for (int t = 0; t < n; t++) {
        Activations a = forward(batch, sub, s, t, train);
        double[] dh = train ? new double[conf.hiddenSize] : null;
        for (int k = 0; k < outputDecisions.size(); k++) {
          String d = outputDecisions.get(k);
          Parameter w = outW.get(k), b = outB.get(k);
          double[] p = softmax(logits(w, b, a.h));
          probs.get(d)[s][t] = p;
          int gold = batch.get(d)[s][t];
          loss -= FastMath.log(Math.max(p[gold], 1e-12)) * perToken;
          if (train) {
            for (int c = 0; c < p.length; c++) {
              double dl = (p[c] - (c == gold ? 1 : 0)) * perToken;
              b.addGradient(c, 0, dl);
              for (int j = 0; j < dh.length; j++) {
                w.addGradient(c, j, dl * a.h[j]);
                dh[j] += w.get(c, j) * dl;
              }
            }
          }
        }
        if (train)
          backward(a, dh);
      }
    }

    if (conf.l2Reg > 0) {
      for (Parameter w : weightMatrices()) {
        loss += conf.l2Reg * w.l2();
        if (train) {
          double[] v = w.getValues(), g = w.getGradient();
          for (int i = 0; i < v.length; i++)
            g[i] += conf.l2Reg * v[i];
        }
      }
    }
    return new Probabilities(probs, loss);
  }

  private List<Parameter> weightMatrices() {
    List<Parameter> l = new ArrayList<>(projW);
    l.add(hiddenW);
    l.addAll(outW);
    return l;
  }

  private static double[] logits(Parameter w, Parameter b, double[] h) {
    double[] z = new double[w.rows()];
    for (int c = 0; c < z.length; c++) {
      double s = b.get(c, 0);
      for (int j = 0; j < h.length; j++)
        s += w.get(c, j) * h[j];
      z[c] = s;
    }
    return z;
  }

  static double[] softmax(double[] z) {
    double max = Double.NEGATIVE_INFINITY;
    for (double v : z)
      max = Math.max(max, v);
    double sum = 0;
    double[] p = new double[z.length];
    for (int i = 0; i < z.length; i++) {
      p[i] = FastMath.exp(z[i] - max);
      sum += p[i];
    }
    for (int i = 0; i < p.length; i++)
      p[i] /= sum;
    return p;
  }

  @Override
  public double[][][] features(Batch batch) {
    List<double[][][]> sub = inputFeatures(batch);
    double[][][] feats = new double[batch.size()][][];
    for (int s = 0; s < batch.size(); s++) {
      int n = batch.sentenceLength(s);
      feats[s] = new double[n][];
      for (int t = 0; t < n; t++)
        feats[s][t] = forward(batch, sub, s, t, false).h;
    }
    return feats;
  }

  @Override
  public String toString() {
    return "(WindowClassifierGraph " + scope + " " + mode + ")";
  }
}
