package edu.jhu.hlt.parsenet.network;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import edu.jhu.hlt.parsenet.util.ExperimentProperties;
import edu.jhu.hlt.parsenet.vocab.VocabRegistry;

/**
 * Creates networks by the class names used in configuration files.
 */
public class Networks {

  public static final List<String> CLASS_NAMES =
      Collections.unmodifiableList(Arrays.asList("TaggerNetwork", "ParserNetwork"));

  public static BaseNetwork create(String className, List<BaseNetwork> inputNetworks,
      VocabRegistry registry, ExperimentProperties config) {
    switch (className) {
      case "TaggerNetwork":
        return new TaggerNetwork(inputNetworks, registry, config);
      case "ParserNetwork":
        return new ParserNetwork(inputNetworks, registry, config);
      default:
        throw new ConfigurationException("unknown network class: " + className + ", expected one of " + CLASS_NAMES);
    }
  }

  /**
   * Creates className along with the networks it declares in
   * input_network_classes (recursively, one instance per class).
   */
  public static BaseNetwork build(String className, VocabRegistry registry, ExperimentProperties config) {
    return build(className, registry, config, new HashMap<>(), new LinkedHashSet<>());
  }

  private static BaseNetwork build(String className, VocabRegistry registry, ExperimentProperties config,
      Map<String, BaseNetwork> built, Set<String> building) {
    BaseNetwork n = built.get(className);
    if (n != null)
      return n;
    if (!building.add(className))
      throw new ConfigurationException("input networks form a cycle: " + building + " -> " + className);
    if (!CLASS_NAMES.contains(className))
      throw new ConfigurationException("unknown network class: " + className + ", expected one of " + CLASS_NAMES);
    List<BaseNetwork> inputs = new ArrayList<>();
    for (String in : config.getList(className, "input_network_classes"))
      inputs.add(build(in, registry, config, built, building));
    n = create(className, inputs, registry, config);
    building.remove(className);
    built.put(className, n);
    return n;
  }
}
