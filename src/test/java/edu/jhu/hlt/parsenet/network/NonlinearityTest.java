package edu.jhu.hlt.parsenet.network;

import static org.junit.Assert.*;

import org.junit.Test;

public class NonlinearityTest {

  @Test
  public void byName() {
    for (Nonlinearity n : Nonlinearity.values())
      assertSame(n, Nonlinearity.forName(n.getName()));
  }

  @Test
  public void unknownNameIsAConfigurationError() {
    try {
      Nonlinearity.forName("softsign");
      fail();
    } catch (ConfigurationException e) {
      assertTrue(e.getMessage().contains("softsign"));
      assertTrue(e.getMessage().contains("leaky_relu"));
    }
  }

  @Test
  public void derivativesMatchFiniteDifferences() {
    double eps = 1e-6;
    for (Nonlinearity n : Nonlinearity.values()) {
      for (double x : new double[] {-1.3, -0.2, 0.4, 2.1}) {
        double numeric = (n.apply(x + eps) - n.apply(x - eps)) / (2 * eps);
        assertEquals(n.getName() + " at " + x, numeric, n.derivative(x, n.apply(x)), 1e-6);
      }
    }
  }

  @Test
  public void leakyRelu() {
    assertEquals(-0.5 * Nonlinearity.LEAK, Nonlinearity.LEAKY_RELU.apply(-0.5), 1e-12);
    assertEquals(0, Nonlinearity.RELU.apply(-0.5), 0);
  }
}
