package edu.jhu.hlt.parsenet.network;

import static org.junit.Assert.*;

import org.junit.Test;

public class ParameterStoreTest {

  private static final ParameterStore.Initializer ONES = p -> java.util.Arrays.fill(p.getValues(), 1);

  @Test
  public void createThenReuse() {
    ParameterStore s = new ParameterStore();
    Parameter a = s.getOrCreate("Net/hidden/W", 2, 3, true, ONES, false);
    assertEquals("Net", a.getScope());
    assertEquals(6, a.size());
    assertEquals(1, a.get(1, 2), 0);
    assertSame(a, s.getOrCreate("Net/hidden/W", 2, 3, true, ONES, true));
    assertTrue(s.contains("Net/hidden/W"));
    assertTrue(s.hasScope("Net"));
    assertFalse(s.hasScope("Other"));
  }

  @Test(expected = IllegalStateException.class)
  public void reuseOfMissing() {
    new ParameterStore().getOrCreate("Net/x", 1, 1, true, ONES, true);
  }

  @Test(expected = IllegalStateException.class)
  public void reuseWithOtherShape() {
    ParameterStore s = new ParameterStore();
    s.getOrCreate("Net/x", 1, 2, true, ONES, false);
    s.getOrCreate("Net/x", 2, 1, true, ONES, true);
  }

  @Test(expected = IllegalStateException.class)
  public void createTwice() {
    ParameterStore s = new ParameterStore();
    s.getOrCreate("Net/x", 1, 1, true, ONES, false);
    s.getOrCreate("Net/x", 1, 1, true, ONES, false);
  }

  @Test(expected = IllegalArgumentException.class)
  public void namesNeedAScope() {
    new Parameter("W", 1, 1, true);
  }

  @Test
  public void scopesFreezingAndPersistence() {
    ParameterStore s = new ParameterStore();
    s.getOrCreate("Tagger/W", 1, 1, true, ONES, false);
    s.getOrCreate("Parser/W", 1, 1, true, ONES, false);
    s.getOrCreate("Parser/step", 1, 1, false, ONES, false);
    s.freeze("Tagger");
    assertTrue(s.trainable("Tagger").isEmpty());
    assertEquals(2, s.trainable("Parser").size());
    assertEquals(1, s.persistent("Parser").size());
    assertEquals(3, s.size());

    Parameter w = s.get("Parser/W");
    w.addGradient(0, 0, 2.5);
    s.zeroGradients();
    assertEquals(0, w.getGradient()[0], 0);
  }

  @Test
  public void l2IsHalfTheSquaredNorm() {
    Parameter p = new Parameter("Net/W", 1, 2, true);
    p.set(0, 0, 3);
    p.set(0, 1, 4);
    assertEquals(12.5, p.l2(), 1e-12);
  }
}
