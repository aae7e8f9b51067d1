package edu.jhu.hlt.parsenet.optimize;

import static org.junit.Assert.*;

import org.junit.Test;

public class OptimizerSchedulerTest {

  private final AdamOptimizer adam = new AdamOptimizer(new AdamOptimizer.Config());
  private final AMSGradOptimizer ams = AMSGradOptimizer.fromOptimizer(adam);

  @Test
  public void switchesOnceStepsExceedATenthOfThePatience() {
    OptimizerScheduler s = new OptimizerScheduler(adam, ams, true, 20);
    assertSame(adam, s.current());
    assertFalse(s.observe(0));
    assertFalse(s.observe(2));
    assertTrue(s.observe(3));
    assertSame(ams, s.current());
    assertTrue(s.hasSwitched());
    // for good, even after an improvement
    assertFalse(s.observe(0));
    assertFalse(s.observe(10));
    assertSame(ams, s.current());
  }

  @Test
  public void disabled() {
    OptimizerScheduler s = new OptimizerScheduler(adam, ams, false, 20);
    assertFalse(s.observe(1000));
    assertSame(adam, s.current());
    assertFalse(s.hasSwitched());
  }
}
