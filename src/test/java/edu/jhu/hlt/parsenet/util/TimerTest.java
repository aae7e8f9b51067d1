package edu.jhu.hlt.parsenet.util;

import static org.junit.Assert.*;

import org.junit.Test;

public class TimerTest {

  @Test
  public void accumulatesOverStartStopPairs() {
    Timer t = new Timer("step");
    assertEquals("<Timer step never stopped>", t.toString());
    t.start();
    assertTrue(t.stop() >= 0);
    Timer.start("x").stop();
    t.start();
    t.stop();
    assertTrue(t.toString().contains("2 calls"));
    assertTrue(t.totalTimeInSeconds() >= 0);
  }

  @Test(expected = IllegalStateException.class)
  public void stopWithoutStart() {
    new Timer("step").stop();
  }
}
