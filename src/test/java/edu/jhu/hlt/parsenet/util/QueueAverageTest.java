package edu.jhu.hlt.parsenet.util;

import static org.junit.Assert.*;

import org.junit.Test;

public class QueueAverageTest {

  @Test
  public void keepsOnlyTheMostRecent() {
    QueueAverage q = new QueueAverage(3);
    assertTrue(Double.isNaN(q.getAverage()));
    q.push(1);
    q.push(2);
    q.push(3);
    assertTrue(q.isFull());
    assertEquals(2, q.getAverage(), 1e-12);
    q.push(10);
    assertEquals(3, q.size());
    assertEquals(5, q.getAverage(), 1e-12);
    assertEquals(10, q.getLast(), 0);
  }
}
