package edu.jhu.hlt.parsenet.data;

import java.io.IOException;
import java.io.Writer;

import edu.jhu.hlt.parsenet.datatypes.Sentence;

public class ConllUWriter {

  private final Writer w;

  public ConllUWriter(Writer w) {
    this.w = w;
  }

  public void write(Sentence s) throws IOException {
    for (String line : s.toLines()) {
      w.write(line);
      w.write('\n');
    }
    w.write('\n');
  }

  public void flush() throws IOException {
    w.flush();
  }
}
