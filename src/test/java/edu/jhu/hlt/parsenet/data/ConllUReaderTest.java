package edu.jhu.hlt.parsenet.data;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.jhu.hlt.parsenet.TestingUtil;
import edu.jhu.hlt.parsenet.datatypes.Field;
import edu.jhu.hlt.parsenet.datatypes.Sentence;

public class ConllUReaderTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void readsSentencesAndSkipsMultiWordLines() throws IOException {
    List<Sentence> sents = ConllUReader.readAll(TestingUtil.trainFile());
    assertEquals(4, sents.size());
    assertEquals(4, sents.get(0).size());
    assertEquals("# sent_id = train-1", sents.get(0).getComments().get(0));
    Sentence third = sents.get(2);
    assertEquals(3, third.size());
    assertEquals("dogs", third.getToken(0).get(Field.FORM));
    assertEquals(1, third.getToken(0).getId());
    assertEquals(3, third.getToken(0).getHead());
  }

  @Test
  public void writerReproducesTheInput() throws IOException {
    File in = TestingUtil.trainFile();
    StringWriter sw = new StringWriter();
    ConllUWriter w = new ConllUWriter(sw);
    for (Sentence s : ConllUReader.readAll(in))
      w.write(s);
    w.flush();
    String expected = new String(Files.readAllBytes(in.toPath()), StandardCharsets.UTF_8);
    assertEquals(expected, sw.toString());
  }

  @Test
  public void badLinesReportTheirPosition() throws IOException {
    File f = tmp.newFile("bad.conllu");
    Files.write(f.toPath(), "1\tonly\tthree\n".getBytes(StandardCharsets.UTF_8));
    try {
      ConllUReader.readAll(f);
      fail();
    } catch (IOException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("bad.conllu:1"));
    }
  }
}
