package edu.jhu.hlt.parsenet.data;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import edu.jhu.hlt.parsenet.datatypes.Sentence;
import edu.jhu.hlt.parsenet.datatypes.Token;

/**
 * Reads CoNLL-U files one sentence at a time. Sentences are separated by
 * blank lines, comment lines start with '#'.
 */
public class ConllUReader implements Iterator<Sentence>, AutoCloseable {

  private final File file;
  private final BufferedReader reader;
  private int lineNumber;
  private Sentence next;

  public ConllUReader(File f) throws IOException {
    this.file = f;
    this.reader = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8);
    this.lineNumber = 0;
    this.next = readASentence();
  }

  public static List<Sentence> readAll(File f) throws IOException {
    List<Sentence> sentences = new ArrayList<>();
    try (ConllUReader r = new ConllUReader(f)) {
      while (r.hasNext())
        sentences.add(r.next());
    }
    return sentences;
  }

  @Override
  public boolean hasNext() {
    return next != null;
  }

  @Override
  public Sentence next() {
    if (next == null)
      throw new NoSuchElementException();
    Sentence r = next;
    try {
      next = readASentence();
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    return r;
  }

  private Sentence readASentence() throws IOException {
    List<String> comments = new ArrayList<>();
    List<Token> tokens = new ArrayList<>();
    List<String> extra = new ArrayList<>();
    List<Integer> extraPos = new ArrayList<>();
    boolean started = false;
    for (String line = reader.readLine(); line != null; line = reader.readLine()) {
      lineNumber++;
      if (line.trim().isEmpty()) {
        if (started)
          break;
        continue;
      }
      started = true;
      if (line.startsWith("#")) {
        comments.add(line);
      } else if (Token.isWordLine(line)) {
        try {
          tokens.add(Token.parse(line));
        } catch (IllegalArgumentException e) {
          throw new IOException(file.getPath() + ":" + lineNumber + ": " + e.getMessage(), e);
        }
      } else {
        extra.add(line);
        extraPos.add(tokens.size());
      }
    }
    if (!started)
      return null;
    return new Sentence(comments, tokens, extra, extraPos);
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
