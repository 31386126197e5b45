package test;

import static org.junit.Assert.*;

import org.junit.Test;

import ddx.Arguments;

public class ArgumentsTest {
  static class Opts extends Arguments.Opt {
    String file = "default.csv";
    int depth = 3;
    double rate = 0.5;
    boolean quiet;
  }

  @Test public void keepsDefaults() {
    Opts o = new Opts();
    assertEquals(0, new Arguments(new String[0]).extract(o));
    assertEquals("default.csv", o.file);
    assertEquals(3, o.depth);
    assertFalse(o.quiet);
  }

  @Test public void readsAllForms() {
    Opts o = new Opts();
    int n = new Arguments(new String[] { "-file=data/x.csv", "--depth", "7", "-rate=0.25", "-quiet" }).extract(o);
    assertEquals(4, n);
    assertEquals("data/x.csv", o.file);
    assertEquals(7, o.depth);
    assertEquals(0.25, o.rate, 0);
    assertTrue(o.quiet);
    assertTrue(o.toString().contains("depth=7"));
    assertTrue(o.toString().contains("file=data/x.csv"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsUnknownOption() {
    new Arguments(new String[] { "-nope=1" }).extract(new Opts());
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsBadNumber() {
    new Arguments(new String[] { "-depth=deep" }).extract(new Opts());
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsMissingValue() {
    new Arguments(new String[] { "-file" }).extract(new Opts());
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsPositionalArgument() {
    new Arguments(new String[] { "train.csv" });
  }
}
