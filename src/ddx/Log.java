package ddx;

import java.io.PrintStream;
import java.text.SimpleDateFormat;
import java.util.Date;

/**
 * Console output of the tool. Normal progress goes to stdout, warnings to
 * stderr, each line stamped with the time and the thread name.
 */
public final class Log {
  private static volatile PrintStream OUT = System.out;
  private static volatile PrintStream ERR = System.err;

  private Log() { }

  /** Redirects both streams, e.g. to silence a test run. */
  public static void setOutput(PrintStream out, PrintStream err) { OUT = out; ERR = err; }

  public static void info(String s) { OUT.println(prefix() + s); }
  public static void warn(String s) { ERR.println(prefix() + "WARN: " + s); }

  // Print to the original STDERR & die
  public static void die( String s ) {
    System.err.println(s);
    System.exit(-1);
  }

  private static String prefix() {
    return new SimpleDateFormat("HH:mm:ss.SSS").format(new Date()) + " [" + Thread.currentThread().getName() + "] ";
  }
}
