package ddx.tree;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

public class Utils {

  /** Running min, max and average of a series of values. */
  public static class MinMaxAvg {
    double min_ = Double.MAX_VALUE;
    double max_ = -Double.MAX_VALUE;
    int count_;
    double total_;

    public void add(double what) {
      total_ += what;
      if (what < min_) min_ = what;
      if (what > max_) max_ = what;
      ++count_;
    }

    public double min() { return min_; }
    public double max() { return max_; }
    public double avg() { return count_ == 0 ? 0 : total_/count_; }
    public int count()  { return count_; }

    @Override public String toString() {
      return count_ == 0 ? "-" : p2d(avg())+" ("+p2d(min_)+" ... "+p2d(max_)+")";
    }
  }

  /** Left-pads the string with spaces to the given width, plus one separating space. */
  public static String pad(String s, int l) {
    StringBuilder sb = new StringBuilder(" ");
    for (int i = s.length(); i < l; i++) sb.append(' ');
    return sb.append(s).toString();
  }

  public static String p2d(double d) { return df().format(d); }
  public static String p5d(double d) { return df5().format(d); }

  // DecimalFormat is not thread safe, trees may be built and reported concurrently
  private static DecimalFormat df()  { return new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.ROOT)); }
  private static DecimalFormat df5() { return new DecimalFormat("0.#####", DecimalFormatSymbols.getInstance(Locale.ROOT)); }
}
