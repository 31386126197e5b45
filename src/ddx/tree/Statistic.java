package ddx.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** Class distributions, entropy and gain ratio over a set of records.
 *
 * The entropy formula is the classic Shannon entropy:
 *
 * - \sum(p_i * log2(p_i))
 *
 * where p_i is the share of the i-th class among the records whose target is
 * present. Records with a missing target are left out of both the counts and
 * the denominator.
 *
 * The gain ratio of an attribute is the entropy reduction obtained by
 * partitioning on the attribute's values, divided by the entropy of the
 * partition sizes themselves (the split information), so that attributes
 * with many distinct values are not favoured.
 */
public final class Statistic {
  /** Class value reported when a record set holds no target value at all. */
  public static final String UNKNOWN = "unknown";

  private static final double LN2 = Math.log(2);

  private Statistic() { }

  /** Split descriptor: the attribute to partition on and its gain ratio. */
  public static final class Split {
    final Attribute _attribute;
    final double _gainRatio;

    Split(Attribute attribute, double gainRatio) { _attribute = attribute; _gainRatio = gainRatio; }

    public Attribute attribute() { return _attribute; }
    public double gainRatio()    { return _gainRatio; }
    final boolean betterThan(Split other) { return other == null || _gainRatio > other._gainRatio; }

    @Override public String toString() { return _attribute + " (" + Utils.p5d(_gainRatio) + ")"; }
  }

  /** Counts of each present target value, ordered by value. */
  public static SortedMap<String,Integer> histogram(List<Record> records, TargetField target) {
    SortedMap<String,Integer> counts = new TreeMap<String,Integer>();
    for( Record r : records ) {
      String v = r.get(target);
      if( v == null ) continue;
      Integer c = counts.get(v);
      counts.put(v, c == null ? 1 : c + 1);
    }
    return counts;
  }

  /** Shannon entropy (base 2) of the target distribution. 0 for an empty set
   * and for a set without any present target value. */
  public static double entropy(List<Record> records, TargetField target) {
    return entropy(histogram(records, target).values());
  }

  static double entropy(Iterable<Integer> counts) {
    int total = 0;
    for( int c : counts ) total += c;
    if( total == 0 ) return 0;
    double e = 0;
    for( int c : counts ) {
      if( c == 0 ) continue;
      double p = c / (double) total;
      e -= p * log2(p);
    }
    return e;
  }

  /** Groups the records by their value of the attribute, ordered by value.
   * Records missing the attribute belong to no partition. */
  public static SortedMap<String,List<Record>> partition(List<Record> records, Attribute attribute) {
    SortedMap<String,List<Record>> parts = new TreeMap<String,List<Record>>();
    for( Record r : records ) {
      String v = r.get(attribute);
      if( v == null ) continue;
      List<Record> p = parts.get(v);
      if( p == null ) parts.put(v, p = new ArrayList<Record>());
      p.add(r);
    }
    return parts;
  }

  /** Information gain of splitting on the attribute, normalized by the split
   * information. Returns 0 when the split information is 0, i.e. when the
   * records fall into at most one partition. */
  public static double gainRatio(List<Record> records, Attribute attribute, TargetField target, double baseEntropy) {
    SortedMap<String,List<Record>> parts = partition(records, attribute);
    int total = 0;
    for( List<Record> p : parts.values() ) total += p.size();
    if( total == 0 ) return 0;
    double splitInfo = 0, infoAttr = 0;
    for( List<Record> p : parts.values() ) {
      double w = p.size() / (double) total;
      splitInfo -= w * log2(w);
      infoAttr  += w * entropy(p, target);
    }
    if( splitInfo == 0 ) return 0;
    return (baseEntropy - infoAttr) / splitInfo;
  }

  /** Evaluates every attribute in lexicographic order and returns the one with
   * the strictly greatest gain ratio, or null if no attribute is given. */
  public static Split bestSplit(List<Record> records, List<Attribute> attributes, TargetField target) {
    double base = entropy(records, target);
    Split best = null;
    for( Attribute a : Attribute.sorted() ) {
      if( !attributes.contains(a) ) continue;
      Split s = new Split(a, gainRatio(records, a, target, base));
      if( s.betterThan(best) ) best = s;
    }
    return best;
  }

  /** Most frequent present target value. Ties go to the lexicographically
   * smallest value; {@link #UNKNOWN} if no value is present. */
  public static String majority(List<Record> records, TargetField target) {
    String best = null;
    int bestCount = 0;
    // histogram is ordered, so only a strictly larger count replaces the best
    for( Map.Entry<String,Integer> e : histogram(records, target).entrySet() ) {
      if( e.getValue() > bestCount ) { best = e.getKey(); bestCount = e.getValue(); }
    }
    return best == null ? UNKNOWN : best;
  }

  /** The only present target value, or null if there are none or several. */
  public static String pure(List<Record> records, TargetField target) {
    String first = null;
    for( Record r : records ) {
      String v = r.get(target);
      if( v == null ) continue;
      if( first == null ) first = v;
      else if( !first.equals(v) ) return null;
    }
    return first;
  }

  static double log2(double x) { return Math.log(x) / LN2; }
}
