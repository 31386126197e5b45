package ddx.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Confusion Matrix for one target field. Each validated record adds one entry
 * under [actual][predicted]; classes are the labels seen on either side.
 */
public class Confusion {
  final TargetField _target;
  // actual -> predicted -> count
  final Map<String,Map<String,Long>> _matrix = new TreeMap<String,Map<String,Long>>();
  final SortedSet<String> _classes = new TreeSet<String>();
  long _rows;
  long _errors;

  public Confusion(TargetField target) { _target = target; }

  public void add(String actual, String predicted) {
    Map<String,Long> row = _matrix.get(actual);
    if( row == null ) _matrix.put(actual, row = new TreeMap<String,Long>());
    Long c = row.get(predicted);
    row.put(predicted, c == null ? 1L : c + 1);
    _classes.add(actual);
    _classes.add(predicted);
    _rows++;
    if( !actual.equals(predicted) ) _errors++;
  }

  public TargetField target()        { return _target; }
  public long rows()                 { return _rows;   }
  public long errors()               { return _errors; }
  public double errorRate()          { return _rows == 0 ? 0 : _errors / (double) _rows; }
  public SortedSet<String> classes() { return _classes; }

  public long count(String actual, String predicted) {
    Map<String,Long> row = _matrix.get(actual);
    Long c = row == null ? null : row.get(predicted);
    return c == null ? 0 : c;
  }

  /** Fraction of the records labelled 'actual' that were predicted otherwise. */
  double classError(String actual) {
    Map<String,Long> row = _matrix.get(actual);
    if( row == null ) return 0;
    long tot = 0;
    for( long c : row.values() ) tot += c;
    return (tot - count(actual, actual)) / (double) tot;
  }

  /** Text rendering: a header row of predicted classes, one row per actual
   * class and a final err/class column. */
  public String confusionMatrix() {
    List<String> cn = new ArrayList<String>(_classes);
    final int K = cn.size()+1;
    String [][] cms = new String[K][K+1];
    cms[0][0] = "";
    for (int i=1;i<K;i++) cms[0][i] = cn.get(i-1);
    cms[0][K]= "err/class";
    for (int j=1;j<K;j++) cms[j][0] = cn.get(j-1);
    for (int j=1;j<K;j++) cms[j][K] = Utils.p2d(classError(cn.get(j-1)));
    for (int i=1;i<K;i++)
      for (int j=1;j<K;j++) cms[j][i] = Long.toString(count(cn.get(j-1), cn.get(i-1)));
    int maxlen = 0;
    for (int i=0;i<K;i++)
      for (int j=0;j<K+1;j++) maxlen = Math.max(maxlen, cms[i][j].length());
    StringBuilder sb = new StringBuilder();
    for (int i=0;i<K;i++) {
      for (int j=0;j<K+1;j++) sb.append(Utils.pad(cms[i][j],maxlen));
      sb.append('\n');
    }
    return sb.toString();
  }

  @Override public String toString() {
    return
      "                      Target: " + _target + "\n" +
      "      Estimate of error rate: " + Utils.p2d(errorRate() * 100) + "%  (" + _errors + "/" + _rows + ")\n" +
      "            Confusion matrix:\n" + confusionMatrix();
  }
}
