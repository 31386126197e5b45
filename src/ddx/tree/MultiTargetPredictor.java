package ddx.tree;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;

import com.google.common.base.Preconditions;

import ddx.Log;

/**
 * One tree per target field, all grown from the same training records with
 * the same parameters. The trees share nothing but the (read-only) training
 * list, so they may be grown in parallel.
 */
public class MultiTargetPredictor {
  final EnumMap<TargetField,Tree> _trees; // The trees that got built
  final TreeParams _params;
  final int _rows;                        // Training set size

  MultiTargetPredictor(EnumMap<TargetField,Tree> trees, TreeParams params, int rows) {
    assert trees.size() == TargetField.values().length;
    _trees = trees;
    _params = params;
    _rows = rows;
  }

  /** Builds the five trees one after the other. */
  public static MultiTargetPredictor build(List<Record> records, TreeParams params) {
    return build(records, params, 1);
  }

  /** Builds the five trees, as fork/join tasks on a pool of the given number
   * of threads when there is more than one. */
  public static MultiTargetPredictor build(List<Record> records, TreeParams params, int threads) {
    Preconditions.checkArgument(threads > 0, "threads must be positive: %s", threads);
    List<Record> data = Collections.unmodifiableList(records);
    EnumMap<TargetField,Tree> trees = new EnumMap<TargetField,Tree>(TargetField.class);
    long start = System.currentTimeMillis();
    if( threads == 1 ) {
      for( TargetField t : TargetField.values() ) trees.put(t, Tree.build(data, t, params));
    } else {
      ForkJoinPool pool = new ForkJoinPool(threads);
      try {
        trees.putAll(pool.invoke(new BuildAll(data, params)));
      } finally {
        pool.shutdown();
      }
    }
    Log.info("Built " + trees.size() + " trees on " + records.size() + " rows in "
             + (System.currentTimeMillis() - start) + " msec, " + params);
    return new MultiTargetPredictor(trees, params, records.size());
  }

  /** Forks one task per target and joins them all. */
  private static class BuildAll extends RecursiveTask<Map<TargetField,Tree>> {
    final List<Record> _data;
    final TreeParams _params;
    BuildAll(List<Record> data, TreeParams params) { _data = data; _params = params; }

    @Override protected Map<TargetField,Tree> compute() {
      EnumMap<TargetField,BuildOne> tasks = new EnumMap<TargetField,BuildOne>(TargetField.class);
      for( TargetField t : TargetField.values() ) {
        BuildOne task = new BuildOne(_data, t, _params);
        task.fork();
        tasks.put(t, task);
      }
      EnumMap<TargetField,Tree> res = new EnumMap<TargetField,Tree>(TargetField.class);
      for( Map.Entry<TargetField,BuildOne> e : tasks.entrySet() ) res.put(e.getKey(), e.getValue().join());
      return res;
    }
  }

  private static class BuildOne extends RecursiveTask<Tree> {
    final List<Record> _data;
    final TargetField _target;
    final TreeParams _params;
    BuildOne(List<Record> data, TargetField target, TreeParams params) {
      _data = data; _target = target; _params = params;
    }
    @Override protected Tree compute() { return Tree.build(_data, _target, _params); }
  }

  /** Runs the record through all five trees. */
  public Prediction predict(Record r) {
    String[] values = new String[TargetField.values().length];
    for( TargetField t : TargetField.values() ) values[t.ordinal()] = _trees.get(t).predict(r);
    return new Prediction(values);
  }

  /** Compares predictions against the labels of the records, per target.
   * Records without a label for a target do not count for that target. */
  public EnumMap<TargetField,Confusion> validate(List<Record> records) {
    EnumMap<TargetField,Confusion> res = new EnumMap<TargetField,Confusion>(TargetField.class);
    for( TargetField t : TargetField.values() ) res.put(t, new Confusion(t));
    for( Record r : records ) {
      Prediction p = predict(r);
      for( TargetField t : TargetField.values() ) {
        String actual = r.get(t);
        if( actual != null ) res.get(t).add(actual, p.get(t));
      }
    }
    return res;
  }

  public Tree tree(TargetField t) { return _trees.get(t); }
  public TreeParams params()      { return _params; }
  public int rows()               { return _rows;   }
}
