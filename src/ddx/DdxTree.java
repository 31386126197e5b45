package ddx;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

import com.google.common.base.Throwables;
import com.google.common.io.Closeables;

import ddx.parser.RecordNormalizer;
import ddx.parser.RecordParser;
import ddx.tree.Confusion;
import ddx.tree.GraphvizTreePrinter;
import ddx.tree.MultiTargetPredictor;
import ddx.tree.Prediction;
import ddx.tree.Record;
import ddx.tree.TargetField;
import ddx.tree.Tree;
import ddx.tree.TreeParams;
import ddx.tree.Utils.MinMaxAvg;

/**
 * Command line driver: trains the five trees on a CSV file and predicts the
 * records of another one (or of the training file itself).
 *
 * <pre>
 * java ddx.DdxTree -train=data/train.csv -test=data/test.csv -output=predictions.csv
 *                  [-report=report.json] [-graphviz=dir] [-maxDepth=10]
 *                  [-minSamplesLeaf=1] [-minGainRatio=0] [-threads=1] [-nodedup]
 * </pre>
 */
public class DdxTree {

  public static class OptArgs extends Arguments.Opt {
    String train;                                     // training data
    String test;                                      // records to predict, training data if unset
    String output = "predictions.csv";                // prediction CSV
    String report;                                    // JSON report, none if unset
    String graphviz;                                  // directory for <target>.dot files
    int maxDepth = TreeParams.DEFAULT_MAX_DEPTH;      // max depth of trees
    int minSamplesLeaf = TreeParams.DEFAULT_MIN_SAMPLES_LEAF;
    double minGainRatio = TreeParams.DEFAULT_MIN_GAIN_RATIO;
    int threads = 1;                                  // >1 builds the trees in parallel
    boolean nodedup;                                  // keep duplicate training records
  }

  public static void main(String[] args) {
    OptArgs opts = new OptArgs();
    try {
      new Arguments(args).extract(opts);
      run(opts);
    } catch( IllegalArgumentException e ) {
      Log.die(e.getMessage() + "\nusage: java ddx.DdxTree -train=<csv> [-test=<csv>] [-output=<csv>] [-report=<json>]"
              + " [-graphviz=<dir>] [-maxDepth=n] [-minSamplesLeaf=n] [-minGainRatio=x] [-threads=n] [-nodedup]");
    } catch( IOException e ) {
      Log.die("Error: " + Throwables.getRootCause(e).getMessage());
    }
  }

  /** Trains, predicts and writes the requested outputs. Returns the predictor. */
  public static MultiTargetPredictor run(OptArgs opts) throws IOException {
    if( opts.train == null ) throw new IllegalArgumentException("Missing -train");
    TreeParams params = new TreeParams(opts.maxDepth, opts.minSamplesLeaf, opts.minGainRatio);
    Log.info("Options: " + opts);

    List<Record> raw = RecordParser.parse(new File(opts.train));
    Log.info("Loaded " + raw.size() + " records from " + opts.train);
    List<Record> train = opts.nodedup
      ? RecordNormalizer.normalize(raw)
      : RecordNormalizer.prepare(raw);
    MultiTargetPredictor predictor = MultiTargetPredictor.build(train, params, opts.threads);

    List<Record> test = raw;
    if( opts.test != null ) {
      test = RecordParser.parse(new File(opts.test));
      Log.info("Loaded " + test.size() + " records from " + opts.test);
    }
    List<Prediction> predictions = new ArrayList<Prediction>(test.size());
    for( Record r : test ) predictions.add(predictor.predict(r));
    ResultWriter.writePredictions(new File(opts.output), test, predictions);
    Log.info("Wrote " + predictions.size() + " predictions to " + opts.output);

    EnumMap<TargetField,Confusion> confusions = predictor.validate(RecordNormalizer.normalize(test));
    Log.info(report(predictor, confusions));

    if( opts.report != null ) {
      ResultWriter.writeReport(new File(opts.report), ResultWriter.report(predictor, confusions));
      Log.info("Wrote report to " + opts.report);
    }
    if( opts.graphviz != null ) writeGraphviz(predictor, new File(opts.graphviz));
    return predictor;
  }

  static String report(MultiTargetPredictor p, EnumMap<TargetField,Confusion> confusions) {
    MinMaxAvg td = new MinMaxAvg(), tl = new MinMaxAvg();
    for( TargetField t : TargetField.values() ) {
      Tree tree = p.tree(t);
      td.add(tree.depth());
      tl.add(tree.leaves());
    }
    StringBuilder sb = new StringBuilder();
    sb.append("\n                 Number of trees: ").append(TargetField.values().length)
      .append("\n               Trained on (rows): ").append(p.rows())
      .append("\n       Avg tree depth (min, max): ").append(td)
      .append("\n      Avg tree leaves (min, max): ").append(tl).append('\n');
    for( Confusion cm : confusions.values() )
      if( cm.rows() > 0 ) sb.append(cm);
    return sb.toString();
  }

  static void writeGraphviz(MultiTargetPredictor p, File dir) throws IOException {
    if( !dir.isDirectory() && !dir.mkdirs() ) throw new IOException("Cannot create directory " + dir);
    for( TargetField t : TargetField.values() ) {
      File f = new File(dir, t.colName() + ".dot");
      OutputStream os = new FileOutputStream(f);
      boolean ok = false;
      try {
        new GraphvizTreePrinter(os).printTree(p.tree(t));
        ok = true;
      } finally {
        Closeables.close(os, !ok);
      }
    }
    OutputStream os = new FileOutputStream(new File(dir, "all.dot"));
    boolean ok = false;
    try {
      new GraphvizTreePrinter(os).printPredictor(p);
      ok = true;
    } finally {
      Closeables.close(os, !ok);
    }
    Log.info("Wrote Graphviz trees to " + dir);
  }
}
