package ddx;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.io.Closeables;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import ddx.parser.RecordParser;
import ddx.tree.Attribute;
import ddx.tree.Confusion;
import ddx.tree.MultiTargetPredictor;
import ddx.tree.Prediction;
import ddx.tree.Record;
import ddx.tree.TargetField;
import ddx.tree.Tree;

/** Writes the prediction CSV and the JSON run report. */
public class ResultWriter {
  public static final String JSON_PARAMS = "params";
  public static final String JSON_MAX_DEPTH = "max_depth";
  public static final String JSON_MIN_SAMPLES_LEAF = "min_samples_leaf";
  public static final String JSON_MIN_GAIN_RATIO = "min_gain_ratio";
  public static final String JSON_TRAINING_ROWS = "training_rows";
  public static final String JSON_TREES = "trees";
  public static final String JSON_TREE_DEPTH = "depth";
  public static final String JSON_TREE_LEAVES = "leaves";
  public static final String JSON_TREE_TIME = "build_msec";
  public static final String JSON_CM = "confusion_matrix";
  public static final String JSON_CM_HEADER = "header";
  public static final String JSON_CM_MATRIX = "matrix";
  public static final String JSON_ROWS = "rows";
  public static final String JSON_ERRORS = "errors";
  public static final String JSON_ERROR_RATE = "error_rate";

  private static final Joiner COMMA = Joiner.on(',');

  private ResultWriter() { }

  /** One line per record: the master index and attributes as read, followed by
   * the predicted value of each target. */
  public static void writePredictions(File f, List<Record> records, List<Prediction> predictions) throws IOException {
    assert records.size() == predictions.size();
    Writer w = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8));
    boolean ok = false;
    try {
      writePredictions(w, records, predictions);
      ok = true;
    } finally {
      Closeables.close(w, !ok);
    }
  }

  public static void writePredictions(Appendable w, List<Record> records, List<Prediction> predictions) throws IOException {
    List<String> cells = new ArrayList<String>();
    cells.add(RecordParser.MASTER_INDEX);
    for( Attribute a : Attribute.values() ) cells.add(a.header());
    for( TargetField t : TargetField.values() ) cells.add(t.header());
    w.append(COMMA.join(cells)).append('\n');
    for( int i = 0; i < records.size(); i++ ) {
      Record r = records.get(i);
      Prediction p = predictions.get(i);
      cells.clear();
      cells.add(quote(r.masterIndex()));
      for( Attribute a : Attribute.values() ) cells.add(quote(r.get(a)));
      for( TargetField t : TargetField.values() ) cells.add(quote(p.get(t)));
      w.append(COMMA.join(cells)).append('\n');
    }
  }

  static String quote(String s) {
    s = Strings.nullToEmpty(s);
    if( s.indexOf(',') < 0 && s.indexOf('"') < 0 && s.indexOf('\n') < 0 && s.indexOf('\r') < 0 ) return s;
    return '"' + s.replace("\"", "\"\"") + '"';
  }

  /** Report of the build parameters, each tree's shape and, where given, its
   * validation results. 'confusions' may be null. */
  public static JsonObject report(MultiTargetPredictor p, Map<TargetField,Confusion> confusions) {
    JsonObject response = new JsonObject();
    JsonObject params = new JsonObject();
    params.addProperty(JSON_MAX_DEPTH, p.params().maxDepth());
    params.addProperty(JSON_MIN_SAMPLES_LEAF, p.params().minSamplesLeaf());
    params.addProperty(JSON_MIN_GAIN_RATIO, p.params().minGainRatio());
    response.add(JSON_PARAMS, params);
    response.addProperty(JSON_TRAINING_ROWS, p.rows());

    JsonObject trees = new JsonObject();
    for( TargetField t : TargetField.values() ) {
      Tree tree = p.tree(t);
      JsonObject o = new JsonObject();
      o.addProperty(JSON_TREE_DEPTH, tree.depth());
      o.addProperty(JSON_TREE_LEAVES, tree.leaves());
      o.addProperty(JSON_TREE_TIME, tree.time());
      Confusion cm = confusions == null ? null : confusions.get(t);
      if( cm != null ) {
        o.addProperty(JSON_ROWS, cm.rows());
        o.addProperty(JSON_ERRORS, cm.errors());
        o.addProperty(JSON_ERROR_RATE, cm.errorRate());
        o.add(JSON_CM, toJson(cm));
      }
      trees.add(t.colName(), o);
    }
    response.add(JSON_TREES, trees);
    return response;
  }

  static JsonObject toJson(Confusion cm) {
    JsonObject res = new JsonObject();
    JsonArray header = new JsonArray();
    for( String c : cm.classes() ) header.add(c);
    res.add(JSON_CM_HEADER, header);
    JsonArray matrix = new JsonArray();
    for( String actual : cm.classes() ) {
      JsonArray row = new JsonArray();
      for( String predicted : cm.classes() ) row.add(cm.count(actual, predicted));
      matrix.add(row);
    }
    res.add(JSON_CM_MATRIX, matrix);
    return res;
  }

  public static void writeReport(File f, JsonObject report) throws IOException {
    Writer w = new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8);
    boolean ok = false;
    try {
      new GsonBuilder().setPrettyPrinting().create().toJson(report, w);
      ok = true;
    } finally {
      Closeables.close(w, !ok);
    }
  }
}
