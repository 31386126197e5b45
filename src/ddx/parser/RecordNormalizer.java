package ddx.parser;

import static com.google.common.base.Strings.emptyToNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

import ddx.Log;
import ddx.tree.Attribute;
import ddx.tree.Record;
import ddx.tree.TargetField;

/** Prepares loaded records for training: case-folds attribute values and
 * drops duplicate records. Never modifies its input. */
public class RecordNormalizer {
  private RecordNormalizer() { }

  /** Normalizes then deduplicates. */
  public static List<Record> prepare(List<Record> records) {
    return dedup(normalize(records));
  }

  /** Attribute values trimmed and lower-cased, target values trimmed; values
   * that end up empty become absent. */
  public static List<Record> normalize(List<Record> records) {
    List<Record> res = new ArrayList<Record>(records.size());
    for( Record r : records ) res.add(normalize(r));
    return res;
  }

  public static Record normalize(Record r) {
    Record n = r;
    for( Attribute a : Attribute.values() ) {
      String v = r.get(a);
      String w = v == null ? null : emptyToNull(v.trim().toLowerCase(Locale.ROOT));
      if( v != null && !v.equals(w) ) n = n.with(a, w);
    }
    for( TargetField t : TargetField.values() ) {
      String v = r.get(t);
      String w = v == null ? null : emptyToNull(v.trim());
      if( v != null && !v.equals(w) ) n = n.with(t, w);
    }
    return n;
  }

  /** Drops every record equal to an earlier one, keeping the first-seen order. */
  public static List<Record> dedup(List<Record> records) {
    LinkedHashSet<Record> set = new LinkedHashSet<Record>(records);
    if( set.size() < records.size() )
      Log.info("Removed " + (records.size() - set.size()) + " duplicate records, " + set.size() + " left");
    return new ArrayList<Record>(set);
  }
}
