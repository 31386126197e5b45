package test;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import ddx.tree.Attribute;
import ddx.tree.Record;
import ddx.tree.TargetField;

/** Record builders and fixture locations shared by the tests. */
public class DdxTestUtil {
  public static final File TRAIN = new File("smalldata/ddx/train.csv");
  public static final File TEST  = new File("smalldata/ddx/test.csv");

  /** Record with a clinical panel, a county and a clinician label, any of them possibly null. */
  public static Record rec(String panel, String county, String clinician) {
    return Record.builder()
      .set(Attribute.CLINICAL_PANEL, panel)
      .set(Attribute.COUNTY, county)
      .set(TargetField.CLINICIAN, clinician)
      .build();
  }

  public static Record rec(String panel, String clinician) { return rec(panel, null, clinician); }

  /** Records (panel, clinician) from alternating arguments. */
  public static List<Record> panels(String... panelAndClass) {
    List<Record> res = new ArrayList<Record>();
    for( int i = 0; i < panelAndClass.length; i += 2 ) res.add(rec(panelAndClass[i], panelAndClass[i+1]));
    return res;
  }

  public static Record empty() { return Record.builder().build(); }
}
