package test;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import ddx.parser.RecordNormalizer;
import ddx.tree.Attribute;
import ddx.tree.Record;
import ddx.tree.TargetField;

public class RecordNormalizerTest {

  @Test public void lowerCasesAttributesOnly() {
    Record r = Record.builder()
      .masterIndex("3")
      .set(Attribute.COUNTY, " Uasin GISHU ")
      .set(Attribute.HEALTH_LEVEL, "   ")
      .set(TargetField.CLINICIAN, " Pre-eclampsia ")
      .set(TargetField.GPT4_0, "Stroke")
      .build();
    Record n = RecordNormalizer.normalize(r);
    assertEquals("uasin gishu", n.get(Attribute.COUNTY));
    assertNull(n.get(Attribute.HEALTH_LEVEL));
    assertEquals("Pre-eclampsia", n.get(TargetField.CLINICIAN));
    assertEquals("Stroke", n.get(TargetField.GPT4_0));
    assertEquals("3", n.masterIndex());
    // the input record is left alone
    assertEquals(" Uasin GISHU ", r.get(Attribute.COUNTY));
  }

  @Test public void dedupKeepsFirstOccurrence() {
    Record a  = DdxTestUtil.rec("a", "k", "X");
    Record a2 = Record.builder().masterIndex("2")
      .set(Attribute.CLINICAL_PANEL, "a").set(Attribute.COUNTY, "k").set(TargetField.CLINICIAN, "X").build();
    Record b  = DdxTestUtil.rec("b", "k", "X");
    List<Record> res = RecordNormalizer.dedup(Arrays.asList(b, a, a2, b));
    assertEquals(Arrays.asList(b, a), res);
    assertNull(res.get(1).masterIndex());
  }

  @Test public void prepareMergesRecordsDifferingInCase() {
    List<Record> res = RecordNormalizer.prepare(Arrays.asList(
        DdxTestUtil.rec("Child Health", "X"), DdxTestUtil.rec("child health ", "X"), DdxTestUtil.rec("Child Health", "Y")));
    assertEquals(2, res.size());
    assertEquals("child health", res.get(0).get(Attribute.CLINICAL_PANEL));
    assertEquals("Y", res.get(1).get(TargetField.CLINICIAN));
  }
}
