package test;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import ddx.parser.RecordNormalizer;
import ddx.parser.RecordParser;
import ddx.tree.Attribute;
import ddx.tree.Confusion;
import ddx.tree.MultiTargetPredictor;
import ddx.tree.Prediction;
import ddx.tree.Record;
import ddx.tree.Statistic;
import ddx.tree.TargetField;
import ddx.tree.Tree.BranchNode;
import ddx.tree.TreeParams;

public class MultiTargetPredictorTest {
  static List<Record> TRAIN;

  @BeforeClass public static void load() throws Exception {
    TRAIN = RecordNormalizer.prepare(RecordParser.parse(DdxTestUtil.TRAIN));
  }

  static Record labelled(String panel, String clinician, String gpt, String llama, String gemini, String snomed) {
    return Record.builder()
      .set(Attribute.CLINICAL_PANEL, panel)
      .set(TargetField.CLINICIAN, clinician)
      .set(TargetField.GPT4_0, gpt)
      .set(TargetField.LLAMA, llama)
      .set(TargetField.GEMINI, gemini)
      .set(TargetField.DDX_SNOMED, snomed)
      .build();
  }

  @Test public void predictsEveryTarget() {
    List<Record> rs = new ArrayList<Record>();
    rs.add(labelled("A", "X", "X1", "X2", "X3", "1"));
    rs.add(labelled("A", "X", "X1", "X2", "X3", "1"));
    rs.add(labelled("B", "Y", "Y1", "Y2", "Y3", "2"));
    rs.add(labelled("B", "Y", "Y1", "Y2", "Y3", "2"));
    MultiTargetPredictor p = MultiTargetPredictor.build(rs, new TreeParams(1, 2, 0.0));
    Prediction a = p.predict(DdxTestUtil.rec("a", null));
    assertEquals("X", a.clinician());
    assertEquals("X1", a.gpt4_0());
    assertEquals("X2", a.llama());
    assertEquals("X3", a.gemini());
    assertEquals("1", a.ddxSnomed());
    Prediction b = p.predict(DdxTestUtil.rec("B", null));
    assertEquals("Y", b.get(TargetField.CLINICIAN));
    assertEquals("2", b.get(TargetField.DDX_SNOMED));
    for( TargetField t : TargetField.values() )
      assertEquals(Attribute.CLINICAL_PANEL, ((BranchNode) p.tree(t).root()).attribute());
  }

  @Test public void recordWithoutAttributesGetsRootMajority() {
    MultiTargetPredictor p = MultiTargetPredictor.build(TRAIN, TreeParams.DEFAULT);
    Prediction pr = p.predict(DdxTestUtil.empty());
    for( TargetField t : TargetField.values() ) {
      assertNotNull(pr.get(t));
      assertEquals(Statistic.majority(TRAIN, t), pr.get(t));
    }
  }

  @Test public void unlabelledTargetPredictsUnknown() {
    List<Record> rs = DdxTestUtil.panels("a","X", "b","Y");
    MultiTargetPredictor p = MultiTargetPredictor.build(rs, TreeParams.DEFAULT);
    Prediction pr = p.predict(DdxTestUtil.rec("a", null));
    assertEquals("X", pr.clinician());
    assertEquals(Statistic.UNKNOWN, pr.gemini());
  }

  @Test public void parallelBuildPredictsLikeSequential() {
    MultiTargetPredictor seq = MultiTargetPredictor.build(TRAIN, TreeParams.DEFAULT);
    MultiTargetPredictor par = MultiTargetPredictor.build(TRAIN, TreeParams.DEFAULT, 4);
    for( TargetField t : TargetField.values() )
      assertEquals(seq.tree(t).toString(), par.tree(t).toString());
    for( Record r : TRAIN ) assertEquals(seq.predict(r), par.predict(r));
  }

  @Test public void trainingRecordsAreNotModified() {
    List<Record> copy = new ArrayList<Record>(TRAIN);
    MultiTargetPredictor.build(TRAIN, TreeParams.DEFAULT, 2);
    assertEquals(copy, TRAIN);
  }

  @Test public void errsOnlyOnConflictingLabels() {
    MultiTargetPredictor p = MultiTargetPredictor.build(TRAIN, TreeParams.DEFAULT);
    EnumMap<TargetField,Confusion> cms = p.validate(TRAIN);
    // one record carries no clinician label
    assertEquals(TRAIN.size() - 1, cms.get(TargetField.CLINICIAN).rows());
    assertEquals(TRAIN.size(), cms.get(TargetField.LLAMA).rows());
    // identical settings with different labels: the maternal pair disagrees
    // everywhere, the three adult health records on clinician and GPT4.0
    assertEquals(2, cms.get(TargetField.CLINICIAN).errors());
    assertEquals(3, cms.get(TargetField.GPT4_0).errors());
  }

  @Test(expected = IllegalArgumentException.class)
  public void zeroThreadsIsRejected() {
    MultiTargetPredictor.build(TRAIN, TreeParams.DEFAULT, 0);
  }
}
