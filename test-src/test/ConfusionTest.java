package test;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

import ddx.tree.Confusion;
import ddx.tree.TargetField;

public class ConfusionTest {

  @Test public void countsAgreement() {
    Confusion cm = new Confusion(TargetField.GEMINI);
    cm.add("Stroke", "Stroke");
    cm.add("Stroke", "Angina");
    cm.add("Angina", "Angina");
    cm.add("Malaria", "Stroke");
    assertEquals(4, cm.rows());
    assertEquals(2, cm.errors());
    assertEquals(0.5, cm.errorRate(), 1e-12);
    assertEquals(Arrays.asList("Angina", "Malaria", "Stroke"), Arrays.asList(cm.classes().toArray()));
    assertEquals(1, cm.count("Stroke", "Angina"));
    assertEquals(0, cm.count("Angina", "Stroke"));
    assertEquals(0, cm.count("Unseen", "Stroke"));
  }

  @Test public void rendersMatrix() {
    Confusion cm = new Confusion(TargetField.CLINICIAN);
    cm.add("X", "X");
    cm.add("X", "Y");
    cm.add("Y", "Y");
    String s = cm.confusionMatrix();
    String[] lines = s.split("\n");
    assertEquals(3, lines.length);
    assertTrue(lines[0].trim().endsWith("err/class"));
    // row X: one right, one wrong
    assertArrayEquals(new String[] { "X", "1", "1", "0.5" }, lines[1].trim().split(" +"));
    assertArrayEquals(new String[] { "Y", "0", "1", "0" }, lines[2].trim().split(" +"));
    assertTrue(cm.toString().contains("33.33%"));
  }

  @Test public void emptyMatrixHasNoErrors() {
    Confusion cm = new Confusion(TargetField.LLAMA);
    assertEquals(0, cm.rows());
    assertEquals(0.0, cm.errorRate(), 0);
  }
}
