package ddx.tree;

import java.util.Arrays;

import com.google.common.base.MoreObjects;

/** The predicted value of every target field for one record. */
public final class Prediction {
  final String[] _values;       // indexed by TargetField.ordinal()

  Prediction(String[] values) {
    assert values.length == TargetField.values().length;
    _values = values;
  }

  public String get(TargetField t) { return _values[t.ordinal()]; }

  public String clinician() { return get(TargetField.CLINICIAN);  }
  public String gpt4_0()    { return get(TargetField.GPT4_0);     }
  public String llama()     { return get(TargetField.LLAMA);      }
  public String gemini()    { return get(TargetField.GEMINI);     }
  public String ddxSnomed() { return get(TargetField.DDX_SNOMED); }

  @Override public boolean equals(Object o) {
    return o instanceof Prediction && Arrays.equals(_values, ((Prediction) o)._values);
  }

  @Override public int hashCode() { return Arrays.hashCode(_values); }

  @Override public String toString() {
    MoreObjects.ToStringHelper h = MoreObjects.toStringHelper(this);
    for( TargetField t : TargetField.values() ) h.add(t.colName(), get(t));
    return h.toString();
  }
}
