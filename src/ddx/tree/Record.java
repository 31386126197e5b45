package ddx.tree;

import java.util.Arrays;

import com.google.common.base.MoreObjects;

/**
 * One input row: a value per {@link Attribute} and per {@link TargetField},
 * null where the value is absent. Records are immutable; {@link #with} returns
 * a modified copy.
 *
 * The optional master index identifies the source row and takes no part in
 * equality.
 */
public final class Record {
  final String   _masterIndex;
  final String[] _attrs;        // indexed by Attribute.ordinal()
  final String[] _targets;      // indexed by TargetField.ordinal()

  Record(String masterIndex, String[] attrs, String[] targets) {
    assert attrs.length == Attribute.values().length;
    assert targets.length == TargetField.values().length;
    _masterIndex = masterIndex;
    _attrs = attrs;
    _targets = targets;
  }

  public String masterIndex()       { return _masterIndex;                }
  public String get(Attribute a)    { return _attrs[a.ordinal()];         }
  public String get(TargetField t)  { return _targets[t.ordinal()];       }
  public boolean has(Attribute a)   { return _attrs[a.ordinal()] != null; }
  public boolean has(TargetField t) { return _targets[t.ordinal()] != null; }

  public Record with(Attribute a, String value) {
    String[] attrs = _attrs.clone();
    attrs[a.ordinal()] = value;
    return new Record(_masterIndex, attrs, _targets);
  }

  public Record with(TargetField t, String value) {
    String[] targets = _targets.clone();
    targets[t.ordinal()] = value;
    return new Record(_masterIndex, _attrs, targets);
  }

  public static Builder builder() { return new Builder(); }

  @Override public boolean equals(Object o) {
    if( this == o ) return true;
    if( !(o instanceof Record) ) return false;
    Record r = (Record) o;
    return Arrays.equals(_attrs, r._attrs) && Arrays.equals(_targets, r._targets);
  }

  @Override public int hashCode() {
    return 31 * Arrays.hashCode(_attrs) + Arrays.hashCode(_targets);
  }

  @Override public String toString() {
    MoreObjects.ToStringHelper h = MoreObjects.toStringHelper(this).omitNullValues();
    h.add("master_index", _masterIndex);
    for( Attribute a : Attribute.values() )     h.add(a.colName(), get(a));
    for( TargetField t : TargetField.values() ) h.add(t.colName(), get(t));
    return h.toString();
  }

  public static final class Builder {
    private String _masterIndex;
    private final String[] _attrs   = new String[Attribute.values().length];
    private final String[] _targets = new String[TargetField.values().length];

    public Builder masterIndex(String s)          { _masterIndex = s; return this;             }
    public Builder set(Attribute a, String v)     { _attrs[a.ordinal()] = v; return this;      }
    public Builder set(TargetField t, String v)   { _targets[t.ordinal()] = v; return this;    }

    /** Sets a value by column name (snake-case or CSV header). Returns false
     * if the name is no attribute or target. */
    public boolean set(String column, String v) {
      Attribute a = Attribute.byName(column);
      if( a != null ) { set(a, v); return true; }
      TargetField t = TargetField.byName(column);
      if( t != null ) { set(t, v); return true; }
      return false;
    }

    public Record build() { return new Record(_masterIndex, _attrs.clone(), _targets.clone()); }
  }
}
