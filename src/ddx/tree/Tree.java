package ddx.tree;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;

import ddx.Log;

/** A decision tree predicting a single target field. */
public class Tree {
  /** Value looked up for a record that has no value for a branch attribute. */
  public static final String MISSING = "missing";

  final TargetField _target;    // Field the tree predicts
  final INode _tree;            // Root of decision tree
  final long _time;             // Build time in msec

  Tree(TargetField target, INode root, long time) {
    _target = target;
    _tree = root;
    _time = time;
  }

  /** Builds the tree for the target from the records. The records are only read. */
  public static Tree build(List<Record> records, TargetField target, TreeParams params) {
    long start = System.currentTimeMillis();
    INode root = new TreeBuilder(target, params).build(records);
    Tree t = new Tree(target, root, System.currentTimeMillis() - start);
    // report & bookkeeping
    StringBuilder sb = new StringBuilder();
    sb.append("Tree ").append(target).append(": d=").append(t.depth());
    sb.append(" leaves=").append(t.leaves()).append(" rows=").append(records.size());
    sb.append(" time=").append(t._time).append("ms  ");
    Log.info(t._tree.toString(sb, 150).toString());
    return t;
  }

  /** Predicts the target for the record. Never null. */
  public String predict(Record r) { return _tree.classify(r); }

  public TargetField target() { return _target; }
  public INode root()         { return _tree;   }
  public long time()          { return _time;   }
  public int leaves()         { return _tree.leaves(); }
  public int depth()          { return _tree.depth();  }
  @Override public String toString() { return _tree.toString(new StringBuilder(), Integer.MAX_VALUE).toString(); }

  public static abstract class INode {
    abstract String classify(Record r);
    public abstract int depth();  // Depth of deepest leaf
    public abstract int leaves(); // Number of leaves
    abstract StringBuilder toString(StringBuilder sb, int len);
    public abstract void print(TreePrinter treePrinter) throws IOException;
  }

  /** Leaf node that for any record returns its class value. */
  public static class LeafNode extends INode {
    final String _value;
    LeafNode(String value) {
      assert value != null;
      _value = value;
    }
    public String value() { return _value; }
    @Override String classify(Record r) { return _value; }
    @Override public int depth()  { return 0; }
    @Override public int leaves() { return 1; }
    @Override StringBuilder toString(StringBuilder sb, int n) { return sb.append('[').append(_value).append(']'); }
    @Override public void print(TreePrinter p) throws IOException { p.printNode(this); }
  }

  /** Inner node: one child per value of the split attribute, plus the
   * majority class of the records the node was built from. */
  public static class BranchNode extends INode {
    final Attribute _attribute;
    final SortedMap<String,INode> _children;
    final String _majority;
    final int _depth, _leaves;

    BranchNode(Attribute attribute, SortedMap<String,INode> children, String majority) {
      assert !children.isEmpty();
      _attribute = attribute;
      _children = Collections.unmodifiableSortedMap(children);
      _majority = majority;
      int d = 0, l = 0;
      for( INode n : _children.values() ) {
        d = Math.max(d, n.depth());
        l += n.leaves();
      }
      _depth = d + 1;
      _leaves = l;
    }

    public Attribute attribute()            { return _attribute; }
    public SortedMap<String,INode> children() { return _children;  }
    public String majority()                { return _majority;  }

    /** Child for the value: exact key first, then the first key equal to it
     * once both are lower-cased. Null if there is none. */
    INode child(String value) {
      INode n = _children.get(value);
      if( n != null ) return n;
      String lower = value.toLowerCase(Locale.ROOT);
      for( Map.Entry<String,INode> e : _children.entrySet() )
        if( e.getKey().toLowerCase(Locale.ROOT).equals(lower) ) return e.getValue();
      return null;
    }

    @Override String classify(Record r) {
      String v = r.get(_attribute);
      INode n = child(v == null ? MISSING : v);
      String res = n == null ? null : n.classify(r);
      return res == null ? _majority : res;
    }

    @Override public int depth()  { return _depth;  }
    @Override public int leaves() { return _leaves; }

    @Override StringBuilder toString(StringBuilder sb, int n) {
      sb.append(_attribute).append(" {");
      boolean first = true;
      for( Map.Entry<String,INode> e : _children.entrySet() ) {
        if( sb.length() > n ) return sb;
        if( !first ) sb.append(',');
        first = false;
        sb.append(e.getKey()).append(':');
        e.getValue().toString(sb, n);
      }
      if( sb.length() > n ) return sb;
      return sb.append("} |").append(_majority);
    }

    @Override public void print(TreePrinter p) throws IOException { p.printNode(this); }
  }
}
