package ddx.tree;

import ddx.tree.Tree.BranchNode;
import ddx.tree.Tree.INode;
import ddx.tree.Tree.LeafNode;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.Map;

/** Writes trees in the Graphviz dot language, one digraph per call. */
public class GraphvizTreePrinter extends TreePrinter {
  private final Appendable _dest;

  public GraphvizTreePrinter(OutputStream dest) {
    this(new OutputStreamWriter(dest, StandardCharsets.UTF_8));
  }

  public GraphvizTreePrinter(Appendable dest) {
    _dest = dest;
  }

  public void printPredictor(MultiTargetPredictor p) throws IOException {
    _dest.append("digraph {\n");
    for (TargetField t : TargetField.values()) {
      Tree tree = p.tree(t);
      int obj = System.identityHashCode(tree);
      _dest.append(String.format("%d [shape=box,label=\"%s\"];\n", obj, t.colName()));
      tree._tree.print(this);
      _dest.append(String.format("%d -> %d;\n", obj, System.identityHashCode(tree._tree)));
    }
    _dest.append("}");
    if( _dest instanceof Flushable ) ((Flushable) _dest).flush();
  }

  public void printTree(Tree t) throws IOException {
    _dest.append("digraph {\n");
    t._tree.print(this);
    _dest.append("}");
    if( _dest instanceof Flushable ) ((Flushable) _dest).flush();
  }

  void printNode(LeafNode t) throws IOException {
    int obj = System.identityHashCode(t);
    _dest.append(String.format("%d [label=\"%s\\n%s\"];\n",
        obj, "Leaf Node",
        MessageFormat.format("Class {0}", escape(t._value))));
  }

  void printNode(BranchNode t) throws IOException {
    int obj = System.identityHashCode(t);

    _dest.append(String.format("%d [label=\"%s\\n%s\"];\n",
        obj, "Node",
        MessageFormat.format("{0} (majority {1})",
            t._attribute.colName(), escape(t._majority))));

    for (Map.Entry<String,INode> e : t._children.entrySet()) {
      e.getValue().print(this);
      int child = System.identityHashCode(e.getValue());
      _dest.append(String.format("%d -> %d [label=\"%s\"];\n", obj, child, escape(e.getKey())));
    }
  }

  private static String escape(String s) { return s.replace("\\", "\\\\").replace("\"", "\\\""); }
}
