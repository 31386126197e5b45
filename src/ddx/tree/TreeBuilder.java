package ddx.tree;

import ddx.tree.Tree.BranchNode;
import ddx.tree.Tree.INode;
import ddx.tree.Tree.LeafNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** Grows the nodes of one tree by recursive partitioning on the attribute
 * with the best gain ratio.
 *
 * Pruning by depth and record count takes priority over the purity check. A
 * partition too small to split becomes a leaf holding the parent's majority.
 */
class TreeBuilder {
  final TargetField _target;
  final TreeParams _params;

  TreeBuilder(TargetField target, TreeParams params) {
    _target = target;
    _params = params;
  }

  INode build(List<Record> records) {
    return build(records, Attribute.sorted(), 0);
  }

  INode build(List<Record> records, List<Attribute> attributes, int depth) {
    String majority = Statistic.majority(records, _target);
    if( records.isEmpty() )
      return new LeafNode(Statistic.UNKNOWN);
    if( depth >= _params._maxDepth || records.size() < _params._minSamplesLeaf )
      return new LeafNode(majority);
    String pure = Statistic.pure(records, _target);
    if( pure != null )
      return new LeafNode(pure);
    if( attributes.isEmpty() )
      return new LeafNode(majority);

    Statistic.Split split = Statistic.bestSplit(records, attributes, _target);
    if( split._gainRatio < _params._minGainRatio )
      return new LeafNode(majority);

    SortedMap<String,List<Record>> parts = Statistic.partition(records, split._attribute);
    // nobody carries the attribute, a branch would only ever answer its majority
    if( parts.isEmpty() )
      return new LeafNode(majority);

    List<Attribute> rem = new ArrayList<Attribute>(attributes);
    rem.remove(split._attribute);
    SortedMap<String,INode> children = new TreeMap<String,INode>();
    for( Map.Entry<String,List<Record>> e : parts.entrySet() ) {
      List<Record> subset = e.getValue();
      children.put(e.getKey(), subset.size() < _params._minSamplesLeaf
                   ? new LeafNode(majority)
                   : build(subset, rem, depth + 1));
    }
    return new BranchNode(split._attribute, children, majority);
  }
}
