package ddx.tree;

import ddx.tree.Tree.BranchNode;
import ddx.tree.Tree.LeafNode;

import java.io.IOException;

public abstract class TreePrinter {
  public abstract void printPredictor(MultiTargetPredictor p) throws IOException;
  public abstract void printTree(Tree t) throws IOException;
  abstract void printNode(LeafNode t) throws IOException;
  abstract void printNode(BranchNode t) throws IOException;
}
