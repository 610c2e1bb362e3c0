package com.skt.metatron.coltree.tree;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.column.ColumnPath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Named tree with a payload per node. The root has depth 0 and an empty name.
 */
public class TreeNode<D> {
  private final String name;
  private final int depth;
  private final TreeNode<D> parent;
  private final D data;

  private final List<TreeNode<D>> children = new ArrayList<>();
  private final Map<String, TreeNode<D>> childMap = new HashMap<>();

  public interface DataFactory<D> {
    D create(ColumnPath path) throws ColTreeException;
  }

  private TreeNode(String name, int depth, TreeNode<D> parent, D data) {
    this.name = name;
    this.depth = depth;
    this.parent = parent;
    this.data = data;
  }

  public static <D> TreeNode<D> createRoot(D data) {
    return new TreeNode<>("", 0, null, data);
  }

  public String name() {
    return name;
  }

  public int depth() {
    return depth;
  }

  public TreeNode<D> parent() {
    return parent;
  }

  public D data() {
    return data;
  }

  public List<TreeNode<D>> children() {
    return Collections.unmodifiableList(children);
  }

  public TreeNode<D> get(String childName) {
    return childMap.get(childName);
  }

  public TreeNode<D> addChild(String childName, D childData) {
    TreeNode<D> child = new TreeNode<>(childName, depth + 1, this, childData);
    children.add(child);
    childMap.put(childName, child);
    return child;
  }

  /**
   * Walks {@code path} from this node, creating missing nodes with data made by {@code factory}
   * from the path of the node being created.
   */
  public TreeNode<D> getOrPut(ColumnPath path, DataFactory<D> factory) throws ColTreeException {
    TreeNode<D> node = this;
    for (int i = 0; i < path.size(); i++) {
      TreeNode<D> child = node.get(path.get(i));
      if (child == null) {
        child = node.addChild(path.get(i), factory.create(path.take(i + 1)));
      }
      node = child;
    }
    return node;
  }

  public TreeNode<D> getRoot() {
    TreeNode<D> node = this;
    while (node.parent != null) {
      node = node.parent;
    }
    return node;
  }

  public TreeNode<D> getAncestor(int ancestorDepth) {
    if (ancestorDepth > depth) {
      throw new IllegalArgumentException(String.format("getAncestor(): depth %d is below node depth %d", ancestorDepth, depth));
    }
    TreeNode<D> node = this;
    while (node.depth > ancestorDepth) {
      node = node.parent;
    }
    return node;
  }

  public ColumnPath pathFromRoot() {
    List<String> names = new ArrayList<>();
    TreeNode<D> node = this;
    while (node.parent != null) {
      names.add(node.name);
      node = node.parent;
    }
    Collections.reverse(names);
    return ColumnPath.of(names);
  }

  /**
   * Descendants of this node matching {@code filter}, in pre-order. This node is not included.
   */
  public List<TreeNode<D>> dfs(Predicate<TreeNode<D>> filter) {
    List<TreeNode<D>> result = new ArrayList<>();
    for (TreeNode<D> child : children) {
      if (filter.test(child)) {
        result.add(child);
      }
      result.addAll(child.dfs(filter));
    }
    return result;
  }

  @Override
  public String toString() {
    return pathFromRoot() + ": " + data;
  }
}
