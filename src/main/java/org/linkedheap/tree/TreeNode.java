package org.linkedheap.tree;

import java.util.List;

/**
 * A node in a tree whose edges run both ways: down to owned children and up to the parent
 *
 * @param <N> The sub-type of the node
 */
public interface TreeNode<N extends TreeNode<N>> {
	/** @return This node's parent node, or null if this node is a root */
	N getParent();

	/** @return All of this node's child nodes, in order */
	List<N> getChildren();

	/** @return Whether this node has no parent */
	default boolean isRoot() {
		return getParent() == null;
	}

	/** @return The root of the tree structure holding this node */
	default N getRoot() {
		N root = (N) this;
		N parent = root.getParent();
		while (parent != null) {
			root = parent;
			parent = root.getParent();
		}
		return root;
	}

	/** @return The number of edges between this node and its root */
	default int getDepth() {
		int depth = 0;
		N parent = getParent();
		while (parent != null) {
			depth++;
			parent = parent.getParent();
		}
		return depth;
	}
}
