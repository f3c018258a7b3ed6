package org.linkedheap.tree;

import java.util.List;

/**
 * <p>
 * A handle to a single element of a linked heap structure held in a {@link HeapNodeArena}. The arena stores the node's value, the
 * owning references to its children and the non-owning reference to its parent. This class only identifies the node.
 * </p>
 * <p>
 * A handle stays valid for as long as the node it refers to is alive, i.e. until the node's owner (its parent, or the caller if it is a
 * root) releases it. After that, {@link #isPresent()} returns false and every other operation through the handle throws a
 * {@link DeadReferenceException}, even if the arena has since recycled the node's storage for a new node.
 * </p>
 * <p>
 * Handles are compared by identity of the node they refer to. Two handles obtained separately for the same node are equal.
 * </p>
 */
public final class HeapNode implements TreeNode<HeapNode> {
	private final HeapNodeArena theArena;
	private final int theSlot;
	private final int theGeneration;

	HeapNode(HeapNodeArena arena, int slot, int generation) {
		theArena = arena;
		theSlot = slot;
		theGeneration = generation;
	}

	/** @return The arena that this node belongs (or used to belong) to */
	public HeapNodeArena getArena() {
		return theArena;
	}

	int getSlot() {
		return theSlot;
	}

	int getGeneration() {
		return theGeneration;
	}

	/** @return This node's heap key */
	public int getValue() {
		return theArena.getValue(this);
	}

	/** @return The values of this node's direct children, in order. Empty for a leaf. */
	public List<Integer> getChildValues() {
		return theArena.getChildValues(this);
	}

	@Override
	public HeapNode getParent() {
		return theArena.getParent(this);
	}

	@Override
	public List<HeapNode> getChildren() {
		return theArena.getChildren(this);
	}

	/** @return The number of children this node owns */
	public int getChildCount() {
		return theArena.getChildCount(this);
	}

	@Override
	public boolean isRoot() {
		return theArena.isRoot(this);
	}

	/** @return Whether the node this handle refers to is still alive */
	public boolean isPresent() {
		return theArena.isPresent(this);
	}

	/**
	 * @param value The value for the new child
	 * @return The new child node, appended to the end of this node's children
	 * @see HeapNodeArena#attachNewChild(HeapNode, int)
	 */
	public HeapNode addChild(int value) {
		return theArena.attachNewChild(this, value);
	}

	/**
	 * @param child The root node to make a child of this node
	 * @return This node
	 * @see HeapNodeArena#link(HeapNode, HeapNode)
	 */
	public HeapNode addChild(HeapNode child) {
		theArena.link(this, child);
		return this;
	}

	/**
	 * @param child The direct child of this node to exchange values with
	 * @see HeapNodeArena#swap(HeapNode, HeapNode)
	 */
	public void swapWith(HeapNode child) {
		theArena.swap(this, child);
	}

	/**
	 * Detaches this node from its parent, making it a root owned by the caller
	 *
	 * @return This node
	 * @see HeapNodeArena#unlink(HeapNode)
	 */
	public HeapNode unlink() {
		return theArena.unlink(this);
	}

	/**
	 * Releases this node and its whole subtree. If this node is a root, it is released by the caller; otherwise by its parent.
	 *
	 * @see HeapNodeArena#release(HeapNode)
	 * @see HeapNodeArena#releaseChild(HeapNode, HeapNode)
	 */
	public void release() {
		theArena.releaseNode(this);
	}

	@Override
	public int hashCode() {
		return theSlot * 31 + theGeneration;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		else if (!(obj instanceof HeapNode))
			return false;
		HeapNode other = (HeapNode) obj;
		return theArena == other.theArena && theSlot == other.theSlot && theGeneration == other.theGeneration;
	}

	@Override
	public String toString() {
		if (!isPresent())
			return "(released node #" + theSlot + ")";
		return String.valueOf(getValue());
	}
}
