package org.linkedheap.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.linkedheap.Transaction;

/** Heap maintenance walks and traversal utilities over {@link HeapNode} trees */
public class HeapNodes {
	private HeapNodes() {
	}

	/**
	 * Moves the value of the given node toward the root, {@link HeapNodeArena#swap(HeapNode, HeapNode) swapping} it with its parent's
	 * value for as long as it is smaller. Stops at the root or when the parent's value is less than or equal to it.
	 *
	 * @param node The node whose value to sift up
	 * @return The node that holds the value when the walk completes
	 * @throws DeadReferenceException If the node has been released
	 */
	public static HeapNode siftUp(HeapNode node) {
		HeapNodeArena arena = node.getArena();
		try (Transaction t = arena.lock(true, null)) {
			HeapNode current = node;
			HeapNode parent = current.getParent();
			while (parent != null && current.getValue() < parent.getValue()) {
				arena.swap(parent, current);
				current = parent;
				parent = current.getParent();
			}
			return current;
		}
	}

	/**
	 * Moves the value of the given node toward the leaves, {@link HeapNodeArena#swap(HeapNode, HeapNode) swapping} it with its smallest
	 * child's value for as long as that child's value is smaller. Among children with equal values, the first is chosen. Stops at a leaf or
	 * when no child's value is smaller.
	 *
	 * @param node The node whose value to sift down
	 * @return The node that holds the value when the walk completes
	 * @throws DeadReferenceException If the node has been released
	 */
	public static HeapNode siftDown(HeapNode node) {
		HeapNodeArena arena = node.getArena();
		try (Transaction t = arena.lock(true, null)) {
			HeapNode current = node;
			while (true) {
				HeapNode smallest = smallestChild(current);
				if (smallest == null || smallest.getValue() >= current.getValue())
					return current;
				arena.swap(current, smallest);
				current = smallest;
			}
		}
	}

	/**
	 * @param node The node to inspect
	 * @return The first of the node's children with the smallest value, or null if the node is a leaf
	 */
	public static HeapNode smallestChild(HeapNode node) {
		HeapNode smallest = null;
		int smallestValue = 0;
		for (HeapNode child : node.getChildren()) {
			int value = child.getValue();
			if (smallest == null || value < smallestValue) {
				smallest = child;
				smallestValue = value;
			}
		}
		return smallest;
	}

	/**
	 * @param root The root of the subtree to check
	 * @return Whether every node in the subtree has a value less than or equal to the values of its children
	 */
	public static boolean isHeapOrdered(HeapNode root) {
		try (Transaction t = root.getArena().lock(false, null)) {
			for (HeapNode node : depthFirst(root)) {
				int value = node.getValue();
				for (int childValue : node.getChildValues()) {
					if (childValue < value)
						return false;
				}
			}
			return true;
		}
	}

	/**
	 * @param root The root of the subtree to count
	 * @return The number of nodes in the subtree, the root included
	 */
	public static int size(HeapNode root) {
		int size = 0;
		try (Transaction t = root.getArena().lock(false, null)) {
			for (Iterator<HeapNode> iter = depthFirst(root).iterator(); iter.hasNext(); iter.next())
				size++;
		}
		return size;
	}

	/**
	 * Iterates over a subtree in pre-order: each node before its children, children in their stored order. The structure must not be
	 * modified during iteration.
	 *
	 * @param root The root of the subtree to iterate
	 * @return An iterable over the subtree's nodes
	 */
	public static Iterable<HeapNode> depthFirst(HeapNode root) {
		if (root == null)
			throw new NullPointerException("root");
		return () -> new Iterator<HeapNode>() {
			private final Deque<HeapNode> theStack = new ArrayDeque<>();

			{
				theStack.push(root);
			}

			@Override
			public boolean hasNext() {
				return !theStack.isEmpty();
			}

			@Override
			public HeapNode next() {
				if (theStack.isEmpty())
					throw new NoSuchElementException();
				HeapNode node = theStack.pop();
				List<HeapNode> children = node.getChildren();
				for (int i = children.size() - 1; i >= 0; i--)
					theStack.push(children.get(i));
				return node;
			}
		};
	}
}
