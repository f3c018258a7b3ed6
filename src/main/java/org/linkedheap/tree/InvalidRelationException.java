package org.linkedheap.tree;

/**
 * Thrown when an operation is given nodes that do not stand in the relation it requires, e.g. a {@link HeapNodeArena#swap(HeapNode, HeapNode)
 * swap} with a node that is not a direct child, or a {@link HeapNodeArena#link(HeapNode, HeapNode) link} that would make a node its own
 * ancestor
 */
public class InvalidRelationException extends IllegalArgumentException {
	/** @param message The message for the exception */
	public InvalidRelationException(String message) {
		super(message);
	}
}
