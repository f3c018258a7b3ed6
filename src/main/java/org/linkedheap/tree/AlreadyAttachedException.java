package org.linkedheap.tree;

/** Thrown when a node that is owned by a parent is used where a caller-owned root is required */
public class AlreadyAttachedException extends IllegalStateException {
	/** @param message The message for the exception */
	public AlreadyAttachedException(String message) {
		super(message);
	}
}
