package org.linkedheap.tree;

/** Thrown when an operation is attempted through a {@link HeapNode} handle whose node has been released */
public class DeadReferenceException extends IllegalStateException {
	/** @param message The message for the exception */
	public DeadReferenceException(String message) {
		super(message);
	}
}
