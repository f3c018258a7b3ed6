package org.linkedheap;

/** Represents a span of locked access to a structure, after which the {@link #close()} method must be called */
@FunctionalInterface
public interface Transaction extends AutoCloseable {
	/** A transaction that holds nothing */
	static Transaction NONE = () -> {
	};

	@Override
	void close();
}
