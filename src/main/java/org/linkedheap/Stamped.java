package org.linkedheap;

/** An Object that provides a stamp that changes when it is modified */
public interface Stamped {
	/**
	 * <p>
	 * Obtains a stamp with the current status of modifications to this object. Whenever this object is modified, the stamp changes. Thus 2
	 * stamps can be compared to determine whether an object has changed in between 2 calls to this method.
	 * </p>
	 * <p>
	 * The value returned from this method is <b>ONLY</b> for comparison. It is not guaranteed to reveal anything about the structure or
	 * its history, e.g. the actual number of times it has been modified.
	 * </p>
	 * 
	 * @return The stamp for comparison
	 */
	long getStamp();
}
