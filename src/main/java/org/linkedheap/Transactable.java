package org.linkedheap;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A mutable structure whose access may be secured against concurrent modification.
 * 
 * Some implementations do not support locking, hence {@link #isLockSupported()}. Such implementations return {@link Transaction#NONE}.
 */
public interface Transactable {
	/** A do-nothing transactable that always returns {@link Transaction#NONE} */
	static Transactable NONE = new NullTransactable();

	/**
	 * <p>
	 * Begins a transaction. Either an exclusive transaction during which no other thread may inspect or modify the structure, or a shared
	 * transaction during which exclusive locks cannot be obtained, allowing safe, stateful inspections.
	 * </p>
	 * <p>
	 * If a conflicting lock is held by another thread, this method blocks until it is able to obtain the lock. A shared lock held by this
	 * thread cannot be upgraded to an exclusive one; attempting to do so will deadlock.
	 * </p>
	 *
	 * @param write Whether to lock for exclusive (modification) or shared (inspection) access
	 * @param cause An object that may have caused the set of modifications to come. May be null, typically unused for read.
	 * @return The transaction to close when calling code is finished accessing or modifying this object
	 */
	Transaction lock(boolean write, Object cause);

	/**
	 * Attempts to begin a transaction. See {@link #lock(boolean, Object)}.
	 *
	 * @param write Whether to lock for exclusive (modification) or shared (inspection) access
	 * @param cause An object that may have caused the set of modifications to come. May be null.
	 * @return The transaction to close when finished, or null if the lock could not be obtained without blocking
	 */
	Transaction tryLock(boolean write, Object cause);

	/** @return Whether this object actually supports locking */
	default boolean isLockSupported() {
		return true;
	}

	/**
	 * @param lock The lock to secure a structure with
	 * @param debugInfo An object describing the owner of the lock, for debugging
	 * @return A transactable backed by the given lock
	 */
	static Transactable transactable(ReentrantReadWriteLock lock, Object debugInfo) {
		if (lock == null)
			return NONE;
		return new RRWLTransactable(lock, debugInfo);
	}

	/** Implements {@link Transactable#NONE} */
	class NullTransactable implements Transactable {
		NullTransactable() {
		}

		@Override
		public Transaction lock(boolean write, Object cause) {
			return Transaction.NONE;
		}

		@Override
		public Transaction tryLock(boolean write, Object cause) {
			return Transaction.NONE;
		}

		@Override
		public boolean isLockSupported() {
			return false;
		}

		@Override
		public String toString() {
			return "UNSAFE";
		}
	}

	/** Implements {@link Transactable#transactable(ReentrantReadWriteLock, Object)} */
	class RRWLTransactable implements Transactable {
		private final ReentrantReadWriteLock theLock;
		private final Object theDebugInfo;

		RRWLTransactable(ReentrantReadWriteLock lock, Object debugInfo) {
			theLock = lock;
			theDebugInfo = debugInfo;
		}

		@Override
		public Transaction lock(boolean write, Object cause) {
			Lock lock = write ? theLock.writeLock() : theLock.readLock();
			lock.lock();
			return lock::unlock;
		}

		@Override
		public Transaction tryLock(boolean write, Object cause) {
			Lock lock = write ? theLock.writeLock() : theLock.readLock();
			if (lock.tryLock())
				return lock::unlock;
			return null;
		}

		@Override
		public String toString() {
			return "Lock for " + theDebugInfo;
		}
	}
}
