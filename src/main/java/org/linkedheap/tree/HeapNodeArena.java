package org.linkedheap.tree;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.log4j.Logger;
import org.linkedheap.Stamped;
import org.linkedheap.Transactable;
import org.linkedheap.Transaction;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

/**
 * <p>
 * Storage for the nodes of one or more linked heap trees. Each node occupies a slot in the arena holding its value, the slot index of its
 * parent and the ordered slot indices of its children.
 * </p>
 * <p>
 * Ownership runs strictly downward: a node is kept alive by its parent, or by the caller if it is a root. The parent index stored for a
 * child is only a back-reference for upward traversal and has no bearing on the parent's lifetime. When a node's owner releases it, the
 * node and its whole subtree are released immediately. The slot is recycled and its generation bumped so that any outstanding
 * {@link HeapNode} handle to the released node is detectably dead.
 * </p>
 * <p>
 * Every public operation validates its arguments completely before modifying anything, so a failed operation leaves the structure as it
 * was. By default an arena is not thread-safe. An arena {@link Builder#safe(boolean) built safe} guards all access with a single
 * read/write lock, and callers may group several operations atomically with {@link #lock(boolean, Object)}.
 * </p>
 */
public class HeapNodeArena implements Transactable, Stamped {
	private static final Logger log = Logger.getLogger(HeapNodeArena.class);

	/** The default number of node slots an arena allocates up front */
	public static final int DEFAULT_INITIAL_CAPACITY = 16;

	private static final int NO_PARENT = -1;
	private static final int[] NO_CHILDREN = new int[0];

	private final String theDescription;
	private final Transactable theLock;

	private int[] theValues;
	private int[] theParents;
	private int[][] theChildren;
	private int[] theChildCounts;
	private int[] theGenerations;
	private boolean[] isLive;
	private int theSlotCount;

	private int[] theFreeSlots;
	private int theFreeCount;

	private final LinkedHashSet<Integer> theRoots;
	private long theStamp;

	/** Creates an unsafe arena with the default capacity */
	public HeapNodeArena() {
		this("heap-arena", false, DEFAULT_INITIAL_CAPACITY);
	}

	HeapNodeArena(String description, boolean safe, int initialCapacity) {
		theDescription = description;
		theLock = safe ? Transactable.transactable(new ReentrantReadWriteLock(), this) : Transactable.NONE;
		theValues = new int[initialCapacity];
		theParents = new int[initialCapacity];
		theChildren = new int[initialCapacity][];
		theChildCounts = new int[initialCapacity];
		theGenerations = new int[initialCapacity];
		isLive = new boolean[initialCapacity];
		theFreeSlots = new int[initialCapacity];
		theRoots = new LinkedHashSet<>();
	}

	/** @return A builder to configure a new arena */
	public static Builder build() {
		return new Builder();
	}

	@Override
	public Transaction lock(boolean write, Object cause) {
		return theLock.lock(write, cause);
	}

	@Override
	public Transaction tryLock(boolean write, Object cause) {
		return theLock.tryLock(write, cause);
	}

	@Override
	public boolean isLockSupported() {
		return theLock.isLockSupported();
	}

	@Override
	public long getStamp() {
		return theStamp;
	}

	/** @return The description of this arena */
	public String getDescription() {
		return theDescription;
	}

	/**
	 * Creates a new node with no parent and no children. The caller owns it.
	 *
	 * @param value The value for the node
	 * @return The new root node
	 */
	public HeapNode createRoot(int value) {
		try (Transaction t = lock(true, null)) {
			int slot = allocate(value, NO_PARENT);
			theRoots.add(slot);
			theStamp++;
			return handle(slot);
		}
	}

	/**
	 * Creates a new node as the last child of the given parent
	 *
	 * @param parent The node to own the new node
	 * @param value The value for the new node
	 * @return The new child node
	 * @throws DeadReferenceException If the parent has been released
	 */
	public HeapNode attachNewChild(HeapNode parent, int value) {
		try (Transaction t = lock(true, null)) {
			int p = slotOf(parent);
			int slot = allocate(value, p);
			appendChild(p, slot);
			theStamp++;
			return handle(slot);
		}
	}

	/**
	 * <p>
	 * Makes an existing root the last child of the given parent. The parent takes over ownership of the child from the caller.
	 * </p>
	 * <p>
	 * A node that is already owned by a parent cannot be linked again. To move it, {@link #unlink(HeapNode) unlink} it first.
	 * </p>
	 *
	 * @param parent The node to own the child
	 * @param child The root node to attach
	 * @throws AlreadyAttachedException If the child already has a parent
	 * @throws InvalidRelationException If the nodes are the same, if the child is the root of the parent's own tree, or if the nodes belong
	 *         to different arenas
	 * @throws DeadReferenceException If either node has been released
	 */
	public void link(HeapNode parent, HeapNode child) {
		try (Transaction t = lock(true, null)) {
			int p = slotOf(parent);
			int c = slotOf(child);
			if (p == c)
				throw new InvalidRelationException("(" + parent + "): a node cannot be linked to itself");
			if (theParents[c] != NO_PARENT)
				throw new AlreadyAttachedException("(" + child + ") is already attached to " + handle(theParents[c]));
			for (int ancestor = theParents[p]; ancestor != NO_PARENT; ancestor = theParents[ancestor]) {
				if (ancestor == c)
					throw new InvalidRelationException("(" + child + ") is an ancestor of " + parent + "; linking would create a cycle");
			}
			if (log.isDebugEnabled())
				log.debug(theDescription + ": linking " + child + " under " + parent);
			theRoots.remove(c);
			theParents[c] = p;
			appendChild(p, c);
			theStamp++;
		}
	}

	/**
	 * Makes the parent of the given node give up its ownership. The node, with its subtree intact, becomes a root owned by the caller.
	 *
	 * @param child The node to detach from its parent
	 * @return The node, now a root
	 * @throws InvalidRelationException If the node has no parent
	 * @throws DeadReferenceException If the node has been released
	 */
	public HeapNode unlink(HeapNode child) {
		try (Transaction t = lock(true, null)) {
			int c = slotOf(child);
			int p = theParents[c];
			if (p == NO_PARENT)
				throw new InvalidRelationException("(" + child + ") has no parent");
			if (log.isDebugEnabled())
				log.debug(theDescription + ": unlinking " + child + " from " + handle(p));
			removeChild(p, c);
			theParents[c] = NO_PARENT;
			theRoots.add(c);
			theStamp++;
			return child;
		}
	}

	/**
	 * Drops the caller's ownership of a root, releasing it and all its descendants
	 *
	 * @param root The root to release
	 * @throws AlreadyAttachedException If the node is not a root, i.e. it is owned by its parent
	 * @throws DeadReferenceException If the node has already been released
	 */
	public void release(HeapNode root) {
		try (Transaction t = lock(true, null)) {
			int r = slotOf(root);
			if (theParents[r] != NO_PARENT)
				throw new AlreadyAttachedException("(" + root + ") is owned by " + handle(theParents[r]) + "; only its parent may release it");
			theRoots.remove(r);
			releaseSubtree(r);
			theStamp++;
		}
	}

	/**
	 * Makes a parent release one of its direct children. The child is removed from the parent's children and released along with all its
	 * descendants.
	 *
	 * @param parent The parent owning the child
	 * @param child The child to release
	 * @throws InvalidRelationException If the child is not a direct child of the parent
	 * @throws DeadReferenceException If either node has been released
	 */
	public void releaseChild(HeapNode parent, HeapNode child) {
		try (Transaction t = lock(true, null)) {
			int p = slotOf(parent);
			int c = slotOf(child);
			if (theParents[c] != p)
				throw new InvalidRelationException("(" + child + ") is not a direct child of " + parent);
			removeChild(p, c);
			releaseSubtree(c);
			theStamp++;
		}
	}

	void releaseNode(HeapNode node) {
		try (Transaction t = lock(true, null)) {
			int n = slotOf(node);
			if (theParents[n] == NO_PARENT)
				release(node);
			else
				releaseChild(handle(theParents[n]), node);
		}
	}

	/**
	 * Exchanges the values of a parent and one of its direct children. No edge of the structure is changed and no node moves. Only the
	 * two values trade places.
	 *
	 * @param parent The parent node
	 * @param child The direct child of the parent
	 * @throws InvalidRelationException If the child is not a direct child of the parent
	 * @throws DeadReferenceException If either node has been released
	 */
	public void swap(HeapNode parent, HeapNode child) {
		try (Transaction t = lock(true, null)) {
			int p = slotOf(parent);
			int c = slotOf(child);
			if (theParents[c] != p)
				throw new InvalidRelationException("(" + child + ") is not a direct child of " + parent);
			int tmp = theValues[p];
			theValues[p] = theValues[c];
			theValues[c] = tmp;
			theStamp++;
		}
	}

	/**
	 * @param node The node to get the value of
	 * @return The node's current value
	 * @throws DeadReferenceException If the node has been released
	 */
	public int getValue(HeapNode node) {
		try (Transaction t = lock(false, null)) {
			return theValues[slotOf(node)];
		}
	}

	/**
	 * @param node The node to get the child values of
	 * @return The values of the node's direct children, in order
	 * @throws DeadReferenceException If the node has been released
	 */
	public List<Integer> getChildValues(HeapNode node) {
		try (Transaction t = lock(false, null)) {
			int n = slotOf(node);
			int[] values = new int[theChildCounts[n]];
			for (int i = 0; i < values.length; i++)
				values[i] = theValues[theChildren[n][i]];
			return Collections.unmodifiableList(Ints.asList(values));
		}
	}

	/**
	 * @param node The node to get the parent of
	 * @return The node's parent, or null if it is a root
	 * @throws DeadReferenceException If the node has been released
	 */
	public HeapNode getParent(HeapNode node) {
		try (Transaction t = lock(false, null)) {
			int p = theParents[slotOf(node)];
			return p == NO_PARENT ? null : handle(p);
		}
	}

	/**
	 * @param node The node to get the children of
	 * @return A snapshot of the node's direct children, in order
	 * @throws DeadReferenceException If the node has been released
	 */
	public List<HeapNode> getChildren(HeapNode node) {
		try (Transaction t = lock(false, null)) {
			int n = slotOf(node);
			ImmutableList.Builder<HeapNode> children = ImmutableList.builderWithExpectedSize(theChildCounts[n]);
			for (int i = 0; i < theChildCounts[n]; i++)
				children.add(handle(theChildren[n][i]));
			return children.build();
		}
	}

	/**
	 * @param node The node to count the children of
	 * @return The number of children the node owns
	 * @throws DeadReferenceException If the node has been released
	 */
	public int getChildCount(HeapNode node) {
		try (Transaction t = lock(false, null)) {
			return theChildCounts[slotOf(node)];
		}
	}

	/**
	 * @param node The node to check
	 * @return Whether the node has no parent
	 * @throws DeadReferenceException If the node has been released
	 */
	public boolean isRoot(HeapNode node) {
		try (Transaction t = lock(false, null)) {
			return theParents[slotOf(node)] == NO_PARENT;
		}
	}

	/**
	 * @param node The node to check
	 * @return Whether the given handle refers to a live node in this arena
	 */
	public boolean isPresent(HeapNode node) {
		if (node == null || node.getArena() != this)
			return false;
		try (Transaction t = lock(false, null)) {
			return isLive[node.getSlot()] && theGenerations[node.getSlot()] == node.getGeneration();
		}
	}

	/** @return The number of live nodes in this arena */
	public int size() {
		try (Transaction t = lock(false, null)) {
			return theSlotCount - theFreeCount;
		}
	}

	/** @return The live roots of this arena, in the order they became roots */
	public List<HeapNode> getRoots() {
		try (Transaction t = lock(false, null)) {
			ImmutableList.Builder<HeapNode> roots = ImmutableList.builderWithExpectedSize(theRoots.size());
			for (int r : theRoots)
				roots.add(handle(r));
			return roots.build();
		}
	}

	/**
	 * Runs debugging checks on this arena to assure that all structural constraints are currently met:
	 * <ul>
	 * <li>A node's parent lists it as a child exactly once, and every child listed by a node refers back to it</li>
	 * <li>No node is its own ancestor</li>
	 * <li>Every live node is reachable from exactly one root</li>
	 * </ul>
	 *
	 * @throws IllegalStateException If any constraint is violated
	 */
	public void checkValid() {
		try (Transaction t = lock(false, null)) {
			for (int slot = 0; slot < theSlotCount; slot++) {
				if (!isLive[slot])
					continue;
				int p = theParents[slot];
				if (p == NO_PARENT) {
					if (!theRoots.contains(slot))
						throw new IllegalStateException("(#" + slot + "): parentless node is not registered as a root");
				} else {
					if (!isLive[p])
						throw new IllegalStateException("(#" + slot + "): parent #" + p + " has been released");
					int occurrences = 0;
					for (int i = 0; i < theChildCounts[p]; i++) {
						if (theChildren[p][i] == slot)
							occurrences++;
					}
					if (occurrences != 1)
						throw new IllegalStateException("(#" + slot + "): parent #" + p + " lists it " + occurrences + " times");
				}
				for (int i = 0; i < theChildCounts[slot]; i++) {
					int c = theChildren[slot][i];
					if (!isLive[c])
						throw new IllegalStateException("(#" + slot + "): child #" + c + " has been released");
					if (theParents[c] != slot)
						throw new IllegalStateException("(#" + slot + "): child #" + c + "'s parent is not this");
				}
			}
			boolean[] visited = new boolean[theSlotCount];
			int reached = 0;
			int[] stack = new int[Math.max(1, theSlotCount)];
			for (int root : theRoots) {
				if (!isLive[root] || theParents[root] != NO_PARENT)
					throw new IllegalStateException("(#" + root + "): registered root is released or has a parent");
				int depth = 0;
				stack[depth++] = root;
				while (depth > 0) {
					int n = stack[--depth];
					if (visited[n])
						throw new IllegalStateException("(#" + n + "): reached twice; the structure has a cycle or a shared node");
					visited[n] = true;
					reached++;
					for (int i = 0; i < theChildCounts[n]; i++) {
						if (depth == stack.length)
							stack = Arrays.copyOf(stack, stack.length * 2);
						stack[depth++] = theChildren[n][i];
					}
				}
			}
			int live = theSlotCount - theFreeCount;
			if (reached != live)
				throw new IllegalStateException(theDescription + ": " + (live - reached) + " live node(s) are not reachable from any root");
		}
	}

	@Override
	public String toString() {
		return theDescription;
	}

	private HeapNode handle(int slot) {
		return new HeapNode(this, slot, theGenerations[slot]);
	}

	private int slotOf(HeapNode node) {
		if (node == null)
			throw new NullPointerException("node");
		if (node.getArena() != this)
			throw new InvalidRelationException("(" + node + ") does not belong to " + theDescription);
		int slot = node.getSlot();
		if (!isLive[slot] || theGenerations[slot] != node.getGeneration())
			throw new DeadReferenceException("Node #" + slot + " of " + theDescription + " has been released");
		return slot;
	}

	private int allocate(int value, int parent) {
		int slot;
		if (theFreeCount > 0)
			slot = theFreeSlots[--theFreeCount];
		else {
			if (theSlotCount == theValues.length)
				grow();
			slot = theSlotCount++;
		}
		theValues[slot] = value;
		theParents[slot] = parent;
		theChildren[slot] = NO_CHILDREN;
		theChildCounts[slot] = 0;
		isLive[slot] = true;
		return slot;
	}

	private void grow() {
		int capacity = theValues.length * 2;
		theValues = Arrays.copyOf(theValues, capacity);
		theParents = Arrays.copyOf(theParents, capacity);
		theChildren = Arrays.copyOf(theChildren, capacity);
		theChildCounts = Arrays.copyOf(theChildCounts, capacity);
		theGenerations = Arrays.copyOf(theGenerations, capacity);
		isLive = Arrays.copyOf(isLive, capacity);
		theFreeSlots = Arrays.copyOf(theFreeSlots, capacity);
	}

	private void appendChild(int parent, int child) {
		int count = theChildCounts[parent];
		if (count == theChildren[parent].length)
			theChildren[parent] = Arrays.copyOf(theChildren[parent], count == 0 ? 2 : count * 2);
		theChildren[parent][count] = child;
		theChildCounts[parent] = count + 1;
	}

	private void removeChild(int parent, int child) {
		int[] children = theChildren[parent];
		int count = theChildCounts[parent];
		for (int i = 0; i < count; i++) {
			if (children[i] == child) {
				System.arraycopy(children, i + 1, children, i, count - i - 1);
				theChildCounts[parent] = count - 1;
				return;
			}
		}
		throw new IllegalStateException("(#" + parent + "): child #" + child + " is not in its children");
	}

	private void releaseSubtree(int top) {
		int[] stack = new int[] { top };
		int depth = 1;
		int released = 0;
		while (depth > 0) {
			int n = stack[--depth];
			int count = theChildCounts[n];
			if (depth + count > stack.length)
				stack = Arrays.copyOf(stack, Math.max(stack.length * 2, depth + count));
			System.arraycopy(theChildren[n], 0, stack, depth, count);
			depth += count;

			isLive[n] = false;
			theGenerations[n]++;
			theParents[n] = NO_PARENT;
			theChildren[n] = NO_CHILDREN;
			theChildCounts[n] = 0;
			theFreeSlots[theFreeCount++] = n;
			released++;
		}
		if (log.isDebugEnabled())
			log.debug(theDescription + ": released " + released + " node(s) from #" + top);
	}

	/** Configures and builds a {@link HeapNodeArena} */
	public static class Builder {
		private boolean isSafe;
		private int theInitialCapacity;
		private String theDescription;

		Builder() {
			theInitialCapacity = DEFAULT_INITIAL_CAPACITY;
			theDescription = "heap-arena";
		}

		/**
		 * @param safe Whether the arena should guard all access with a read/write lock
		 * @return This builder
		 */
		public Builder safe(boolean safe) {
			isSafe = safe;
			return this;
		}

		/**
		 * @param capacity The number of node slots to allocate up front
		 * @return This builder
		 */
		public Builder withInitialCapacity(int capacity) {
			if (capacity <= 0)
				throw new IllegalArgumentException("Initial capacity must be positive: " + capacity);
			theInitialCapacity = capacity;
			return this;
		}

		/**
		 * @param descrip The description for the arena, used in its {@link HeapNodeArena#toString() toString()} and in log messages
		 * @return This builder
		 */
		public Builder withDescription(String descrip) {
			if (descrip == null)
				throw new NullPointerException("description");
			theDescription = descrip;
			return this;
		}

		/** @return Whether arenas built with this builder will be thread-safe */
		public boolean isSafe() {
			return isSafe;
		}

		/** @return The new arena */
		public HeapNodeArena build() {
			return new HeapNodeArena(theDescription, isSafe, theInitialCapacity);
		}
	}
}
