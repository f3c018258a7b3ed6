package org.linkedheap.tree;

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

/** Tests construction, linking, value exchange and read access of {@link HeapNode}s */
public class HeapNodeTest {
	private HeapNodeArena theArena;

	@Before
	public void setUp() {
		theArena = new HeapNodeArena();
	}

	@Test
	public void testNewRoot() {
		HeapNode node = theArena.createRoot(7);
		assertEquals(7, node.getValue());
		assertNull(node.getParent());
		assertTrue(node.isRoot());
		assertEquals(Collections.emptyList(), node.getChildren());
		assertEquals(Collections.emptyList(), node.getChildValues());
		assertEquals(0, node.getChildCount());
	}

	@Test
	public void testValuesAreIndependent() {
		HeapNode node1 = theArena.createRoot(10);
		HeapNode node2 = theArena.createRoot(7);
		assertEquals(node1.getValue(), 3 + node2.getValue());
	}

	@Test
	public void testOneNewChild() {
		HeapNode parent = theArena.createRoot(5);
		HeapNode child = theArena.attachNewChild(parent, 24);
		assertEquals(asList(24), parent.getChildValues());
		assertEquals(parent, child.getParent());
		assertFalse(child.isRoot());
		assertEquals(asList(child), parent.getChildren());
		theArena.checkValid();
	}

	@Test
	public void testNewChildrenAppendInOrder() {
		HeapNode parent = theArena.createRoot(1);
		parent.addChild(9);
		parent.addChild(4);
		parent.addChild(4);
		assertEquals(asList(9, 4, 4), parent.getChildValues());
		theArena.checkValid();
	}

	@Test
	public void testParentChildRelationship() {
		HeapNode leaf = theArena.createRoot(3);
		HeapNode branch = theArena.createRoot(5);

		theArena.link(branch, leaf);

		assertEquals(branch, leaf.getParent());
		assertEquals(branch.getValue(), leaf.getParent().getValue());
		assertEquals(leaf, branch.getChildren().get(0));
		assertEquals(leaf.getValue(), branch.getChildren().get(0).getValue());
		assertEquals(asList(branch), theArena.getRoots());
		theArena.checkValid();
	}

	@Test
	public void testChildValues() {
		HeapNode node1 = theArena.createRoot(1);
		HeapNode node2 = theArena.createRoot(2);
		HeapNode node3 = theArena.createRoot(3);

		theArena.link(node1, node2);
		node1.addChild(node3);

		assertEquals(asList(2, 3), node1.getChildValues());
	}

	@Test
	public void testLinkConsistency() {
		HeapNode p = theArena.createRoot(0);
		HeapNode other = theArena.createRoot(0);
		HeapNode c = theArena.createRoot(1);
		theArena.link(p, c);
		assertEquals(p.getChildren().contains(c), p.equals(c.getParent()));
		assertEquals(other.getChildren().contains(c), other.equals(c.getParent()));
		assertFalse(other.getChildren().contains(c));
	}

	@Test
	public void testRelinkForbidden() {
		HeapNode first = theArena.createRoot(1);
		HeapNode second = theArena.createRoot(2);
		HeapNode child = first.addChild(10);
		try {
			theArena.link(second, child);
			fail("Re-linking an attached node should fail");
		} catch (AlreadyAttachedException e) {
			// expected
		}
		assertEquals(first, child.getParent());
		assertEquals(asList(10), first.getChildValues());
		assertEquals(Collections.emptyList(), second.getChildValues());
		theArena.checkValid();
	}

	@Test
	public void testRelinkAfterUnlink() {
		HeapNode first = theArena.createRoot(1);
		HeapNode second = theArena.createRoot(2);
		HeapNode child = first.addChild(10);
		child.addChild(20);

		child.unlink();
		assertTrue(child.isRoot());
		assertEquals(Collections.emptyList(), first.getChildValues());
		assertEquals(asList(20), child.getChildValues());

		second.addChild(child);
		assertEquals(second, child.getParent());
		assertEquals(asList(10), second.getChildValues());
		assertEquals(asList(20), child.getChildValues());
		theArena.checkValid();
	}

	@Test(expected = InvalidRelationException.class)
	public void testUnlinkRoot() {
		theArena.createRoot(1).unlink();
	}

	@Test
	public void testLinkRejectsCycles() {
		HeapNode root = theArena.createRoot(1);
		HeapNode grandchild = root.addChild(2).addChild(3);
		try {
			theArena.link(grandchild, root);
			fail("Linking a root beneath its own descendant should fail");
		} catch (InvalidRelationException e) {
			// expected
		}
		try {
			theArena.link(root, root);
			fail("Linking a node to itself should fail");
		} catch (InvalidRelationException e) {
			// expected
		}
		assertTrue(root.isRoot());
		theArena.checkValid();
	}

	@Test(expected = InvalidRelationException.class)
	public void testLinkAcrossArenas() {
		HeapNodeArena other = new HeapNodeArena();
		theArena.link(theArena.createRoot(1), other.createRoot(2));
	}

	@Test
	public void testSwap() {
		HeapNode root = theArena.createRoot(5);
		HeapNode left = root.addChild(24);
		HeapNode right = root.addChild(3);
		assertEquals(asList(24, 3), root.getChildValues());

		theArena.swap(root, right);
		assertEquals(3, root.getValue());
		assertEquals(5, right.getValue());
		assertEquals(asList(24, 5), root.getChildValues());
		assertEquals(asList(left, right), root.getChildren());
		assertEquals(root, right.getParent());
		theArena.checkValid();
	}

	@Test
	public void testSwapTwiceRestores() {
		HeapNode root = theArena.createRoot(8);
		HeapNode child = root.addChild(2);
		HeapNode grandchild = child.addChild(6);
		List<HeapNode> rootChildren = root.getChildren();
		List<HeapNode> childChildren = child.getChildren();

		root.swapWith(child);
		assertEquals(2, root.getValue());
		assertEquals(8, child.getValue());
		assertEquals(rootChildren, root.getChildren());
		assertEquals(childChildren, child.getChildren());
		assertEquals(child, grandchild.getParent());

		root.swapWith(child);
		assertEquals(8, root.getValue());
		assertEquals(2, child.getValue());
		assertEquals(6, grandchild.getValue());
		assertEquals(rootChildren, root.getChildren());
		assertEquals(childChildren, child.getChildren());
		theArena.checkValid();
	}

	@Test
	public void testSwapRejectsNonChildren() {
		HeapNode root = theArena.createRoot(5);
		HeapNode child = root.addChild(7);
		HeapNode grandchild = child.addChild(9);
		HeapNode stranger = theArena.createRoot(1);

		assertSwapFails(root, grandchild);
		assertSwapFails(root, stranger);
		assertSwapFails(child, root);
		assertSwapFails(root, root);

		assertEquals(5, root.getValue());
		assertEquals(7, child.getValue());
		assertEquals(9, grandchild.getValue());
		assertEquals(1, stranger.getValue());
	}

	private void assertSwapFails(HeapNode parent, HeapNode notChild) {
		try {
			theArena.swap(parent, notChild);
			fail("Swap of " + parent + " with non-child " + notChild + " should fail");
		} catch (InvalidRelationException e) {
			// expected
		}
	}

	@Test
	public void testChildValuesAreUnmodifiable() {
		HeapNode root = theArena.createRoot(5);
		root.addChild(6);
		try {
			root.getChildValues().set(0, 1);
			fail("Child values should not be modifiable");
		} catch (UnsupportedOperationException e) {
			// expected
		}
		try {
			root.getChildren().clear();
			fail("Children should not be modifiable");
		} catch (UnsupportedOperationException e) {
			// expected
		}
		assertEquals(asList(6), root.getChildValues());
	}

	@Test
	public void testHandleIdentity() {
		HeapNode root = theArena.createRoot(5);
		HeapNode child = root.addChild(6);
		HeapNode sameChild = root.getChildren().get(0);
		assertEquals(child, sameChild);
		assertEquals(child.hashCode(), sameChild.hashCode());
		assertSame(theArena, sameChild.getArena());
		assertEquals(root, child.getRoot());
		assertEquals(1, child.getDepth());
		assertEquals("6", child.toString());
	}
}
