package org.aatree.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import org.junit.Test;

/** Tests the local re-balancing operations of {@link AaTree} on hand-built node structures */
public class AaTreeRotationTest {
	private static AaNode<String> node(String value, int level) {
		AaNode<String> node = new AaNode<>(value);
		node.setLevel(level);
		return node;
	}

	/** Tests {@link AaTree#skew(AaNode)} on a left horizontal link */
	@Test
	@SuppressWarnings("static-method")
	public void testSkew() {
		AaNode<String> p = node("P", 3);
		AaNode<String> a = node("A", 1);
		AaNode<String> b = node("B", 2);
		AaNode<String> c = node("C", 1);
		AaNode<String> d = node("D", 2);
		AaNode<String> f = node("F", 1);
		p.setLeft(d);
		d.setLeft(b);
		d.setRight(f);
		b.setLeft(a);
		b.setRight(c);

		AaNode<String> root = AaTree.skew(d);
		assertSame(b, root);
		assertSame(p, b.getParent());
		assertSame(a, b.getLeft());
		assertSame(d, b.getRight());
		assertSame(b, d.getParent());
		assertSame(c, d.getLeft());
		assertSame(d, c.getParent());
		assertSame(f, d.getRight());
		assertEquals(2, b.getLevel());
		assertEquals(2, d.getLevel());
	}

	/** Tests that {@link AaTree#skew(AaNode)} leaves nodes alone that have no left horizontal link */
	@Test
	@SuppressWarnings("static-method")
	public void testSkewNoOp() {
		assertNull(AaTree.skew(null));
		AaNode<String> d = node("D", 2);
		assertSame(d, AaTree.skew(d));
		AaNode<String> b = node("B", 1);
		d.setLeft(b);
		assertSame(d, AaTree.skew(d));
		assertSame(b, d.getLeft());
	}

	/** Tests {@link AaTree#split(AaNode)} on two consecutive right horizontal links */
	@Test
	@SuppressWarnings("static-method")
	public void testSplit() {
		AaNode<String> a = node("A", 1);
		AaNode<String> b = node("B", 2);
		AaNode<String> c = node("C", 2);
		AaNode<String> d = node("D", 1);
		AaNode<String> e = node("E", 2);
		b.setLeft(a);
		b.setRight(c);
		c.setLeft(d);
		c.setRight(e);

		AaNode<String> root = AaTree.split(b);
		assertSame(c, root);
		assertNull(c.getParent());
		assertEquals(3, c.getLevel());
		assertSame(b, c.getLeft());
		assertSame(e, c.getRight());
		assertSame(a, b.getLeft());
		assertSame(d, b.getRight());
		assertSame(b, d.getParent());
		assertEquals(2, b.getLevel());
		assertEquals(2, e.getLevel());
	}

	/** Tests that {@link AaTree#split(AaNode)} leaves a single right horizontal link alone */
	@Test
	@SuppressWarnings("static-method")
	public void testSplitNoOp() {
		assertNull(AaTree.split(null));
		AaNode<String> b = node("B", 1);
		AaNode<String> c = node("C", 1);
		b.setRight(c);
		assertSame(b, AaTree.split(b));
		AaNode<String> e = node("E", 0);
		c.setRight(e);
		assertSame(b, AaTree.split(b));
		assertEquals(1, c.getLevel());
	}

	/** Tests {@link AaTree#decreaseLevel(AaNode)} */
	@Test
	@SuppressWarnings("static-method")
	public void testDecreaseLevel() {
		AaNode<String> n = node("N", 3);
		n.setLeft(node("L", 1));
		n.setRight(node("R", 3));
		AaTree.decreaseLevel(n);
		assertEquals(2, n.getLevel());
		assertEquals(2, n.getRight().getLevel());

		// Already low enough
		AaTree.decreaseLevel(n);
		assertEquals(2, n.getLevel());

		// A node that lost one of its children
		AaNode<String> lone = node("X", 2);
		lone.setRight(node("Y", 1));
		AaTree.decreaseLevel(lone);
		assertEquals(1, lone.getLevel());
		assertEquals(1, lone.getRight().getLevel());
	}

	/** Tests in-order neighbor navigation over parent links */
	@Test
	@SuppressWarnings("static-method")
	public void testClosest() {
		AaTree<Integer> tree = new AaTree<>(Integer::compare);
		for (int i = 0; i < 50; i++)
			tree.insert(i);
		AaNode<Integer> node = tree.getTerminal(true);
		for (int i = 0; i < 50; i++) {
			assertEquals(Integer.valueOf(i), node.getValue());
			node = node.getClosest(false);
		}
		assertNull(node);
		node = tree.getTerminal(false);
		for (int i = 49; i >= 0; i--) {
			assertEquals(Integer.valueOf(i), node.getValue());
			node = node.getClosest(true);
		}
		assertNull(node);
	}
}
