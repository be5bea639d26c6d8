package org.aatree.tree;

import java.util.Comparator;

import org.apache.log4j.Logger;

/**
 * The balancing engine behind {@link AaTreeSet}: an AA tree of distinct values ordered by a comparator.
 *
 * All rotations re-link the existing nodes, so a node stays valid until the value it holds is removed.
 *
 * @param <E> The type of values stored in the tree
 */
final class AaTree<E> {
	private static final Logger log = Logger.getLogger(AaTree.class);

	private final Comparator<? super E> theCompare;
	private AaNode<E> theRoot;
	private int theSize;
	private long theStructureStamp;

	/** @param compare The ordering for the tree's values */
	AaTree(Comparator<? super E> compare) {
		theCompare = compare;
	}

	Comparator<? super E> comparator() {
		return theCompare;
	}

	/** @return The number of values in this tree */
	int size() {
		return theSize;
	}

	/** @return The root node of this tree, or null if the tree is empty */
	AaNode<E> getRoot() {
		return theRoot;
	}

	/** @return A stamp that changes with every structural modification of the tree */
	long getStructureStamp() {
		return theStructureStamp;
	}

	/**
	 * @param first Whether to get the left-most or right-most node
	 * @return The left-most (if <code>first</code>) or right-most (otherwise) node in this tree, or null if the tree is empty
	 */
	AaNode<E> getTerminal(boolean first) {
		return theRoot == null ? null : theRoot.getTerminal(first);
	}

	/**
	 * @param node The node to check
	 * @return Whether the node is still linked into this tree
	 */
	boolean isPresent(AaNode<E> node) {
		return node.getParent() != null || theRoot == node;
	}

	/**
	 * @param value The value to add
	 * @return Whether the value was added (false if an equal value was already present)
	 */
	boolean insert(E value) {
		if (theRoot == null)
			theCompare.compare(value, value); // Type (and possibly null) check
		int preSize = theSize;
		theRoot = insert(theRoot, value);
		theRoot.setParent(null);
		if (theSize == preSize)
			return false;
		theStructureStamp++;
		return true;
	}

	/**
	 * @param value The value to remove
	 * @return Whether the value was found and removed
	 */
	boolean erase(E value) {
		if (theRoot == null)
			return false;
		int preSize = theSize;
		theRoot = erase(theRoot, value);
		if (theRoot != null)
			theRoot.setParent(null);
		if (theSize == preSize)
			return false;
		theStructureStamp++;
		return true;
	}

	/**
	 * @param value The value to search for
	 * @return The node with the smallest value not less than the given value, or null if there is no such node
	 */
	AaNode<E> lowerBound(E value) {
		AaNode<E> node = theRoot;
		AaNode<E> found = null;
		while (node != null) {
			int comp = theCompare.compare(node.getValue(), value);
			if (comp < 0)
				node = node.getRight();
			else {
				found = node;
				if (comp == 0)
					break;
				node = node.getLeft();
			}
		}
		return found;
	}

	/**
	 * @param value The value to search for
	 * @return The node holding a value equal to the given value, or null if there is no such node
	 */
	AaNode<E> find(E value) {
		AaNode<E> found = lowerBound(value);
		if (found != null && theCompare.compare(found.getValue(), value) == 0)
			return found;
		return null;
	}

	/** Unlinks every node in this tree */
	void clear() {
		if (theRoot == null)
			return;
		if (log.isDebugEnabled())
			log.debug("Tearing down tree of " + theSize + " values");
		theRoot.clear();
		theRoot = null;
		theSize = 0;
		theStructureStamp++;
	}

	/**
	 * Replaces this tree's contents with a structural copy of another tree's. The other tree must use the same ordering.
	 *
	 * @param source The tree to copy
	 */
	@SuppressWarnings("unchecked")
	void copyFrom(AaTree<? extends E> source) {
		clear();
		if (source.theRoot != null)
			theRoot = AaNode.deepCopy((AaNode<E>) source.theRoot, null);
		theSize = source.theSize;
		theStructureStamp++;
	}

	private AaNode<E> insert(AaNode<E> node, E value) {
		if (node == null) {
			theSize++;
			return new AaNode<>(value);
		}
		int comp = theCompare.compare(value, node.getValue());
		if (comp < 0)
			node.setLeft(insert(node.getLeft(), value));
		else if (comp > 0)
			node.setRight(insert(node.getRight(), value));
		else
			return node; // Already present
		return split(skew(node));
	}

	private AaNode<E> erase(AaNode<E> node, E value) {
		if (node == null)
			return null;
		int comp = theCompare.compare(value, node.getValue());
		if (comp < 0)
			node.setLeft(erase(node.getLeft(), value));
		else if (comp > 0)
			node.setRight(erase(node.getRight(), value));
		else if (node.isLeaf()) {
			node.unlink();
			theSize--;
			return null;
		} else if (node.getLeft() == null) {
			AaNode<E> successor = node.getSuccessor();
			node.setRight(erase(node.getRight(), successor.getValue()));
			successor.transplant(node);
			node = successor;
		} else {
			AaNode<E> predecessor = node.getPredecessor();
			node.setLeft(erase(node.getLeft(), predecessor.getValue()));
			predecessor.transplant(node);
			node = predecessor;
		}

		node = skew(decreaseLevel(node));
		node.setRight(skew(node.getRight()));
		if (node.getRight() != null)
			node.getRight().setRight(skew(node.getRight().getRight()));
		node = split(node);
		node.setRight(split(node.getRight()));
		return node;
	}

	/**
	 * Lowers a node's level (and its right child's, if it was on the same level) after one of its sub-trees has shrunk
	 *
	 * @param <E> The type of the node
	 * @param node The node to re-level
	 * @return The node
	 */
	static <E> AaNode<E> decreaseLevel(AaNode<E> node) {
		int expected = Math.min(AaNode.levelOf(node.getLeft()), AaNode.levelOf(node.getRight())) + 1;
		if (expected < node.getLevel()) {
			if (log.isTraceEnabled())
				log.trace("Decrease " + node + " to " + expected);
			node.setLevel(expected);
			if (node.getRight() != null && expected < node.getRight().getLevel())
				node.getRight().setLevel(expected);
		}
		return node;
	}

	/**
	 * <pre>
	 *       |                   |
	 *  B &lt;-- D              B --&gt; D
	 * / \     \     ==&gt;    /     / \
	 * A  C     F           A     C   F
	 * </pre>
	 *
	 * Removes a left horizontal link by rotating the left child up. The returned node carries the parent link of the given node; the caller
	 * must hook it into the parent's child slot.
	 *
	 * @param <E> The type of the node
	 * @param node The sub-tree root to skew. May be null.
	 * @return The new sub-tree root
	 */
	static <E> AaNode<E> skew(AaNode<E> node) {
		if (node == null || node.getLeft() == null || node.getLeft().getLevel() != node.getLevel())
			return node;
		if (log.isTraceEnabled())
			log.trace("Skew " + node);
		AaNode<E> left = node.getLeft();
		AaNode<E> parent = node.getParent();
		node.setLeft(left.getRight());
		left.setRight(node);
		left.setParent(parent);
		return left;
	}

	/**
	 * <pre>
	 *                           |
	 *   |                       C
	 *   B --&gt; C --&gt; E         / \
	 *  /     /         ==&gt;   B   E
	 * A     D               / \
	 *                      A   D
	 * </pre>
	 *
	 * Removes two consecutive right horizontal links by rotating the middle node up a level. The returned node carries the parent link of
	 * the given node; the caller must hook it into the parent's child slot.
	 *
	 * @param <E> The type of the node
	 * @param node The sub-tree root to split. May be null.
	 * @return The new sub-tree root
	 */
	static <E> AaNode<E> split(AaNode<E> node) {
		if (node == null || node.getRight() == null || node.getRight().getRight() == null
			|| node.getRight().getRight().getLevel() != node.getLevel())
			return node;
		if (log.isTraceEnabled())
			log.trace("Split " + node);
		AaNode<E> right = node.getRight();
		AaNode<E> parent = node.getParent();
		node.setRight(right.getLeft());
		right.setLeft(node);
		right.setParent(parent);
		right.setLevel(right.getLevel() + 1);
		return right;
	}

	/**
	 * Runs checks on this tree structure to assure that all ordering, balance and bookkeeping constraints are currently met
	 *
	 * @throws IllegalStateException If any constraint is violated
	 */
	void checkValid() throws IllegalStateException {
		if (theRoot == null) {
			if (theSize != 0)
				throw new IllegalStateException("Empty tree with size " + theSize);
			return;
		}
		if (theRoot.getParent() != null)
			throw new IllegalStateException("The root (" + theRoot + ") has a parent");
		int count = checkValid(theRoot, null, null);
		if (count != theSize)
			throw new IllegalStateException("Size is " + theSize + " but " + count + " nodes are in the tree");
	}

	private int checkValid(AaNode<E> node, AaNode<E> lowBound, AaNode<E> highBound) {
		AaNode<E> left = node.getLeft();
		AaNode<E> right = node.getRight();
		if (left != null && left.getParent() != node)
			throw new IllegalStateException("(" + node + "): left (" + left + ")'s parent is not this");
		if (right != null && right.getParent() != node)
			throw new IllegalStateException("(" + node + "): right (" + right + ")'s parent is not this");
		if (lowBound != null && theCompare.compare(lowBound.getValue(), node.getValue()) >= 0)
			throw new IllegalStateException("(" + node + ") is not greater than " + lowBound);
		if (highBound != null && theCompare.compare(node.getValue(), highBound.getValue()) >= 0)
			throw new IllegalStateException("(" + node + ") is not less than " + highBound);

		if (node.isLeaf() && node.getLevel() != 1)
			throw new IllegalStateException("Leaf (" + node + ") is not on level 1");
		if (left != null && left.getLevel() >= node.getLevel())
			throw new IllegalStateException("(" + node + "): left horizontal link to " + left);
		if (right != null && right.getLevel() > node.getLevel())
			throw new IllegalStateException("(" + node + "): right child (" + right + ") is above its parent");
		if (right != null && right.getRight() != null && right.getRight().getLevel() >= node.getLevel())
			throw new IllegalStateException("(" + node + "): two consecutive right horizontal links");
		if (node.getLevel() > 1 && (left == null || right == null))
			throw new IllegalStateException("(" + node + ") is above level 1 but does not have two children");

		int count = 1;
		if (left != null)
			count += checkValid(left, lowBound, node);
		if (right != null)
			count += checkValid(right, node, highBound);
		return count;
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder();
		AaNode.print(theRoot, str, 0);
		return str.toString();
	}
}
