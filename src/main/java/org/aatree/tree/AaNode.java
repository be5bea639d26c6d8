package org.aatree.tree;

/**
 * A node in an AA tree. Nodes are only linked and re-linked by {@link AaTree}; the parent link is a back-reference used for traversal.
 *
 * @param <E> The type of value that the node holds
 */
final class AaNode<E> {
	private E theValue;
	private int theLevel;

	private AaNode<E> theParent;
	private AaNode<E> theLeft;
	private AaNode<E> theRight;

	/** @param value The value for the new leaf */
	AaNode(E value) {
		theValue = value;
		theLevel = 1;
	}

	/** @return This node's value */
	E getValue() {
		return theValue;
	}

	/** @return This node's balance level. 1 for leaves. */
	int getLevel() {
		return theLevel;
	}

	void setLevel(int level) {
		theLevel = level;
	}

	/** @return The parent of this node. Null if and only if this node is the root or has been unlinked. */
	AaNode<E> getParent() {
		return theParent;
	}

	void setParent(AaNode<E> parent) {
		theParent = parent;
	}

	AaNode<E> getLeft() {
		return theLeft;
	}

	AaNode<E> getRight() {
		return theRight;
	}

	/**
	 * @param left Whether to get the left or right child
	 * @return The left or right child of this node
	 */
	AaNode<E> getChild(boolean left) {
		return left ? theLeft : theRight;
	}

	/**
	 * Sets this node's left child, pointing the child's parent link back at this node
	 *
	 * @param left The new left child. May be null.
	 */
	void setLeft(AaNode<E> left) {
		theLeft = left;
		if (left != null)
			left.theParent = this;
	}

	/**
	 * Sets this node's right child, pointing the child's parent link back at this node
	 *
	 * @param right The new right child. May be null.
	 */
	void setRight(AaNode<E> right) {
		theRight = right;
		if (right != null)
			right.theParent = this;
	}

	/** @return Whether this node has no children */
	boolean isLeaf() {
		return theLeft == null && theRight == null;
	}

	/** @return Whether this node is this node's parent's right child */
	boolean isRightChild() {
		return theParent != null && theParent.theRight == this;
	}

	/**
	 * @param left Whether to get the left-most or right-most node
	 * @return The left-most or right-most node in this sub-tree
	 */
	AaNode<E> getTerminal(boolean left) {
		AaNode<E> node = this;
		AaNode<E> child = node.getChild(left);
		while (child != null) {
			node = child;
			child = node.getChild(left);
		}
		return node;
	}

	/** @return The left-most node of this node's right sub-tree. This node must have a right child. */
	AaNode<E> getSuccessor() {
		return theRight.getTerminal(true);
	}

	/** @return The right-most node of this node's left sub-tree. This node must have a left child. */
	AaNode<E> getPredecessor() {
		return theLeft.getTerminal(false);
	}

	/**
	 * Finds the in-order neighbor of this node using the parent links
	 *
	 * @param left Whether to get the previous (left) or next (right) node
	 * @return The adjacent node, or null if this node is the first or last in its tree
	 */
	AaNode<E> getClosest(boolean left) {
		if (getChild(left) != null)
			return left ? getPredecessor() : getSuccessor();
		AaNode<E> node = this;
		// Climb while we're coming from the side we're moving toward
		while (node.theParent != null && node.isRightChild() != left)
			node = node.theParent;
		return node.theParent;
	}

	/**
	 * Moves this node into the position of another node in the tree. This node must already have been unlinked. The replaced node is
	 * unlinked afterward.
	 *
	 * @param replaced The node whose level, children and parent link this node shall take over
	 */
	void transplant(AaNode<E> replaced) {
		theLevel = replaced.theLevel;
		setLeft(replaced.theLeft);
		setRight(replaced.theRight);
		theParent = replaced.theParent;
		replaced.unlink();
	}

	/** Clears all of this node's links */
	void unlink() {
		theParent = null;
		theLeft = null;
		theRight = null;
	}

	/** Unlinks this entire sub-tree, children before parents */
	void clear() {
		if (theLeft != null)
			theLeft.clear();
		if (theRight != null)
			theRight.clear();
		unlink();
	}

	/**
	 * @param <E> The type of the nodes
	 * @param node The root of the sub-tree to copy
	 * @param parent The parent for the copied root
	 * @return A structurally identical copy of the sub-tree
	 */
	static <E> AaNode<E> deepCopy(AaNode<E> node, AaNode<E> parent) {
		AaNode<E> copy = new AaNode<>(node.theValue);
		copy.theLevel = node.theLevel;
		copy.theParent = parent;
		if (node.theLeft != null)
			copy.theLeft = deepCopy(node.theLeft, copy);
		if (node.theRight != null)
			copy.theRight = deepCopy(node.theRight, copy);
		return copy;
	}

	/**
	 * @param node The node to get the level of
	 * @return The level of the given node, or 0 if the node is null
	 */
	static int levelOf(AaNode<?> node) {
		return node == null ? 0 : node.theLevel;
	}

	/**
	 * Prints a tree in a way that indicates the position and level of each node in the tree
	 *
	 * @param node The tree node to print
	 * @param str The string builder to append the printed tree representation to
	 * @param indent The amount of indentation with which to indent the root of the tree
	 */
	static void print(AaNode<?> node, StringBuilder str, int indent) {
		if (node == null) {
			for (int i = 0; i < indent; i++)
				str.append('\t');
			str.append(node).append('\n');
			return;
		}

		if (node.theRight != null)
			print(node.theRight, str, indent + 1);

		for (int i = 0; i < indent; i++)
			str.append('\t');
		str.append(node).append('\n');

		if (node.theLeft != null)
			print(node.theLeft, str, indent + 1);
	}

	@Override
	public String toString() {
		return theValue + " (" + theLevel + ")";
	}
}
