package org.aatree.tree;

import java.util.NoSuchElementException;

/**
 * An immutable position in an {@link AaTreeSet}: either an element of the set or the end position, which sits after the last element.
 *
 * A cursor stays valid across insertions and across removal of any value other than its own. Once its value is removed (or the set is
 * cleared), {@link #get()}, {@link #next()} and {@link #previous()} throw {@link IllegalStateException}. The end position is always
 * valid.
 *
 * @param <E> The type of values in the set
 */
public final class TreeCursor<E> {
	private final AaTreeSet<E> theSet;
	private final AaNode<E> theNode;

	TreeCursor(AaTreeSet<E> set, AaNode<E> node) {
		theSet = set;
		theNode = node;
	}

	/** @return The set that this cursor iterates over */
	public AaTreeSet<E> getSet() {
		return theSet;
	}

	/** @return Whether this cursor is at the end position */
	public boolean isEnd() {
		return theNode == null;
	}

	/**
	 * @return The value at this position
	 * @throws NoSuchElementException If this is the end position
	 * @throws IllegalStateException If this cursor's value has been removed from the set
	 */
	public E get() throws NoSuchElementException, IllegalStateException {
		if (theNode == null)
			throw new NoSuchElementException("The end position has no value");
		checkPresent();
		return theNode.getValue();
	}

	/**
	 * @return A cursor at the next value in the set, or the end position if this is the last value
	 * @throws NoSuchElementException If this is the end position
	 * @throws IllegalStateException If this cursor's value has been removed from the set
	 */
	public TreeCursor<E> next() throws NoSuchElementException, IllegalStateException {
		if (theNode == null)
			throw new NoSuchElementException("Cannot advance past the end position");
		checkPresent();
		return new TreeCursor<>(theSet, theNode.getClosest(false));
	}

	/**
	 * @return A cursor at the previous value in the set. From the end position this is the last value (or the end position again if the
	 *         set is empty). From the first value this is the end position.
	 * @throws IllegalStateException If this cursor's value has been removed from the set
	 */
	public TreeCursor<E> previous() throws IllegalStateException {
		if (theNode == null)
			return new TreeCursor<>(theSet, theSet.getTree().getTerminal(false));
		checkPresent();
		return new TreeCursor<>(theSet, theNode.getClosest(true));
	}

	private void checkPresent() {
		if (!theSet.getTree().isPresent(theNode))
			throw new IllegalStateException("This cursor's value has been removed from the set");
	}

	@Override
	public int hashCode() {
		return System.identityHashCode(theSet) * 31 + System.identityHashCode(theNode);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		else if (!(obj instanceof TreeCursor))
			return false;
		TreeCursor<?> other = (TreeCursor<?>) obj;
		return theSet == other.theSet && theNode == other.theNode;
	}

	@Override
	public String toString() {
		return theNode == null ? "end" : String.valueOf(theNode.getValue());
	}
}
