package org.aatree.tree;

import java.util.AbstractSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.aatree.ReversibleCollection;
import org.apache.log4j.Logger;

import com.google.common.collect.Ordering;

/**
 * A set of distinct values kept in order by an AA tree. Insertion, removal and lookup are O(log n).
 *
 * Besides the {@link java.util.Set} API, positions in the set may be addressed with {@link TreeCursor}s obtained from {@link #begin()},
 * {@link #end()}, {@link #lowerBound(Object)} and {@link #find(Object)}.
 *
 * This class is not thread-safe. Iterators are fail-fast.
 *
 * @param <E> The type of values in the set
 */
public class AaTreeSet<E> extends AbstractSet<E> implements ReversibleCollection<E> {
	private static final Logger log = Logger.getLogger(AaTreeSet.class);

	private static final String DEFAULT_DESCRIPTION = "aa-tree-set";
	/** System property that, if "true", makes {@link Builder#withValidation(boolean) validation} the default for new sets */
	public static final String VALIDATE_PROPERTY = "org.aatree.validate";

	/**
	 * Builds {@link AaTreeSet}s
	 *
	 * @param <E> The type of elements for the set
	 */
	public static class Builder<E> {
		private final Comparator<? super E> theCompare;
		private String theDescription;
		private boolean isValidating;

		/** @param compare The comparator for the new set */
		protected Builder(Comparator<? super E> compare) {
			if (compare == null)
				throw new NullPointerException("Comparator is required");
			theCompare = compare;
			theDescription = DEFAULT_DESCRIPTION;
			isValidating = Boolean.getBoolean(VALIDATE_PROPERTY);
		}

		/**
		 * @param description The description for the set, used in diagnostics
		 * @return This builder
		 */
		public Builder<E> withDescription(String description) {
			theDescription = description;
			return this;
		}

		/**
		 * @param validate Whether the set should check all of its structural constraints after every modification. This makes every
		 *        modification O(n), so it is meant for debugging.
		 * @return This builder
		 */
		public Builder<E> withValidation(boolean validate) {
			isValidating = validate;
			return this;
		}

		/** @return The new, empty set */
		public AaTreeSet<E> build() {
			return new AaTreeSet<>(theCompare, theDescription, isValidating);
		}

		/**
		 * @param values The initial values for the set
		 * @return The new set, containing the given values
		 */
		public AaTreeSet<E> build(Iterable<? extends E> values) {
			AaTreeSet<E> set = build();
			for (E value : values)
				set.add(value);
			return set;
		}
	}

	/**
	 * @param <E> The type of elements for the set
	 * @return A builder for a set ordered by its values' natural ordering
	 */
	public static <E extends Comparable<? super E>> Builder<E> build() {
		return new Builder<>(Ordering.<E> natural());
	}

	/**
	 * @param <E> The type of elements for the set
	 * @param compare The comparator for the set's ordering
	 * @return A builder for the set
	 */
	public static <E> Builder<E> build(Comparator<? super E> compare) {
		return new Builder<>(compare);
	}

	/**
	 * @param <E> The type of elements for the set
	 * @param values The initial values for the set
	 * @return A new set with the given values, in their natural ordering
	 */
	@SafeVarargs
	public static <E extends Comparable<? super E>> AaTreeSet<E> of(E... values) {
		AaTreeSet<E> set = new AaTreeSet<>(Ordering.<E> natural());
		for (E value : values)
			set.add(value);
		return set;
	}

	private final AaTree<E> theTree;
	private final String theDescription;
	private final boolean isValidating;

	/** Creates an empty set ordered by its values' natural ordering. The values must be {@link Comparable}. */
	public AaTreeSet() {
		this(AaTreeSet.<E> naturalOrder());
	}

	/** @param compare The value ordering for the set */
	public AaTreeSet(Comparator<? super E> compare) {
		this(compare, DEFAULT_DESCRIPTION, Boolean.getBoolean(VALIDATE_PROPERTY));
	}

	/**
	 * @param compare The value ordering for the set
	 * @param values The initial values for the set
	 */
	public AaTreeSet(Comparator<? super E> compare, Collection<? extends E> values) {
		this(compare);
		for (E value : values)
			add(value);
	}

	/**
	 * Creates a structural copy of another set, with the same ordering
	 *
	 * @param source The set to copy
	 */
	public AaTreeSet(AaTreeSet<E> source) {
		this(source.comparator(), source.theDescription, source.isValidating);
		theTree.copyFrom(source.theTree);
	}

	/**
	 * Creates a set with the values of another set from one position (inclusive) up to another (exclusive), with the same ordering
	 *
	 * @param first The position of the first value to copy
	 * @param last The position after the last value to copy. Must not be before <code>first</code>.
	 * @throws IllegalArgumentException If the cursors are from different sets
	 */
	public AaTreeSet(TreeCursor<E> first, TreeCursor<E> last) throws IllegalArgumentException {
		this(first.getSet().comparator());
		if (first.getSet() != last.getSet())
			throw new IllegalArgumentException("Cursors are from different sets");
		for (TreeCursor<E> cursor = first; !cursor.equals(last); cursor = cursor.next())
			theTree.insert(cursor.get());
		validate();
	}

	/**
	 * @param compare The value ordering for the set
	 * @param description The description for the set
	 * @param validate Whether to check the tree structure after every modification
	 */
	protected AaTreeSet(Comparator<? super E> compare, String description, boolean validate) {
		if (compare == null)
			throw new NullPointerException("Comparator is required");
		theTree = new AaTree<>(compare);
		theDescription = description;
		isValidating = validate;
	}

	@SuppressWarnings({ "unchecked", "rawtypes" })
	private static <E> Comparator<? super E> naturalOrder() {
		return (Comparator<? super E>) (Comparator) Ordering.natural();
	}

	AaTree<E> getTree() {
		return theTree;
	}

	/** @return The description of this set */
	public String getDescription() {
		return theDescription;
	}

	/** @return The ordering of this set's values */
	public Comparator<? super E> comparator() {
		return theTree.comparator();
	}

	@Override
	public int size() {
		return theTree.size();
	}

	@Override
	public boolean isEmpty() {
		return theTree.size() == 0;
	}

	/** @return A cursor at the smallest value in this set, or {@link #end()} if the set is empty */
	public TreeCursor<E> begin() {
		return new TreeCursor<>(this, theTree.getTerminal(true));
	}

	/** @return The end position of this set, after the largest value */
	public TreeCursor<E> end() {
		return new TreeCursor<>(this, null);
	}

	/**
	 * @param value The value to search for
	 * @return A cursor at the smallest value in this set that is not less than the given value, or {@link #end()} if there is none
	 */
	public TreeCursor<E> lowerBound(E value) {
		return new TreeCursor<>(this, theTree.lowerBound(value));
	}

	/**
	 * @param value The value to search for
	 * @return A cursor at the value in this set equal to the given value, or {@link #end()} if there is none
	 */
	public TreeCursor<E> find(E value) {
		return new TreeCursor<>(this, theTree.find(value));
	}

	/**
	 * @return The smallest value in this set
	 * @throws NoSuchElementException If this set is empty
	 */
	public E first() throws NoSuchElementException {
		return terminal(true).getValue();
	}

	/**
	 * @return The largest value in this set
	 * @throws NoSuchElementException If this set is empty
	 */
	public E last() throws NoSuchElementException {
		return terminal(false).getValue();
	}

	private AaNode<E> terminal(boolean first) {
		AaNode<E> node = theTree.getTerminal(first);
		if (node == null)
			throw new NoSuchElementException("Empty set");
		return node;
	}

	@Override
	@SuppressWarnings("unchecked")
	public boolean contains(Object o) {
		return theTree.find((E) o) != null;
	}

	/**
	 * Adds a value to this set if an equal value is not already present
	 *
	 * @param value The value to add
	 * @return Whether the value was added
	 */
	@Override
	public boolean add(E value) {
		boolean added = theTree.insert(value);
		validate();
		return added;
	}

	/**
	 * Removes a value from this set if it is present
	 *
	 * @param o The value to remove
	 * @return Whether the value was found and removed
	 */
	@Override
	@SuppressWarnings("unchecked")
	public boolean remove(Object o) {
		boolean removed = theTree.erase((E) o);
		validate();
		return removed;
	}

	@Override
	public void clear() {
		theTree.clear();
	}

	/**
	 * Replaces this set's contents with the values of another set. If the two sets share the same comparator, the other set's tree is
	 * copied node for node.
	 *
	 * @param source The set to copy the values of
	 * @return This set
	 */
	public AaTreeSet<E> assign(AaTreeSet<? extends E> source) {
		if (source == this)
			return this;
		if (source.comparator() == comparator())
			theTree.copyFrom(source.theTree);
		else {
			theTree.clear();
			for (E value : source)
				theTree.insert(value);
		}
		validate();
		return this;
	}

	@Override
	public Iterator<E> iterator() {
		return new TreeIterator(true);
	}

	@Override
	public Iterable<E> descending() {
		return () -> new TreeIterator(false);
	}

	/**
	 * Runs checks on this set's tree structure to assure that all ordering and balancing constraints are currently met
	 *
	 * @throws IllegalStateException If any constraint is violated
	 */
	public void checkValid() throws IllegalStateException {
		theTree.checkValid();
	}

	/** @return A representation of this set's tree structure, one node per line with its level, the right-most node on top */
	public String printTree() {
		return theTree.toString();
	}

	private void validate() {
		if (!isValidating)
			return;
		try {
			theTree.checkValid();
		} catch (IllegalStateException e) {
			log.error(theDescription + " is corrupt:\n" + theTree, e);
			throw e;
		}
	}

	private class TreeIterator implements Iterator<E> {
		private final boolean isAscending;
		private AaNode<E> theNext;
		private AaNode<E> theLastReturned;
		private long theExpectedStamp;

		TreeIterator(boolean ascending) {
			isAscending = ascending;
			theNext = theTree.getTerminal(ascending);
			theExpectedStamp = theTree.getStructureStamp();
		}

		@Override
		public boolean hasNext() {
			return theNext != null;
		}

		@Override
		public E next() {
			if (theNext == null)
				throw new NoSuchElementException();
			checkStamp();
			theLastReturned = theNext;
			theNext = theNext.getClosest(!isAscending);
			return theLastReturned.getValue();
		}

		@Override
		public void remove() {
			if (theLastReturned == null)
				throw new IllegalStateException("next() has not been called, or remove() has already been called for the current element");
			checkStamp();
			// Only the removed value's node is unlinked, so theNext is still in the tree
			AaTreeSet.this.remove(theLastReturned.getValue());
			theLastReturned = null;
			theExpectedStamp = theTree.getStructureStamp();
		}

		private void checkStamp() {
			if (theTree.getStructureStamp() != theExpectedStamp)
				throw new ConcurrentModificationException("The set has been modified outside of this iterator");
		}
	}
}
