package org.aatree;

import java.util.AbstractCollection;
import java.util.Collection;
import java.util.Iterator;

/**
 * An ordered collection that can be iterated in either direction
 *
 * @param <E> The type of values in the collection
 */
public interface ReversibleCollection<E> extends Collection<E> {
	/** @return An iterable that iterates through this collection's values in reverse */
	Iterable<E> descending();

	/** @return A view of this collection with its elements reversed */
	default ReversibleCollection<E> reverse() {
		return new ReversedCollection<>(this);
	}

	/**
	 * Implements {@link ReversibleCollection#reverse()}
	 *
	 * @param <E> The type of elements in the collection
	 */
	class ReversedCollection<E> extends AbstractCollection<E> implements ReversibleCollection<E> {
		private final ReversibleCollection<E> theWrapped;

		/** @param wrap The collection to reverse */
		protected ReversedCollection(ReversibleCollection<E> wrap) {
			theWrapped = wrap;
		}

		@Override
		public int size() {
			return theWrapped.size();
		}

		@Override
		public Iterator<E> iterator() {
			return theWrapped.descending().iterator();
		}

		@Override
		public Iterable<E> descending() {
			return theWrapped;
		}

		@Override
		public ReversibleCollection<E> reverse() {
			return theWrapped;
		}

		@Override
		public boolean contains(Object o) {
			return theWrapped.contains(o);
		}

		@Override
		public boolean add(E e) {
			return theWrapped.add(e);
		}

		@Override
		public boolean remove(Object o) {
			return theWrapped.remove(o);
		}

		@Override
		public void clear() {
			theWrapped.clear();
		}
	}
}
