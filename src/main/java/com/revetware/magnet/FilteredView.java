/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.revetware.magnet;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.lang.String.format;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * A lazy view over a source sequence that yields {@code transform(element)} for each element where {@code predicate(element)} holds.
 * <p>
 * Nothing is materialized: every call to {@link #iterator()} (or {@link #begin()}) restarts from the source's first element,
 * and each element is tested and transformed only as iteration reaches it. The transform is never invoked on an element that failed the predicate.
 * <p>
 * Predicates and transforms may share state, for example a caller-owned decode buffer that the predicate fills and the transform reads.
 * Such views must not be iterated concurrently, nor interleaved with another view that shares the same buffer.
 * <p>
 * For example, the decoded values of all {@code tr} parameters:
 * <pre>{@code FilteredView<QueryParameter, String> trackers = FilteredView.of(
 *   queryParameters,
 *   queryParameter -> queryParameter.keyEquals("tr"),
 *   queryParameter -> queryParameter.getDecodedValue().orElse(""));
 *
 * for (String tracker : trackers)
 *   System.out.println(tracker);}</pre>
 *
 * @param <T> the source element type
 * @param <R> the result element type
 */
@NotThreadSafe
public final class FilteredView<T, R> implements Iterable<R> {
	@NonNull
	private final Iterable<T> source;
	@NonNull
	private final Predicate<? super T> predicate;
	@NonNull
	private final Function<? super T, ? extends R> transform;

	/**
	 * Vends a view that yields transformed elements satisfying the predicate.
	 *
	 * @param source    the source sequence
	 * @param predicate which elements to keep
	 * @param transform how to convert kept elements
	 * @param <T>       the source element type
	 * @param <R>       the result element type
	 * @return the view
	 */
	@NonNull
	public static <T, R> FilteredView<T, R> of(@NonNull Iterable<T> source,
																						 @NonNull Predicate<? super T> predicate,
																						 @NonNull Function<? super T, ? extends R> transform) {
		return new FilteredView<>(source, predicate, transform);
	}

	/**
	 * Vends a view that yields the source elements satisfying the predicate, untransformed.
	 *
	 * @param source    the source sequence
	 * @param predicate which elements to keep
	 * @param <T>       the element type
	 * @return the view
	 */
	@NonNull
	public static <T> FilteredView<T, T> filtering(@NonNull Iterable<T> source,
																								 @NonNull Predicate<? super T> predicate) {
		return new FilteredView<>(source, predicate, Function.identity());
	}

	/**
	 * Vends a view that yields every source element, transformed.
	 *
	 * @param source    the source sequence
	 * @param transform how to convert elements
	 * @param <T>       the source element type
	 * @param <R>       the result element type
	 * @return the view
	 */
	@NonNull
	public static <T, R> FilteredView<T, R> transforming(@NonNull Iterable<T> source,
																											 @NonNull Function<? super T, ? extends R> transform) {
		return new FilteredView<>(source, element -> true, transform);
	}

	private FilteredView(@NonNull Iterable<T> source,
											 @NonNull Predicate<? super T> predicate,
											 @NonNull Function<? super T, ? extends R> transform) {
		this.source = requireNonNull(source);
		this.predicate = requireNonNull(predicate);
		this.transform = requireNonNull(transform);
	}

	/**
	 * Acquires a cursor positioned at the first source element satisfying the predicate, or at the end if there is none.
	 *
	 * @return a new cursor
	 */
	@NonNull
	public Cursor<T, R> begin() {
		Cursor<T, R> cursor = new Cursor<>(this, this.source.iterator());
		cursor.skipToMatch();
		return cursor;
	}

	/**
	 * Acquires the end-of-sequence sentinel cursor.
	 *
	 * @return a cursor for which {@link Cursor#isEnd()} is {@code true}
	 */
	@NonNull
	public Cursor<T, R> end() {
		return new Cursor<>(this, null);
	}

	@Override
	@NonNull
	public Iterator<R> iterator() {
		return new FilteredIterator<>(this);
	}

	/**
	 * A sequential stream over this view, driven lazily by {@link #iterator()}.
	 *
	 * @return the stream
	 */
	@NonNull
	public Stream<R> stream() {
		return StreamSupport.stream(spliterator(), false);
	}

	/**
	 * Copies this view's current elements into a list.
	 *
	 * @return an unmodifiable list of the elements, in order
	 */
	@NonNull
	public List<R> toList() {
		List<R> elements = new ArrayList<>();

		for (R element : this)
			elements.add(element);

		return unmodifiableList(elements);
	}

	/**
	 * The first element of this view.
	 *
	 * @return the first element, or {@link Optional#empty()} if there is none (or it is {@code null})
	 */
	@NonNull
	public Optional<R> first() {
		Cursor<T, R> cursor = begin();
		return cursor.isEnd() ? Optional.empty() : Optional.ofNullable(cursor.get());
	}

	@NonNull
	public Boolean isEmpty() {
		return begin().isEnd();
	}

	@NonNull
	Predicate<? super T> getPredicate() {
		return this.predicate;
	}

	@NonNull
	Function<? super T, ? extends R> getTransform() {
		return this.transform;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{source=%s, predicate=%s, transform=%s}", getClass().getSimpleName(), this.source, this.predicate, this.transform);
	}

	/**
	 * A forward-only position within a {@link FilteredView}.
	 * <p>
	 * Advancing skips non-matching source elements immediately; {@link #get()} applies the transform to the current element.
	 * Two cursors are equal if they belong to the same view and refer to the same source position. All end cursors of a view are equal.
	 *
	 * @param <T> the source element type
	 * @param <R> the result element type
	 */
	@NotThreadSafe
	public static final class Cursor<T, R> {
		private static final int END_POSITION = -1;

		@NonNull
		private final FilteredView<T, R> view;
		@Nullable
		private final Iterator<T> sourceIterator;
		@Nullable
		private T current;
		// Index of current in the source, or END_POSITION
		private int position;
		// Index the source iterator will yield next
		private int nextSourceIndex;

		private Cursor(@NonNull FilteredView<T, R> view,
									 @Nullable Iterator<T> sourceIterator) {
			this.view = requireNonNull(view);
			this.sourceIterator = sourceIterator;
			this.position = END_POSITION;
			this.nextSourceIndex = 0;
		}

		/**
		 * Is this cursor past the last matching element?
		 *
		 * @return {@code true} if there is no current element, {@code false} otherwise
		 */
		@NonNull
		public Boolean isEnd() {
			return this.position == END_POSITION;
		}

		/**
		 * Applies the view's transform to the current element.
		 *
		 * @return the transformed element
		 * @throws NoSuchElementException if this cursor is at the end
		 */
		@Nullable
		public R get() {
			if (isEnd())
				throw new NoSuchElementException("Cursor is at the end of the view");

			return this.view.getTransform().apply(this.current);
		}

		/**
		 * Moves to the next source element satisfying the predicate, or to the end.
		 *
		 * @return this cursor
		 * @throws NoSuchElementException if this cursor is already at the end
		 */
		@NonNull
		public Cursor<T, R> advance() {
			if (isEnd())
				throw new NoSuchElementException("Cannot advance past the end of the view");

			skipToMatch();
			return this;
		}

		/**
		 * The index of the current element within the source sequence.
		 *
		 * @return the source index, or {@link Optional#empty()} at the end
		 */
		@NonNull
		public Optional<Integer> getPosition() {
			return isEnd() ? Optional.empty() : Optional.of(this.position);
		}

		private void skipToMatch() {
			Iterator<T> sourceIterator = this.sourceIterator;

			if (sourceIterator != null) {
				while (sourceIterator.hasNext()) {
					T element = sourceIterator.next();
					int index = this.nextSourceIndex++;

					if (this.view.getPredicate().test(element)) {
						this.current = element;
						this.position = index;
						return;
					}
				}
			}

			this.current = null;
			this.position = END_POSITION;
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{position=%s}", getClass().getSimpleName(), isEnd() ? "end" : this.position);
		}

		@Override
		public boolean equals(@Nullable Object object) {
			if (this == object)
				return true;

			if (!(object instanceof Cursor<?, ?> cursor))
				return false;

			return this.view == cursor.view && this.position == cursor.position;
		}

		@Override
		public int hashCode() {
			return Objects.hash(System.identityHashCode(this.view), this.position);
		}
	}

	/**
	 * Adapts a cursor to {@link Iterator}, deferring each advance until the caller asks for more so that abandoning iteration early has no further side effects.
	 */
	@NotThreadSafe
	private static final class FilteredIterator<T, R> implements Iterator<R> {
		@NonNull
		private final FilteredView<T, R> view;
		@Nullable
		private Cursor<T, R> cursor;
		private boolean advancePending;

		private FilteredIterator(@NonNull FilteredView<T, R> view) {
			this.view = requireNonNull(view);
		}

		@Override
		public boolean hasNext() {
			if (this.cursor == null) {
				this.cursor = this.view.begin();
			} else if (this.advancePending) {
				this.cursor.advance();
				this.advancePending = false;
			}

			return !this.cursor.isEnd();
		}

		@Override
		public R next() {
			if (!hasNext())
				throw new NoSuchElementException();

			this.advancePending = true;
			return this.cursor.get();
		}
	}
}
