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
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.Charset;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * A lazy, re-iterable sequence of the {@link QueryParameter}s in a raw query string such as {@code "xt=urn:btih:abc&dn=Name"}.
 * <p>
 * Parameters are produced in their original order and are never de-duplicated.
 * Every {@code "&"}-delimited segment is a parameter, so {@code "a&&b"} yields three parameters, the second having an empty key.
 * The first {@code "="} in a segment separates key from value; a segment without {@code "="} has no value.
 * <p>
 * Nothing is decoded or copied up front: each call to {@link #iterator()} scans the query string as it advances.
 */
@ThreadSafe
public final class QueryParameters implements Iterable<QueryParameter> {
	@NonNull
	private static final QueryParameters EMPTY_INSTANCE;

	static {
		EMPTY_INSTANCE = new QueryParameters(null, QueryFormat.X_WWW_FORM_URLENCODED, UTF_8);
	}

	@Nullable
	private final String query;
	@NonNull
	private final QueryFormat queryFormat;
	@NonNull
	private final Charset charset;

	/**
	 * Vends a lazy sequence over the parameters of the given raw query string, decoding with UTF-8 and {@link QueryFormat#X_WWW_FORM_URLENCODED} rules.
	 *
	 * @param query a raw query string, without the leading {@code "?"}
	 * @return the parameter sequence
	 */
	@NonNull
	public static QueryParameters fromQuery(@NonNull String query) {
		requireNonNull(query);
		return fromQuery(query, QueryFormat.X_WWW_FORM_URLENCODED, UTF_8);
	}

	/**
	 * Vends a lazy sequence over the parameters of the given raw query string.
	 * <p>
	 * An empty query string, as in {@code "magnet:?"}, yields exactly one parameter with an empty key and no value.
	 *
	 * @param query       a raw query string, without the leading {@code "?"}
	 * @param queryFormat how keys and values are decoded
	 * @param charset     the charset used to interpret decoded bytes
	 * @return the parameter sequence
	 */
	@NonNull
	public static QueryParameters fromQuery(@NonNull String query,
																					@NonNull QueryFormat queryFormat,
																					@NonNull Charset charset) {
		requireNonNull(query);
		requireNonNull(queryFormat);
		requireNonNull(charset);

		return new QueryParameters(query, queryFormat, charset);
	}

	/**
	 * Vends a sequence with no parameters, used for URIs that have no query component at all.
	 *
	 * @return the empty parameter sequence
	 */
	@NonNull
	public static QueryParameters empty() {
		return EMPTY_INSTANCE;
	}

	private QueryParameters(@Nullable String query,
													@NonNull QueryFormat queryFormat,
													@NonNull Charset charset) {
		this.query = query;
		this.queryFormat = requireNonNull(queryFormat);
		this.charset = requireNonNull(charset);
	}

	@Override
	@NonNull
	public Iterator<QueryParameter> iterator() {
		return new QueryParameterIterator(this.query, this.queryFormat, this.charset);
	}

	/**
	 * Finds the first parameter whose decoded key equals the given plain text.
	 *
	 * @param key the plain (already-decoded) key
	 * @return the first matching parameter, or {@code null} if none matches
	 */
	@Nullable
	QueryParameter findFirst(@NonNull CharSequence key) {
		requireNonNull(key);

		for (QueryParameter queryParameter : this)
			if (queryParameter.keyEquals(key))
				return queryParameter;

		return null;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{query=%s, queryFormat=%s, charset=%s}", getClass().getSimpleName(), this.query, this.queryFormat, this.charset);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof QueryParameters queryParameters))
			return false;

		return Objects.equals(this.query, queryParameters.query)
				&& Objects.equals(this.queryFormat, queryParameters.queryFormat)
				&& Objects.equals(this.charset, queryParameters.charset);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.query, this.queryFormat, this.charset);
	}

	@NotThreadSafe
	private static final class QueryParameterIterator implements Iterator<QueryParameter> {
		@Nullable
		private final String query;
		@NonNull
		private final QueryFormat queryFormat;
		@NonNull
		private final Charset charset;
		// Start of the next segment, or -1 once exhausted
		private int index;

		private QueryParameterIterator(@Nullable String query,
																	 @NonNull QueryFormat queryFormat,
																	 @NonNull Charset charset) {
			this.query = query;
			this.queryFormat = queryFormat;
			this.charset = charset;
			this.index = query == null ? -1 : 0;
		}

		@Override
		public boolean hasNext() {
			return this.index >= 0;
		}

		@Override
		@NonNull
		public QueryParameter next() {
			if (!hasNext())
				throw new NoSuchElementException();

			String query = this.query;
			int start = this.index;
			int end = query.indexOf('&', start);

			if (end == -1) {
				end = query.length();
				this.index = -1;
			} else {
				this.index = end + 1;
			}

			int equals = query.indexOf('=', start);

			if (equals == -1 || equals > end)
				return QueryParameter.with(query.substring(start, end), null, this.queryFormat, this.charset);

			return QueryParameter.with(query.substring(start, equals), query.substring(equals + 1, end), this.queryFormat, this.charset);
		}
	}
}
