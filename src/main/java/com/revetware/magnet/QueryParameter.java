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

import com.revetware.magnet.exception.IllegalPercentEncodingException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.Charset;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A single {@code key[=value]} pair from a query string, such as {@code dn=Leaves+of+Grass}.
 * <p>
 * Keys and values are held in their original percent-encoded form.
 * Comparisons against plain text are performed on the decoded value via {@link #keyEquals(CharSequence)}, so a key written as {@code %78%74} is equal to {@code "xt"}.
 * <p>
 * Instances are normally acquired by iterating {@link QueryParameters#fromQuery(String, QueryFormat, Charset)} or {@link Uri#getQueryParameters(QueryFormat, Charset)}.
 */
@ThreadSafe
public final class QueryParameter {
	@NonNull
	private final String encodedKey;
	@Nullable
	private final String encodedValue;
	@NonNull
	private final QueryFormat queryFormat;
	@NonNull
	private final Charset charset;

	/**
	 * Vends a parameter for the given still-encoded key and value.
	 *
	 * @param encodedKey   the percent-encoded key, possibly empty
	 * @param encodedValue the percent-encoded value, or {@code null} if the parameter has no {@code "="}
	 * @param queryFormat  how keys and values are decoded
	 * @param charset      the charset used to interpret decoded bytes
	 * @return the parameter
	 */
	@NonNull
	public static QueryParameter with(@NonNull String encodedKey,
																		@Nullable String encodedValue,
																		@NonNull QueryFormat queryFormat,
																		@NonNull Charset charset) {
		return new QueryParameter(encodedKey, encodedValue, queryFormat, charset);
	}

	private QueryParameter(@NonNull String encodedKey,
												 @Nullable String encodedValue,
												 @NonNull QueryFormat queryFormat,
												 @NonNull Charset charset) {
		this.encodedKey = requireNonNull(encodedKey);
		this.encodedValue = encodedValue;
		this.queryFormat = requireNonNull(queryFormat);
		this.charset = requireNonNull(charset);
	}

	/**
	 * Does this parameter's decoded key equal the given plain text?
	 *
	 * @param key the plain (already-decoded) key to compare against
	 * @return {@code true} if the keys match, {@code false} otherwise
	 */
	@NonNull
	public Boolean keyEquals(@NonNull CharSequence key) {
		requireNonNull(key);
		return PercentEncoding.encodedEquals(getEncodedKey(), key, getQueryFormat(), getCharset());
	}

	/**
	 * The decoded key.
	 *
	 * @return the decoded key
	 * @throws IllegalPercentEncodingException if the key contains malformed percent-encoding
	 */
	@NonNull
	public String getDecodedKey() {
		return PercentEncoding.decode(getEncodedKey(), getQueryFormat(), getCharset());
	}

	/**
	 * The decoded value.
	 * <p>
	 * A parameter written as {@code key=} has an empty value; a parameter written as {@code key} has no value.
	 *
	 * @return the decoded value, or {@link Optional#empty()} if this parameter has no value
	 * @throws IllegalPercentEncodingException if the value contains malformed percent-encoding
	 */
	@NonNull
	public Optional<String> getDecodedValue() {
		if (this.encodedValue == null)
			return Optional.empty();

		return Optional.of(PercentEncoding.decode(this.encodedValue, getQueryFormat(), getCharset()));
	}

	/**
	 * Decodes this parameter's value once into a caller-owned buffer, replacing its contents.
	 *
	 * @param buffer the buffer to decode into
	 * @return {@code true} if the value was present and decoded, {@code false} otherwise
	 */
	@NonNull
	public Boolean decodeValueInto(@NonNull StringBuilder buffer) {
		requireNonNull(buffer);

		if (this.encodedValue == null)
			return false;

		return PercentEncoding.decodeInto(this.encodedValue, buffer, getQueryFormat(), getCharset());
	}

	/**
	 * The key exactly as it appears in the query string.
	 *
	 * @return the percent-encoded key
	 */
	@NonNull
	public String getEncodedKey() {
		return this.encodedKey;
	}

	/**
	 * The value exactly as it appears in the query string.
	 *
	 * @return the percent-encoded value, or {@link Optional#empty()} if this parameter has no value
	 */
	@NonNull
	public Optional<String> getEncodedValue() {
		return Optional.ofNullable(this.encodedValue);
	}

	/**
	 * Was this parameter written with an {@code "="}?
	 *
	 * @return {@code true} if a value is present (possibly empty), {@code false} otherwise
	 */
	@NonNull
	public Boolean hasValue() {
		return this.encodedValue != null;
	}

	@NonNull
	public QueryFormat getQueryFormat() {
		return this.queryFormat;
	}

	@NonNull
	public Charset getCharset() {
		return this.charset;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{encodedKey=%s, encodedValue=%s}", getClass().getSimpleName(), getEncodedKey(), this.encodedValue);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof QueryParameter queryParameter))
			return false;

		return Objects.equals(getEncodedKey(), queryParameter.getEncodedKey())
				&& Objects.equals(this.encodedValue, queryParameter.encodedValue)
				&& Objects.equals(getQueryFormat(), queryParameter.getQueryFormat())
				&& Objects.equals(getCharset(), queryParameter.getCharset());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getEncodedKey(), this.encodedValue, getQueryFormat(), getCharset());
	}
}
