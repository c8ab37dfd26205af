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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINEST;

/**
 * Predicates and transforms over {@link QueryParameter}s that give magnet link fields their meaning.
 * <p>
 * These are the building blocks of the {@link FilteredView}s vended by {@link MagnetLink}.
 */
@ThreadSafe
public final class MagnetLinkFields {
	@NonNull
	private static final Logger logger = Logger.getLogger(MagnetLinkFields.class.getName());

	@NonNull
	private static final Predicate<QueryParameter> EXACT_TOPIC_PREDICATE;
	@NonNull
	private static final Function<QueryParameter, Uri> URI_TRANSFORM;
	@NonNull
	private static final Function<QueryParameter, String> INFO_HASH_TRANSFORM;
	@NonNull
	private static final Function<QueryParameter, String> PROTOCOL_TRANSFORM;

	static {
		EXACT_TOPIC_PREDICATE = new ExactTopicPredicate();
		URI_TRANSFORM = new UriTransform();
		INFO_HASH_TRANSFORM = new TopicPathTransform(true);
		PROTOCOL_TRANSFORM = new TopicPathTransform(false);
	}

	private MagnetLinkFields() {
		// Non-instantiable
	}

	/**
	 * Matches "exact topic" parameters: a decoded key of {@code xt}, or {@code xt.} followed by one or more ASCII digits ({@code xt.1}, {@code xt.23}).
	 * <p>
	 * Matching is case-sensitive. {@code XT}, {@code xt.}, {@code xt.a} and {@code xta} are not exact topics.
	 *
	 * @return the exact topic predicate
	 */
	@NonNull
	public static Predicate<QueryParameter> isExactTopic() {
		return EXACT_TOPIC_PREDICATE;
	}

	/**
	 * Does the given decoded key name an exact topic?
	 *
	 * @param key a decoded query parameter key
	 * @return {@code true} if {@code key} is {@code xt} or {@code xt.<digits>}, {@code false} otherwise
	 */
	@NonNull
	public static Boolean isExactTopicKey(@NonNull CharSequence key) {
		requireNonNull(key);

		if (key.length() == 2)
			return key.charAt(0) == 'x' && key.charAt(1) == 't';

		if (key.length() <= 3 || key.charAt(0) != 'x' || key.charAt(1) != 't' || key.charAt(2) != '.')
			return false;

		for (int i = 3; i < key.length(); i++) {
			char c = key.charAt(i);

			if (c < '0' || c > '9')
				return false;
		}

		return true;
	}

	/**
	 * Matches parameters with the given key whose value, once percent-decoded into {@code buffer}, parses as a URI.
	 * <p>
	 * Values of fields such as {@code tr} are URIs that were percent-encoded a second time to be carried in the query, so they are decoded once before parsing.
	 * Parameters that fail to decode or parse are not matched. After a successful match, {@code buffer} holds the decoded URI text.
	 *
	 * @param key    the plain (already-decoded) key, for example {@code tr}
	 * @param buffer the caller-owned scratch buffer
	 * @return the predicate
	 */
	@NonNull
	public static Predicate<QueryParameter> isUriWithKey(@NonNull String key,
																											 @NonNull StringBuilder buffer) {
		requireNonNull(key);
		requireNonNull(buffer);

		return new UriWithKeyPredicate(key, buffer);
	}

	/**
	 * Matches {@code x.}-prefixed extension parameters with the given name that have a value, for example {@code x.custom=value}.
	 *
	 * @param name the extension name without its {@code x.} prefix
	 * @return the predicate
	 */
	@NonNull
	public static Predicate<QueryParameter> isExtensionParameter(@NonNull String name) {
		requireNonNull(name);

		return queryParameter -> {
			if (!queryParameter.hasValue())
				return false;

			String key = queryParameter.getDecodedKey();
			return key.startsWith("x.") && key.substring(2).equals(name);
		};
	}

	/**
	 * Parses a parameter's value, as written, into a {@link Uri}.
	 * <p>
	 * Exact topic values are percent-encoded only once, so the encoded text is itself the URI.
	 * Only apply to parameters already known to hold a valid URI, such as the exact topics of an accepted {@link MagnetLink}.
	 *
	 * @return the transform
	 */
	@NonNull
	public static Function<QueryParameter, Uri> toUri() {
		return URI_TRANSFORM;
	}

	/**
	 * Materializes the URI text that {@link #isUriWithKey(String, StringBuilder)} decoded into {@code buffer}.
	 *
	 * @param buffer the same buffer given to the predicate
	 * @return the transform
	 */
	@NonNull
	public static Function<QueryParameter, String> toDecodedValue(@NonNull StringBuilder buffer) {
		requireNonNull(buffer);
		return queryParameter -> buffer.toString();
	}

	/**
	 * Extracts the info hash from an exact topic: the part of its URI's path after the last {@code ":"}.
	 * <p>
	 * For {@code urn:btih:d2474e86c95b19b8bcfdb92bc12c9d44667cfa36} this is {@code d2474e86c95b19b8bcfdb92bc12c9d44667cfa36}.
	 * A path without {@code ":"} is entirely hash.
	 *
	 * @return the transform
	 */
	@NonNull
	public static Function<QueryParameter, String> toInfoHash() {
		return INFO_HASH_TRANSFORM;
	}

	/**
	 * Extracts the protocol from an exact topic: the part of its URI's path before the last {@code ":"}.
	 * <p>
	 * For {@code urn:btih:d2474e86c95b19b8bcfdb92bc12c9d44667cfa36} this is {@code btih}; for {@code urn:sha1:a:b} it is {@code sha1:a}.
	 * A path without {@code ":"} has no protocol, so the result is the empty string.
	 *
	 * @return the transform
	 */
	@NonNull
	public static Function<QueryParameter, String> toProtocol() {
		return PROTOCOL_TRANSFORM;
	}

	@ThreadSafe
	private static final class ExactTopicPredicate implements Predicate<QueryParameter> {
		@Override
		public boolean test(@NonNull QueryParameter queryParameter) {
			requireNonNull(queryParameter);

			// Decoding-aware, so "%78%74" matches too
			if (queryParameter.keyEquals("xt"))
				return true;

			return isExactTopicKey(queryParameter.getDecodedKey());
		}

		@Override
		@NonNull
		public String toString() {
			return "isExactTopic";
		}
	}

	@NotThreadSafe
	private static final class UriWithKeyPredicate implements Predicate<QueryParameter> {
		@NonNull
		private final String key;
		@NonNull
		private final StringBuilder buffer;

		private UriWithKeyPredicate(@NonNull String key,
																@NonNull StringBuilder buffer) {
			this.key = key;
			this.buffer = buffer;
		}

		@Override
		public boolean test(@NonNull QueryParameter queryParameter) {
			requireNonNull(queryParameter);

			if (!queryParameter.keyEquals(this.key))
				return false;

			if (!queryParameter.decodeValueInto(this.buffer)) {
				logger.log(FINEST, () -> format("Skipping '%s' parameter with missing or undecodable value %s", this.key, queryParameter));
				return false;
			}

			if (Uri.parse(this.buffer.toString()).isEmpty()) {
				logger.log(FINEST, () -> format("Skipping '%s' parameter whose decoded value is not a URI: %s", this.key, queryParameter));
				return false;
			}

			return true;
		}

		@Override
		@NonNull
		public String toString() {
			return format("isUriWithKey(%s)", this.key);
		}
	}

	@ThreadSafe
	private static final class UriTransform implements Function<QueryParameter, Uri> {
		@Override
		@NonNull
		public Uri apply(@NonNull QueryParameter queryParameter) {
			requireNonNull(queryParameter);
			return parseTopic(queryParameter);
		}

		@Override
		@NonNull
		public String toString() {
			return "toUri";
		}
	}

	@ThreadSafe
	private static final class TopicPathTransform implements Function<QueryParameter, String> {
		@NonNull
		private final Boolean afterLastColon;

		private TopicPathTransform(@NonNull Boolean afterLastColon) {
			this.afterLastColon = requireNonNull(afterLastColon);
		}

		@Override
		@NonNull
		public String apply(@NonNull QueryParameter queryParameter) {
			requireNonNull(queryParameter);

			String path = parseTopic(queryParameter).getPath();
			int lastColon = path.lastIndexOf(':');

			if (this.afterLastColon)
				return lastColon == -1 ? path : path.substring(lastColon + 1);

			return lastColon == -1 ? "" : path.substring(0, lastColon);
		}

		@Override
		@NonNull
		public String toString() {
			return this.afterLastColon ? "toInfoHash" : "toProtocol";
		}
	}

	@NonNull
	private static Uri parseTopic(@NonNull QueryParameter queryParameter) {
		String value = queryParameter.getEncodedValue().orElse("");

		return Uri.parse(value).orElseThrow(() ->
				new IllegalStateException(format("Exact topic value '%s' is not a valid URI", value)));
	}
}
