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
import java.text.ParsePosition;
import java.util.Objects;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.FINER;

/**
 * Grammar rule that matches a magnet link.
 * <p>
 * Matching happens in two passes. First, the text must be an RFC 3986 {@code absolute-URI} (and, by default, have scheme {@code magnet}).
 * Second, its query must contain at least one exact topic ({@code xt} or {@code xt.<digits>}) and every exact topic's value must itself parse as a URI.
 * All other magnet fields are optional and are only checked lazily by the {@link MagnetLink} accessors.
 * <p>
 * Instances are immutable; acquire the default via {@link #withDefaults()} or configure one via {@link #builder()}.
 * Most callers will prefer {@link MagnetLinks#parse(String)}.
 */
@ThreadSafe
public final class MagnetLinkRule {
	@NonNull
	private static final Logger logger = Logger.getLogger(MagnetLinkRule.class.getName());

	@NonNull
	private static final String MAGNET_SCHEME;
	@NonNull
	private static final MagnetLinkRule DEFAULT_INSTANCE;

	static {
		MAGNET_SCHEME = "magnet";
		DEFAULT_INSTANCE = new Builder().build();
	}

	@NonNull
	private final QueryFormat queryFormat;
	@NonNull
	private final Charset charset;
	@NonNull
	private final Boolean requireMagnetScheme;

	/**
	 * Acquires a rule that decodes with {@link QueryFormat#X_WWW_FORM_URLENCODED} and UTF-8 and requires the {@code magnet} scheme.
	 *
	 * @return the default rule
	 */
	@NonNull
	public static MagnetLinkRule withDefaults() {
		return DEFAULT_INSTANCE;
	}

	/**
	 * Acquires a builder for {@link MagnetLinkRule} instances.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	private MagnetLinkRule(@NonNull Builder builder) {
		requireNonNull(builder);

		this.queryFormat = builder.queryFormat != null ? builder.queryFormat : QueryFormat.X_WWW_FORM_URLENCODED;
		this.charset = builder.charset != null ? builder.charset : UTF_8;
		this.requireMagnetScheme = builder.requireMagnetScheme != null ? builder.requireMagnetScheme : true;
	}

	/**
	 * Matches the entirety of {@code input} as a magnet link.
	 *
	 * @param input the candidate magnet link
	 * @return the accepted link, or the reason for rejection; never throws for malformed input
	 */
	@NonNull
	public MagnetLinkParseResult parse(@NonNull String input) {
		requireNonNull(input);

		ParsePosition parsePosition = new ParsePosition(0);
		MagnetLinkParseResult result = parse(input, parsePosition);

		if (result.isAccepted() && parsePosition.getIndex() != input.length())
			return reject(MagnetLinkRejectionReason.TRAILING_CHARACTERS,
					format("Unexpected characters after magnet link at index %d", parsePosition.getIndex()), input);

		return result;
	}

	/**
	 * Matches a magnet link starting at the position's index, so this rule can be composed into a larger grammar.
	 * <p>
	 * On acceptance, the position's index is advanced past the matched link; any following text (for example a {@code "#"}) is left unconsumed.
	 * On rejection, the position's index is restored to where matching started and its error index is set; callers should not rely on partial consumption.
	 *
	 * @param input         the text to match against
	 * @param parsePosition where matching starts; updated as described above
	 * @return the accepted link, or the reason for rejection; never throws for malformed input
	 */
	@NonNull
	public MagnetLinkParseResult parse(@NonNull CharSequence input,
																		 @NonNull ParsePosition parsePosition) {
		requireNonNull(input);
		requireNonNull(parsePosition);

		int start = parsePosition.getIndex();

		// 1. General URI syntax
		Uri uri = Uri.parseAbsolute(input, parsePosition).orElse(null);

		if (uri == null)
			return reject(MagnetLinkRejectionReason.INVALID_URI_SYNTAX,
					format("Input is not a valid absolute URI (error at index %d)", parsePosition.getErrorIndex()), input);

		if (this.requireMagnetScheme && !MAGNET_SCHEME.equalsIgnoreCase(uri.getScheme()))
			return rejectAt(start, parsePosition, MagnetLinkRejectionReason.UNSUPPORTED_SCHEME,
					format("Expected scheme '%s' but found '%s'", MAGNET_SCHEME, uri.getScheme()), input);

		logger.log(FINER, () -> format("Parsed general URI syntax for %s", uri));

		// 2. There must be at least one exact topic; it is the only mandatory field
		QueryParameters queryParameters = uri.getQueryParameters(this.queryFormat, this.charset);
		FilteredView<QueryParameter, QueryParameter> exactTopics = FilteredView.filtering(queryParameters, MagnetLinkFields.isExactTopic());
		FilteredView.Cursor<QueryParameter, QueryParameter> cursor = exactTopics.begin();

		if (cursor.isEnd())
			return rejectAt(start, parsePosition, MagnetLinkRejectionReason.MISSING_EXACT_TOPIC,
					"Magnet link has no exact topic (xt) parameter", input);

		// 3. Every exact topic must itself be a URI.  Values are encoded only once, so they parse as-is
		for (; !cursor.isEnd(); cursor.advance()) {
			QueryParameter exactTopic = cursor.get();
			String value = exactTopic.getEncodedValue().orElse("");

			if (Uri.parse(value).isEmpty())
				return rejectAt(start, parsePosition, MagnetLinkRejectionReason.INVALID_EXACT_TOPIC,
						format("Exact topic '%s' has value '%s', which is not a valid URI", exactTopic.getEncodedKey(), value), input);
		}

		// 4. All other fields are optional
		return new MagnetLinkParseResult.Accepted(new MagnetLink(uri, this.queryFormat, this.charset));
	}

	@NonNull
	private MagnetLinkParseResult rejectAt(int start,
																				 @NonNull ParsePosition parsePosition,
																				 @NonNull MagnetLinkRejectionReason rejectionReason,
																				 @NonNull String message,
																				 @NonNull CharSequence input) {
		parsePosition.setErrorIndex(start);
		parsePosition.setIndex(start);
		return reject(rejectionReason, message, input);
	}

	@NonNull
	private MagnetLinkParseResult reject(@NonNull MagnetLinkRejectionReason rejectionReason,
																			 @NonNull String message,
																			 @NonNull CharSequence input) {
		logger.log(FINE, () -> format("Rejected magnet link (%s): %s", rejectionReason.name(), message));
		return new MagnetLinkParseResult.Rejected(rejectionReason, message, input.toString());
	}

	@NonNull
	public QueryFormat getQueryFormat() {
		return this.queryFormat;
	}

	@NonNull
	public Charset getCharset() {
		return this.charset;
	}

	/**
	 * Does this rule reject URIs whose scheme is not {@code magnet}?
	 *
	 * @return {@code true} if the scheme is checked, {@code false} if any scheme is accepted
	 */
	@NonNull
	public Boolean getRequireMagnetScheme() {
		return this.requireMagnetScheme;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{queryFormat=%s, charset=%s, requireMagnetScheme=%s}", getClass().getSimpleName(),
				getQueryFormat(), getCharset(), getRequireMagnetScheme());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof MagnetLinkRule magnetLinkRule))
			return false;

		return Objects.equals(getQueryFormat(), magnetLinkRule.getQueryFormat())
				&& Objects.equals(getCharset(), magnetLinkRule.getCharset())
				&& Objects.equals(getRequireMagnetScheme(), magnetLinkRule.getRequireMagnetScheme());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getQueryFormat(), getCharset(), getRequireMagnetScheme());
	}

	/**
	 * Builder used to construct instances of {@link MagnetLinkRule}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private QueryFormat queryFormat;
		@Nullable
		private Charset charset;
		@Nullable
		private Boolean requireMagnetScheme;

		private Builder() {
			// Only permit construction through MagnetLinkRule builder methods
		}

		/**
		 * How query keys and values are decoded; defaults to {@link QueryFormat#X_WWW_FORM_URLENCODED}.
		 *
		 * @param queryFormat the query format, or {@code null} for the default
		 * @return this builder
		 */
		@NonNull
		public Builder queryFormat(@Nullable QueryFormat queryFormat) {
			this.queryFormat = queryFormat;
			return this;
		}

		/**
		 * The charset used to interpret percent-decoded bytes; defaults to UTF-8.
		 *
		 * @param charset the charset, or {@code null} for the default
		 * @return this builder
		 */
		@NonNull
		public Builder charset(@Nullable Charset charset) {
			this.charset = charset;
			return this;
		}

		/**
		 * Whether URIs with a scheme other than {@code magnet} (compared case-insensitively) are rejected; defaults to {@code true}.
		 * <p>
		 * Disable when this rule is one of several alternatives in a multi-scheme grammar that has already dispatched on the scheme.
		 *
		 * @param requireMagnetScheme whether to check the scheme, or {@code null} for the default
		 * @return this builder
		 */
		@NonNull
		public Builder requireMagnetScheme(@Nullable Boolean requireMagnetScheme) {
			this.requireMagnetScheme = requireMagnetScheme;
			return this;
		}

		@NonNull
		public MagnetLinkRule build() {
			return new MagnetLinkRule(this);
		}
	}
}
