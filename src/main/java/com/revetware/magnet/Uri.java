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

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.Charset;
import java.text.ParsePosition;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A syntactically valid RFC 3986 URI whose components are held exactly as written (still percent-encoded).
 * <p>
 * Unlike {@link java.net.URI}, there is no distinction between "opaque" and "hierarchical" URIs: {@code magnet:?xt=urn:btih:abc}
 * has scheme {@code magnet}, an empty path and query {@code xt=urn:btih:abc}, while {@code urn:btih:abc} has path {@code btih:abc}.
 * <p>
 * Instances are acquired via {@link #parse(String)} (the {@code URI} production, which permits a fragment) or
 * {@link #parseAbsolute(CharSequence, ParsePosition)} (the {@code absolute-URI} production, which matches a prefix and does not).
 * No normalization is performed.
 *
 * @see <a href="https://www.rfc-editor.org/rfc/rfc3986#appendix-A">RFC 3986 Appendix A</a>
 */
@ThreadSafe
public final class Uri {
	@NonNull
	private final String scheme;
	@Nullable
	private final String authority;
	@NonNull
	private final String path;
	@Nullable
	private final String query;
	@Nullable
	private final String fragment;

	/**
	 * Parses the entirety of {@code text} as an RFC 3986 {@code URI}: {@code scheme ":" hier-part [ "?" query ] [ "#" fragment ]}.
	 * <p>
	 * Relative references are not accepted, so {@code "not%20a%20uri"} does not parse.
	 *
	 * @param text the candidate URI
	 * @return the parsed URI, or {@link Optional#empty()} if {@code text} is not a URI
	 */
	@NonNull
	public static Optional<Uri> parse(@NonNull String text) {
		requireNonNull(text);

		Parser parser = new Parser(text, 0, true);
		Uri uri = parser.parse();

		// Must consume everything
		if (uri == null || parser.getIndex() != text.length())
			return Optional.empty();

		return Optional.of(uri);
	}

	/**
	 * Matches the longest RFC 3986 {@code absolute-URI} ({@code scheme ":" hier-part [ "?" query ]}) starting at the position's index.
	 * <p>
	 * On success, the position's index is advanced past the matched text.
	 * On failure, the position's error index is set and its index is left unchanged.
	 * Any characters after the match (such as a {@code "#"} fragment) are left for the caller.
	 *
	 * @param text          the text to match against
	 * @param parsePosition where matching starts; updated as described above
	 * @return the matched URI, or {@link Optional#empty()} if no {@code absolute-URI} starts at the position
	 */
	@NonNull
	public static Optional<Uri> parseAbsolute(@NonNull CharSequence text,
																						@NonNull ParsePosition parsePosition) {
		requireNonNull(text);
		requireNonNull(parsePosition);

		int start = parsePosition.getIndex();

		if (start < 0 || start > text.length()) {
			parsePosition.setErrorIndex(start);
			return Optional.empty();
		}

		Parser parser = new Parser(text, start, false);
		Uri uri = parser.parse();

		if (uri == null) {
			parsePosition.setErrorIndex(parser.getIndex());
			return Optional.empty();
		}

		parsePosition.setIndex(parser.getIndex());
		return Optional.of(uri);
	}

	private Uri(@NonNull String scheme,
							@Nullable String authority,
							@NonNull String path,
							@Nullable String query,
							@Nullable String fragment) {
		this.scheme = requireNonNull(scheme);
		this.authority = authority;
		this.path = requireNonNull(path);
		this.query = query;
		this.fragment = fragment;
	}

	/**
	 * The lazily-enumerated parameters of this URI's query, decoded with the given rules on demand.
	 *
	 * @param queryFormat how keys and values are decoded
	 * @param charset     the charset used to interpret decoded bytes
	 * @return the query parameters, or an empty sequence if this URI has no query
	 */
	@NonNull
	public QueryParameters getQueryParameters(@NonNull QueryFormat queryFormat,
																						@NonNull Charset charset) {
		requireNonNull(queryFormat);
		requireNonNull(charset);

		if (this.query == null)
			return QueryParameters.empty();

		return QueryParameters.fromQuery(this.query, queryFormat, charset);
	}

	/**
	 * The scheme, for example {@code magnet} or {@code udp}.
	 *
	 * @return the scheme as written
	 */
	@NonNull
	public String getScheme() {
		return this.scheme;
	}

	/**
	 * The authority, for example {@code tracker.example.com:80}.
	 *
	 * @return the authority, or {@link Optional#empty()} if the URI has no {@code "//"}
	 */
	@NonNull
	public Optional<String> getAuthority() {
		return Optional.ofNullable(this.authority);
	}

	/**
	 * The path, for example {@code btih:d2474e86c95b19b8bcfdb92bc12c9d44667cfa36} for an {@code urn:} URI.
	 *
	 * @return the percent-encoded path, possibly empty
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	@NonNull
	public Optional<String> getQuery() {
		return Optional.ofNullable(this.query);
	}

	@NonNull
	public Optional<String> getFragment() {
		return Optional.ofNullable(this.fragment);
	}

	/**
	 * Re-serializes this URI; the result is exactly the text that was parsed.
	 */
	@Override
	@NonNull
	public String toString() {
		StringBuilder sb = new StringBuilder(this.scheme).append(':');

		if (this.authority != null)
			sb.append("//").append(this.authority);

		sb.append(this.path);

		if (this.query != null)
			sb.append('?').append(this.query);

		if (this.fragment != null)
			sb.append('#').append(this.fragment);

		return sb.toString();
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Uri uri))
			return false;

		return Objects.equals(getScheme(), uri.getScheme())
				&& Objects.equals(this.authority, uri.authority)
				&& Objects.equals(getPath(), uri.getPath())
				&& Objects.equals(this.query, uri.query)
				&& Objects.equals(this.fragment, uri.fragment);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getScheme(), this.authority, getPath(), this.query, this.fragment);
	}

	/**
	 * Recursive-descent matcher for the RFC 3986 productions; single-use.
	 */
	private static final class Parser {
		@NonNull
		private final CharSequence text;
		@NonNull
		private final Boolean permitFragment;
		private int index;

		private Parser(@NonNull CharSequence text,
									 int index,
									 @NonNull Boolean permitFragment) {
			this.text = text;
			this.index = index;
			this.permitFragment = permitFragment;
		}

		private int getIndex() {
			return this.index;
		}

		@Nullable
		private Uri parse() {
			String scheme = scheme();

			if (scheme == null || !consume(':'))
				return null;

			String authority = null;

			if (startsWith("//")) {
				this.index += 2;
				int start = this.index;

				while (this.index < this.text.length() && isAuthorityChar(this.text.charAt(this.index)))
					this.index++;

				authority = this.text.subSequence(start, this.index).toString();

				if (!isValidAuthority(authority))
					return null;
			}

			// path-abempty, path-absolute, path-rootless and path-empty all reduce to *( pchar / "/" ) here:
			// "//" was consumed above and the authority stops at the first "/"
			String path = run(false);
			String query = null;
			String fragment = null;

			if (consume('?'))
				query = run(true);

			if (this.permitFragment && consume('#'))
				fragment = run(true);

			return new Uri(scheme, authority, path, query, fragment);
		}

		// scheme = ALPHA *( ALPHA / DIGIT / "+" / "-" / "." )
		@Nullable
		private String scheme() {
			int start = this.index;

			if (this.index >= this.text.length() || !isAlpha(this.text.charAt(this.index)))
				return null;

			this.index++;

			while (this.index < this.text.length()) {
				char c = this.text.charAt(this.index);

				if (!(isAlpha(c) || isDigit(c) || c == '+' || c == '-' || c == '.'))
					break;

				this.index++;
			}

			return this.text.subSequence(start, this.index).toString();
		}

		// *( pchar / "/" ), plus "?" for query and fragment
		@NonNull
		private String run(@NonNull Boolean permitQuestionMark) {
			int start = this.index;

			while (this.index < this.text.length()) {
				char c = this.text.charAt(this.index);

				if (c == '%') {
					if (!isPercentTriplet(this.index))
						break;

					this.index += 3;
					continue;
				}

				if (isPchar(c) || c == '/' || (permitQuestionMark && c == '?'))
					this.index++;
				else
					break;
			}

			return this.text.subSequence(start, this.index).toString();
		}

		@NonNull
		private Boolean consume(char c) {
			if (this.index < this.text.length() && this.text.charAt(this.index) == c) {
				this.index++;
				return true;
			}

			return false;
		}

		@NonNull
		private Boolean startsWith(@NonNull String prefix) {
			if (this.index + prefix.length() > this.text.length())
				return false;

			for (int i = 0; i < prefix.length(); i++)
				if (this.text.charAt(this.index + i) != prefix.charAt(i))
					return false;

			return true;
		}

		@NonNull
		private Boolean isPercentTriplet(int at) {
			return at + 2 < this.text.length()
					&& PercentEncoding.isHexDigit(this.text.charAt(at + 1))
					&& PercentEncoding.isHexDigit(this.text.charAt(at + 2));
		}

		// Superset used to find where the authority ends; structure is checked by isValidAuthority
		@NonNull
		private Boolean isAuthorityChar(char c) {
			return isUnreserved(c) || isSubDelim(c) || c == ':' || c == '@' || c == '[' || c == ']' || c == '%';
		}

		// authority = [ userinfo "@" ] host [ ":" port ]
		@NonNull
		private Boolean isValidAuthority(@NonNull String authority) {
			if (!hasValidPercentEncoding(authority))
				return false;

			int at = authority.indexOf('@');

			if (at != authority.lastIndexOf('@'))
				return false;

			String userinfo = at == -1 ? "" : authority.substring(0, at);
			String hostAndPort = at == -1 ? authority : authority.substring(at + 1);

			if (userinfo.indexOf('[') != -1 || userinfo.indexOf(']') != -1)
				return false;

			String port;

			if (hostAndPort.startsWith("[")) {
				int close = hostAndPort.indexOf(']');

				if (close == -1 || close == 1)
					return false;

				String ipLiteral = hostAndPort.substring(1, close);

				for (int i = 0; i < ipLiteral.length(); i++) {
					char c = ipLiteral.charAt(i);

					if (!(isUnreserved(c) || isSubDelim(c) || c == ':'))
						return false;
				}

				String remainder = hostAndPort.substring(close + 1);

				if (remainder.isEmpty())
					return true;

				if (remainder.charAt(0) != ':')
					return false;

				port = remainder.substring(1);
			} else {
				int colon = hostAndPort.indexOf(':');
				String host = colon == -1 ? hostAndPort : hostAndPort.substring(0, colon);

				if (host.indexOf('[') != -1 || host.indexOf(']') != -1)
					return false;

				port = colon == -1 ? "" : hostAndPort.substring(colon + 1);
			}

			for (int i = 0; i < port.length(); i++)
				if (!isDigit(port.charAt(i)))
					return false;

			return true;
		}

		@NonNull
		private Boolean hasValidPercentEncoding(@NonNull String s) {
			for (int i = 0; i < s.length(); i++) {
				if (s.charAt(i) != '%')
					continue;

				if (i + 2 >= s.length() || !PercentEncoding.isHexDigit(s.charAt(i + 1)) || !PercentEncoding.isHexDigit(s.charAt(i + 2)))
					return false;

				i += 2;
			}

			return true;
		}

		@NonNull
		private static Boolean isPchar(char c) {
			return isUnreserved(c) || isSubDelim(c) || c == ':' || c == '@';
		}

		@NonNull
		private static Boolean isUnreserved(char c) {
			return isAlpha(c) || isDigit(c) || c == '-' || c == '.' || c == '_' || c == '~';
		}

		@NonNull
		private static Boolean isSubDelim(char c) {
			switch (c) {
				case '!':
				case '$':
				case '&':
				case '\'':
				case '(':
				case ')':
				case '*':
				case '+':
				case ',':
				case ';':
				case '=':
					return true;
				default:
					return false;
			}
		}

		@NonNull
		private static Boolean isAlpha(char c) {
			return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
		}

		@NonNull
		private static Boolean isDigit(char c) {
			return c >= '0' && c <= '9';
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{index=%d, permitFragment=%s}", getClass().getSimpleName(), this.index, this.permitFragment);
		}
	}
}
