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

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.Charset;

import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * A non-instantiable collection of percent-decoding utility methods.
 * <p>
 * Decoding is a single pass: {@code "%2541"} decodes to {@code "%41"}, not {@code "A"}.
 * Consecutive {@code %xx} triplets are collected into bytes and interpreted with the supplied charset, so multi-byte sequences such as {@code "%E2%9C%93"} decode correctly.
 */
@ThreadSafe
public final class PercentEncoding {
	private PercentEncoding() {
		// Non-instantiable
	}

	/**
	 * Percent-decodes the given text using UTF-8 and {@link QueryFormat#X_WWW_FORM_URLENCODED} rules.
	 *
	 * @param encoded the percent-encoded text
	 * @return the decoded text
	 * @throws IllegalPercentEncodingException if the text contains malformed percent-encoding
	 */
	@NonNull
	public static String decode(@NonNull CharSequence encoded) {
		requireNonNull(encoded);
		return decode(encoded, QueryFormat.X_WWW_FORM_URLENCODED, UTF_8);
	}

	/**
	 * Percent-decodes the given text.
	 *
	 * @param encoded     the percent-encoded text
	 * @param queryFormat whether {@code "+"} decodes to a space
	 * @param charset     the charset used to interpret decoded bytes
	 * @return the decoded text
	 * @throws IllegalPercentEncodingException if the text contains malformed percent-encoding
	 */
	@NonNull
	public static String decode(@NonNull CharSequence encoded,
															@NonNull QueryFormat queryFormat,
															@NonNull Charset charset) {
		requireNonNull(encoded);
		requireNonNull(queryFormat);
		requireNonNull(charset);

		if (!requiresDecoding(encoded, queryFormat))
			return encoded.toString();

		StringBuilder buffer = new StringBuilder(encoded.length());

		if (!decodeInto(encoded, buffer, queryFormat, charset))
			throw new IllegalPercentEncodingException(format("Invalid percent-encoding in '%s'", encoded), encoded.toString());

		return buffer.toString();
	}

	/**
	 * Percent-decodes the given text into a caller-owned buffer, replacing whatever the buffer held before.
	 * <p>
	 * This is the non-throwing variant of {@link #decode(CharSequence, QueryFormat, Charset)}.
	 * If decoding fails, the buffer's contents are unspecified.
	 *
	 * @param encoded     the percent-encoded text
	 * @param buffer      the buffer to decode into
	 * @param queryFormat whether {@code "+"} decodes to a space
	 * @param charset     the charset used to interpret decoded bytes
	 * @return {@code true} if decoding succeeded, {@code false} if the text contains malformed percent-encoding
	 */
	@NonNull
	public static Boolean decodeInto(@NonNull CharSequence encoded,
																	 @NonNull StringBuilder buffer,
																	 @NonNull QueryFormat queryFormat,
																	 @NonNull Charset charset) {
		requireNonNull(encoded);
		requireNonNull(buffer);
		requireNonNull(queryFormat);
		requireNonNull(charset);

		buffer.setLength(0);

		int length = encoded.length();
		byte[] bytes = null;

		for (int i = 0; i < length; ) {
			char c = encoded.charAt(i);

			if (c == '%') {
				int runLength = percentTripletRunLength(encoded, i);

				if (runLength < 0)
					return false;

				// Consume the whole run of %xx triplets into bytes
				int byteCount = runLength / 3;

				if (bytes == null || bytes.length < byteCount)
					bytes = new byte[Math.max(byteCount, 8)];

				for (int j = 0; j < byteCount; j++)
					bytes[j] = (byte) decodedByte(encoded, i + j * 3);

				buffer.append(new String(bytes, 0, byteCount, charset));
				i += runLength;
				continue;
			}

			buffer.append(c == '+' && queryFormat == QueryFormat.X_WWW_FORM_URLENCODED ? ' ' : c);
			i++;
		}

		return true;
	}

	/**
	 * Compares percent-encoded text against plain text by decoded value, without decoding the encoded text into a new string.
	 * <p>
	 * For example, {@code "%78%74"} is equal to {@code "xt"}.
	 * Uses UTF-8 and {@link QueryFormat#X_WWW_FORM_URLENCODED} rules.
	 *
	 * @param encoded the percent-encoded text
	 * @param plain   the plain text to compare against
	 * @return {@code true} if {@code encoded} decodes to {@code plain}, {@code false} otherwise (including malformed encoding)
	 */
	@NonNull
	public static Boolean encodedEquals(@NonNull CharSequence encoded,
																			@NonNull CharSequence plain) {
		requireNonNull(encoded);
		requireNonNull(plain);

		return encodedEquals(encoded, plain, QueryFormat.X_WWW_FORM_URLENCODED, UTF_8);
	}

	/**
	 * Compares percent-encoded text against plain text by decoded value.
	 * <p>
	 * Runs of encoded ASCII bytes are compared in place; only runs containing multi-byte sequences are decoded, one run at a time.
	 *
	 * @param encoded     the percent-encoded text
	 * @param plain       the plain text to compare against
	 * @param queryFormat whether {@code "+"} decodes to a space
	 * @param charset     the charset used to interpret decoded bytes
	 * @return {@code true} if {@code encoded} decodes to {@code plain}, {@code false} otherwise (including malformed encoding)
	 */
	@NonNull
	public static Boolean encodedEquals(@NonNull CharSequence encoded,
																			@NonNull CharSequence plain,
																			@NonNull QueryFormat queryFormat,
																			@NonNull Charset charset) {
		requireNonNull(encoded);
		requireNonNull(plain);
		requireNonNull(queryFormat);
		requireNonNull(charset);

		// A decoded string is never longer than its encoded form
		if (plain.length() > encoded.length())
			return false;

		int length = encoded.length();
		int p = 0;

		for (int i = 0; i < length; ) {
			char c = encoded.charAt(i);

			if (c == '%') {
				int runLength = percentTripletRunLength(encoded, i);

				if (runLength < 0)
					return false;

				int byteCount = runLength / 3;
				boolean ascii = true;

				for (int j = 0; j < byteCount && ascii; j++)
					ascii = decodedByte(encoded, i + j * 3) < 0x80;

				if (ascii && isAsciiCompatible(charset)) {
					for (int j = 0; j < byteCount; j++) {
						if (p >= plain.length() || plain.charAt(p) != (char) decodedByte(encoded, i + j * 3))
							return false;
						p++;
					}
				} else {
					byte[] bytes = new byte[byteCount];

					for (int j = 0; j < byteCount; j++)
						bytes[j] = (byte) decodedByte(encoded, i + j * 3);

					String decoded = new String(bytes, charset);

					for (int j = 0; j < decoded.length(); j++) {
						if (p >= plain.length() || plain.charAt(p) != decoded.charAt(j))
							return false;
						p++;
					}
				}

				i += runLength;
				continue;
			}

			char decoded = c == '+' && queryFormat == QueryFormat.X_WWW_FORM_URLENCODED ? ' ' : c;

			if (p >= plain.length() || plain.charAt(p) != decoded)
				return false;

			p++;
			i++;
		}

		return p == plain.length();
	}

	/**
	 * Does the given text contain anything that decoding would change?
	 *
	 * @param encoded     the text to examine
	 * @param queryFormat whether {@code "+"} decodes to a space
	 * @return {@code true} if the text contains {@code "%"} (or {@code "+"} in form mode), {@code false} otherwise
	 */
	@NonNull
	public static Boolean requiresDecoding(@NonNull CharSequence encoded,
																				 @NonNull QueryFormat queryFormat) {
		requireNonNull(encoded);
		requireNonNull(queryFormat);

		for (int i = 0; i < encoded.length(); i++) {
			char c = encoded.charAt(i);

			if (c == '%' || (c == '+' && queryFormat == QueryFormat.X_WWW_FORM_URLENCODED))
				return true;
		}

		return false;
	}

	/**
	 * Is {@code c} a hexadecimal digit?
	 */
	@NonNull
	static Boolean isHexDigit(char c) {
		return hex(c) >= 0;
	}

	// Length in chars of the run of well-formed %xx triplets starting at index, or -1 if the first '%' in the run is malformed
	private static int percentTripletRunLength(@NonNull CharSequence s, int index) {
		int j = index;

		while (j < s.length() && s.charAt(j) == '%') {
			if (j + 2 >= s.length())
				return -1;

			if (hex(s.charAt(j + 1)) < 0 || hex(s.charAt(j + 2)) < 0)
				return -1;

			j += 3;
		}

		return j - index;
	}

	// Assumes a well-formed %xx triplet starts at index
	private static int decodedByte(@NonNull CharSequence s, int index) {
		return (hex(s.charAt(index + 1)) << 4) | hex(s.charAt(index + 2));
	}

	@NonNull
	private static Boolean isAsciiCompatible(@NonNull Charset charset) {
		return UTF_8.equals(charset)
				|| "US-ASCII".equals(charset.name())
				|| "ISO-8859-1".equals(charset.name());
	}

	private static int hex(char c) {
		if (c >= '0' && c <= '9') return c - '0';
		if (c >= 'A' && c <= 'F') return c - 'A' + 10;
		if (c >= 'a' && c <= 'f') return c - 'a' + 10;
		return -1;
	}
}
