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

package com.revetware.magnet.exception;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when text contains a {@code %} that is not followed by two hexadecimal digits.
 */
@NotThreadSafe
public final class IllegalPercentEncodingException extends MagnetLinkException {
	@NonNull
	private final String encodedText;

	public IllegalPercentEncodingException(@Nullable String message,
																				 @NonNull String encodedText) {
		super(message);
		this.encodedText = requireNonNull(encodedText);
	}

	/**
	 * The text that failed to decode.
	 *
	 * @return the still-encoded text
	 */
	@NonNull
	public String getEncodedText() {
		return this.encodedText;
	}
}
