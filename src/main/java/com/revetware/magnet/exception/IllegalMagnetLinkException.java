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

import com.revetware.magnet.MagnetLinkRejectionReason;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a caller asks for a magnet link to be parsed "or else" and the input is rejected.
 *
 * @see com.revetware.magnet.MagnetLinks#parseOrThrow(String)
 */
@NotThreadSafe
public final class IllegalMagnetLinkException extends MagnetLinkException {
	@NonNull
	private final MagnetLinkRejectionReason rejectionReason;
	@NonNull
	private final String input;

	public IllegalMagnetLinkException(@Nullable String message,
																		@NonNull MagnetLinkRejectionReason rejectionReason,
																		@NonNull String input) {
		super(message);
		this.rejectionReason = requireNonNull(rejectionReason);
		this.input = requireNonNull(input);
	}

	@NonNull
	public MagnetLinkRejectionReason getRejectionReason() {
		return this.rejectionReason;
	}

	@NonNull
	public String getInput() {
		return this.input;
	}
}
