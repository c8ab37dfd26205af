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

import com.revetware.magnet.exception.IllegalMagnetLinkException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The outcome of parsing a candidate magnet link: either {@link Accepted}, holding the {@link MagnetLink}, or {@link Rejected}, holding the reason.
 * <p>
 * Rejection is a normal outcome, not an error:
 * <pre>{@code MagnetLinkParseResult result = MagnetLinks.parse(text);
 *
 * if (result instanceof MagnetLinkParseResult.Rejected rejected)
 *   System.out.println("Not a magnet link: " + rejected.getRejectionReason());
 * else
 *   show(result.orElseThrow());}</pre>
 */
public sealed interface MagnetLinkParseResult permits MagnetLinkParseResult.Accepted, MagnetLinkParseResult.Rejected {
	/**
	 * Was the input accepted as a magnet link?
	 *
	 * @return {@code true} if accepted, {@code false} if rejected
	 */
	@NonNull
	Boolean isAccepted();

	/**
	 * The parsed magnet link, if accepted.
	 *
	 * @return the magnet link, or {@link Optional#empty()} if rejected
	 */
	@NonNull
	Optional<MagnetLink> getMagnetLink();

	/**
	 * The parsed magnet link, or an exception describing why the input was rejected.
	 *
	 * @return the magnet link
	 * @throws IllegalMagnetLinkException if the input was rejected
	 */
	@NonNull
	MagnetLink orElseThrow();

	/**
	 * A successfully parsed magnet link.
	 */
	@ThreadSafe
	final class Accepted implements MagnetLinkParseResult {
		@NonNull
		private final MagnetLink magnetLink;

		Accepted(@NonNull MagnetLink magnetLink) {
			this.magnetLink = requireNonNull(magnetLink);
		}

		@Override
		@NonNull
		public Boolean isAccepted() {
			return true;
		}

		@Override
		@NonNull
		public Optional<MagnetLink> getMagnetLink() {
			return Optional.of(this.magnetLink);
		}

		@Override
		@NonNull
		public MagnetLink orElseThrow() {
			return this.magnetLink;
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{magnetLink=%s}", Accepted.class.getSimpleName(), this.magnetLink);
		}

		@Override
		public boolean equals(@Nullable Object object) {
			if (this == object)
				return true;

			if (!(object instanceof Accepted accepted))
				return false;

			return Objects.equals(this.magnetLink, accepted.magnetLink);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.magnetLink);
		}
	}

	/**
	 * Input that is not a magnet link, along with why.
	 */
	@ThreadSafe
	final class Rejected implements MagnetLinkParseResult {
		@NonNull
		private final MagnetLinkRejectionReason rejectionReason;
		@NonNull
		private final String message;
		@NonNull
		private final String input;

		Rejected(@NonNull MagnetLinkRejectionReason rejectionReason,
						 @NonNull String message,
						 @NonNull String input) {
			this.rejectionReason = requireNonNull(rejectionReason);
			this.message = requireNonNull(message);
			this.input = requireNonNull(input);
		}

		@Override
		@NonNull
		public Boolean isAccepted() {
			return false;
		}

		@Override
		@NonNull
		public Optional<MagnetLink> getMagnetLink() {
			return Optional.empty();
		}

		@Override
		@NonNull
		public MagnetLink orElseThrow() {
			throw new IllegalMagnetLinkException(getMessage(), getRejectionReason(), getInput());
		}

		@NonNull
		public MagnetLinkRejectionReason getRejectionReason() {
			return this.rejectionReason;
		}

		/**
		 * A human-readable description of the rejection, suitable for logging.
		 *
		 * @return the message
		 */
		@NonNull
		public String getMessage() {
			return this.message;
		}

		/**
		 * The text that was rejected.
		 *
		 * @return the input
		 */
		@NonNull
		public String getInput() {
			return this.input;
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{rejectionReason=%s, message=%s}", Rejected.class.getSimpleName(), getRejectionReason(), getMessage());
		}

		@Override
		public boolean equals(@Nullable Object object) {
			if (this == object)
				return true;

			if (!(object instanceof Rejected rejected))
				return false;

			return Objects.equals(getRejectionReason(), rejected.getRejectionReason())
					&& Objects.equals(getMessage(), rejected.getMessage())
					&& Objects.equals(getInput(), rejected.getInput());
		}

		@Override
		public int hashCode() {
			return Objects.hash(getRejectionReason(), getMessage(), getInput());
		}
	}
}
