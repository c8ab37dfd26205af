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

import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * A non-instantiable collection of entry points for parsing magnet links with {@link MagnetLinkRule#withDefaults()}.
 */
@ThreadSafe
public final class MagnetLinks {
	private MagnetLinks() {
		// Non-instantiable
	}

	/**
	 * Parses the entirety of {@code input} as a magnet link, e.g. {@code magnet:?xt=urn:btih:d2474e86c95b19b8bcfdb92bc12c9d44667cfa36&dn=Leaves+of+Grass}.
	 *
	 * @param input the candidate magnet link
	 * @return the accepted link, or the reason for rejection; never throws for malformed input
	 */
	@NonNull
	public static MagnetLinkParseResult parse(@NonNull String input) {
		requireNonNull(input);
		return MagnetLinkRule.withDefaults().parse(input);
	}

	/**
	 * Parses the entirety of {@code input} as a magnet link, throwing if it is rejected.
	 *
	 * @param input the candidate magnet link
	 * @return the magnet link
	 * @throws IllegalMagnetLinkException if {@code input} is not a magnet link
	 */
	@NonNull
	public static MagnetLink parseOrThrow(@NonNull String input) {
		requireNonNull(input);
		return parse(input).orElseThrow();
	}
}
