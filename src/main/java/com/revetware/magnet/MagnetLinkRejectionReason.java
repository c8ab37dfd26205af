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

/**
 * Reasons a candidate magnet link was rejected by {@link MagnetLinkRule}.
 */
public enum MagnetLinkRejectionReason {
	/**
	 * The input does not match the RFC 3986 {@code absolute-URI} production.
	 */
	INVALID_URI_SYNTAX,
	/**
	 * The input is a valid URI but its scheme is not {@code magnet}.
	 */
	UNSUPPORTED_SCHEME,
	/**
	 * No query parameter is keyed {@code xt} or {@code xt.<digits>}.
	 */
	MISSING_EXACT_TOPIC,
	/**
	 * An exact topic's value does not parse as a URI.
	 */
	INVALID_EXACT_TOPIC,
	/**
	 * A magnet link was matched but characters remain after it.
	 */
	TRAILING_CHARACTERS
}
