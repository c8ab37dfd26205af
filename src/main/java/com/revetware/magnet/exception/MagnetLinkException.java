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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Abstract superclass for exceptions thrown when magnet link or URI text cannot be interpreted.
 */
@NotThreadSafe
public abstract class MagnetLinkException extends RuntimeException {
	public MagnetLinkException(@Nullable String message) {
		super(message);
	}

	public MagnetLinkException(@Nullable String message,
														 @Nullable Throwable cause) {
		super(message, cause);
	}
}
