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

import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.text.ParsePosition;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class UriTests {
	@Test
	public void urn() {
		Uri uri = Uri.parse("urn:btih:d2474e86c95b19b8bcfdb92bc12c9d44667cfa36").orElseThrow();

		assertEquals("urn", uri.getScheme());
		assertEquals(Optional.empty(), uri.getAuthority());
		assertEquals("btih:d2474e86c95b19b8bcfdb92bc12c9d44667cfa36", uri.getPath());
		assertEquals(Optional.empty(), uri.getQuery());
		assertEquals(Optional.empty(), uri.getFragment());
	}

	@Test
	public void allComponents() {
		Uri uri = Uri.parse("http://user@[::1]:8080/a/b?q=1&r#frag").orElseThrow();

		assertEquals("http", uri.getScheme());
		assertEquals(Optional.of("user@[::1]:8080"), uri.getAuthority());
		assertEquals("/a/b", uri.getPath());
		assertEquals(Optional.of("q=1&r"), uri.getQuery());
		assertEquals(Optional.of("frag"), uri.getFragment());
	}

	@Test
	public void magnetLinkHasEmptyPath() {
		Uri uri = Uri.parse("magnet:?xt=urn:btih:abc&dn=Leaves+of+Grass").orElseThrow();

		assertEquals("magnet", uri.getScheme());
		assertEquals("", uri.getPath());
		assertEquals(Optional.of("xt=urn:btih:abc&dn=Leaves+of+Grass"), uri.getQuery());

		int count = 0;

		for (QueryParameter ignored : uri.getQueryParameters(QueryFormat.X_WWW_FORM_URLENCODED, UTF_8))
			count++;

		assertEquals(2, count);
	}

	@Test
	public void invalidInput() {
		assertFalse(Uri.parse("").isPresent());
		assertFalse(Uri.parse("not a uri").isPresent());
		assertFalse(Uri.parse("not%20a%20uri").isPresent(), "Relative references are not URIs");
		assertFalse(Uri.parse("1abc:x").isPresent(), "Scheme must start with a letter");
		assertFalse(Uri.parse("a:%zz").isPresent(), "Malformed percent-encoding");
		assertFalse(Uri.parse("http://host:port/").isPresent(), "Port must be numeric");
		assertFalse(Uri.parse("http://a@b@c/").isPresent());
		assertFalse(Uri.parse("http://[::1/").isPresent());
	}

	@Test
	public void roundTrip() {
		String text = "udp://tracker.example.com:80/announce?x=%20y#z";
		Uri uri = Uri.parse(text).orElseThrow();

		assertEquals(text, uri.toString());
		assertEquals(uri, Uri.parse(uri.toString()).orElseThrow());
	}

	@Test
	public void absoluteUriMatchesPrefix() {
		String text = "magnet:?xt=urn:a:b#x";
		ParsePosition parsePosition = new ParsePosition(0);

		Uri uri = Uri.parseAbsolute(text, parsePosition).orElseThrow();

		assertEquals(Optional.of("xt=urn:a:b"), uri.getQuery());
		assertEquals(Optional.empty(), uri.getFragment(), "absolute-URI has no fragment");
		assertEquals("#x", text.substring(parsePosition.getIndex()), "Fragment should be left unconsumed");
	}

	@Test
	public void absoluteUriFromOffset() {
		String text = "see urn:isbn:0451450523 for details";
		ParsePosition parsePosition = new ParsePosition(4);

		Uri uri = Uri.parseAbsolute(text, parsePosition).orElseThrow();

		assertEquals("isbn:0451450523", uri.getPath());
		assertEquals(" for details", text.substring(parsePosition.getIndex()));
	}

	@Test
	public void absoluteUriFailure() {
		ParsePosition parsePosition = new ParsePosition(0);

		assertFalse(Uri.parseAbsolute("::", parsePosition).isPresent());
		assertEquals(0, parsePosition.getIndex(), "Index should be unchanged on failure");
		assertTrue(parsePosition.getErrorIndex() >= 0, "Error index should be set on failure");
	}
}
