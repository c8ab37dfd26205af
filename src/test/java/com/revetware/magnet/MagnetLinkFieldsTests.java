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

import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.function.Predicate;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class MagnetLinkFieldsTests {
	@Test
	public void exactTopicKeys() {
		Predicate<QueryParameter> isExactTopic = MagnetLinkFields.isExactTopic();

		assertTrue(isExactTopic.test(parameter("xt", "urn:btih:abc")));
		assertTrue(isExactTopic.test(parameter("xt.1", "urn:btih:abc")));
		assertTrue(isExactTopic.test(parameter("xt.23", "urn:btih:abc")));
		assertTrue(isExactTopic.test(parameter("%78%74", "urn:btih:abc")), "Percent-encoded 'xt' should match");
		assertTrue(isExactTopic.test(parameter("xt.%31", "urn:btih:abc")), "Percent-encoded 'xt.1' should match");

		assertFalse(isExactTopic.test(parameter("xt.a", "urn:btih:abc")));
		assertFalse(isExactTopic.test(parameter("xt.1a", "urn:btih:abc")));
		assertFalse(isExactTopic.test(parameter("xta", "urn:btih:abc")));
		assertFalse(isExactTopic.test(parameter("xt.", "urn:btih:abc")), "'xt.' needs at least one digit");
		assertFalse(isExactTopic.test(parameter("XT", "urn:btih:abc")), "Matching is case-sensitive");
		assertFalse(isExactTopic.test(parameter("x", "urn:btih:abc")));
		assertFalse(isExactTopic.test(parameter("", "urn:btih:abc")));
	}

	@Test
	public void exactTopicKeyText() {
		assertTrue(MagnetLinkFields.isExactTopicKey("xt"));
		assertTrue(MagnetLinkFields.isExactTopicKey("xt.0"));
		assertFalse(MagnetLinkFields.isExactTopicKey("xt.-1"));
		assertFalse(MagnetLinkFields.isExactTopicKey("xs"));
	}

	@Test
	public void uriWithKey() {
		StringBuilder buffer = new StringBuilder();
		Predicate<QueryParameter> isTracker = MagnetLinkFields.isUriWithKey("tr", buffer);

		assertTrue(isTracker.test(parameter("tr", "udp%3A%2F%2Ftracker.example.com%3A80")));
		assertEquals("udp://tracker.example.com:80", buffer.toString(), "Predicate should leave the decoded URI in the buffer");
		assertEquals("udp://tracker.example.com:80", MagnetLinkFields.toDecodedValue(buffer).apply(parameter("tr", "ignored")));

		assertFalse(isTracker.test(parameter("xs", "udp%3A%2F%2Ftracker.example.com%3A80")), "Key must match");
		assertFalse(isTracker.test(parameter("tr", null)), "Parameter without a value");
		assertFalse(isTracker.test(parameter("tr", "")), "Empty value is not a URI");
		assertFalse(isTracker.test(parameter("tr", "not%2520a%2520uri")), "Decoded once, the value is still not a URI");
		assertFalse(isTracker.test(parameter("tr", "%25zz")), "Decoded value has malformed percent-encoding");
		assertFalse(isTracker.test(parameter("tr", "%zz")), "Value fails to decode");
	}

	@Test
	public void extensionParameter() {
		Predicate<QueryParameter> isCustom = MagnetLinkFields.isExtensionParameter("custom");

		assertTrue(isCustom.test(parameter("x.custom", "value123")));
		assertTrue(isCustom.test(parameter("x%2Ecustom", "value123")), "Key is compared after decoding");
		assertTrue(isCustom.test(parameter("x.custom", "")));

		assertFalse(isCustom.test(parameter("x.custom", null)), "Parameter must have a value");
		assertFalse(isCustom.test(parameter("custom", "value123")), "Parameter must have the 'x.' prefix");
		assertFalse(isCustom.test(parameter("x.customs", "value123")));
		assertFalse(isCustom.test(parameter("x", "value123")));
	}

	@Test
	public void infoHashAndProtocol() {
		QueryParameter btih = parameter("xt", "urn:btih:d2474e86c95b19b8bcfdb92bc12c9d44667cfa36");

		assertEquals("d2474e86c95b19b8bcfdb92bc12c9d44667cfa36", MagnetLinkFields.toInfoHash().apply(btih));
		assertEquals("btih", MagnetLinkFields.toProtocol().apply(btih));

		QueryParameter nested = parameter("xt", "urn:sha1:a:b");
		assertEquals("b", MagnetLinkFields.toInfoHash().apply(nested), "Split happens on the last colon");
		assertEquals("sha1:a", MagnetLinkFields.toProtocol().apply(nested));

		QueryParameter noColon = parameter("xt", "urn:abc");
		assertEquals("abc", MagnetLinkFields.toInfoHash().apply(noColon), "Without a colon, the whole path is the hash");
		assertEquals("", MagnetLinkFields.toProtocol().apply(noColon), "Without a colon, there is no protocol");
	}

	@Test
	public void toUri() {
		Uri uri = MagnetLinkFields.toUri().apply(parameter("xt", "urn:btih:abc"));

		assertEquals("urn", uri.getScheme());
		assertEquals("btih:abc", uri.getPath());

		assertThrows(IllegalStateException.class, () -> MagnetLinkFields.toUri().apply(parameter("xt", "not%20a%20uri")));
	}

	private static QueryParameter parameter(String encodedKey, @Nullable String encodedValue) {
		return QueryParameter.with(encodedKey, encodedValue, QueryFormat.X_WWW_FORM_URLENCODED, UTF_8);
	}
}
