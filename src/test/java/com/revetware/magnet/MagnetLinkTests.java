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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class MagnetLinkTests {
	private static final String HASH = "d2474e86c95b19b8bcfdb92bc12c9d44667cfa36";

	@Test
	public void basicLink() {
		MagnetLink magnetLink = MagnetLinks.parseOrThrow("magnet:?xt=urn:btih:" + HASH
				+ "&dn=Leaves+of+Grass&tr=udp%3A%2F%2Ftracker.example.com%3A80");

		assertEquals(Optional.of("Leaves of Grass"), magnetLink.getDisplayName());
		assertEquals(List.of("udp://tracker.example.com:80"), magnetLink.getAddressTrackers(new StringBuilder()).toList());
		assertEquals(List.of(HASH), magnetLink.getInfoHashes().toList());
		assertEquals(List.of("btih"), magnetLink.getProtocols().toList());

		List<Uri> exactTopics = magnetLink.getExactTopics().toList();
		assertEquals(1, exactTopics.size());
		assertEquals("urn:btih:" + HASH, exactTopics.get(0).toString());

		Uri tracker = Uri.parse(magnetLink.getAddressTrackers(new StringBuilder()).first().orElseThrow()).orElseThrow();
		assertEquals(Optional.of("tracker.example.com:80"), tracker.getAuthority());
	}

	@Test
	public void displayNameDecoding() {
		assertEquals(Optional.of("Leaves of Grass"),
				MagnetLinks.parseOrThrow("magnet:?xt=urn:btih:" + HASH + "&dn=Leaves%20of%20Grass").getDisplayName(), "'%20' should decode to space");

		MagnetLink strict = MagnetLinkRule.builder()
				.queryFormat(QueryFormat.RFC_3986_STRICT)
				.build()
				.parse("magnet:?xt=urn:btih:" + HASH + "&dn=Leaves+of+Grass")
				.orElseThrow();

		assertEquals(Optional.of("Leaves+of+Grass"), strict.getDisplayName(), "'+' is literal in strict mode");
	}

	@Test
	public void multipleExactTopics() {
		MagnetLink magnetLink = MagnetLinks.parseOrThrow("magnet:?xt.1=urn:btih:" + HASH
				+ "&dn=Two+Topics&xt.2=urn:sha1:TXGCZQTH26NL6OUQAJJPFALHG2LTGBC7");

		assertEquals(2, magnetLink.getExactTopics().toList().size());
		assertEquals(List.of(HASH, "TXGCZQTH26NL6OUQAJJPFALHG2LTGBC7"), magnetLink.getInfoHashes().toList());
		assertEquals(List.of("btih", "sha1"), magnetLink.getProtocols().toList());
	}

	@Test
	public void exactTopicsRoundTrip() {
		MagnetLink magnetLink = MagnetLinks.parseOrThrow("magnet:?xt=urn:btih:" + HASH + "&xt.1=urn:ed2k:354B15E68FB8F36D7CD88FF94116CDC1");

		assertFalse(magnetLink.getExactTopics().isEmpty());

		for (Uri exactTopic : magnetLink.getExactTopics())
			assertEquals(exactTopic, Uri.parse(exactTopic.toString()).orElseThrow(), "Re-serialized exact topic should re-parse to an equal URI");
	}

	@Test
	public void accessorsAreRepeatable() {
		MagnetLink magnetLink = MagnetLinks.parseOrThrow(sampleLink());
		StringBuilder buffer = new StringBuilder();

		assertEquals(magnetLink.getExactTopics().toList(), magnetLink.getExactTopics().toList());
		assertEquals(magnetLink.getInfoHashes().toList(), magnetLink.getInfoHashes().toList());

		FilteredView<QueryParameter, String> trackers = magnetLink.getAddressTrackers(buffer);
		assertEquals(trackers.toList(), trackers.toList(), "Re-iterating a view should yield the same elements");
		assertEquals(5, trackers.toList().size());
	}

	@Test
	public void invalidTrackersAreSkipped() {
		MagnetLink magnetLink = MagnetLinks.parseOrThrow("magnet:?xt=urn:btih:" + HASH
				+ "&tr=udp%3A%2F%2Fa.example.com%3A80"
				+ "&tr=not%2520a%2520uri"
				+ "&tr"
				+ "&tr=%25zz"
				+ "&tr=http%3A%2F%2Fb.example.com%2Fannounce");

		assertEquals(List.of("udp://a.example.com:80", "http://b.example.com/announce"),
				magnetLink.getAddressTrackers(new StringBuilder()).toList(), "Only valid trackers, in original order");
	}

	@Test
	public void sourcesSeedsAndManifests() {
		MagnetLink magnetLink = MagnetLinks.parseOrThrow("magnet:?xt=urn:btih:" + HASH
				+ "&xs=http%3A%2F%2Fcache.example.com%2Ffile.torrent"
				+ "&as=https%3A%2F%2Fmirror.example.com%2Ffile.epub"
				+ "&mt=http%3A%2F%2Fexample.com%2Fmanifest.txt"
				+ "&ws=https%3A%2F%2Fseed.example.com%2Ffiles%2F"
				+ "&kt=martin+luther+king+mp3");

		assertEquals(List.of("http://cache.example.com/file.torrent"), magnetLink.getExactSources(new StringBuilder()).toList());
		assertEquals(List.of("https://mirror.example.com/file.epub"), magnetLink.getAcceptableSources(new StringBuilder()).toList());
		assertEquals(List.of("http://example.com/manifest.txt"), magnetLink.getManifestTopics(new StringBuilder()).toList());
		assertEquals(List.of("https://seed.example.com/files/"), magnetLink.getWebSeeds(new StringBuilder()).toList());
		assertEquals(Optional.of("martin luther king mp3"), magnetLink.getKeywordTopic());
		assertTrue(magnetLink.getAddressTrackers(new StringBuilder()).isEmpty());
	}

	@Test
	public void separateBuffersMayBeInterleaved() {
		MagnetLink magnetLink = MagnetLinks.parseOrThrow("magnet:?xt=urn:btih:" + HASH
				+ "&tr=udp%3A%2F%2Ftracker.example.com%3A80"
				+ "&ws=https%3A%2F%2Fseed.example.com%2F"
				+ "&tr=udp%3A%2F%2Ftracker.example.org%3A1337");

		List<String> pairs = new ArrayList<>();
		var trackers = magnetLink.getAddressTrackers(new StringBuilder()).iterator();
		var seeds = magnetLink.getWebSeeds(new StringBuilder()).iterator();

		while (trackers.hasNext()) {
			String tracker = trackers.next();
			String seed = seeds.hasNext() ? seeds.next() : "-";
			pairs.add(tracker + " " + seed);
		}

		assertEquals(List.of(
				"udp://tracker.example.com:80 https://seed.example.com/",
				"udp://tracker.example.org:1337 -"
		), pairs);
	}

	@Test
	public void singleValuedFields() {
		MagnetLink magnetLink = MagnetLinks.parseOrThrow("magnet:?xt=urn:btih:" + HASH + "&dn&kt=");

		assertEquals(Optional.empty(), magnetLink.getDisplayName(), "A key without a value has no display name");
		assertEquals(Optional.of(""), magnetLink.getKeywordTopic(), "An empty value is still a value");

		MagnetLink bare = MagnetLinks.parseOrThrow("magnet:?xt=urn:btih:" + HASH);
		assertEquals(Optional.empty(), bare.getDisplayName());
		assertEquals(Optional.empty(), bare.getKeywordTopic());

		MagnetLink twice = MagnetLinks.parseOrThrow("magnet:?xt=urn:btih:" + HASH + "&dn=First&dn=Second");
		assertEquals(Optional.of("First"), twice.getDisplayName());
	}

	@Test
	public void extensionParameters() {
		MagnetLink magnetLink = MagnetLinks.parseOrThrow("magnet:?xt=urn:btih:" + HASH
				+ "&custom=plain&x.custom=value123&x.pe=10.0.0.1%3A6881");

		assertEquals(Optional.of("value123"), magnetLink.getParameter("custom"));
		assertEquals(Optional.of("10.0.0.1:6881"), magnetLink.getParameter("pe"));
		assertEquals(Optional.empty(), magnetLink.getParameter("missing"));

		MagnetLink unprefixed = MagnetLinks.parseOrThrow("magnet:?xt=urn:btih:" + HASH + "&custom=value123");
		assertEquals(Optional.empty(), unprefixed.getParameter("custom"), "Keys without the 'x.' prefix are not extension parameters");
	}

	@Test
	public void textRepresentation() {
		String text = sampleLink();
		MagnetLink magnetLink = MagnetLinks.parseOrThrow(text);

		assertEquals(text, magnetLink.toString());
		assertEquals(magnetLink, MagnetLinks.parseOrThrow(text));
		assertEquals("magnet", magnetLink.getUri().getScheme());
	}

	private static String sampleLink() {
		return "magnet:?xt=urn:btih:" + HASH
				+ "&dn=Leaves+of+Grass+by+Walt+Whitman.epub"
				+ "&tr=udp%3A%2F%2Ftracker.example4.com%3A80"
				+ "&tr=udp%3A%2F%2Ftracker.example5.com%3A80"
				+ "&tr=udp%3A%2F%2Ftracker.example3.com%3A6969"
				+ "&tr=udp%3A%2F%2Ftracker.example2.com%3A80"
				+ "&tr=udp%3A%2F%2Ftracker.example1.com%3A1337";
	}
}
