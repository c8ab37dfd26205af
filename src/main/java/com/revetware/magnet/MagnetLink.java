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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.Charset;
import java.util.Objects;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A parsed magnet link, exposing the fields that matter to the {@code magnet} scheme rather than the general URI syntax.
 * <p>
 * Instances are acquired via {@link MagnetLinks#parse(String)} or {@link MagnetLinkRule}, which guarantee that the link
 * has at least one exact topic and that every exact topic's value is itself a URI.
 * <p>
 * Multi-valued fields are returned as {@link FilteredView}s computed on demand over the link's query parameters; nothing is cached.
 * Fields whose values are doubly percent-encoded URIs ({@code tr}, {@code xs}, {@code as}, {@code mt}, {@code ws}) require a caller-owned
 * scratch buffer. A buffer must not be shared by two views that are iterated at the same time, since each step overwrites it.
 * <p>
 * For example:
 * <pre>{@code MagnetLink magnetLink = MagnetLinks.parseOrThrow(
 *   "magnet:?xt=urn:btih:d2474e86c95b19b8bcfdb92bc12c9d44667cfa36"
 *   + "&dn=Leaves+of+Grass&tr=udp%3A%2F%2Ftracker.example.com%3A80");
 *
 * // "Leaves of Grass"
 * String displayName = magnetLink.getDisplayName().orElse(null);
 *
 * // "udp://tracker.example.com:80"
 * for (String tracker : magnetLink.getAddressTrackers(new StringBuilder()))
 *   System.out.println(tracker);}</pre>
 *
 * @see <a href="https://www.bittorrent.org/beps/bep_0009.html">BEP 9: Extension for Peers to Send Metadata Files</a>
 * @see <a href="https://www.bittorrent.org/beps/bep_0053.html">BEP 53: Magnet URI extension</a>
 * @see <a href="https://en.wikipedia.org/wiki/Magnet_URI_scheme">Magnet URI scheme</a>
 */
@ThreadSafe
public final class MagnetLink {
	@NonNull
	private final Uri uri;
	@NonNull
	private final QueryFormat queryFormat;
	@NonNull
	private final Charset charset;

	// Only MagnetLinkRule constructs instances, after validation
	MagnetLink(@NonNull Uri uri,
						 @NonNull QueryFormat queryFormat,
						 @NonNull Charset charset) {
		this.uri = requireNonNull(uri);
		this.queryFormat = requireNonNull(queryFormat);
		this.charset = requireNonNull(charset);
	}

	/**
	 * URNs naming the file or files, from the {@code xt} or {@code xt.1}, {@code xt.2}, ... parameters.
	 * <p>
	 * The exact topic is the only mandatory field of a magnet link.
	 *
	 * @return a view of all exact topic URIs, in order; never empty
	 */
	@NonNull
	public FilteredView<QueryParameter, Uri> getExactTopics() {
		return FilteredView.of(getQueryParameters(), MagnetLinkFields.isExactTopic(), MagnetLinkFields.toUri());
	}

	/**
	 * The info hash of each exact topic, e.g. {@code d2474e86c95b19b8bcfdb92bc12c9d44667cfa36} for {@code xt=urn:btih:d2474e86c95b19b8bcfdb92bc12c9d44667cfa36}.
	 *
	 * @return a view of all info hashes, in exact topic order
	 */
	@NonNull
	public FilteredView<QueryParameter, String> getInfoHashes() {
		return FilteredView.of(getQueryParameters(), MagnetLinkFields.isExactTopic(), MagnetLinkFields.toInfoHash());
	}

	/**
	 * The protocol of each exact topic, e.g. {@code btih} for {@code xt=urn:btih:d2474e86c95b19b8bcfdb92bc12c9d44667cfa36}.
	 *
	 * @return a view of all protocols, in exact topic order
	 */
	@NonNull
	public FilteredView<QueryParameter, String> getProtocols() {
		return FilteredView.of(getQueryParameters(), MagnetLinkFields.isExactTopic(), MagnetLinkFields.toProtocol());
	}

	/**
	 * Tracker URLs ({@code tr}) used to obtain resources for BitTorrent downloads.
	 *
	 * @param buffer scratch buffer for decoding each URL
	 * @return a view of the decoded tracker URLs that are valid URIs
	 */
	@NonNull
	public FilteredView<QueryParameter, String> getAddressTrackers(@NonNull StringBuilder buffer) {
		requireNonNull(buffer);
		return urisWithKey("tr", buffer);
	}

	/**
	 * Exact source URLs ({@code xs}): direct download links to the file.
	 *
	 * @param buffer scratch buffer for decoding each URL
	 * @return a view of the decoded exact source URLs that are valid URIs
	 */
	@NonNull
	public FilteredView<QueryParameter, String> getExactSources(@NonNull StringBuilder buffer) {
		requireNonNull(buffer);
		return urisWithKey("xs", buffer);
	}

	/**
	 * Acceptable source URLs ({@code as}): direct download links usable as a fallback for exact sources.
	 *
	 * @param buffer scratch buffer for decoding each URL
	 * @return a view of the decoded acceptable source URLs that are valid URIs
	 */
	@NonNull
	public FilteredView<QueryParameter, String> getAcceptableSources(@NonNull StringBuilder buffer) {
		requireNonNull(buffer);
		return urisWithKey("as", buffer);
	}

	/**
	 * Manifest topics ({@code mt}): links to metafiles listing further magnet links.
	 *
	 * @param buffer scratch buffer for decoding each URL
	 * @return a view of the decoded manifest topic URLs that are valid URIs
	 * @see <a href="http://rakjar.de/gnuticles/MAGMA-Specsv22.txt">MAGnet MAnifest</a>
	 */
	@NonNull
	public FilteredView<QueryParameter, String> getManifestTopics(@NonNull StringBuilder buffer) {
		requireNonNull(buffer);
		return urisWithKey("mt", buffer);
	}

	/**
	 * Web seeds ({@code ws}): the payload data served over HTTP(S).
	 *
	 * @param buffer scratch buffer for decoding each URL
	 * @return a view of the decoded web seed URLs that are valid URIs
	 */
	@NonNull
	public FilteredView<QueryParameter, String> getWebSeeds(@NonNull StringBuilder buffer) {
		requireNonNull(buffer);
		return urisWithKey("ws", buffer);
	}

	/**
	 * Search keywords to use in P2P networks ({@code kt}), e.g. {@code kt=martin+luther+king+mp3}.
	 *
	 * @return the decoded keyword topic, or {@link Optional#empty()} if the first {@code kt} parameter is absent or has no value
	 */
	@NonNull
	public Optional<String> getKeywordTopic() {
		return decodedParameter("kt");
	}

	/**
	 * A filename to display to the user ({@code dn}); for convenience only.
	 *
	 * @return the decoded display name, or {@link Optional#empty()} if the first {@code dn} parameter is absent or has no value
	 */
	@NonNull
	public Optional<String> getDisplayName() {
		return decodedParameter("dn");
	}

	/**
	 * An informal extension parameter: query keys prefixed with {@code x.} are reserved for these and will never be standardized.
	 * <p>
	 * For example, {@code getParameter("custom")} returns {@code value123} for {@code x.custom=value123}.
	 *
	 * @param name the parameter name without its {@code x.} prefix
	 * @return the decoded value of the first matching parameter, or {@link Optional#empty()} if there is none
	 */
	@NonNull
	public Optional<String> getParameter(@NonNull String name) {
		requireNonNull(name);

		return FilteredView.filtering(getQueryParameters(), MagnetLinkFields.isExtensionParameter(name))
				.first()
				.flatMap(QueryParameter::getDecodedValue);
	}

	/**
	 * The general-syntax URI this magnet link was parsed from.
	 *
	 * @return the URI
	 */
	@NonNull
	public Uri getUri() {
		return this.uri;
	}

	/**
	 * All of this link's query parameters, including ones without magnet-specific meaning.
	 *
	 * @return the query parameters, in order
	 */
	@NonNull
	public QueryParameters getQueryParameters() {
		return getUri().getQueryParameters(getQueryFormat(), getCharset());
	}

	@NonNull
	public QueryFormat getQueryFormat() {
		return this.queryFormat;
	}

	@NonNull
	public Charset getCharset() {
		return this.charset;
	}

	@NonNull
	private FilteredView<QueryParameter, String> urisWithKey(@NonNull String key,
																													 @NonNull StringBuilder buffer) {
		return FilteredView.of(getQueryParameters(), MagnetLinkFields.isUriWithKey(key, buffer), MagnetLinkFields.toDecodedValue(buffer));
	}

	@NonNull
	private Optional<String> decodedParameter(@NonNull String key) {
		QueryParameter queryParameter = getQueryParameters().findFirst(key);

		if (queryParameter == null)
			return Optional.empty();

		return queryParameter.getDecodedValue();
	}

	/**
	 * The link text exactly as parsed.
	 */
	@Override
	@NonNull
	public String toString() {
		return getUri().toString();
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof MagnetLink magnetLink))
			return false;

		return Objects.equals(getUri(), magnetLink.getUri())
				&& Objects.equals(getQueryFormat(), magnetLink.getQueryFormat())
				&& Objects.equals(getCharset(), magnetLink.getCharset());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getUri(), getQueryFormat(), getCharset());
	}
}
