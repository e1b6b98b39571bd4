package org.macroingest.collector;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable content fingerprints used for deduplication.
 */
public final class Fingerprints {

	private Fingerprints() {
	}

	/**
	 * SHA-256 of {@code namespace + "|" + identity} as lower-case hex. The namespace is
	 * the source tag so that identical identities from different sources never collide.
	 * @param namespace the source tag
	 * @param identity canonical identity, typically the document URL
	 * @return 64 character hex digest
	 */
	public static String of(String namespace, String identity) {
		return sha256(namespace + "|" + identity);
	}

	public static String sha256(String text) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}

}
