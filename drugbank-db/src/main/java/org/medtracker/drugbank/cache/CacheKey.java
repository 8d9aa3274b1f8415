package org.medtracker.drugbank.cache;

/*
 * This file is part of MedTracker.
 *
 * Copyright (C) 2025 The MedTracker Authors
 *
 * MedTracker is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * MedTracker is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with MedTracker.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

import lombok.Value;

/**
 * Cache key: the tier plus a normalized fingerprint.
 * <p>
 * Text is trimmed, lower-cased and has runs of whitespace collapsed before it
 * is fingerprinted, so "Aspirin  and Warfarin" and "aspirin and warfarin" map
 * to the same key. Pair keys sort the two names first.
 */
@Value
public class CacheKey {

	CacheTier tier;
	String fingerprint;

	/** Key for a full response to the given request text. */
	public static CacheKey request(String text) {
		return new CacheKey(CacheTier.RESPONSE, sha256(normalize(text)));
	}

	/** Key for a single drug. */
	public static CacheKey drug(String name) {
		return new CacheKey(CacheTier.DRUG, normalize(name));
	}

	/** Key for a drug pair; {@code pair(a, b)} equals {@code pair(b, a)}. */
	public static CacheKey pair(String drugA, String drugB) {
		String a = normalize(drugA);
		String b = normalize(drugB);
		String joined = a.compareTo(b) <= 0 ? a + '\u0000' + b : b + '\u0000' + a;
		return new CacheKey(CacheTier.PAIR, sha256(joined));
	}

	static String normalize(String text) {
		return StringUtils.normalizeSpace(text == null ? "" : text).toLowerCase(Locale.ROOT);
	}

	private static String sha256(String s) {
		try {
			MessageDigest md = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}
}
