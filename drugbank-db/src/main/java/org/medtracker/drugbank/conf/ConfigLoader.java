package org.medtracker.drugbank.conf;

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

import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.medtracker.drugbank.util.Logger;

/**
 * Loads configuration for the DrugBank store from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/drugbank.properties</code> from the
 * classpath. You can override this by setting the system property
 * <code>medtracker.config</code> to an absolute path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>Numeric settings fall back to their defaults when blank, unparseable or
 * not positive; the fallback is logged.</li>
 * <li>Use {@link #validate()} during startup to check for missing required
 * keys.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/drugbank.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "medtracker.config";

	// ---- Property keys -------------------------------------------------------
	private static final String K_DRUGBANK_XML_PATH = "DRUGBANK_XML_PATH";
	private static final String K_STORE_PATH = "STORE_PATH";
	private static final String K_DB_USER = "DB_USER";
	private static final String K_DB_PASS = "DB_PASS";

	private static final String K_BUILD_BATCH_SIZE = "BUILD_BATCH_SIZE";
	private static final String K_BUILD_PROGRESS_INTERVAL = "BUILD_PROGRESS_INTERVAL";

	private static final String K_ALIAS_FILE = "ALIAS_FILE";
	private static final String K_RESOLVE_MIN_PARTIAL_LENGTH = "RESOLVE_MIN_PARTIAL_LENGTH";

	private static final String K_CACHE_RESPONSE_TTL = "CACHE_RESPONSE_TTL_SECONDS";
	private static final String K_CACHE_DRUG_TTL = "CACHE_DRUG_TTL_SECONDS";
	private static final String K_CACHE_PAIR_TTL = "CACHE_PAIR_TTL_SECONDS";
	private static final String K_CACHE_MAX_ENTRIES = "CACHE_MAX_ENTRIES";

	// ---- Defaults ------------------------------------------------------------
	public static final int DEFAULT_BATCH_SIZE = 5_000;
	public static final int DEFAULT_PROGRESS_INTERVAL = 1_000;
	public static final int DEFAULT_MIN_PARTIAL_LENGTH = 3;
	public static final Duration DEFAULT_RESPONSE_TTL = Duration.ofMinutes(15);
	public static final Duration DEFAULT_DRUG_TTL = Duration.ofDays(7);
	public static final Duration DEFAULT_PAIR_TTL = Duration.ofDays(7);
	public static final int DEFAULT_CACHE_MAX_ENTRIES = 10_000;

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			} else {
				Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
			}
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	/**
	 * Create a loader over in-memory properties (tests and embedding callers).
	 */
	public ConfigLoader(Properties props) {
		if (props != null) {
			properties.putAll(props);
		}
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Validates presence of keys that the init command requires. This does not
	 * fail; it returns a list of human-readable issues so the caller can decide
	 * how to proceed.
	 *
	 * @return list of error strings; empty if all required keys look OK
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		requireNonBlank(K_DRUGBANK_XML_PATH, issues);
		requireNonBlank(K_STORE_PATH, issues);

		requirePositiveIfSet(K_BUILD_BATCH_SIZE, issues);
		requirePositiveIfSet(K_BUILD_PROGRESS_INTERVAL, issues);
		requirePositiveIfSet(K_RESOLVE_MIN_PARTIAL_LENGTH, issues);
		requirePositiveIfSet(K_CACHE_RESPONSE_TTL, issues);
		requirePositiveIfSet(K_CACHE_DRUG_TTL, issues);
		requirePositiveIfSet(K_CACHE_PAIR_TTL, issues);
		requirePositiveIfSet(K_CACHE_MAX_ENTRIES, issues);

		String alias = getOptional(K_ALIAS_FILE, null);
		if (alias != null && !Files.isReadable(Path.of(alias))) {
			issues.add("ALIAS_FILE is not readable: " + alias);
		}

		String store = getOptional(K_STORE_PATH, null);
		if (store != null && store.endsWith(".mv.db")) {
			issues.add("STORE_PATH must not include the '.mv.db' suffix: " + store);
		}
		return issues;
	}

	/** Path to the DrugBank {@code full_database.xml} export. */
	public Path getDrugBankXmlPath() {
		return Path.of(getRequired(K_DRUGBANK_XML_PATH));
	}

	/** Store location (H2 file prefix, without the {@code .mv.db} suffix). */
	public Path getStorePath() {
		return Path.of(getRequired(K_STORE_PATH));
	}

	/** Database username; the embedded store defaults to {@code sa}. */
	public String getDbUser() {
		return getOptional(K_DB_USER, "sa");
	}

	/** Database password; blank by default. */
	public String getDbPass() {
		String v = properties.getProperty(K_DB_PASS);
		return v == null ? "" : v.trim();
	}

	/** Number of drugs written per committed batch. */
	public int getBuildBatchSize() {
		return getPositiveInt(K_BUILD_BATCH_SIZE, DEFAULT_BATCH_SIZE);
	}

	/** Emit a progress line every N drugs. */
	public int getBuildProgressInterval() {
		return getPositiveInt(K_BUILD_PROGRESS_INTERVAL, DEFAULT_PROGRESS_INTERVAL);
	}

	/** Optional: alias CSV on disk that replaces the bundled table. */
	public Path getAliasFile() {
		String v = getOptional(K_ALIAS_FILE, null);
		return v == null ? null : Path.of(v);
	}

	/** Shortest input accepted by the partial-match resolution step. */
	public int getResolveMinPartialLength() {
		return getPositiveInt(K_RESOLVE_MIN_PARTIAL_LENGTH, DEFAULT_MIN_PARTIAL_LENGTH);
	}

	public Duration getCacheResponseTtl() {
		return getSeconds(K_CACHE_RESPONSE_TTL, DEFAULT_RESPONSE_TTL);
	}

	public Duration getCacheDrugTtl() {
		return getSeconds(K_CACHE_DRUG_TTL, DEFAULT_DRUG_TTL);
	}

	public Duration getCachePairTtl() {
		return getSeconds(K_CACHE_PAIR_TTL, DEFAULT_PAIR_TTL);
	}

	/** Upper bound on entries held by each cache tier. */
	public int getCacheMaxEntries() {
		return getPositiveInt(K_CACHE_MAX_ENTRIES, DEFAULT_CACHE_MAX_ENTRIES);
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = new FileInputStream(file.toFile())) {
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null || v.isBlank()) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private int getPositiveInt(String key, int defaultVal) {
		Integer val = parsePositive(key);
		return val != null ? val : defaultVal;
	}

	private Duration getSeconds(String key, Duration defaultVal) {
		Integer secs = parsePositive(key);
		return secs != null ? Duration.ofSeconds(secs) : defaultVal;
	}

	/** Positive integer value of {@code key}, or null (logged) when absent or invalid. */
	private Integer parsePositive(String key) {
		String raw = getOptional(key, null);
		if (raw == null)
			return null;
		try {
			int val = Integer.parseInt(raw);
			if (val > 0)
				return val;
			Logger.warn("Non-positive value for {}: '{}'. Using default", key, raw);
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default", key, raw);
		}
		return null;
	}

	private void requireNonBlank(String key, List<String> issues) {
		String v = properties.getProperty(key);
		if (v == null || v.trim().isEmpty()) {
			issues.add("Missing required property: " + key);
		}
	}

	private void requirePositiveIfSet(String key, List<String> issues) {
		String v = getOptional(key, null);
		if (v == null)
			return;
		try {
			if (Integer.parseInt(v) <= 0) {
				issues.add(key + " must be a positive integer: " + v);
			}
		} catch (NumberFormatException nfe) {
			issues.add(key + " must be a positive integer: " + v);
		}
	}
}
