package org.medtracker.drugbank.query;

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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.medtracker.drugbank.conf.ConfigLoader;
import org.medtracker.drugbank.util.Logger;

/**
 * Brand names and common misspellings mapped to DrugBank generic names.
 *
 * <p>CSV with header {@code alias,target}; lines starting with {@code #} are
 * comments. An alias may appear on several rows (combination products map to
 * each of their ingredients). Aliases and targets are matched lower-cased.</p>
 */
public final class AliasTable {

	/** Bundled table on the classpath. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "aliases/drug_aliases.csv";

	private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
			.setHeader("alias", "target")
			.setSkipHeaderRecord(true)
			.setCommentMarker('#')
			.setIgnoreEmptyLines(true)
			.setIgnoreSurroundingSpaces(true)
			.build();

	private final Map<String, Set<String>> targetsByAlias;

	private AliasTable(Map<String, Set<String>> targetsByAlias) {
		this.targetsByAlias = targetsByAlias;
	}

	public static AliasTable empty() {
		return new AliasTable(Collections.emptyMap());
	}

	/** Table from explicit pairs; keys and values are normalized. */
	public static AliasTable of(Map<String, ? extends Iterable<String>> aliases) {
		Map<String, Set<String>> m = new LinkedHashMap<>();
		aliases.forEach((alias, targets) -> {
			for (String t : targets) {
				add(m, alias, t);
			}
		});
		return new AliasTable(m);
	}

	public static AliasTable load(Path csv) throws IOException {
		try (Reader r = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
			AliasTable t = parse(r);
			Logger.info("Loaded {} drug aliases from {}", t.size(), csv);
			return t;
		}
	}

	/** Bundled table; empty (with a warning) if the resource is missing. */
	public static AliasTable fromClasspath() {
		try (InputStream in = AliasTable.class.getClassLoader().getResourceAsStream(DEFAULT_CLASSPATH_RESOURCE)) {
			if (in == null) {
				Logger.warn("Alias table {} not found on classpath; alias resolution disabled",
						DEFAULT_CLASSPATH_RESOURCE);
				return empty();
			}
			return parse(new InputStreamReader(in, StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new IllegalStateException("Unable to read alias table " + DEFAULT_CLASSPATH_RESOURCE, e);
		}
	}

	/** The file named by {@code ALIAS_FILE}, else the bundled table. */
	public static AliasTable fromConfig(ConfigLoader cfg) {
		Path file = cfg.getAliasFile();
		if (file == null) {
			return fromClasspath();
		}
		try {
			return load(file);
		} catch (IOException e) {
			throw new IllegalStateException("Unable to read alias file " + file, e);
		}
	}

	static AliasTable parse(Reader reader) throws IOException {
		Map<String, Set<String>> m = new LinkedHashMap<>();
		try (CSVParser parser = FORMAT.parse(reader)) {
			for (CSVRecord rec : parser) {
				if (rec.size() < 2) {
					Logger.warn("Ignoring alias line {}: expected 'alias,target'", rec.getRecordNumber());
					continue;
				}
				add(m, rec.get(0), rec.get(1));
			}
		}
		return new AliasTable(m);
	}

	private static void add(Map<String, Set<String>> m, String alias, String target) {
		String a = normalize(alias);
		String t = normalize(target);
		if (a == null || t == null) {
			return;
		}
		m.computeIfAbsent(a, k -> new LinkedHashSet<>()).add(t);
	}

	static String normalize(String s) {
		String t = StringUtils.trimToNull(s);
		return t == null ? null : StringUtils.normalizeSpace(t).toLowerCase(Locale.ROOT);
	}

	/** Targets for an alias (any case), in file order; empty if unknown. */
	public Set<String> targetsFor(String alias) {
		String key = normalize(alias);
		if (key == null) {
			return Collections.emptySet();
		}
		Set<String> t = targetsByAlias.get(key);
		return t == null ? Collections.emptySet() : Collections.unmodifiableSet(t);
	}

	/** Targets of every alias whose text contains {@code term}, in file order. */
	public List<String> targetsOfAliasesContaining(String term) {
		String needle = normalize(term);
		List<String> out = new ArrayList<>();
		if (needle == null) {
			return out;
		}
		Set<String> seen = new LinkedHashSet<>();
		for (Map.Entry<String, Set<String>> e : targetsByAlias.entrySet()) {
			if (e.getKey().contains(needle)) {
				seen.addAll(e.getValue());
			}
		}
		out.addAll(seen);
		return out;
	}

	public int size() {
		return targetsByAlias.size();
	}
}
