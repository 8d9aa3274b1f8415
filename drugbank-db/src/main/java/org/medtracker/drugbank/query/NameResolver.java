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

import java.sql.Connection;
import java.sql.ResultSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.medtracker.drugbank.conf.ConfigLoader;
import org.medtracker.drugbank.om.Drug;
import org.medtracker.drugbank.util.Db;
import org.medtracker.drugbank.util.Logger;

/**
 * Turns a user-supplied drug name into at most one stored drug.
 *
 * <ol>
 * <li>Exact, case-insensitive name match. Rows sharing a name resolve to the
 * lowest id.</li>
 * <li>Alias table. Each target resolves by exact name, else by a unique
 * partial match; the alias counts only when its targets together give exactly
 * one drug. An alias reaching two or more drugs ends resolution unresolved.</li>
 * <li>Unique substring match on the name, for inputs of at least
 * {@code minPartialLength} characters.</li>
 * </ol>
 *
 * Anything ambiguous is unresolved. The resolver holds no connection; callers
 * pass the one they are using.
 */
public class NameResolver {

	static final String DRUG_COLUMNS = "id, name, description, indication, mechanism_of_action, toxicity";

	private static final String SQL_EXACT =
			"SELECT " + DRUG_COLUMNS + " FROM drugs WHERE name_lower = ? ORDER BY id";
	private static final String SQL_PARTIAL =
			"SELECT " + DRUG_COLUMNS + " FROM drugs WHERE name_lower LIKE ? ESCAPE '\\' ORDER BY name_lower, id LIMIT 2";

	private final AliasTable aliases;
	private final int minPartialLength;

	public NameResolver(AliasTable aliases, int minPartialLength) {
		if (minPartialLength <= 0) {
			throw new IllegalArgumentException("minPartialLength must be > 0");
		}
		this.aliases = aliases == null ? AliasTable.empty() : aliases;
		this.minPartialLength = minPartialLength;
	}

	public static NameResolver fromConfig(ConfigLoader cfg) {
		return new NameResolver(AliasTable.fromConfig(cfg), cfg.getResolveMinPartialLength());
	}

	public AliasTable getAliases() {
		return aliases;
	}

	public Optional<Drug> resolve(Connection conn, String name) throws Exception {
		String input = normalize(name);
		if (input == null) {
			return Optional.empty();
		}

		Optional<Drug> exact = exact(conn, input);
		if (exact.isPresent()) {
			return exact;
		}

		Set<String> targets = aliases.targetsFor(input);
		if (!targets.isEmpty()) {
			Map<String, Drug> viaAlias = aliasMatches(conn, targets);
			if (viaAlias.size() == 1) {
				return Optional.of(viaAlias.values().iterator().next());
			}
			if (viaAlias.size() > 1) {
				Logger.debug("Alias '{}' is ambiguous ({} drugs); leaving it unresolved", input, viaAlias.size());
				return Optional.empty();
			}
		}

		Optional<Drug> partial = uniquePartial(conn, input);
		if (partial.isEmpty()) {
			Logger.debug("Unresolved drug name '{}'", name);
		}
		return partial;
	}

	/** Stored drugs reached from the alias targets, by id. */
	private Map<String, Drug> aliasMatches(Connection conn, Set<String> targets) throws Exception {
		Map<String, Drug> found = new LinkedHashMap<>();
		for (String target : targets) {
			Optional<Drug> d = exact(conn, target);
			if (d.isEmpty()) {
				d = uniquePartial(conn, target);
			}
			d.ifPresent(drug -> found.putIfAbsent(drug.getId(), drug));
		}
		return found;
	}

	Optional<Drug> exact(Connection conn, String nameLower) throws Exception {
		return Db.querySingle(conn, SQL_EXACT, ps -> ps.setString(1, nameLower), NameResolver::mapDrug);
	}

	Optional<Drug> uniquePartial(Connection conn, String nameLower) throws Exception {
		if (nameLower.length() < minPartialLength) {
			return Optional.empty();
		}
		List<Drug> hits = Db.runQuery(conn, SQL_PARTIAL,
				ps -> ps.setString(1, containsPattern(nameLower)),
				NameResolver::mapDrug);
		return hits.size() == 1 ? Optional.of(hits.get(0)) : Optional.empty();
	}

	static String normalize(String name) {
		String t = StringUtils.trimToNull(name);
		return t == null ? null : StringUtils.normalizeSpace(t).toLowerCase(Locale.ROOT);
	}

	/** {@code %term%} with LIKE wildcards in the term escaped. */
	static String containsPattern(String term) {
		StringBuilder sb = new StringBuilder(term.length() + 4).append('%');
		for (int i = 0; i < term.length(); i++) {
			char c = term.charAt(i);
			if (c == '%' || c == '_' || c == '\\') {
				sb.append('\\');
			}
			sb.append(c);
		}
		return sb.append('%').toString();
	}

	static Drug mapDrug(ResultSet rs) throws Exception {
		return Drug.builder()
				.id(rs.getString("id"))
				.name(rs.getString("name"))
				.description(rs.getString("description"))
				.indication(rs.getString("indication"))
				.mechanismOfAction(rs.getString("mechanism_of_action"))
				.toxicity(rs.getString("toxicity"))
				.build();
	}
}
