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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.apache.commons.lang3.StringUtils;
import org.medtracker.drugbank.conf.ConfigLoader;
import org.medtracker.drugbank.error.DrugBankException;
import org.medtracker.drugbank.error.StoreNotInitializedException;
import org.medtracker.drugbank.om.Drug;
import org.medtracker.drugbank.om.DrugSummary;
import org.medtracker.drugbank.om.InteractionView;
import org.medtracker.drugbank.om.StoreStatus;
import org.medtracker.drugbank.processing.persist.DrugStore;
import org.medtracker.drugbank.processing.persist.StoreSchema;
import org.medtracker.drugbank.util.Db;
import org.medtracker.drugbank.util.Logger;

/**
 * Read-only queries over a built drug store.
 *
 * <p>Every call opens its own connection, so one engine can serve concurrent
 * callers. The engine keeps one idle connection open for its lifetime so the
 * embedded database is not reopened on every call; {@link #close()} releases
 * it. After a forced rebuild of the same location, close the engine and create
 * a new one.</p>
 *
 * <p>Names that cannot be resolved produce empty results. Querying a location
 * that was never built raises {@link StoreNotInitializedException}.</p>
 */
public class DrugQueryEngine implements AutoCloseable {

	private static final String SQL_SEARCH =
			"SELECT id, name FROM drugs WHERE name_lower LIKE ? ESCAPE '\\' ORDER BY name_lower, id";
	private static final String SQL_BY_ID =
			"SELECT " + NameResolver.DRUG_COLUMNS + " FROM drugs WHERE id = ?";
	private static final String SQL_PAIR_EDGES =
			"SELECT i.interacting_drug_id, i.interacting_drug_name, i.description"
			+ " FROM drug_interactions i"
			+ " WHERE i.drug_id = ?"
			+ " AND (i.interacting_drug_id = ? OR (i.interacting_drug_id IS NULL AND LOWER(i.interacting_drug_name) = ?))"
			+ " ORDER BY i.id";
	private static final String SQL_EDGES_FROM =
			"SELECT i.interacting_drug_id, i.interacting_drug_name, i.description"
			+ " FROM drug_interactions i WHERE i.drug_id = ? ORDER BY i.id";
	private static final String SQL_EDGES_TO =
			"SELECT d.id, d.name, i.description"
			+ " FROM drug_interactions i JOIN drugs d ON d.id = i.drug_id"
			+ " WHERE i.interacting_drug_id = ? AND i.drug_id <> ? ORDER BY i.id";
	private static final String SQL_FOOD =
			"SELECT description FROM food_interactions WHERE drug_id = ? ORDER BY id";

	@FunctionalInterface
	private interface ReadWork<T> {
		T apply(Connection conn) throws Exception;
	}

	private final DrugStore store;
	private final NameResolver resolver;

	private Connection anchor;
	private volatile boolean schemaChecked;

	public DrugQueryEngine(DrugStore store, NameResolver resolver) {
		if (store == null || resolver == null) {
			throw new IllegalArgumentException("store and resolver must not be null");
		}
		this.store = store;
		this.resolver = resolver;
	}

	public static DrugQueryEngine fromConfig(ConfigLoader cfg) {
		return new DrugQueryEngine(DrugStore.fromConfig(cfg), NameResolver.fromConfig(cfg));
	}

	// -------------------------- Queries ----------------------------------------

	/** Drugs whose name, or one of whose aliases, contains {@code term}. */
	public List<DrugSummary> search(String term) {
		return search(term, 0);
	}

	/**
	 * Same as {@link #search(String)}, capped at {@code limit} results when
	 * {@code limit > 0}.
	 */
	public List<DrugSummary> search(String term, int limit) {
		final String needle = NameResolver.normalize(term);
		if (needle == null) {
			return Collections.emptyList();
		}
		return read("search", conn -> {
			String sql = limit > 0 ? SQL_SEARCH + " LIMIT " + limit : SQL_SEARCH;
			Map<String, DrugSummary> hits = new LinkedHashMap<>();
			for (DrugSummary s : Db.runQuery(conn, sql,
					ps -> ps.setString(1, NameResolver.containsPattern(needle)),
					rs -> new DrugSummary(rs.getString(1), rs.getString(2)))) {
				hits.put(s.getId(), s);
			}

			for (String target : resolver.getAliases().targetsOfAliasesContaining(needle)) {
				if (limit > 0 && hits.size() >= limit) {
					break;
				}
				resolver.exact(conn, target).ifPresent(d -> hits.putIfAbsent(d.getId(), d.toSummary()));
			}
			return new ArrayList<>(hits.values());
		});
	}

	public Optional<Drug> getDetails(String name) {
		if (StringUtils.isBlank(name)) {
			return Optional.empty();
		}
		return read("getDetails", conn -> resolver.resolve(conn, name));
	}

	public Optional<Drug> getDrugById(String drugbankId) {
		final String id = StringUtils.trimToNull(drugbankId);
		if (id == null) {
			return Optional.empty();
		}
		return read("getDrugById",
				conn -> Db.querySingle(conn, SQL_BY_ID, ps -> ps.setString(1, id), NameResolver::mapDrug));
	}

	/**
	 * Interactions among every pair of the named drugs.
	 * <p>
	 * Unresolvable names are dropped and names resolving to the same drug count
	 * once. For each pair the edges authored from the lower id to the higher id
	 * are returned, or the opposite direction when there are none, so the result
	 * does not depend on the order of {@code names}.
	 */
	public List<InteractionView> getInteractions(Collection<String> names) {
		if (names == null || names.size() < 2) {
			return Collections.emptyList();
		}
		return read("getInteractions", conn -> {
			// sorted by id
			TreeMap<String, Drug> resolved = new TreeMap<>();
			for (String n : names) {
				resolver.resolve(conn, n).ifPresent(d -> resolved.putIfAbsent(d.getId(), d));
			}
			List<Drug> drugs = new ArrayList<>(resolved.values());
			List<InteractionView> out = new ArrayList<>();
			for (int i = 0; i < drugs.size(); i++) {
				for (int j = i + 1; j < drugs.size(); j++) {
					Drug a = drugs.get(i);
					Drug b = drugs.get(j);
					List<InteractionView> edges = pairEdges(conn, a, b);
					if (edges.isEmpty()) {
						edges = pairEdges(conn, b, a);
					}
					out.addAll(edges);
				}
			}
			Logger.debug("getInteractions: {} names, {} resolved, {} interactions", names.size(), drugs.size(),
					out.size());
			return out;
		});
	}

	/**
	 * Every interaction involving one drug, in either direction, seen from that
	 * drug. A counterpart that appears in both directions is listed once, with
	 * the edge authored on the requested drug.
	 */
	public List<InteractionView> getInteractionsFor(String name) {
		if (StringUtils.isBlank(name)) {
			return Collections.emptyList();
		}
		return read("getInteractionsFor", conn -> {
			Optional<Drug> found = resolver.resolve(conn, name);
			if (found.isEmpty()) {
				return Collections.<InteractionView>emptyList();
			}
			Drug drug = found.get();
			List<InteractionView> out = new ArrayList<>(Db.runQuery(conn, SQL_EDGES_FROM,
					ps -> ps.setString(1, drug.getId()),
					rs -> new InteractionView(drug.getId(), drug.getName(), rs.getString(1), rs.getString(2),
							rs.getString(3))));

			Set<String> counterparts = new LinkedHashSet<>();
			for (InteractionView v : out) {
				if (v.getInteractingDrugId() != null) {
					counterparts.add(v.getInteractingDrugId());
				}
			}
			for (InteractionView v : Db.runQuery(conn, SQL_EDGES_TO,
					ps -> {
						ps.setString(1, drug.getId());
						ps.setString(2, drug.getId());
					},
					rs -> new InteractionView(drug.getId(), drug.getName(), rs.getString(1), rs.getString(2),
							rs.getString(3)))) {
				if (counterparts.add(v.getInteractingDrugId())) {
					out.add(v);
				}
			}
			return out;
		});
	}

	/** Food interaction texts in source order; empty when none or unresolved. */
	public List<String> getFoodInteractions(String name) {
		if (StringUtils.isBlank(name)) {
			return Collections.emptyList();
		}
		return read("getFoodInteractions", conn -> {
			Optional<Drug> drug = resolver.resolve(conn, name);
			if (drug.isEmpty()) {
				return Collections.<String>emptyList();
			}
			return Db.runQuery(conn, SQL_FOOD, ps -> ps.setString(1, drug.get().getId()), rs -> rs.getString(1));
		});
	}

	/** Never throws; an unbuilt store reports {@code initialized=false}. */
	public StoreStatus status() {
		return store.status();
	}

	public DrugStore getStore() {
		return store;
	}

	// -------------------------- Internals --------------------------------------

	private List<InteractionView> pairEdges(Connection conn, Drug from, Drug to) throws Exception {
		return Db.runQuery(conn, SQL_PAIR_EDGES,
				ps -> {
					ps.setString(1, from.getId());
					ps.setString(2, to.getId());
					ps.setString(3, NameResolver.normalize(to.getName()));
				},
				rs -> {
					String interactingId = rs.getString(1);
					return new InteractionView(from.getId(), from.getName(),
							interactingId != null ? interactingId : to.getId(),
							rs.getString(2), rs.getString(3));
				});
	}

	private <T> T read(String operation, ReadWork<T> work) {
		if (!store.exists()) {
			throw new StoreNotInitializedException(store.getLocation());
		}
		try {
			holdOpen();
			try (Connection conn = store.openExisting()) {
				conn.setReadOnly(true);
				if (!schemaChecked) {
					if (!StoreSchema.isPresent(conn)) {
						throw new StoreNotInitializedException(store.getLocation());
					}
					schemaChecked = true;
				}
				return work.apply(conn);
			}
		} catch (DrugBankException e) {
			throw e;
		} catch (Exception e) {
			throw new DrugBankException(operation + " failed on " + store.getLocation() + ": " + e.getMessage(), e);
		}
	}

	private synchronized void holdOpen() {
		if (anchor == null) {
			anchor = store.openExisting();
			Logger.debug("Opened DrugBank store {}", store.getLocation());
		}
	}

	@Override
	public synchronized void close() {
		if (anchor == null) {
			return;
		}
		try {
			anchor.close();
		} catch (SQLException e) {
			Logger.warn("Error closing DrugBank store {}: {}", store.getLocation(), e.getMessage());
		} finally {
			anchor = null;
		}
	}
}
