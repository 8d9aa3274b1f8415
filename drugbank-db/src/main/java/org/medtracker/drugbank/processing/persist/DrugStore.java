package org.medtracker.drugbank.processing.persist;

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
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.time.Duration;
import java.util.Objects;

import org.medtracker.drugbank.conf.ConfigLoader;
import org.medtracker.drugbank.om.StoreStatus;
import org.medtracker.drugbank.util.Db;
import org.medtracker.drugbank.util.Logger;

/**
 * Location of an embedded H2 drug store and the way to connect to it.
 *
 * <p>The location is a file prefix: H2 keeps the data in
 * {@code <location>.mv.db}. The store builder writes to a sibling staging
 * store ({@code <location>.building}) and moves it into place when complete,
 * so the data file at the location is either absent or fully built.</p>
 */
public final class DrugStore {

	public static final String H2_DRIVER = "org.h2.Driver";

	static final String DATA_SUFFIX = ".mv.db";
	static final String TRACE_SUFFIX = ".trace.db";
	static final String STAGING_SUFFIX = ".building";
	static final String LOCK_SUFFIX = ".build.lock";

	private static final int CONNECT_RETRIES = 1;
	private static final Duration CONNECT_BACKOFF = Duration.ofMillis(100);

	private final Path location;
	private final String user;
	private final String pass;

	public DrugStore(Path location, String user, String pass) {
		Objects.requireNonNull(location, "location must not be null");
		this.location = location.toAbsolutePath().normalize();
		this.user = user == null ? "sa" : user;
		this.pass = pass == null ? "" : pass;
	}

	public DrugStore(Path location) {
		this(location, "sa", "");
	}

	public static DrugStore fromConfig(ConfigLoader cfg) {
		return new DrugStore(cfg.getStorePath(), cfg.getDbUser(), cfg.getDbPass());
	}

	public Path getLocation() {
		return location;
	}

	public Path getDataFile() {
		return sibling(DATA_SUFFIX);
	}

	Path getLockFile() {
		return sibling(LOCK_SUFFIX);
	}

	/** Staging store next to this one, used while a build is running. */
	DrugStore staging() {
		return new DrugStore(sibling(STAGING_SUFFIX), user, pass);
	}

	public boolean exists() {
		return Files.isRegularFile(getDataFile());
	}

	/** Opens an existing store; fails rather than creating an empty database. */
	public Connection openExisting() {
		return Db.getConnection(jdbcUrl(true), user, pass, H2_DRIVER, CONNECT_RETRIES, CONNECT_BACKOFF);
	}

	Connection openOrCreate() throws IOException {
		Path parent = location.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		return Db.getConnection(jdbcUrl(false), user, pass, H2_DRIVER, 0, CONNECT_BACKOFF);
	}

	String jdbcUrl(boolean mustExist) {
		return "jdbc:h2:file:" + location
				+ (mustExist ? ";IFEXISTS=TRUE" : "")
				+ ";TRACE_LEVEL_FILE=0";
	}

	/**
	 * Current state of the store. Never throws: a missing or schema-less store
	 * is reported as not initialized, and a data file that exists but cannot be
	 * opened is reported as {@linkplain StoreStatus#isUnreadable() unreadable}.
	 */
	public StoreStatus status() {
		if (!exists()) {
			return StoreStatus.notInitialized(location);
		}
		try (Connection conn = openExisting()) {
			if (!StoreSchema.isPresent(conn)) {
				return StoreStatus.notInitialized(location);
			}
			return StoreStatus.ready(location,
					count(conn, "drugs"),
					count(conn, "drug_interactions"),
					count(conn, "food_interactions"));
		} catch (Exception e) {
			Logger.warn("Unable to read DrugBank store at {}: {}", location, e.getMessage());
			return StoreStatus.unreadable(location, e.getMessage());
		}
	}

	/** True when the store exists and holds at least one drug. */
	public boolean hasData() {
		StoreStatus s = status();
		return s.isInitialized() && s.getDrugCount() > 0;
	}

	static long count(Connection conn, String table) throws Exception {
		return Db.querySingle(conn, "SELECT COUNT(*) FROM " + table, null, rs -> rs.getLong(1)).orElse(0L);
	}

	/** Remove the data and trace files of this store, if present. */
	void deleteFiles() throws IOException {
		Files.deleteIfExists(getDataFile());
		Files.deleteIfExists(sibling(TRACE_SUFFIX));
	}

	private Path sibling(String suffix) {
		return Paths.get(location.toString() + suffix);
	}

	@Override
	public String toString() {
		return "DrugStore[" + location + "]";
	}
}
