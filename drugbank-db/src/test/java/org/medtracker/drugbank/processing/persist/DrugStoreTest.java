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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.medtracker.drugbank.conf.ConfigLoader;
import org.medtracker.drugbank.om.DrugRecord;
import org.medtracker.drugbank.om.StoreStatus;
import org.medtracker.drugbank.util.Db;

class DrugStoreTest {

	@TempDir
	Path tmp;

	@Test
	@DisplayName("File layout derives from the location prefix")
	void fileLayout() {
		DrugStore store = new DrugStore(tmp.resolve("sub/../drugbank"));

		assertEquals(tmp.resolve("drugbank").toAbsolutePath(), store.getLocation());
		assertEquals(tmp.resolve("drugbank.mv.db").toAbsolutePath(), store.getDataFile());
		assertEquals(tmp.resolve("drugbank.build.lock").toAbsolutePath(), store.getLockFile());
		assertEquals(tmp.resolve("drugbank.building").toAbsolutePath(), store.staging().getLocation());
		assertTrue(store.jdbcUrl(true).contains(";IFEXISTS=TRUE"));
		assertFalse(store.jdbcUrl(false).contains("IFEXISTS"));
	}

	@Test
	@DisplayName("Missing store reports not initialized and refuses to open")
	void missingStore() {
		DrugStore store = new DrugStore(tmp.resolve("drugbank"));

		StoreStatus s = store.status();

		assertFalse(s.isInitialized());
		assertFalse(s.isUnreadable());
		assertEquals(0, s.getDrugCount());
		assertFalse(store.hasData());
		assertThrows(IllegalStateException.class, store::openExisting);
		assertFalse(store.exists(), "opening must not create an empty database");
	}

	@Test
	@DisplayName("Database without the schema is not initialized")
	void emptyDatabase() throws Exception {
		DrugStore store = new DrugStore(tmp.resolve("drugbank"));
		try (Connection c = store.openOrCreate()) {
			Db.execute(c, "CREATE TABLE unrelated (x INT)", null);
		}

		assertTrue(store.exists());
		assertFalse(store.status().isInitialized());
		assertFalse(store.status().isUnreadable());
	}

	@Test
	@DisplayName("Status reports row counts of a built store")
	void builtStore() {
		DrugRecord r = new DrugRecord();
		r.setId("DB1");
		r.setName("One");
		r.addFoodInteraction("Take with food.");
		DrugStore store = new DrugStore(tmp.resolve("drugbank"));
		new StoreBuilder(store, 10, 10).build(List.of(r).iterator(), false);

		StoreStatus s = store.status();

		assertTrue(s.isInitialized());
		assertEquals(StoreStatus.ready(store.getLocation(), 1, 0, 1), s);
		assertFalse(s.isUnreadable());
		assertTrue(store.hasData());
	}

	@Test
	void fromConfig() {
		Properties p = new Properties();
		p.setProperty("STORE_PATH", tmp.resolve("cfgstore").toString());
		DrugStore store = DrugStore.fromConfig(new ConfigLoader(p));
		assertEquals(tmp.resolve("cfgstore").toAbsolutePath(), store.getLocation());
	}
}
