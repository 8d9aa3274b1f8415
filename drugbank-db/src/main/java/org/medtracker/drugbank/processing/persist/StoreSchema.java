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

import java.sql.Connection;

import org.medtracker.drugbank.util.Db;

/**
 * DDL for the drug store. Tables are created before loading; indexes after,
 * so the bulk insert does not maintain them row by row.
 *
 * <p>No foreign keys: interaction rows may point at drugs that are not part of
 * the loaded set, and are matched by {@code interacting_drug_name} instead.</p>
 */
public final class StoreSchema {

	private StoreSchema() {
	}

	static final String DDL_DRUGS =
			"CREATE TABLE IF NOT EXISTS drugs ("
			+ " id VARCHAR(64) PRIMARY KEY,"
			+ " name VARCHAR NOT NULL,"
			+ " name_lower VARCHAR NOT NULL,"
			+ " description CLOB,"
			+ " indication CLOB,"
			+ " mechanism_of_action CLOB,"
			+ " toxicity CLOB"
			+ ")";

	static final String DDL_DRUG_INTERACTIONS =
			"CREATE TABLE IF NOT EXISTS drug_interactions ("
			+ " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
			+ " drug_id VARCHAR(64) NOT NULL,"
			+ " interacting_drug_id VARCHAR(64),"
			+ " interacting_drug_name VARCHAR NOT NULL,"
			+ " description VARCHAR"
			+ ")";

	static final String DDL_FOOD_INTERACTIONS =
			"CREATE TABLE IF NOT EXISTS food_interactions ("
			+ " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
			+ " drug_id VARCHAR(64) NOT NULL,"
			+ " description VARCHAR NOT NULL"
			+ ")";

	static final String[] INDEXES = {
			"CREATE INDEX IF NOT EXISTS idx_drugs_name ON drugs(name)",
			"CREATE INDEX IF NOT EXISTS idx_drugs_name_lower ON drugs(name_lower)",
			"CREATE INDEX IF NOT EXISTS idx_drug_interactions_drug_id ON drug_interactions(drug_id)",
			"CREATE INDEX IF NOT EXISTS idx_drug_interactions_interacting_id ON drug_interactions(interacting_drug_id)",
			"CREATE INDEX IF NOT EXISTS idx_food_interactions_drug_id ON food_interactions(drug_id)"
	};

	public static void createTables(Connection conn) throws Exception {
		Db.execute(conn, DDL_DRUGS, null);
		Db.execute(conn, DDL_DRUG_INTERACTIONS, null);
		Db.execute(conn, DDL_FOOD_INTERACTIONS, null);
	}

	public static void createIndexes(Connection conn) throws Exception {
		for (String ddl : INDEXES) {
			Db.execute(conn, ddl, null);
		}
	}

	/** True when all three tables exist. */
	public static boolean isPresent(Connection conn) throws Exception {
		Long tables = Db.querySingle(conn,
				"SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES"
				+ " WHERE TABLE_SCHEMA = 'PUBLIC'"
				+ " AND TABLE_NAME IN ('DRUGS', 'DRUG_INTERACTIONS', 'FOOD_INTERACTIONS')",
				null, rs -> rs.getLong(1)).orElse(0L);
		return tables == 3;
	}
}
