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

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.Duration;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;

import org.medtracker.drugbank.conf.ConfigLoader;
import org.medtracker.drugbank.error.BuildInProgressException;
import org.medtracker.drugbank.error.BuildIncompleteException;
import org.medtracker.drugbank.error.DrugBankException;
import org.medtracker.drugbank.error.SourceUnavailableException;
import org.medtracker.drugbank.om.BuildResult;
import org.medtracker.drugbank.om.DrugRecord;
import org.medtracker.drugbank.om.InteractionEdge;
import org.medtracker.drugbank.om.StoreStatus;
import org.medtracker.drugbank.processing.extract.DrugBankXmlParser;
import org.medtracker.drugbank.util.Db;
import org.medtracker.drugbank.util.Logger;

/**
 * Materializes the parsed DrugBank record stream into the H2 drug store.
 *
 * <ul>
 * <li>Idempotent: an existing non-empty store is left alone unless
 * {@code force} is set, so this is safe to call on every process start. A
 * store file that exists but cannot be opened is never replaced without
 * {@code force}; the build fails instead.</li>
 * <li>Writes are JDBC batches committed every {@code batchSize} drugs.</li>
 * <li>The build goes to a staging store that replaces the target only after
 * the last commit and the index build. A failure deletes the staging store and
 * leaves the target as it was.</li>
 * <li>A file lock next to the store keeps a second builder out while one is
 * running.</li>
 * </ul>
 *
 * <p>Interaction edges are stored as authored, including edges whose
 * interacting drug is not (or not yet) in the store; the denormalized name
 * keeps them queryable without a second pass over the document.</p>
 */
public class StoreBuilder {

	private static final String SQL_MERGE_DRUG =
			"MERGE INTO drugs (id, name, name_lower, description, indication, mechanism_of_action, toxicity)"
			+ " KEY (id) VALUES (?, ?, ?, ?, ?, ?, ?)";
	private static final String SQL_INSERT_INTERACTION =
			"INSERT INTO drug_interactions (drug_id, interacting_drug_id, interacting_drug_name, description)"
			+ " VALUES (?, ?, ?, ?)";
	private static final String SQL_INSERT_FOOD =
			"INSERT INTO food_interactions (drug_id, description) VALUES (?, ?)";
	private static final String SQL_DELETE_INTERACTIONS = "DELETE FROM drug_interactions WHERE drug_id = ?";
	private static final String SQL_DELETE_FOOD = "DELETE FROM food_interactions WHERE drug_id = ?";

	private final DrugStore store;
	private final int batchSize;
	private final int progressInterval;
	private ProgressListener progressListener;

	public StoreBuilder(DrugStore store, int batchSize, int progressInterval) {
		if (store == null) {
			throw new IllegalArgumentException("store must not be null");
		}
		if (batchSize <= 0 || progressInterval <= 0) {
			throw new IllegalArgumentException("batchSize and progressInterval must be > 0");
		}
		this.store = store;
		this.batchSize = batchSize;
		this.progressInterval = progressInterval;
	}

	public static StoreBuilder fromConfig(ConfigLoader cfg) {
		return new StoreBuilder(DrugStore.fromConfig(cfg), cfg.getBuildBatchSize(), cfg.getBuildProgressInterval());
	}

	public StoreBuilder withProgressListener(ProgressListener listener) {
		this.progressListener = listener;
		return this;
	}

	public DrugStore getStore() {
		return store;
	}

	/**
	 * Build the store from a DrugBank XML file.
	 *
	 * @throws SourceUnavailableException if a build is needed and the file cannot be read
	 * @throws BuildIncompleteException   if writing fails, or the existing store
	 *                                    cannot be opened and {@code force} is off;
	 *                                    the target is untouched
	 * @throws BuildInProgressException   if another build holds the lock
	 */
	public BuildResult build(Path sourceXml, boolean force) {
		try (BuildLock lock = BuildLock.acquire(store.getLockFile())) {
			StoreStatus existing = store.status();
			if (keepExisting(existing, force)) {
				return BuildResult.noOp(existing);
			}
			if (sourceXml == null || !Files.isRegularFile(sourceXml)) {
				throw new SourceUnavailableException(sourceXml, "file not found");
			}
			if (!Files.isReadable(sourceXml)) {
				throw new SourceUnavailableException(sourceXml, "file not readable");
			}

			Logger.info("Building DrugBank store {} from {} ({} MB)", store.getLocation(), sourceXml,
					sizeInMb(sourceXml));

			try (InputStream in = new BufferedInputStream(Files.newInputStream(sourceXml), 1 << 16);
					DrugBankXmlParser parser = new DrugBankXmlParser(in)) {
				return write(parser);
			} catch (IOException e) {
				throw new SourceUnavailableException("Unable to read DrugBank source " + sourceXml + ": " + e.getMessage(), e);
			}
		}
	}

	/**
	 * Build the store from an already open record stream (normally a
	 * {@link DrugBankXmlParser}).
	 */
	public BuildResult build(Iterator<DrugRecord> records, boolean force) {
		try (BuildLock lock = BuildLock.acquire(store.getLockFile())) {
			StoreStatus existing = store.status();
			if (keepExisting(existing, force)) {
				return BuildResult.noOp(existing);
			}
			return write(records);
		}
	}

	private boolean keepExisting(StoreStatus existing, boolean force) {
		if (existing.isUnreadable()) {
			if (!force) {
				throw new BuildIncompleteException("DrugBank store at " + store.getLocation()
						+ " exists but cannot be opened, possibly because another process has it open ("
						+ existing.getUnreadableReason() + "); close it or rebuild with force", 0, null);
			}
			Logger.warn("Forced rebuild over unreadable DrugBank store at {}: {}", store.getLocation(),
					existing.getUnreadableReason());
			return false;
		}
		if (existing.isInitialized() && existing.getDrugCount() > 0) {
			if (!force) {
				Logger.info("DrugBank store already built at {} ({} drugs); nothing to do", store.getLocation(),
						existing.getDrugCount());
				return true;
			}
			Logger.info("Forced rebuild of DrugBank store at {}", store.getLocation());
		}
		return false;
	}

	// -------------------------- Write path -------------------------------------

	private BuildResult write(Iterator<DrugRecord> records) {
		final long startNs = System.nanoTime();
		final DrugStore staging = store.staging();
		int processed = 0;

		try {
			staging.deleteFiles();
			long interactions;
			long foods;
			int drugs;

			try (Connection conn = staging.openOrCreate()) {
				Db.withTransaction(conn, () -> StoreSchema.createTables(conn));
				conn.setAutoCommit(false);

				try (PreparedStatement drugPs = conn.prepareStatement(SQL_MERGE_DRUG);
						PreparedStatement ixPs = conn.prepareStatement(SQL_INSERT_INTERACTION);
						PreparedStatement foodPs = conn.prepareStatement(SQL_INSERT_FOOD)) {

					Set<String> seenIds = new HashSet<>();
					int pending = 0;

					while (records.hasNext()) {
						DrugRecord rec = records.next();

						if (!seenIds.add(rec.getId())) {
							// last occurrence wins: drop the child rows written for the earlier one
							flush(drugPs, ixPs, foodPs);
							Db.execute(conn, SQL_DELETE_INTERACTIONS, ps -> ps.setString(1, rec.getId()));
							Db.execute(conn, SQL_DELETE_FOOD, ps -> ps.setString(1, rec.getId()));
							Logger.warn("Duplicate drug id {} in source; keeping the later record", rec.getId());
						}

						addDrug(drugPs, ixPs, foodPs, rec);
						processed++;
						pending++;

						if (pending >= batchSize) {
							flush(drugPs, ixPs, foodPs);
							conn.commit();
							pending = 0;
						}
						if (processed % progressInterval == 0) {
							reportProgress(processed, startNs);
						}
					}
					flush(drugPs, ixPs, foodPs);
					conn.commit();
				}

				Logger.info("Loaded {} drugs; creating indexes...", processed);
				StoreSchema.createIndexes(conn);
				conn.commit();

				drugs = (int) DrugStore.count(conn, "drugs");
				interactions = DrugStore.count(conn, "drug_interactions");
				foods = DrugStore.count(conn, "food_interactions");

				Db.execute(conn, "SHUTDOWN", null);
			}

			promote(staging);

			int skippedRecords = (records instanceof DrugBankXmlParser)
					? ((DrugBankXmlParser) records).getSkippedCount()
					: 0;
			Duration elapsed = Duration.ofNanos(System.nanoTime() - startNs);

			Logger.info("DrugBank store ready at {}: {} drugs, {} drug interactions, {} food interactions,"
					+ " {} skipped records in {}s", store.getLocation(), drugs, interactions, foods, skippedRecords,
					elapsed.toSeconds());

			return BuildResult.builder()
					.skipped(false)
					.drugs(drugs)
					.interactions(interactions)
					.foodInteractions(foods)
					.skippedRecords(skippedRecords)
					.elapsed(elapsed)
					.build();

		} catch (DrugBankException e) {
			discard(staging);
			throw e;
		} catch (Exception e) {
			discard(staging);
			throw new BuildIncompleteException("DrugBank store build failed: " + e.getMessage(), processed, e);
		}
	}

	private static void addDrug(PreparedStatement drugPs, PreparedStatement ixPs, PreparedStatement foodPs,
			DrugRecord rec) throws Exception {
		drugPs.setString(1, rec.getId());
		drugPs.setString(2, rec.getName());
		drugPs.setString(3, rec.getName().toLowerCase(Locale.ROOT));
		setNullable(drugPs, 4, rec.getDescription());
		setNullable(drugPs, 5, rec.getIndication());
		setNullable(drugPs, 6, rec.getMechanismOfAction());
		setNullable(drugPs, 7, rec.getToxicity());
		drugPs.addBatch();

		for (InteractionEdge edge : rec.getInteractions()) {
			ixPs.setString(1, rec.getId());
			setNullable(ixPs, 2, edge.getDrugbankId());
			ixPs.setString(3, edge.getName());
			setNullable(ixPs, 4, edge.getDescription());
			ixPs.addBatch();
		}

		for (String food : rec.getFoodInteractions()) {
			foodPs.setString(1, rec.getId());
			foodPs.setString(2, food);
			foodPs.addBatch();
		}
	}

	/** Drugs first so a replaced drug row lands before its children. */
	private static void flush(PreparedStatement drugPs, PreparedStatement ixPs, PreparedStatement foodPs)
			throws Exception {
		drugPs.executeBatch();
		ixPs.executeBatch();
		foodPs.executeBatch();
	}

	private static void setNullable(PreparedStatement ps, int idx, String value) throws Exception {
		if (value == null) {
			ps.setNull(idx, Types.VARCHAR);
		} else {
			ps.setString(idx, value);
		}
	}

	private void reportProgress(int processed, long startNs) {
		long elapsedMs = Duration.ofNanos(System.nanoTime() - startNs).toMillis();
		Logger.info("Loaded {} drugs ({}s elapsed)...", processed, elapsedMs / 1000);
		if (progressListener != null) {
			progressListener.onProgress(processed, elapsedMs);
		}
	}

	/** Move the finished staging file over the target data file. */
	private void promote(DrugStore staging) throws IOException {
		Path from = staging.getDataFile();
		Path to = store.getDataFile();
		try {
			Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException | FileAlreadyExistsException e) {
			Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
		}
		Files.deleteIfExists(staging.getDataFile());
	}

	private static void discard(DrugStore staging) {
		try {
			staging.deleteFiles();
		} catch (IOException e) {
			Logger.error("Unable to delete partial store {}; delete it manually before rebuilding",
					staging.getDataFile());
		}
	}

	private static long sizeInMb(Path p) {
		try {
			return Files.size(p) / (1024 * 1024);
		} catch (IOException e) {
			return -1;
		}
	}

	// -------------------------- Single-flight lock -----------------------------

	/**
	 * Exclusive OS-level lock on {@code <location>.build.lock}. The file itself
	 * stays in place; only the lock on it matters.
	 */
	static final class BuildLock implements AutoCloseable {

		private final Path file;
		private final FileChannel channel;
		private final FileLock lock;

		private BuildLock(Path file, FileChannel channel, FileLock lock) {
			this.file = file;
			this.channel = channel;
			this.lock = lock;
		}

		static BuildLock acquire(Path file) {
			FileChannel channel = null;
			try {
				Path parent = file.getParent();
				if (parent != null) {
					Files.createDirectories(parent);
				}
				channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
				FileLock lock = channel.tryLock();
				if (lock == null) {
					channel.close();
					throw new BuildInProgressException(file);
				}
				return new BuildLock(file, channel, lock);
			} catch (OverlappingFileLockException e) {
				closeQuietly(channel);
				throw new BuildInProgressException(file);
			} catch (IOException e) {
				closeQuietly(channel);
				throw new BuildIncompleteException("Store location is not writable: " + file, 0, e);
			}
		}

		@Override
		public void close() {
			try {
				lock.release();
				channel.close();
			} catch (IOException e) {
				Logger.warn("Unable to release build lock {}: {}", file, e.getMessage());
			}
		}

		private static void closeQuietly(FileChannel channel) {
			if (channel == null) {
				return;
			}
			try {
				channel.close();
			} catch (IOException e) {
				Logger.warn("Unable to close lock channel: {}", e.getMessage());
			}
		}
	}
}
