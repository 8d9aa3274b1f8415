package org.medtracker.drugbank;

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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.medtracker.drugbank.conf.ConfigLoader;
import org.medtracker.drugbank.error.DrugBankException;
import org.medtracker.drugbank.om.BuildResult;
import org.medtracker.drugbank.processing.persist.DrugStore;
import org.medtracker.drugbank.processing.persist.StoreBuilder;
import org.medtracker.drugbank.util.Logger;

/**
 * Init command: builds the DrugBank store from the XML export.
 *
 * <pre>
 * drugbank-init [--force] [--config &lt;file&gt;] [&lt;source.xml&gt; [&lt;store-path&gt;]]
 * </pre>
 *
 * Missing positional arguments come from {@code DRUGBANK_XML_PATH} and
 * {@code STORE_PATH} in the configuration. Running it against a store that is
 * already built does nothing and succeeds, so it can run on every deploy.
 *
 * Exit codes: {@value #EXIT_OK} success or nothing to do,
 * {@value #EXIT_FAILURE} build failed, {@value #EXIT_USAGE} bad arguments or
 * configuration.
 */
public class DrugBankMain {

	public static final int EXIT_OK = 0;
	public static final int EXIT_FAILURE = 1;
	public static final int EXIT_USAGE = 2;

	private static final String USAGE =
			"Usage: drugbank-init [--force] [--config <file>] [<source.xml> [<store-path>]]";

	public static void main(String[] args) {
		System.exit(run(args));
	}

	/** Runs the command and returns its exit code. */
	public static int run(String[] args) {
		boolean force = false;
		Path configFile = null;
		List<String> positional = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String a = args[i];
			if ("--force".equals(a) || "-f".equals(a)) {
				force = true;
			} else if ("--config".equals(a)) {
				if (i + 1 >= args.length) {
					return usage("--config needs a file argument");
				}
				configFile = Path.of(args[++i]);
			} else if ("--help".equals(a) || "-h".equals(a)) {
				System.out.println(USAGE);
				return EXIT_OK;
			} else if (a.startsWith("-")) {
				return usage("Unknown option: " + a);
			} else {
				positional.add(a);
			}
		}
		if (positional.size() > 2) {
			return usage("Too many arguments");
		}

		final ConfigLoader cfg;
		final Path source;
		final Path storePath;
		try {
			cfg = configFile != null ? new ConfigLoader(configFile) : new ConfigLoader();
			source = positional.size() > 0 ? Path.of(positional.get(0)) : cfg.getDrugBankXmlPath();
			storePath = positional.size() > 1 ? Path.of(positional.get(1)) : cfg.getStorePath();
		} catch (IllegalArgumentException | IllegalStateException e) {
			return usage(e.getMessage());
		}

		for (String issue : cfg.validate()) {
			Logger.warn("Config: {}", issue);
		}

		StoreBuilder builder = new StoreBuilder(
				new DrugStore(storePath, cfg.getDbUser(), cfg.getDbPass()),
				cfg.getBuildBatchSize(),
				cfg.getBuildProgressInterval());
		try {
			BuildResult r = builder.build(source, force);
			if (r.isSkipped()) {
				System.out.println("DrugBank store already initialized at " + builder.getStore().getLocation()
						+ " (" + r.getDrugs() + " drugs); use --force to rebuild");
			} else {
				System.out.println("DrugBank store built at " + builder.getStore().getLocation() + ": "
						+ r.getDrugs() + " drugs, " + r.getInteractions() + " drug interactions, "
						+ r.getFoodInteractions() + " food interactions, " + r.getSkippedRecords()
						+ " skipped records in " + r.getElapsed().toSeconds() + "s");
			}
			return EXIT_OK;
		} catch (DrugBankException e) {
			Logger.error("DrugBank init failed: {}", e.getMessage());
			return EXIT_FAILURE;
		}
	}

	private static int usage(String problem) {
		Logger.error(problem);
		System.err.println(USAGE);
		return EXIT_USAGE;
	}
}
