package org.medtracker.drugbank.error;

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

/** Another builder holds the lock for this store location. */
public class BuildInProgressException extends DrugBankException {

	private static final long serialVersionUID = 1L;

	public BuildInProgressException(Path lockFile) {
		super("A DrugBank store build is already running (lock held: " + lockFile + ")");
	}
}
