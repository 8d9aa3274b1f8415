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

/**
 * Ingestion stopped before the store was complete. The partial output has been
 * discarded; delete any leftovers and rebuild.
 */
public class BuildIncompleteException extends DrugBankException {

	private static final long serialVersionUID = 1L;

	private final int drugsWritten;

	public BuildIncompleteException(String message, int drugsWritten, Throwable cause) {
		super(message + " (after " + drugsWritten + " drugs)", cause);
		this.drugsWritten = drugsWritten;
	}

	public int getDrugsWritten() {
		return drugsWritten;
	}
}
