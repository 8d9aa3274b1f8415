package org.medtracker.drugbank.processing.extract;

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
 * Notified when a top-level drug element cannot be turned into a record. The
 * record is skipped and parsing continues.
 */
@FunctionalInterface
public interface MalformedRecordListener {

	/**
	 * @param position 1-based ordinal of the drug element in the document
	 * @param id       primary id if one was read, otherwise null
	 * @param reason   short description of what was missing
	 */
	void onMalformedRecord(int position, String id, String reason);
}
