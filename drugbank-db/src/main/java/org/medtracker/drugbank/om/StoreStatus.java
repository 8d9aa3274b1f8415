package org.medtracker.drugbank.om;

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

import lombok.Value;

/**
 * Whether the store is usable, with its row counts when it is.
 *
 * <p>A store whose data file exists but cannot be opened (held by another
 * process, damaged, wrong credentials) is not initialized and carries the
 * reason in {@code unreadableReason}; an absent or schema-less store has none.</p>
 */
@Value
public class StoreStatus {

	Path location;
	boolean initialized;
	long drugCount;
	long interactionCount;
	long foodInteractionCount;
	String unreadableReason;

	public static StoreStatus ready(Path location, long drugs, long interactions, long foodInteractions) {
		return new StoreStatus(location, true, drugs, interactions, foodInteractions, null);
	}

	public static StoreStatus notInitialized(Path location) {
		return new StoreStatus(location, false, 0, 0, 0, null);
	}

	public static StoreStatus unreadable(Path location, String reason) {
		return new StoreStatus(location, false, 0, 0, 0, reason == null ? "unknown error" : reason);
	}

	/** The data file is there but could not be opened. */
	public boolean isUnreadable() {
		return unreadableReason != null;
	}
}
