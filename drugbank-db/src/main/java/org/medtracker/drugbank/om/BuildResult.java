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

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a store build. {@code skipped} means an existing non-empty store
 * was kept and nothing was written.
 */
@Value
@Builder
public class BuildResult {

	boolean skipped;
	int drugs;
	long interactions;
	long foodInteractions;
	int skippedRecords;
	Duration elapsed;

	public static BuildResult noOp(StoreStatus existing) {
		return BuildResult.builder()
				.skipped(true)
				.drugs((int) existing.getDrugCount())
				.interactions(existing.getInteractionCount())
				.foodInteractions(existing.getFoodInteractionCount())
				.elapsed(Duration.ZERO)
				.build();
	}
}
