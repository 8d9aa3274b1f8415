package org.medtracker.drugbank.cache;

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

/** The three cache levels and their default time-to-live. */
public enum CacheTier {

	/** Complete responses keyed by request text. */
	RESPONSE(Duration.ofMinutes(15)),
	/** Single drug lookups keyed by drug name. */
	DRUG(Duration.ofDays(7)),
	/** Drug pair results, independent of argument order. */
	PAIR(Duration.ofDays(7));

	private final Duration defaultTtl;

	CacheTier(Duration defaultTtl) {
		this.defaultTtl = defaultTtl;
	}

	public Duration getDefaultTtl() {
		return defaultTtl;
	}
}
