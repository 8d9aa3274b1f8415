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

import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

/**
 * Interaction between two drugs as returned to callers. Both sides carry id and
 * name so a caller can render the row without another lookup.
 */
@Value
public class InteractionView {

	String drugId;
	String drugName;
	String interactingDrugId;
	String interactingDrugName;

	@Getter(AccessLevel.NONE)
	String description;

	public Optional<String> getDescription() {
		return Optional.ofNullable(description);
	}

	/** True when this row links the two given drug ids, in either direction. */
	public boolean involves(String idA, String idB) {
		return (drugId.equals(idA) && idB.equals(interactingDrugId))
				|| (drugId.equals(idB) && idA.equals(interactingDrugId));
	}
}
