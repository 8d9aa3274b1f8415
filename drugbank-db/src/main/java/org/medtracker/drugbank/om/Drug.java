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
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

/**
 * A catalogued substance as stored. The free-text fields are optional in the
 * source, so their getters return {@link Optional}.
 */
@Value
@Builder
public class Drug {

	String id;
	String name;

	@Getter(AccessLevel.NONE)
	String description;
	@Getter(AccessLevel.NONE)
	String indication;
	@Getter(AccessLevel.NONE)
	String mechanismOfAction;
	@Getter(AccessLevel.NONE)
	String toxicity;

	public Optional<String> getDescription() {
		return Optional.ofNullable(description);
	}

	public Optional<String> getIndication() {
		return Optional.ofNullable(indication);
	}

	public Optional<String> getMechanismOfAction() {
		return Optional.ofNullable(mechanismOfAction);
	}

	public Optional<String> getToxicity() {
		return Optional.ofNullable(toxicity);
	}

	public DrugSummary toSummary() {
		return new DrugSummary(id, name);
	}
}
