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

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * One top-level drug as read from the source document. Filled in field by field
 * while the parser walks the element, then handed to the store builder.
 */
@Data
public class DrugRecord {

	private String id;
	private String name;
	private String description;
	private String indication;
	private String mechanismOfAction;
	private String toxicity;

	private List<InteractionEdge> interactions = new ArrayList<>();
	private List<String> foodInteractions = new ArrayList<>();

	public void addInteraction(InteractionEdge edge) {
		interactions.add(edge);
	}

	public void addFoodInteraction(String text) {
		foodInteractions.add(text);
	}
}
