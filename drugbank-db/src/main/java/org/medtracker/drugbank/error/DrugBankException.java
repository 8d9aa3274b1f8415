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
 * Root of the build and store-availability failures that propagate to callers.
 * Per-record parse problems and unresolved names never surface as exceptions.
 */
public class DrugBankException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public DrugBankException(String message) {
		super(message);
	}

	public DrugBankException(String message, Throwable cause) {
		super(message, cause);
	}
}
