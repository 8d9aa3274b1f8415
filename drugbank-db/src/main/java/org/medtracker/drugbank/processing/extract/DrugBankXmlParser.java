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

import java.io.InputStream;
import java.util.Iterator;
import java.util.NoSuchElementException;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import org.apache.commons.lang3.StringUtils;
import org.medtracker.drugbank.error.SourceUnavailableException;
import org.medtracker.drugbank.om.DrugRecord;
import org.medtracker.drugbank.om.InteractionEdge;
import org.medtracker.drugbank.util.Logger;

/**
 * Streams a DrugBank {@code full_database.xml} export as one {@link DrugRecord}
 * per top-level {@code <drug>} element, in document order.
 *
 * <p>The reader is pull-based (StAX): only the record being assembled is held in
 * memory, so working memory does not grow with document size. The iterator is
 * lazy, finite and cannot be restarted.</p>
 *
 * <p>Only direct children of a top-level drug are read as its fields. DrugBank
 * nests {@code <name>}, {@code <description>} and {@code <drugbank-id>} under
 * products, salts, targets and so on; those are skipped.</p>
 *
 * <p>A drug without a primary id or a name is skipped with a warning and
 * reported to the {@link MalformedRecordListener}; the stream continues. A
 * document that is not well-formed raises {@link SourceUnavailableException}.</p>
 *
 * <p>The parser does not own the input stream beyond {@link #close()}, which
 * closes both the reader and the stream.</p>
 */
public class DrugBankXmlParser implements Iterator<DrugRecord>, AutoCloseable {

	/** XML namespace used in DrugBank exports. */
	public static final String NAMESPACE = "http://www.drugbank.ca";

	private static final String EL_DRUG = "drug";
	private static final String EL_DRUGBANK_ID = "drugbank-id";
	private static final String EL_NAME = "name";
	private static final String EL_DESCRIPTION = "description";
	private static final String EL_INDICATION = "indication";
	private static final String EL_MECHANISM = "mechanism-of-action";
	private static final String EL_TOXICITY = "toxicity";
	private static final String EL_DRUG_INTERACTIONS = "drug-interactions";
	private static final String EL_DRUG_INTERACTION = "drug-interaction";
	private static final String EL_FOOD_INTERACTIONS = "food-interactions";
	private static final String EL_FOOD_INTERACTION = "food-interaction";

	private static final XMLInputFactory FACTORY = newSecureFactory();

	private final XMLStreamReader reader;
	private final InputStream source;
	private final MalformedRecordListener malformedListener;

	private DrugRecord next;
	private boolean finished;
	private int depth;
	private int drugElements;
	private int emitted;
	private int skipped;

	public DrugBankXmlParser(InputStream source) {
		this(source, null);
	}

	public DrugBankXmlParser(InputStream source, MalformedRecordListener malformedListener) {
		if (source == null) {
			throw new IllegalArgumentException("source stream must not be null");
		}
		this.source = source;
		this.malformedListener = malformedListener;
		try {
			this.reader = FACTORY.createXMLStreamReader(source);
		} catch (XMLStreamException e) {
			throw new SourceUnavailableException("Unable to open DrugBank XML stream: " + e.getMessage(), e);
		}
	}

	/** StAX factory with DTDs and external entities disabled. */
	private static XMLInputFactory newSecureFactory() {
		XMLInputFactory f = XMLInputFactory.newFactory();
		f.setProperty(XMLInputFactory.SUPPORT_DTD, false);
		f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
		f.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
		f.setProperty(XMLInputFactory.IS_COALESCING, true);
		return f;
	}

	// -------------------------- Iterator ---------------------------------------

	@Override
	public boolean hasNext() {
		if (next == null && !finished) {
			next = advance();
			if (next == null) {
				finished = true;
			}
		}
		return next != null;
	}

	@Override
	public DrugRecord next() {
		if (!hasNext()) {
			throw new NoSuchElementException("No more drug records");
		}
		DrugRecord out = next;
		next = null;
		emitted++;
		return out;
	}

	/** Records handed out so far. */
	public int getEmittedCount() {
		return emitted;
	}

	/** Drug elements skipped as malformed so far. */
	public int getSkippedCount() {
		return skipped;
	}

	@Override
	public void close() {
		finished = true;
		next = null;
		try {
			reader.close();
		} catch (XMLStreamException e) {
			Logger.warn("Error closing XML reader: {}", e.getMessage());
		}
		try {
			source.close();
		} catch (Exception e) {
			Logger.warn("Error closing DrugBank source stream: {}", e.getMessage());
		}
	}

	// -------------------------- Walk -------------------------------------------

	/** Pull events until the next valid top-level drug, or null at end of document. */
	private DrugRecord advance() {
		try {
			while (reader.hasNext()) {
				int event = reader.next();
				if (event == XMLStreamConstants.START_ELEMENT) {
					depth++;
					// depth 1 = <drugbank>, depth 2 = its children
					if (depth == 2) {
						if (isDrugBank(EL_DRUG)) {
							drugElements++;
							DrugRecord rec = readDrug();
							depth--;
							if (accept(rec)) {
								return rec;
							}
						} else {
							skipElement();
							depth--;
						}
					}
				} else if (event == XMLStreamConstants.END_ELEMENT) {
					depth--;
				}
			}
			return null;
		} catch (XMLStreamException e) {
			throw new SourceUnavailableException(
					"DrugBank XML is not well-formed near drug #" + drugElements + ": " + e.getMessage(), e);
		}
	}

	private boolean accept(DrugRecord rec) {
		String reason = null;
		if (StringUtils.isBlank(rec.getId())) {
			reason = "missing primary drugbank-id";
		} else if (StringUtils.isBlank(rec.getName())) {
			reason = "missing name";
		}
		if (reason == null) {
			return true;
		}
		skipped++;
		Logger.warn("Skipping malformed drug #{} (id={}): {}", drugElements, rec.getId(), reason);
		if (malformedListener != null) {
			malformedListener.onMalformedRecord(drugElements, rec.getId(), reason);
		}
		return false;
	}

	/** Reader is on the drug START_ELEMENT; returns positioned on its END_ELEMENT. */
	private DrugRecord readDrug() throws XMLStreamException {
		DrugRecord rec = new DrugRecord();
		String fallbackId = null;

		while (reader.hasNext()) {
			int event = reader.next();
			if (event == XMLStreamConstants.END_ELEMENT) {
				break;
			}
			if (event != XMLStreamConstants.START_ELEMENT) {
				continue;
			}
			// every START here is a direct child; each branch consumes it fully
			if (!inNamespace()) {
				skipElement();
				continue;
			}
			switch (reader.getLocalName()) {
			case EL_DRUGBANK_ID: {
				boolean primary = "true".equalsIgnoreCase(reader.getAttributeValue(null, "primary"));
				String id = clean(readText());
				if (primary && rec.getId() == null) {
					rec.setId(id);
				} else if (fallbackId == null) {
					fallbackId = id;
				}
				break;
			}
			case EL_NAME:
				rec.setName(clean(readText()));
				break;
			case EL_DESCRIPTION:
				rec.setDescription(clean(readText()));
				break;
			case EL_INDICATION:
				rec.setIndication(clean(readText()));
				break;
			case EL_MECHANISM:
				rec.setMechanismOfAction(clean(readText()));
				break;
			case EL_TOXICITY:
				rec.setToxicity(clean(readText()));
				break;
			case EL_DRUG_INTERACTIONS:
				readInteractions(rec);
				break;
			case EL_FOOD_INTERACTIONS:
				readFoodInteractions(rec);
				break;
			default:
				skipElement();
			}
		}

		if (rec.getId() == null) {
			rec.setId(fallbackId);
		}
		return rec;
	}

	private void readInteractions(DrugRecord rec) throws XMLStreamException {
		while (reader.hasNext()) {
			int event = reader.next();
			if (event == XMLStreamConstants.END_ELEMENT) {
				return;
			}
			if (event == XMLStreamConstants.START_ELEMENT) {
				if (isDrugBank(EL_DRUG_INTERACTION)) {
					InteractionEdge edge = readInteraction();
					if (edge != null) {
						rec.addInteraction(edge);
					}
				} else {
					skipElement();
				}
			}
		}
	}

	/** Edges without a name are dropped. */
	private InteractionEdge readInteraction() throws XMLStreamException {
		String id = null;
		String name = null;
		String description = null;
		while (reader.hasNext()) {
			int event = reader.next();
			if (event == XMLStreamConstants.END_ELEMENT) {
				break;
			}
			if (event != XMLStreamConstants.START_ELEMENT) {
				continue;
			}
			if (isDrugBank(EL_DRUGBANK_ID)) {
				id = clean(readText());
			} else if (isDrugBank(EL_NAME)) {
				name = clean(readText());
			} else if (isDrugBank(EL_DESCRIPTION)) {
				description = clean(readText());
			} else {
				skipElement();
			}
		}
		return name == null ? null : new InteractionEdge(id, name, description);
	}

	private void readFoodInteractions(DrugRecord rec) throws XMLStreamException {
		while (reader.hasNext()) {
			int event = reader.next();
			if (event == XMLStreamConstants.END_ELEMENT) {
				return;
			}
			if (event == XMLStreamConstants.START_ELEMENT) {
				if (isDrugBank(EL_FOOD_INTERACTION)) {
					String text = clean(readText());
					if (text != null) {
						rec.addFoodInteraction(text);
					}
				} else {
					skipElement();
				}
			}
		}
	}

	// -------------------------- Helpers ----------------------------------------

	/**
	 * Concatenated text of the current element and its descendants. Reader must
	 * be on a START_ELEMENT; returns positioned on the matching END_ELEMENT.
	 */
	private String readText() throws XMLStreamException {
		StringBuilder sb = new StringBuilder();
		int level = 1;
		while (level > 0 && reader.hasNext()) {
			int event = reader.next();
			switch (event) {
			case XMLStreamConstants.START_ELEMENT:
				level++;
				break;
			case XMLStreamConstants.END_ELEMENT:
				level--;
				break;
			case XMLStreamConstants.CHARACTERS:
			case XMLStreamConstants.CDATA:
			case XMLStreamConstants.SPACE:
				sb.append(reader.getText());
				break;
			default:
				break;
			}
		}
		return sb.toString();
	}

	/** Skip the current element and its subtree. */
	private void skipElement() throws XMLStreamException {
		int level = 1;
		while (level > 0 && reader.hasNext()) {
			int event = reader.next();
			if (event == XMLStreamConstants.START_ELEMENT) {
				level++;
			} else if (event == XMLStreamConstants.END_ELEMENT) {
				level--;
			}
		}
	}

	private boolean isDrugBank(String localName) {
		return localName.equals(reader.getLocalName()) && inNamespace();
	}

	/** DrugBank namespace, or no namespace at all (hand-written fixtures). */
	private boolean inNamespace() {
		String ns = reader.getNamespaceURI();
		return ns == null || ns.isEmpty() || NAMESPACE.equals(ns);
	}

	/** Trimmed text, or null when blank. */
	static String clean(String raw) {
		return StringUtils.trimToNull(raw);
	}
}
