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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.medtracker.drugbank.error.SourceUnavailableException;
import org.medtracker.drugbank.om.DrugRecord;
import org.medtracker.drugbank.om.InteractionEdge;

class DrugBankXmlParserTest {

	private static InputStream resource(String name) {
		InputStream in = DrugBankXmlParserTest.class.getClassLoader().getResourceAsStream("xml/" + name);
		if (in == null) {
			throw new IllegalStateException("Missing test resource xml/" + name);
		}
		return in;
	}

	private static List<DrugRecord> readAll(DrugBankXmlParser parser) {
		List<DrugRecord> out = new ArrayList<>();
		parser.forEachRemaining(out::add);
		return out;
	}

	@Test
	@DisplayName("Reads the direct fields, interactions and food interactions of each drug")
	void readsDrugFields() {
		try (DrugBankXmlParser parser = new DrugBankXmlParser(resource("two_drugs.xml"))) {
			List<DrugRecord> drugs = readAll(parser);

			assertEquals(2, drugs.size());
			DrugRecord asa = drugs.get(0);
			assertEquals("DB00945", asa.getId());
			assertEquals("Acetylsalicylic acid", asa.getName());
			assertTrue(asa.getDescription().startsWith("The prototypical analgesic"));
			assertEquals("Irreversibly inhibits cyclooxygenase-1 and 2.", asa.getMechanismOfAction());
			assertEquals("Oral LD50 in rats is 200 mg/kg.", asa.getToxicity());
			assertEquals(1, asa.getInteractions().size());
			assertEquals(new InteractionEdge("DB00682", "Warfarin",
					"The risk or severity of bleeding can be increased when Acetylsalicylic acid is combined with Warfarin."),
					asa.getInteractions().get(0));
			assertTrue(asa.getFoodInteractions().isEmpty());

			DrugRecord warfarin = drugs.get(1);
			assertEquals("DB00682", warfarin.getId());
			assertEquals(List.of("Avoid drastic changes in dietary habit, particularly foods rich in vitamin K."),
					warfarin.getFoodInteractions());
			assertEquals(2, parser.getEmittedCount());
			assertEquals(0, parser.getSkippedCount());
		}
	}

	@Test
	@DisplayName("Nested names and ids under salts and products do not leak into the drug")
	void ignoresNestedElements() {
		try (DrugBankXmlParser parser = new DrugBankXmlParser(resource("sample_drugbank.xml"))) {
			DrugRecord lepirudin = parser.next();

			assertEquals("DB00001", lepirudin.getId());
			assertEquals("Lepirudin", lepirudin.getName());
			assertEquals("Lepirudin is a recombinant hirudin.", lepirudin.getDescription());
			// the edge without a name is dropped
			assertEquals(1, lepirudin.getInteractions().size());
			assertEquals("Bivalirudin", lepirudin.getInteractions().get(0).getName());
			assertEquals(2, lepirudin.getFoodInteractions().size());
		}
	}

	@Test
	@DisplayName("Malformed drug is skipped, reported, and the stream continues")
	void skipsMalformedRecord() {
		MalformedRecordListener listener = mock(MalformedRecordListener.class);
		try (DrugBankXmlParser parser = new DrugBankXmlParser(resource("sample_drugbank.xml"), listener)) {
			List<DrugRecord> drugs = readAll(parser);

			assertEquals(List.of("DB00001", "DB00006", "DB00014"),
					drugs.stream().map(DrugRecord::getId).collect(Collectors.toList()));
			assertEquals(1, parser.getSkippedCount());
			verify(listener, times(1)).onMalformedRecord(eq(2), eq("DB99999"), anyString());
		}
	}

	@Test
	@DisplayName("Drug without a primary flag falls back to its first id; name-only edges keep a null id")
	void fallsBackToFirstId() {
		try (DrugBankXmlParser parser = new DrugBankXmlParser(resource("sample_drugbank.xml"))) {
			List<DrugRecord> drugs = readAll(parser);

			DrugRecord bivalirudin = drugs.get(1);
			assertEquals(2, bivalirudin.getInteractions().size());
			assertNull(bivalirudin.getInteractions().get(1).getDrugbankId());
			assertEquals("Heparin", bivalirudin.getInteractions().get(1).getName());

			DrugRecord goserelin = drugs.get(2);
			assertEquals("DB00014", goserelin.getId());
			assertNull(goserelin.getDescription());
		}
	}

	@Test
	@DisplayName("Elements without a namespace are accepted")
	void acceptsUnqualifiedDocument() {
		String xml = "<drugbank><drug><drugbank-id primary=\"true\">DB1</drugbank-id><name> Plain </name></drug></drugbank>";
		try (DrugBankXmlParser parser = new DrugBankXmlParser(
				new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)))) {
			DrugRecord rec = parser.next();
			assertEquals("DB1", rec.getId());
			assertEquals("Plain", rec.getName());
			assertFalse(parser.hasNext());
			assertThrows(NoSuchElementException.class, parser::next);
		}
	}

	@Test
	@DisplayName("Document that is not well-formed raises SourceUnavailable after the good records")
	void notWellFormed() {
		try (DrugBankXmlParser parser = new DrugBankXmlParser(resource("not_well_formed.xml"))) {
			assertEquals("DB00001", parser.next().getId());
			assertThrows(SourceUnavailableException.class, parser::hasNext);
		}
	}

	@Test
	@DisplayName("DOCTYPE declarations are refused")
	void refusesDtd() {
		String xml = "<?xml version=\"1.0\"?><!DOCTYPE drugbank [<!ENTITY x SYSTEM \"file:///etc/passwd\">]>"
				+ "<drugbank><drug><drugbank-id>DB1</drugbank-id><name>&x;</name></drug></drugbank>";
		try (DrugBankXmlParser parser = new DrugBankXmlParser(
				new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)))) {
			assertThrows(SourceUnavailableException.class, parser::hasNext);
		}
	}

	// -------------------------- Streaming bound --------------------------------

	private static final int SYNTHETIC_DRUGS = 20_000;
	private static final String FILLER = StringUtils.repeat("lorem ipsum ", 340); // ~4 KB per drug

	/** Generates the document lazily, one drug per chunk. */
	private static InputStream syntheticDocument(int drugs) {
		Enumeration<InputStream> chunks = new Enumeration<InputStream>() {
			private int i = -1;

			@Override
			public boolean hasMoreElements() {
				return i <= drugs;
			}

			@Override
			public InputStream nextElement() {
				String s;
				if (i == -1) {
					s = "<?xml version=\"1.0\"?><drugbank xmlns=\"http://www.drugbank.ca\">";
				} else if (i == drugs) {
					s = "</drugbank>";
				} else {
					s = "<drug><drugbank-id primary=\"true\">DB" + i + "</drugbank-id><name>Drug " + i
							+ "</name><description>" + FILLER + "</description><drug-interactions>"
							+ "<drug-interaction><drugbank-id>DB" + (i + 1) + "</drugbank-id><name>Drug " + (i + 1)
							+ "</name><description>" + FILLER + "</description></drug-interaction>"
							+ "</drug-interactions></drug>";
				}
				i++;
				return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
			}
		};
		return new SequenceInputStream(chunks);
	}

	private static final class CountingInputStream extends FilterInputStream {
		long count;

		CountingInputStream(InputStream in) {
			super(in);
		}

		@Override
		public int read() throws IOException {
			int b = super.read();
			if (b >= 0) {
				count++;
			}
			return b;
		}

		@Override
		public int read(byte[] b, int off, int len) throws IOException {
			int n = super.read(b, off, len);
			if (n > 0) {
				count += n;
			}
			return n;
		}
	}

	@Test
	@DisplayName("Records are produced lazily: the first record needs only the start of the document")
	void producesRecordsLazily() {
		CountingInputStream in = new CountingInputStream(syntheticDocument(2_000));
		try (DrugBankXmlParser parser = new DrugBankXmlParser(in)) {
			assertEquals("DB0", parser.next().getId());
			long afterFirst = in.count;

			int n = 1;
			while (parser.hasNext()) {
				parser.next();
				n++;
			}
			assertEquals(2_000, n);
			assertTrue(afterFirst * 100 < in.count,
					"first record consumed " + afterFirst + " of " + in.count + " bytes");
		}
	}

	@Test
	@DisplayName("Heap use stays flat while streaming a document far larger than the ceiling")
	void heapStaysBounded() {
		final long ceiling = 48L * 1024 * 1024;
		Runtime rt = Runtime.getRuntime();
		CountingInputStream in = new CountingInputStream(syntheticDocument(SYNTHETIC_DRUGS));

		long baseline = -1;
		long peak = 0;
		try (DrugBankXmlParser parser = new DrugBankXmlParser(in)) {
			int n = 0;
			while (parser.hasNext()) {
				DrugRecord rec = parser.next();
				assertEquals("Drug " + n, rec.getName());
				n++;
				if (n % 5_000 == 0) {
					System.gc();
					long used = rt.totalMemory() - rt.freeMemory();
					if (baseline < 0) {
						baseline = used;
					}
					peak = Math.max(peak, used);
				}
			}
			assertEquals(SYNTHETIC_DRUGS, n);
		}

		assertTrue(in.count > 2 * ceiling, "document should be larger than the ceiling: " + in.count);
		assertTrue(peak - baseline < ceiling, "heap grew by " + (peak - baseline) + " bytes");
	}
}
