package org.medtracker.drugbank.query;

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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.medtracker.drugbank.error.StoreNotInitializedException;
import org.medtracker.drugbank.om.Drug;
import org.medtracker.drugbank.om.DrugSummary;
import org.medtracker.drugbank.om.InteractionView;
import org.medtracker.drugbank.processing.persist.DrugStore;
import org.medtracker.drugbank.processing.persist.StoreBuilder;

class DrugQueryEngineTest {

	@TempDir
	Path tmp;

	private DrugQueryEngine engine;

	@AfterEach
	void closeEngine() {
		if (engine != null) {
			engine.close();
		}
	}

	private DrugQueryEngine engineFor(String fixture) throws Exception {
		Path source = tmp.resolve(fixture);
		try (InputStream in = getClass().getClassLoader().getResourceAsStream("xml/" + fixture)) {
			Files.copy(in, source);
		}
		DrugStore store = new DrugStore(tmp.resolve("drugbank"));
		new StoreBuilder(store, 100, 100).build(source, false);
		engine = new DrugQueryEngine(store, new NameResolver(AliasTable.fromClasspath(), 3));
		return engine;
	}

	private static List<String> ids(List<DrugSummary> hits) {
		return hits.stream().map(DrugSummary::getId).collect(Collectors.toList());
	}

	@Nested
	@DisplayName("Aspirin and warfarin")
	class TwoDrugScenario {

		@Test
		@DisplayName("search(\"asp\") finds acetylsalicylic acid through its alias")
		void searchByAliasFragment() throws Exception {
			DrugQueryEngine q = engineFor("two_drugs.xml");

			List<DrugSummary> hits = q.search("asp");

			assertEquals(List.of(new DrugSummary("DB00945", "Acetylsalicylic acid")), hits);
		}

		@Test
		@DisplayName("getDetails(\"aspirin\") resolves through the alias table")
		void detailsByAlias() throws Exception {
			DrugQueryEngine q = engineFor("two_drugs.xml");

			Drug d = q.getDetails("aspirin").orElseThrow();

			assertEquals("DB00945", d.getId());
			assertEquals("Acetylsalicylic acid", d.getName());
			assertEquals(Optional.of("Irreversibly inhibits cyclooxygenase-1 and 2."), d.getMechanismOfAction());
			assertEquals(d, q.getDrugById("DB00945").orElseThrow());
		}

		@Test
		@DisplayName("One interaction between the two, whichever order they are given in")
		void interactionBetweenBoth() throws Exception {
			DrugQueryEngine q = engineFor("two_drugs.xml");

			List<InteractionView> forward = q.getInteractions(List.of("aspirin", "warfarin"));
			List<InteractionView> reverse = q.getInteractions(List.of("Warfarin", "ASPIRIN"));

			assertEquals(1, forward.size());
			assertEquals(forward, reverse);
			InteractionView v = forward.get(0);
			assertTrue(v.involves("DB00945", "DB00682"));
			assertEquals("Acetylsalicylic acid", v.getDrugName());
			assertEquals("Warfarin", v.getInteractingDrugName());
			assertTrue(v.getDescription().orElseThrow().contains("bleeding"));
		}

		@Test
		@DisplayName("Food interactions: none for aspirin, one for warfarin")
		void foodInteractions() throws Exception {
			DrugQueryEngine q = engineFor("two_drugs.xml");

			assertEquals(Collections.emptyList(), q.getFoodInteractions("aspirin"));
			List<String> warfarin = q.getFoodInteractions("warfarin");
			assertEquals(1, warfarin.size());
			assertTrue(warfarin.get(0).contains("vitamin K"));
		}
	}

	@Test
	@DisplayName("Search matches name fragments case-insensitively, ordered by name")
	void searchByName() throws Exception {
		DrugQueryEngine q = engineFor("sample_drugbank.xml");

		assertEquals(List.of("DB00006", "DB00001"), ids(q.search("RUDIN")));
		assertEquals(List.of("DB00006"), ids(q.search("rudin", 1)));
		assertTrue(q.search("   ").isEmpty());
		assertTrue(q.search(null).isEmpty());
		assertTrue(q.search("zzz").isEmpty());
		assertTrue(q.search("_").isEmpty());
	}

	@Test
	@DisplayName("Pairs read the canonical direction first and fall back to the reverse one")
	void canonicalDirection() throws Exception {
		DrugQueryEngine q = engineFor("sample_drugbank.xml");

		// both directions authored: DB00001 -> DB00006 wins
		List<InteractionView> lb = q.getInteractions(List.of("Bivalirudin", "Lepirudin"));
		assertEquals(1, lb.size());
		assertEquals("DB00001", lb.get(0).getDrugId());
		assertEquals("Lepirudin may increase the anticoagulant activities of Bivalirudin.",
				lb.get(0).getDescription().orElseThrow());

		// only DB00014 -> "bivalirudin" authored, by name without an id
		List<InteractionView> gb = q.getInteractions(List.of("Bivalirudin", "Goserelin"));
		assertEquals(1, gb.size());
		assertEquals("DB00014", gb.get(0).getDrugId());
		assertEquals("DB00006", gb.get(0).getInteractingDrugId());
		assertTrue(gb.get(0).involves("DB00006", "DB00014"));
	}

	@Test
	@DisplayName("Result does not depend on argument order for any pair of drugs")
	void symmetricForAllPairs() throws Exception {
		DrugQueryEngine q = engineFor("sample_drugbank.xml");
		List<String> names = List.of("Lepirudin", "Bivalirudin", "Goserelin");

		for (String a : names) {
			for (String b : names) {
				assertEquals(q.getInteractions(List.of(a, b)), q.getInteractions(List.of(b, a)), a + "/" + b);
			}
		}
		List<InteractionView> all = q.getInteractions(names);
		assertEquals(all, q.getInteractions(Arrays.asList("Goserelin", "Lepirudin", "Bivalirudin")));
		// Lepirudin/Goserelin has no edge
		assertEquals(2, all.size());
	}

	@Test
	@DisplayName("Unresolved and repeated names are dropped")
	void unresolvedNamesDropped() throws Exception {
		DrugQueryEngine q = engineFor("sample_drugbank.xml");

		assertTrue(q.getInteractions(List.of("Lepirudin", "no such drug")).isEmpty());
		assertTrue(q.getInteractions(List.of("Lepirudin", "lepirudin")).isEmpty());
		assertTrue(q.getInteractions(List.of("Lepirudin")).isEmpty());
		assertFalse(q.getDetails("no such drug").isPresent());
		assertTrue(q.getFoodInteractions("no such drug").isEmpty());
		assertTrue(q.getInteractionsFor("no such drug").isEmpty());
	}

	@Test
	@DisplayName("All interactions of one drug, both directions, each counterpart once")
	void interactionsForOneDrug() throws Exception {
		DrugQueryEngine q = engineFor("sample_drugbank.xml");

		List<InteractionView> biv = q.getInteractionsFor("bivalirudin");

		// own edges: Lepirudin, Heparin (name only)
		assertEquals(2, biv.size());
		assertTrue(biv.stream().allMatch(v -> "DB00006".equals(v.getDrugId())));
		assertEquals("Reverse-direction edge.", biv.get(0).getDescription().orElseThrow());

		List<InteractionView> lep = q.getInteractionsFor("lepirudin");
		assertEquals(1, lep.size());
		assertEquals("DB00006", lep.get(0).getInteractingDrugId());
	}

	@Test
	@DisplayName("Reverse edges are reported from the requested drug's side")
	void interactionsForIncludesReverseEdges() throws Exception {
		DrugQueryEngine q = engineFor("two_drugs.xml");

		List<InteractionView> w = q.getInteractionsFor("warfarin");

		assertEquals(1, w.size());
		assertEquals("DB00682", w.get(0).getDrugId());
		assertEquals("DB00945", w.get(0).getInteractingDrugId());
		assertEquals("Acetylsalicylic acid", w.get(0).getInteractingDrugName());
	}

	@Test
	@DisplayName("Status reports the built store")
	void status() throws Exception {
		DrugQueryEngine q = engineFor("sample_drugbank.xml");

		assertTrue(q.status().isInitialized());
		assertEquals(3, q.status().getDrugCount());
	}

	@Test
	@DisplayName("Queries against an unbuilt store raise StoreNotInitialized")
	void notInitialized() {
		DrugStore store = new DrugStore(tmp.resolve("never-built"));
		engine = new DrugQueryEngine(store, new NameResolver(AliasTable.empty(), 3));

		assertFalse(engine.status().isInitialized());
		StoreNotInitializedException ex = assertThrows(StoreNotInitializedException.class,
				() -> engine.getDetails("warfarin"));
		assertEquals(store.getLocation(), ex.getLocation());
		assertThrows(StoreNotInitializedException.class, () -> engine.search("war"));
		assertFalse(store.exists());
	}
}
