package com.metrocrawler.service;

import com.metrocrawler.client.WikidataFixture;
import com.metrocrawler.exception.AssemblyException;
import com.metrocrawler.exception.SeedException;
import com.metrocrawler.model.ConnectionDocument;
import com.metrocrawler.model.ConnectionType;
import com.metrocrawler.model.CrawlDiagnostic;
import com.metrocrawler.model.CrawlResult;
import com.metrocrawler.model.CrawlSettings;
import com.metrocrawler.model.IdStrategy;
import com.metrocrawler.model.LineDocument;
import com.metrocrawler.model.NetworkDocument;
import com.metrocrawler.model.StationDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CrawlEngineTest {

    private WikidataFixture wikidata;

    /**
     * System S1 with lines L1 (A, B) and L2 (B, C); B is the interchange and
     * the seed station.
     */
    @BeforeEach
    void setUp() {
        wikidata = new WikidataFixture()
                .label("S1", "en", "Metro")
                .relate("S1", "P527", "L1", "L2")
                .label("L1", "en", "Red line")
                .color("L1", "FF0000")
                .relate("L1", "P527", "A", "B")
                .relate("L1", "P361", "S1")
                .label("L2", "en", "Blue line")
                .relate("L2", "P527", "B", "C")
                .relate("L2", "P361", "S1")
                .label("A", "en", "Alpha station")
                .coordinates("A", 55.75, 37.61)
                .relate("A", "P81", "L1")
                .relate("A", "P197", "B")
                .label("B", "en", "Beta station")
                .coordinates("B", 55.76, 37.62)
                .relate("B", "P81", "L1", "L2")
                .relate("B", "P197", "A", "C")
                .relate("B", "P833", "C")
                .label("C", "en", "Gamma station")
                .coordinates("C", 55.77, 37.63)
                .relate("C", "P81", "L2")
                .relate("C", "P197", "B");
    }

    @Test
    void testCrawl_TwoLinesWithInterchange_BuildsWholeNetwork() {
        // When
        NetworkDocument document = harvest(CrawlSettings.builder().build(), "S1", "B");

        // Then
        assertEquals("S1", document.getId());
        assertEquals(List.of("L1", "L2"), lineIds(document));
        assertEquals(List.of("L1/A", "L1/B", "L2/C"), stationIds(document));

        assertEquals(List.of(adjacent("L1/B")), station(document, "L1/A").getConnections());
        assertEquals(List.of(adjacent("L1/A"), adjacent("L2/C"), transfer("L2/C")),
                station(document, "L1/B").getConnections());
        assertEquals(List.of(adjacent("L1/B")), station(document, "L2/C").getConnections());

        assertEquals("L1", station(document, "L1/B").getLine());
        assertEquals(Map.of("en", "Beta"), station(document, "L1/B").getNames());
        assertEquals("#FF0000", document.getLines().get(0).getColor());
        assertNull(document.getLines().get(1).getColor());
    }

    @Test
    void testCrawl_EveryEntityFetchedOnce() {
        // When
        harvest(CrawlSettings.builder().build(), "S1", "B");

        // Then
        for (String id : List.of("S1", "L1", "L2", "A", "B", "C")) {
            assertEquals(1, wikidata.entityRequests(id), "requests for " + id);
        }
    }

    @Test
    void testCrawl_SharedStation_BelongsToFirstLineThatListsIt() {
        // Given
        wikidata.relate("S2", "P527", "L2", "L1").label("S2", "en", "Metro");

        // When
        NetworkDocument document = harvest(CrawlSettings.builder().build(), "S2", "B");

        // Then
        assertEquals(List.of("L2", "L1"), lineIds(document));
        assertEquals(List.of("L2/B", "L2/C", "L1/A"), stationIds(document));
    }

    @Test
    void testCrawl_StableAcrossRuns() {
        NetworkDocument first = harvest(CrawlSettings.builder().build(), "S1", "B");
        NetworkDocument second = harvest(CrawlSettings.builder().build(), "S1", "B");

        assertEquals(first, second);
    }

    @Test
    void testCrawl_ConnectionToUndiscoveredStation_IsDropped() {
        // Given: Z exists but is on no line of the system
        wikidata.label("Z", "en", "Zeta station").relate("A", "P197", "Z");

        // When
        NetworkDocument document = harvest(CrawlSettings.builder().build(), "S1", "B");

        // Then
        assertEquals(List.of(adjacent("L1/B")), station(document, "L1/A").getConnections());
        assertEquals(0, wikidata.entityRequests("Z"));
        assertStationIdsResolve(document);
    }

    @Test
    void testCrawl_Cycles_TerminateAndVisitEachEntityOnce() {
        // Given: station <-> line <-> station loops and two lines listing the same stations
        WikidataFixture loop = new WikidataFixture()
                .label("S", "en", "Loop metro")
                .relate("S", "P527", "L1")
                .relate("L1", "P527", "X", "Y")
                .relate("L1", "P361", "S")
                .relate("L2", "P527", "Y", "X")
                .relate("L2", "P361", "S")
                .relate("X", "P81", "L1", "L2")
                .relate("X", "P197", "Y")
                .relate("X", "P833", "X")
                .relate("Y", "P81", "L2", "L1")
                .relate("Y", "P197", "X");
        wikidata = loop;

        // When
        NetworkDocument document = harvest(CrawlSettings.builder().followStationLines(true).build(), "S", "X");

        // Then
        assertEquals(List.of("L1", "L2"), lineIds(document));
        assertEquals(List.of("L1/X", "L1/Y"), stationIds(document));
        assertEquals(List.of(adjacent("L1/Y")), station(document, "L1/X").getConnections());
        for (String id : List.of("S", "L1", "L2", "X", "Y")) {
            assertEquals(1, loop.entityRequests(id), "requests for " + id);
        }
    }

    @Test
    void testCrawl_MissingCoordinates_StationStillPresent() {
        // Given
        WikidataFixture fixture = new WikidataFixture()
                .label("S", "en", "Metro")
                .relate("S", "P527", "L")
                .relate("L", "P527", "N")
                .label("N", "en", "Nowhere station");
        wikidata = fixture;

        // When
        CrawlResult result = engine(CrawlSettings.builder().build()).crawl("S", "N");
        NetworkDocument document = new GraphAssembler().assemble(result);

        // Then
        assertEquals(List.of("L/N"), stationIds(document));
        assertTrue(station(document, "L/N").getGeoPositions().isEmpty());
        assertEquals("", station(document, "L/N").getOpenTime());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    void testCrawl_MalformedCoordinates_ReportedAndLeftOut() {
        // Given
        wikidata.claim("C", "P625", WikidataFixture.valueClaim("globecoordinate", Map.of("latitude", 55.0)));

        // When
        CrawlResult result = engine(CrawlSettings.builder().build()).crawl("S1", "B");
        NetworkDocument document = new GraphAssembler().assemble(result);

        // Then: the first coordinate claim of C is still the valid one
        assertEquals(List.of("55.77", "37.63"), station(document, "L2/C").getGeoPositions());

        // When coordinates are only malformed
        WikidataFixture fixture = new WikidataFixture()
                .label("S", "en", "Metro")
                .relate("S", "P527", "L")
                .relate("L", "P527", "N")
                .claim("N", "P625", WikidataFixture.valueClaim("globecoordinate", Map.of("latitude", 55.0)));
        wikidata = fixture;
        result = engine(CrawlSettings.builder().build()).crawl("S", "N");
        document = new GraphAssembler().assemble(result);

        // Then
        assertTrue(station(document, "L/N").getGeoPositions().isEmpty());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals("N", result.getDiagnostics().get(0).getEntityId());
        assertEquals("MALFORMED_ATTRIBUTE", result.getDiagnostics().get(0).getReason());
    }

    @Test
    void testCrawl_UnreachableStation_SkippedWithDiagnostic() {
        // Given
        wikidata.unreachable("C");

        // When
        CrawlResult result = engine(CrawlSettings.builder().build()).crawl("S1", "B");
        NetworkDocument document = new GraphAssembler().assemble(result);

        // Then
        assertEquals(List.of("L1/A", "L1/B"), stationIds(document));
        assertEquals(List.of(adjacent("L1/A")), station(document, "L1/B").getConnections());
        assertEquals(List.of("C"), diagnosticIds(result));
        assertEquals("TRANSPORT", result.getDiagnostics().get(0).getReason());
    }

    @Test
    void testCrawl_StationWhoseRelationsFail_IsExcluded() {
        // Given
        wikidata.unreachableClaims("A");

        // When
        CrawlResult result = engine(CrawlSettings.builder().build()).crawl("S1", "B");
        NetworkDocument document = new GraphAssembler().assemble(result);

        // Then
        assertEquals(List.of("L1/B", "L2/C"), stationIds(document));
        assertEquals(List.of(adjacent("L2/C"), transfer("L2/C")), station(document, "L1/B").getConnections());
        assertEquals(List.of("A"), diagnosticIds(result));
    }

    @Test
    void testCrawl_LineWhoseStationsFail_IsExcludedWithItsOnlyStations() {
        // Given
        wikidata.unreachableClaims("L2");

        // When
        NetworkDocument document = harvest(CrawlSettings.builder().build(), "S1", "B");

        // Then
        assertEquals(List.of("L1"), lineIds(document));
        assertEquals(List.of("L1/A", "L1/B"), stationIds(document));
        assertStationIdsResolve(document);
    }

    @Test
    void testCrawl_LineOnlyKnownToSeedStation_IsDiscovered() {
        // Given: the system lists only L1, C is the seed
        WikidataFixture fixture = new WikidataFixture()
                .relate("S", "P527", "L1")
                .relate("L1", "P527", "A")
                .label("A", "en", "Alpha")
                .relate("L2", "P527", "C")
                .relate("C", "P81", "L2");
        wikidata = fixture;

        // When
        NetworkDocument document = harvest(CrawlSettings.builder().build(), "S", "C");

        // Then
        assertEquals(List.of("L1", "L2"), lineIds(document));
        assertEquals(List.of("L1/A", "L2/C"), stationIds(document));
    }

    @Test
    void testCrawl_FollowStationLines_OnlyAcceptsLinesOfTheSystem() {
        // Given
        wikidata.relate("A", "P81", "L3", "L4")
                .relate("L3", "P527", "D")
                .relate("L3", "P16", "S1")
                .label("D", "en", "Delta station")
                .relate("L4", "P527", "E")
                .label("E", "en", "Epsilon station")
                .relate("L4", "P361", "OTHER");

        // When
        NetworkDocument withoutFollowing = harvest(CrawlSettings.builder().build(), "S1", "B");
        NetworkDocument following = harvest(CrawlSettings.builder().followStationLines(true).build(), "S1", "B");

        // Then
        assertEquals(List.of("L1", "L2"), lineIds(withoutFollowing));
        assertEquals(List.of("L1", "L2", "L3"), lineIds(following));
        assertTrue(stationIds(following).contains("L3/D"));
        assertFalse(stationIds(following).contains("L4/E"));
    }

    @Test
    void testCrawl_EntityLimit_TruncatesAndReports() {
        // When
        CrawlResult result = engine(CrawlSettings.builder().maxEntities(3).build()).crawl("S1", "B");

        // Then
        assertEquals(2, result.getLines().size());
        assertEquals(1, result.getStations().size());
        assertEquals("L1/A", result.getStations().get(0).getLocalId());
        assertEquals(List.of(CrawlState.REASON_ENTITY_LIMIT), result.getDiagnostics().stream()
                .map(CrawlDiagnostic::getReason)
                .collect(Collectors.toList()));
    }

    @Test
    void testCrawl_Parallel_SameDocumentAsSequential() {
        // Given: a longer line so that resolution really fans out
        for (int i = 0; i < 20; i++) {
            wikidata.relate("L2", "P527", "M" + i).label("M" + i, "en", "Station " + i);
        }

        // When
        NetworkDocument sequential = harvest(CrawlSettings.builder().build(), "S1", "B");
        NetworkDocument parallel = harvest(CrawlSettings.builder().parallelism(4).build(), "S1", "B");

        // Then
        assertEquals(23, parallel.getStations().size());
        assertEquals(sequential, parallel);
    }

    @Test
    void testCrawl_NameIds() {
        // When
        NetworkDocument document = harvest(CrawlSettings.builder().idStrategy(IdStrategy.NAME).build(), "S1", "B");

        // Then
        assertEquals("metro", document.getId());
        assertEquals(List.of("red", "blue"), lineIds(document));
        assertEquals(List.of("red/alpha", "red/beta", "blue/gamma"), stationIds(document));
        assertEquals(List.of(adjacent("red/beta")), station(document, "red/alpha").getConnections());
    }

    @Test
    void testCrawl_MergedItemListedUnderBothIds_AppearsOnce() {
        // Given: OLD was merged into NEW; L1 still lists OLD, L2 lists NEW
        wikidata = mergedStationFixture("L1", "L2");

        // When
        NetworkDocument document = harvest(CrawlSettings.builder().build(), "S", "A");

        // Then
        assertEquals(List.of("L1/NEW", "L1/A"), stationIds(document));
        assertEquals(Map.of("en", "Merged"), station(document, "L1/NEW").getNames());
        assertEquals(List.of(adjacent("L1/NEW")), station(document, "L1/A").getConnections());
    }

    @Test
    void testCrawl_MergedItemReachedAfterSurvivor_IsSkipped() {
        // Given
        wikidata = mergedStationFixture("L2", "L1");

        // When
        NetworkDocument document = harvest(CrawlSettings.builder().build(), "S", "A");

        // Then
        assertEquals(List.of("L2/NEW", "L1/A"), stationIds(document));
        assertEquals(List.of(adjacent("L2/NEW")), station(document, "L1/A").getConnections());
    }

    @Test
    void testCrawl_MergedSeedStation_FetchedOnceUnderRequestedId() {
        // Given
        WikidataFixture fixture = mergedStationFixture("L1", "L2");
        wikidata = fixture;

        // When
        NetworkDocument document = harvest(CrawlSettings.builder().build(), "S", "OLD");

        // Then
        assertEquals(List.of("L1/NEW", "L1/A"), stationIds(document));
        assertEquals(1, fixture.entityRequests("OLD"));
        assertEquals(0, fixture.entityRequests("NEW"));
    }

    @Test
    void testCrawl_SystemWithoutLines_EmptySystem() {
        // Given
        wikidata = new WikidataFixture()
                .label("S", "en", "Ghost metro")
                .label("X", "en", "Lonely station");
        CrawlResult result = engine(CrawlSettings.builder().build()).crawl("S", "X");

        // When
        AssemblyException e = assertThrows(AssemblyException.class, () -> new GraphAssembler().assemble(result));

        // Then
        assertEquals(AssemblyException.Kind.EMPTY_SYSTEM, e.getKind());
        assertEquals("S", e.getSystemId());
        assertTrue(result.getStations().isEmpty());
    }

    @Test
    void testCrawl_MissingSystem_FailsWithSeedError() {
        SeedException e = assertThrows(SeedException.class,
                () -> engine(CrawlSettings.builder().build()).crawl("NOPE", "B"));

        assertEquals(SeedException.Kind.SYSTEM_NOT_FOUND, e.getKind());
        assertEquals("NOPE", e.getSeedId());
    }

    @Test
    void testCrawl_MissingSeedStation_FailsWithSeedError() {
        SeedException e = assertThrows(SeedException.class,
                () -> engine(CrawlSettings.builder().build()).crawl("S1", "NOPE"));

        assertEquals(SeedException.Kind.STATION_NOT_FOUND, e.getKind());
        assertTrue(e.getMessage().contains("NOPE"));
    }

    /**
     * System S listing {@code firstLine} then {@code secondLine}. L1 lists OLD
     * and A, L2 lists NEW, and OLD is a redirect to NEW. A is adjacent to OLD.
     */
    private static WikidataFixture mergedStationFixture(String firstLine, String secondLine) {
        return new WikidataFixture()
                .relate("S", "P527", firstLine, secondLine)
                .relate("L1", "P527", "OLD", "A")
                .relate("L2", "P527", "NEW")
                .redirect("OLD", "NEW")
                .label("NEW", "en", "Merged station")
                .label("A", "en", "Alpha station")
                .relate("A", "P197", "OLD");
    }

    private CrawlEngine engine(CrawlSettings settings) {
        return new CrawlEngine(new EntityResolver(wikidata), new RelationExpander(wikidata), settings);
    }

    private NetworkDocument harvest(CrawlSettings settings, String systemId, String stationId) {
        return new GraphAssembler().assemble(engine(settings).crawl(systemId, stationId));
    }

    private static void assertStationIdsResolve(NetworkDocument document) {
        List<String> ids = stationIds(document);
        for (StationDocument station : document.getStations()) {
            for (ConnectionDocument connection : station.getConnections()) {
                assertTrue(ids.contains(connection.getTo()), "dangling connection to " + connection.getTo());
            }
        }
    }

    private static StationDocument station(NetworkDocument document, String id) {
        return document.getStations().stream()
                .filter(s -> s.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no station " + id));
    }

    private static List<String> stationIds(NetworkDocument document) {
        return document.getStations().stream().map(StationDocument::getId).collect(Collectors.toList());
    }

    private static List<String> lineIds(NetworkDocument document) {
        return document.getLines().stream().map(LineDocument::getId).collect(Collectors.toList());
    }

    private static List<String> diagnosticIds(CrawlResult result) {
        return result.getDiagnostics().stream().map(CrawlDiagnostic::getEntityId).collect(Collectors.toList());
    }

    private static ConnectionDocument adjacent(String to) {
        return new ConnectionDocument(to, ConnectionType.ADJACENT);
    }

    private static ConnectionDocument transfer(String to) {
        return new ConnectionDocument(to, ConnectionType.TRANSFER);
    }
}
