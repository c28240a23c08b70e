package org.kingstonaccess.service.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.kingstonaccess.service.client.NominatimClient;
import org.kingstonaccess.service.config.RegionProperties;
import org.kingstonaccess.service.model.BoundingBox;
import org.kingstonaccess.service.model.NominatimPlace;
import org.kingstonaccess.service.model.PlaceCandidate;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlaceResolverTest {

    private static final BoundingBox KINGSTON = new BoundingBox(44.10, 44.40, -76.70, -76.20);

    @Mock
    private NominatimClient nominatimClient;

    private PlaceResolver placeResolver;

    @BeforeEach
    void setUp() {
        placeResolver = new PlaceResolver(nominatimClient, new RegionProperties());
    }

    private static NominatimPlace place(String placeId, String name, String lat, String lon) {
        return NominatimPlace.builder()
                .placeId(placeId)
                .name(name)
                .displayName(name + ", Princess Street, Kingston, Ontario")
                .lat(lat)
                .lon(lon)
                .build();
    }

    @Test
    void specificQueryIsNotExpanded() {
        assertEquals(List.of("Tim Hortons on Princess St"),
                PlaceResolver.expandQueries("  Tim Hortons on Princess St "));
    }

    @Test
    void genericGroceryTermExpandsToChains() {
        List<String> queries = PlaceResolver.expandQueries("market");

        assertEquals(10, queries.size());
        assertEquals("market", queries.get(0));
        assertEquals("supermarket", queries.get(1));
        assertEquals("Costco Kingston", queries.get(9));
    }

    @Test
    void expansionDeduplicatesCaseInsensitively() {
        List<String> queries = PlaceResolver.expandQueries("SuperMarket");

        assertEquals(9, queries.size());
        assertEquals("SuperMarket", queries.get(0));
        assertEquals("grocery store", queries.get(1));
    }

    @Test
    void substringMatchCollapsesWhitespace() {
        List<String> queries = PlaceResolver.expandQueries("cheap   grocery  near me");

        assertEquals("cheap grocery near me", queries.get(0));
        assertTrue(queries.contains("Metro Kingston"));
    }

    @Test
    void blankQueryExpandsToNothing() {
        assertTrue(PlaceResolver.expandQueries("   ").isEmpty());
        assertTrue(PlaceResolver.expandQueries(null).isEmpty());
    }

    @Test
    void blankAutocompleteSkipsGeocoder() {
        assertTrue(placeResolver.autocomplete("  ", 10, null).isEmpty());
        verifyNoInteractions(nominatimClient);
    }

    @Test
    void autocompleteLimitIsClamped() {
        placeResolver.autocomplete("princess", 500, KINGSTON);
        verify(nominatimClient).search("princess", 50, KINGSTON);

        placeResolver.autocomplete("princess", 0, null);
        verify(nominatimClient).search("princess", 1, null);
    }

    @Test
    void resolveMergesExpansionsInFirstSeenOrder() {
        when(nominatimClient.search(anyString(), anyInt(), any())).thenReturn(List.of());
        when(nominatimClient.search(eq("groceries"), anyInt(), any())).thenReturn(List.of(
                place("1", "Metro", "44.2301", "-76.4811"),
                place("2", "Food Basics", "44.2410", "-76.5020")));
        when(nominatimClient.search(eq("supermarket"), anyInt(), any())).thenReturn(List.of(
                place("2", "Food Basics", "44.2410", "-76.5020"),
                place("3", "No Frills", "44.2520", "-76.5301")));

        List<PlaceCandidate> places = placeResolver.resolve("groceries", 10, KINGSTON);

        assertEquals(List.of("1", "2", "3"), places.stream().map(PlaceCandidate::id).toList());
    }

    @Test
    void resolveStopsOnceLimitIsReached() {
        when(nominatimClient.search(eq("market"), anyInt(), any())).thenReturn(List.of(
                place("1", "Metro", "44.2301", "-76.4811"),
                place("2", "Food Basics", "44.2410", "-76.5020"),
                place("3", "No Frills", "44.2520", "-76.5301")));

        List<PlaceCandidate> places = placeResolver.resolve("market", 2, KINGSTON);

        assertEquals(2, places.size());
        verify(nominatimClient).search("market", 2, KINGSTON);
        verify(nominatimClient, never()).search(eq("supermarket"), anyInt(), any());
    }

    @Test
    void placesWithoutIdsCollapseOnLocationAndLabel() {
        NominatimPlace upper = place(null, "METRO", "44.2301", "-76.4811");
        NominatimPlace lower = place(null, "Metro", "44.2301", "-76.4811");
        when(nominatimClient.search(eq("Metro Kingston"), anyInt(), any())).thenReturn(List.of(upper, lower));

        List<PlaceCandidate> places = placeResolver.resolve("Metro Kingston", 10, KINGSTON);

        assertEquals(1, places.size());
        assertEquals("METRO", places.get(0).label());
    }

    @Test
    void candidateShapingUsesAddressDetails() {
        NominatimPlace hit = NominatimPlace.builder()
                .osmId("99")
                .name("Springer Market Square")
                .lat("44.2297")
                .lon("-76.4805")
                .address(NominatimPlace.Address.builder()
                        .houseNumber("216")
                        .road("Ontario Street")
                        .postcode("K7L 2Z3")
                        .build())
                .build();

        PlaceCandidate candidate = placeResolver.toCandidate(hit, "market square").orElseThrow();

        assertEquals("99", candidate.id());
        assertEquals("Springer Market Square", candidate.label());
        assertEquals("216 Ontario Street, K7L 2Z3", candidate.subtitle());
        assertEquals(44.2297, candidate.lat(), 1e-9);
        assertEquals(-76.4805, candidate.lng(), 1e-9);
    }

    @Test
    void labelAndSubtitleFallBackToDisplayName() {
        NominatimPlace hit = NominatimPlace.builder()
                .placeId("7")
                .displayName("Kingston City Hall, 216, Ontario Street, Kingston")
                .lat("44.2297")
                .lon("-76.4805")
                .build();

        PlaceCandidate candidate = placeResolver.toCandidate(hit, "city hall").orElseThrow();

        assertEquals("Kingston City Hall", candidate.label());
        assertEquals("Kingston City Hall, 216", candidate.subtitle());
    }

    @Test
    void bareHitFallsBackToQueryAndRegion() {
        NominatimPlace hit = NominatimPlace.builder().lat("44.23").lon("-76.48").build();

        PlaceCandidate candidate = placeResolver.toCandidate(hit, "somewhere").orElseThrow();

        assertEquals("somewhere", candidate.label());
        assertEquals("Kingston", candidate.subtitle());
    }

    @Test
    void localityIsUsedWhenNothingElseIsKnown() {
        NominatimPlace hit = NominatimPlace.builder()
                .lat("44.23")
                .lon("-76.48")
                .address(NominatimPlace.Address.builder().town("Amherstview").build())
                .build();

        assertEquals("Amherstview", placeResolver.subtitle(hit));
    }

    @Test
    void nonNumericCoordinatesAreSkipped() {
        when(nominatimClient.search("princess", 5, null)).thenReturn(List.of(
                place("1", "Broken", "n/a", "-76.48"),
                place("2", "Good", "44.23", "-76.48")));

        List<PlaceCandidate> places = placeResolver.autocomplete("princess", 5, null);

        assertEquals(1, places.size());
        assertEquals("Good", places.get(0).label());
    }
}
