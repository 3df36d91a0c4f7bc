package com.geonamesfst.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geonamesfst.entry.AdministrativeDivisions;
import com.geonamesfst.entry.GeoNamesEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class MatchTypeTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testOrderByKindThenId() {
        List<MatchType> matches = new ArrayList<>(List.of(
                new MatchType.Alternate(1, "de"),
                new MatchType.Name(9),
                new MatchType.Historic(2, "ger", "", ""),
                new MatchType.AsciiName(3),
                new MatchType.Name(4),
                new MatchType.PreferredName(1, "en")));
        Collections.sort(matches);

        assertEquals(List.of(
                new MatchType.Name(4),
                new MatchType.Name(9),
                new MatchType.AsciiName(3),
                new MatchType.PreferredName(1, "en"),
                new MatchType.Historic(2, "ger", "", ""),
                new MatchType.Alternate(1, "de")), matches);
    }

    @Test
    void testMatchKeyIgnoresTermWhenOrdering() {
        MatchKey zurich = new MatchKey("Zürich", new MatchType.Name(1));
        MatchKey aachen = new MatchKey("Aachen", new MatchType.AsciiName(1));

        assertTrue(zurich.compareTo(aachen) < 0);
        assertEquals(0, new MatchKey("A", new MatchType.Name(1)).compareTo(new MatchKey("B", new MatchType.Name(1))));
    }

    @Test
    void testKindRanks() {
        assertEquals(0, MatchKind.NAME.rank());
        assertEquals(6, MatchKind.ALTERNATE.rank());
        assertEquals(MatchKind.COLLOQUIAL, new MatchType.Colloquial(1, "de").kind());
        assertEquals(MatchKind.SHORT_NAME, new MatchType.ShortName(1, "").kind());
    }

    @Test
    void testJsonCarriesTypeDiscriminator() throws Exception {
        JsonNode node = mapper.valueToTree(new MatchType.PreferredName(1, "de"));

        assertEquals("PreferredName", node.get("type").asText());
        assertEquals(1, node.get("id").asLong());
        assertEquals("de", node.get("lang").asText());
        assertEquals(3, node.size());
    }

    @Test
    void testSearchResultJsonShape() throws Exception {
        GeoNamesEntry entry = new GeoNamesEntry(1, "Frankfurt", 50.1f, 8.6f, "P", "PPLA", "DE",
                new AdministrativeDivisions("05", "064", "06412", ""), null);
        SearchResultWithDistance result = new SearchResultWithDistance("Frankfort", new MatchType.Name(1), entry, 1);

        JsonNode node = mapper.valueToTree(result);

        assertEquals("Frankfort", node.get("key").get("name").asText());
        assertEquals("Name", node.get("key").get("type").asText());
        assertEquals(1, node.get("key").get("id").asLong());
        assertEquals(3, node.get("key").size());
        assertEquals(1, node.get("distance").asInt());
        assertEquals("PPLA", node.get("entry").get("featureCode").asText());
        assertEquals("06412", node.get("entry").get("administrativeDivisions").get("admin3").asText());
        assertTrue(node.get("entry").get("elevation") == null);
    }

    @Test
    void testMatchKeyJsonFlattensHistoricRange() {
        JsonNode node = mapper.valueToTree(new MatchKey("Franckfurt", new MatchType.Historic(1, "ger", "1600", "1800")));

        assertEquals("Franckfurt", node.get("name").asText());
        assertEquals("Historic", node.get("type").asText());
        assertEquals("ger", node.get("lang").asText());
        assertEquals("1600", node.get("from").asText());
        assertTrue(node.get("match") == null);
    }

    @Test
    void testNegativeDistanceRejected() {
        GeoNamesEntry entry = new GeoNamesEntry(1, "Frankfurt", 0f, 0f, "P", "PPLA", "DE",
                AdministrativeDivisions.EMPTY, null);

        assertThrows(IllegalArgumentException.class,
                () -> new SearchResult("Frankfurt", new MatchType.Name(1), entry).withDistance(-1));
    }
}
