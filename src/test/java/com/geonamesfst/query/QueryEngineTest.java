package com.geonamesfst.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.geonamesfst.GazetteerFixtures;
import com.geonamesfst.automaton.PrefixAutomaton;
import com.geonamesfst.automaton.StateLimitExceededException;
import com.geonamesfst.index.IndexStats;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class QueryEngineTest {

    @TempDir
    Path tempDir;

    private QueryEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        engine = GazetteerFixtures.buildEngine(tempDir);
    }

    @Test
    @DisplayName("find: 主名称精确命中")
    void testFindReturnsSingleNameMatch() {
        List<SearchResult> results = engine.find("Frankfurt");

        assertEquals(1, results.size());
        assertEquals(new MatchType.Name(1), results.get(0).key().match());
        assertEquals("Frankfurt", results.get(0).key().name());
        assertEquals("DE", results.get(0).entry().countryCode());
    }

    @Test
    @DisplayName("find: 按导入顺序展开分组")
    void testFindExpandsGroupInImportOrder() {
        List<SearchResult> results = engine.find("Köln");

        assertEquals(List.of(new MatchType.Name(3), new MatchType.Alternate(3, "de")), matches(results));
    }

    @Test
    void testFindAlternateName() {
        List<SearchResult> results = engine.find("Frankfurt am Main");

        assertEquals(List.of(new MatchType.PreferredName(1, "de")), matches(results));
        assertEquals("Frankfurt", results.get(0).entry().name());
    }

    @Test
    void testFindMissingTermReturnsEmpty() {
        assertTrue(engine.find("Berlin").isEmpty());
        assertTrue(engine.find("Frankfur").isEmpty());
        // en 不在默认语言集合中
        assertTrue(engine.find("Cologne").isEmpty());
        assertTrue(engine.find("Nirgendwo").isEmpty());
    }

    @Test
    @DisplayName("startsWith: 距离优先排序")
    void testStartsWithRanksByDistanceThenKey() {
        List<SearchResultWithDistance> results = engine.startsWith("Frank", null);

        assertEquals(List.of(
                new MatchType.Name(1),
                new MatchType.Name(5),
                new MatchType.Colloquial(5, "de"),
                new MatchType.Name(2),
                new MatchType.PreferredName(1, "de")), matches(results));
        assertEquals(List.of(4, 4, 7, 11, 12), distances(results));
    }

    @Test
    void testStartsWithZeroDistanceMeansNoFilter() {
        assertEquals(engine.startsWith("Frank", null), engine.startsWith("Frank", 0));
    }

    @Test
    void testStartsWithDistanceFilter() {
        List<SearchResultWithDistance> results = engine.startsWith("Frank", 4);

        assertEquals(List.of(new MatchType.Name(1), new MatchType.Name(5)), matches(results));
    }

    @Test
    @DisplayName("fuzzy: Frnkfrt 命中 Frankfurt，距离 2")
    void testFuzzySubsequence() {
        List<SearchResultWithDistance> results = engine.fuzzy("Frnkfrt", null);

        assertEquals("Frankfurt", results.get(0).key().name());
        assertEquals(2, results.get(0).distance());
        assertEquals(List.of(
                new MatchType.Name(1),
                new MatchType.Name(5),
                new MatchType.Historic(1, "ger", "1600", "1800"),
                new MatchType.Colloquial(5, "de"),
                new MatchType.Name(2),
                new MatchType.PreferredName(1, "de")), matches(results));
    }

    @Test
    void testFuzzyDistanceFilter() {
        List<SearchResultWithDistance> results = engine.fuzzy("Frnkfrt", 2);

        assertEquals(List.of("Frankfurt", "Frankfort"), names(results));
    }

    @Test
    @DisplayName("levenshtein: 默认距离 1")
    void testLevenshteinDefaultDistance() {
        List<SearchResultWithDistance> results = engine.levenshtein("Frankfurt", null, null);

        assertEquals(List.of(
                new MatchType.Name(1),
                new MatchType.Name(5),
                new MatchType.Historic(1, "ger", "1600", "1800")), matches(results));
        assertEquals(List.of(0, 1, 1), distances(results));
    }

    @Test
    void testLevenshteinAcrossUmlaut() {
        List<SearchResultWithDistance> results = engine.levenshtein("Koln", 1, null);

        assertEquals(List.of(
                new MatchType.AsciiName(3),
                new MatchType.Name(3),
                new MatchType.Alternate(3, "de")), matches(results));
        assertEquals(List.of(0, 1, 1), distances(results));
    }

    @Test
    void testLevenshteinZeroDistanceIsExact() {
        List<SearchResultWithDistance> results = engine.levenshtein("Frankfurt", 0, null);

        assertEquals(List.of(new MatchType.Name(1)), matches(results));
    }

    @Test
    @DisplayName("levenshtein: 超出状态上限")
    void testLevenshteinStateLimitExceeded() {
        StateLimitExceededException exception = assertThrows(StateLimitExceededException.class,
                () -> engine.levenshtein("Frankfurt", 2, 3));

        assertEquals(3, exception.getLimit());
    }

    @Test
    void testLevenshteinNegativeDistanceRejected() {
        assertThrows(InvalidQueryException.class, () -> engine.levenshtein("Frankfurt", -1, null));
    }

    @Test
    @DisplayName("前缀与子序列查询拒绝负距离")
    void testNegativeDistanceRejectedByEveryDistanceQuery() {
        assertThrows(InvalidQueryException.class, () -> engine.startsWith("Frank", -1));
        assertThrows(InvalidQueryException.class, () -> engine.fuzzy("Frnkfrt", -1));
        assertThrows(InvalidQueryException.class,
                () -> engine.searchWithDistance(new PrefixAutomaton("Frank"), "Frank", -2));
    }

    @Test
    @DisplayName("距离过滤单调")
    void testDistanceFilterIsMonotonic() {
        for (int distance = 1; distance < 6; distance++) {
            List<SearchResultWithDistance> narrow = engine.fuzzy("Frnkfrt", distance);
            List<SearchResultWithDistance> wide = engine.fuzzy("Frnkfrt", distance + 1);
            assertTrue(wide.containsAll(narrow));
        }
    }

    @Test
    void testRegexUnanchored() {
        List<SearchResult> results = engine.regex("furt");

        assertEquals(List.of(new MatchType.Name(1), new MatchType.Historic(1, "ger", "1600", "1800")),
                matches(results));
    }

    @Test
    void testRegexAnchored() {
        List<SearchResult> results = engine.regex("^Frankfurt.*");

        assertEquals(List.of(
                new MatchType.Name(1),
                new MatchType.Name(2),
                new MatchType.PreferredName(1, "de")), matches(results));
        assertTrue(engine.regex("^furt").isEmpty());
    }

    @Test
    void testRegexRankedByKey() {
        List<SearchResult> results = engine.regex("^M.nchen");

        assertEquals(List.of(new MatchType.Name(4), new MatchType.AsciiName(4)), matches(results));
    }

    @Test
    @DisplayName("regex: 锚点只作用于所在的顶层分支")
    void testRegexAnchorsPerAlternative() {
        assertEquals(List.of(
                new MatchType.Name(3),
                new MatchType.ShortName(4, ""),
                new MatchType.Alternate(3, "de")), matches(engine.regex("^Köln|nich")));
        assertEquals(List.of(new MatchType.Name(1), new MatchType.ShortName(4, "")),
                matches(engine.regex("Frankfurt$|nich")));
    }

    @Test
    void testRegexMisplacedAnchorIsClientError() {
        InvalidQueryException exception = assertThrows(InvalidQueryException.class,
                () -> engine.regex("Frank^furt"));

        assertEquals("Frank^furt", exception.getQuery());
        assertTrue(exception.getMessage().startsWith("Invalid regex"));
    }

    @Test
    void testInvalidRegexIsClientError() {
        InvalidQueryException exception = assertThrows(InvalidQueryException.class, () -> engine.regex("Frank("));

        assertEquals("Frank(", exception.getQuery());
    }

    @Test
    @DisplayName("五种查询均拒绝空查询")
    void testEmptyQueryRejectedByEveryOperation() {
        List<Consumer<String>> operations = List.of(
                engine::find,
                engine::regex,
                query -> engine.startsWith(query, null),
                query -> engine.fuzzy(query, null),
                query -> engine.levenshtein(query, null, null));

        for (Consumer<String> operation : operations) {
            InvalidQueryException exception = assertThrows(InvalidQueryException.class, () -> operation.accept(""));
            assertEquals("Empty query", exception.getMessage());
            assertThrows(InvalidQueryException.class, () -> operation.accept(null));
        }
    }

    @Test
    void testOverlongQueryRejected() {
        String query = "a".repeat(513);

        assertThrows(InvalidQueryException.class, () -> engine.find(query));
    }

    @Test
    void testRankingIsIdempotent() {
        List<SearchResultWithDistance> results = engine.fuzzy("Frnkfrt", null);
        List<SearchResultWithDistance> resorted = new ArrayList<>(results);
        resorted.sort(SearchResultWithDistance.RANKING);

        assertEquals(results, resorted);
    }

    @Test
    void testEveryResultResolvesToStoredEntry() {
        List<SearchResult> results = engine.regex(".*");

        assertEquals(12, results.size());
        for (SearchResult result : results) {
            assertEquals(result.key().match().id(), result.entry().id());
            assertTrue(engine.getEntryStore().contains(result.entry().id()));
        }
    }

    @Test
    void testStats() {
        IndexStats stats = engine.stats();

        assertEquals(5, stats.recordCount());
        assertEquals(12, stats.pairCount());
        assertEquals(11, stats.termCount());
        assertTrue(stats.fstBytes() > 0);
    }

    @Test
    void testAllLanguages() throws IOException {
        Path directory = tempDir.resolve("all");
        Files.createDirectories(directory);
        QueryEngine allLanguages = QueryEngine.build(List.of(GazetteerFixtures.writeGeonames(directory)),
                List.of(GazetteerFixtures.writeAlternates(directory)), null);

        assertEquals(List.of(new MatchType.PreferredName(3, "en")), matches(allLanguages.find("Cologne")));
    }

    @Test
    void testEmptyIndex() throws IOException {
        QueryEngine empty = QueryEngine.build(List.of(), List.of(), null);

        assertTrue(empty.find("Frankfurt").isEmpty());
        assertTrue(empty.fuzzy("Frankfurt", null).isEmpty());
        assertEquals(0, empty.stats().termCount());
    }

    private static List<MatchType> matches(List<? extends EntryResult> results) {
        return results.stream().map(result -> result.key().match()).collect(Collectors.toList());
    }

    private static List<String> names(List<? extends EntryResult> results) {
        return results.stream().map(result -> result.key().name()).collect(Collectors.toList());
    }

    private static List<Integer> distances(List<SearchResultWithDistance> results) {
        return results.stream().map(SearchResultWithDistance::distance).collect(Collectors.toList());
    }
}
