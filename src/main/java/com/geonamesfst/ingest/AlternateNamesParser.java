package com.geonamesfst.ingest;

import com.geonamesfst.config.Constants;
import com.geonamesfst.entry.EntryStore;
import com.geonamesfst.query.MatchType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * GeoNames alternateNames 文件解析器。
 *
 * 语言不在允许集合内的行、所属记录不在记录库中的行直接跳过；四个标志位按互斥组合映射为命名来源，
 * 其余组合（全部为假或多个为真）一律归为 {@link MatchType.Alternate}。
 */
public final class AlternateNamesParser {
    private static final Logger logger = LoggerFactory.getLogger(AlternateNamesParser.class);

    private AlternateNamesParser() {
    }

    /**
     * 读取全部备选名文件。
     *
     * @param paths 备选名文件
     * @param entryStore 已构建的记录库，用于丢弃无法解析到记录的备选名
     * @param languages 允许的语言集合，为 null 时接受所有语言
     * @return 检索词对
     */
    public static List<TermPair> ingest(List<Path> paths, EntryStore entryStore, Set<String> languages)
            throws IOException {
        List<TermPair> pairs = new ArrayList<>();
        logger.info("读取 {} 个 alternateNames 文件", paths.size());
        for (Path path : paths) {
            try (BufferedReader reader = SourceReaders.open(path)) {
                parse(reader, path.toString(), pairs, entryStore, languages);
            }
        }
        return pairs;
    }

    /**
     * 解析单个数据流。
     *
     * @return 产出的检索词对数量
     */
    public static int parse(BufferedReader reader, String source, List<TermPair> pairs,
                            EntryStore entryStore, Set<String> languages) throws IOException {
        int lineNumber = 0;
        int accepted = 0;
        int skippedLanguage = 0;
        int skippedUnknown = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isEmpty()) {
                continue;
            }
            String[] columns = line.split("\t", -1);

            String lang = GeoNamesParser.required(columns, Constants.ALT_COL_LANGUAGE, "language", source, lineNumber);
            if (languages != null && !languages.contains(lang)) {
                skippedLanguage++;
                continue;
            }

            long id = GeoNamesParser.parseId(
                    GeoNamesParser.required(columns, Constants.ALT_COL_ID, "geoname_id", source, lineNumber),
                    source, lineNumber);
            if (!entryStore.contains(id)) {
                skippedUnknown++;
                continue;
            }

            String name = GeoNamesParser.required(columns, Constants.ALT_COL_NAME, "name", source, lineNumber);
            boolean preferred = flag(columns, Constants.ALT_COL_PREFERRED, "isPreferredName", source, lineNumber);
            boolean shortName = flag(columns, Constants.ALT_COL_SHORT, "isShortName", source, lineNumber);
            boolean colloquial = flag(columns, Constants.ALT_COL_COLLOQUIAL, "isColloquial", source, lineNumber);
            boolean historic = flag(columns, Constants.ALT_COL_HISTORIC, "isHistoric", source, lineNumber);
            String from = orEmpty(GeoNamesParser.column(columns, Constants.ALT_COL_FROM));
            String to = orEmpty(GeoNamesParser.column(columns, Constants.ALT_COL_TO));

            pairs.add(new TermPair(name, classify(id, lang, preferred, shortName, colloquial, historic, from, to)));
            accepted++;
        }
        logger.debug("{}: 接受 {} 条备选名，语言过滤跳过 {} 条，未知记录跳过 {} 条",
                source, accepted, skippedLanguage, skippedUnknown);
        return accepted;
    }

    /**
     * 将四个标志位映射为唯一的命名来源。只有恰好一个标志为真时才得到对应类别，否则为 Alternate。
     */
    public static MatchType classify(long id, String lang, boolean preferred, boolean shortName,
                                     boolean colloquial, boolean historic, String from, String to) {
        int flagCount = (preferred ? 1 : 0) + (shortName ? 1 : 0) + (colloquial ? 1 : 0) + (historic ? 1 : 0);
        if (flagCount != 1) {
            return new MatchType.Alternate(id, lang);
        }
        if (preferred) {
            return new MatchType.PreferredName(id, lang);
        }
        if (shortName) {
            return new MatchType.ShortName(id, lang);
        }
        if (colloquial) {
            return new MatchType.Colloquial(id, lang);
        }
        return new MatchType.Historic(id, lang, orEmpty(from), orEmpty(to));
    }

    private static boolean flag(String[] columns, int index, String columnName, String source, int lineNumber)
            throws GazetteerFormatException {
        return Constants.FLAG_TRUE.equals(GeoNamesParser.required(columns, index, columnName, source, lineNumber));
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
