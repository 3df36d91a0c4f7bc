package com.geonamesfst.ingest;

import com.geonamesfst.config.Constants;
import com.geonamesfst.entry.AdministrativeDivisions;
import com.geonamesfst.entry.EntryStore;
import com.geonamesfst.entry.GeoNamesEntry;
import com.geonamesfst.query.MatchType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * GeoNames 主数据（allCountries.txt 等）解析器。
 *
 * 每行以 TAB 分隔，不做引号处理。标识、名称和 ASCII 名称为必填列，缺失或标识无法解析时整个导入失败；
 * 其余列宽松解析：坐标解析失败记为 NaN，要素与国家列缺失记为 {@code <missing>}，行政区划缺失记为空串。
 */
public final class GeoNamesParser {
    private static final Logger logger = LoggerFactory.getLogger(GeoNamesParser.class);

    private GeoNamesParser() {
    }

    /**
     * 读取全部主数据文件，生成检索词对并填充记录库。
     */
    public static PrimaryIngestResult ingest(List<Path> paths) throws IOException {
        List<TermPair> pairs = new ArrayList<>();
        EntryStore.Builder storeBuilder = EntryStore.builder();
        logger.info("读取 {} 个 GeoNames 文件", paths.size());
        for (Path path : paths) {
            try (BufferedReader reader = SourceReaders.open(path)) {
                parse(reader, path.toString(), pairs, storeBuilder);
            }
        }
        logger.info("读取 {} 条 GeoNames 记录，{} 个检索词", storeBuilder.size(), pairs.size());
        return new PrimaryIngestResult(pairs, storeBuilder.build());
    }

    /**
     * 解析单个数据流。
     *
     * @param reader 数据流
     * @param source 数据源名称，仅用于错误信息
     * @param pairs 检索词对输出
     * @param storeBuilder 记录库构建器
     * @return 解析的行数
     */
    public static int parse(BufferedReader reader, String source, List<TermPair> pairs,
                            EntryStore.Builder storeBuilder) throws IOException {
        int lineNumber = 0;
        int rows = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isEmpty()) {
                continue;
            }
            String[] columns = line.split("\t", -1);
            GeoNamesEntry entry = parseRow(columns, source, lineNumber);
            String asciiName = columns[Constants.GN_COL_ASCII_NAME];

            if (!asciiName.equals(entry.name())) {
                pairs.add(new TermPair(asciiName, new MatchType.AsciiName(entry.id())));
            }
            pairs.add(new TermPair(entry.name(), new MatchType.Name(entry.id())));
            storeBuilder.put(entry);
            rows++;
        }
        return rows;
    }

    static GeoNamesEntry parseRow(String[] columns, String source, int lineNumber) throws GazetteerFormatException {
        long id = parseId(required(columns, Constants.GN_COL_ID, "geoname_id", source, lineNumber), source, lineNumber);
        String name = required(columns, Constants.GN_COL_NAME, "name", source, lineNumber);
        required(columns, Constants.GN_COL_ASCII_NAME, "ascii name", source, lineNumber);

        float latitude = parseFloatOrNaN(column(columns, Constants.GN_COL_LATITUDE));
        float longitude = parseFloatOrNaN(column(columns, Constants.GN_COL_LONGITUDE));
        String featureClass = orDefault(column(columns, Constants.GN_COL_FEATURE_CLASS), Constants.MISSING_VALUE);
        String featureCode = orDefault(column(columns, Constants.GN_COL_FEATURE_CODE), Constants.MISSING_VALUE);
        String countryCode = orDefault(column(columns, Constants.GN_COL_COUNTRY_CODE), Constants.MISSING_VALUE);
        int adminColumn = Constants.GN_COL_ADMIN_FIRST;
        AdministrativeDivisions divisions = new AdministrativeDivisions(
                column(columns, adminColumn),
                column(columns, adminColumn + 1),
                column(columns, adminColumn + 2),
                column(columns, adminColumn + 3));
        Short elevation = parseShortOrNull(column(columns, Constants.GN_COL_ELEVATION));

        return new GeoNamesEntry(id, name, latitude, longitude, featureClass, featureCode, countryCode,
                divisions, elevation);
    }

    static String column(String[] columns, int index) {
        return index < columns.length ? columns[index] : null;
    }

    static String required(String[] columns, int index, String columnName, String source, int lineNumber)
            throws GazetteerFormatException {
        String value = column(columns, index);
        if (value == null) {
            throw new GazetteerFormatException("缺少必填列 " + columnName + "（第 " + index + " 列）", source, lineNumber);
        }
        return value;
    }

    static long parseId(String raw, String source, int lineNumber) throws GazetteerFormatException {
        try {
            long id = Long.parseLong(raw);
            if (id < 0) {
                throw new GazetteerFormatException("geoname_id 不能为负数: " + raw, source, lineNumber);
            }
            return id;
        } catch (NumberFormatException exception) {
            throw new GazetteerFormatException("geoname_id 不是合法整数: '" + raw + "'", source, lineNumber, exception);
        }
    }

    /**
     * 宽松解析浮点数，缺失或非数字返回 NaN。
     */
    static float parseFloatOrNaN(String raw) {
        if (raw == null) {
            return Float.NaN;
        }
        try {
            return Float.parseFloat(raw.trim());
        } catch (NumberFormatException exception) {
            return Float.NaN;
        }
    }

    static Short parseShortOrNull(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            return Short.parseShort(raw);
        } catch (NumberFormatException exception) {
            return null;
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
