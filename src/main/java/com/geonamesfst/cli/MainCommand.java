package com.geonamesfst.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geonamesfst.annotate.AnnotatedEntity;
import com.geonamesfst.annotate.Entity;
import com.geonamesfst.annotate.EntityAnnotator;
import com.geonamesfst.annotate.ResultSelection;
import com.geonamesfst.annotate.SearchMode;
import com.geonamesfst.automaton.StateLimitExceededException;
import com.geonamesfst.config.Constants;
import com.geonamesfst.config.EngineConfig;
import com.geonamesfst.entry.GeoNamesEntry;
import com.geonamesfst.index.IndexStats;
import com.geonamesfst.query.EntryResult;
import com.geonamesfst.query.InvalidQueryException;
import com.geonamesfst.query.MatchType;
import com.geonamesfst.query.QueryEngine;
import com.geonamesfst.query.ResultFilter;
import com.geonamesfst.query.SearchResultWithDistance;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
    name = "geonames-fst",
    description = "🌍 基于 FST 的 GeoNames 地名检索工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.FindSubcommand.class,
        MainCommand.RegexSubcommand.class,
        MainCommand.StartsWithSubcommand.class,
        MainCommand.FuzzySubcommand.class,
        MainCommand.LevenshteinSubcommand.class,
        MainCommand.AnnotateSubcommand.class,
        MainCommand.StatsSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_BUILD_FAILURE = 1;
    static final int EXIT_INVALID_QUERY = 2;
    static final int EXIT_LIMIT_EXCEEDED = 3;

    @Option(names = {"-g", "--geonames"}, description = "GeoNames 主数据文件（可指定多个）", split = ",")
    private List<Path> geonamesPaths;

    @Option(names = {"-a", "--alternate"}, description = "alternateNames 备选名文件（可指定多个）", split = ",")
    private List<Path> alternatePaths;

    @Option(names = {"-l", "--languages"}, description = "保留的备选名语言，逗号分隔，空串表示无语言码",
            defaultValue = ",de,ger")
    private String languages;

    @Option(names = {"--all-languages"}, description = "保留所有语言的备选名")
    private boolean allLanguages;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🌍 基于 FST 的 GeoNames 地名检索工具");
        System.out.println("使用 --help 查看帮助信息");
        return EXIT_OK;
    }

    EngineConfig buildConfig() {
        EngineConfig config = EngineConfig.defaults();
        config.setGeonamesPaths(geonamesPaths);
        config.setAlternatePaths(alternatePaths);
        config.setLanguages(allLanguages ? null : parseLanguages(languages));
        return config;
    }

    QueryEngine buildEngine() throws IOException {
        EngineConfig config = buildConfig();
        if (config.getGeonamesPaths().isEmpty()) {
            System.err.println("⚠️ 未指定 --geonames 数据文件，索引为空");
        }
        return QueryEngine.build(config);
    }

    /**
     * ",de,ger" 解析为 {"", "de", "ger"}，保留空语言码。
     */
    static Set<String> parseLanguages(String rawLanguages) {
        if (rawLanguages == null) {
            return Constants.DEFAULT_ALTERNATE_LANGUAGES;
        }
        return new HashSet<>(Arrays.asList(rawLanguages.split(",", -1)));
    }

    static int sanitizeLimit(int rawLimit) {
        if (rawLimit < 0) {
            System.err.printf("⚠️ limit=%d 非法，已使用 0%n", rawLimit);
            return 0;
        }
        if (rawLimit > Constants.MAX_RESULT_LIMIT) {
            System.err.printf("⚠️ limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_RESULT_LIMIT);
            return Constants.MAX_RESULT_LIMIT;
        }
        return rawLimit;
    }

    static ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    /**
     * 单行文本格式：序号、命中检索词、命名来源、记录摘要，带距离时追加距离。
     */
    static String formatResult(int rank, EntryResult result) {
        GeoNamesEntry entry = result.entry();
        MatchType match = result.key().match();
        StringBuilder line = new StringBuilder();
        line.append(rank).append(". ").append(result.key().name())
            .append(" [").append(match.getClass().getSimpleName()).append("]")
            .append(" → #").append(entry.id()).append(' ').append(entry.name())
            .append(" (").append(entry.featureClass()).append('.').append(entry.featureCode())
            .append(", ").append(entry.countryCode()).append(')')
            .append(String.format(Locale.ROOT, " %.4f,%.4f", entry.latitude(), entry.longitude()));
        if (result instanceof SearchResultWithDistance withDistance) {
            line.append(" d=").append(withDistance.distance());
        }
        return line.toString();
    }

    static class FilterOptions {
        @Option(names = {"--feature-class"}, description = "按 feature class 过滤（如 P）")
        String featureClass;

        @Option(names = {"--feature-code"}, description = "按 feature code 过滤（如 PPLA）")
        String featureCode;

        @Option(names = {"--country-code"}, description = "按国家代码过滤（如 DE）")
        String countryCode;

        ResultFilter toFilter() {
            return new ResultFilter(featureClass, featureCode, countryCode);
        }
    }

    /**
     * 查询类子命令的公共流程：构建索引、执行查询、过滤、截断并输出，按错误类别映射退出码。
     */
    abstract static class QuerySubcommand implements Callable<Integer> {

        @Mixin
        FilterOptions filterOptions = new FilterOptions();

        @Option(names = {"-n", "--limit"}, description = "返回结果数量限制", defaultValue = "10")
        int limit = 10;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        String format = "text";

        @ParentCommand
        MainCommand main;

        protected abstract String describe();

        protected abstract List<? extends EntryResult> query(QueryEngine engine);

        @Override
        public Integer call() {
            QueryEngine engine;
            try {
                engine = main.buildEngine();
            } catch (IOException exception) {
                System.err.println("❌ 索引构建失败: " + exception.getMessage());
                return EXIT_BUILD_FAILURE;
            }
            try {
                long start = System.currentTimeMillis();
                List<? extends EntryResult> results = ResultFilter.apply(query(engine), filterOptions.toFilter());
                long elapsed = System.currentTimeMillis() - start;
                List<? extends EntryResult> shown = results.subList(0, Math.min(sanitizeLimit(limit), results.size()));

                if ("json".equalsIgnoreCase(format)) {
                    printJson(shown);
                } else {
                    System.out.println("🔍 " + describe());
                    System.out.println();
                    printText(shown);
                    System.out.println();
                    System.out.println("📊 共 " + results.size() + " 条匹配，用时 " + elapsed + "ms");
                }
                return EXIT_OK;
            } catch (InvalidQueryException exception) {
                System.err.println("❌ 查询无效: " + exception.getMessage());
                return EXIT_INVALID_QUERY;
            } catch (StateLimitExceededException exception) {
                System.err.println("❌ 超出状态上限 " + exception.getLimit() + ": " + exception.getMessage());
                return EXIT_LIMIT_EXCEEDED;
            } catch (IOException exception) {
                System.err.println("❌ 输出失败: " + exception.getMessage());
                return EXIT_BUILD_FAILURE;
            }
        }

        void printText(List<? extends EntryResult> results) {
            if (results.isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }
            int rank = 1;
            for (EntryResult result : results) {
                System.out.println(formatResult(rank++, result));
            }
        }

        void printJson(List<? extends EntryResult> results) throws IOException {
            System.out.println(objectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(results));
        }
    }

    @Command(name = "find", description = "🎯 精确查询")
    static class FindSubcommand extends QuerySubcommand {

        @Parameters(description = "检索词", arity = "1")
        String term;

        @Override
        protected String describe() {
            return "精确查询: \"" + term + "\"";
        }

        @Override
        protected List<? extends EntryResult> query(QueryEngine engine) {
            return engine.find(term);
        }
    }

    @Command(name = "regex", description = "🧩 正则表达式查询（^ 锚定开头，匹配总是延伸到词尾）")
    static class RegexSubcommand extends QuerySubcommand {

        @Parameters(description = "正则表达式", arity = "1")
        String pattern;

        @Override
        protected String describe() {
            return "正则查询: /" + pattern + "/";
        }

        @Override
        protected List<? extends EntryResult> query(QueryEngine engine) {
            return engine.regex(pattern);
        }
    }

    @Command(name = "starts-with", description = "🔤 前缀查询")
    static class StartsWithSubcommand extends QuerySubcommand {

        @Parameters(description = "前缀", arity = "1")
        String prefix;

        @Option(names = {"--max-dist"}, description = "最大编辑距离，0 或不指定表示不过滤")
        Integer maxDistance;

        @Override
        protected String describe() {
            return "前缀查询: \"" + prefix + "\"";
        }

        @Override
        protected List<? extends EntryResult> query(QueryEngine engine) {
            return engine.startsWith(prefix, maxDistance);
        }
    }

    @Command(name = "fuzzy", description = "🌫️ 子序列模糊查询")
    static class FuzzySubcommand extends QuerySubcommand {

        @Parameters(description = "查询文本", arity = "1")
        String text;

        @Option(names = {"--max-dist"}, description = "最大编辑距离，0 或不指定表示不过滤")
        Integer maxDistance;

        @Override
        protected String describe() {
            return "模糊查询: \"" + text + "\"";
        }

        @Override
        protected List<? extends EntryResult> query(QueryEngine engine) {
            return engine.fuzzy(text, maxDistance);
        }
    }

    @Command(name = "levenshtein", description = "📏 编辑距离查询")
    static class LevenshteinSubcommand extends QuerySubcommand {

        @Parameters(description = "查询文本", arity = "1")
        String text;

        @Option(names = {"--max-dist"}, description = "最大编辑距离（默认 1）")
        Integer maxDistance;

        @Option(names = {"--state-limit"}, description = "自动机状态数上限（默认 10000）")
        Integer stateLimit;

        @Override
        protected String describe() {
            return "编辑距离查询: \"" + text + "\"";
        }

        @Override
        protected List<? extends EntryResult> query(QueryEngine engine) {
            return engine.levenshtein(text, maxDistance, stateLimit);
        }
    }

    @Command(name = "annotate", description = "🏷️ 批量标注 JSON 实体文件，输出 JSON")
    static class AnnotateSubcommand implements Callable<Integer> {

        @Parameters(description = "实体文件（[{\"reference\":1,\"text\":\"Frankfurt\"}, ...]）", arity = "1")
        Path entitiesFile;

        @Option(names = {"--mode"}, description = "查询方式 (find|starts-with|fuzzy|levenshtein)",
                defaultValue = "find")
        String mode = "find";

        @Option(names = {"--select"}, description = "结果选择 (first|all)", defaultValue = "first")
        String select = "first";

        @Option(names = {"--max-dist"}, description = "最大编辑距离")
        Integer maxDistance;

        @Option(names = {"--state-limit"}, description = "Levenshtein 自动机状态数上限")
        Integer stateLimit;

        @Mixin
        FilterOptions filterOptions = new FilterOptions();

        @ParentCommand
        MainCommand main;

        @Override
        public Integer call() {
            SearchMode searchMode;
            ResultSelection selection;
            try {
                searchMode = toSearchMode(mode, maxDistance, stateLimit, filterOptions.toFilter());
                selection = ResultSelection.parse(select);
            } catch (IllegalArgumentException exception) {
                System.err.println("❌ 参数无效: " + exception.getMessage());
                return EXIT_INVALID_QUERY;
            }

            ObjectMapper mapper = objectMapper();
            try {
                List<Entity> entities = mapper.readValue(entitiesFile.toFile(), new TypeReference<List<Entity>>() {
                });
                QueryEngine engine = main.buildEngine();
                List<AnnotatedEntity> annotated = new EntityAnnotator(engine).annotate(entities, searchMode, selection);
                System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(annotated));
                return EXIT_OK;
            } catch (IOException exception) {
                System.err.println("❌ 标注失败: " + exception.getMessage());
                return EXIT_BUILD_FAILURE;
            }
        }

        static SearchMode toSearchMode(String mode, Integer maxDistance, Integer stateLimit, ResultFilter filter) {
            switch (mode.toLowerCase(Locale.ROOT)) {
                case "find":
                    return new SearchMode.Find(filter);
                case "starts-with":
                    return new SearchMode.StartsWith(maxDistance, filter);
                case "fuzzy":
                    return new SearchMode.Fuzzy(maxDistance, filter);
                case "levenshtein":
                    return new SearchMode.Levenshtein(maxDistance, stateLimit, filter);
                default:
                    throw new IllegalArgumentException("未知查询方式: " + mode);
            }
        }
    }

    @Command(name = "stats", description = "📊 查看索引统计信息")
    static class StatsSubcommand implements Callable<Integer> {

        @ParentCommand
        MainCommand main;

        @Override
        public Integer call() {
            try {
                IndexStats stats = main.buildEngine().stats();
                System.out.println("📊 索引统计");
                System.out.println("═══════════");
                System.out.println("📄 记录数: " + stats.recordCount());
                System.out.println("🔗 检索词对: " + stats.pairCount());
                System.out.println("🔤 唯一检索词: " + stats.termCount());
                System.out.println("💾 FST 大小: " + formatBytes(stats.fstBytes()));
                return EXIT_OK;
            } catch (IOException exception) {
                System.err.println("❌ 索引构建失败: " + exception.getMessage());
                return EXIT_BUILD_FAILURE;
            }
        }

        static String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format(Locale.ROOT, "%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format(Locale.ROOT, "%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format(Locale.ROOT, "%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }
}
