package com.ngramindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ngramindex.config.Constants;
import com.ngramindex.config.IndexConfig;
import com.ngramindex.index.AttributeIndex;
import com.ngramindex.index.Index;
import com.ngramindex.index.IndexStatus;
import com.ngramindex.query.CountResult;
import com.ngramindex.query.NgramQueryException;
import com.ngramindex.query.QueryEngine;
import com.ngramindex.text.Attribute;
import com.ngramindex.text.MosesCorpusReader;
import com.ngramindex.text.Sentence;
import com.ngramindex.text.Token;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(
    name = "ngram-index",
    description = "📚 基于后缀数组的语料 n-gram 索引",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.IndexSubcommand.class,
        MainCommand.CountSubcommand.class,
        MainCommand.StatusSubcommand.class,
        MainCommand.DumpSubcommand.class,
        MainCommand.FuseSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    private static final Map<String, String> ESCAPES = Map.of(
        "$", "${dollar}",
        "|", "${pipe}",
        "#", "${hash}",
        "<", "${lt}",
        ">", "${gt}",
        " ", "${space}",
        "\t", "${tab}",
        "\n", "${newline}"
    );

    @Option(names = {"-i", "--index"}, description = "索引路径前缀（如 ./index/corpus）", defaultValue = "./index/corpus")
    private Path basePath;

    @Option(names = {"--threads"}, description = "后缀序构建线程数", defaultValue = "4")
    private int threads;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("📚 基于后缀数组的语料 n-gram 索引");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private int resolveThreadCount() {
        if (threads <= 0) {
            System.err.printf("⚠️ 非法线程数 %d，已回退为默认值 %d%n", threads, Constants.DEFAULT_BUILD_THREADS);
            return Math.min(Constants.DEFAULT_BUILD_THREADS, Constants.MAX_BUILD_THREADS);
        }
        if (threads > Constants.MAX_BUILD_THREADS) {
            System.err.printf("⚠️ 线程数 %d 超过安全上限 %d，已自动限制%n", threads, Constants.MAX_BUILD_THREADS);
            return Constants.MAX_BUILD_THREADS;
        }
        return threads;
    }

    static String escapeFactor(String value) {
        StringBuilder builder = new StringBuilder(value.length());
        for (int offset = 0; offset < value.length(); offset++) {
            String character = String.valueOf(value.charAt(offset));
            builder.append(ESCAPES.getOrDefault(character, character));
        }
        return builder.toString();
    }

    @Command(name = "index", description = "📂 从 Moses 因子化文本构建索引")
    static class IndexSubcommand implements Callable<Integer> {

        @Parameters(description = "语料文件路径", arity = "1..*")
        private List<Path> corpusFiles;

        @Option(names = {"-a", "--attributes"}, description = "以冒号分隔的属性列表", defaultValue = "surface:lemma:pos:syn")
        private String attributes;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            System.out.println("🚀 开始索引...");
            System.out.println("📁 索引前缀: " + main.basePath);
            System.out.println("📂 语料文件: " + corpusFiles);
            int effectiveThreads = main.resolveThreadCount();
            System.out.println("🔧 线程数: " + effectiveThreads);

            try {
                IndexConfig config = IndexConfig.defaults();
                config.setBasePath(main.basePath);
                config.setAttributes(Index.parseAttributes(attributes));
                config.setBuildThreads(effectiveThreads);
                Index index = Index.create(config);

                long start = System.currentTimeMillis();
                MosesCorpusReader reader = new MosesCorpusReader();
                for (Path corpusFile : corpusFiles) {
                    try (BufferedReader input = Files.newBufferedReader(corpusFile, StandardCharsets.UTF_8)) {
                        int sentences = reader.read(input, index::appendSentence);
                        System.out.println("   📄 " + corpusFile + ": " + sentences + " 个句子");
                    }
                }
                index.buildSuffixArrays(config.effectiveBuildThreads());
                index.saveMain();
                long elapsed = System.currentTimeMillis() - start;

                System.out.println("✅ 索引完成！");
                System.out.println("📊 统计:");
                System.out.println("   句子数: " + index.getSentenceCount());
                System.out.println("   词元数: " + index.getCorpusSize());
                System.out.println("   用时: " + elapsed + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 索引失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "count", description = "🔎 统计 n-gram 出现次数")
    static class CountSubcommand implements Callable<Integer> {

        @Parameters(description = "查询，如 \"lemma: take place\"", arity = "1")
        private String query;

        @Option(names = {"-l", "--limit"}, description = "最多列出的位置数", defaultValue = "10")
        private int limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                Index index = Index.open(main.basePath);
                CountResult result = new QueryEngine(index).count(query, Math.max(0, limit));

                if ("json".equalsIgnoreCase(format)) {
                    ObjectMapper mapper = new ObjectMapper();
                    System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
                    return 0;
                }
                System.out.println("🔍 查询: \"" + query + "\" (属性 " + result.attribute() + ")");
                if (!result.found()) {
                    System.out.println("⚠️ 未找到匹配结果");
                } else {
                    System.out.println("📍 位置: " + result.positions()
                        + (result.count() > result.positions().size() ? " ..." : ""));
                }
                System.out.println("📊 共 " + result.count() + " 次出现，用时 " + result.elapsedMs() + "ms");
                return 0;
            } catch (NgramQueryException exception) {
                System.err.println("❌ 查询语法错误: " + exception.getMessage());
                System.err.println("💡 " + exception.getSuggestion());
                return 2;
            } catch (Exception exception) {
                System.err.println("❌ 查询失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "status", description = "📊 查看索引统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                IndexStatus status = Index.open(main.basePath).status();

                System.out.println("📊 索引状态");
                System.out.println("═══════════");
                System.out.println("📁 索引前缀: " + main.basePath);
                System.out.println("📄 句子数: " + status.sentenceCount());
                System.out.println("🔤 词元数: " + status.corpusSize());
                System.out.println("🏷️ 属性: " + String.join(", ", status.attributes()));
                System.out.println("💾 索引大小: " + formatBytes(status.indexSizeBytes()));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }

        static String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }

    @Command(name = "dump", description = "📜 从索引还原语料并以 Moses 格式输出")
    static class DumpSubcommand implements Callable<Integer> {

        @Option(names = {"-n", "--max-sentences"}, description = "最多输出的句子数，0 表示全部", defaultValue = "0")
        private int maxSentences;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                Index index = Index.open(main.basePath);
                index.loadMain();
                int written = 0;
                for (Sentence sentence : index.iterateSentences()) {
                    if (maxSentences > 0 && written >= maxSentences) {
                        break;
                    }
                    System.out.println(toMosesLine(sentence, index.getAttributes()));
                    written++;
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 导出失败: " + exception.getMessage());
                return 1;
            }
        }

        static String toMosesLine(Sentence sentence, List<Attribute> attributes) {
            return sentence.tokens().stream()
                .map(token -> toMosesWord(token, attributes))
                .collect(Collectors.joining(" "));
        }

        private static String toMosesWord(Token token, List<Attribute> attributes) {
            return Arrays.stream(Attribute.values())
                .map(attribute -> attributes.contains(attribute) ? escapeFactor(token.get(attribute)) : "")
                .collect(Collectors.joining("|"))
                .replaceAll("\\|+$", "");
        }
    }

    @Command(name = "fuse", description = "🔗 生成并保存复合属性（如 lemma+pos）")
    static class FuseSubcommand implements Callable<Integer> {

        @Parameters(description = "复合属性名", arity = "1")
        private String attribute;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            if (!attribute.contains(Constants.COMPOSITE_SEPARATOR)) {
                System.err.println("❌ 不是复合属性: " + attribute);
                return 2;
            }
            try {
                Index index = Index.open(main.basePath);
                long start = System.currentTimeMillis();
                AttributeIndex fused = index.load(attribute);
                long elapsed = System.currentTimeMillis() - start;
                System.out.println("✅ 复合属性 " + fused.name() + " 已就绪: "
                    + fused.symbols().size() + " 个符号，用时 " + elapsed + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 拼接失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
