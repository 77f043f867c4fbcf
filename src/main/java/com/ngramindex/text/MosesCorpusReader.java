package com.ngramindex.text;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Moses 因子化文本读取器。
 *
 * 每行一个句子，词元以空白分隔，词元内部按 surface|lemma|pos|syn 顺序以 "|" 分隔因子，
 * 缺失的尾部因子视为空串。以 "#" 开头的行为注释；空行表示空句子。
 * 因子中的特殊字符以 ${name} 形式转义；${newline} 可被解码，但符号表不接受换行，含换行的因子按行报错。
 */
public class MosesCorpusReader implements CorpusReader {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String FACTOR_SEPARATOR = "|";
    private static final String COMMENT_PREFIX = "#";
    private static final int MAX_FACTORS = 4;

    private static final Map<String, String> ESCAPES = Map.of(
        "dollar", "$",
        "pipe", "|",
        "hash", "#",
        "lt", "<",
        "gt", ">",
        "space", " ",
        "tab", "\t",
        "newline", "\n"
    );

    @Override
    public int read(BufferedReader input, Consumer<Sentence> consumer) throws IOException {
        int sentenceId = 0;
        int lineNumber = 0;
        String line;
        while ((line = input.readLine()) != null) {
            lineNumber++;
            if (line.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            sentenceId++;
            consumer.accept(new Sentence(sentenceId, parseLine(line, lineNumber)));
        }
        return sentenceId;
    }

    /**
     * 解析一行句子文本。
     */
    List<Token> parseLine(String line, int lineNumber) throws IOException {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        String[] words = WHITESPACE.split(trimmed);
        List<Token> tokens = new ArrayList<>(words.length);
        for (String word : words) {
            tokens.add(parseToken(word, lineNumber));
        }
        return tokens;
    }

    private Token parseToken(String word, int lineNumber) throws IOException {
        String[] factors = word.split(Pattern.quote(FACTOR_SEPARATOR), -1);
        if (factors.length > MAX_FACTORS) {
            throw new IOException("第 " + lineNumber + " 行词元因子过多（最多 " + MAX_FACTORS + " 个）: " + word);
        }
        String[] values = new String[MAX_FACTORS];
        for (int index = 0; index < MAX_FACTORS; index++) {
            values[index] = index < factors.length ? unescape(factors[index]) : "";
            if (values[index].indexOf('\n') >= 0 || values[index].indexOf('\r') >= 0) {
                throw new IOException("第 " + lineNumber + " 行词元因子包含换行符: " + word);
            }
        }
        try {
            return new Token(values[0], values[1], values[2], values[3]);
        } catch (IllegalArgumentException exception) {
            throw new IOException("第 " + lineNumber + " 行词元非法: " + exception.getMessage(), exception);
        }
    }

    /**
     * 还原 ${name} 转义，未知名称保持原样。
     */
    public static String unescape(String factor) {
        int start = factor.indexOf("${");
        if (start < 0) {
            return factor;
        }
        StringBuilder builder = new StringBuilder(factor.length());
        int cursor = 0;
        while (start >= 0) {
            int end = factor.indexOf('}', start + 2);
            if (end < 0) {
                break;
            }
            String replacement = ESCAPES.get(factor.substring(start + 2, end));
            builder.append(factor, cursor, start);
            if (replacement != null) {
                builder.append(replacement);
            } else {
                builder.append(factor, start, end + 1);
            }
            cursor = end + 1;
            start = factor.indexOf("${", cursor);
        }
        builder.append(factor, cursor, factor.length());
        return builder.toString();
    }
}
