package com.ngramindex.query;

import com.ngramindex.config.Constants;
import com.ngramindex.text.Attribute;
import com.ngramindex.text.MosesCorpusReader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 文本形式的 n-gram 查询。
 *
 * 语法：[属性名:] 词 词 ...，属性名可为复合属性（如 lemma+pos），缺省时使用调用方给定的默认属性。
 * 复合属性的每个词以 | 分隔各分量的取值，如 "lemma+pos: take|VB place|NN"。
 * words 保存的是与符号表一致的存储形式。
 */
public record NgramQuery(String attribute, List<String> words) {

    private static final Pattern ATTRIBUTE_PREFIX = Pattern.compile("^\\s*([A-Za-z]+(?:\\+[A-Za-z]+)*)\\s*:(.*)$", Pattern.DOTALL);
    private static final Pattern WORD = Pattern.compile("\\S+");
    private static final Set<String> SIMPLE_ATTRIBUTE_NAMES = Arrays.stream(Attribute.values())
        .map(Attribute::attributeName)
        .collect(Collectors.toUnmodifiableSet());
    private static final String FACTOR_SEPARATOR = "|";

    public NgramQuery {
        if (attribute == null || attribute.isBlank()) {
            throw new IllegalArgumentException("属性名不能为空");
        }
        if (words == null || words.isEmpty()) {
            throw new IllegalArgumentException("查询词不能为空");
        }
        words = List.copyOf(words);
    }

    /**
     * 解析查询文本。
     *
     * @param text 查询文本
     * @param defaultAttribute 未写属性前缀时使用的属性
     * @throws NgramQueryException 查询为空、过长或复合因子个数不符
     */
    public static NgramQuery parse(String text, String defaultAttribute) {
        if (text == null || text.isBlank()) {
            throw new NgramQueryException("查询为空", 0, text);
        }
        String attribute = defaultAttribute;
        String body = text;
        int bodyOffset = 0;
        Matcher matcher = ATTRIBUTE_PREFIX.matcher(text);
        if (matcher.matches() && isKnownAttribute(matcher.group(1))) {
            attribute = matcher.group(1).toLowerCase(Locale.ROOT);
            body = matcher.group(2);
            bodyOffset = matcher.start(2);
        }
        int componentCount = componentCount(attribute);

        List<String> words = new ArrayList<>();
        Matcher wordMatcher = WORD.matcher(body);
        while (wordMatcher.find()) {
            String word = wordMatcher.group();
            int wordPosition = bodyOffset + wordMatcher.start();
            words.add(toStoredForm(word, componentCount, wordPosition, text));
        }
        if (words.isEmpty()) {
            throw new NgramQueryException("查询缺少词", text.length(), text);
        }
        if (words.size() > Constants.MAX_QUERY_TOKENS) {
            throw new NgramQueryException("查询词数超过上限 " + Constants.MAX_QUERY_TOKENS, text.length(), text);
        }
        return new NgramQuery(attribute, words);
    }

    /**
     * 复合属性包含的简单属性个数。
     */
    public static int componentCount(String attribute) {
        return attribute.split(Pattern.quote(Constants.COMPOSITE_SEPARATOR), -1).length;
    }

    /**
     * 以 | 代替内部分隔符、空串代替缺失占位符的可读形式。
     */
    public List<String> displayWords() {
        return words.stream()
            .map(word -> word.replace(Constants.MISSING_VALUE, "").replace(Constants.ATTRIBUTE_SEPARATOR, FACTOR_SEPARATOR))
            .toList();
    }

    public int length() {
        return words.size();
    }

    private static String toStoredForm(String word, int componentCount, int position, String text) {
        String[] factors = word.split(Pattern.quote(FACTOR_SEPARATOR), -1);
        if (factors.length != componentCount) {
            throw new NgramQueryException("词 \"" + word + "\" 含 " + factors.length + " 个因子，属性需要 "
                + componentCount + " 个", position, text);
        }
        List<String> values = new ArrayList<>(factors.length);
        for (String factor : factors) {
            String value = MosesCorpusReader.unescape(factor);
            if (value.contains(Constants.ATTRIBUTE_SEPARATOR) || value.contains(Constants.MISSING_VALUE)) {
                throw new NgramQueryException("词中包含保留分隔符", position, text);
            }
            values.add(value.isEmpty() ? Constants.MISSING_VALUE : value);
        }
        return String.join(Constants.ATTRIBUTE_SEPARATOR, values);
    }

    private static boolean isKnownAttribute(String name) {
        for (String part : name.split(Pattern.quote(Constants.COMPOSITE_SEPARATOR))) {
            if (!SIMPLE_ATTRIBUTE_NAMES.contains(part.toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }
}
