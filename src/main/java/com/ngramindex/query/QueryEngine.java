package com.ngramindex.query;

import com.ngramindex.config.Constants;
import com.ngramindex.index.AttributeIndex;
import com.ngramindex.index.Index;
import com.ngramindex.index.NgramRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final Index index;

    public QueryEngine(Index index) {
        this.index = index;
    }

    /**
     * 解析并执行文本查询，未写属性前缀时使用第一个配置属性。
     */
    public CountResult count(String queryText, int limit) throws IOException {
        String defaultAttribute = index.getAttributes().get(0).attributeName();
        return count(NgramQuery.parse(queryText, defaultAttribute), queryText, limit);
    }

    public CountResult count(NgramQuery query, int limit) throws IOException {
        return count(query, String.join(" ", query.displayWords()), limit);
    }

    private CountResult count(NgramQuery query, String queryText, int limit) throws IOException {
        long startNanos = System.nanoTime();
        AttributeIndex array = index.load(query.attribute());
        if (query.length() > Constants.NGRAM_LIMIT) {
            logger.warn("查询长度 {} 超过比较上限 {}，仅前 {} 个词参与匹配",
                query.length(), Constants.NGRAM_LIMIT, Constants.NGRAM_LIMIT);
        }

        Optional<int[]> ngram = array.encode(query.words());
        if (ngram.isEmpty()) {
            logger.debug("查询包含符号表外的词: attribute={}, words={}", query.attribute(), query.displayWords());
            return new CountResult(queryText, query.attribute(), query.displayWords(), 0, -1, -1, List.of(),
                elapsedMs(startNanos));
        }
        Optional<NgramRange> range = array.findNgramRange(ngram.get());
        if (range.isEmpty()) {
            return new CountResult(queryText, query.attribute(), query.displayWords(), 0, -1, -1, List.of(),
                elapsedMs(startNanos));
        }

        List<Integer> limited = Arrays.stream(array.firstPositions(range.get(), limit))
            .boxed()
            .toList();
        long elapsed = elapsedMs(startNanos);
        logger.debug("查询完成: attribute={}, count={}, 用时 {}ms", query.attribute(), range.get().count(), elapsed);
        return new CountResult(queryText, query.attribute(), query.displayWords(), range.get().count(),
            range.get().first(), range.get().last(), limited, elapsed);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
