package com.ngramindex.index;

import com.ngramindex.config.Constants;
import com.ngramindex.storage.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 由两个已有属性索引逐位置拼接出复合属性索引（如 lemma+pos），无需重新读取语料。
 */
public final class CompositeIndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CompositeIndexBuilder.class);

    private CompositeIndexBuilder() {
    }

    /**
     * 复合属性名：first+second
     */
    public static String compositeName(String first, String second) {
        return first + Constants.COMPOSITE_SEPARATOR + second;
    }

    /**
     * 拼接两个属性的语料流并构建后缀序。
     *
     * @throws IllegalArgumentException 两个语料流长度或句子边界位置不一致
     */
    public static AttributeIndex fuse(AttributeIndex first, AttributeIndex second) {
        CorpusStream firstCorpus = first.corpus();
        CorpusStream secondCorpus = second.corpus();
        if (firstCorpus.size() != secondCorpus.size()) {
            throw new IllegalArgumentException("无法拼接长度不同的语料流: " + first.name() + "=" + firstCorpus.size()
                + ", " + second.name() + "=" + secondCorpus.size());
        }
        SymbolTable firstSymbols = first.symbols();
        SymbolTable secondSymbols = second.symbols();
        AttributeIndex fused = new AttributeIndex(compositeName(first.name(), second.name()));
        for (int position = 0; position < firstCorpus.size(); position++) {
            boolean firstBoundary = firstCorpus.isBoundary(position);
            if (firstBoundary != secondCorpus.isBoundary(position)) {
                throw new IllegalArgumentException("句子边界位置不一致: position=" + position
                    + ", attributes=" + first.name() + "/" + second.name());
            }
            if (firstBoundary) {
                fused.appendSentenceBoundary();
            } else {
                fused.appendWord(firstSymbols.symbolOf(firstCorpus.get(position))
                    + Constants.ATTRIBUTE_SEPARATOR
                    + secondSymbols.symbolOf(secondCorpus.get(position)));
            }
        }
        logger.info("已拼接复合属性 {}: positions={}", fused.name(), fused.size());
        fused.buildSuffixArray();
        return fused;
    }
}
