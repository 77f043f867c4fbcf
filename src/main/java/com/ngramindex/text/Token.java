package com.ngramindex.text;

import com.ngramindex.config.Constants;

import java.util.Map;

/**
 * 语料中的一个词元，携带全部简单属性的字符串取值。缺失的属性以空串表示。
 */
public record Token(
    String surface,
    String lemma,
    String pos,
    String syn
) {
    public Token {
        surface = checkValue(surface);
        lemma = checkValue(lemma);
        pos = checkValue(pos);
        syn = checkValue(syn);
    }

    /**
     * 按属性取值构造词元，未给出的属性为空串。
     */
    public static Token fromValues(Map<Attribute, String> values) {
        return new Token(
            values.get(Attribute.SURFACE),
            values.get(Attribute.LEMMA),
            values.get(Attribute.POS),
            values.get(Attribute.SYN)
        );
    }

    /**
     * 取出指定属性的取值。
     */
    public String get(Attribute attribute) {
        return attribute.valueOf(this);
    }

    private static String checkValue(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(Constants.ATTRIBUTE_SEPARATOR) || value.contains(Constants.MISSING_VALUE)) {
            throw new IllegalArgumentException("属性值不能包含保留控制字符: "
                + value.replace(Constants.ATTRIBUTE_SEPARATOR, "\\u001D").replace(Constants.MISSING_VALUE, "\\u001F"));
        }
        return value;
    }
}
