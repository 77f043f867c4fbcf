package com.ngramindex.text;

import java.util.Locale;
import java.util.function.Function;

/**
 * 词元的简单属性。复合属性由两个属性名以 "+" 连接得到，不在此枚举中。
 */
public enum Attribute {
    SURFACE("surface", Token::surface),
    LEMMA("lemma", Token::lemma),
    POS("pos", Token::pos),
    SYN("syn", Token::syn);

    private final String attributeName;
    private final Function<Token, String> accessor;

    Attribute(String attributeName, Function<Token, String> accessor) {
        this.attributeName = attributeName;
        this.accessor = accessor;
    }

    /**
     * 索引文件名中使用的属性名。
     */
    public String attributeName() {
        return attributeName;
    }

    /**
     * 取出词元在该属性上的取值。
     */
    public String valueOf(Token token) {
        return accessor.apply(token);
    }

    /**
     * 按属性名解析，大小写不敏感。
     *
     * @throws IllegalArgumentException 未知属性名
     */
    public static Attribute fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("属性名不能为空");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Attribute attribute : values()) {
            if (attribute.attributeName.equals(normalized)) {
                return attribute;
            }
        }
        throw new IllegalArgumentException("未知属性: " + name);
    }

    @Override
    public String toString() {
        return attributeName;
    }
}
