package com.ngramindex.query;

public class NgramQueryException extends RuntimeException {
    private final int position;
    private final String queryString;
    private final String suggestion;

    public NgramQueryException(String message, int position, String queryString) {
        super(buildMessage(message, position, queryString));
        this.position = position;
        this.queryString = queryString;
        this.suggestion = suggestFix(queryString);
    }

    public int getPosition() {
        return position;
    }

    public String getQueryString() {
        return queryString;
    }

    public String getSuggestion() {
        return suggestion;
    }

    private static String buildMessage(String message, int pos, String query) {
        String safeQuery = query == null ? "" : query;
        int caretPos = Math.max(0, Math.min(pos, safeQuery.length()));
        String pointer = " ".repeat(caretPos) + "^";
        return "Query error at position " + pos + ": " + message + System.lineSeparator()
                + safeQuery + System.lineSeparator() + pointer;
    }

    private static String suggestFix(String query) {
        if (query == null || query.isBlank()) {
            return "请输入非空查询，例如 \"lemma: take place\"";
        }
        if (query.contains("+")) {
            return "复合属性查询中每个词需按属性顺序以 | 分隔各因子，例如 \"lemma+pos: take|VB place|NN\"";
        }
        return "字面的 | 请写作 ${pipe}，空格请写作 ${space}";
    }
}
