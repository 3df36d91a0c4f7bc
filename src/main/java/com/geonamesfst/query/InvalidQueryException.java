package com.geonamesfst.query;

/**
 * 客户端输入错误：空查询、非法正则表达式等。不应重试。
 */
public class InvalidQueryException extends RuntimeException {
    private final String query;

    public InvalidQueryException(String message, String query) {
        super(message);
        this.query = query;
    }

    public InvalidQueryException(String message, String query, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }

    public static InvalidQueryException emptyQuery() {
        return new InvalidQueryException("Empty query", "");
    }
}
