package com.geonamesfst.automaton;

/**
 * 自动机构建超出资源上限。调用方可以减小编辑距离或提高上限后重试。
 */
public class StateLimitExceededException extends RuntimeException {
    private final int limit;

    public StateLimitExceededException(String message, int limit) {
        super(message);
        this.limit = limit;
    }

    public StateLimitExceededException(String message, int limit, Throwable cause) {
        super(message, cause);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
