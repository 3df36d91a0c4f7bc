package com.geonamesfst.ingest;

import java.io.IOException;

/**
 * 数据源格式错误或索引构建失败，属于启动期致命错误。
 */
public class GazetteerFormatException extends IOException {
    private final String source;
    private final int lineNumber;

    public GazetteerFormatException(String message, String source, int lineNumber) {
        super(buildMessage(message, source, lineNumber));
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public GazetteerFormatException(String message, String source, int lineNumber, Throwable cause) {
        super(buildMessage(message, source, lineNumber), cause);
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public String getSource() {
        return source;
    }

    /**
     * @return 出错行号（从 1 开始），与具体行无关时为 0
     */
    public int getLineNumber() {
        return lineNumber;
    }

    private static String buildMessage(String message, String source, int lineNumber) {
        if (lineNumber <= 0) {
            return message + " (" + source + ")";
        }
        return message + " (" + source + ":" + lineNumber + ")";
    }
}
