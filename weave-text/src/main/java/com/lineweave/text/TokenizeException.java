package com.lineweave.text;

/**
 * 输入无法转换为 token 流
 */
public class TokenizeException extends RuntimeException {
    private final int line;
    private final int column;

    public TokenizeException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public TokenizeException(String message, Throwable cause) {
        super(message, cause);
        this.line = -1;
        this.column = -1;
    }

    /** 出错行号，未知为 -1 */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (line >= 0) {
            sb.append(" at line ").append(line);
            sb.append(", column ").append(column);
        }
        return sb.toString();
    }
}
