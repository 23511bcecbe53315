package com.ccdsl.ir.backend;

/**
 * 生成代码的输出缓冲区，跟踪缩进层级。每级缩进 4 个空格，换行统一为 \n。
 */
public class CodeWriter {
    private static final String INDENT = "    ";

    private final StringBuilder output = new StringBuilder();
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public CodeWriter append(String text) {
        if (text == null || text.isEmpty()) return this;
        if (atLineStart) {
            for (int i = 0; i < indentLevel; i++) {
                output.append(INDENT);
            }
            atLineStart = false;
        }
        output.append(text);
        return this;
    }

    public void newLine() {
        output.append('\n');
        atLineStart = true;
    }

    /** 追加一整行 */
    public void line(String text) {
        append(text);
        newLine();
    }

    /** 输出 "head {" 并缩进 */
    public void open(String head) {
        line(head.isEmpty() ? "{" : head + " {");
        indent();
    }

    /** 反缩进并输出 "}" 加可选尾随文本（如 ";" 或 " else {"） */
    public void close(String trailer) {
        dedent();
        line("}" + trailer);
    }

    public void close() {
        close("");
    }

    /**
     * 追加空行，不产生连续空行
     */
    public void blankLine() {
        int len = output.length();
        if (len == 0) return;
        if (len >= 2 && output.charAt(len - 1) == '\n' && output.charAt(len - 2) == '\n') {
            return;
        }
        if (output.charAt(len - 1) != '\n') {
            output.append('\n');
        }
        output.append('\n');
        atLineStart = true;
    }

    public String getOutput() {
        return output.toString();
    }
}
