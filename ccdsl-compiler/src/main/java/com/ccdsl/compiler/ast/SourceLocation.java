package com.ccdsl.compiler.ast;

/**
 * 源码区间：起始行列（1 起）、字符偏移和长度
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int length;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    public SourceLocation(String file, int line, int column, int offset, int length) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.length = length;
    }

    public String getFile() { return file; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getOffset() { return offset; }
    public int getLength() { return length; }

    public int getEndOffset() {
        return offset + length;
    }

    /**
     * 从本区间起点延伸到 end 的终点
     */
    public SourceLocation to(SourceLocation end) {
        if (end == null || end.getEndOffset() <= offset) return this;
        return new SourceLocation(file, line, column, offset, end.getEndOffset() - offset);
    }

    public boolean containsOffset(int pos) {
        return pos >= offset && pos < offset + Math.max(length, 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && offset == that.offset
                && length == that.length
                && (file == null ? that.file == null : file.equals(that.file));
    }

    @Override
    public int hashCode() {
        return ((file != null ? file.hashCode() : 0) * 31 + offset) * 31 + length;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
