package com.ccdsl.compiler.lexer;

import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.compiler.diagnostic.DiagnosticCollector;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 合约 DSL 词法分析器
 *
 * <p>遇到无法识别的字符时记录 LEX_ERROR，并跳到下一个空白处继续扫描，单个坏字符不会中止整个文件。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final DiagnosticCollector diagnostics;
    private final List<Token> tokens = new ArrayList<Token>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    // 基础类型名
    private static final Set<String> PRIMITIVE_TYPES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "u8", "u16", "u32", "u64", "u128", "u256",
            "i8", "i16", "i32", "i64", "i128",
            "bool", "address", "string", "bytes")));

    // 合法的整数后缀
    private static final Set<String> INT_SUFFIXES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "u8", "u16", "u32", "u64", "u128", "u256",
            "i8", "i16", "i32", "i64", "i128")));

    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();

        // 声明
        map.put("contract", TokenType.KW_CONTRACT);
        map.put("interface", TokenType.KW_INTERFACE);
        map.put("implements", TokenType.KW_IMPLEMENTS);
        map.put("struct", TokenType.KW_STRUCT);
        map.put("state", TokenType.KW_STATE);
        map.put("event", TokenType.KW_EVENT);
        map.put("modifier", TokenType.KW_MODIFIER);
        map.put("const", TokenType.KW_CONST);
        map.put("fn", TokenType.KW_FN);
        map.put("let", TokenType.KW_LET);
        map.put("mut", TokenType.KW_MUT);

        // 可见性
        map.put("public", TokenType.KW_PUBLIC);
        map.put("private", TokenType.KW_PRIVATE);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("while", TokenType.KW_WHILE);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("match", TokenType.KW_MATCH);
        map.put("require", TokenType.KW_REQUIRE);
        map.put("revert", TokenType.KW_REVERT);
        map.put("emit", TokenType.KW_EMIT);
        map.put("return", TokenType.KW_RETURN);

        map.put("as", TokenType.KW_AS);
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);

        // 泛型类型构造器
        map.put("map", TokenType.KW_MAP);
        map.put("vec", TokenType.KW_VEC);
        map.put("option", TokenType.KW_OPTION);
        map.put("result", TokenType.KW_RESULT);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词（供编辑器工具使用） */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public static boolean isPrimitiveTypeName(String name) {
        return PRIMITIVE_TYPES.contains(name);
    }

    public Lexer(String source, String fileName, DiagnosticCollector diagnostics) {
        this.source = source;
        this.fileName = fileName;
        this.diagnostics = diagnostics;
    }

    /**
     * 执行词法分析，返回以 EOF 结尾的 Token 列表
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '?': addToken(TokenType.QUESTION); break;
            case ':': addToken(TokenType.COLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '*': addToken(TokenType.MUL); break;
            case '%': addToken(TokenType.MOD); break;

            case '_':
                if (isAlphaNumeric(peek())) {
                    identifier();
                } else {
                    addToken(TokenType.UNDERSCORE);
                }
                break;

            case '.':
                addToken(match('.') ? TokenType.RANGE : TokenType.DOT);
                break;

            case '-':
                addToken(match('>') ? TokenType.ARROW : TokenType.MINUS);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '=':
                if (match('=')) {
                    addToken(TokenType.EQ);
                } else if (match('>')) {
                    addToken(TokenType.DOUBLE_ARROW);
                } else {
                    addToken(TokenType.ASSIGN);
                }
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    error("Unexpected character '&'. Did you mean '&&'?");
                }
                break;

            case '|':
                addToken(match('|') ? TokenType.OR : TokenType.PIPE);
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
                break;

            case '\n':
                newLine();
                break;

            case '"':
                string(TokenType.STRING_LITERAL);
                break;

            // 字节串 b"..."
            case 'b':
                if (peek() == '"') {
                    advance();
                    string(TokenType.BYTES_LITERAL);
                } else {
                    identifier();
                }
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void string(TokenType type) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                error("Unterminated string");
                return;
            }
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
                char escaped = advance();
                switch (escaped) {
                    case 'n': value.append('\n'); break;
                    case 't': value.append('\t'); break;
                    case '0': value.append('\0'); break;
                    case '\\': value.append('\\'); break;
                    case '"': value.append('"'); break;
                    default:
                        error("Invalid escape character: \\" + escaped);
                        return;
                }
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合的 "
        addToken(type, value.toString());
    }

    /** 消耗数字字符和下划线分隔符 */
    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    private void number() {
        BigInteger value;
        if (source.charAt(start) == '0' && (peek() == 'x' || peek() == 'X')) {
            advance(); // 消费 'x'
            int bodyStart = current;
            while (isHexDigit(peek()) || peek() == '_') advance();
            String body = stripUnderscores(source.substring(bodyStart, current));
            if (body.isEmpty()) {
                error("Invalid hex literal: " + source.substring(start, current));
                return;
            }
            value = new BigInteger(body, 16);
        } else {
            advanceDigits();
            value = new BigInteger(stripUnderscores(source.substring(start, current)));
        }

        String suffix = null;
        if ((peek() == 'u' || peek() == 'i') && isDigit(peekNext())) {
            int suffixStart = current;
            advance();
            while (isDigit(peek())) advance();
            suffix = source.substring(suffixStart, current);
            if (!INT_SUFFIXES.contains(suffix)) {
                error("Invalid integer suffix: " + suffix);
                return;
            }
        }
        if (isAlpha(peek())) {
            error("Invalid integer literal: " + source.substring(start, current + 1));
            return;
        }
        addToken(TokenType.INT_LITERAL, new NumericLiteral(value, suffix));
    }

    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type != null) {
            addToken(type);
            return;
        }
        if (PRIMITIVE_TYPES.contains(text)) {
            addToken(TokenType.PRIMITIVE_TYPE);
            return;
        }
        Intrinsic intrinsic = Intrinsic.fromName(text);
        if (intrinsic != null) {
            addToken(TokenType.INTRINSIC, intrinsic);
            return;
        }
        addToken(TokenType.IDENTIFIER);
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (peek() == '/' && peekNext() == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                depth--;
            } else {
                if (peek() == '\n') {
                    advance();
                    newLine();
                } else {
                    advance();
                }
            }
        }
        if (depth > 0) {
            error("Unterminated block comment");
        }
    }

    /**
     * 记录词法错误，然后跳到下一个空白处恢复
     */
    private void error(String message) {
        while (!isAtEnd() && !isWhitespace(peek())) {
            advance();
        }
        int length = Math.max(current - start, 1);
        diagnostics.error(DiagnosticCode.LEX_ERROR, message,
                new SourceLocation(fileName, startLine, startColumn, start, length));
    }
}
