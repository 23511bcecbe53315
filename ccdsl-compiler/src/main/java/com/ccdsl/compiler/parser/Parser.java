package com.ccdsl.compiler.parser;

import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.decl.Declaration;
import com.ccdsl.compiler.ast.decl.SourceFile;
import com.ccdsl.compiler.ast.expr.Expression;
import com.ccdsl.compiler.ast.stmt.Block;
import com.ccdsl.compiler.ast.stmt.Statement;
import com.ccdsl.compiler.ast.type.TypeRef;
import com.ccdsl.compiler.diagnostic.Diagnostic;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.compiler.lexer.Lexer;
import com.ccdsl.compiler.lexer.Token;
import com.ccdsl.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.ccdsl.compiler.lexer.TokenType.*;

/**
 * 合约 DSL 语法分析器（递归下降）
 *
 * <p>总是以容错模式解析：语句级错误跳到下一个 ; 或 }，声明级错误跳到下一个成员/顶层关键字，
 * 一次解析可以报告多个 PARSE_ERROR。</p>
 */
public class Parser {

    final String fileName;
    private final List<Token> tokens;
    private int position;
    Token current;
    Token previous;

    /** 条件头部（无括号的 if / while / for / match）中禁止结构体字面量 */
    boolean allowStructLiteral = true;
    /** match 语句分支中的单条语句，分号可省略 */
    boolean optionalTerminator;

    private final List<Diagnostic> errors = new ArrayList<Diagnostic>();
    private int lastErrorOffset = -1;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final ExprParser exprParser = new ExprParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final DeclParser declParser = new DeclParser(this);

    public Parser(Lexer lexer, String fileName) {
        this(lexer.scanTokens(), fileName);
    }

    public Parser(List<Token> tokens, String fileName) {
        this.tokens = tokens;
        this.fileName = fileName;
        this.position = 0;
        this.current = tokens.get(0);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
        }
        current = tokens.get(position);
        return previous;
    }

    /**
     * 向前看 n 个 token（n = 0 即当前）
     */
    Token peek(int n) {
        int idx = Math.min(position + n, tokens.size() - 1);
        return tokens.get(idx);
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    boolean checkAhead(int n, TokenType type) {
        return peek(n).getType() == type;
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则抛出 {@link ParseException}
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 成员名：标识符或关键字（.map / .filter 中的 map 是关键字）
     */
    String expectMemberName() {
        if (check(IDENTIFIER) || current.getType().isKeyword()) {
            return advance().getLexeme();
        }
        throw new ParseException("Expected member name", current, "IDENTIFIER");
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    /**
     * 当前 token 的位置
     */
    SourceLocation location() {
        return tokenLocation(current);
    }

    SourceLocation previousLocation() {
        return tokenLocation(previous);
    }

    /** 从 start 延伸到上一个已消费 token 的区间 */
    SourceLocation spanFrom(SourceLocation start) {
        return previous != null ? start.to(previousLocation()) : start;
    }

    SourceLocation tokenLocation(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLength());
    }

    // ============ 错误处理 ============

    /** 记录语法错误；同一位置的级联错误只保留第一条 */
    void recordError(ParseException e) {
        Token token = e.getToken() != null ? e.getToken() : current;
        if (token.getOffset() == lastErrorOffset) return;
        lastErrorOffset = token.getOffset();
        errors.add(Diagnostic.error(DiagnosticCode.PARSE_ERROR,
                e.getBaseMessage() + ", found " + token.describe(), tokenLocation(token)));
    }

    /**
     * 语句级恢复：跳到本层的下一个 ;（消费）或 }（不消费）
     */
    void synchronizeInBlock() {
        int depth = 0;
        while (!isAtEnd()) {
            if (check(LBRACE)) {
                depth++;
            } else if (check(RBRACE)) {
                if (depth == 0) return;
                depth--;
                if (depth == 0) {
                    advance();
                    return;
                }
            } else if (check(SEMICOLON) && depth == 0) {
                advance();
                return;
            }
            advance();
        }
    }

    /**
     * 成员级恢复：跳到下一个成员起始关键字或合约体的 }
     */
    void synchronizeMember() {
        int depth = 0;
        if (!isAtEnd() && !check(RBRACE)) advance();
        while (!isAtEnd()) {
            if (depth == 0 && (isMemberStart() || check(RBRACE))) return;
            if (check(LBRACE)) depth++;
            if (check(RBRACE)) depth--;
            advance();
        }
    }

    /**
     * 顶层恢复：跳到下一个 contract / struct / interface
     */
    private void synchronizeTopLevel() {
        advance();
        while (!isAtEnd() && !checkAny(KW_CONTRACT, KW_STRUCT, KW_INTERFACE)) {
            advance();
        }
    }

    boolean isMemberStart() {
        return checkAny(KW_STATE, KW_STRUCT, KW_EVENT, KW_MODIFIER, KW_CONST,
                KW_FN, KW_PUBLIC, KW_PRIVATE);
    }

    // ============ 文件解析 ============

    /**
     * 解析整个源文件
     */
    public ParseResult parse() {
        SourceLocation loc = location();
        List<Declaration> declarations = new ArrayList<Declaration>();
        while (!isAtEnd()) {
            try {
                if (check(KW_CONTRACT)) {
                    declarations.add(declParser.parseContract());
                } else if (check(KW_STRUCT)) {
                    declarations.add(declParser.parseStruct());
                } else if (check(KW_INTERFACE)) {
                    declarations.add(declParser.parseInterface());
                } else {
                    throw new ParseException("Expected 'contract', 'struct' or 'interface'", current);
                }
            } catch (ParseException e) {
                recordError(e);
                synchronizeTopLevel();
            }
        }
        SourceFile file = new SourceFile(loc, fileName, declarations);
        return new ParseResult(file, errors);
    }

    // ============ 委托 ============

    Expression parseExpression() {
        return exprParser.parseExpression();
    }

    Statement parseStatement() {
        return stmtParser.parseStatement();
    }

    Block parseBlock() {
        return stmtParser.parseBlock();
    }

    TypeRef parseType() {
        return typeParser.parseType();
    }
}
