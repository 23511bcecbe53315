package com.ccdsl.compiler.parser;

import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.expr.Expression;
import com.ccdsl.compiler.ast.expr.Literal;
import com.ccdsl.compiler.ast.expr.MatchArm;
import com.ccdsl.compiler.ast.expr.MatchPattern;
import com.ccdsl.compiler.ast.stmt.*;
import com.ccdsl.compiler.ast.type.TypeRef;
import com.ccdsl.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.ccdsl.compiler.lexer.TokenType.*;

/**
 * 语句解析器
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析 { ... }，块内单条语句出错时记录并恢复，继续解析后续语句
     */
    Block parseBlock() {
        SourceLocation start = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        boolean savedTerminator = parser.optionalTerminator;
        boolean savedStruct = parser.allowStructLiteral;
        parser.optionalTerminator = false;
        parser.allowStructLiteral = true;

        List<Statement> statements = new ArrayList<Statement>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            try {
                statements.add(parseStatement());
            } catch (ParseException e) {
                parser.recordError(e);
                parser.synchronizeInBlock();
            }
        }

        parser.optionalTerminator = savedTerminator;
        parser.allowStructLiteral = savedStruct;
        parser.expect(RBRACE, "Expected '}'");
        return new Block(parser.spanFrom(start), statements);
    }

    Statement parseStatement() {
        switch (parser.current.getType()) {
            case LBRACE: return parseBlock();
            case KW_LET: return parseLet();
            case KW_IF: return parseIf();
            case KW_WHILE: return parseWhile();
            case KW_FOR: return parseFor();
            case KW_MATCH: return parseMatch();
            case KW_REQUIRE: return parseRequire();
            case KW_REVERT: return parseRevert();
            case KW_EMIT: return parseEmit();
            case KW_RETURN: return parseReturn();
            case UNDERSCORE: return parsePlaceholder();
            default: return parseExpressionOrAssignment();
        }
    }

    // ============ 声明与赋值 ============

    private Statement parseLet() {
        SourceLocation start = parser.location();
        parser.advance();
        boolean mutable = parser.match(KW_MUT);
        Token name = parser.expect(IDENTIFIER, "Expected variable name after 'let'");
        TypeRef declaredType = null;
        if (parser.match(COLON)) {
            declaredType = parser.parseType();
        }
        parser.expect(ASSIGN, "Expected '=' in let binding");
        Expression initializer = parser.parseExpression();
        endStatement();
        return new LetStmt(parser.spanFrom(start), name.getLexeme(), mutable, declaredType, initializer);
    }

    private Statement parseExpressionOrAssignment() {
        SourceLocation start = parser.location();
        Expression expr = parser.parseExpression();
        if (parser.match(ASSIGN)) {
            Expression value = parser.parseExpression();
            endStatement();
            return new AssignStmt(parser.spanFrom(start), expr, value);
        }
        endStatement();
        return new ExpressionStmt(parser.spanFrom(start), expr);
    }

    // ============ 控制流 ============

    private Statement parseIf() {
        SourceLocation start = parser.location();
        parser.advance();
        Expression condition = parser.exprParser.parseConditionHead();
        Block thenBranch = parseBlock();
        Statement elseBranch = null;
        if (parser.match(KW_ELSE)) {
            if (parser.check(KW_IF)) {
                elseBranch = parseIf();
            } else {
                elseBranch = parseBlock();
            }
        }
        return new IfStmt(parser.spanFrom(start), condition, thenBranch, elseBranch);
    }

    private Statement parseWhile() {
        SourceLocation start = parser.location();
        parser.advance();
        Expression condition = parser.exprParser.parseConditionHead();
        Block body = parseBlock();
        return new WhileStmt(parser.spanFrom(start), condition, body);
    }

    /**
     * for i in a..b { } 或 for x in items { }，头部可以加括号
     */
    private Statement parseFor() {
        SourceLocation start = parser.location();
        parser.advance();
        boolean parenthesized = parser.match(LPAREN);
        Token variable = parser.expect(IDENTIFIER, "Expected loop variable after 'for'");
        parser.expect(KW_IN, "Expected 'in' after loop variable");
        Expression first = parser.exprParser.parseConditionHead();
        Expression end = null;
        if (parser.match(RANGE)) {
            end = parser.exprParser.parseConditionHead();
        }
        if (parenthesized) {
            parser.expect(RPAREN, "Expected ')' after for header");
        }
        Block body = parseBlock();
        if (end != null) {
            return new ForRangeStmt(parser.spanFrom(start), variable.getLexeme(), first, end, body);
        }
        return new ForEachStmt(parser.spanFrom(start), variable.getLexeme(), first, body);
    }

    private Statement parseMatch() {
        SourceLocation start = parser.location();
        parser.advance();
        Expression scrutinee = parser.exprParser.parseConditionHead();
        parser.expect(LBRACE, "Expected '{' after match scrutinee");
        List<MatchArm> arms = new ArrayList<MatchArm>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation armStart = parser.location();
            MatchPattern pattern = parser.exprParser.parsePattern();
            parser.expect(DOUBLE_ARROW, "Expected '=>' after match pattern");
            Block body;
            if (parser.check(LBRACE)) {
                body = parseBlock();
            } else {
                body = parseArmStatement();
            }
            arms.add(new MatchArm(parser.spanFrom(armStart), pattern, body));
            parser.match(COMMA);
        }
        parser.expect(RBRACE, "Expected '}' after match arms");
        return new MatchStmt(parser.spanFrom(start), scrutinee, arms);
    }

    /** 分支体是单条语句时包成块，分号可省略 */
    private Block parseArmStatement() {
        SourceLocation start = parser.location();
        boolean saved = parser.optionalTerminator;
        parser.optionalTerminator = true;
        try {
            Statement statement = parseStatement();
            return new Block(parser.spanFrom(start), Collections.singletonList(statement));
        } finally {
            parser.optionalTerminator = saved;
        }
    }

    // ============ 合约语句 ============

    /**
     * require(cond) 或 require(cond, "message")
     */
    private Statement parseRequire() {
        SourceLocation start = parser.location();
        parser.advance();
        parser.expect(LPAREN, "Expected '(' after 'require'");
        Expression condition = parser.parseExpression();
        String message = null;
        if (parser.match(COMMA)) {
            message = (String) parser.expect(STRING_LITERAL, "Expected message string").getLiteral();
        }
        parser.expect(RPAREN, "Expected ')' after require arguments");
        endStatement();
        return new RequireStmt(parser.spanFrom(start), condition, message, false);
    }

    /**
     * revert("message") 等价于 require(false, "message")
     */
    private Statement parseRevert() {
        SourceLocation start = parser.location();
        Token keyword = parser.advance();
        parser.expect(LPAREN, "Expected '(' after 'revert'");
        String message = null;
        if (parser.check(STRING_LITERAL)) {
            message = (String) parser.advance().getLiteral();
        }
        parser.expect(RPAREN, "Expected ')' after revert message");
        endStatement();
        Literal never = new Literal(parser.tokenLocation(keyword), Literal.LiteralKind.BOOL, Boolean.FALSE);
        return new RequireStmt(parser.spanFrom(start), never, message, true);
    }

    private Statement parseEmit() {
        SourceLocation start = parser.location();
        parser.advance();
        Token event = parser.expect(IDENTIFIER, "Expected event name after 'emit'");
        parser.expect(LPAREN, "Expected '(' after event name");
        List<Expression> args = parser.exprParser.parseArguments();
        endStatement();
        return new EmitStmt(parser.spanFrom(start), event.getLexeme(), args);
    }

    private Statement parseReturn() {
        SourceLocation start = parser.location();
        parser.advance();
        Expression value = null;
        if (!parser.checkAny(SEMICOLON, RBRACE) && !(parser.optionalTerminator && parser.check(COMMA))) {
            value = parser.parseExpression();
        }
        endStatement();
        return new ReturnStmt(parser.spanFrom(start), value);
    }

    /** 修饰器体中的 _; */
    private Statement parsePlaceholder() {
        SourceLocation start = parser.location();
        parser.advance();
        endStatement();
        return new PlaceholderStmt(start);
    }

    // ============ 辅助方法 ============

    private void endStatement() {
        if (parser.optionalTerminator) {
            parser.match(SEMICOLON);
            return;
        }
        parser.expect(SEMICOLON, "Expected ';' after statement");
    }
}
