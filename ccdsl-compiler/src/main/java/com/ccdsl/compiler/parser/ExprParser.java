package com.ccdsl.compiler.parser;

import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.decl.Parameter;
import com.ccdsl.compiler.ast.expr.*;
import com.ccdsl.compiler.ast.type.TypeRef;
import com.ccdsl.compiler.lexer.Intrinsic;
import com.ccdsl.compiler.lexer.NumericLiteral;
import com.ccdsl.compiler.lexer.Token;
import com.ccdsl.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.ccdsl.compiler.lexer.TokenType.*;

/**
 * 表达式解析器（优先级爬升）
 *
 * <p>优先级从低到高：?: → || → &amp;&amp; → == != → &lt; &gt; &lt;= &gt;= → + - → * / % → as → 一元 → 后缀</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseTernary();
    }

    // ============ 二元运算 ============

    private Expression parseTernary() {
        SourceLocation start = parser.location();
        Expression condition = parseOr();
        if (parser.match(QUESTION)) {
            Expression thenExpr = parseExpression();
            parser.expect(COLON, "Expected ':' in conditional expression");
            Expression elseExpr = parseTernary();
            return new TernaryExpr(parser.spanFrom(start), condition, thenExpr, elseExpr);
        }
        return condition;
    }

    private Expression parseOr() {
        SourceLocation start = parser.location();
        Expression left = parseAnd();
        while (parser.match(OR)) {
            Expression right = parseAnd();
            left = new BinaryExpr(parser.spanFrom(start), left, BinaryExpr.BinaryOp.OR, right);
        }
        return left;
    }

    private Expression parseAnd() {
        SourceLocation start = parser.location();
        Expression left = parseEquality();
        while (parser.match(AND)) {
            Expression right = parseEquality();
            left = new BinaryExpr(parser.spanFrom(start), left, BinaryExpr.BinaryOp.AND, right);
        }
        return left;
    }

    private Expression parseEquality() {
        SourceLocation start = parser.location();
        Expression left = parseComparison();
        while (parser.checkAny(EQ, NE)) {
            BinaryExpr.BinaryOp op = parser.advance().getType() == EQ
                    ? BinaryExpr.BinaryOp.EQ : BinaryExpr.BinaryOp.NE;
            Expression right = parseComparison();
            left = new BinaryExpr(parser.spanFrom(start), left, op, right);
        }
        return left;
    }

    private Expression parseComparison() {
        SourceLocation start = parser.location();
        Expression left = parseAdditive();
        while (parser.checkAny(LT, GT, LE, GE)) {
            BinaryExpr.BinaryOp op = toBinaryOp(parser.advance().getType());
            Expression right = parseAdditive();
            left = new BinaryExpr(parser.spanFrom(start), left, op, right);
        }
        return left;
    }

    private Expression parseAdditive() {
        SourceLocation start = parser.location();
        Expression left = parseMultiplicative();
        while (parser.checkAny(PLUS, MINUS)) {
            BinaryExpr.BinaryOp op = toBinaryOp(parser.advance().getType());
            Expression right = parseMultiplicative();
            left = new BinaryExpr(parser.spanFrom(start), left, op, right);
        }
        return left;
    }

    private Expression parseMultiplicative() {
        SourceLocation start = parser.location();
        Expression left = parseCast();
        while (parser.checkAny(MUL, DIV, MOD)) {
            BinaryExpr.BinaryOp op = toBinaryOp(parser.advance().getType());
            Expression right = parseCast();
            left = new BinaryExpr(parser.spanFrom(start), left, op, right);
        }
        return left;
    }

    private Expression parseCast() {
        SourceLocation start = parser.location();
        Expression expr = parseUnary();
        while (parser.match(KW_AS)) {
            TypeRef target = parser.parseType();
            expr = new CastExpr(parser.spanFrom(start), expr, target);
        }
        return expr;
    }

    private Expression parseUnary() {
        SourceLocation start = parser.location();
        if (parser.check(MINUS) && parser.checkAhead(1, INT_LITERAL)) {
            // 负整数字面量直接折叠，使 -128i8 这类最小值可以表示
            parser.advance();
            Token number = parser.advance();
            NumericLiteral lit = (NumericLiteral) number.getLiteral();
            Expression negative = new Literal(parser.spanFrom(start), Literal.LiteralKind.INTEGER,
                    lit.getValue().negate(), lit.getSuffix());
            return parsePostfix(negative, start);
        }
        if (parser.match(MINUS)) {
            Expression operand = parseUnary();
            return new UnaryExpr(parser.spanFrom(start), UnaryExpr.UnaryOp.NEG, operand);
        }
        if (parser.match(NOT)) {
            Expression operand = parseUnary();
            return new UnaryExpr(parser.spanFrom(start), UnaryExpr.UnaryOp.NOT, operand);
        }
        return parsePostfix(parsePrimary(), start);
    }

    // ============ 后缀 ============

    private Expression parsePostfix(Expression expr, SourceLocation start) {
        while (true) {
            if (parser.match(DOT)) {
                if (parser.check(INT_LITERAL)) {
                    Token index = parser.advance();
                    String name = ((NumericLiteral) index.getLiteral()).getValue().toString();
                    expr = new FieldAccessExpr(parser.spanFrom(start), expr, name);
                    continue;
                }
                String name = parser.expectMemberName();
                if (parser.match(LPAREN)) {
                    List<Expression> args = parseArguments();
                    expr = new MethodCallExpr(parser.spanFrom(start), expr, name, args);
                } else {
                    expr = new FieldAccessExpr(parser.spanFrom(start), expr, name);
                }
            } else if (parser.match(LBRACKET)) {
                boolean saved = parser.allowStructLiteral;
                parser.allowStructLiteral = true;
                Expression index = parseExpression();
                parser.allowStructLiteral = saved;
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpr(parser.spanFrom(start), expr, index);
            } else {
                return expr;
            }
        }
    }

    /**
     * 解析已消费 '(' 之后的实参列表，包括 ')'
     */
    List<Expression> parseArguments() {
        boolean saved = parser.allowStructLiteral;
        parser.allowStructLiteral = true;
        List<Expression> args = new ArrayList<Expression>();
        if (!parser.check(RPAREN)) {
            do {
                args.add(parseExpression());
            } while (parser.match(COMMA));
        }
        parser.allowStructLiteral = saved;
        parser.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }

    // ============ 基本表达式 ============

    private Expression parsePrimary() {
        SourceLocation start = parser.location();
        Token token = parser.current;

        switch (token.getType()) {
            case INT_LITERAL: {
                parser.advance();
                NumericLiteral lit = (NumericLiteral) token.getLiteral();
                return new Literal(start, Literal.LiteralKind.INTEGER, lit.getValue(), lit.getSuffix());
            }
            case STRING_LITERAL:
                parser.advance();
                return new Literal(start, Literal.LiteralKind.STRING, token.getLiteral());
            case BYTES_LITERAL:
                parser.advance();
                return new Literal(start, Literal.LiteralKind.BYTES, token.getLiteral());
            case KW_TRUE:
                parser.advance();
                return new Literal(start, Literal.LiteralKind.BOOL, Boolean.TRUE);
            case KW_FALSE:
                parser.advance();
                return new Literal(start, Literal.LiteralKind.BOOL, Boolean.FALSE);
            case INTRINSIC: {
                parser.advance();
                // msg_sender 与 msg_sender() 等价
                if (parser.match(LPAREN)) {
                    parser.expect(RPAREN, "Intrinsic '" + token.getLexeme() + "' takes no arguments");
                }
                return new IntrinsicExpr(parser.spanFrom(start), (Intrinsic) token.getLiteral());
            }
            case IDENTIFIER:
                return parseIdentifierExpr();
            case LPAREN:
                return parseParenthesized();
            case LBRACKET:
                return parseArrayLiteral();
            case PIPE:
                return parseLambda();
            case OR:
                throw new ParseException("Lambda must declare at least one parameter", token);
            case KW_MATCH:
                return parseMatchExpr();
            default:
                throw new ParseException("Expected expression", token);
        }
    }

    private Expression parseIdentifierExpr() {
        SourceLocation start = parser.location();
        String name = parser.advance().getLexeme();

        if (parser.match(LPAREN)) {
            List<Expression> args = parseArguments();
            return new CallExpr(parser.spanFrom(start), name, args);
        }
        if (parser.allowStructLiteral && parser.check(LBRACE) && looksLikeStructBody()) {
            return parseStructLiteral(name, start);
        }
        return new Identifier(start, name);
    }

    /** Name { field: ... } 或 Name { } */
    private boolean looksLikeStructBody() {
        if (parser.checkAhead(1, RBRACE)) return true;
        return parser.checkAhead(1, IDENTIFIER) && parser.checkAhead(2, COLON);
    }

    private Expression parseStructLiteral(String name, SourceLocation start) {
        parser.expect(LBRACE, "Expected '{'");
        boolean saved = parser.allowStructLiteral;
        parser.allowStructLiteral = true;
        List<String> fields = new ArrayList<String>();
        List<Expression> values = new ArrayList<Expression>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            Token field = parser.expect(IDENTIFIER, "Expected field name in struct literal");
            parser.expect(COLON, "Expected ':' after field name");
            fields.add(field.getLexeme());
            values.add(parseExpression());
            if (!parser.match(COMMA)) break;
        }
        parser.allowStructLiteral = saved;
        parser.expect(RBRACE, "Expected '}' after struct literal");
        return new StructLiteral(parser.spanFrom(start), name, fields, values);
    }

    private Expression parseParenthesized() {
        SourceLocation start = parser.location();
        parser.advance();
        boolean saved = parser.allowStructLiteral;
        parser.allowStructLiteral = true;
        Expression first = parseExpression();
        if (parser.match(COMMA)) {
            List<Expression> elements = new ArrayList<Expression>();
            elements.add(first);
            do {
                elements.add(parseExpression());
            } while (parser.match(COMMA));
            parser.allowStructLiteral = saved;
            parser.expect(RPAREN, "Expected ')' after tuple");
            return new TupleLiteral(parser.spanFrom(start), elements);
        }
        parser.allowStructLiteral = saved;
        parser.expect(RPAREN, "Expected ')' after expression");
        return first;
    }

    private Expression parseArrayLiteral() {
        SourceLocation start = parser.location();
        parser.advance();
        boolean saved = parser.allowStructLiteral;
        parser.allowStructLiteral = true;
        List<Expression> elements = new ArrayList<Expression>();
        if (!parser.check(RBRACKET)) {
            do {
                elements.add(parseExpression());
            } while (parser.match(COMMA));
        }
        parser.allowStructLiteral = saved;
        parser.expect(RBRACKET, "Expected ']' after array elements");
        return new ArrayLiteral(parser.spanFrom(start), elements);
    }

    /**
     * |x| expr 或 |x: u64, y: u64| expr
     */
    private Expression parseLambda() {
        SourceLocation start = parser.location();
        parser.advance();
        List<Parameter> params = new ArrayList<Parameter>();
        do {
            SourceLocation paramLoc = parser.location();
            String name = parser.expect(IDENTIFIER, "Expected lambda parameter name").getLexeme();
            TypeRef type = null;
            if (parser.match(COLON)) {
                type = parser.parseType();
            }
            params.add(new Parameter(parser.spanFrom(paramLoc), name, type));
        } while (parser.match(COMMA));
        parser.expect(PIPE, "Expected '|' after lambda parameters");
        Expression body = parseExpression();
        return new LambdaExpr(parser.spanFrom(start), params, body);
    }

    private Expression parseMatchExpr() {
        SourceLocation start = parser.location();
        parser.advance();
        Expression scrutinee = parseConditionHead();
        parser.expect(LBRACE, "Expected '{' after match scrutinee");
        List<MatchArm> arms = new ArrayList<MatchArm>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation armStart = parser.location();
            MatchPattern pattern = parsePattern();
            parser.expect(DOUBLE_ARROW, "Expected '=>' after match pattern");
            Expression value = parseExpression();
            arms.add(new MatchArm(parser.spanFrom(armStart), pattern, value));
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RBRACE, "Expected '}' after match arms");
        return new MatchExpr(parser.spanFrom(start), scrutinee, arms);
    }

    /**
     * 条件头部：不允许结构体字面量，以免把后续的 { 当成字面量体
     */
    Expression parseConditionHead() {
        boolean saved = parser.allowStructLiteral;
        parser.allowStructLiteral = false;
        try {
            return parseExpression();
        } finally {
            parser.allowStructLiteral = saved;
        }
    }

    // ============ 模式 ============

    /**
     * 模式：_ | 字面量 | low..high
     */
    MatchPattern parsePattern() {
        SourceLocation start = parser.location();
        if (parser.match(UNDERSCORE)) {
            return MatchPattern.wildcard(start);
        }
        Literal low = parsePatternLiteral();
        if (parser.match(RANGE)) {
            Literal high = parsePatternLiteral();
            if (!low.isInteger() || !high.isInteger()) {
                throw new ParseException("Range patterns require integer bounds", parser.previous);
            }
            return new MatchPattern(parser.spanFrom(start), MatchPattern.PatternKind.RANGE, low, high);
        }
        return new MatchPattern(parser.spanFrom(start), MatchPattern.PatternKind.LITERAL, low, null);
    }

    private Literal parsePatternLiteral() {
        Expression expr;
        TokenType type = parser.current.getType();
        if (type == INT_LITERAL || type == KW_TRUE || type == KW_FALSE
                || type == STRING_LITERAL || type == BYTES_LITERAL
                || (type == MINUS && parser.checkAhead(1, INT_LITERAL))) {
            expr = parseUnary();
        } else {
            throw new ParseException("Expected pattern", parser.current);
        }
        if (!(expr instanceof Literal)) {
            throw new ParseException("Expected literal pattern", parser.current);
        }
        return (Literal) expr;
    }

    // ============ 辅助方法 ============

    private static BinaryExpr.BinaryOp toBinaryOp(TokenType type) {
        switch (type) {
            case PLUS: return BinaryExpr.BinaryOp.ADD;
            case MINUS: return BinaryExpr.BinaryOp.SUB;
            case MUL: return BinaryExpr.BinaryOp.MUL;
            case DIV: return BinaryExpr.BinaryOp.DIV;
            case MOD: return BinaryExpr.BinaryOp.MOD;
            case LT: return BinaryExpr.BinaryOp.LT;
            case GT: return BinaryExpr.BinaryOp.GT;
            case LE: return BinaryExpr.BinaryOp.LE;
            case GE: return BinaryExpr.BinaryOp.GE;
            default:
                throw new IllegalArgumentException("Not a binary operator: " + type);
        }
    }
}
