package com.ccdsl.compiler.parser;

import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.decl.*;
import com.ccdsl.compiler.ast.expr.Expression;
import com.ccdsl.compiler.ast.stmt.Block;
import com.ccdsl.compiler.ast.type.TypeRef;
import com.ccdsl.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.ccdsl.compiler.lexer.TokenType.*;

/**
 * 声明解析器：合约、合约成员、顶层结构体和接口
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    // ============ 合约 ============

    /**
     * contract Name [implements A, B] { members }
     */
    ContractDecl parseContract() {
        SourceLocation start = parser.location();
        parser.expect(KW_CONTRACT, "Expected 'contract'");
        String name = parser.expect(IDENTIFIER, "Expected contract name").getLexeme();

        List<String> interfaces = new ArrayList<String>();
        if (parser.match(KW_IMPLEMENTS)) {
            do {
                interfaces.add(parser.expect(IDENTIFIER, "Expected interface name").getLexeme());
            } while (parser.match(COMMA));
        }
        parser.expect(LBRACE, "Expected '{' after contract header");

        List<StateVarDecl> stateVars = new ArrayList<StateVarDecl>();
        List<StructDecl> structs = new ArrayList<StructDecl>();
        List<EventDecl> events = new ArrayList<EventDecl>();
        List<ModifierDecl> modifiers = new ArrayList<ModifierDecl>();
        List<ConstDecl> constants = new ArrayList<ConstDecl>();
        List<FunctionDecl> functions = new ArrayList<FunctionDecl>();

        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            try {
                switch (parser.current.getType()) {
                    case KW_STATE:
                        parseStateBlock(stateVars);
                        break;
                    case KW_STRUCT:
                        structs.add(parseStruct());
                        break;
                    case KW_EVENT:
                        events.add(parseEvent());
                        break;
                    case KW_MODIFIER:
                        modifiers.add(parseModifier());
                        break;
                    case KW_CONST:
                        constants.add(parseConst());
                        break;
                    case KW_FN:
                    case KW_PUBLIC:
                    case KW_PRIVATE:
                        functions.add(parseFunction());
                        break;
                    default:
                        throw new ParseException("Expected contract member", parser.current);
                }
            } catch (ParseException e) {
                parser.recordError(e);
                parser.synchronizeMember();
            }
        }
        parser.expect(RBRACE, "Expected '}' after contract body");

        return new ContractDecl(parser.spanFrom(start), name, interfaces, stateVars, structs,
                events, modifiers, constants, functions);
    }

    /**
     * state { name: type [= default]; ... }
     */
    private void parseStateBlock(List<StateVarDecl> out) {
        parser.advance();
        parser.expect(LBRACE, "Expected '{' after 'state'");
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation start = parser.location();
            String name = parser.expect(IDENTIFIER, "Expected state variable name").getLexeme();
            parser.expect(COLON, "Expected ':' after state variable name");
            TypeRef type = parser.parseType();
            Expression defaultValue = null;
            if (parser.match(ASSIGN)) {
                defaultValue = parser.parseExpression();
            }
            out.add(new StateVarDecl(parser.spanFrom(start), name, type, defaultValue));
            if (!parser.matchAny(SEMICOLON, COMMA) && !parser.check(RBRACE)) {
                throw new ParseException("Expected ';' after state variable", parser.current);
            }
        }
        parser.expect(RBRACE, "Expected '}' after state block");
    }

    // ============ 成员 ============

    /**
     * struct Name { field: type, ... }
     */
    StructDecl parseStruct() {
        SourceLocation start = parser.location();
        parser.expect(KW_STRUCT, "Expected 'struct'");
        String name = parser.expect(IDENTIFIER, "Expected struct name").getLexeme();
        parser.expect(LBRACE, "Expected '{' after struct name");
        List<FieldDecl> fields = new ArrayList<FieldDecl>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation fieldStart = parser.location();
            String field = parser.expect(IDENTIFIER, "Expected field name").getLexeme();
            parser.expect(COLON, "Expected ':' after field name");
            TypeRef type = parser.parseType();
            fields.add(new FieldDecl(parser.spanFrom(fieldStart), field, type));
            if (!parser.matchAny(COMMA, SEMICOLON) && !parser.check(RBRACE)) {
                throw new ParseException("Expected ',' between struct fields", parser.current);
            }
        }
        parser.expect(RBRACE, "Expected '}' after struct fields");
        return new StructDecl(parser.spanFrom(start), name, fields);
    }

    /**
     * event Name(field: type, ...);
     */
    private EventDecl parseEvent() {
        SourceLocation start = parser.location();
        parser.advance();
        String name = parser.expect(IDENTIFIER, "Expected event name").getLexeme();
        parser.expect(LPAREN, "Expected '(' after event name");
        List<Parameter> fields = parseParameters();
        parser.match(SEMICOLON);
        return new EventDecl(parser.spanFrom(start), name, fields);
    }

    /**
     * modifier name[(params)] { ... _; ... }
     */
    private ModifierDecl parseModifier() {
        SourceLocation start = parser.location();
        parser.advance();
        String name = parser.expect(IDENTIFIER, "Expected modifier name").getLexeme();
        List<Parameter> params = Collections.emptyList();
        if (parser.match(LPAREN)) {
            params = parseParameters();
        }
        Block body = parser.parseBlock();
        return new ModifierDecl(parser.spanFrom(start), name, params, body);
    }

    /**
     * const NAME: type = expr;
     */
    private ConstDecl parseConst() {
        SourceLocation start = parser.location();
        parser.advance();
        String name = parser.expect(IDENTIFIER, "Expected constant name").getLexeme();
        parser.expect(COLON, "Expected ':' after constant name");
        TypeRef type = parser.parseType();
        parser.expect(ASSIGN, "Expected '=' in constant declaration");
        Expression value = parser.parseExpression();
        parser.expect(SEMICOLON, "Expected ';' after constant declaration");
        return new ConstDecl(parser.spanFrom(start), name, type, value);
    }

    /**
     * [public|private] fn name(params) [-> type] [modifier(args) ...] { body }
     */
    private FunctionDecl parseFunction() {
        SourceLocation start = parser.location();
        Visibility visibility = Visibility.PUBLIC;
        if (parser.match(KW_PRIVATE)) {
            visibility = Visibility.PRIVATE;
        } else {
            parser.match(KW_PUBLIC);
        }
        parser.expect(KW_FN, "Expected 'fn'");
        String name = parser.expect(IDENTIFIER, "Expected function name").getLexeme();
        parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = parseParameters();
        TypeRef returnType = null;
        if (parser.match(ARROW)) {
            returnType = parser.parseType();
        }

        List<ModifierInvocation> modifiers = new ArrayList<ModifierInvocation>();
        while (parser.check(IDENTIFIER)) {
            SourceLocation modStart = parser.location();
            String modName = parser.advance().getLexeme();
            List<Expression> args = Collections.emptyList();
            if (parser.match(LPAREN)) {
                args = parser.exprParser.parseArguments();
            }
            modifiers.add(new ModifierInvocation(parser.spanFrom(modStart), modName, args));
        }

        Block body = parser.parseBlock();
        return new FunctionDecl(parser.spanFrom(start), name, visibility, params, returnType,
                modifiers, body);
    }

    // ============ 接口 ============

    /**
     * interface Name { fn sig(params) [-> type]; ... }
     */
    InterfaceDecl parseInterface() {
        SourceLocation start = parser.location();
        parser.expect(KW_INTERFACE, "Expected 'interface'");
        String name = parser.expect(IDENTIFIER, "Expected interface name").getLexeme();
        parser.expect(LBRACE, "Expected '{' after interface name");
        List<FunctionSignature> functions = new ArrayList<FunctionSignature>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation sigStart = parser.location();
            parser.match(KW_PUBLIC);
            parser.expect(KW_FN, "Expected 'fn' in interface body");
            String fnName = parser.expect(IDENTIFIER, "Expected function name").getLexeme();
            parser.expect(LPAREN, "Expected '(' after function name");
            List<Parameter> params = parseParameters();
            TypeRef returnType = null;
            if (parser.match(ARROW)) {
                returnType = parser.parseType();
            }
            parser.expect(SEMICOLON, "Expected ';' after interface function");
            functions.add(new FunctionSignature(parser.spanFrom(sigStart), fnName, params, returnType));
        }
        parser.expect(RBRACE, "Expected '}' after interface body");
        return new InterfaceDecl(parser.spanFrom(start), name, functions);
    }

    // ============ 辅助方法 ============

    /**
     * 解析已消费 '(' 之后的 name: type 列表，包括 ')'
     */
    private List<Parameter> parseParameters() {
        List<Parameter> params = new ArrayList<Parameter>();
        if (!parser.check(RPAREN)) {
            do {
                SourceLocation start = parser.location();
                Token name = parser.expect(IDENTIFIER, "Expected parameter name");
                parser.expect(COLON, "Expected ':' after parameter name");
                TypeRef type = parser.parseType();
                params.add(new Parameter(parser.spanFrom(start), name.getLexeme(), type));
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after parameters");
        return params;
    }
}
