package com.ccdsl.compiler.parser;

import com.ccdsl.compiler.ast.SourceLocation;
import com.ccdsl.compiler.ast.type.ArrayTypeRef;
import com.ccdsl.compiler.ast.type.GenericTypeRef;
import com.ccdsl.compiler.ast.type.NamedTypeRef;
import com.ccdsl.compiler.ast.type.PrimitiveTypeRef;
import com.ccdsl.compiler.ast.type.TupleTypeRef;
import com.ccdsl.compiler.ast.type.TypeRef;
import com.ccdsl.compiler.lexer.NumericLiteral;
import com.ccdsl.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.ccdsl.compiler.lexer.TokenType.*;

/**
 * 类型注解解析：u64、map&lt;K, V&gt;、vec&lt;T&gt;、option&lt;T&gt;、result&lt;T, E&gt;、[T; N]、(A, B)、结构体名
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    TypeRef parseType() {
        SourceLocation start = parser.location();

        if (parser.check(PRIMITIVE_TYPE)) {
            return new PrimitiveTypeRef(start, parser.advance().getLexeme());
        }
        if (parser.match(KW_MAP)) {
            List<TypeRef> args = parseTypeArguments(2, "map");
            return new GenericTypeRef(parser.spanFrom(start), "map", args);
        }
        if (parser.match(KW_VEC)) {
            List<TypeRef> args = parseTypeArguments(1, "vec");
            return new GenericTypeRef(parser.spanFrom(start), "vec", args);
        }
        if (parser.match(KW_OPTION)) {
            List<TypeRef> args = parseTypeArguments(1, "option");
            return new GenericTypeRef(parser.spanFrom(start), "option", args);
        }
        if (parser.match(KW_RESULT)) {
            List<TypeRef> args = parseTypeArguments(2, "result");
            return new GenericTypeRef(parser.spanFrom(start), "result", args);
        }
        if (parser.match(LBRACKET)) {
            TypeRef element = parseType();
            parser.expect(SEMICOLON, "Expected ';' in array type");
            Token size = parser.expect(INT_LITERAL, "Expected array length");
            parser.expect(RBRACKET, "Expected ']' after array type");
            int length = ((NumericLiteral) size.getLiteral()).getValue().intValue();
            return new ArrayTypeRef(parser.spanFrom(start), element, length);
        }
        if (parser.match(LPAREN)) {
            List<TypeRef> elements = new ArrayList<TypeRef>();
            elements.add(parseType());
            while (parser.match(COMMA)) {
                elements.add(parseType());
            }
            parser.expect(RPAREN, "Expected ')' after tuple type");
            if (elements.size() == 1) {
                return elements.get(0);
            }
            return new TupleTypeRef(parser.spanFrom(start), elements);
        }
        if (parser.check(IDENTIFIER)) {
            return new NamedTypeRef(start, parser.advance().getLexeme());
        }
        throw new ParseException("Expected type", parser.current);
    }

    private List<TypeRef> parseTypeArguments(int count, String name) {
        parser.expect(LT, "Expected '<' after '" + name + "'");
        List<TypeRef> args = new ArrayList<TypeRef>();
        args.add(parseType());
        while (parser.match(COMMA)) {
            args.add(parseType());
        }
        parser.expect(GT, "Expected '>' to close '" + name + "' type arguments");
        if (args.size() != count) {
            throw new ParseException("'" + name + "' takes " + count + " type argument(s)", parser.previous);
        }
        return args;
    }
}
