package com.ccdsl.compiler.analysis;

import com.ccdsl.compiler.ast.decl.FieldDecl;
import com.ccdsl.compiler.ast.decl.StructDecl;
import com.ccdsl.compiler.ast.type.*;
import com.ccdsl.compiler.diagnostic.DiagnosticCode;
import com.ccdsl.compiler.diagnostic.DiagnosticCollector;
import com.ccdsl.compiler.types.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 类型注解解析器：{@link TypeRef} → {@link Type}，并回填 {@code resolvedType}。
 *
 * <p>结构体按需解析并缓存，自引用的结构体报告 INVALID_CONSTRUCT。</p>
 */
final class TypeResolver {

    private final Map<String, StructDecl> structDecls = new LinkedHashMap<String, StructDecl>();
    private final Map<String, StructType> resolved = new HashMap<String, StructType>();
    private final Set<String> resolving = new HashSet<String>();
    private final DiagnosticCollector diagnostics;

    TypeResolver(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
    }

    /** 注册结构体声明；重名返回 false */
    boolean registerStruct(StructDecl decl) {
        if (structDecls.containsKey(decl.getName())) return false;
        structDecls.put(decl.getName(), decl);
        return true;
    }

    boolean hasStruct(String name) {
        return structDecls.containsKey(name);
    }

    /**
     * 按名称取结构体类型，未声明返回 null
     */
    StructType resolveStruct(String name) {
        StructType cached = resolved.get(name);
        if (cached != null) return cached;
        StructDecl decl = structDecls.get(name);
        if (decl == null) return null;
        if (!resolving.add(name)) {
            diagnostics.error(DiagnosticCode.INVALID_CONSTRUCT,
                    "Struct '" + name + "' contains itself", decl.getLocation());
            return null;
        }
        LinkedHashMap<String, Type> fields = new LinkedHashMap<String, Type>();
        for (FieldDecl field : decl.getFields()) {
            if (fields.containsKey(field.getName())) {
                diagnostics.error(DiagnosticCode.DUPLICATE_DECLARATION,
                        "Duplicate field '" + field.getName() + "' in struct '" + name + "'",
                        field.getLocation());
                continue;
            }
            fields.put(field.getName(), resolve(field.getType()));
        }
        resolving.remove(name);
        StructType type = new StructType(name, fields);
        resolved.put(name, type);
        return type;
    }

    /**
     * 解析类型注解，失败时报告诊断并返回错误类型
     */
    Type resolve(TypeRef ref) {
        Type type = doResolve(ref);
        ref.setResolvedType(type);
        return type;
    }

    private Type doResolve(TypeRef ref) {
        if (ref instanceof PrimitiveTypeRef) {
            String name = ((PrimitiveTypeRef) ref).getName();
            IntegerType integer = IntegerType.byName(name);
            if (integer != null) return integer;
            PrimitiveType prim = PrimitiveType.byName(name);
            if (prim != null) return prim;
            diagnostics.error(DiagnosticCode.UNDEFINED_SYMBOL, "Unknown type '" + name + "'", ref.getLocation());
            return PrimitiveType.ERROR;
        }
        if (ref instanceof GenericTypeRef) {
            GenericTypeRef generic = (GenericTypeRef) ref;
            List<Type> args = new ArrayList<Type>();
            for (TypeRef arg : generic.getTypeArgs()) {
                args.add(resolve(arg));
            }
            String name = generic.getName();
            if ("map".equals(name)) {
                Type key = args.get(0);
                if (!isValidMapKey(key)) {
                    diagnostics.error(DiagnosticCode.INVALID_CONSTRUCT,
                            "Map key type must be an integer, bool or address, found " + key,
                            generic.getTypeArgs().get(0).getLocation());
                }
                return new MapType(key, args.get(1));
            }
            if ("vec".equals(name)) return new VectorType(args.get(0));
            if ("option".equals(name)) return new OptionType(args.get(0));
            if ("result".equals(name)) return new ResultType(args.get(0), args.get(1));
            diagnostics.error(DiagnosticCode.UNDEFINED_SYMBOL, "Unknown type '" + name + "'", ref.getLocation());
            return PrimitiveType.ERROR;
        }
        if (ref instanceof ArrayTypeRef) {
            ArrayTypeRef array = (ArrayTypeRef) ref;
            Type element = resolve(array.getElementType());
            if (array.getSize() <= 0) {
                diagnostics.error(DiagnosticCode.INVALID_CONSTRUCT,
                        "Array length must be positive", ref.getLocation());
            }
            return new ArrayType(element, array.getSize());
        }
        if (ref instanceof TupleTypeRef) {
            List<Type> elements = new ArrayList<Type>();
            for (TypeRef element : ((TupleTypeRef) ref).getElementTypes()) {
                elements.add(resolve(element));
            }
            return new TupleType(elements);
        }
        if (ref instanceof NamedTypeRef) {
            String name = ((NamedTypeRef) ref).getName();
            if (!structDecls.containsKey(name)) {
                diagnostics.error(DiagnosticCode.UNDEFINED_SYMBOL, "Unknown type '" + name + "'", ref.getLocation());
                return PrimitiveType.ERROR;
            }
            StructType struct = resolveStruct(name);
            return struct != null ? struct : PrimitiveType.ERROR;
        }
        throw new IllegalStateException("Unhandled type reference: " + ref.getClass().getSimpleName());
    }

    private static boolean isValidMapKey(Type key) {
        return key.isError() || key.isInteger() || key.isBool() || key.getKind() == Type.Kind.ADDRESS;
    }
}
