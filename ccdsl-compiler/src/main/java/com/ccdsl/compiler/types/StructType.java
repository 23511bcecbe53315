package com.ccdsl.compiler.types;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 命名结构体类型。按名称加字段签名（字段名、顺序、类型）比较。
 */
public final class StructType extends Type {
    private final String name;
    private final Map<String, Type> fields;

    public StructType(String name, LinkedHashMap<String, Type> fields) {
        this.name = name;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public String getName() { return name; }

    /** 按声明顺序 */
    public Map<String, Type> getFields() { return fields; }

    public Type getFieldType(String field) {
        return fields.get(field);
    }

    @Override
    public Kind getKind() {
        return Kind.STRUCT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructType)) return false;
        StructType that = (StructType) o;
        if (!name.equals(that.name)) return false;
        // LinkedHashMap 的 equals 不看顺序，这里逐项比较
        if (fields.size() != that.fields.size()) return false;
        Iterator<Map.Entry<String, Type>> a = fields.entrySet().iterator();
        Iterator<Map.Entry<String, Type>> b = that.fields.entrySet().iterator();
        while (a.hasNext()) {
            Map.Entry<String, Type> x = a.next();
            Map.Entry<String, Type> y = b.next();
            if (!x.getKey().equals(y.getKey()) || !x.getValue().equals(y.getValue())) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
