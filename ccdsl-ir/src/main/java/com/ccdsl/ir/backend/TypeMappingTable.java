package com.ccdsl.ir.backend;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * DSL 类型到目标类型名的映射。
 *
 * <p>原始类型按 DSL 名称查表；复合类型使用模板，{0}、{1} 为类型参数，{n} 为数组长度，
 * {*} 为逗号分隔的全部元素类型。缺失的原始类型或 null 模板表示该目标不支持。</p>
 */
public final class TypeMappingTable {

    private final Map<String, String> primitives;
    private final String vectorTemplate;
    private final String arrayTemplate;
    private final String mapTemplate;
    private final String tupleTemplate;
    private final String optionTemplate;
    private final String resultTemplate;

    private TypeMappingTable(Builder b) {
        this.primitives = new HashMap<String, String>(b.primitives);
        this.vectorTemplate = b.vector;
        this.arrayTemplate = b.array;
        this.mapTemplate = b.map;
        this.tupleTemplate = b.tuple;
        this.optionTemplate = b.option;
        this.resultTemplate = b.result;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 原始类型（u8、bool、address...），不支持时为 null */
    public String primitive(String dslName) {
        return primitives.get(dslName);
    }

    public String vector(String element) {
        return fill(vectorTemplate, element, null, -1);
    }

    public String array(String element, int size) {
        return fill(arrayTemplate, element, null, size);
    }

    public String map(String key, String value) {
        return fill(mapTemplate, key, value, -1);
    }

    public String option(String inner) {
        return fill(optionTemplate, inner, null, -1);
    }

    public String result(String ok, String err) {
        return fill(resultTemplate, ok, err, -1);
    }

    public String tuple(List<String> elements) {
        if (tupleTemplate == null) return null;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i));
        }
        return tupleTemplate.replace("{*}", sb.toString());
    }

    private static String fill(String template, String first, String second, int size) {
        if (template == null) return null;
        String result = template.replace("{0}", first);
        if (second != null) result = result.replace("{1}", second);
        if (size >= 0) result = result.replace("{n}", String.valueOf(size));
        return result;
    }

    public static final class Builder {
        private final Map<String, String> primitives = new HashMap<String, String>();
        private String vector;
        private String array;
        private String map;
        private String tuple;
        private String option;
        private String result;

        public Builder primitive(String dslName, String targetName) {
            primitives.put(dslName, targetName);
            return this;
        }

        /** 同名映射 */
        public Builder identity(String... dslNames) {
            for (String name : dslNames) {
                primitives.put(name, name);
            }
            return this;
        }

        public Builder vector(String template) { this.vector = template; return this; }
        public Builder array(String template) { this.array = template; return this; }
        public Builder map(String template) { this.map = template; return this; }
        public Builder tuple(String template) { this.tuple = template; return this; }
        public Builder option(String template) { this.option = template; return this; }
        public Builder result(String template) { this.result = template; return this; }

        public TypeMappingTable build() {
            return new TypeMappingTable(this);
        }
    }
}
