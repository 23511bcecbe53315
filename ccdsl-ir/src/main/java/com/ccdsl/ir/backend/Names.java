package com.ccdsl.ir.backend;

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * 命名转换与字面量转义工具
 */
public final class Names {

    private Names() {}

    /**
     * TokenVault → token_vault，getBalance → get_balance，ERC20Token → erc20_token
     */
    public static String toSnake(String name) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                boolean prevLower = i > 0 && (Character.isLowerCase(name.charAt(i - 1))
                        || Character.isDigit(name.charAt(i - 1)));
                boolean nextLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                boolean prevUpper = i > 0 && Character.isUpperCase(name.charAt(i - 1));
                if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '_'
                        && (prevLower || (prevUpper && nextLower))) {
                    sb.append('_');
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** get_balance → GetBalance，transfer → Transfer */
    public static String toPascal(String name) {
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return sb.toString();
    }

    /** 保留字后追加下划线 */
    public static String escapeReserved(String name, Set<String> reserved) {
        return reserved.contains(name) ? name + "_" : name;
    }

    /** "Insufficient balance!" → InsufficientBalance；无可用字符时为 null */
    public static String messageToPascal(String message) {
        StringBuilder sb = new StringBuilder();
        for (String word : words(message)) {
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1).toLowerCase());
        }
        if (sb.length() == 0) return null;
        if (Character.isDigit(sb.charAt(0))) sb.insert(0, "Error");
        return sb.toString();
    }

    /** "Insufficient balance!" → INSUFFICIENT_BALANCE；无可用字符时为 null */
    public static String messageToUpperSnake(String message) {
        StringBuilder sb = new StringBuilder();
        for (String word : words(message)) {
            if (sb.length() > 0) sb.append('_');
            sb.append(word.toUpperCase());
        }
        return sb.length() == 0 ? null : sb.toString();
    }

    private static String[] words(String message) {
        String cleaned = message.replaceAll("[^A-Za-z0-9]+", " ").trim();
        return cleaned.isEmpty() ? new String[0] : cleaned.split(" ");
    }

    /**
     * 转义为双引号字符串内容
     */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 转义为 b"..." 字节串内容：非 ASCII 可打印字符按 UTF-8 写成 \xHH
     */
    public static String escapeByteString(String s) {
        StringBuilder sb = new StringBuilder();
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c >= 0x20 && c < 0x7F) {
                        sb.append((char) c);
                    } else {
                        sb.append(String.format("\\x%02x", c));
                    }
            }
        }
        return sb.toString();
    }
}
