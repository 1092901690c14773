package com.lineweave.text.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.lineweave.core.token.BreakMode;
import com.lineweave.core.token.Token;
import com.lineweave.text.TokenizeException;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 从 JSON 读取 token 流
 *
 * <p>格式为对象数组，每个对象的 {@code type} 取值：
 * {@code string}（{@code text}）、{@code break}（{@code blank}, {@code offset}）、
 * {@code linebreak}（{@code offset}）、{@code begin}（{@code offset}, {@code mode}）、
 * {@code end}、{@code eof}。省略的数值字段按 0 处理，{@code break} 的 {@code blank} 默认 1。</p>
 */
public class JsonTokenReader {

    /**
     * 读取整个数组
     *
     * @throws TokenizeException JSON 非法或字段缺失
     */
    public List<Token> read(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new TokenizeException("Malformed JSON token stream: " + e.getMessage(), e);
        }
        if (!root.isJsonArray()) {
            throw new TokenizeException("Token stream must be a JSON array", -1, -1);
        }

        JsonArray array = root.getAsJsonArray();
        List<Token> tokens = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonElement element = array.get(i);
            if (!element.isJsonObject()) {
                throw new TokenizeException("Token #" + i + " is not an object", -1, -1);
            }
            tokens.add(toToken(element.getAsJsonObject(), i));
        }
        return tokens;
    }

    public List<Token> read(String json) {
        return read(new StringReader(json));
    }

    private Token toToken(JsonObject obj, int index) {
        String type = requireString(obj, "type", index).toLowerCase(Locale.ROOT);
        try {
            switch (type) {
                case "string":
                    return Token.string(requireString(obj, "text", index));
                case "break":
                    return Token.breakToken(intField(obj, "blank", 1), intField(obj, "offset", 0));
                case "linebreak":
                    return Token.lineBreak(intField(obj, "offset", 0));
                case "begin":
                    return Token.begin(intField(obj, "offset", 0), mode(obj, index));
                case "end":
                    return Token.end();
                case "eof":
                    return Token.eof();
                default:
                    throw new TokenizeException("Token #" + index + " has unknown type '" + type + "'", -1, -1);
            }
        } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
            // 数值字段类型不符或取值非法
            throw new TokenizeException("Token #" + index + " is invalid: " + e.getMessage(), e);
        }
    }

    private static BreakMode mode(JsonObject obj, int index) {
        if (!obj.has("mode")) {
            return BreakMode.INCONSISTENT;
        }
        String mode = obj.get("mode").getAsString().toUpperCase(Locale.ROOT);
        try {
            return BreakMode.valueOf(mode);
        } catch (IllegalArgumentException e) {
            throw new TokenizeException("Token #" + index + " has unknown mode '" + mode + "'", e);
        }
    }

    private static String requireString(JsonObject obj, String field, int index) {
        JsonElement e = obj.get(field);
        if (e == null || !e.isJsonPrimitive()) {
            throw new TokenizeException("Token #" + index + " is missing '" + field + "'", -1, -1);
        }
        return e.getAsString();
    }

    private static int intField(JsonObject obj, String field, int defaultValue) {
        JsonElement e = obj.get(field);
        return e == null || e.isJsonNull() ? defaultValue : e.getAsInt();
    }
}
