package com.lineweave.text.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.lineweave.core.token.Token;

import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import java.util.Locale;

/**
 * 把 token 流写成 {@link JsonTokenReader} 可读的 JSON
 */
public class JsonTokenWriter {
    private final Gson gson;

    public JsonTokenWriter() {
        this.gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    }

    public void write(List<Token> tokens, Writer writer) {
        gson.toJson(toJson(tokens), writer);
    }

    public String write(List<Token> tokens) {
        StringWriter out = new StringWriter();
        write(tokens, out);
        return out.toString();
    }

    JsonArray toJson(List<Token> tokens) {
        JsonArray array = new JsonArray();
        for (Token token : tokens) {
            array.add(toJson(token));
        }
        return array;
    }

    private static JsonObject toJson(Token token) {
        JsonObject obj = new JsonObject();
        switch (token.getKind()) {
            case STRING:
                obj.addProperty("type", "string");
                obj.addProperty("text", token.getText());
                break;
            case BREAK:
                if (token.isLineBreak()) {
                    obj.addProperty("type", "linebreak");
                } else {
                    obj.addProperty("type", "break");
                    obj.addProperty("blank", token.getBlankSpace());
                }
                obj.addProperty("offset", token.getOffset());
                break;
            case BEGIN:
                obj.addProperty("type", "begin");
                obj.addProperty("offset", token.getOffset());
                obj.addProperty("mode", token.getMode().name().toLowerCase(Locale.ROOT));
                break;
            default:
                obj.addProperty("type", token.getKind().name().toLowerCase(Locale.ROOT));
                break;
        }
        return obj;
    }
}
