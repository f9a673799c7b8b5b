package com.aiaq.io;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Streams JSON into plain Java values: insertion-ordered {@link Map}s, {@link MutableList}s, strings,
 * longs, doubles, booleans and {@code null}.
 */
public class JsonReader {
    private final JsonFactory factory = new JsonFactory();

    public Object read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return readValue(parser, parser.nextToken());
        }
    }

    public Object read(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return readValue(parser, parser.nextToken());
        }
    }

    private Object readValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> readObject(parser);
            case START_ARRAY -> readArray(parser);
            case VALUE_STRING -> parser.getText();
            case VALUE_NUMBER_INT -> parser.getLongValue();
            case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
            case VALUE_TRUE -> Boolean.TRUE;
            case VALUE_FALSE -> Boolean.FALSE;
            case VALUE_NULL -> null;
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private Map<String, Object> readObject(JsonParser parser) throws IOException {
        Map<String, Object> fields = new LinkedHashMap<>();
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            fields.put(fieldName, readValue(parser, parser.nextToken()));
        }
        return fields;
    }

    private MutableList<Object> readArray(JsonParser parser) throws IOException {
        MutableList<Object> elements = Lists.mutable.empty();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(readValue(parser, token));
        }
        return elements;
    }
}
