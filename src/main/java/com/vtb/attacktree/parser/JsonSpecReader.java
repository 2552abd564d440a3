package com.vtb.attacktree.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Формат B: JSON
 */
public class JsonSpecReader extends AbstractSpecReader {

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    protected JsonNode parseTree(String content) throws IOException {
        return mapper.readTree(content);
    }

    @Override
    public SpecFormat getFormat() {
        return SpecFormat.JSON;
    }
}
