package com.vtb.attacktree.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;

/**
 * Формат A: YAML
 */
public class YamlSpecReader extends AbstractSpecReader {

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    @Override
    protected JsonNode parseTree(String content) throws IOException {
        return mapper.readTree(content);
    }

    @Override
    public SpecFormat getFormat() {
        return SpecFormat.YAML;
    }
}
