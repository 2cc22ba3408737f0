package io.nextrun.client.config;

import java.io.IOException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ConfigFactory
{
    final ObjectMapper objectMapper;

    public ConfigFactory(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }

    public Config create()
    {
        return new Config(objectMapper);
    }

    public Config fromJsonString(String json)
    {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        }
        catch (IOException ex) {
            throw new ConfigException(ex);
        }
        if (node == null || !node.isObject()) {
            throw new ConfigException("Expected a JSON object but got " + node);
        }
        return new Config(objectMapper, node);
    }
}
