package io.nextrun.client;

import java.io.IOException;
import java.io.InputStream;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.InjectableValues;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import io.nextrun.client.api.JacksonTimeModule;
import io.nextrun.client.api.RestTriggerNode;
import io.nextrun.client.config.ConfigException;
import io.nextrun.client.config.ConfigFactory;

public final class NodeMapper
{
    private NodeMapper()
    { }

    public static ObjectMapper objectMapper()
    {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new GuavaModule());
        mapper.registerModule(new JacksonTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        // intervals and clock fields are whole numbers; 5.7 must not become 5
        mapper.configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);

        // InjectableValues makes @JacksonInject work which is used at io.nextrun.client.config.Config
        InjectableValues.Std injects = new InjectableValues.Std();
        injects.addValue(ObjectMapper.class, mapper);
        mapper.setInjectableValues(injects);

        return mapper;
    }

    public static ConfigFactory configFactory()
    {
        return new ConfigFactory(objectMapper());
    }

    public static RestTriggerNode readTriggerNode(ObjectMapper mapper, InputStream in)
    {
        try {
            return mapper.readValue(in, RestTriggerNode.class);
        }
        catch (IOException ex) {
            throw new ConfigException("Invalid trigger node: " + ex.getMessage(), ex);
        }
    }
}
