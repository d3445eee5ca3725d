package com.example.harmonicmixer.policy;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * PolicyType 作为 Map 键时写出小写值
 */
public class PolicyTypeKeySerializer extends JsonSerializer<PolicyType> {

    @Override
    public void serialize(PolicyType value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeFieldName(value.getValue());
    }
}
