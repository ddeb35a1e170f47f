package com.practice.todoapi.todo.web.json;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.practice.todoapi.todo.domain.model.Patch;

/**
 * Reads a {@link Patch} property: a JSON value becomes {@link Patch#of}, an explicit
 * {@code null} becomes {@link Patch#clear()} and a missing key stays {@link Patch#absent()}.
 */
public class PatchDeserializer extends StdDeserializer<Patch<?>> implements ContextualDeserializer {

    private final JavaType valueType;

    public PatchDeserializer() {
        this(null);
    }

    private PatchDeserializer(JavaType valueType) {
        super(Patch.class);
        this.valueType = valueType;
    }

    @Override
    public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property) {
        JavaType type = property != null ? property.getType() : ctxt.getContextualType();
        if (type == null) {
            return this;
        }
        return new PatchDeserializer(type.containedTypeOrUnknown(0));
    }

    @Override
    public Patch<?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        Object value = ctxt.readValue(p, valueType);
        return Patch.ofNullable(value);
    }

    @Override
    public Patch<?> getNullValue(DeserializationContext ctxt) {
        return Patch.clear();
    }

    @Override
    public Object getAbsentValue(DeserializationContext ctxt) {
        return Patch.absent();
    }
}
