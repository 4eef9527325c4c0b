package com.dimensional.units.json;

import com.dimensional.units.Unit;
import com.dimensional.units.UnitAliasManager;
import com.dimensional.units.UnitException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.Objects;

/**
 * Jackson module that writes a {@link Unit} as its rendered formula string and reads it back
 * with {@link Unit#parse(String, UnitAliasManager)}.
 *
 * <p>Aliases are written by name, so the reading side needs a registry that knows them.
 */
public final class UnitJsonModule extends SimpleModule {

    public UnitJsonModule(UnitAliasManager registry) {
        super("UnitJsonModule");
        Objects.requireNonNull(registry, "registry must not be null");
        addSerializer(Unit.class, new UnitSerializer());
        addDeserializer(Unit.class, new UnitDeserializer(registry));
    }

    static final class UnitSerializer extends StdSerializer<Unit> {

        UnitSerializer() {
            super(Unit.class);
        }

        @Override
        public void serialize(Unit value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.render());
        }
    }

    static final class UnitDeserializer extends StdDeserializer<Unit> {

        private final UnitAliasManager registry;

        UnitDeserializer(UnitAliasManager registry) {
            super(Unit.class);
            this.registry = registry;
        }

        @Override
        public Unit deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.VALUE_STRING) {
                return (Unit) ctxt.handleUnexpectedToken(Unit.class, p);
            }
            String formula = p.getText();
            try {
                return Unit.parse(formula, registry);
            } catch (UnitException e) {
                throw ctxt.weirdStringException(formula, Unit.class, e.getMessage());
            }
        }
    }
}
