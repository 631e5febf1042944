package com.ai.handoff.dto;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Reads timestamps in every shape older metadata used: epoch seconds or millis,
 * ISO instants, offset date-times and zone-less local date-times (taken as UTC).
 */
public class LenientInstantDeserializer extends StdDeserializer<Instant> {

    private static final long MILLIS_THRESHOLD = 100_000_000_000L;

    public LenientInstantDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT) {
            return fromEpoch(p.getLongValue());
        }
        if (token == JsonToken.VALUE_NUMBER_FLOAT) {
            double seconds = p.getDoubleValue();
            return Instant.ofEpochMilli(Math.round(seconds * 1000));
        }
        if (token == JsonToken.VALUE_STRING) {
            String text = p.getText().trim();
            if (StringUtils.isEmpty(text)) {
                return null;
            }
            Instant parsed = parse(text);
            if (parsed == null) {
                return (Instant) ctxt.handleWeirdStringValue(Instant.class, text, "Unrecognized timestamp");
            }
            return parsed;
        }
        return (Instant) ctxt.handleUnexpectedToken(Instant.class, p);
    }

    static Instant parse(String text) {
        if (StringUtils.isNumeric(text)) {
            return fromEpoch(Long.parseLong(text));
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text,
                    OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant fromEpoch(long value) {
        return value >= MILLIS_THRESHOLD ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
    }
}
