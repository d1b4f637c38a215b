package com.example.cloudbeatsbackup.infrastructure.backup;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.util.Locale;

/**
 * Writes a number rounded to one decimal place, always with the decimal: 215.0, 183.4.
 */
public class OneDecimalSerializer extends StdSerializer<Double> {

    public OneDecimalSerializer() {
        super(Double.class);
    }

    @Override
    public void serialize(Double value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        double number = value == null || value.isNaN() || value.isInfinite() ? 0d : value;
        gen.writeNumber(String.format(Locale.ROOT, "%.1f", number));
    }
}
