package datahandler.model;

import java.io.IOException;
import java.util.Map;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

/**
 * Writes a table as {"epochMillis": {"column": value, ...}, ...}. Every row lists every column, missing cells are null.
 */
public class TimeSeriesTableSerializer extends StdSerializer<TimeSeriesTable> {

    private static final long serialVersionUID = 1L;

    public TimeSeriesTableSerializer() {
        super(TimeSeriesTable.class);
    }

    @Override
    public void serialize(TimeSeriesTable table, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        for (Long timestamp : table.getTimestamps()) {
            gen.writeFieldName(Long.toString(timestamp));
            gen.writeStartObject();
            Map<String,Object> row = table.getRow(timestamp);
            for (String column : table.getColumns()) {
                provider.defaultSerializeField(column, row.get(column), gen);
            }
            gen.writeEndObject();
        }
        gen.writeEndObject();
    }
}
