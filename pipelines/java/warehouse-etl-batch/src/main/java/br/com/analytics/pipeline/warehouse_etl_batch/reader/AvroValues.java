package br.com.analytics.pipeline.warehouse_etl_batch.reader;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericEnumSymbol;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;
import org.jspecify.annotations.Nullable;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns Avro generic values into plain Java values: strings, lists and maps all the way down.
 */
final class AvroValues {

    private AvroValues() {
    }

    static Map<String, @Nullable Object> toMap(GenericRecord record) {
        Map<String, @Nullable Object> values = new LinkedHashMap<>();
        for (Schema.Field field : record.getSchema().getFields()) {
            values.put(field.name(), toJava(record.get(field.pos())));
        }
        return values;
    }

    static @Nullable Object toJava(@Nullable Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof CharSequence || value instanceof GenericEnumSymbol<?>) {
            return value.toString();
        }
        if (value instanceof GenericRecord record) {
            return unwrapListElement(toMap(record));
        }
        if (value instanceof Collection<?> collection) {
            List<@Nullable Object> list = new ArrayList<>(collection.size());
            for (Object element : collection) {
                list.add(toJava(element));
            }
            return list;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, @Nullable Object> converted = new LinkedHashMap<>();
            map.forEach((key, item) -> converted.put(String.valueOf(key), toJava(item)));
            return converted;
        }
        if (value instanceof ByteBuffer buffer) {
            byte[] bytes = new byte[buffer.remaining()];
            buffer.duplicate().get(bytes);
            return bytes;
        }
        if (value instanceof GenericFixed fixed) {
            return fixed.bytes().clone();
        }
        return value;
    }

    // Parquet 3-level lists can surface as {element: {...}} wrappers depending on the writer
    private static Object unwrapListElement(Map<String, @Nullable Object> values) {
        if (values.size() == 1) {
            Map.Entry<String, @Nullable Object> only = values.entrySet().iterator().next();
            if (("element".equals(only.getKey()) || "item".equals(only.getKey())) && only.getValue() instanceof Map<?, ?>) {
                return only.getValue();
            }
        }
        return values;
    }
}
