package gr.imsi.athenarc.pipeline.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep copies of loosely typed values (filter operands, extras, operation options)
 * into unmodifiable collections. Nulls are kept, insertion order is kept.
 */
final class ImmutableValues {

    private ImmutableValues() {}

    static Object copyOf(Object value) {
        if (value instanceof Map) {
            return copyOfMap((Map<?, ?>) value);
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>(((Collection<?>) value).size());
            for (Object element : (Collection<?>) value) {
                copy.add(copyOf(element));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Object[]) {
            Object[] array = (Object[]) value;
            List<Object> copy = new ArrayList<>(array.length);
            for (Object element : array) {
                copy.add(copyOf(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    static Map<String, Object> copyOfMap(Map<?, ?> map) {
        if (map == null) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }
}
