package com.umitunal.qworker.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brings payload values into the form they take after a JSON round trip.
 *
 * <p>Integral numbers become {@code Integer} when they fit, otherwise {@code Long}
 * or {@code BigInteger}; decimals become {@code Double}; characters become
 * strings; nested maps and collections are copied read-only. Values JSON cannot
 * carry back unchanged (byte arrays, enums, arbitrary objects, non-finite
 * numbers) are rejected.
 */
final class Payloads {

    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private Payloads() {}

    /**
     * @throws JobValidationException if a value has no exact JSON form
     */
    static Map<String, Object> normalize(String jobName, Map<String, ?> payload) {
        if (payload == null) {
            return Collections.emptyMap();
        }
        return normalizeMap(jobName, "", payload);
    }

    private static Map<String, Object> normalizeMap(String jobName, String path, Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new JobValidationException(jobName + " payload keys must be strings, got "
                        + entry.getKey() + " at " + (path.isEmpty() ? "top level" : path));
            }
            String key = (String) entry.getKey();
            String childPath = path.isEmpty() ? key : path + "." + key;
            copy.put(key, normalizeValue(jobName, childPath, entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object normalizeValue(String jobName, String path, Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long) {
            long l = (Long) value;
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                return (int) l;
            }
            return l;
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            if (big.compareTo(INT_MIN) >= 0 && big.compareTo(INT_MAX) <= 0) {
                return big.intValue();
            }
            if (big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0) {
                return big.longValue();
            }
            return big;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            // Parsed from the decimal text, as a JSON reader would
            double d = Double.parseDouble(value.toString());
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new JobValidationException(jobName + " payload field " + path + " is not a finite number");
            }
            return d;
        }
        if (value instanceof Map) {
            return normalizeMap(jobName, path, (Map<?, ?>) value);
        }
        if (value instanceof Collection) {
            List<Object> list = new ArrayList<>();
            int index = 0;
            for (Object element : (Collection<?>) value) {
                list.add(normalizeValue(jobName, path + "[" + index++ + "]", element));
            }
            return Collections.unmodifiableList(list);
        }
        if (value instanceof Object[]) {
            return normalizeValue(jobName, path, Arrays.asList((Object[]) value));
        }
        throw new JobValidationException(jobName + " payload field " + path + " has unsupported type "
                + value.getClass().getName());
    }
}
