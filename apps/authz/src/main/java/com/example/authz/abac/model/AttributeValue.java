package com.example.authz.abac.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed attribute value used by ABAC condition evaluation.
 *
 * <p>Callers hand in loosely typed maps ({@code Map<String, Object>}); {@link #of(Object)} converts
 * them once into this closed set of variants so that comparisons never depend on runtime casts.
 */
public sealed interface AttributeValue
        permits AttributeValue.Text, AttributeValue.Numeric, AttributeValue.Bool,
        AttributeValue.ListValue, AttributeValue.MapValue, AttributeValue.Null {

    Null NULL = new Null();

    /**
     * String form used by the {@code in} operator.
     */
    @Nullable
    String asText();

    default boolean isNull() {
        return this instanceof Null;
    }

    /**
     * Convert an arbitrary Java value (as found in attribute maps or JWT claims) into an attribute value.
     * Unknown object types fall back to their {@code toString()} form.
     */
    @NonNull
    static AttributeValue of(@Nullable Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof AttributeValue value) {
            return value;
        }
        if (raw instanceof CharSequence text) {
            return new Text(text.toString());
        }
        if (raw instanceof Boolean bool) {
            return new Bool(bool);
        }
        if (raw instanceof Number number) {
            return new Numeric(number);
        }
        if (raw instanceof Enum<?> constant) {
            return new Text(constant.name());
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, AttributeValue> entries = new LinkedHashMap<>();
            map.forEach((key, value) -> entries.put(String.valueOf(key), of(value)));
            return new MapValue(Collections.unmodifiableMap(entries));
        }
        if (raw instanceof Collection<?> collection) {
            List<AttributeValue> elements = new ArrayList<>(collection.size());
            collection.forEach(element -> elements.add(of(element)));
            return new ListValue(Collections.unmodifiableList(elements));
        }
        if (raw instanceof Object[] array) {
            return of(Arrays.asList(array));
        }
        return new Text(raw.toString());
    }

    record Text(@NonNull String value) implements AttributeValue {
        @Override
        public String asText() {
            return value;
        }
    }

    /**
     * Numeric attribute. Keeps the original {@link Number} so its string form matches the caller's value
     * ({@code 5} stays {@code "5"}, {@code 5.0} stays {@code "5.0"}).
     */
    record Numeric(@NonNull Number value) implements AttributeValue {
        @Override
        public String asText() {
            return value.toString();
        }

        public double asDouble() {
            return value.doubleValue();
        }

        /**
         * Numeric equality independent of the boxed type ({@code 18 == 18L == 18.0}).
         */
        public boolean numericallyEquals(@NonNull Numeric other) {
            try {
                return new BigDecimal(value.toString()).compareTo(new BigDecimal(other.value.toString())) == 0;
            } catch (NumberFormatException e) {
                // NaN / Infinity have no BigDecimal form
                return Double.compare(value.doubleValue(), other.value.doubleValue()) == 0;
            }
        }
    }

    record Bool(boolean value) implements AttributeValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record ListValue(@NonNull List<AttributeValue> elements) implements AttributeValue {
        @Override
        public String asText() {
            return elements.stream().map(AttributeValue::asText).toList().toString();
        }
    }

    record MapValue(@NonNull Map<String, AttributeValue> entries) implements AttributeValue {

        @NonNull
        public AttributeValue get(@NonNull String key) {
            AttributeValue value = entries.get(key);
            return value != null ? value : NULL;
        }

        @Override
        public String asText() {
            return entries.toString();
        }
    }

    record Null() implements AttributeValue {
        @Override
        public String asText() {
            return null;
        }
    }
}
