package tech.accessplane.platform.store;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion between {@link Item} attribute values and DynamoDB
 * {@link AttributeValue}s.
 *
 * <p>Numbers without a fraction or exponent come back as {@link Long}, all
 * others as {@link BigDecimal}. Binary values are decoded to UTF-8 strings.
 */
final class AttributeValues {

    private AttributeValues() {
    }

    static Map<String, AttributeValue> toAttributeMap(Item item) {
        return toAttributeMap(item.attributes());
    }

    static Map<String, AttributeValue> toAttributeMap(Map<String, ?> values) {
        Map<String, AttributeValue> result = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (value != null) {
                result.put(name, toAttributeValue(value));
            }
        });
        return result;
    }

    static Map<String, AttributeValue> keyOf(ItemKey key) {
        return Map.of(
            KeySpace.PK, AttributeValue.fromS(key.partitionKey()),
            KeySpace.SK, AttributeValue.fromS(key.sortKey()));
    }

    static AttributeValue toAttributeValue(Object value) {
        if (value == null) {
            return AttributeValue.fromNul(true);
        }
        if (value instanceof String s) {
            return AttributeValue.fromS(s);
        }
        if (value instanceof Boolean b) {
            return AttributeValue.fromBool(b);
        }
        if (value instanceof Number n) {
            return AttributeValue.fromN(n instanceof BigDecimal bd ? bd.toPlainString() : n.toString());
        }
        if (value instanceof List<?> list) {
            List<AttributeValue> converted = new ArrayList<>(list.size());
            for (Object element : list) {
                converted.add(toAttributeValue(element));
            }
            return AttributeValue.fromL(converted);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, AttributeValue> converted = new LinkedHashMap<>();
            map.forEach((k, v) -> converted.put(String.valueOf(k), toAttributeValue(v)));
            return AttributeValue.fromM(converted);
        }
        if (value instanceof Enum<?> e) {
            return AttributeValue.fromS(e.name());
        }
        return AttributeValue.fromS(value.toString());
    }

    static Item toItem(Map<String, AttributeValue> attributes) {
        Item.Builder builder = Item.builder();
        attributes.forEach((name, value) -> builder.set(name, fromAttributeValue(value)));
        return builder.build();
    }

    static Object fromAttributeValue(AttributeValue value) {
        if (value == null) {
            return null;
        }
        return switch (value.type()) {
            case S -> value.s();
            case N -> parseNumber(value.n());
            case BOOL -> value.bool();
            case NUL -> null;
            case L -> {
                List<Object> list = new ArrayList<>(value.l().size());
                for (AttributeValue element : value.l()) {
                    list.add(fromAttributeValue(element));
                }
                yield list;
            }
            case M -> {
                Map<String, Object> map = new LinkedHashMap<>();
                value.m().forEach((k, v) -> {
                    Object converted = fromAttributeValue(v);
                    if (converted != null) {
                        map.put(k, converted);
                    }
                });
                yield map;
            }
            case SS -> new ArrayList<>(value.ss());
            case NS -> value.ns().stream().map(AttributeValues::parseNumber).toList();
            case B -> value.b().asUtf8String();
            case BS -> value.bs().stream().map(SdkBytes::asUtf8String).toList();
            case UNKNOWN_TO_SDK_VERSION -> null;
        };
    }

    private static Object parseNumber(String n) {
        if (n.indexOf('.') < 0 && n.indexOf('e') < 0 && n.indexOf('E') < 0) {
            try {
                return Long.parseLong(n);
            } catch (NumberFormatException ignored) {
                // too large for a long
                return new BigDecimal(n);
            }
        }
        return new BigDecimal(n);
    }
}
