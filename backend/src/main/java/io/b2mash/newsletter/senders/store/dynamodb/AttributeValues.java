package io.b2mash.newsletter.senders.store.dynamodb;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** Converts between plain Java attribute maps and DynamoDB {@link AttributeValue}s. */
final class AttributeValues {

  private AttributeValues() {}

  static Map<String, AttributeValue> toItem(Map<String, ?> attributes) {
    var item = new LinkedHashMap<String, AttributeValue>();
    attributes.forEach(
        (name, value) -> {
          if (value != null) {
            item.put(name, toAttributeValue(value));
          }
        });
    return item;
  }

  static Map<String, Object> fromItem(Map<String, AttributeValue> item) {
    var attributes = new LinkedHashMap<String, Object>();
    item.forEach((name, value) -> attributes.put(name, fromAttributeValue(value)));
    return attributes;
  }

  static AttributeValue toAttributeValue(Object value) {
    if (value instanceof String s) {
      return AttributeValue.fromS(s);
    }
    if (value instanceof Boolean b) {
      return AttributeValue.fromBool(b);
    }
    if (value instanceof Number n) {
      return AttributeValue.fromN(n.toString());
    }
    if (value instanceof List<?> list) {
      var values = new ArrayList<AttributeValue>(list.size());
      for (var element : list) {
        values.add(toAttributeValue(element));
      }
      return AttributeValue.fromL(values);
    }
    if (value instanceof Map<?, ?> map) {
      var values = new LinkedHashMap<String, AttributeValue>();
      map.forEach(
          (name, element) -> {
            if (element != null) {
              values.put((String) name, toAttributeValue(element));
            }
          });
      return AttributeValue.fromM(values);
    }
    throw new IllegalArgumentException(
        "Unsupported attribute type: " + value.getClass().getName());
  }

  static Object fromAttributeValue(AttributeValue value) {
    return switch (value.type()) {
      case S -> value.s();
      case N -> parseNumber(value.n());
      case BOOL -> value.bool();
      case NUL -> null;
      case L -> {
        var list = new ArrayList<Object>(value.l().size());
        for (var element : value.l()) {
          list.add(fromAttributeValue(element));
        }
        yield list;
      }
      case M -> fromItem(value.m());
      default -> throw new IllegalArgumentException("Unsupported attribute type: " + value.type());
    };
  }

  private static Object parseNumber(String number) {
    if (number.indexOf('.') >= 0 || number.indexOf('e') >= 0 || number.indexOf('E') >= 0) {
      return new BigDecimal(number);
    }
    return Long.parseLong(number);
  }
}
