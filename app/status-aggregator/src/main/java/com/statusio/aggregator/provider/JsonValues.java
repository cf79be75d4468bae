/*
 * どこで: Status Aggregator プロバイダ層
 * 何を: 型が揺れる JSON 値(数値/数値文字列/真偽値)を明示的に読み取る
 * なぜ: 各アダプタの DTO で許容する表現を限定し、曖昧なフィールド参照を避けるため
 */
package com.statusio.aggregator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.OptionalDouble;

final class JsonValues {

  private JsonValues() {}

  static boolean isPresent(JsonNode node) {
    return node != null && !node.isNull() && !node.isMissingNode();
  }

  /** 数値、または数値として解釈できる文字列のみを数値として返す。 */
  static OptionalDouble number(JsonNode node) {
    if (!isPresent(node)) {
      return OptionalDouble.empty();
    }
    if (node.isNumber()) {
      return OptionalDouble.of(node.doubleValue());
    }
    if (node.isTextual()) {
      try {
        return OptionalDouble.of(Double.parseDouble(node.textValue().trim()));
      } catch (NumberFormatException ex) {
        return OptionalDouble.empty();
      }
    }
    return OptionalDouble.empty();
  }

  static double numberOrZero(JsonNode node) {
    return number(node).orElse(0d);
  }

  /** 文字列・数値を文字列として返す。空文字やそれ以外の型は null。 */
  static String text(JsonNode node) {
    if (!isPresent(node) || !node.isValueNode()) {
      return null;
    }
    final String value = node.asText();
    return value == null || value.isBlank() ? null : value;
  }

  static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first;
    }
    if (second != null && !second.isBlank()) {
      return second;
    }
    return null;
  }
}
