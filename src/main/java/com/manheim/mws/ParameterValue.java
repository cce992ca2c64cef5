package com.manheim.mws;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A value supplied as an extra request parameter: either a single primitive or a one-level map of primitives
 * that is flattened into dotted parameter names.
 */
public abstract class ParameterValue {

   private ParameterValue() {
   }

   /**
    * Converts a caller supplied value. Strings, numbers, booleans and times become a {@link Primitive}, maps of
    * those become a {@link Nested}.
    *
    * @param name parameter name, used to report unsupported values
    * @throws InvalidQueryException if the value has an unsupported type or is nested more than one level
    */
   public static ParameterValue from(String name, Object value) {
      if (value instanceof ParameterValue) {
         return (ParameterValue) value;
      }
      if (value instanceof Map) {
         Map<String, Primitive> entries = new LinkedHashMap<>();
         for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            String childName = String.valueOf(entry.getKey());
            if (entry.getValue() instanceof Map || entry.getValue() instanceof Nested) {
               throw new InvalidQueryException(InvalidQueryException.Reason.INVALID_PARAMETER, name + "." + childName,
                     "parameters may only be nested one level deep");
            }
            entries.put(childName, primitive(name + "." + childName, entry.getValue()));
         }
         return new Nested(entries);
      }
      return primitive(name, value);
   }

   /**
    * Renders a single value the way MWS expects it on the wire. {@code null} renders as the empty string.
    *
    * @throws InvalidQueryException if the value is not a string, number, boolean or time
    */
   public static Primitive primitive(String name, Object value) {
      if (value instanceof Primitive) {
         return (Primitive) value;
      }
      if (value == null) {
         return new Primitive("");
      }
      if (value instanceof CharSequence || value instanceof Character) {
         return new Primitive(wellFormed(name, value.toString()));
      }
      if (value instanceof Boolean) {
         return new Primitive(value.toString());
      }
      if (value instanceof BigDecimal) {
         return new Primitive(((BigDecimal) value).toPlainString());
      }
      if (value instanceof Double || value instanceof Float) {
         return new Primitive(plainDecimal(name, (Number) value));
      }
      if (value instanceof Number) {
         return new Primitive(value.toString());
      }
      if (value instanceof OffsetDateTime) {
         return new Primitive(ParameterNormalizer.formatTime((OffsetDateTime) value));
      }
      if (value instanceof ZonedDateTime) {
         return new Primitive(ParameterNormalizer.formatTime(((ZonedDateTime) value).toOffsetDateTime()));
      }
      if (value instanceof Instant) {
         return new Primitive(ParameterNormalizer.formatTime(((Instant) value).atOffset(ZoneOffset.UTC)));
      }
      if (value instanceof Date) {
         return new Primitive(ParameterNormalizer.formatTime(((Date) value).toInstant().atOffset(ZoneOffset.UTC)));
      }
      throw new InvalidQueryException(InvalidQueryException.Reason.INVALID_PARAMETER, name,
            "unsupported value of type " + value.getClass().getName());
   }

   /**
    * Plain decimal form of a floating point value, e.g. {@code 1e20} renders as {@code 100000000000000000000}.
    */
   private static String plainDecimal(String name, Number value) {
      double d = value.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
         throw new InvalidQueryException(InvalidQueryException.Reason.INVALID_PARAMETER, name,
               "not a finite number: " + value);
      }
      BigDecimal decimal = value instanceof Float ? new BigDecimal(value.toString()) : BigDecimal.valueOf(d);
      if (decimal.signum() == 0) {
         return "0";
      }
      return decimal.stripTrailingZeros().toPlainString();
   }

   /**
    * Unpaired surrogates cannot be encoded as UTF-8.
    */
   private static String wellFormed(String name, String s) {
      for (int i = 0; i < s.length(); i++) {
         char c = s.charAt(i);
         if (Character.isHighSurrogate(c) && i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
            i++;
         } else if (Character.isSurrogate(c)) {
            throw new InvalidQueryException(InvalidQueryException.Reason.INVALID_PARAMETER, name,
                  "unpaired surrogate at index " + i);
         }
      }
      return s;
   }

   public static final class Primitive extends ParameterValue {
      private final String rendered;

      private Primitive(String rendered) {
         this.rendered = rendered;
      }

      public String getRendered() {
         return rendered;
      }

      @Override
      public boolean equals(Object o) {
         return o instanceof Primitive && rendered.equals(((Primitive) o).rendered);
      }

      @Override
      public int hashCode() {
         return rendered.hashCode();
      }

      @Override
      public String toString() {
         return rendered;
      }
   }

   public static final class Nested extends ParameterValue {
      private final Map<String, Primitive> entries;

      private Nested(Map<String, Primitive> entries) {
         this.entries = Collections.unmodifiableMap(entries);
      }

      public Map<String, Primitive> getEntries() {
         return entries;
      }

      @Override
      public boolean equals(Object o) {
         return o instanceof Nested && entries.equals(((Nested) o).entries);
      }

      @Override
      public int hashCode() {
         return entries.hashCode();
      }

      @Override
      public String toString() {
         return entries.toString();
      }
   }
}
