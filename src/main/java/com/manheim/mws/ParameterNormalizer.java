package com.manheim.mws;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Flattens an {@link MwsQuery} into the string-to-string parameter map that gets canonicalized and signed.
 */
class ParameterNormalizer {
   private static final Log LOG = LogFactory.getLog(ParameterNormalizer.class);

   public static final String AWS_ACCESS_KEY_ID = "AWSAccessKeyId";
   public static final String ACTION = "Action";
   public static final String MWS_AUTH_TOKEN = "MWSAuthToken";
   public static final String SELLER_ID = "SellerId";
   public static final String SIGNATURE_METHOD = "SignatureMethod";
   public static final String SIGNATURE_VERSION = "SignatureVersion";
   public static final String TIMESTAMP = "Timestamp";
   public static final String VERSION = "Version";
   public static final String ISO_8601_TIME_FORMAT = "uuuu-MM-dd'T'HH:mm:ssxxx";

   private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern(ISO_8601_TIME_FORMAT,
         Locale.ROOT);

   /**
    * Keys are unique and every value is non-empty. Iteration order is not significant.
    */
   Map<String, String> normalize(MwsQuery query) {
      Map<String, String> result = new LinkedHashMap<>();
      putUnique(result, AWS_ACCESS_KEY_ID, query.getAccessKeyId());
      putUnique(result, ACTION, query.getAction());
      putUnique(result, SELLER_ID, query.getSellerId());
      putUnique(result, SIGNATURE_METHOD, query.getSignatureMethod());
      putUnique(result, SIGNATURE_VERSION, String.valueOf(query.getSignatureVersion()));
      putUnique(result, TIMESTAMP, formatTime(query.getTimestamp()));
      putUnique(result, VERSION, query.getVersion());
      if (query.getMwsAuthToken() != null) {
         putUnique(result, MWS_AUTH_TOKEN, query.getMwsAuthToken());
      }
      for (Map.Entry<String, String> entry : flattenParams(query.getParams()).entrySet()) {
         putUnique(result, entry.getKey(), entry.getValue());
      }
      for (Map.Entry<String, String> entry : expandStructuredLists(query.getStructuredLists().values()).entrySet()) {
         putUnique(result, entry.getKey(), entry.getValue());
      }
      if (result.containsKey(CanonicalStringBuilder.SIGNATURE)) {
         throw new InvalidQueryException(InvalidQueryException.Reason.INVALID_PARAMETER,
               CanonicalStringBuilder.SIGNATURE, "parameter name is reserved for the request signature");
      }
      return result;
   }

   /**
    * Camelizes names and flattens nested values into {@code Parent.Child} keys. Empty values are dropped.
    */
   static Map<String, String> flattenParams(Map<String, ParameterValue> params) {
      Map<String, String> result = new LinkedHashMap<>();
      for (Map.Entry<String, ParameterValue> entry : params.entrySet()) {
         String key = camelize(entry.getKey());
         ParameterValue value = entry.getValue();
         if (value instanceof ParameterValue.Nested) {
            for (Map.Entry<String, ParameterValue.Primitive> child : ((ParameterValue.Nested) value).getEntries()
                  .entrySet()) {
               putUnique(result, key + '.' + camelize(child.getKey()), child.getValue().getRendered());
            }
         } else {
            putUnique(result, key, ((ParameterValue.Primitive) value).getRendered());
         }
      }
      return result;
   }

   /**
    * Emits {@code label.N} for every value, N starting at 1. Labels are not camelized.
    */
   static Map<String, String> expandStructuredLists(Collection<StructuredList> lists) {
      Map<String, String> result = new LinkedHashMap<>();
      for (StructuredList list : lists) {
         List<ParameterValue.Primitive> values = list.getValues();
         for (int i = 0; i < values.size(); i++) {
            putUnique(result, list.getLabel() + '.' + (i + 1), values.get(i).getRendered());
         }
      }
      return result;
   }

   /**
    * {@code custom_param} becomes {@code CustomParam}. Only the first letter of each segment is touched.
    */
   static String camelize(String name) {
      StringBuilder result = new StringBuilder(name.length());
      for (String segment : name.split("_")) {
         if (!segment.isEmpty()) {
            result.appendCodePoint(Character.toUpperCase(segment.codePointAt(0)))
                  .append(segment, Character.charCount(segment.codePointAt(0)), segment.length());
         }
      }
      return result.toString();
   }

   /**
    * ISO-8601 with seconds precision, keeping the offset of the given time, e.g. {@code
    * 2013-01-01T00:00:00-02:00}.
    */
   static String formatTime(OffsetDateTime time) {
      return TIME_FORMATTER.format(time);
   }

   private static void putUnique(Map<String, String> target, String key, String value) {
      if (value == null || value.isEmpty()) {
         if (LOG.isDebugEnabled()) {
            LOG.debug("Dropping empty parameter " + key);
         }
         return;
      }
      if (target.containsKey(key)) {
         throw new InvalidQueryException(InvalidQueryException.Reason.INVALID_PARAMETER, key,
               "parameter is defined more than once");
      }
      target.put(key, value);
   }
}
