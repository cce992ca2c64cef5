package com.manheim.mws;

import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds the Signature Version 2 string to sign:
 * <pre>
 * VERB
 * host
 * /path
 * sorted-and-encoded-query
 * </pre>
 * The query line is produced by the same encoder as the query sent on the wire.
 *
 * @see http://docs.aws.amazon.com/general/latest/gr/signature-version-2.html
 */
class CanonicalStringBuilder {
   public static final String ENCODING = "UTF8";
   public static final String SIGNATURE = "Signature";

   /**
    * Orders parameter names by Unicode code point.
    */
   static final Comparator<String> KEY_ORDER = new Comparator<String>() {
      @Override
      public int compare(String a, String b) {
         int i = 0;
         int j = 0;
         while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
               return ca < cb ? -1 : 1;
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
         }
         return (a.length() - i) - (b.length() - j);
      }
   };

   private final ParameterNormalizer normalizer;

   CanonicalStringBuilder() {
      this(new ParameterNormalizer());
   }

   CanonicalStringBuilder(ParameterNormalizer normalizer) {
      this.normalizer = normalizer;
   }

   String canonical(MwsQuery query) {
      return query.getVerb().name() + '\n' +
            canonicalHost(query.getHost()) + '\n' +
            query.getUriPath() + '\n' +
            queryString(query, null);
   }

   /**
    * @param signature added as {@code Signature} before sorting when not {@code null}; expected unencoded
    */
   String queryString(MwsQuery query, String signature) {
      SortedMap<String, String> sortedParams = new TreeMap<>(KEY_ORDER);
      sortedParams.putAll(normalizer.normalize(query));
      if (signature != null && !signature.isEmpty()) {
         sortedParams.put(SIGNATURE, signature);
      }
      return addQueryString(sortedParams, new StringBuilder()).toString();
   }

   StringBuilder addQueryString(SortedMap<String, String> sortedParams, StringBuilder builder) {
      int startingLength = builder.length();
      for (Map.Entry<String, String> entry : sortedParams.entrySet()) {
         if (builder.length() > startingLength) {
            builder.append('&');
         }
         builder.append(encode(entry.getKey())).append('=').append(encode(entry.getValue()));
      }
      return builder;
   }

   /**
    * Lower case, port stripped.
    */
   String canonicalHost(String host) {
      String result = host.toLowerCase(Locale.ROOT);
      int portSeparator = result.lastIndexOf(':');
      return portSeparator >= 0 ? result.substring(0, portSeparator) : result;
   }

   /**
    * Percent-encodes UTF-8 bytes with upper case hex, leaving {@code A-Z a-z 0-9 - _ . ~} as is. Space is
    * rendered as {@code +}, which is what MWS accepts for both the string to sign and the transmitted query.
    */
   String encode(String s) {
      try {
         return URLEncoder.encode(s, ENCODING)
               .replace("*", "%2A")
               .replace("%7E", "~");
      } catch (UnsupportedEncodingException e) {
         // Will never happen with "UTF8" hardcoded.
         throw new RuntimeException(e);
      }
   }
}
