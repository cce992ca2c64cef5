package com.manheim.mws;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import org.apache.http.client.methods.HttpUriRequest;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An MWS query request: everything needed to produce the canonical string, the Signature Version 2 signature and
 * the signed request URI. Instances are immutable and safe to share between threads; every derived value is
 * recomputed from the same fields and is therefore stable.
 *
 * <pre>
 * MwsQuery query = MwsQuery.builder()
 *       .endpoint(MwsEndpoint.EUROPE)
 *       .api(MwsApi.ORDERS)
 *       .credentials(accessKeyId, secretKey)
 *       .action("ListOrders")
 *       .sellerId(sellerId)
 *       .param("created_after", createdAfter)
 *       .structuredList("marketplaces", "MarketplaceId.Id", marketplaceId)
 *       .build();
 * String uri = query.requestUri();
 * </pre>
 */
public final class MwsQuery {
   public static final HttpVerb DEFAULT_VERB = HttpVerb.GET;
   public static final String DEFAULT_URI_PATH = "/";
   public static final String SIGNATURE_METHOD = "HmacSHA256";
   public static final int SIGNATURE_VERSION = 2;

   private static final ParameterNormalizer NORMALIZER = new ParameterNormalizer();
   private static final QueryAssembler ASSEMBLER = new QueryAssembler();

   private final HttpVerb verb;
   private final String uriPath;
   private final String host;
   private final AWSCredentials credentials;
   private final String action;
   private final String sellerId;
   private final String version;
   private final OffsetDateTime timestamp;
   private final String mwsAuthToken;
   private final Map<String, ParameterValue> params;
   private final Map<String, StructuredList> structuredLists;

   private MwsQuery(Builder builder, AWSCredentials credentials, OffsetDateTime timestamp) {
      this.verb = builder.verb;
      this.uriPath = builder.uriPath;
      this.host = builder.host;
      this.credentials = credentials;
      this.action = builder.action;
      this.sellerId = builder.sellerId;
      this.version = builder.version;
      this.timestamp = timestamp;
      this.mwsAuthToken = isEmpty(builder.mwsAuthToken) ? null : builder.mwsAuthToken;
      this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
      this.structuredLists = Collections.unmodifiableMap(new LinkedHashMap<>(builder.structuredLists));
   }

   public static Builder builder() {
      return new Builder();
   }

   public HttpVerb getVerb() {
      return verb;
   }

   public String getUriPath() {
      return uriPath;
   }

   public String getHost() {
      return host;
   }

   public String getAccessKeyId() {
      return credentials.getAWSAccessKeyId();
   }

   AWSCredentials getCredentials() {
      return credentials;
   }

   public String getAction() {
      return action;
   }

   public String getSellerId() {
      return sellerId;
   }

   public String getVersion() {
      return version;
   }

   public OffsetDateTime getTimestamp() {
      return timestamp;
   }

   /**
    * @return the delegation token, or {@code null} when none (or an empty one) was supplied
    */
   public String getMwsAuthToken() {
      return mwsAuthToken;
   }

   public String getSignatureMethod() {
      return SIGNATURE_METHOD;
   }

   public int getSignatureVersion() {
      return SIGNATURE_VERSION;
   }

   public Map<String, ParameterValue> getParams() {
      return params;
   }

   public Map<String, StructuredList> getStructuredLists() {
      return structuredLists;
   }

   /**
    * All request parameters except {@code Signature}, flattened to strings. Iteration order is not significant.
    */
   public Map<String, String> normalizedParameters() {
      return Collections.unmodifiableMap(NORMALIZER.normalize(this));
   }

   public String canonical() {
      return ASSEMBLER.canonical(this);
   }

   /**
    * Base64 HMAC-SHA256 of {@link #canonical()}, not percent-encoded.
    */
   public String signature() {
      return ASSEMBLER.sign(this);
   }

   public String buildQuery() {
      return ASSEMBLER.buildQuery(this);
   }

   public String buildQuery(String signature) {
      return ASSEMBLER.buildQuery(this, signature);
   }

   public String requestUri() {
      return ASSEMBLER.requestUri(this);
   }

   public HttpUriRequest toHttpRequest() {
      return ASSEMBLER.toHttpRequest(this);
   }

   @Override
   public String toString() {
      return "MwsQuery{" +
            "verb=" + verb +
            ", host='" + host + '\'' +
            ", uriPath='" + uriPath + '\'' +
            ", action='" + action + '\'' +
            ", sellerId='" + sellerId + '\'' +
            ", version='" + version + '\'' +
            ", timestamp=" + timestamp +
            ", accessKeyId='" + getAccessKeyId() + '\'' +
            ", secretAccessKey='****'" +
            ", mwsAuthToken=" + (mwsAuthToken == null ? "null" : "'****'") +
            ", params=" + params.keySet() +
            ", structuredLists=" + structuredLists.keySet() +
            '}';
   }

   private static boolean isEmpty(String s) {
      return s == null || s.isEmpty();
   }

   public static final class Builder {
      private HttpVerb verb = DEFAULT_VERB;
      private String uriPath = DEFAULT_URI_PATH;
      private String host;
      private AWSCredentials credentials;
      private String action;
      private String sellerId;
      private String version;
      private OffsetDateTime timestamp;
      private String mwsAuthToken;
      private final Map<String, ParameterValue> params = new LinkedHashMap<>();
      private final Map<String, StructuredList> structuredLists = new LinkedHashMap<>();
      private Clock clock = Clock.systemUTC();

      private Builder() {
      }

      public Builder verb(HttpVerb verb) {
         this.verb = verb;
         return this;
      }

      public Builder uriPath(String uriPath) {
         this.uriPath = uriPath;
         return this;
      }

      public Builder host(String host) {
         this.host = host;
         return this;
      }

      public Builder endpoint(MwsEndpoint endpoint) {
         return host(endpoint.getHost());
      }

      /**
       * Sets both the URI path and the version of the given API section.
       */
      public Builder api(MwsApi api) {
         return uriPath(api.getUriPath()).version(api.getVersion());
      }

      public Builder credentials(AWSCredentials credentials) {
         this.credentials = credentials;
         return this;
      }

      /**
       * Resolves the provider once, immediately.
       */
      public Builder credentials(AWSCredentialsProvider credentialsProvider) {
         return credentials(credentialsProvider.getCredentials());
      }

      public Builder credentials(String accessKeyId, String secretAccessKey) {
         if (accessKeyId == null) {
            throw InvalidQueryException.missingCredential("accessKeyId");
         }
         if (secretAccessKey == null) {
            throw InvalidQueryException.missingCredential("secretAccessKey");
         }
         return credentials(new BasicAWSCredentials(accessKeyId, secretAccessKey));
      }

      public Builder action(String action) {
         this.action = action;
         return this;
      }

      public Builder sellerId(String sellerId) {
         this.sellerId = sellerId;
         return this;
      }

      public Builder version(String version) {
         this.version = version;
         return this;
      }

      public Builder timestamp(OffsetDateTime timestamp) {
         this.timestamp = timestamp;
         return this;
      }

      /**
       * @param timestamp ISO-8601 with offset, e.g. {@code 2013-01-01T00:00:00-02:00}; the offset is preserved.
       *                  {@code null} means the current time is used.
       */
      public Builder timestamp(String timestamp) {
         if (timestamp == null) {
            return timestamp((OffsetDateTime) null);
         }
         try {
            return timestamp(OffsetDateTime.parse(timestamp));
         } catch (DateTimeParseException e) {
            throw new InvalidQueryException(InvalidQueryException.Reason.INVALID_PARAMETER, "timestamp",
                  "not an ISO-8601 date-time with offset: " + timestamp, e);
         }
      }

      public Builder mwsAuthToken(String mwsAuthToken) {
         this.mwsAuthToken = mwsAuthToken;
         return this;
      }

      /**
       * Adds an extra parameter. The name is camelized ({@code created_after} becomes {@code CreatedAfter}); a map
       * value is flattened into {@code Name.Child} parameters.
       *
       * @throws InvalidQueryException if the value is of an unsupported type
       */
      public Builder param(String name, Object value) {
         params.put(name, ParameterValue.from(name, value));
         return this;
      }

      public Builder params(Map<String, ?> params) {
         for (Map.Entry<String, ?> entry : params.entrySet()) {
            param(entry.getKey(), entry.getValue());
         }
         return this;
      }

      /**
       * @param key only identifies the list within this query; the emitted names come from the list's label
       */
      public Builder structuredList(String key, StructuredList list) {
         structuredLists.put(key, list);
         return this;
      }

      public Builder structuredList(String key, String label, List<?> values) {
         return structuredList(key, new StructuredList(label, values));
      }

      public Builder structuredList(String key, String label, Object... values) {
         return structuredList(key, StructuredList.of(label, values));
      }

      /**
       * Test hook for the clock used when no timestamp is supplied.
       */
      Builder clock(Clock clock) {
         this.clock = clock;
         return this;
      }

      /**
       * @throws InvalidQueryException naming the first missing or invalid field
       */
      public MwsQuery build() {
         String accessKeyId = credentials == null ? null : credentials.getAWSAccessKeyId();
         String secretAccessKey = credentials == null ? null : credentials.getAWSSecretKey();
         if (isEmpty(accessKeyId)) {
            throw InvalidQueryException.missingCredential("accessKeyId");
         }
         if (isEmpty(secretAccessKey)) {
            throw InvalidQueryException.missingCredential("secretAccessKey");
         }
         if (verb == null) {
            throw InvalidQueryException.missingRequired("verb");
         }
         requireNonEmpty("action", action);
         requireNonEmpty("sellerId", sellerId);
         requireNonEmpty("version", version);
         requireNonEmpty("host", host);
         requireNonEmpty("uriPath", uriPath);
         if (!uriPath.startsWith("/")) {
            throw new InvalidQueryException(InvalidQueryException.Reason.INVALID_URI_PATH, "uriPath",
                  "must start with '/': " + uriPath);
         }
         requireValidPath(uriPath);
         OffsetDateTime time = timestamp != null ? timestamp
               : OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
         // snapshot of the caller's credentials
         MwsQuery query = new MwsQuery(this, new BasicAWSCredentials(accessKeyId, secretAccessKey), time);
         // surfaces duplicate parameter names now rather than on first use
         NORMALIZER.normalize(query);
         return query;
      }

      /**
       * The path must be usable verbatim in a URI: no query or fragment, and already percent-encoded.
       */
      private static void requireValidPath(String path) {
         if (path.indexOf('?') >= 0 || path.indexOf('#') >= 0) {
            throw new InvalidQueryException(InvalidQueryException.Reason.INVALID_URI_PATH, "uriPath",
                  "must not contain a query or fragment: " + path);
         }
         try {
            new URI(path);
         } catch (URISyntaxException e) {
            throw new InvalidQueryException(InvalidQueryException.Reason.INVALID_URI_PATH, "uriPath",
                  "not a valid URI path: " + path, e);
         }
      }

      private static void requireNonEmpty(String field, String value) {
         if (isEmpty(value)) {
            throw InvalidQueryException.missingRequired(field);
         }
      }
   }
}
