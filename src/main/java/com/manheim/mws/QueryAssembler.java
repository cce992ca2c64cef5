package com.manheim.mws;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.http.Consts;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;

/**
 * Combines the canonical query and its signature into what gets sent to MWS.
 */
class QueryAssembler {
   private static final Log LOG = LogFactory.getLog(QueryAssembler.class);

   public static final String SCHEME = "https://";
   public static final ContentType FORM_CONTENT_TYPE =
         ContentType.create("application/x-www-form-urlencoded", Consts.UTF_8);

   private final CanonicalStringBuilder canonicalStringBuilder;
   private final RequestSigner requestSigner;

   QueryAssembler() {
      this(new CanonicalStringBuilder());
   }

   private QueryAssembler(CanonicalStringBuilder canonicalStringBuilder) {
      this(canonicalStringBuilder, new V2RequestSigner(canonicalStringBuilder));
   }

   QueryAssembler(CanonicalStringBuilder canonicalStringBuilder, RequestSigner requestSigner) {
      this.canonicalStringBuilder = canonicalStringBuilder;
      this.requestSigner = requestSigner;
   }

   String canonical(MwsQuery query) {
      return canonicalStringBuilder.canonical(query);
   }

   String sign(MwsQuery query) {
      return requestSigner.sign(query);
   }

   String buildQuery(MwsQuery query) {
      return canonicalStringBuilder.queryString(query, null);
   }

   String buildQuery(MwsQuery query, String signature) {
      return canonicalStringBuilder.queryString(query, signature);
   }

   String requestUri(MwsQuery query) {
      return endpointUri(query) + '?' + buildQuery(query, sign(query));
   }

   /**
    * Builds, but does not execute, the request for the query. GET requests carry the signed query in the URI,
    * POST requests carry it as a form encoded body.
    */
   HttpUriRequest toHttpRequest(MwsQuery query) {
      if (LOG.isDebugEnabled()) {
         LOG.debug("Building " + query.getVerb() + " request for " + query.getAction() + " on " + query.getHost());
      }
      switch (query.getVerb()) {
         case POST:
            HttpPost post = new HttpPost(endpointUri(query));
            post.setEntity(new StringEntity(buildQuery(query, sign(query)), FORM_CONTENT_TYPE));
            return post;
         case GET:
         default:
            return new HttpGet(requestUri(query));
      }
   }

   String endpointUri(MwsQuery query) {
      return SCHEME + query.getHost() + query.getUriPath();
   }
}
