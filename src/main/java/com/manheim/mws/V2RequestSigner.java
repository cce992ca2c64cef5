package com.manheim.mws;

import com.amazonaws.auth.AWSCredentials;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.UnsupportedEncodingException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;

/**
 * Signs queries using the Signature Version 2 scheme with HmacSHA256.
 *
 * @see http://docs.aws.amazon.com/general/latest/gr/signature-version-2.html
 */
class V2RequestSigner implements RequestSigner {
   private static final Log LOG = LogFactory.getLog(V2RequestSigner.class);

   public static final String ENCODING = "UTF8";
   public static final String SIGNATURE_HASHING_ALGORITHM = "HmacSHA256";

   private final CanonicalStringBuilder canonicalStringBuilder;

   V2RequestSigner() {
      this(new CanonicalStringBuilder());
   }

   V2RequestSigner(CanonicalStringBuilder canonicalStringBuilder) {
      this.canonicalStringBuilder = canonicalStringBuilder;
   }

   @Override
   public String sign(MwsQuery query) {
      byte[] key = signingKey(query.getCredentials());
      if (LOG.isDebugEnabled()) {
         LOG.debug("Signing " + query.getAction() + " request for " + query.getHost());
      }
      return createSignature(canonicalStringBuilder.canonical(query), key);
   }

   byte[] signingKey(AWSCredentials credentials) {
      String secretKey = credentials == null ? null : credentials.getAWSSecretKey();
      if (secretKey == null || secretKey.isEmpty()) {
         throw InvalidQueryException.missingCredential("secretAccessKey");
      }
      return getBytes(secretKey);
   }

   /**
    * Base64 with padding and without line breaks.
    */
   String createSignature(String stringToSign, byte[] key) {
      return Base64.encodeBase64String(hmacSHA256(stringToSign, key));
   }

   byte[] getBytes(String key) {
      try {
         return key.getBytes(ENCODING);
      } catch (UnsupportedEncodingException e) {
         // Will never happen with "UTF8" hardcoded.
         throw new RuntimeException(e);
      }
   }

   byte[] hmacSHA256(String data, byte[] key) {
      try {
         Mac mac = Mac.getInstance(SIGNATURE_HASHING_ALGORITHM);
         mac.init(new SecretKeySpec(key, SIGNATURE_HASHING_ALGORITHM));
         return mac.doFinal(getBytes(data));
      } catch (NoSuchAlgorithmException | InvalidKeyException e) {
         throw new RuntimeException(e);
      }
   }
}
