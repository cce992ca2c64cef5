package com.manheim.mws;

import com.amazonaws.auth.AWSCredentials;
import org.junit.Before;
import org.junit.Test;

import java.util.regex.Pattern;

import static com.manheim.mws.QueryFixtures.*;
import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

/**
 * Test the V2 signing process against signatures accepted by MWS.
 */
public class V2RequestSignerTest {
   private V2RequestSigner testObject;

   @Before
   public final void before() {
      testObject = new V2RequestSigner();
   }

   @Test
   public final void createsSignature() {
      String stringToSign = "GET\nmws-eu.amazonservices.com\n/\n" + QUERY;
      assertEquals(SIGNATURE, testObject.createSignature(stringToSign, testObject.getBytes(AWS_SECRET_KEY)));
   }

   @Test
   public final void signsQuery() {
      assertEquals(SIGNATURE, testObject.sign(listOrders().build()));
   }

   @Test
   public final void signsQueryWithAuthToken() {
      assertEquals(SIGNATURE_WITH_AUTH_TOKEN, testObject.sign(listOrders().mwsAuthToken(AUTH_TOKEN).build()));
   }

   @Test
   public final void signatureIsPaddedBase64OnOneLine() {
      MwsQuery query = listOrders()
            .param("custom_param", "a value long enough to make no difference to the digest length")
            .build();
      String signature = testObject.sign(query);

      Pattern expectedFormat = Pattern.compile("[A-Za-z0-9+/]{43}=");
      assertTrue(signature, expectedFormat.matcher(signature).matches());
   }

   @Test
   public final void signatureIsDeterministic() {
      MwsQuery query = listOrders().mwsAuthToken(AUTH_TOKEN).build();
      assertEquals(testObject.sign(query), testObject.sign(query));
      assertEquals(testObject.sign(query), new V2RequestSigner().sign(listOrders().mwsAuthToken(AUTH_TOKEN).build()));
   }

   @Test
   public final void signatureDependsOnSecret() {
      MwsQuery other = listOrders().credentials(AWS_ACCESS_KEY_ID, "another secret").build();
      assertNotEquals(SIGNATURE, testObject.sign(other));
   }

   @Test
   public final void signsCanonicalString() {
      CanonicalStringBuilder canonicalStringBuilder = spy(new CanonicalStringBuilder());
      MwsQuery query = listOrders().build();

      new V2RequestSigner(canonicalStringBuilder).sign(query);

      verify(canonicalStringBuilder).canonical(query);
   }

   @Test
   public final void refusesToSignWithoutSecret() {
      AWSCredentials credentials = mock(AWSCredentials.class);
      when(credentials.getAWSAccessKeyId()).thenReturn(AWS_ACCESS_KEY_ID);
      when(credentials.getAWSSecretKey()).thenReturn(null);

      assertMissingSecret(credentials);
      assertMissingSecret(null);
   }

   @Test
   public final void signsWithSecretCapturedAtBuild() {
      AWSCredentials credentials = mock(AWSCredentials.class);
      when(credentials.getAWSAccessKeyId()).thenReturn(AWS_ACCESS_KEY_ID);
      when(credentials.getAWSSecretKey()).thenReturn(AWS_SECRET_KEY, "rotated secret");
      MwsQuery query = listOrders().credentials(credentials).build();

      assertEquals(SIGNATURE, testObject.sign(query));
      assertEquals(SIGNATURE, testObject.sign(query));
      verify(credentials, times(1)).getAWSSecretKey();
   }

   @Test
   public final void getBytesIsUtf8() {
      assertArrayEquals(new byte[] { 'k', (byte) 0xC3, (byte) 0xA9 }, testObject.getBytes("k\u00e9"));
   }

   private void assertMissingSecret(AWSCredentials credentials) {
      try {
         testObject.signingKey(credentials);
         fail("expected a missing credential");
      } catch (InvalidQueryException e) {
         assertEquals(InvalidQueryException.Reason.MISSING_CREDENTIAL, e.getReason());
         assertEquals("secretAccessKey", e.getField());
      }
   }
}
