package com.manheim.mws;

/**
 * Thrown when an {@link MwsQuery} cannot be built or signed from the values supplied by the caller.
 */
public class InvalidQueryException extends IllegalArgumentException {

   public enum Reason {
      MISSING_CREDENTIAL,
      MISSING_REQUIRED,
      INVALID_URI_PATH,
      INVALID_PARAMETER
   }

   private final Reason reason;
   private final String field;

   public InvalidQueryException(Reason reason, String field, String message) {
      super(field + ": " + message);
      this.reason = reason;
      this.field = field;
   }

   public InvalidQueryException(Reason reason, String field, String message, Throwable cause) {
      super(field + ": " + message, cause);
      this.reason = reason;
      this.field = field;
   }

   public Reason getReason() {
      return reason;
   }

   /**
    * @return the name of the offending input, e.g. {@code sellerId} or the extra parameter name
    */
   public String getField() {
      return field;
   }

   static InvalidQueryException missingRequired(String field) {
      return new InvalidQueryException(Reason.MISSING_REQUIRED, field, "is required and must not be empty");
   }

   static InvalidQueryException missingCredential(String field) {
      return new InvalidQueryException(Reason.MISSING_CREDENTIAL, field, "credential must not be empty");
   }
}
