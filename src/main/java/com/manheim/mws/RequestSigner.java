package com.manheim.mws;

/**
 * Utility for signing queries made to MWS.
 */
public interface RequestSigner {

   /**
    * Signs the canonical form of the query with the secret key it carries. The returned signature is not
    * percent-encoded; the specific algorithm is determined by implementations of this interface.
    *
    * @throws InvalidQueryException if the query carries no secret key
    */
   String sign(MwsQuery query);
}
