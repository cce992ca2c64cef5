package com.manheim.mws;

/**
 * HTTP methods accepted by MWS query requests.
 */
public enum HttpVerb {
   GET,
   POST
}
