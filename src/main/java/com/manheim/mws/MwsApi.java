package com.manheim.mws;

/**
 * MWS API sections. Each section is served under its own path and pinned to an API version.
 */
public enum MwsApi {
   ORDERS("/Orders/2013-09-01", "2013-09-01"),
   REPORTS("/", "2009-01-01"),
   FEEDS("/", "2009-01-01"),
   PRODUCTS("/Products/2011-10-01", "2011-10-01"),
   SELLERS("/Sellers/2011-07-01", "2011-07-01"),
   FULFILLMENT_INVENTORY("/FulfillmentInventory/2010-10-01", "2010-10-01");

   private final String uriPath;
   private final String version;

   MwsApi(String uriPath, String version) {
      this.uriPath = uriPath;
      this.version = version;
   }

   public String getUriPath() {
      return uriPath;
   }

   public String getVersion() {
      return version;
   }
}
