package com.manheim.mws;

/**
 * Regional MWS hosts.
 */
public enum MwsEndpoint {
   NORTH_AMERICA("mws.amazonservices.com"),
   EUROPE("mws-eu.amazonservices.com"),
   INDIA("mws.amazonservices.in"),
   CHINA("mws.amazonservices.com.cn"),
   JAPAN("mws.amazonservices.jp"),
   AUSTRALIA("mws.amazonservices.com.au");

   private final String host;

   MwsEndpoint(String host) {
      this.host = host;
   }

   public String getHost() {
      return host;
   }
}
