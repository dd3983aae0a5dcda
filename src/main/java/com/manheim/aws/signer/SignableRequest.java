package com.manheim.aws.signer;

import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.TimeZone;

/**
 * A canonical request together with the time and scope it is signed for.
 */
public final class SignableRequest {
   public static final String ISO_8601_TIME_FORMAT = "yyyyMMdd'T'HHmmss'Z'";

   private final String dateStamp;
   private final String timeStamp;
   private final String region;
   private final String service;
   private final CanonicalRequest canonicalRequest;

   /**
    * @param dateStamp {@code yyyyMMdd}
    * @param timeStamp {@code HHmmss'Z'}, UTC
    */
   public SignableRequest(String dateStamp, String timeStamp, String region, String service,
         CanonicalRequest canonicalRequest) {
      this.dateStamp = dateStamp;
      this.timeStamp = timeStamp;
      this.region = region;
      this.service = service;
      this.canonicalRequest = canonicalRequest;
   }

   /**
    * Formats a date the way the {@code x-amz-date} header expects it, at second precision in UTC.
    */
   public static String isoTimestamp(Date date) {
      DateFormat dateFormat = new SimpleDateFormat(ISO_8601_TIME_FORMAT);
      dateFormat.setTimeZone(TimeZone.getTimeZone("GMT"));
      return dateFormat.format(date);
   }

   /**
    * Splits an {@code x-amz-date} value into its date and time parts.
    */
   public static SignableRequest forTimestamp(String isoTimestamp, String region, String service,
         CanonicalRequest canonicalRequest) {
      if (isoTimestamp.length() != 16 || isoTimestamp.charAt(8) != 'T') {
         throw new IllegalArgumentException("Not an ISO 8601 basic timestamp: " + isoTimestamp);
      }
      return new SignableRequest(isoTimestamp.substring(0, 8), isoTimestamp.substring(9), region, service,
            canonicalRequest);
   }

   public String getDateStamp() {
      return dateStamp;
   }

   public String getTimeStamp() {
      return timeStamp;
   }

   public String getRegion() {
      return region;
   }

   public String getService() {
      return service;
   }

   public CanonicalRequest getCanonicalRequest() {
      return canonicalRequest;
   }

   public String isoTimestamp() {
      return dateStamp + 'T' + timeStamp;
   }

   /**
    * {@code date/region/service/aws4_request}
    */
   public String credentialScope() {
      return credentialScope(dateStamp, region, service);
   }

   static String credentialScope(String dateStamp, String region, String service) {
      return dateStamp + '/' + region + '/' + service + '/' + SigningKeyDeriver.TERMINATOR;
   }
}
