/*
 * Where: Relay delivery model
 * What: Provider credential set for APNs, FCM and Resend
 * Why: Platform rows, the global fallback and the merged result share one typed shape
 */
package com.mysocial.relay.model;

public record DeliveryConfig(
    String apnsKeyId,
    String apnsTeamId,
    String apnsBundleId,
    String apnsKeyPath,
    String apnsKeyContent,
    Boolean apnsProduction,
    String fcmServerKey,
    String resendApiKey,
    String resendFromEmail) {

  public static DeliveryConfig empty() {
    return new DeliveryConfig(null, null, null, null, null, null, null, null, null);
  }

  /** Field-by-field merge: a non-blank value here wins, anything else comes from fallback. */
  public DeliveryConfig orElse(DeliveryConfig fallback) {
    return new DeliveryConfig(
        pick(apnsKeyId, fallback.apnsKeyId),
        pick(apnsTeamId, fallback.apnsTeamId),
        pick(apnsBundleId, fallback.apnsBundleId),
        pick(apnsKeyPath, fallback.apnsKeyPath),
        pick(apnsKeyContent, fallback.apnsKeyContent),
        apnsProduction != null ? apnsProduction : fallback.apnsProduction,
        pick(fcmServerKey, fallback.fcmServerKey),
        pick(resendApiKey, fallback.resendApiKey),
        pick(resendFromEmail, fallback.resendFromEmail));
  }

  public boolean hasApns() {
    return present(apnsKeyId)
        && present(apnsTeamId)
        && present(apnsBundleId)
        && (present(apnsKeyContent) || present(apnsKeyPath));
  }

  public boolean hasFcm() {
    return present(fcmServerKey);
  }

  public boolean hasResend() {
    return present(resendApiKey) && present(resendFromEmail);
  }

  public boolean isApnsProduction() {
    return Boolean.TRUE.equals(apnsProduction);
  }

  @Override
  public String toString() {
    // credentials stay out of logs
    return "DeliveryConfig[apns=" + hasApns() + ", fcm=" + hasFcm() + ", resend=" + hasResend()
        + "]";
  }

  private static String pick(String preferred, String fallback) {
    return present(preferred) ? preferred : fallback;
  }

  private static boolean present(String value) {
    return value != null && !value.isBlank();
  }
}
