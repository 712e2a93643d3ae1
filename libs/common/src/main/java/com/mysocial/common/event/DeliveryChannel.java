package com.mysocial.common.event;

public enum DeliveryChannel {
  APNS,
  FCM,
  EMAIL
}
