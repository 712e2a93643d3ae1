package com.mysocial.relay.api;

public record ApiErrorResponse(String code, String message) {}
