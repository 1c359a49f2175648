package com.storefront.backend.modules.auth.application;

/**
 * Where a session lives: the caller-chosen device id plus what the request told us about the client.
 */
public record DeviceContext(String deviceId, String deviceName, String ip, String userAgent) {
}
