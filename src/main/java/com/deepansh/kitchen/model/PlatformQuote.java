package com.deepansh.kitchen.model;

/**
 * Basket total and delivery estimate on one grocery platform.
 */
public record PlatformQuote(String platform, double total, String deliveryTime) {
}
