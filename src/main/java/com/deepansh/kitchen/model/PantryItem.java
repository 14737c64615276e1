package com.deepansh.kitchen.model;

public record PantryItem(String name, double quantity, String unit) {
}
