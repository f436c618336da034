package com.promptmenu.order.entity;

public record DeliveryAddress(
        String street,
        String city,
        String state,
        String country,
        String postalCode,
        String instructions
) {
}
