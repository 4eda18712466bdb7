package com.sandy.aiot.warning.vo;

public record DeliveryResult(boolean success, String detail) {

    public static DeliveryResult ok() {
        return new DeliveryResult(true, null);
    }

    public static DeliveryResult fail(String detail) {
        return new DeliveryResult(false, detail);
    }
}
