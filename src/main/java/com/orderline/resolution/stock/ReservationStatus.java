package com.orderline.resolution.stock;

public enum ReservationStatus {
    RESERVED,
    RELEASED,
    SOLD
}
