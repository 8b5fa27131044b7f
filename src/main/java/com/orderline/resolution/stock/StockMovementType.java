package com.orderline.resolution.stock;

public enum StockMovementType {
    FINISHED_RESERVE,
    FINISHED_RELEASE,
    FINISHED_SELL
}
