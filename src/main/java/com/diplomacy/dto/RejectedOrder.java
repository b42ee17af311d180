package com.diplomacy.dto;

import com.diplomacy.model.Order;

/**
 * An order that failed validation, with the reason reported back to its player.
 * The unit it was attached to falls back to its phase default.
 */
public record RejectedOrder(Order order, String reason) {

    public String format() {
        return "Rejected " + order.player() + " " + order.toNotation() + ": " + reason;
    }
}
