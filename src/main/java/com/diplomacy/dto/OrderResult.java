package com.diplomacy.dto;

import com.diplomacy.model.Order;

/**
 * Adjudicated result of one order.
 *
 * @param order     the order as adjudicated (a defaulted hold for units without orders)
 * @param succeeded whether the move succeeded, the support was given, the convoy held
 * @param detail    short explanation, e.g. "bounced", "cut", "dislodged"
 */
public record OrderResult(Order order, boolean succeeded, String detail) {

    public String format() {
        return order.player() + " " + order.toNotation() + (succeeded ? "" : " (" + detail + ")");
    }
}
