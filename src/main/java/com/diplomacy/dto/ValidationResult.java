package com.diplomacy.dto;

import com.diplomacy.model.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Orders split into those that passed validation and those that were rejected.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ValidationResult {

    @Builder.Default
    private List<Order> accepted = new ArrayList<>();

    @Builder.Default
    private List<RejectedOrder> rejected = new ArrayList<>();

    public void accept(Order order) {
        accepted.add(order);
    }

    public void reject(Order order, String reason) {
        rejected.add(new RejectedOrder(order, reason));
    }
}
