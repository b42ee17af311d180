package com.diplomacy.model;

/**
 * An order issued by one player for the unit on (or the center at) one part.
 * Orders live for one phase: they are buffered, validated, adjudicated and then dropped.
 */
public sealed interface Order {

    /** Name of the issuing player. */
    String player();

    /** The part the order is attached to. */
    Part part();

    OrderType type();

    /**
     * Order text in log notation, e.g. {@code "LON_C M NTH_C"}.
     */
    String toNotation();

    record Hold(String player, Part part) implements Order {
        @Override
        public OrderType type() {
            return OrderType.HOLD;
        }

        @Override
        public String toNotation() {
            return part.id() + " H";
        }
    }

    /**
     * @param viaConvoy explicitly ordered to travel by convoy
     */
    record Move(String player, Part part, Part destination, boolean viaConvoy) implements Order {
        @Override
        public OrderType type() {
            return OrderType.MOVE;
        }

        @Override
        public String toNotation() {
            return part.id() + (viaConvoy ? " V " : " M ") + destination.id();
        }
    }

    record SupportHold(String player, Part part, Part target) implements Order {
        @Override
        public OrderType type() {
            return OrderType.SUPPORT_HOLD;
        }

        @Override
        public String toNotation() {
            return part.id() + " S " + target.id();
        }
    }

    /**
     * Support for the unit on {@code from} moving to {@code destination}.
     */
    record SupportMove(String player, Part part, Part destination, Part from) implements Order {
        @Override
        public OrderType type() {
            return OrderType.SUPPORT_MOVE;
        }

        @Override
        public String toNotation() {
            return part.id() + " S " + destination.id() + " from " + from.id();
        }
    }

    /**
     * Convoy of the army on {@code from} to {@code destination}.
     */
    record Convoy(String player, Part part, Part destination, Part from) implements Order {
        @Override
        public OrderType type() {
            return OrderType.CONVOY;
        }

        @Override
        public String toNotation() {
            return part.id() + " C " + destination.id() + " from " + from.id();
        }
    }

    record Retreat(String player, Part part, Part destination) implements Order {
        @Override
        public OrderType type() {
            return OrderType.RETREAT;
        }

        @Override
        public String toNotation() {
            return part.id() + " R " + destination.id();
        }
    }

    record Build(String player, Part part) implements Order {
        @Override
        public OrderType type() {
            return OrderType.BUILD;
        }

        @Override
        public String toNotation() {
            return "B " + part.id();
        }
    }

    record Disband(String player, Part part) implements Order {
        @Override
        public OrderType type() {
            return OrderType.DISBAND;
        }

        @Override
        public String toNotation() {
            return "D " + part.id();
        }
    }
}
