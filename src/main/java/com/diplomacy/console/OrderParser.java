package com.diplomacy.console;

import com.diplomacy.model.MapGraph;
import com.diplomacy.model.Order;
import com.diplomacy.model.Part;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Parses the fixed order grammar that follows {@code --order <player>}:
 * <pre>
 *   H|B|D &lt;part&gt;
 *   &lt;part&gt; H
 *   &lt;part&gt; M|V|R [to] &lt;dest&gt;
 *   &lt;part&gt; S [to] &lt;target&gt; [from &lt;from&gt;]
 *   &lt;part&gt; C [to] &lt;dest&gt; from &lt;from&gt;
 * </pre>
 */
@Component
public class OrderParser {

    /**
     * @throws IllegalArgumentException on malformed orders or unknown parts
     */
    public Order parse(MapGraph map, String player, List<String> tokens) {
        if (tokens.size() < 2) {
            throw new IllegalArgumentException("Incomplete order: " + String.join(" ", tokens));
        }
        String first = tokens.get(0);
        if (tokens.size() == 2 && isVerb(first, "H", "B", "D")) {
            Part part = map.part(tokens.get(1));
            return switch (first.toUpperCase()) {
                case "H" -> new Order.Hold(player, part);
                case "B" -> new Order.Build(player, part);
                default -> new Order.Disband(player, part);
            };
        }

        Part part = map.part(first);
        String verb = tokens.get(1).toUpperCase();
        List<String> rest = dropTo(tokens.subList(2, tokens.size()));
        switch (verb) {
            case "H":
                expectSize(rest, 0, tokens);
                return new Order.Hold(player, part);
            case "M":
            case "V":
                expectSize(rest, 1, tokens);
                return new Order.Move(player, part, map.part(rest.get(0)), verb.equals("V"));
            case "R":
                expectSize(rest, 1, tokens);
                return new Order.Retreat(player, part, map.part(rest.get(0)));
            case "S":
                if (rest.size() == 1) {
                    return new Order.SupportHold(player, part, map.part(rest.get(0)));
                }
                expectFrom(rest, tokens);
                return new Order.SupportMove(player, part, map.part(rest.get(0)), map.part(rest.get(2)));
            case "C":
                expectFrom(rest, tokens);
                return new Order.Convoy(player, part, map.part(rest.get(0)), map.part(rest.get(2)));
            default:
                throw new IllegalArgumentException("Unknown order type: " + tokens.get(1));
        }
    }

    private boolean isVerb(String token, String... verbs) {
        for (String verb : verbs) {
            if (verb.equalsIgnoreCase(token)) {
                return true;
            }
        }
        return false;
    }

    private List<String> dropTo(List<String> tokens) {
        if (!tokens.isEmpty() && tokens.get(0).equalsIgnoreCase("to")) {
            return tokens.subList(1, tokens.size());
        }
        return tokens;
    }

    private void expectSize(List<String> rest, int size, List<String> tokens) {
        if (rest.size() != size) {
            throw new IllegalArgumentException("Malformed order: " + String.join(" ", tokens));
        }
    }

    private void expectFrom(List<String> rest, List<String> tokens) {
        if (rest.size() != 3 || !rest.get(1).equalsIgnoreCase("from")) {
            throw new IllegalArgumentException("Malformed order, expected '<dest> from <part>': " + String.join(" ", tokens));
        }
    }
}
