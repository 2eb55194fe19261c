package io.mergekit.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered stack of precedence tiers, resolved into a single tree.
 * <p>
 * Resolution:
 *  1) Inside a tier, layers are combined in insertion order with
 *     {@link DeepMerge#horizontalMerge} (or {@link DeepMerge#roleMerge} for a
 *     role tier), each later layer being the overlay.
 *  2) Tiers are folded from lowest to highest precedence with
 *     {@link DeepMerge#merge}, the higher tier being the overlay.
 * <p>
 * Layers are never modified.
 */
public final class PrecedenceStack {
    private static final Logger log = Logger.getLogger(PrecedenceStack.class.getName());

    public enum TierKind { HORIZONTAL, ROLE }

    public record Tier(String name, TierKind kind, List<Value> layers) {
        public Tier {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(kind, "kind");
            if (name.isBlank()) throw new IllegalArgumentException("tier name must not be blank");
            layers = List.copyOf(layers);
        }
    }

    private final List<Tier> tiers;

    private PrecedenceStack(List<Tier> tiers) {
        this.tiers = List.copyOf(tiers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Tiers from lowest to highest precedence. */
    public List<Tier> tiers() { return tiers; }

    public Value resolve(DeepMerge merger) {
        Objects.requireNonNull(merger, "merger");
        Value result = new Value.Mapping();
        for (Tier tier : tiers) {
            Value combined = combine(tier, merger);
            log.log(Level.FINE, () -> "resolving tier " + tier.name() + " (" + tier.layers().size() + " layers)");
            result = merger.merge(combined, result);
        }
        return result;
    }

    private static Value combine(Tier tier, DeepMerge merger) {
        Value acc = new Value.Mapping();
        for (Value layer : tier.layers()) {
            acc = tier.kind() == TierKind.ROLE
                    ? merger.roleMerge(layer, acc)
                    : merger.horizontalMerge(layer, acc);
        }
        return acc;
    }

    public static final class Builder {
        private final Map<String, TierKind> kinds = new LinkedHashMap<>();
        private final Map<String, List<Value>> layers = new LinkedHashMap<>();

        private Builder() {
        }

        /** Declare the next tier, above every tier declared so far. */
        public Builder tier(String name) {
            return declare(name, TierKind.HORIZONTAL);
        }

        /** Declare the next tier as a role chain (knockout directives apply). */
        public Builder roleTier(String name) {
            return declare(name, TierKind.ROLE);
        }

        /** Add a layer on top of the named tier. */
        public Builder layer(String tierName, Value layer) {
            var list = layers.get(tierName);
            if (list == null) throw new IllegalArgumentException("unknown tier: " + tierName);
            list.add(Objects.requireNonNull(layer, "layer"));
            return this;
        }

        public PrecedenceStack build() {
            var out = new ArrayList<Tier>(kinds.size());
            kinds.forEach((name, kind) -> out.add(new Tier(name, kind, layers.get(name))));
            return new PrecedenceStack(out);
        }

        private Builder declare(String name, TierKind kind) {
            Objects.requireNonNull(name, "name");
            if (kinds.containsKey(name)) throw new IllegalArgumentException("duplicate tier: " + name);
            kinds.put(name, kind);
            layers.put(name, new ArrayList<>());
            return this;
        }
    }
}
