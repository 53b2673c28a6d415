package io.github.eutro.mdsl2ir.ops;

import io.github.eutro.mdsl2ir.ssa.Region;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The key of an operation which holds {@link Region regions}, such as a conditional or a loop.
 * <p>
 * The regions become owned by the effect the operation's instruction is assigned in.
 */
public class RegionOpKey extends OpKey {
    private final int minRegions;
    private final int maxRegions;

    public RegionOpKey(String mnemonic, int minRegions, int maxRegions) {
        super(mnemonic);
        this.minRegions = minRegions;
        this.maxRegions = maxRegions;
    }

    public RegionOpKey(String mnemonic, int regions) {
        this(mnemonic, regions, regions);
    }

    public static final class RegionOp extends Op {
        /**
         * The regions of this operation. The list itself is fixed.
         */
        public final List<Region> regions;

        private RegionOp(RegionOpKey key, List<Region> regions) {
            super(key);
            this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
        }
    }

    public RegionOp create(List<Region> regions) {
        if (regions.size() < minRegions || regions.size() > maxRegions) {
            throw new IllegalArgumentException(mnemonic + " takes "
                    + (minRegions == maxRegions ? minRegions : minRegions + " to " + maxRegions)
                    + " regions, got " + regions.size());
        }
        return new RegionOp(this, regions);
    }

    public RegionOp create(Region... regions) {
        return create(Arrays.asList(regions));
    }

    public @Nullable RegionOp checkNullable(Op val) {
        return val.key == this ? (RegionOp) val : null;
    }

    public boolean check(Op val) {
        return val.key == this;
    }
}
