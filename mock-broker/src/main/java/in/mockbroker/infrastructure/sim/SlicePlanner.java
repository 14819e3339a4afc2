package in.mockbroker.infrastructure.sim;

import in.mockbroker.config.SimulatorConfig;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Splits an order's remaining quantity into execution slices.
 *
 * Slice count is 1 with partial fills off, otherwise uniform in [minSlices, maxSlices].
 * Each non-final slice takes a random fraction of the current leftover, floored to the
 * quantity scale and never below one quantity unit; the final slice takes the exact leftover.
 * Splitting stops early rather than produce an empty final slice, so the slices always sum
 * to the input quantity and every slice is positive.
 */
final class SlicePlanner {

    private final SimulatorConfig config;
    private final Random random;
    private final BigDecimal quantityUnit;

    SlicePlanner(SimulatorConfig config, Random random) {
        this.config = config;
        this.random = random;
        this.quantityUnit = BigDecimal.ONE.movePointLeft(config.quantityScale());
    }

    int drawSliceCount() {
        if (!config.partialFill()) {
            return 1;
        }
        int span = config.maxSlices() - config.minSlices() + 1;
        return config.minSlices() + random.nextInt(span);
    }

    List<BigDecimal> plan(BigDecimal quantity) {
        int slices = drawSliceCount();
        List<BigDecimal> sliceQtys = new ArrayList<>(slices);
        if (slices <= 1) {
            sliceQtys.add(quantity);
            return sliceQtys;
        }

        BigDecimal leftover = quantity;
        for (int i = 0; i < slices - 1; i++) {
            BigDecimal part = leftover.multiply(BigDecimal.valueOf(drawFraction()))
                .setScale(config.quantityScale(), RoundingMode.DOWN)
                .max(quantityUnit);
            if (part.compareTo(leftover) >= 0) {
                break;
            }
            sliceQtys.add(part);
            leftover = leftover.subtract(part);
        }
        sliceQtys.add(leftover);
        return sliceQtys;
    }

    private double drawFraction() {
        double min = config.minSliceFraction();
        double max = config.maxSliceFraction();
        return min + random.nextDouble() * (max - min);
    }
}
