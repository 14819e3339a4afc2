package in.mockbroker.infrastructure.sim;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;

/**
 * Random whose nextDouble() values are queued up front, so a test can pin the reject draw,
 * slice fractions and per-slice jitter. An empty queue yields 0.5; nextInt always yields 0,
 * so the slice count is the configured minimum.
 */
public class ScriptedRandom extends Random {

    private final Deque<Double> draws = new ArrayDeque<>();

    public ScriptedRandom draws(double... values) {
        for (double v : values) {
            draws.add(v);
        }
        return this;
    }

    @Override
    public double nextDouble() {
        Double next = draws.poll();
        return next != null ? next : 0.5;
    }

    @Override
    public int nextInt(int bound) {
        return 0;
    }
}
