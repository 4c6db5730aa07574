package in.greenhouse.infrastructure.store;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Generates 20-character child keys that sort in creation order.
 *
 * The first 8 characters encode the creation millisecond; the remaining 12 are random
 * and are incremented instead of re-randomized when two keys share a millisecond.
 */
public final class PushKeyGenerator {

    private static final String ALPHABET =
        "-0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ_abcdefghijklmnopqrstuvwxyz";

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final int[] lastRandom = new int[12];
    private long lastMillis = -1;

    public PushKeyGenerator() {
        this(Clock.systemUTC());
    }

    public PushKeyGenerator(Clock clock) {
        this.clock = clock;
    }

    public synchronized String next() {
        long now = clock.millis();
        boolean sameMillis = now <= lastMillis;
        if (sameMillis) {
            now = lastMillis;
        }
        lastMillis = now;

        char[] time = new char[8];
        long t = now;
        for (int i = 7; i >= 0; i--) {
            time[i] = ALPHABET.charAt((int) (t % 64));
            t /= 64;
        }

        if (!sameMillis) {
            for (int i = 0; i < 12; i++) {
                lastRandom[i] = random.nextInt(64);
            }
        } else {
            int i = 11;
            while (i >= 0 && lastRandom[i] == 63) {
                lastRandom[i] = 0;
                i--;
            }
            if (i >= 0) {
                lastRandom[i]++;
            }
        }

        StringBuilder key = new StringBuilder(20).append(time);
        for (int r : lastRandom) {
            key.append(ALPHABET.charAt(r));
        }
        return key.toString();
    }
}
