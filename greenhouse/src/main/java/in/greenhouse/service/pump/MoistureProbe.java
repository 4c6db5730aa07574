package in.greenhouse.service.pump;

import java.util.Optional;

/**
 * Latest known soil moisture, recorded on irrigation events as before/after values.
 */
@FunctionalInterface
public interface MoistureProbe {
    Optional<Double> currentMoisture();

    static MoistureProbe none() {
        return Optional::empty;
    }
}
