package wattsched.scheduler.energy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the platform's consumed energy from backend answers and derives the average
 * power between two answers.
 */
public class EnergyMonitor {

    private static final Logger log = LoggerFactory.getLogger(EnergyMonitor.class);

    private final boolean enabled;

    private double lastTime = Double.NaN;
    private double consumedEnergy = 0;
    private double power = 0;
    private int answers = 0;

    public EnergyMonitor(boolean enabled) {
        this.enabled = enabled;
    }

    /** Whether the scheduler should query consumed energy on callbacks */
    public boolean enabled() {
        return enabled;
    }

    /**
     * Record a consumed-energy answer. The first answer only sets the baseline.
     */
    public void onAnswer(double timestamp, double energy) {
        if (!Double.isNaN(lastTime)) {
            double dt = timestamp - lastTime;
            if (dt > 0) {
                power = (energy - consumedEnergy) / dt;
            }
        }
        lastTime = timestamp;
        consumedEnergy = energy;
        answers++;
        log.debug("Consumed energy {} J at {}, power {} W", energy, timestamp, power);
    }

    /** Joules consumed up to the last answer */
    public double consumedEnergy() {
        return consumedEnergy;
    }

    /** Average watts between the last two answers, 0 before the second one */
    public double power() {
        return power;
    }

    public int answers() {
        return answers;
    }
}
