package scanagram.core.port.out;

/**
 * Port for the randomness used to spread out retry delays.
 *
 * <p>Implementations must be safe for concurrent use.
 */
public interface JitterSource {

    /**
     * Draw a uniformly distributed value from {@code [-ratio, ratio]}.
     *
     * @param ratio half-width of the range, not negative
     * @return the drawn value
     */
    double nextSymmetric(double ratio);
}
