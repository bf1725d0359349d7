package scanagram.core.port.in;

import io.smallrye.mutiny.Uni;

import scanagram.core.model.ratelimit.LimiterSnapshot;
import scanagram.core.model.report.ProfileReport;

/**
 * Port for producing profile reports.
 */
public interface ProfileReporting {

    /**
     * Collect a profile and its posts through the profile's request governor
     * and analyze them.
     *
     * <p>The returned Uni fails with a {@code ProfileCollectionException} when
     * the profile itself cannot be fetched.
     *
     * @param username the profile to report on
     * @return Uni with the report
     */
    Uni<ProfileReport> collect(String username);

    /**
     * Current limiter statistics of a profile's governor.
     *
     * @param username the profile
     * @return the snapshot
     */
    LimiterSnapshot limiterStatus(String username);
}
