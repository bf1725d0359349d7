package scanagram.core.model.report;

/**
 * A value and how often it occurred, as used in frequency rankings.
 */
public record RankedCount(String value, long count) {}
