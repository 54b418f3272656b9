package com.jobkeeper.model;

/** A labelled count with its share of the total, in percent. */
public class DistributionEntry {
    private final String label;
    private final long count;
    private final double percentage;

    public DistributionEntry(String label, long count, double percentage) {
        this.label = label;
        this.count = count;
        this.percentage = percentage;
    }

    public String getLabel() { return label; }
    public long getCount() { return count; }
    public double getPercentage() { return percentage; }

    @Override
    public String toString() {
        return label + "=" + count + " (" + percentage + "%)";
    }
}
