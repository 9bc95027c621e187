package io.github.byzatic.minicron.cron;

/**
 * The five positional fields of a cron expression with their accepted bounds.
 */
public enum CronFieldType {
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23),
    DAY_OF_MONTH("day of month", 1, 31),
    MONTH("month", 1, 12),
    // 0 is Monday
    DAY_OF_WEEK("day of week", 0, 6);

    private final String label;
    private final int min;
    private final int max;

    CronFieldType(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    public String getLabel() {
        return label;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    public boolean inRange(int value) {
        return value >= min && value <= max;
    }
}
