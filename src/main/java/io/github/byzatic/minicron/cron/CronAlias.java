package io.github.byzatic.minicron.cron;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named shorthands expanded to a canonical 5-field expression before tokenizing.
 */
public enum CronAlias {
    MIDNIGHT("@midnight", "0 0 * * *"),
    YEARLY("@yearly", "0 0 1 1 *"),
    ANNUALLY("@annually", "0 0 1 1 *"),
    MONTHLY("@monthly", "0 0 1 * *"),
    WEEKLY("@weekly", "0 0 * * 0"),
    DAILY("@daily", "0 0 * * *"),
    HOURLY("@hourly", "0 * * * *"),
    MINUTELY("@minutely", "* * * * *"),
    // reserved, no expansion
    BOOT("@boot", null),
    WAKEUP("@wakeup", null);

    private static final ImmutableMap<String, CronAlias> BY_NAME =
            Maps.uniqueIndex(Arrays.asList(values()), CronAlias::getName);

    private final String name;
    private final String expansion;

    CronAlias(String name, String expansion) {
        this.name = name;
        this.expansion = expansion;
    }

    public @NotNull String getName() {
        return name;
    }

    public @Nullable String getExpansion() {
        return expansion;
    }

    public boolean isSupported() {
        return expansion != null;
    }

    /**
     * Exact, case-sensitive lookup by alias name (e.g. {@code "@daily"}).
     */
    public static @NotNull Optional<CronAlias> lookup(@Nullable String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
